package edu.eci.arsw.facilitator.room;

import edu.eci.arsw.facilitator.domain.Room;

/**
 * Se publica dentro del candado del directorio, después de quitar al miembro.
 *
 * @param room         sala sin el miembro
 * @param sessionId    sesión que salió
 * @param previousHost anfitrión antes de la salida
 */
public record MemberLeftEvent(Room room, String sessionId, String previousHost) {

    public boolean hostChanged() {
        return room.hostSessionId() != null && !room.hostSessionId().equals(previousHost);
    }
}
