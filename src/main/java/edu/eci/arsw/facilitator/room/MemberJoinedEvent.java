package edu.eci.arsw.facilitator.room;

import edu.eci.arsw.facilitator.domain.Room;

/**
 * Se publica dentro del candado del directorio, después de añadir al miembro.
 *
 * @param room      sala con el nuevo miembro ya incluido
 * @param sessionId sesión que se unió
 */
public record MemberJoinedEvent(Room room, String sessionId) {

    public boolean isHost() {
        return sessionId.equals(room.hostSessionId());
    }
}
