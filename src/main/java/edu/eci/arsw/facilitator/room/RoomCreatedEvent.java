package edu.eci.arsw.facilitator.room;

import edu.eci.arsw.facilitator.domain.Room;

/**
 * @param room             sala recién creada
 * @param creatorSessionId sesión que la pidió, o null si se creó sin creador
 */
public record RoomCreatedEvent(Room room, String creatorSessionId) {
}
