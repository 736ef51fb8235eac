package edu.eci.arsw.facilitator.exception;

/**
 * La sala alcanzó su capacidad.
 */
public class RoomFullException extends FacilitatorException {
    public RoomFullException(String message) {
        super(ErrorCode.ROOM_FULL, message);
    }
}
