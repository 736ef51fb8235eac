package edu.eci.arsw.facilitator.exception;

/**
 * Ya existe una sala viva con ese nombre.
 */
public class RoomNameTakenException extends FacilitatorException {
    public RoomNameTakenException(String message) {
        super(ErrorCode.ROOM_NAME_TAKEN, message);
    }
}
