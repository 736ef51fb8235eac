package edu.eci.arsw.facilitator.exception;

/**
 * No existe una sala con el id o criterio pedido.
 */
public class RoomNotFoundException extends FacilitatorException {
    public RoomNotFoundException(String message) {
        super(ErrorCode.ROOM_NOT_FOUND, message);
    }
}
