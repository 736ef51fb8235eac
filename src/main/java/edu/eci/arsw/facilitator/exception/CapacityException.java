package edu.eci.arsw.facilitator.exception;

/**
 * Se agotó un recurso global del servidor (sesiones, salas o enlaces retransmitidos). El cliente debe reintentar más tarde.
 */
public class CapacityException extends FacilitatorException {
    public CapacityException(String message) {
        super(ErrorCode.CAPACITY_ERROR, message);
    }
}
