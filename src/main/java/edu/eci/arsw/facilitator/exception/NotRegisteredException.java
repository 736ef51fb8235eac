package edu.eci.arsw.facilitator.exception;

/**
 * El remitente no tiene una sesión registrada.
 */
public class NotRegisteredException extends FacilitatorException {
    public NotRegisteredException(String message) {
        super(ErrorCode.NOT_REGISTERED, message);
    }
}
