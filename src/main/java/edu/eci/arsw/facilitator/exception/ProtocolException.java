package edu.eci.arsw.facilitator.exception;

/**
 * Mensaje de protocolo mal formado o incompleto.
 */
public class ProtocolException extends FacilitatorException {
    public ProtocolException(String message) {
        super(ErrorCode.PROTOCOL_ERROR, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorCode.PROTOCOL_ERROR, message, cause);
    }
}
