package edu.eci.arsw.facilitator.exception;

/**
 * Excepción base del Facilitator. Cada subclase lleva el código con el que se
 * informa al cliente.
 */
public abstract class FacilitatorException extends RuntimeException {

    private final ErrorCode code;

    protected FacilitatorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected FacilitatorException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
