package edu.eci.arsw.facilitator.exception;

/**
 * Token inválido, duplicado o contraseña de sala incorrecta. El servidor no reintenta.
 */
public class AuthenticationException extends FacilitatorException {
    public AuthenticationException(String message) {
        super(ErrorCode.AUTH_ERROR, message);
    }
}
