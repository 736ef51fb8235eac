package edu.eci.arsw.facilitator.exception;

/**
 * La sesión ya pertenece a una sala; debe salir antes de unirse a otra.
 */
public class AlreadyMemberException extends FacilitatorException {
    public AlreadyMemberException(String message) {
        super(ErrorCode.ALREADY_MEMBER, message);
    }
}
