package edu.eci.arsw.facilitator.session;

public enum CloseReason {
    /** El cliente pidió salir. */
    UNREGISTERED,
    /** Superó el tiempo de vida sin actividad. */
    EXPIRED,
    /** El transporte agotó los reintentos hacia su endpoint. */
    UNREACHABLE,
    /** Un registro nuevo desde el mismo endpoint reemplazó la sesión. */
    REPLACED
}
