package edu.eci.arsw.facilitator.exception;

/**
 * Códigos de error que viajan al cliente en las respuestas de error.
 */
public enum ErrorCode {
    AUTH_ERROR,
    ROOM_FULL,
    ROOM_NOT_FOUND,
    ALREADY_MEMBER,
    ROOM_NAME_TAKEN,
    CAPACITY_ERROR,
    NOT_REGISTERED,
    PROTOCOL_ERROR,
    INTERNAL_ERROR
}
