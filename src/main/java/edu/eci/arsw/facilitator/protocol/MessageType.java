package edu.eci.arsw.facilitator.protocol;

import edu.eci.arsw.facilitator.exception.ErrorCode;

/**
 * Tipos de mensaje del protocolo de control.
 */
public enum MessageType {
    // registro
    REGISTER,
    REGISTER_ACK,
    UNREGISTER,
    UNREGISTERED,
    HEARTBEAT,
    // salas
    CREATE_ROOM,
    ROOM_CREATED,
    JOIN_ROOM,
    ROOM_JOINED,
    LEAVE_ROOM,
    ROOM_LEFT,
    LIST_ROOMS,
    ROOM_LIST,
    PEER_JOINED,
    PEER_LEFT,
    HOST_CHANGED,
    // rendezvous
    CANDIDATE_EXCHANGE,
    PUNCH_PROBE,
    PUNCH_ACK,
    PUNCH_REPORT,
    DIRECT_ESTABLISHED,
    RELAY_ESTABLISHED,
    RELAY_DATA,
    LINK_FAILED,
    RETRY_LINK,
    PEER_DATA,
    // errores
    AUTH_ERROR,
    CAPACITY_ERROR,
    ROOM_FULL,
    ROOM_NOT_FOUND,
    ALREADY_MEMBER,
    ERROR;

    /**
     * Tipo de respuesta con el que se comunica un código de error.
     *
     * @param code código de error
     * @return tipo de mensaje
     */
    public static MessageType forError(ErrorCode code) {
        return switch (code) {
            case AUTH_ERROR -> AUTH_ERROR;
            case CAPACITY_ERROR -> CAPACITY_ERROR;
            case ROOM_FULL -> ROOM_FULL;
            case ROOM_NOT_FOUND -> ROOM_NOT_FOUND;
            case ALREADY_MEMBER -> ALREADY_MEMBER;
            default -> ERROR;
        };
    }

    public boolean isError() {
        return this == AUTH_ERROR || this == CAPACITY_ERROR || this == ROOM_FULL
                || this == ROOM_NOT_FOUND || this == ALREADY_MEMBER || this == ERROR;
    }
}
