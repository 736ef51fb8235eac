package edu.eci.arsw.facilitator.domain;

/**
 * Clasificación de un endpoint candidato.
 */
public enum EndpointKind {
    /** Dirección de la red local declarada por el cliente. */
    LOCAL,
    /** Dirección pública observada por el servidor (reflexión NAT). */
    PUBLIC,
    /** Dirección del propio Facilitator cuando retransmite. */
    RELAY
}
