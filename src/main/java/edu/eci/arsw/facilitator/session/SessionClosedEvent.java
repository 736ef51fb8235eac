package edu.eci.arsw.facilitator.session;

import edu.eci.arsw.facilitator.domain.Session;

/**
 * Se publica cuando una sesión sale del registro, fuera del candado del registro.
 *
 * @param session última instantánea de la sesión, ya en estado DISCONNECTED
 * @param reason  motivo del cierre
 */
public record SessionClosedEvent(Session session, CloseReason reason) {
}
