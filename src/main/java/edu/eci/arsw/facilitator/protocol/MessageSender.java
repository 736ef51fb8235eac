package edu.eci.arsw.facilitator.protocol;

import edu.eci.arsw.facilitator.transport.DeliveryMode;

/**
 * Envía mensajes de control a una sesión registrada por su endpoint de control.
 * Enviar a una sesión que ya no existe no hace nada.
 */
public interface MessageSender {

    void send(String sessionId, ProtocolMessage message, DeliveryMode mode);

    default void send(String sessionId, ProtocolMessage message) {
        send(sessionId, message, DeliveryMode.RELIABLE_ORDERED);
    }
}
