package edu.eci.arsw.facilitator.transport;

import java.net.InetSocketAddress;

/**
 * Consumidor de los eventos del transporte. La secuencia de mensajes no tiene
 * fin y se reinicia cuando el par abre una nueva conexión.
 */
public interface TransportListener {

    void onMessage(InboundMessage message);

    /**
     * El par agotó los reintentos de una trama fiable.
     *
     * @param peer endpoint del par
     */
    default void onPeerUnreachable(InetSocketAddress peer) {
    }
}
