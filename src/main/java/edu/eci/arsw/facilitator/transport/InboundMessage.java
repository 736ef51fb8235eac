package edu.eci.arsw.facilitator.transport;

import java.net.InetSocketAddress;

/**
 * Mensaje entregado por el transporte.
 *
 * @param sender  endpoint de origen tal como se observó
 * @param payload carga útil
 * @param mode    modo con el que el emisor lo envió
 */
public record InboundMessage(InetSocketAddress sender, byte[] payload, DeliveryMode mode) {
}
