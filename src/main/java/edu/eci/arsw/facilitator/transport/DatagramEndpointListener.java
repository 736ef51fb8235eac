package edu.eci.arsw.facilitator.transport;

import java.net.InetSocketAddress;

/**
 * Recibe los datagramas crudos de un {@link DatagramEndpoint}.
 */
@FunctionalInterface
public interface DatagramEndpointListener {
    void onDatagram(InetSocketAddress remote, byte[] data);
}
