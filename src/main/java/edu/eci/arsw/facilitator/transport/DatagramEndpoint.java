package edu.eci.arsw.facilitator.transport;

import java.net.InetSocketAddress;

/**
 * Puerto mínimo de un transporte de datagramas.
 *
 * Las implementaciones pueden ser un {@code DatagramChannel} real o una red en
 * memoria para pruebas.
 */
public interface DatagramEndpoint {

    /**
     * Empieza a recibir datagramas. Debe llamarse después de
     * {@link #setListener(DatagramEndpointListener)}.
     */
    void start();

    /**
     * Deja de recibir y libera el socket.
     */
    void stop();

    /**
     * Envía un datagrama al destino indicado.
     *
     * @param remote  destino
     * @param payload bytes a enviar
     */
    void send(InetSocketAddress remote, byte[] payload);

    void setListener(DatagramEndpointListener listener);

    /**
     * Dirección local efectivamente ligada.
     *
     * @return dirección local
     */
    InetSocketAddress localAddress();
}
