package edu.eci.arsw.facilitator.transport;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Envío y recepción de datagramas con los tres modos de entrega.
 */
public interface Transport {

    void send(InetSocketAddress to, byte[] payload, DeliveryMode mode);

    void setListener(TransportListener listener);

    /**
     * Última vez que se recibió algo del endpoint.
     *
     * @param peer endpoint remoto
     * @return instante de la última recepción, si hubo alguna
     */
    Optional<Instant> lastReceived(InetSocketAddress peer);

    /**
     * Descarta el estado del par y cancela sus retransmisiones pendientes.
     *
     * @param peer endpoint remoto
     */
    void forget(InetSocketAddress peer);

    /**
     * Endpoints remotos con estado en el transporte.
     *
     * @return copia del conjunto de pares conocidos
     */
    Set<InetSocketAddress> knownPeers();

    void start();

    void stop();
}
