package edu.eci.arsw.facilitator.domain;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Endpoint candidato de una sesión. Inmutable una vez observado.
 *
 * @param address   dirección IP literal
 * @param port      puerto
 * @param transport tipo de transporte
 * @param kind      clasificación
 */
public record Endpoint(String address, int port, TransportKind transport, EndpointKind kind) {

    public Endpoint {
        Objects.requireNonNull(address, "address");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Puerto fuera de rango: " + port);
        }
        transport = transport == null ? TransportKind.UDP : transport;
        kind = kind == null ? EndpointKind.LOCAL : kind;
    }

    public static Endpoint of(InetSocketAddress socketAddress, EndpointKind kind) {
        return new Endpoint(socketAddress.getAddress().getHostAddress(), socketAddress.getPort(),
                TransportKind.UDP, kind);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(address, port);
    }

    /**
     * Compara solo dirección, puerto y transporte.
     *
     * @param other otro endpoint
     * @return true si apuntan al mismo destino
     */
    public boolean sameTarget(Endpoint other) {
        return other != null && address.equals(other.address) && port == other.port
                && transport == other.transport;
    }

    @Override
    public String toString() {
        return kind + ":" + address + ":" + port;
    }
}
