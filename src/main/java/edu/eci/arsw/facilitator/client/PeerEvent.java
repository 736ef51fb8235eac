package edu.eci.arsw.facilitator.client;

/**
 * Evento entregado a los {@link PeerListener} del cliente.
 *
 * @param type          tipo de evento
 * @param peerSessionId par al que se refiere (el nuevo anfitrión en HOST_CHANGED)
 * @param roomId        sala actual
 * @param payload       datos recibidos, solo en PEER_DATA
 * @param reason        motivo, solo en LINK_FAILED y DISCONNECTED
 */
public record PeerEvent(Type type, String peerSessionId, String roomId, byte[] payload, String reason) {

    public enum Type {
        PEER_JOINED,
        PEER_LEFT,
        HOST_CHANGED,
        LINK_DIRECT,
        LINK_RELAYED,
        LINK_FAILED,
        PEER_DATA,
        DISCONNECTED
    }

    static PeerEvent of(Type type, String peerSessionId, String roomId) {
        return new PeerEvent(type, peerSessionId, roomId, null, null);
    }
}
