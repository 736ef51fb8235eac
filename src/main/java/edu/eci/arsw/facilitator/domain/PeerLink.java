package edu.eci.arsw.facilitator.domain;

import java.time.Instant;

/**
 * Relación de conectividad entre dos sesiones de la misma sala.
 *
 * El iniciador es la sesión con el id lexicográficamente menor.
 */
public record PeerLink(String linkId,
                       String roomId,
                       String initiatorId,
                       String responderId,
                       LinkState state,
                       int attempts,
                       boolean initiatorReported,
                       boolean responderReported,
                       Instant negotiationStartedAt,
                       Instant lastTransitionAt,
                       String channelId) {

    public static PeerLink negotiating(String linkId, String roomId, String a, String b, Instant now) {
        boolean aFirst = a.compareTo(b) < 0;
        return new PeerLink(linkId, roomId, aFirst ? a : b, aFirst ? b : a, LinkState.NEGOTIATING,
                1, false, false, now, now, null);
    }

    public boolean involves(String sessionId) {
        return initiatorId.equals(sessionId) || responderId.equals(sessionId);
    }

    public String peerOf(String sessionId) {
        return initiatorId.equals(sessionId) ? responderId : initiatorId;
    }

    public boolean isInitiator(String sessionId) {
        return initiatorId.equals(sessionId);
    }

    public boolean bothReported() {
        return initiatorReported && responderReported;
    }

    public PeerLink withReport(String sessionId) {
        boolean init = initiatorReported || initiatorId.equals(sessionId);
        boolean resp = responderReported || responderId.equals(sessionId);
        return new PeerLink(linkId, roomId, initiatorId, responderId, state, attempts, init, resp,
                negotiationStartedAt, lastTransitionAt, channelId);
    }

    public PeerLink transition(LinkState next, Instant now) {
        return new PeerLink(linkId, roomId, initiatorId, responderId, next, attempts,
                initiatorReported, responderReported, negotiationStartedAt, now, channelId);
    }

    public PeerLink relayed(String newChannelId, Instant now) {
        return new PeerLink(linkId, roomId, initiatorId, responderId, LinkState.RELAYED, attempts,
                initiatorReported, responderReported, negotiationStartedAt, now, newChannelId);
    }

    public PeerLink retry(Instant now) {
        return new PeerLink(linkId, roomId, initiatorId, responderId, LinkState.NEGOTIATING,
                attempts + 1, false, false, now, now, null);
    }

    public static String pairKey(String a, String b) {
        return a.compareTo(b) < 0 ? a + "|" + b : b + "|" + a;
    }

    public String pairKey() {
        return initiatorId + "|" + responderId;
    }
}
