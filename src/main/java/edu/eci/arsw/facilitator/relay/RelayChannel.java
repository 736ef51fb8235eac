package edu.eci.arsw.facilitator.relay;

import edu.eci.arsw.facilitator.transport.DeliveryMode;
import edu.eci.arsw.facilitator.transport.TimerService;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Canal de retransmisión de un {@link edu.eci.arsw.facilitator.domain.PeerLink}.
 * Tiene un tramo por sentido, cada uno con su secuencia, cuota, cola y contadores.
 * El estado mutable se protege con el monitor del canal.
 */
public class RelayChannel {
    private final String channelId;
    private final String linkId;
    private final String sessionA;
    private final String sessionB;
    private final Leg aToB;
    private final Leg bToA;
    private boolean closed;

    RelayChannel(String channelId, String linkId, String sessionA, String sessionB,
                 RelayQuota quotaAtoB, RelayQuota quotaBtoA) {
        this.channelId = channelId;
        this.linkId = linkId;
        this.sessionA = sessionA;
        this.sessionB = sessionB;
        this.aToB = new Leg(sessionA, sessionB, quotaAtoB);
        this.bToA = new Leg(sessionB, sessionA, quotaBtoA);
    }

    public String channelId() {
        return channelId;
    }

    public String linkId() {
        return linkId;
    }

    public String sessionA() {
        return sessionA;
    }

    public String sessionB() {
        return sessionB;
    }

    /**
     * Tramo que sale de {@code fromSessionId}, o null si no pertenece al canal.
     */
    Leg legFrom(String fromSessionId) {
        if (sessionA.equals(fromSessionId)) {
            return aToB;
        }
        if (sessionB.equals(fromSessionId)) {
            return bToA;
        }
        return null;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized void markClosed() {
        closed = true;
        aToB.release();
        bToA.release();
    }

    public synchronized Stats stats() {
        return new Stats(channelId, linkId, sessionA, sessionB, aToB.snapshot(), bToA.snapshot());
    }

    /**
     * Un sentido del canal.
     */
    static final class Leg {
        final String from;
        final String to;
        final RelayQuota quota;
        final Deque<Queued> backlog = new ArrayDeque<>();
        long nextSeq;
        long datagrams;
        long bytes;
        long dropped;
        TimerService.Timer drainTimer;

        Leg(String from, String to, RelayQuota quota) {
            this.from = from;
            this.to = to;
            this.quota = quota;
        }

        void release() {
            backlog.clear();
            if (drainTimer != null) {
                drainTimer.cancel();
                drainTimer = null;
            }
        }

        LegStats snapshot() {
            return new LegStats(from, to, datagrams, bytes, dropped, backlog.size());
        }
    }

    record Queued(byte[] payload, DeliveryMode mode) {
    }

    public record LegStats(String from, String to, long datagrams, long bytes, long dropped, int backlog) {
    }

    public record Stats(String channelId, String linkId, String sessionA, String sessionB,
                        LegStats aToB, LegStats bToA) {
    }
}
