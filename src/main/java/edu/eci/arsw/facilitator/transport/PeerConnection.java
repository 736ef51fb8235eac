package edu.eci.arsw.facilitator.transport;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Estado del transporte para un endpoint remoto: contadores de secuencia,
 * tramas pendientes de acuse y ventanas de recepción.
 *
 * Todos los métodos mutadores son sincronizados sobre la instancia.
 */
final class PeerConnection {

    private final InetSocketAddress remote;
    private final int reorderWindow;

    private final EnumMap<DeliveryMode, Long> nextSeq = new EnumMap<>(DeliveryMode.class);
    private final Map<PendingKey, PendingFrame> pending = new HashMap<>();
    private final EnumMap<DeliveryMode, InboundWindow> inbound = new EnumMap<>(DeliveryMode.class);

    private boolean remoteEpochKnown;
    private int remoteEpoch;
    private volatile Instant lastReceivedAt;

    record PendingKey(DeliveryMode mode, long seq) {
    }

    /**
     * Trama fiable a la espera de acuse.
     */
    static final class PendingFrame {
        final PendingKey key;
        final byte[] bytes;
        int attempts;
        TimerService.Timer timer;

        PendingFrame(PendingKey key, byte[] bytes) {
            this.key = key;
            this.bytes = bytes;
        }
    }

    PeerConnection(InetSocketAddress remote, int reorderWindow) {
        this.remote = remote;
        this.reorderWindow = reorderWindow;
        resetInbound();
    }

    InetSocketAddress remote() {
        return remote;
    }

    synchronized long nextSequence(DeliveryMode mode) {
        long seq = nextSeq.getOrDefault(mode, 0L);
        nextSeq.put(mode, seq + 1);
        return seq;
    }

    synchronized PendingFrame track(DeliveryMode mode, long seq, byte[] bytes) {
        PendingFrame frame = new PendingFrame(new PendingKey(mode, seq), bytes);
        pending.put(frame.key, frame);
        return frame;
    }

    synchronized boolean isPending(PendingFrame frame) {
        return pending.get(frame.key) == frame;
    }

    synchronized PendingFrame pending(DeliveryMode mode, long seq) {
        return pending.get(new PendingKey(mode, seq));
    }

    synchronized void acknowledge(DeliveryMode mode, long seq) {
        PendingFrame frame = pending.remove(new PendingKey(mode, seq));
        if (frame != null && frame.timer != null) {
            frame.timer.cancel();
        }
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Registra la época del emisor. Si cambió, el par reinició su conexión y se
     * descarta todo el estado anterior.
     *
     * @param epoch época recibida
     * @return true si hubo reinicio de conexión
     */
    synchronized boolean observeEpoch(int epoch) {
        if (remoteEpochKnown && remoteEpoch == epoch) {
            return false;
        }
        boolean restarted = remoteEpochKnown;
        remoteEpochKnown = true;
        remoteEpoch = epoch;
        if (restarted) {
            cancelAll();
            nextSeq.clear();
            resetInbound();
        }
        return restarted;
    }

    synchronized InboundWindow.Result accept(DeliveryMode mode, long seq, byte[] payload) {
        return inbound.get(mode).accept(seq, payload);
    }

    /**
     * Cancela todos los temporizadores y vacía las tramas pendientes.
     *
     * @return tramas que estaban pendientes
     */
    synchronized List<PendingFrame> cancelAll() {
        List<PendingFrame> dropped = new ArrayList<>(pending.values());
        for (PendingFrame frame : dropped) {
            if (frame.timer != null) {
                frame.timer.cancel();
            }
        }
        pending.clear();
        return dropped;
    }

    void markReceived(Instant now) {
        lastReceivedAt = now;
    }

    Instant lastReceivedAt() {
        return lastReceivedAt;
    }

    private void resetInbound() {
        inbound.put(DeliveryMode.RELIABLE_UNORDERED, new InboundWindow(false, reorderWindow));
        inbound.put(DeliveryMode.RELIABLE_ORDERED, new InboundWindow(true, reorderWindow));
    }
}
