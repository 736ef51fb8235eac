package edu.eci.arsw.facilitator.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transporte fiable sobre un {@link DatagramEndpoint}.
 *
 * <ul>
 * <li>Los modos fiables retransmiten con espera exponencial
 * ({@code base * 2^intento}) hasta {@code maxAttempts}; al agotarlos el par se
 * reporta como inalcanzable.</li>
 * <li>El receptor deduplica por secuencia y reconfirma los duplicados.</li>
 * <li>El modo ordenado retiene las tramas fuera de orden dentro de la ventana;
 * las que caen fuera se descartan y se pide el reenvío de la siguiente
 * esperada.</li>
 * <li>Cada instancia tiene una época propia: si un par cambia de época se
 * considera una conexión nueva.</li>
 * </ul>
 */
public class ReliableTransport implements Transport, DatagramEndpointListener {
    private static final Logger log = LoggerFactory.getLogger(ReliableTransport.class);

    private static final int MAX_BACKOFF_SHIFT = 10;

    private final DatagramEndpoint endpoint;
    private final TimerService timers;
    private final Clock clock;
    private final Duration retransmitBase;
    private final int maxAttempts;
    private final int reorderWindow;
    private final int epoch;

    private final Map<InetSocketAddress, PeerConnection> peers = new ConcurrentHashMap<>();
    private volatile TransportListener listener = message -> { };

    public ReliableTransport(DatagramEndpoint endpoint, TimerService timers, Clock clock,
                             Duration retransmitBase, int maxAttempts, int reorderWindow) {
        this.endpoint = endpoint;
        this.timers = timers;
        this.clock = clock;
        this.retransmitBase = retransmitBase;
        this.maxAttempts = maxAttempts;
        this.reorderWindow = reorderWindow;
        int e;
        do {
            e = new SecureRandom().nextInt();
        } while (e == 0);
        this.epoch = e;
        this.endpoint.setListener(this);
    }

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void start() {
        endpoint.start();
    }

    @Override
    public void stop() {
        endpoint.stop();
        peers.values().forEach(PeerConnection::cancelAll);
        peers.clear();
    }

    public InetSocketAddress localAddress() {
        return endpoint.localAddress();
    }

    @Override
    public void send(InetSocketAddress to, byte[] payload, DeliveryMode mode) {
        PeerConnection pc = connection(to);
        long seq = pc.nextSequence(mode);
        byte[] bytes = FrameCodec.encode(Frame.data(mode, epoch, seq, payload));
        if (mode.isReliable()) {
            PeerConnection.PendingFrame frame = pc.track(mode, seq, bytes);
            scheduleRetransmit(pc, frame);
        }
        endpoint.send(to, bytes);
    }

    @Override
    public Optional<Instant> lastReceived(InetSocketAddress peer) {
        PeerConnection pc = peers.get(peer);
        return pc == null ? Optional.empty() : Optional.ofNullable(pc.lastReceivedAt());
    }

    @Override
    public void forget(InetSocketAddress peer) {
        PeerConnection pc = peers.remove(peer);
        if (pc != null) {
            int dropped = pc.cancelAll().size();
            log.debug("Forgot peer {} ({} pending frames dropped)", peer, dropped);
        }
    }

    @Override
    public Set<InetSocketAddress> knownPeers() {
        return Set.copyOf(peers.keySet());
    }

    /**
     * Cantidad de tramas fiables pendientes de acuse hacia un par.
     *
     * @param peer endpoint remoto
     * @return tramas pendientes
     */
    public int pendingCount(InetSocketAddress peer) {
        PeerConnection pc = peers.get(peer);
        return pc == null ? 0 : pc.pendingCount();
    }

    @Override
    public void onDatagram(InetSocketAddress remote, byte[] data) {
        Optional<Frame> decoded = FrameCodec.decode(data);
        if (decoded.isEmpty()) {
            log.debug("Malformed frame from {} ({} bytes) dropped", remote, data == null ? 0 : data.length);
            return;
        }
        Frame frame = decoded.get();
        PeerConnection pc = connection(remote);
        pc.markReceived(clock.instant());

        switch (frame.type()) {
            case ACK -> pc.acknowledge(frame.mode(), frame.seq());
            case NACK -> onResendRequest(pc, frame);
            case DATA -> onData(pc, frame);
        }
    }

    private void onData(PeerConnection pc, Frame frame) {
        if (pc.observeEpoch(frame.epoch())) {
            log.info("Peer {} restarted its connection, transport state reset", pc.remote());
        }
        if (!frame.mode().isReliable()) {
            deliver(pc.remote(), frame.payload(), frame.mode());
            return;
        }
        InboundWindow.Result result = pc.accept(frame.mode(), frame.seq(), frame.payload());
        if (result.ack()) {
            endpoint.send(pc.remote(), FrameCodec.encode(Frame.ack(frame.mode(), epoch, frame.seq())));
        }
        if (result.resend()) {
            endpoint.send(pc.remote(), FrameCodec.encode(Frame.nack(frame.mode(), epoch, result.expected())));
        }
        for (byte[] payload : result.deliverable()) {
            deliver(pc.remote(), payload, frame.mode());
        }
    }

    private void onResendRequest(PeerConnection pc, Frame frame) {
        PeerConnection.PendingFrame pending = pc.pending(frame.mode(), frame.seq());
        if (pending != null) {
            endpoint.send(pc.remote(), pending.bytes);
        }
    }

    private void scheduleRetransmit(PeerConnection pc, PeerConnection.PendingFrame frame) {
        int shift = Math.min(frame.attempts, MAX_BACKOFF_SHIFT);
        Duration delay = retransmitBase.multipliedBy(1L << shift);
        frame.timer = timers.schedule(delay, () -> retransmit(pc, frame));
    }

    private void retransmit(PeerConnection pc, PeerConnection.PendingFrame frame) {
        boolean exhausted;
        synchronized (pc) {
            if (!pc.isPending(frame)) {
                return;
            }
            frame.attempts++;
            exhausted = frame.attempts > maxAttempts;
        }
        if (exhausted) {
            log.warn("Peer {} unreachable after {} attempts (mode={}, seq={})",
                    pc.remote(), maxAttempts, frame.key.mode(), frame.key.seq());
            peers.remove(pc.remote(), pc);
            pc.cancelAll();
            try {
                listener.onPeerUnreachable(pc.remote());
            } catch (RuntimeException e) {
                log.error("onPeerUnreachable failed for {}", pc.remote(), e);
            }
            return;
        }
        endpoint.send(pc.remote(), frame.bytes);
        scheduleRetransmit(pc, frame);
    }

    private void deliver(InetSocketAddress sender, byte[] payload, DeliveryMode mode) {
        try {
            listener.onMessage(new InboundMessage(sender, payload, mode));
        } catch (RuntimeException e) {
            log.error("Transport listener failed for message from {}", sender, e);
        }
    }

    private PeerConnection connection(InetSocketAddress remote) {
        return peers.computeIfAbsent(remote, r -> new PeerConnection(r, reorderWindow));
    }
}
