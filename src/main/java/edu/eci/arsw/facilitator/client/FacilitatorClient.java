package edu.eci.arsw.facilitator.client;

import de.huxhorn.sulky.ulid.ULID;
import edu.eci.arsw.facilitator.domain.Endpoint;
import edu.eci.arsw.facilitator.domain.EndpointKind;
import edu.eci.arsw.facilitator.domain.RoomConfig;
import edu.eci.arsw.facilitator.domain.RoomFilter;
import edu.eci.arsw.facilitator.domain.RoomSummary;
import edu.eci.arsw.facilitator.exception.AlreadyMemberException;
import edu.eci.arsw.facilitator.exception.AuthenticationException;
import edu.eci.arsw.facilitator.exception.CapacityException;
import edu.eci.arsw.facilitator.exception.ErrorCode;
import edu.eci.arsw.facilitator.exception.FacilitatorException;
import edu.eci.arsw.facilitator.exception.NotRegisteredException;
import edu.eci.arsw.facilitator.exception.ProtocolException;
import edu.eci.arsw.facilitator.exception.RoomFullException;
import edu.eci.arsw.facilitator.exception.RoomNameTakenException;
import edu.eci.arsw.facilitator.exception.RoomNotFoundException;
import edu.eci.arsw.facilitator.protocol.MessageType;
import edu.eci.arsw.facilitator.protocol.ProtocolCodec;
import edu.eci.arsw.facilitator.protocol.ProtocolMessage;
import edu.eci.arsw.facilitator.transport.DeliveryMode;
import edu.eci.arsw.facilitator.transport.InboundMessage;
import edu.eci.arsw.facilitator.transport.ReliableTransport;
import edu.eci.arsw.facilitator.transport.ScheduledTimerService;
import edu.eci.arsw.facilitator.transport.TimerService;
import edu.eci.arsw.facilitator.transport.Transport;
import edu.eci.arsw.facilitator.transport.TransportListener;
import edu.eci.arsw.facilitator.transport.UdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cliente de sesión del Facilitator.
 *
 * <p>Registra al cliente, gestiona la sala y entrega a los {@link PeerListener}
 * los datos y cambios de conectividad de cada par. La negociación (golpes de NAT,
 * reportes, relay) ocurre por dentro; para enviar basta con
 * {@link #sendToPeer(String, byte[], DeliveryMode)}.</p>
 *
 * <p>Las operaciones de control bloquean hasta la respuesta o hasta el tiempo
 * de espera configurado.</p>
 */
public class FacilitatorClient implements TransportListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FacilitatorClient.class);

    /** Intervalo de keep-alive por defecto. */
    public static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private final Transport transport;
    private final InetSocketAddress facilitator;
    private final TimerService timers;
    private final Duration heartbeatInterval;
    private final Duration requestTimeout;
    private final ProtocolCodec codec = new ProtocolCodec();
    private final ULID ulid = new ULID();

    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final Map<String, PeerPath> paths = new ConcurrentHashMap<>();
    private final Map<String, HolePuncher> punchers = new ConcurrentHashMap<>();
    private final List<PeerListener> listeners = new CopyOnWriteArrayList<>();

    private volatile String sessionId;
    private volatile String roomId;
    private volatile Endpoint observedEndpoint;
    private volatile TimerService.Timer heartbeat;
    private volatile boolean started;
    private ScheduledExecutorService ownedExecutor;

    record PendingRequest(Set<MessageType> expected, CompletableFuture<ProtocolMessage> future) {
    }

    /**
     * Camino hacia un par: directo a un endpoint o por un canal de relay.
     */
    record PeerPath(String linkId, InetSocketAddress direct, String channelId) {
        boolean isDirect() {
            return direct != null;
        }
    }

    public FacilitatorClient(Transport transport, InetSocketAddress facilitator, TimerService timers,
                             Duration heartbeatInterval, Duration requestTimeout) {
        this.transport = transport;
        this.facilitator = facilitator;
        this.timers = timers;
        this.heartbeatInterval = heartbeatInterval;
        this.requestTimeout = requestTimeout;
        this.transport.setListener(this);
    }

    /**
     * Cliente sobre un socket UDP real con los valores por defecto.
     *
     * @param bind        dirección local
     * @param facilitator dirección del Facilitator
     * @return cliente sin conectar
     */
    public static FacilitatorClient udp(InetSocketAddress bind, InetSocketAddress facilitator) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "facilitator-client-timer");
            t.setDaemon(true);
            return t;
        });
        TimerService timers = new ScheduledTimerService(executor);
        UdpDatagramEndpoint endpoint = new UdpDatagramEndpoint(bind, 65507, "facilitator-client-io");
        ReliableTransport transport = new ReliableTransport(endpoint, timers, Clock.systemUTC(),
                Duration.ofMillis(200), 8, 64);
        FacilitatorClient client = new FacilitatorClient(transport, facilitator, timers,
                DEFAULT_HEARTBEAT, DEFAULT_REQUEST_TIMEOUT);
        client.ownedExecutor = executor;
        return client;
    }

    public void addListener(PeerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PeerListener listener) {
        listeners.remove(listener);
    }

    public String connect(String token) {
        return connect(token, null, List.of());
    }

    /**
     * Se registra en el Facilitator y empieza a enviar heartbeats.
     *
     * @param token          token de sesión
     * @param name           nombre visible, opcional
     * @param localEndpoints endpoints de la red local, candidatos para conexión directa
     * @return id de sesión asignado
     * @throws AuthenticationException si el token se rechaza
     * @throws CapacityException       si el servidor está lleno
     */
    public String connect(String token, String name, List<Endpoint> localEndpoints) {
        if (!started) {
            transport.start();
            started = true;
        }
        ProtocolMessage req = ProtocolMessage.of(MessageType.REGISTER);
        req.token = token;
        req.name = name;
        req.endpoints = localEndpoints;
        ProtocolMessage ack = request(req, MessageType.REGISTER_ACK);
        sessionId = ack.sessionId;
        observedEndpoint = ack.endpoint;
        scheduleHeartbeat();
        log.info("Connected to facilitator {} as {} (observed {})", facilitator, sessionId, observedEndpoint);
        return sessionId;
    }

    public JoinedRoom createRoom(RoomConfig config) {
        ProtocolMessage req = ProtocolMessage.of(MessageType.CREATE_ROOM);
        req.room = config;
        return joined(request(req, MessageType.ROOM_JOINED));
    }

    public JoinedRoom joinRoom(String roomId) {
        return joinRoom(roomId, null);
    }

    public JoinedRoom joinRoom(String roomId, String password) {
        ProtocolMessage req = ProtocolMessage.of(MessageType.JOIN_ROOM);
        req.roomId = roomId;
        req.password = password;
        return joined(request(req, MessageType.ROOM_JOINED));
    }

    public JoinedRoom joinRoom(RoomFilter criteria) {
        ProtocolMessage req = ProtocolMessage.of(MessageType.JOIN_ROOM);
        req.criteria = criteria;
        return joined(request(req, MessageType.ROOM_JOINED));
    }

    public void leaveRoom() {
        request(ProtocolMessage.of(MessageType.LEAVE_ROOM), MessageType.ROOM_LEFT);
        roomId = null;
        clearPeers();
    }

    public List<RoomSummary> listRooms(RoomFilter filter) {
        ProtocolMessage req = ProtocolMessage.of(MessageType.LIST_ROOMS);
        req.criteria = filter;
        ProtocolMessage resp = request(req, MessageType.ROOM_LIST);
        return resp.rooms == null ? List.of() : resp.rooms;
    }

    /**
     * Envía datos a un par por el camino vigente.
     *
     * @param peerSessionId par destino
     * @param payload       datos opacos
     * @param mode          modo de entrega
     * @throws ClientException si todavía no hay camino hacia el par
     */
    public void sendToPeer(String peerSessionId, byte[] payload, DeliveryMode mode) {
        PeerPath path = paths.get(peerSessionId);
        if (path == null) {
            throw new ClientException("No hay camino hacia " + peerSessionId);
        }
        if (path.isDirect()) {
            ProtocolMessage msg = ProtocolMessage.of(MessageType.PEER_DATA);
            msg.sessionId = sessionId;
            msg.payload = payload;
            transport.send(path.direct(), codec.encode(msg), mode);
        } else {
            ProtocolMessage msg = ProtocolMessage.of(MessageType.RELAY_DATA);
            msg.channelId = path.channelId();
            msg.payload = payload;
            transport.send(facilitator, codec.encode(msg), mode);
        }
    }

    /**
     * Pide reintentar la negociación con un par cuyo enlace falló.
     */
    public void retryLink(String peerSessionId) {
        ProtocolMessage msg = ProtocolMessage.of(MessageType.RETRY_LINK);
        msg.peerSessionId = peerSessionId;
        sendToFacilitator(msg, DeliveryMode.RELIABLE_ORDERED);
    }

    /**
     * Se da de baja y libera el transporte.
     */
    public void disconnect() {
        if (sessionId != null) {
            try {
                request(ProtocolMessage.of(MessageType.UNREGISTER), MessageType.UNREGISTERED);
            } catch (ClientException | FacilitatorException e) {
                log.warn("Unregister failed: {}", e.getMessage());
            }
        }
        close();
    }

    @Override
    public void close() {
        cancelHeartbeat();
        clearPeers();
        pending.values().forEach(p -> p.future().completeExceptionally(new ClientException("Cliente cerrado")));
        pending.clear();
        sessionId = null;
        roomId = null;
        if (started) {
            started = false;
            transport.stop();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public String roomId() {
        return roomId;
    }

    public Endpoint observedEndpoint() {
        return observedEndpoint;
    }

    /**
     * @return true si el camino hacia el par es directo, false si es por relay,
     *         vacío si no hay camino
     */
    public Optional<Boolean> isDirect(String peerSessionId) {
        return Optional.ofNullable(paths.get(peerSessionId)).map(PeerPath::isDirect);
    }

    @Override
    public void onMessage(InboundMessage in) {
        ProtocolMessage msg;
        try {
            msg = codec.decode(in.payload());
        } catch (ProtocolException e) {
            log.debug("Malformed message from {} dropped: {}", in.sender(), e.getMessage());
            return;
        }
        if (facilitator.equals(in.sender())) {
            onServerMessage(msg);
        } else {
            onPeerMessage(in.sender(), msg);
        }
    }

    @Override
    public void onPeerUnreachable(InetSocketAddress peer) {
        if (facilitator.equals(peer)) {
            log.warn("Facilitator {} unreachable", peer);
            cancelHeartbeat();
            clearPeers();
            emit(new PeerEvent(PeerEvent.Type.DISCONNECTED, null, roomId, null, "UNREACHABLE"));
            return;
        }
        paths.entrySet().removeIf(e -> {
            if (peer.equals(e.getValue().direct())) {
                emit(new PeerEvent(PeerEvent.Type.LINK_FAILED, e.getKey(), roomId, null, "UNREACHABLE"));
                return true;
            }
            return false;
        });
    }

    private void onServerMessage(ProtocolMessage msg) {
        completePending(msg);
        switch (msg.type) {
            case ROOM_JOINED -> roomId = msg.roomId;
            case PEER_JOINED -> emit(PeerEvent.of(PeerEvent.Type.PEER_JOINED, msg.peerSessionId, msg.roomId));
            case PEER_LEFT -> {
                forgetPeer(msg.peerSessionId);
                emit(PeerEvent.of(PeerEvent.Type.PEER_LEFT, msg.peerSessionId, msg.roomId));
            }
            case HOST_CHANGED -> emit(PeerEvent.of(PeerEvent.Type.HOST_CHANGED, msg.hostSessionId, msg.roomId));
            case CANDIDATE_EXCHANGE -> startPunching(msg);
            case DIRECT_ESTABLISHED -> onDirect(msg);
            case RELAY_ESTABLISHED -> {
                stopPuncher(msg.linkId);
                paths.put(msg.peerSessionId, new PeerPath(msg.linkId, null, msg.channelId));
                emit(PeerEvent.of(PeerEvent.Type.LINK_RELAYED, msg.peerSessionId, roomId));
            }
            case LINK_FAILED -> {
                stopPuncher(msg.linkId);
                paths.remove(msg.peerSessionId);
                emit(new PeerEvent(PeerEvent.Type.LINK_FAILED, msg.peerSessionId, roomId, null, msg.reason));
            }
            case RELAY_DATA -> emit(new PeerEvent(PeerEvent.Type.PEER_DATA, msg.peerSessionId, roomId, msg.payload, null));
            default -> {
                if (msg.type.isError()) {
                    log.debug("Unmatched {} from facilitator: {}", msg.type, msg.reason);
                }
            }
        }
    }

    private void onPeerMessage(InetSocketAddress from, ProtocolMessage msg) {
        switch (msg.type) {
            case PUNCH_PROBE -> {
                ProtocolMessage ack = ProtocolMessage.of(MessageType.PUNCH_ACK);
                ack.sessionId = sessionId;
                ack.linkId = msg.linkId;
                transport.send(from, codec.encode(ack), DeliveryMode.UNRELIABLE);
                punchSucceeded(msg.linkId, from);
            }
            case PUNCH_ACK -> punchSucceeded(msg.linkId, from);
            case PEER_DATA -> {
                Optional<String> peer = peerAt(from);
                if (peer.isEmpty()) {
                    log.debug("PeerData from unknown endpoint {} dropped", from);
                    return;
                }
                emit(new PeerEvent(PeerEvent.Type.PEER_DATA, peer.get(), roomId, msg.payload, null));
            }
            default -> log.debug("Unexpected {} from peer {}", msg.type, from);
        }
    }

    /**
     * Resuelve el par por la dirección de origen: primero los caminos directos
     * confirmados, luego los perforadores que ya ganaron en esa dirección.
     */
    private Optional<String> peerAt(InetSocketAddress from) {
        for (Map.Entry<String, PeerPath> e : paths.entrySet()) {
            if (from.equals(e.getValue().direct())) {
                return Optional.of(e.getKey());
            }
        }
        for (HolePuncher puncher : punchers.values()) {
            if (from.equals(puncher.winner())) {
                return Optional.of(puncher.peerSessionId());
            }
        }
        return Optional.empty();
    }

    private void startPunching(ProtocolMessage msg) {
        stopPuncher(msg.linkId);
        HolePuncher puncher = new HolePuncher(msg.linkId, msg.peerSessionId, msg.endpoints, timers,
                Duration.ofMillis(msg.punchDelayMs == null ? 0 : msg.punchDelayMs),
                Duration.ofMillis(msg.punchIntervalMs == null ? 250 : msg.punchIntervalMs),
                Duration.ofMillis(msg.punchWindowMs == null ? 5000 : msg.punchWindowMs),
                target -> sendProbe(msg.linkId, target));
        punchers.put(msg.linkId, puncher);
        puncher.start();
    }

    private void sendProbe(String linkId, InetSocketAddress target) {
        ProtocolMessage probe = ProtocolMessage.of(MessageType.PUNCH_PROBE);
        probe.sessionId = sessionId;
        probe.linkId = linkId;
        transport.send(target, codec.encode(probe), DeliveryMode.UNRELIABLE);
    }

    private void punchSucceeded(String linkId, InetSocketAddress at) {
        HolePuncher puncher = linkId == null ? null : punchers.get(linkId);
        if (puncher == null || !puncher.succeed(at)) {
            return;
        }
        log.debug("Punch succeeded for link {} at {}", linkId, at);
        ProtocolMessage report = ProtocolMessage.of(MessageType.PUNCH_REPORT);
        report.linkId = linkId;
        report.peerSessionId = puncher.peerSessionId();
        report.endpoint = Endpoint.of(at, EndpointKind.PUBLIC);
        sendToFacilitator(report, DeliveryMode.RELIABLE_ORDERED);
    }

    private void onDirect(ProtocolMessage msg) {
        HolePuncher puncher = punchers.remove(msg.linkId);
        InetSocketAddress at = puncher == null ? null : puncher.winner();
        if (puncher != null) {
            puncher.cancel();
        }
        if (at == null && msg.endpoint != null) {
            at = msg.endpoint.toSocketAddress();
        }
        if (at == null) {
            log.warn("DirectEstablished for link {} without endpoint", msg.linkId);
            return;
        }
        paths.put(msg.peerSessionId, new PeerPath(msg.linkId, at, null));
        emit(PeerEvent.of(PeerEvent.Type.LINK_DIRECT, msg.peerSessionId, roomId));
    }

    private ProtocolMessage request(ProtocolMessage req, MessageType expected) {
        if (!started) {
            throw new ClientException("Cliente no conectado");
        }
        req.traceId = ulid.nextULID();
        req.sessionId = sessionId;
        CompletableFuture<ProtocolMessage> future = new CompletableFuture<>();
        pending.put(req.traceId, new PendingRequest(EnumSet.of(expected), future));
        try {
            sendToFacilitator(req, DeliveryMode.RELIABLE_ORDERED);
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ClientException("Sin respuesta a " + req.type + " en " + requestTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("Interrumpido esperando " + req.type, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new ClientException("Fallo en " + req.type, e.getCause());
        } finally {
            pending.remove(req.traceId);
        }
    }

    private void completePending(ProtocolMessage msg) {
        if (msg.traceId == null) {
            return;
        }
        PendingRequest p = pending.get(msg.traceId);
        if (p == null) {
            return;
        }
        if (msg.type.isError()) {
            p.future().completeExceptionally(toException(msg));
        } else if (p.expected().contains(msg.type)) {
            p.future().complete(msg);
        }
    }

    private void sendToFacilitator(ProtocolMessage msg, DeliveryMode mode) {
        transport.send(facilitator, codec.encode(msg), mode);
    }

    private void scheduleHeartbeat() {
        cancelHeartbeat();
        heartbeat = timers.schedule(heartbeatInterval, this::sendHeartbeat);
    }

    private void sendHeartbeat() {
        if (!started || sessionId == null) {
            return;
        }
        ProtocolMessage hb = ProtocolMessage.of(MessageType.HEARTBEAT);
        hb.sessionId = sessionId;
        sendToFacilitator(hb, DeliveryMode.UNRELIABLE);
        heartbeat = timers.schedule(heartbeatInterval, this::sendHeartbeat);
    }

    private void cancelHeartbeat() {
        TimerService.Timer t = heartbeat;
        heartbeat = null;
        if (t != null) {
            t.cancel();
        }
    }

    private void stopPuncher(String linkId) {
        HolePuncher p = linkId == null ? null : punchers.remove(linkId);
        if (p != null) {
            p.cancel();
        }
    }

    private void forgetPeer(String peerSessionId) {
        paths.remove(peerSessionId);
        punchers.values().removeIf(p -> {
            if (p.peerSessionId().equals(peerSessionId)) {
                p.cancel();
                return true;
            }
            return false;
        });
    }

    private void clearPeers() {
        punchers.values().forEach(HolePuncher::cancel);
        punchers.clear();
        paths.clear();
    }

    private JoinedRoom joined(ProtocolMessage msg) {
        roomId = msg.roomId;
        return new JoinedRoom(msg.roomId, msg.members == null ? List.of() : msg.members, msg.hostSessionId);
    }

    private void emit(PeerEvent event) {
        for (PeerListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.error("PeerListener failed on {}", event.type(), e);
            }
        }
    }

    private static FacilitatorException toException(ProtocolMessage msg) {
        ErrorCode code = msg.code != null ? msg.code : ErrorCode.INTERNAL_ERROR;
        String reason = msg.reason == null ? code.name() : msg.reason;
        return switch (code) {
            case AUTH_ERROR -> new AuthenticationException(reason);
            case ROOM_FULL -> new RoomFullException(reason);
            case ROOM_NOT_FOUND -> new RoomNotFoundException(reason);
            case ALREADY_MEMBER -> new AlreadyMemberException(reason);
            case ROOM_NAME_TAKEN -> new RoomNameTakenException(reason);
            case CAPACITY_ERROR -> new CapacityException(reason);
            case NOT_REGISTERED -> new NotRegisteredException(reason);
            case PROTOCOL_ERROR, INTERNAL_ERROR -> new ProtocolException(reason);
        };
    }
}
