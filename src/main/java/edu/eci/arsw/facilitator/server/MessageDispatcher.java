package edu.eci.arsw.facilitator.server;

import de.huxhorn.sulky.ulid.ULID;
import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.domain.EndpointKind;
import edu.eci.arsw.facilitator.domain.Room;
import edu.eci.arsw.facilitator.domain.Session;
import edu.eci.arsw.facilitator.exception.ErrorCode;
import edu.eci.arsw.facilitator.exception.FacilitatorException;
import edu.eci.arsw.facilitator.exception.NotRegisteredException;
import edu.eci.arsw.facilitator.exception.ProtocolException;
import edu.eci.arsw.facilitator.protocol.MessageType;
import edu.eci.arsw.facilitator.protocol.ProtocolCodec;
import edu.eci.arsw.facilitator.protocol.ProtocolMessage;
import edu.eci.arsw.facilitator.relay.RelayEngine;
import edu.eci.arsw.facilitator.rendezvous.RendezvousCoordinator;
import edu.eci.arsw.facilitator.room.RoomDirectory;
import edu.eci.arsw.facilitator.session.CloseReason;
import edu.eci.arsw.facilitator.session.SessionClosedEvent;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import edu.eci.arsw.facilitator.transport.DeliveryMode;
import edu.eci.arsw.facilitator.transport.InboundMessage;
import edu.eci.arsw.facilitator.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Atiende cada mensaje de control recibido: límite de tasa, decodificación,
 * autenticación por endpoint y enrutamiento al componente que corresponde.
 *
 * Las excepciones del dominio se responden con el mensaje de error de su código;
 * las inesperadas se registran y se responden con ERROR. Nunca se propagan al
 * hilo trabajador.
 */
@Component
public class MessageDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final SessionRegistry registry;
    private final RoomDirectory directory;
    private final RendezvousCoordinator coordinator;
    private final RelayEngine relay;
    private final Transport transport;
    private final ProtocolCodec codec;
    private final Clock clock;
    private final int rateLimit;
    private final Duration idleEndpointTimeout;
    private final ULID ulid = new ULID();

    /** Límite de tasa por endpoint */
    private final Map<InetSocketAddress, ControlRateLimiter> limiters = new ConcurrentHashMap<>();

    public MessageDispatcher(SessionRegistry registry,
                             RoomDirectory directory,
                             RendezvousCoordinator coordinator,
                             RelayEngine relay,
                             Transport transport,
                             ProtocolCodec codec,
                             Clock clock,
                             FacilitatorProperties props) {
        this.registry = registry;
        this.directory = directory;
        this.coordinator = coordinator;
        this.relay = relay;
        this.transport = transport;
        this.codec = codec;
        this.clock = clock;
        this.rateLimit = props.getControlRateLimit();
        this.idleEndpointTimeout = props.getSession().getLivenessTimeout();
    }

    /**
     * Procesa un mensaje entrante.
     *
     * @param in mensaje entregado por el transporte
     */
    public void dispatch(InboundMessage in) {
        ProtocolMessage msg = null;
        try {
            msg = codec.decode(in.payload());
            if (msg.type != MessageType.RELAY_DATA && !limiter(in.sender()).tryAcquire()) {
                log.debug("Control rate limit exceeded by {}, {} dropped", in.sender(), msg.type);
                return;
            }
            if (msg.traceId == null || msg.traceId.isBlank()) {
                msg.traceId = ulid.nextULID();
            }
            MDC.put("traceId", msg.traceId);
            route(in, msg);
        } catch (ProtocolException ex) {
            log.debug("Malformed message from {}: {}", in.sender(), ex.getMessage());
            reply(in.sender(), ProtocolMessage.error(msg, ex.getCode(), ex.getMessage()), DeliveryMode.UNRELIABLE);
        } catch (FacilitatorException ex) {
            log.info("{} rejected for {}: {} {}", msg == null ? null : msg.type, in.sender(), ex.getCode(), ex.getMessage());
            reply(in.sender(), ProtocolMessage.error(msg, ex.getCode(), ex.getMessage()), DeliveryMode.RELIABLE_ORDERED);
        } catch (IllegalArgumentException ex) {
            log.info("Invalid {} from {}: {}", msg == null ? null : msg.type, in.sender(), ex.getMessage());
            reply(in.sender(), ProtocolMessage.error(msg, ErrorCode.PROTOCOL_ERROR, ex.getMessage()),
                    DeliveryMode.RELIABLE_ORDERED);
        } catch (RuntimeException ex) {
            log.error("Dispatch failed for message from {}", in.sender(), ex);
            reply(in.sender(), ProtocolMessage.error(msg, ErrorCode.INTERNAL_ERROR,
                    "500: " + ex.getClass().getSimpleName()), DeliveryMode.RELIABLE_ORDERED);
        } finally {
            MDC.clear();
        }
    }

    /**
     * El transporte agotó los reintentos hacia un endpoint.
     *
     * @param endpoint endpoint inalcanzable
     */
    public void onPeerUnreachable(InetSocketAddress endpoint) {
        limiters.remove(endpoint);
        if (registry.disconnectEndpoint(endpoint)) {
            log.warn("Session at {} disconnected: transport unreachable", endpoint);
        }
    }

    @EventListener
    public void onSessionClosed(SessionClosedEvent event) {
        InetSocketAddress endpoint = event.session().controlEndpoint();
        limiters.remove(endpoint);
        if (event.reason() == CloseReason.EXPIRED || event.reason() == CloseReason.UNREACHABLE) {
            transport.forget(endpoint);
        }
    }

    /**
     * Libera el estado de transporte y el límite de tasa de los endpoints sin
     * sesión que llevan más del tiempo de vida sin enviar nada. Cubre las bajas
     * limpias, una vez confirmado {@code UNREGISTERED}, y los remitentes que
     * nunca se registraron.
     *
     * @return endpoints liberados
     */
    public int sweepIdleEndpoints() {
        Instant cutoff = clock.instant().minus(idleEndpointTimeout);
        Set<InetSocketAddress> candidates = new HashSet<>(transport.knownPeers());
        candidates.addAll(limiters.keySet());
        int freed = 0;
        for (InetSocketAddress endpoint : candidates) {
            if (registry.findByEndpoint(endpoint).isPresent()) {
                continue;
            }
            Optional<Instant> last = transport.lastReceived(endpoint);
            if (last.isPresent() && last.get().isAfter(cutoff)) {
                continue;
            }
            limiters.remove(endpoint);
            transport.forget(endpoint);
            freed++;
        }
        return freed;
    }

    private void route(InboundMessage in, ProtocolMessage msg) {
        if (msg.type == MessageType.REGISTER) {
            onRegister(in, msg);
            return;
        }
        Session session = requireSession(in.sender(), msg);
        MDC.put("sessionId", session.sessionId());
        registry.touch(session.sessionId());

        switch (msg.type) {
            case HEARTBEAT -> reply(in.sender(), ProtocolMessage.replyTo(msg, MessageType.HEARTBEAT),
                    DeliveryMode.UNRELIABLE);
            case UNREGISTER -> onUnregister(in, session, msg);
            case CREATE_ROOM -> directory.createAndJoin(session.sessionId(), msg.room);
            case JOIN_ROOM -> onJoin(session, msg);
            case LEAVE_ROOM -> onLeave(in, session, msg);
            case LIST_ROOMS -> onList(in, msg);
            case PUNCH_REPORT -> coordinator.onPunchReport(session.sessionId(), msg.linkId, msg.peerSessionId,
                    msg.endpoint);
            case RETRY_LINK -> coordinator.onRetryLink(session.sessionId(), msg.peerSessionId);
            case RELAY_DATA -> relay.forward(msg.channelId, session.sessionId(), msg.payload, in.mode());
            default -> throw new ProtocolException("Unsupported type " + msg.type);
        }
    }

    private void onRegister(InboundMessage in, ProtocolMessage msg) {
        Session session = registry.register(msg.token, msg.endpoints, in.sender(), msg.name);
        MDC.put("sessionId", session.sessionId());
        ProtocolMessage ack = ProtocolMessage.replyTo(msg, MessageType.REGISTER_ACK);
        ack.sessionId = session.sessionId();
        ack.endpoint = session.candidates().stream()
                .filter(e -> e.kind() == EndpointKind.PUBLIC)
                .findFirst()
                .orElse(null);
        reply(in.sender(), ack, DeliveryMode.RELIABLE_ORDERED);
    }

    private void onUnregister(InboundMessage in, Session session, ProtocolMessage msg) {
        registry.unregister(session.sessionId());
        ProtocolMessage bye = ProtocolMessage.replyTo(msg, MessageType.UNREGISTERED);
        bye.sessionId = session.sessionId();
        reply(in.sender(), bye, DeliveryMode.RELIABLE_ORDERED);
    }

    private void onJoin(Session session, ProtocolMessage msg) {
        if (msg.roomId != null && !msg.roomId.isBlank()) {
            directory.joinRoom(session.sessionId(), msg.roomId, msg.password);
        } else {
            directory.joinMatching(session.sessionId(), msg.criteria, msg.password);
        }
    }

    private void onLeave(InboundMessage in, Session session, ProtocolMessage msg) {
        Optional<Room> left = directory.leaveRoom(session.sessionId());
        ProtocolMessage ack = ProtocolMessage.replyTo(msg, MessageType.ROOM_LEFT);
        ack.roomId = left.map(Room::roomId).orElse(null);
        reply(in.sender(), ack, DeliveryMode.RELIABLE_ORDERED);
    }

    private void onList(InboundMessage in, ProtocolMessage msg) {
        ProtocolMessage list = ProtocolMessage.replyTo(msg, MessageType.ROOM_LIST);
        list.rooms = directory.listRooms(msg.criteria).stream().map(Room::summary).toList();
        reply(in.sender(), list, DeliveryMode.RELIABLE_ORDERED);
    }

    private Session requireSession(InetSocketAddress sender, ProtocolMessage msg) {
        Session session = registry.findByEndpoint(sender)
                .orElseThrow(() -> new NotRegisteredException("Endpoint sin sesión: " + sender));
        if (msg.sessionId != null && !msg.sessionId.equals(session.sessionId())) {
            throw new NotRegisteredException("sessionId no corresponde al endpoint");
        }
        return session;
    }

    private ControlRateLimiter limiter(InetSocketAddress endpoint) {
        return limiters.computeIfAbsent(endpoint, k -> new ControlRateLimiter(rateLimit, clock));
    }

    private void reply(InetSocketAddress to, ProtocolMessage msg, DeliveryMode mode) {
        try {
            transport.send(to, codec.encode(msg), mode);
        } catch (RuntimeException e) {
            log.warn("Could not send {} to {}: {}", msg.type, to, e.toString());
        }
    }
}
