package edu.eci.arsw.facilitator.rendezvous;

import de.huxhorn.sulky.ulid.ULID;
import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.domain.Endpoint;
import edu.eci.arsw.facilitator.domain.EndpointKind;
import edu.eci.arsw.facilitator.domain.LinkState;
import edu.eci.arsw.facilitator.domain.PeerLink;
import edu.eci.arsw.facilitator.domain.Session;
import edu.eci.arsw.facilitator.exception.CapacityException;
import edu.eci.arsw.facilitator.metrics.NegotiationMetrics;
import edu.eci.arsw.facilitator.protocol.MessageSender;
import edu.eci.arsw.facilitator.protocol.MessageType;
import edu.eci.arsw.facilitator.protocol.ProtocolMessage;
import edu.eci.arsw.facilitator.relay.RelayEngine;
import edu.eci.arsw.facilitator.room.MemberJoinedEvent;
import edu.eci.arsw.facilitator.room.MemberLeftEvent;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import edu.eci.arsw.facilitator.transport.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Coordina el atravesamiento de NAT de cada par de miembros de una sala.
 *
 * <p>Máquina de estados de {@link PeerLink}: NEGOTIATING termina en DIRECT cuando
 * ambos extremos reportan un golpe exitoso, en RELAYED cuando vence la ventana de
 * negociación, o en FAILED si el relay no tiene capacidad. FAILED vuelve a
 * NEGOTIATING con RETRY_LINK mientras queden reintentos. Toda transición
 * terminal cancela el temporizador de la ventana.</p>
 */
@Service
public class RendezvousCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RendezvousCoordinator.class);

    static final String REASON_PEER_LEFT = "PEER_LEFT";
    static final String REASON_RELAY_CAPACITY = "RELAY_CAPACITY";
    static final String REASON_RETRY_LIMIT = "RETRY_LIMIT";

    private final SessionRegistry registry;
    private final RelayEngine relay;
    private final MessageSender sender;
    private final TimerService timers;
    private final Clock clock;
    private final NegotiationMetrics metrics;
    private final FacilitatorProperties.Rendezvous props;
    private final ULID ulid = new ULID();

    private final Object lock = new Object();
    private final Map<String, PeerLink> links = new ConcurrentHashMap<>();
    private final Map<String, String> linkByPair = new HashMap<>();
    private final Map<String, TimerService.Timer> windows = new HashMap<>();
    /** linkId|sessionId -> endpoint en el que esa sesión vio a su par */
    private final Map<String, Endpoint> reported = new HashMap<>();

    public RendezvousCoordinator(SessionRegistry registry,
                                 RelayEngine relay,
                                 MessageSender sender,
                                 TimerService timers,
                                 Clock clock,
                                 NegotiationMetrics metrics,
                                 FacilitatorProperties props) {
        this.registry = registry;
        this.relay = relay;
        this.sender = sender;
        this.timers = timers;
        this.clock = clock;
        this.metrics = metrics;
        this.props = props.getRendezvous();
    }

    /**
     * Crea un enlace entre el nuevo miembro y cada miembro existente.
     */
    @EventListener
    @Order(10)
    public void onMemberJoined(MemberJoinedEvent event) {
        String joiner = event.sessionId();
        synchronized (lock) {
            for (String member : event.room().members()) {
                if (!member.equals(joiner) && !linkByPair.containsKey(PeerLink.pairKey(joiner, member))) {
                    startLocked(PeerLink.negotiating(ulid.nextULID(), event.room().roomId(), joiner, member,
                            clock.instant()));
                }
            }
        }
    }

    /**
     * Derriba los enlaces del miembro que salió y avisa al otro extremo.
     */
    @EventListener
    @Order(10)
    public void onMemberLeft(MemberLeftEvent event) {
        teardown(event.sessionId());
    }

    /**
     * Un extremo confirmó que vio al otro. Con ambas confirmaciones el enlace pasa
     * a DIRECT.
     *
     * @param sessionId     sesión que reporta
     * @param linkId        enlace, si el cliente lo conoce
     * @param peerSessionId par, alternativa al linkId
     * @param seenAt        endpoint en el que vio al par, opcional
     */
    public void onPunchReport(String sessionId, String linkId, String peerSessionId, Endpoint seenAt) {
        synchronized (lock) {
            PeerLink link = resolve(sessionId, linkId, peerSessionId);
            if (link == null || link.state() != LinkState.NEGOTIATING) {
                log.debug("PunchReport from {} ignored (link={}, peer={})", sessionId, linkId, peerSessionId);
                return;
            }
            if (seenAt != null) {
                reported.put(reportKey(link.linkId(), sessionId), seenAt);
            }
            PeerLink updated = link.withReport(sessionId);
            links.put(updated.linkId(), updated);
            if (updated.bothReported()) {
                Instant now = clock.instant();
                PeerLink direct = updated.transition(LinkState.DIRECT, now);
                links.put(direct.linkId(), direct);
                cancelWindow(direct.linkId());
                metrics.recordDirect(Duration.between(direct.negotiationStartedAt(), now));
                log.info("Link {} is DIRECT ({} <-> {})", direct.linkId(), direct.initiatorId(), direct.responderId());
                sendDirect(direct, direct.initiatorId());
                sendDirect(direct, direct.responderId());
            }
        }
    }

    /**
     * Reintenta un enlace FAILED si quedan intentos.
     *
     * @param sessionId     sesión que lo pide
     * @param peerSessionId el otro extremo
     */
    public void onRetryLink(String sessionId, String peerSessionId) {
        synchronized (lock) {
            PeerLink link = resolve(sessionId, null, peerSessionId);
            if (link == null || link.state() != LinkState.FAILED) {
                log.debug("RetryLink from {} to {} ignored", sessionId, peerSessionId);
                return;
            }
            if (link.attempts() > props.getRetryCap()) {
                sendFailed(sessionId, link, REASON_RETRY_LIMIT);
                return;
            }
            log.info("Retrying link {} (attempt {})", link.linkId(), link.attempts() + 1);
            startLocked(link.retry(clock.instant()));
        }
    }

    public Optional<PeerLink> find(String linkId) {
        return Optional.ofNullable(links.get(linkId));
    }

    public Optional<PeerLink> findBetween(String a, String b) {
        synchronized (lock) {
            String id = linkByPair.get(PeerLink.pairKey(a, b));
            return id == null ? Optional.empty() : Optional.ofNullable(links.get(id));
        }
    }

    public List<PeerLink> links() {
        return List.copyOf(links.values());
    }

    public List<PeerLink> linksOfRoom(String roomId) {
        return links.values().stream().filter(l -> l.roomId().equals(roomId)).toList();
    }

    void onNegotiationTimeout(String linkId) {
        synchronized (lock) {
            windows.remove(linkId);
            PeerLink link = links.get(linkId);
            if (link == null || link.state() != LinkState.NEGOTIATING) {
                return;
            }
            log.info("Negotiation window expired for link {}, falling back to relay", linkId);
            relayLocked(link);
        }
    }

    private void startLocked(PeerLink link) {
        links.put(link.linkId(), link);
        linkByPair.put(link.pairKey(), link.linkId());
        reported.remove(reportKey(link.linkId(), link.initiatorId()));
        reported.remove(reportKey(link.linkId(), link.responderId()));
        if (props.isForceRelay()) {
            log.info("Link {} forced to relay", link.linkId());
            relayLocked(link);
            return;
        }
        Optional<Session> initiator = registry.find(link.initiatorId());
        Optional<Session> responder = registry.find(link.responderId());
        if (initiator.isEmpty() || responder.isEmpty()) {
            log.debug("Link {} discarded, a peer is gone", link.linkId());
            links.remove(link.linkId());
            linkByPair.remove(link.pairKey(), link.linkId());
            return;
        }
        log.info("Link {} NEGOTIATING ({} <-> {}, attempt {})",
                link.linkId(), link.initiatorId(), link.responderId(), link.attempts());
        sendCandidates(link, initiator.get(), responder.get(), true);
        sendCandidates(link, responder.get(), initiator.get(), false);
        String linkId = link.linkId();
        windows.put(linkId, timers.schedule(props.getNegotiationWindow(), () -> onNegotiationTimeout(linkId)));
    }

    private void relayLocked(PeerLink link) {
        cancelWindow(link.linkId());
        Instant now = clock.instant();
        try {
            String channelId = relay.open(link);
            links.put(link.linkId(), link.relayed(channelId, now));
            metrics.recordRelayed(Duration.between(link.negotiationStartedAt(), now));
        } catch (CapacityException e) {
            log.warn("Link {} FAILED: {}", link.linkId(), e.getMessage());
            links.put(link.linkId(), link.transition(LinkState.FAILED, now));
            metrics.recordFailure();
            sendFailed(link.initiatorId(), link, REASON_RELAY_CAPACITY);
            sendFailed(link.responderId(), link, REASON_RELAY_CAPACITY);
        }
    }

    private void teardown(String sessionId) {
        List<PeerLink> removed = new ArrayList<>();
        synchronized (lock) {
            for (PeerLink link : List.copyOf(links.values())) {
                if (!link.involves(sessionId)) {
                    continue;
                }
                links.remove(link.linkId());
                linkByPair.remove(link.pairKey(), link.linkId());
                reported.remove(reportKey(link.linkId(), link.initiatorId()));
                reported.remove(reportKey(link.linkId(), link.responderId()));
                cancelWindow(link.linkId());
                removed.add(link);
            }
        }
        // el relay y el envío van fuera del candado
        for (PeerLink link : removed) {
            if (link.channelId() != null) {
                relay.close(link.channelId());
            }
            log.info("Link {} torn down ({} left, state was {})", link.linkId(), sessionId, link.state());
            sendFailed(link.peerOf(sessionId), link, REASON_PEER_LEFT);
        }
    }

    private void sendCandidates(PeerLink link, Session to, Session peer, boolean initiator) {
        ProtocolMessage msg = ProtocolMessage.of(MessageType.CANDIDATE_EXCHANGE);
        msg.linkId = link.linkId();
        msg.roomId = link.roomId();
        msg.peerSessionId = peer.sessionId();
        msg.endpoints = peer.candidates();
        msg.initiator = initiator;
        msg.punchDelayMs = initiator ? 0L : props.getResponderDelay().toMillis();
        msg.punchWindowMs = props.getNegotiationWindow().toMillis();
        msg.punchIntervalMs = props.getPunchInterval().toMillis();
        sender.send(to.sessionId(), msg);
    }

    private void sendDirect(PeerLink link, String to) {
        String peer = link.peerOf(to);
        ProtocolMessage msg = ProtocolMessage.of(MessageType.DIRECT_ESTABLISHED);
        msg.linkId = link.linkId();
        msg.peerSessionId = peer;
        msg.endpoint = reported.get(reportKey(link.linkId(), to));
        if (msg.endpoint == null) {
            msg.endpoint = registry.find(peer)
                    .flatMap(s -> s.candidates().stream().filter(e -> e.kind() == EndpointKind.PUBLIC).findFirst())
                    .orElse(null);
        }
        sender.send(to, msg);
    }

    private void sendFailed(String to, PeerLink link, String reason) {
        ProtocolMessage msg = ProtocolMessage.of(MessageType.LINK_FAILED);
        msg.linkId = link.linkId();
        msg.peerSessionId = link.peerOf(to);
        msg.reason = reason;
        sender.send(to, msg);
    }

    private PeerLink resolve(String sessionId, String linkId, String peerSessionId) {
        PeerLink link = null;
        if (linkId != null) {
            link = links.get(linkId);
        } else if (peerSessionId != null) {
            String id = linkByPair.get(PeerLink.pairKey(sessionId, peerSessionId));
            link = id == null ? null : links.get(id);
        }
        return link != null && link.involves(sessionId) ? link : null;
    }

    private void cancelWindow(String linkId) {
        TimerService.Timer t = windows.remove(linkId);
        if (t != null) {
            t.cancel();
        }
    }

    private static String reportKey(String linkId, String sessionId) {
        return linkId + "|" + sessionId;
    }
}
