package edu.eci.arsw.facilitator.relay;

import de.huxhorn.sulky.ulid.ULID;
import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.domain.PeerLink;
import edu.eci.arsw.facilitator.exception.CapacityException;
import edu.eci.arsw.facilitator.protocol.MessageSender;
import edu.eci.arsw.facilitator.protocol.MessageType;
import edu.eci.arsw.facilitator.protocol.ProtocolMessage;
import edu.eci.arsw.facilitator.transport.DeliveryMode;
import edu.eci.arsw.facilitator.transport.TimerService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Retransmite datagramas entre dos sesiones cuando no hubo camino directo.
 *
 * Cada sentido tiene su propia secuencia de relay y el transporte secuencia cada
 * tramo por separado, así que el orden del modo del emisor se conserva por
 * enlace. Sobre la cuota, los datos no fiables se descartan y los fiables esperan
 * en una cola acotada que se vacía cuando rota la ventana.
 */
@Service
public class RelayEngine {
    private static final Logger log = LoggerFactory.getLogger(RelayEngine.class);

    private final MessageSender sender;
    private final TimerService timers;
    private final Clock clock;
    private final FacilitatorProperties.Relay props;
    private final ULID ulid = new ULID();

    private final Object lock = new Object();
    private final Map<String, RelayChannel> channels = new ConcurrentHashMap<>();

    private final Counter forwardedBytes;
    private final Counter forwardedDatagrams;
    private final Counter droppedDatagrams;

    public RelayEngine(MessageSender sender,
                       TimerService timers,
                       Clock clock,
                       FacilitatorProperties props,
                       MeterRegistry meters) {
        this.sender = sender;
        this.timers = timers;
        this.clock = clock;
        this.props = props.getRelay();
        this.forwardedBytes = Counter.builder("facilitator.relay.bytes").register(meters);
        this.forwardedDatagrams = Counter.builder("facilitator.relay.datagrams").register(meters);
        this.droppedDatagrams = Counter.builder("facilitator.relay.dropped").register(meters);
        Gauge.builder("facilitator.relay.channels", channels, Map::size).register(meters);
    }

    /**
     * Abre un canal para el enlace y avisa a ambos extremos con RELAY_ESTABLISHED.
     *
     * @param link enlace que pasa a RELAYED
     * @return id del canal
     * @throws CapacityException si se alcanzó el máximo de enlaces retransmitidos
     */
    public String open(PeerLink link) {
        RelayChannel channel;
        synchronized (lock) {
            if (channels.size() >= props.getMaxLinks()) {
                throw new CapacityException("Máximo de enlaces retransmitidos alcanzado (" + props.getMaxLinks() + ")");
            }
            channel = new RelayChannel(ulid.nextULID(), link.linkId(), link.initiatorId(), link.responderId(),
                    newQuota(), newQuota());
            channels.put(channel.channelId(), channel);
        }
        log.info("Relay channel {} opened for link {} ({} <-> {})",
                channel.channelId(), link.linkId(), link.initiatorId(), link.responderId());
        notifyEstablished(channel, channel.sessionA(), channel.sessionB());
        notifyEstablished(channel, channel.sessionB(), channel.sessionA());
        return channel.channelId();
    }

    /**
     * Reenvía un payload al otro extremo del canal. Un canal inexistente o cerrado,
     * o un emisor que no pertenece al canal, descartan en silencio.
     *
     * @param channelId     canal
     * @param fromSessionId sesión emisora
     * @param payload       datos opacos
     * @param mode          modo de entrega del emisor
     * @return true si se envió o quedó en cola
     */
    public boolean forward(String channelId, String fromSessionId, byte[] payload, DeliveryMode mode) {
        RelayChannel channel = channelId == null ? null : channels.get(channelId);
        if (channel == null || payload == null) {
            log.debug("Relay data for unknown channel {} dropped", channelId);
            return false;
        }
        RelayChannel.Leg leg = channel.legFrom(fromSessionId);
        if (leg == null) {
            log.debug("Session {} is not part of channel {}, dropped", fromSessionId, channelId);
            return false;
        }
        synchronized (channel) {
            if (channel.isClosed()) {
                return false;
            }
            if (leg.backlog.isEmpty() && leg.quota.tryAcquire(payload.length)) {
                emit(channel, leg, payload, mode);
                return true;
            }
            if (!mode.isReliable() || leg.backlog.size() >= props.getBacklogSize()) {
                leg.dropped++;
                droppedDatagrams.increment();
                return false;
            }
            leg.backlog.addLast(new RelayChannel.Queued(payload, mode));
            scheduleDrain(channel, leg);
            return true;
        }
    }

    /**
     * Cierra el canal, libera la cola y cancela su temporizador de vaciado.
     *
     * @param channelId canal
     * @return true si existía
     */
    public boolean close(String channelId) {
        RelayChannel channel = channelId == null ? null : channels.remove(channelId);
        if (channel == null) {
            return false;
        }
        RelayChannel.Stats stats;
        synchronized (channel) {
            channel.markClosed();
            stats = channel.stats();
        }
        log.info("Relay channel {} closed (a->b {} datagrams, b->a {} datagrams)",
                channelId, stats.aToB().datagrams(), stats.bToA().datagrams());
        return true;
    }

    public Optional<RelayChannel> find(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    public List<RelayChannel.Stats> snapshot() {
        return channels.values().stream().map(RelayChannel::stats).toList();
    }

    public int activeChannels() {
        return channels.size();
    }

    private void drain(RelayChannel channel, RelayChannel.Leg leg) {
        synchronized (channel) {
            leg.drainTimer = null;
            if (channel.isClosed()) {
                return;
            }
            while (!leg.backlog.isEmpty() && leg.quota.tryAcquire(leg.backlog.peekFirst().payload().length)) {
                RelayChannel.Queued q = leg.backlog.pollFirst();
                emit(channel, leg, q.payload(), q.mode());
            }
            if (!leg.backlog.isEmpty()) {
                scheduleDrain(channel, leg);
            }
        }
    }

    private void scheduleDrain(RelayChannel channel, RelayChannel.Leg leg) {
        if (leg.drainTimer == null) {
            Duration delay = Duration.ofMillis(leg.quota.millisUntilNextWindow());
            leg.drainTimer = timers.schedule(delay, () -> drain(channel, leg));
        }
    }

    private void emit(RelayChannel channel, RelayChannel.Leg leg, byte[] payload, DeliveryMode mode) {
        ProtocolMessage msg = ProtocolMessage.of(MessageType.RELAY_DATA);
        msg.channelId = channel.channelId();
        msg.peerSessionId = leg.from;
        msg.seq = leg.nextSeq++;
        msg.mode = mode;
        msg.payload = payload;
        sender.send(leg.to, msg, mode);
        leg.datagrams++;
        leg.bytes += payload.length;
        forwardedDatagrams.increment();
        forwardedBytes.increment(payload.length);
    }

    private void notifyEstablished(RelayChannel channel, String to, String peer) {
        ProtocolMessage msg = ProtocolMessage.of(MessageType.RELAY_ESTABLISHED);
        msg.channelId = channel.channelId();
        msg.linkId = channel.linkId();
        msg.peerSessionId = peer;
        sender.send(to, msg);
    }

    private RelayQuota newQuota() {
        return new RelayQuota(clock, props.getDatagramsPerSecond(), props.getBytesPerSecond());
    }
}
