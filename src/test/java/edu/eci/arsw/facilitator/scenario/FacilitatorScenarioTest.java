package edu.eci.arsw.facilitator.scenario;

import edu.eci.arsw.facilitator.client.FacilitatorClient;
import edu.eci.arsw.facilitator.client.JoinedRoom;
import edu.eci.arsw.facilitator.client.PeerEvent;
import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.domain.LinkState;
import edu.eci.arsw.facilitator.domain.PeerLink;
import edu.eci.arsw.facilitator.domain.RoomConfig;
import edu.eci.arsw.facilitator.domain.RoomFilter;
import edu.eci.arsw.facilitator.domain.RoomSummary;
import edu.eci.arsw.facilitator.exception.AuthenticationException;
import edu.eci.arsw.facilitator.exception.RoomFullException;
import edu.eci.arsw.facilitator.metrics.NegotiationMetrics;
import edu.eci.arsw.facilitator.protocol.ProtocolCodec;
import edu.eci.arsw.facilitator.relay.RelayEngine;
import edu.eci.arsw.facilitator.rendezvous.RendezvousCoordinator;
import edu.eci.arsw.facilitator.room.MemberJoinedEvent;
import edu.eci.arsw.facilitator.room.MemberLeftEvent;
import edu.eci.arsw.facilitator.room.RoomCreatedEvent;
import edu.eci.arsw.facilitator.room.RoomDirectory;
import edu.eci.arsw.facilitator.server.MessageDispatcher;
import edu.eci.arsw.facilitator.server.RoomNotifier;
import edu.eci.arsw.facilitator.server.SessionMessenger;
import edu.eci.arsw.facilitator.session.OpaqueTokenAuthenticator;
import edu.eci.arsw.facilitator.session.SessionClosedEvent;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import edu.eci.arsw.facilitator.support.InMemoryNetwork;
import edu.eci.arsw.facilitator.support.SimulatedTime;
import edu.eci.arsw.facilitator.transport.DeliveryMode;
import edu.eci.arsw.facilitator.transport.InboundMessage;
import edu.eci.arsw.facilitator.transport.ReliableTransport;
import edu.eci.arsw.facilitator.transport.TransportListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Flujos completos cliente-servidor sobre la red en memoria y el reloj simulado.
 * Los eventos se encaminan a mano en el mismo orden que usa el contexto de Spring.
 */
class FacilitatorScenarioTest {

    private static final Duration STEP = Duration.ofMillis(50);

    private InMemoryNetwork net;
    private SimulatedTime time;
    private FacilitatorProperties props;

    private SessionRegistry registry;
    private RoomDirectory directory;
    private RelayEngine relay;
    private RendezvousCoordinator coordinator;
    private RoomNotifier notifier;
    private MessageDispatcher dispatcher;
    private ReliableTransport serverTransport;
    private InetSocketAddress serverAddress;

    private final List<FacilitatorClient> clients = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        net = new InMemoryNetwork(11L);
        time = new SimulatedTime();
        props = new FacilitatorProperties();
        props.getSession().setLivenessTimeout(Duration.ofSeconds(30));
        props.getRendezvous().setNegotiationWindow(Duration.ofSeconds(5));
        props.getRendezvous().setResponderDelay(Duration.ofMillis(100));
        props.getRendezvous().setPunchInterval(Duration.ofMillis(250));

        InMemoryNetwork.Node serverNode = net.endpoint("203.0.113.1", 3478);
        serverAddress = serverNode.localAddress();
        serverTransport = new ReliableTransport(serverNode, time, time, STEP, 8, 64);
        ProtocolCodec codec = new ProtocolCodec();
        SimpleMeterRegistry meters = new SimpleMeterRegistry();

        registry = new SessionRegistry(new OpaqueTokenAuthenticator(), this::publish, time, props);
        directory = new RoomDirectory(registry, this::publish, time, props);
        SessionMessenger messenger = new SessionMessenger(registry, serverTransport, codec);
        relay = new RelayEngine(messenger, time, time, props, meters);
        coordinator = new RendezvousCoordinator(registry, relay, messenger, time, time,
                new NegotiationMetrics(meters, time), props);
        notifier = new RoomNotifier(messenger, registry);
        dispatcher = new MessageDispatcher(registry, directory, coordinator, relay, serverTransport, codec, time, props);

        serverTransport.setListener(new TransportListener() {
            @Override
            public void onMessage(InboundMessage message) {
                dispatcher.dispatch(message);
            }

            @Override
            public void onPeerUnreachable(InetSocketAddress peer) {
                dispatcher.onPeerUnreachable(peer);
            }
        });
        serverTransport.start();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(FacilitatorClient::close);
        serverTransport.stop();
        net.close();
    }

    private void publish(Object event) {
        if (event instanceof RoomCreatedEvent e) {
            notifier.onRoomCreated(e);
        } else if (event instanceof MemberJoinedEvent e) {
            notifier.onMemberJoined(e);
            coordinator.onMemberJoined(e);
        } else if (event instanceof MemberLeftEvent e) {
            notifier.onMemberLeft(e);
            coordinator.onMemberLeft(e);
        } else if (event instanceof SessionClosedEvent e) {
            directory.onSessionClosed(e);
            dispatcher.onSessionClosed(e);
        }
    }

    private FacilitatorClient client(String ip, List<PeerEvent> events) {
        InMemoryNetwork.Node node = net.endpoint(ip, 40000);
        ReliableTransport transport = new ReliableTransport(node, time, time, STEP, 8, 64);
        FacilitatorClient c = new FacilitatorClient(transport, serverAddress, time,
                Duration.ofSeconds(10), Duration.ofSeconds(5));
        c.addListener(events::add);
        clients.add(c);
        return c;
    }

    private void pumpUntil(BooleanSupplier done, Duration limit) {
        long steps = limit.toMillis() / STEP.toMillis();
        for (long i = 0; i < steps && !done.getAsBoolean(); i++) {
            net.awaitIdle();
            if (!done.getAsBoolean()) {
                time.advance(STEP);
            }
        }
        net.awaitIdle();
        assertTrue(done.getAsBoolean(), "la condición no se cumplió en " + limit);
    }

    private void pump(Duration total) {
        long steps = total.toMillis() / STEP.toMillis();
        for (long i = 0; i < steps; i++) {
            net.awaitIdle();
            time.advance(STEP);
        }
        net.awaitIdle();
    }

    private static List<PeerEvent> ofType(List<PeerEvent> events, PeerEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    private static boolean has(List<PeerEvent> events, PeerEvent.Type type) {
        return !ofType(events, type).isEmpty();
    }

    // -------- conexión directa --------

    @Test
    void dosPares_deberianQuedarEnConexionDirectaEIntercambiarDatos_casoFeliz1() {
        List<PeerEvent> eventsA = new CopyOnWriteArrayList<>();
        List<PeerEvent> eventsB = new CopyOnWriteArrayList<>();
        FacilitatorClient a = client("198.51.100.10", eventsA);
        FacilitatorClient b = client("198.51.100.20", eventsB);

        String idA = a.connect("alice", "Alice", List.of());
        String idB = b.connect("bob", "Bob", List.of());
        assertEquals("198.51.100.10", a.observedEndpoint().address());

        JoinedRoom created = a.createRoom(RoomConfig.named("lobby", 4));
        JoinedRoom joined = b.joinRoom(created.roomId());
        assertEquals(List.of(idA, idB), joined.members());
        assertEquals(idA, joined.hostSessionId());

        pumpUntil(() -> a.isDirect(idB).isPresent() && b.isDirect(idA).isPresent(), Duration.ofSeconds(2));

        assertEquals(Optional.of(true), a.isDirect(idB));
        assertEquals(Optional.of(true), b.isDirect(idA));
        PeerLink link = coordinator.findBetween(idA, idB).orElseThrow();
        assertEquals(LinkState.DIRECT, link.state());
        assertEquals(0, relay.activeChannels());
        assertEquals(idB, ofType(eventsA, PeerEvent.Type.PEER_JOINED).get(0).peerSessionId());

        a.sendToPeer(idB, "hola".getBytes(StandardCharsets.UTF_8), DeliveryMode.RELIABLE_ORDERED);
        pumpUntil(() -> has(eventsB, PeerEvent.Type.PEER_DATA), Duration.ofSeconds(1));

        PeerEvent data = ofType(eventsB, PeerEvent.Type.PEER_DATA).get(0);
        assertEquals(idA, data.peerSessionId());
        assertEquals("hola", new String(data.payload(), StandardCharsets.UTF_8));
    }

    // -------- relay --------

    @Test
    void dosPares_deberianCaerAlRelay_cuandoElTraficoEntreEllosSeBloquea() {
        List<PeerEvent> eventsA = new CopyOnWriteArrayList<>();
        List<PeerEvent> eventsB = new CopyOnWriteArrayList<>();
        FacilitatorClient a = client("198.51.100.10", eventsA);
        FacilitatorClient b = client("198.51.100.20", eventsB);
        Set<String> peers = Set.of("198.51.100.10", "198.51.100.20");
        net.dropWhen((from, to) -> peers.contains(from.getAddress().getHostAddress())
                && peers.contains(to.getAddress().getHostAddress()));

        String idA = a.connect("alice");
        String idB = b.connect("bob");
        String roomId = a.createRoom(RoomConfig.named("lobby", 4)).roomId();
        b.joinRoom(roomId);

        pump(Duration.ofMillis(4900));
        assertEquals(LinkState.NEGOTIATING, coordinator.findBetween(idA, idB).orElseThrow().state());

        pumpUntil(() -> a.isDirect(idB).isPresent() && b.isDirect(idA).isPresent(), Duration.ofSeconds(1));

        assertEquals(Optional.of(false), a.isDirect(idB));
        assertEquals(Optional.of(false), b.isDirect(idA));
        assertEquals(LinkState.RELAYED, coordinator.findBetween(idA, idB).orElseThrow().state());
        assertTrue(has(eventsA, PeerEvent.Type.LINK_RELAYED));

        byte[] payload = new byte[256];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }
        b.sendToPeer(idA, payload, DeliveryMode.RELIABLE_ORDERED);
        pumpUntil(() -> has(eventsA, PeerEvent.Type.PEER_DATA), Duration.ofSeconds(1));

        PeerEvent data = ofType(eventsA, PeerEvent.Type.PEER_DATA).get(0);
        assertEquals(idB, data.peerSessionId());
        assertArrayEquals(payload, data.payload());
        assertEquals(1, relay.snapshot().get(0).bToA().datagrams() + relay.snapshot().get(0).aToB().datagrams());
    }

    @Test
    void relay_deberiaEntregarEnOrdenExacto_cuandoLaRedPierdeDuplicaYReordena() {
        List<PeerEvent> eventsA = new CopyOnWriteArrayList<>();
        FacilitatorClient a = client("198.51.100.10", eventsA);
        FacilitatorClient b = client("198.51.100.20", new CopyOnWriteArrayList<>());
        props.getRendezvous().setForceRelay(true);

        String idA = a.connect("alice");
        String idB = b.connect("bob");
        b.joinRoom(a.createRoom(RoomConfig.named("lobby", 2)).roomId());
        pumpUntil(() -> a.isDirect(idB).isPresent() && b.isDirect(idA).isPresent(), Duration.ofSeconds(1));
        assertEquals(Optional.of(false), b.isDirect(idA));

        net.setLossRate(0.2);
        net.setDuplicateRate(0.1);
        net.setReorderRate(0.2);
        for (int i = 0; i < 100; i++) {
            b.sendToPeer(idA, ("m" + i).getBytes(StandardCharsets.UTF_8), DeliveryMode.RELIABLE_ORDERED);
        }
        for (int i = 0; i < 400 && ofType(eventsA, PeerEvent.Type.PEER_DATA).size() < 100; i++) {
            net.awaitIdle();
            net.flushHeld();
            time.advance(STEP);
        }
        net.awaitIdle();

        List<PeerEvent> data = ofType(eventsA, PeerEvent.Type.PEER_DATA);
        List<String> received = data.stream()
                .map(e -> new String(e.payload(), StandardCharsets.UTF_8))
                .toList();
        List<String> expected = IntStream.range(0, 100).mapToObj(i -> "m" + i).toList();
        assertEquals(expected, received);
        assertTrue(data.stream().allMatch(e -> idB.equals(e.peerSessionId())));
    }

    // -------- expiración --------

    @Test
    void parSilencioso_deberiaExpirarYDerribarElCanal() {
        List<PeerEvent> eventsA = new CopyOnWriteArrayList<>();
        FacilitatorClient a = client("198.51.100.10", eventsA);
        FacilitatorClient b = client("198.51.100.20", new CopyOnWriteArrayList<>());
        props.getRendezvous().setForceRelay(true);

        String idA = a.connect("alice");
        String idB = b.connect("bob");
        b.joinRoom(a.createRoom(RoomConfig.named("lobby", 2)).roomId());
        pumpUntil(() -> a.isDirect(idB).isPresent(), Duration.ofSeconds(1));
        assertEquals(1, relay.activeChannels());

        b.close();
        pump(Duration.ofSeconds(31));
        List<String> expired = registry.expireSweep();
        net.awaitIdle();
        pumpUntil(() -> has(eventsA, PeerEvent.Type.LINK_FAILED), Duration.ofSeconds(1));

        assertEquals(List.of(idB), expired);
        assertTrue(registry.find(idA).isPresent());
        assertEquals(0, relay.activeChannels());
        assertTrue(coordinator.links().isEmpty());
        assertEquals(idB, ofType(eventsA, PeerEvent.Type.PEER_LEFT).get(0).peerSessionId());
        assertEquals("PEER_LEFT", ofType(eventsA, PeerEvent.Type.LINK_FAILED).get(0).reason());
        assertEquals(Optional.empty(), a.isDirect(idB));
        assertEquals(List.of(idA), directory.find(a.roomId()).orElseThrow().members());
    }

    @Test
    void bajaLimpia_deberiaLiberarElEstadoDelEndpointTrasElBarrido() {
        FacilitatorClient a = client("198.51.100.10", new CopyOnWriteArrayList<>());
        a.connect("alice");
        assertEquals(Set.of(new InetSocketAddress("198.51.100.10", 40000)), serverTransport.knownPeers());

        a.disconnect();
        pump(Duration.ofSeconds(31));
        dispatcher.sweepIdleEndpoints();

        assertEquals(0, registry.size());
        assertTrue(serverTransport.knownPeers().isEmpty());
        assertTrue(((Map<?, ?>) ReflectionTestUtils.getField(dispatcher, "limiters")).isEmpty());
    }

    // -------- salas --------

    @Test
    void salirDeLaSala_deberiaMigrarElAnfitrionYAvisarAlResto() {
        List<PeerEvent> eventsB = new CopyOnWriteArrayList<>();
        FacilitatorClient a = client("198.51.100.10", new CopyOnWriteArrayList<>());
        FacilitatorClient b = client("198.51.100.20", eventsB);
        props.getRendezvous().setForceRelay(true);

        String idA = a.connect("alice");
        String idB = b.connect("bob");
        b.joinRoom(a.createRoom(RoomConfig.named("lobby", 4)).roomId());

        a.leaveRoom();
        pumpUntil(() -> has(eventsB, PeerEvent.Type.HOST_CHANGED), Duration.ofSeconds(1));

        assertNull(a.roomId());
        assertEquals(idA, ofType(eventsB, PeerEvent.Type.PEER_LEFT).get(0).peerSessionId());
        assertEquals(idB, ofType(eventsB, PeerEvent.Type.HOST_CHANGED).get(0).peerSessionId());
        assertEquals(0, relay.activeChannels());
    }

    @Test
    void unirsePorCriterios_deberiaEncontrarLaSalaListada() {
        FacilitatorClient a = client("198.51.100.10", new CopyOnWriteArrayList<>());
        FacilitatorClient b = client("198.51.100.20", new CopyOnWriteArrayList<>());
        a.connect("alice");
        b.connect("bob");
        String roomId = a.createRoom(new RoomConfig("museo", 3, null, null, "museo.glb", null, null)).roomId();

        List<RoomSummary> listed = b.listRooms(new RoomFilter(null, "museo.glb", true));
        JoinedRoom joined = b.joinRoom(new RoomFilter("mus", null, true));

        assertEquals(1, listed.size());
        assertEquals(roomId, listed.get(0).roomId());
        assertEquals(roomId, joined.roomId());
        assertEquals(2, joined.members().size());
    }

    @Test
    void connect_noDeberiaPasar_cuandoElTokenYaEstaEnUso() {
        FacilitatorClient a = client("198.51.100.10", new CopyOnWriteArrayList<>());
        FacilitatorClient b = client("198.51.100.20", new CopyOnWriteArrayList<>());
        a.connect("alice");

        assertThrows(AuthenticationException.class, () -> b.connect("alice"));
        assertEquals(1, registry.size());
    }

    @Test
    void joinRoom_noDeberiaPasar_cuandoLaSalaEstaLlena() {
        FacilitatorClient a = client("198.51.100.10", new CopyOnWriteArrayList<>());
        FacilitatorClient b = client("198.51.100.20", new CopyOnWriteArrayList<>());
        FacilitatorClient c = client("198.51.100.30", new CopyOnWriteArrayList<>());
        a.connect("alice");
        b.connect("bob");
        String idC = c.connect("carol");
        String roomId = a.createRoom(RoomConfig.named("duo", 2)).roomId();
        b.joinRoom(roomId);

        assertThrows(RoomFullException.class, () -> c.joinRoom(roomId));
        assertNull(c.roomId());
        assertEquals(2, directory.find(roomId).orElseThrow().members().size());
        assertNull(registry.find(idC).orElseThrow().roomId());
    }
}
