package edu.eci.arsw.facilitator.transport;

import edu.eci.arsw.facilitator.support.InMemoryNetwork;
import edu.eci.arsw.facilitator.support.SimulatedTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ReliableTransportTest {

    private static final Duration BASE = Duration.ofMillis(10);

    private InMemoryNetwork net;
    private SimulatedTime time;
    private InMemoryNetwork.Node nodeA;
    private InMemoryNetwork.Node nodeB;
    private ReliableTransport a;
    private ReliableTransport b;
    private final List<String> receivedByB = new CopyOnWriteArrayList<>();
    private final List<InetSocketAddress> unreachable = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        net = new InMemoryNetwork(7L);
        time = new SimulatedTime();
        nodeA = net.endpoint("10.0.0.1", 4000);
        nodeB = net.endpoint("10.0.0.2", 5000);
        a = transport(nodeA, 20);
        b = transport(nodeB, 20);
        a.setListener(new TransportListener() {
            @Override
            public void onMessage(InboundMessage message) {
            }

            @Override
            public void onPeerUnreachable(InetSocketAddress peer) {
                unreachable.add(peer);
            }
        });
        b.setListener(m -> receivedByB.add(new String(m.payload(), StandardCharsets.UTF_8)));
        a.start();
        b.start();
    }

    @AfterEach
    void tearDown() {
        net.close();
    }

    private ReliableTransport transport(InMemoryNetwork.Node node, int maxAttempts) {
        return new ReliableTransport(node, time, time, BASE, maxAttempts, 64);
    }

    private void send(ReliableTransport from, InMemoryNetwork.Node to, String text, DeliveryMode mode) {
        from.send(to.localAddress(), text.getBytes(StandardCharsets.UTF_8), mode);
    }

    private void runUntil(BooleanSupplier done) {
        for (int i = 0; i < 20_000 && !done.getAsBoolean(); i++) {
            net.awaitIdle();
            net.flushHeld();
            net.awaitIdle();
            if (!done.getAsBoolean()) {
                time.advance(BASE);
            }
        }
        net.awaitIdle();
    }

    // -------- send(...) RELIABLE_ORDERED --------

    @Test
    void send_ordenado_deberiaEntregarUnaVezYEnOrden_conPerdidaDuplicadosYDesorden() {
        net.setLossRate(0.2);
        net.setDuplicateRate(0.1);
        net.setReorderRate(0.2);
        List<String> expected = IntStream.range(0, 100).mapToObj(i -> "m-" + i).toList();

        expected.forEach(m -> send(a, nodeB, m, DeliveryMode.RELIABLE_ORDERED));
        runUntil(() -> receivedByB.size() >= expected.size() && a.pendingCount(nodeB.localAddress()) == 0);

        assertEquals(expected, new ArrayList<>(receivedByB));
        assertEquals(0, a.pendingCount(nodeB.localAddress()));
        assertTrue(unreachable.isEmpty());
    }

    @Test
    void send_ordenado_deberiaEntregarSinRetransmitir_enRedPerfecta_casoFeliz2() {
        send(a, nodeB, "uno", DeliveryMode.RELIABLE_ORDERED);
        send(a, nodeB, "dos", DeliveryMode.RELIABLE_ORDERED);
        net.awaitIdle();

        assertEquals(List.of("uno", "dos"), receivedByB);
        assertEquals(0, a.pendingCount(nodeB.localAddress()));
        assertEquals(4, net.sentCount());
    }

    // -------- send(...) RELIABLE_UNORDERED / UNRELIABLE --------

    @Test
    void send_noOrdenado_deberiaEntregarTodoExactamenteUnaVez() {
        net.setLossRate(0.15);
        net.setDuplicateRate(0.2);
        net.setReorderRate(0.3);
        Set<String> expected = new HashSet<>();
        for (int i = 0; i < 60; i++) {
            expected.add("u-" + i);
            send(a, nodeB, "u-" + i, DeliveryMode.RELIABLE_UNORDERED);
        }

        runUntil(() -> receivedByB.size() >= expected.size() && a.pendingCount(nodeB.localAddress()) == 0);

        assertEquals(expected.size(), receivedByB.size());
        assertEquals(expected, new HashSet<>(receivedByB));
    }

    @Test
    void send_noFiable_noDeberiaRetransmitir_cuandoSePierde() {
        net.dropWhen((from, to) -> to.equals(nodeB.localAddress()));

        send(a, nodeB, "hola", DeliveryMode.UNRELIABLE);
        time.advance(Duration.ofSeconds(10));
        net.awaitIdle();

        assertTrue(receivedByB.isEmpty());
        assertEquals(1, net.sentCount());
        assertEquals(0, a.pendingCount(nodeB.localAddress()));
    }

    // -------- retransmisión agotada --------

    @Test
    void send_deberiaReportarParInalcanzable_cuandoSeAgotanLosIntentos() {
        ReliableTransport shortLived = transport(net.endpoint("10.0.0.3", 6000), 3);
        List<InetSocketAddress> lost = new CopyOnWriteArrayList<>();
        shortLived.setListener(new TransportListener() {
            @Override
            public void onMessage(InboundMessage message) {
            }

            @Override
            public void onPeerUnreachable(InetSocketAddress peer) {
                lost.add(peer);
            }
        });
        shortLived.start();
        net.isolate(nodeB.localAddress());

        shortLived.send(nodeB.localAddress(), new byte[]{1}, DeliveryMode.RELIABLE_ORDERED);
        time.advance(Duration.ofSeconds(1));
        net.awaitIdle();

        assertEquals(List.of(nodeB.localAddress()), lost);
        assertEquals(0, shortLived.pendingCount(nodeB.localAddress()));
        assertEquals(0, time.pendingTasks());
    }

    @Test
    void forget_deberiaCancelarRetransmisionesPendientes() {
        net.isolate(nodeB.localAddress());
        send(a, nodeB, "x", DeliveryMode.RELIABLE_ORDERED);
        assertEquals(1, a.pendingCount(nodeB.localAddress()));

        a.forget(nodeB.localAddress());
        time.advance(Duration.ofSeconds(30));

        assertEquals(0, a.pendingCount(nodeB.localAddress()));
        assertTrue(unreachable.isEmpty());
    }

    // -------- épocas de conexión --------

    @Test
    void onDatagram_deberiaReiniciarEstado_cuandoElParCambiaDeEpoca() {
        send(a, nodeB, "antes-0", DeliveryMode.RELIABLE_ORDERED);
        send(a, nodeB, "antes-1", DeliveryMode.RELIABLE_ORDERED);
        net.awaitIdle();

        nodeA.shutdown();
        InMemoryNetwork.Node restarted = net.endpoint("10.0.0.1", 4000);
        ReliableTransport a2 = transport(restarted, 20);
        a2.start();
        send(a2, nodeB, "despues-0", DeliveryMode.RELIABLE_ORDERED);
        net.awaitIdle();

        assertEquals(List.of("antes-0", "antes-1", "despues-0"), receivedByB);
        assertEquals(0, a2.pendingCount(nodeB.localAddress()));
    }

    @Test
    void lastReceived_deberiaMarcarLaUltimaRecepcion_casoFeliz1() {
        assertTrue(b.lastReceived(nodeA.localAddress()).isEmpty());

        send(a, nodeB, "ping", DeliveryMode.UNRELIABLE);
        net.awaitIdle();

        assertEquals(time.instant(), b.lastReceived(nodeA.localAddress()).orElseThrow());
    }

    @Test
    void onDatagram_noDeberiaPasar_cuandoElDatagramaEstaMalFormado() {
        InMemoryNetwork.Node raw = net.endpoint("10.0.0.9", 1);
        raw.start();

        raw.send(nodeB.localAddress(), new byte[]{0x7F, 0x00, 0x01});
        net.awaitIdle();

        assertTrue(receivedByB.isEmpty());
        assertTrue(b.lastReceived(raw.localAddress()).isEmpty());
    }
}
