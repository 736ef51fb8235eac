package edu.eci.arsw.facilitator.room;

import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.domain.Room;
import edu.eci.arsw.facilitator.domain.RoomConfig;
import edu.eci.arsw.facilitator.domain.RoomFilter;
import edu.eci.arsw.facilitator.domain.Session;
import edu.eci.arsw.facilitator.domain.Visibility;
import edu.eci.arsw.facilitator.exception.AlreadyMemberException;
import edu.eci.arsw.facilitator.exception.AuthenticationException;
import edu.eci.arsw.facilitator.exception.CapacityException;
import edu.eci.arsw.facilitator.exception.NotRegisteredException;
import edu.eci.arsw.facilitator.exception.RoomFullException;
import edu.eci.arsw.facilitator.exception.RoomNameTakenException;
import edu.eci.arsw.facilitator.exception.RoomNotFoundException;
import edu.eci.arsw.facilitator.session.OpaqueTokenAuthenticator;
import edu.eci.arsw.facilitator.session.SessionClosedEvent;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import edu.eci.arsw.facilitator.support.SimulatedTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoomDirectoryTest {

    private SimulatedTime time;
    private FacilitatorProperties props;
    private SessionRegistry registry;
    private RoomDirectory directory;
    private final List<Object> published = new ArrayList<>();
    private int port = 30000;

    @BeforeEach
    void setUp() {
        time = new SimulatedTime();
        props = new FacilitatorProperties();
        props.getRoom().setDefaultCapacity(4);
        props.getRoom().setMaxCapacity(8);
        props.getRoom().setMaxRooms(5);
        props.getRoom().setEmptyGraceTtl(Duration.ofSeconds(30));
        registry = new SessionRegistry(new OpaqueTokenAuthenticator(), e -> {
            published.add(e);
            if (e instanceof SessionClosedEvent closed) {
                directory.onSessionClosed(closed);
            }
        }, time, props);
        directory = new RoomDirectory(registry, e -> {
            synchronized (published) {
                published.add(e);
            }
        }, time, props);
    }

    private String session(String token) {
        Session s = registry.register(token, List.of(), new InetSocketAddress("198.51.100.1", port++), token);
        return s.sessionId();
    }

    private <T> List<T> events(Class<T> type) {
        synchronized (published) {
            return published.stream().filter(type::isInstance).map(type::cast).toList();
        }
    }

    // -------- createAndJoin(...) / joinRoom(...) --------

    @Test
    void joinRoom_deberiaLlenarLaSalaYRechazarAlTercero_casoFeliz1() {
        String a = session("a");
        String b = session("b");
        String c = session("c");
        Room room = directory.createAndJoin(a, RoomConfig.named("lobby", 2));

        Room joined = directory.joinRoom(b, room.roomId(), null);

        assertEquals(List.of(a, b), joined.members());
        assertEquals(a, joined.hostSessionId());
        assertThrows(RoomFullException.class, () -> directory.joinRoom(c, room.roomId(), null));
        assertEquals(2, directory.find(room.roomId()).orElseThrow().members().size());
        assertEquals(room.roomId(), registry.find(b).orElseThrow().roomId());
        assertTrue(registry.find(c).orElseThrow().roomId() == null);
    }

    @Test
    void createAndJoin_deberiaPublicarCreacionYUnion_casoFeliz2() {
        String a = session("a");

        Room room = directory.createAndJoin(a, RoomConfig.named("lobby", 3));

        List<RoomCreatedEvent> created = events(RoomCreatedEvent.class);
        List<MemberJoinedEvent> joined = events(MemberJoinedEvent.class);
        assertEquals(1, created.size());
        assertEquals(a, created.get(0).creatorSessionId());
        assertEquals(1, joined.size());
        assertTrue(joined.get(0).isHost());
        assertEquals(room, joined.get(0).room());
    }

    @Test
    void joinRoom_noDeberiaPasar_cuandoLaSesionYaEstaEnUnaSala() {
        String a = session("a");
        Room r1 = directory.createAndJoin(a, RoomConfig.named("uno", 4));
        directory.createRoom(RoomConfig.named("dos", 4));

        assertThrows(AlreadyMemberException.class, () -> directory.joinRoom(a, r1.roomId(), null));
        assertThrows(AlreadyMemberException.class, () -> directory.createAndJoin(a, RoomConfig.named("tres", 4)));
        assertEquals(r1.roomId(), directory.roomOf(a).orElseThrow());
    }

    @Test
    void joinRoom_noDeberiaPasar_cuandoLaSalaNoExiste() {
        String a = session("a");

        assertThrows(RoomNotFoundException.class, () -> directory.joinRoom(a, "missing", null));
    }

    @Test
    void joinRoom_noDeberiaPasar_cuandoLaSesionNoEstaRegistrada() {
        Room r = directory.createRoom(RoomConfig.named("lobby", 4));

        assertThrows(NotRegisteredException.class, () -> directory.joinRoom("ghost", r.roomId(), null));
    }

    @Test
    void joinRoom_deberiaExigirContrasena_enSalaProtegida() {
        String a = session("a");
        String b = session("b");
        Room r = directory.createAndJoin(a,
                new RoomConfig("secreta", 4, Visibility.PASSWORD, "pw", null, null, null));

        assertThrows(AuthenticationException.class, () -> directory.joinRoom(b, r.roomId(), "mal"));
        assertEquals(2, directory.joinRoom(b, r.roomId(), "pw").members().size());
    }

    @Test
    void joinRoom_deberiaRespetarCapacidadBajoConcurrencia() throws Exception {
        Room r = directory.createRoom(RoomConfig.named("carrera", 3));
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            ids.add(session("s" + i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(10);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (String id : ids) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    directory.joinRoom(id, r.roomId(), null);
                    return true;
                } catch (RoomFullException e) {
                    return false;
                }
            }));
        }
        start.countDown();
        int ok = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) {
                ok++;
            }
        }
        pool.shutdownNow();

        assertEquals(3, ok);
        assertEquals(3, directory.find(r.roomId()).orElseThrow().members().size());
    }

    // -------- createRoom(...) --------

    @Test
    void createRoom_deberiaAjustarCapacidadYGenerarNombre() {
        Room big = directory.createRoom(new RoomConfig(null, 100, null, null, null, null, null));
        Room small = directory.createRoom(new RoomConfig(null, 0, null, null, null, null, null));
        Room def = directory.createRoom(null);

        assertEquals(8, big.capacity());
        assertEquals(1, small.capacity());
        assertEquals(4, def.capacity());
        assertTrue(big.name().startsWith("room-"));
        assertEquals(Visibility.PUBLIC, def.visibility());
        assertTrue(def.isEmpty());
        assertEquals(time.instant(), def.emptySince());
    }

    @Test
    void createRoom_noDeberiaPasar_cuandoElNombreYaExiste() {
        directory.createRoom(RoomConfig.named("Lobby", 4));

        assertThrows(RoomNameTakenException.class, () -> directory.createRoom(RoomConfig.named("lobby", 2)));
    }

    @Test
    void createRoom_noDeberiaPasar_cuandoSeAlcanzaElMaximoDeSalas() {
        for (int i = 0; i < 5; i++) {
            directory.createRoom(RoomConfig.named("r" + i, 2));
        }

        assertThrows(CapacityException.class, () -> directory.createRoom(RoomConfig.named("extra", 2)));
    }

    @Test
    void createRoom_noDeberiaPasar_cuandoSalaProtegidaSinContrasena() {
        assertThrows(IllegalArgumentException.class,
                () -> directory.createRoom(new RoomConfig("x", 2, Visibility.PASSWORD, null, null, null, null)));
    }

    // -------- leaveRoom(...) --------

    @Test
    void leaveRoom_deberiaMigrarAnfitrion_casoFeliz1() {
        String a = session("a");
        String b = session("b");
        String c = session("c");
        Room r = directory.createAndJoin(a, RoomConfig.named("lobby", 4));
        directory.joinRoom(b, r.roomId(), null);
        directory.joinRoom(c, r.roomId(), null);

        Room after = directory.leaveRoom(a).orElseThrow();

        assertEquals(b, after.hostSessionId());
        MemberLeftEvent left = events(MemberLeftEvent.class).get(0);
        assertTrue(left.hostChanged());
        assertEquals(a, left.previousHost());
        assertTrue(directory.roomOf(a).isEmpty());
        assertNull(registry.find(a).orElseThrow().roomId());
    }

    @Test
    void leaveRoom_deberiaDevolverVacio_cuandoNoEstaEnNingunaSala() {
        assertTrue(directory.leaveRoom(session("a")).isEmpty());
    }

    @Test
    void onSessionClosed_deberiaSacarALaSesionDeSuSala() {
        String a = session("a");
        String b = session("b");
        Room r = directory.createAndJoin(a, RoomConfig.named("lobby", 4));
        directory.joinRoom(b, r.roomId(), null);

        registry.unregister(a);

        Room after = directory.find(r.roomId()).orElseThrow();
        assertEquals(List.of(b), after.members());
        assertEquals(b, after.hostSessionId());
    }

    // -------- sweepEmptyRooms() --------

    @Test
    void sweepEmptyRooms_deberiaConservarSalaVaciaDuranteElPeriodoDeGracia() {
        String a = session("a");
        String b = session("b");
        Room r = directory.createAndJoin(a, RoomConfig.named("lobby", 4));
        directory.leaveRoom(a);

        time.advance(Duration.ofSeconds(20));
        assertEquals(0, directory.sweepEmptyRooms());
        directory.joinRoom(b, r.roomId(), null);
        directory.leaveRoom(b);

        time.advance(Duration.ofSeconds(29));
        assertEquals(0, directory.sweepEmptyRooms());
        time.advance(Duration.ofSeconds(1));
        assertEquals(1, directory.sweepEmptyRooms());
        assertTrue(directory.find(r.roomId()).isEmpty());
    }

    @Test
    void sweepEmptyRooms_noDeberiaBorrarSalasConMiembros() {
        directory.createAndJoin(session("a"), RoomConfig.named("lobby", 4));

        time.advance(Duration.ofMinutes(10));

        assertEquals(0, directory.sweepEmptyRooms());
        assertEquals(1, directory.size());
    }

    // -------- listRooms(...) / joinMatching(...) --------

    @Test
    void listRooms_noDeberiaMostrarSalasPrivadas() {
        directory.createRoom(RoomConfig.named("publica", 4));
        directory.createRoom(new RoomConfig("privada", 4, Visibility.PRIVATE, null, null, null, null));
        directory.createRoom(new RoomConfig("clave", 4, Visibility.PASSWORD, "pw", null, null, null));

        List<String> names = directory.listRooms(RoomFilter.any()).stream().map(Room::name).toList();

        assertEquals(List.of("publica", "clave"), names);
        assertEquals(3, directory.allRooms().size());
    }

    @Test
    void joinMatching_deberiaElegirLaSalaMasAntiguaConEspacio() {
        Room first = directory.createRoom(new RoomConfig("arena-1", 1, null, null, "scene://arena", null, null));
        time.advance(Duration.ofSeconds(1));
        Room second = directory.createRoom(new RoomConfig("arena-2", 4, null, null, "scene://arena", null, null));
        time.advance(Duration.ofSeconds(1));
        directory.createRoom(new RoomConfig("arena-3", 4, null, null, "scene://arena", null, null));
        String a = session("a");
        String b = session("b");
        RoomFilter arena = new RoomFilter(null, "scene://arena", null);

        assertEquals(first.roomId(), directory.joinMatching(a, arena, null).roomId());
        assertEquals(second.roomId(), directory.joinMatching(b, arena, null).roomId());
    }

    @Test
    void joinMatching_noDeberiaPasar_cuandoNadaCoincideOTodoEstaLleno() {
        directory.createAndJoin(session("a"), RoomConfig.named("solo", 1));
        directory.createRoom(new RoomConfig("oculta", 4, Visibility.PRIVATE, null, null, null, null));
        String b = session("b");

        assertThrows(RoomFullException.class, () -> directory.joinMatching(b, new RoomFilter("solo", null, null), null));
        assertThrows(RoomNotFoundException.class, () -> directory.joinMatching(b, new RoomFilter("oculta", null, null), null));
    }
}
