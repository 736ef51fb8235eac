package edu.eci.arsw.facilitator.room;

import de.huxhorn.sulky.ulid.ULID;
import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.domain.Room;
import edu.eci.arsw.facilitator.domain.RoomConfig;
import edu.eci.arsw.facilitator.domain.RoomFilter;
import edu.eci.arsw.facilitator.domain.Visibility;
import edu.eci.arsw.facilitator.exception.AlreadyMemberException;
import edu.eci.arsw.facilitator.exception.AuthenticationException;
import edu.eci.arsw.facilitator.exception.CapacityException;
import edu.eci.arsw.facilitator.exception.NotRegisteredException;
import edu.eci.arsw.facilitator.exception.RoomFullException;
import edu.eci.arsw.facilitator.exception.RoomNameTakenException;
import edu.eci.arsw.facilitator.exception.RoomNotFoundException;
import edu.eci.arsw.facilitator.session.SessionClosedEvent;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directorio de salas: creación, membresía, anfitrión y descubrimiento.
 *
 * Una sesión está como máximo en una sala y una sala nunca supera su capacidad.
 * Una sala vacía se conserva durante el periodo de gracia y la elimina
 * {@link #sweepEmptyRooms()}.
 */
@Service
public class RoomDirectory {
    private static final Logger log = LoggerFactory.getLogger(RoomDirectory.class);

    private static final Comparator<Room> OLDEST_FIRST =
            Comparator.comparing(Room::createdAt).thenComparing(Room::roomId);

    private final SessionRegistry registry;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final FacilitatorProperties.Room props;
    private final ULID ulid = new ULID();

    private final Object lock = new Object();
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    /** sesión -> sala */
    private final Map<String, String> membership = new HashMap<>();

    public RoomDirectory(SessionRegistry registry,
                         ApplicationEventPublisher events,
                         Clock clock,
                         FacilitatorProperties props) {
        this.registry = registry;
        this.events = events;
        this.clock = clock;
        this.props = props.getRoom();
    }

    /**
     * Crea una sala vacía.
     *
     * @param config parámetros de la sala
     * @return la sala creada
     * @throws RoomNameTakenException si el nombre ya lo usa una sala viva
     * @throws CapacityException      si se alcanzó el máximo de salas
     */
    public Room createRoom(RoomConfig config) {
        synchronized (lock) {
            Room room = createLocked(config);
            events.publishEvent(new RoomCreatedEvent(room, null));
            return room;
        }
    }

    /**
     * Crea una sala y une al creador, que queda como anfitrión.
     */
    public Room createAndJoin(String sessionId, RoomConfig config) {
        synchronized (lock) {
            requireRegistered(sessionId);
            requireNotMember(sessionId);
            Room room = createLocked(config);
            events.publishEvent(new RoomCreatedEvent(room, sessionId));
            return joinLocked(sessionId, room);
        }
    }

    /**
     * Une una sesión a una sala por id.
     *
     * @param sessionId sesión
     * @param roomId    sala
     * @param password  contraseña, solo para salas PASSWORD
     * @return la sala con el nuevo miembro
     */
    public Room joinRoom(String sessionId, String roomId, String password) {
        synchronized (lock) {
            requireRegistered(sessionId);
            requireNotMember(sessionId);
            Room room = rooms.get(roomId);
            if (room == null) {
                throw new RoomNotFoundException("Sala no encontrada: " + roomId);
            }
            checkPassword(room, password);
            if (room.isFull()) {
                throw new RoomFullException("Sala llena: " + roomId);
            }
            return joinLocked(sessionId, room);
        }
    }

    /**
     * Une una sesión a la sala no privada más antigua que cumpla el criterio y
     * tenga espacio.
     */
    public Room joinMatching(String sessionId, RoomFilter criteria, String password) {
        RoomFilter filter = criteria == null ? RoomFilter.any() : criteria;
        synchronized (lock) {
            requireRegistered(sessionId);
            requireNotMember(sessionId);
            List<Room> matching = rooms.values().stream()
                    .filter(r -> r.visibility() != Visibility.PRIVATE)
                    .filter(filter::matches)
                    .filter(r -> r.visibility() != Visibility.PASSWORD || Objects.equals(r.password(), password))
                    .sorted(OLDEST_FIRST)
                    .toList();
            if (matching.isEmpty()) {
                throw new RoomNotFoundException("Ninguna sala coincide con el criterio");
            }
            return matching.stream()
                    .filter(r -> !r.isFull())
                    .findFirst()
                    .map(r -> joinLocked(sessionId, r))
                    .orElseThrow(() -> new RoomFullException("Todas las salas que coinciden están llenas"));
        }
    }

    /**
     * Saca una sesión de su sala.
     *
     * @param sessionId sesión
     * @return la sala resultante, vacía si la sesión no estaba en ninguna
     */
    public Optional<Room> leaveRoom(String sessionId) {
        synchronized (lock) {
            String roomId = membership.remove(sessionId);
            if (roomId == null) {
                return Optional.empty();
            }
            Room before = rooms.get(roomId);
            if (before == null) {
                return Optional.empty();
            }
            Room after = before.withoutMember(sessionId, clock.instant());
            rooms.put(roomId, after);
            registry.clearRoom(sessionId, roomId);
            log.info("Session {} left room {} ({} members left)", sessionId, roomId, after.members().size());
            events.publishEvent(new MemberLeftEvent(after, sessionId, before.hostSessionId()));
            return Optional.of(after);
        }
    }

    /**
     * Salas visibles (PUBLIC y PASSWORD) que cumplen el filtro, más antiguas primero.
     */
    public List<Room> listRooms(RoomFilter filter) {
        RoomFilter f = filter == null ? RoomFilter.any() : filter;
        return rooms.values().stream()
                .filter(r -> r.visibility() != Visibility.PRIVATE)
                .filter(f::matches)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    public Optional<Room> find(String roomId) {
        return roomId == null ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
    }

    public List<Room> allRooms() {
        return rooms.values().stream().sorted(OLDEST_FIRST).toList();
    }

    public Optional<String> roomOf(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(membership.get(sessionId));
        }
    }

    public int size() {
        return rooms.size();
    }

    /**
     * Elimina las salas que llevan vacías más que el periodo de gracia.
     *
     * @return cantidad de salas eliminadas
     */
    public int sweepEmptyRooms() {
        Duration ttl = props.getEmptyGraceTtl();
        Instant now = clock.instant();
        int removed = 0;
        synchronized (lock) {
            for (Room r : List.copyOf(rooms.values())) {
                if (r.isEmpty() && r.emptySince() != null && !r.emptySince().plus(ttl).isAfter(now)) {
                    rooms.remove(r.roomId());
                    removed++;
                    log.info("Room {} ({}) destroyed after grace period", r.roomId(), r.name());
                }
            }
        }
        return removed;
    }

    @EventListener
    public void onSessionClosed(SessionClosedEvent event) {
        leaveRoom(event.session().sessionId());
    }

    private Room createLocked(RoomConfig config) {
        RoomConfig c = config == null ? new RoomConfig(null, null, null, null, null, null, null) : config;
        if (rooms.size() >= props.getMaxRooms()) {
            throw new CapacityException("Máximo de salas alcanzado (" + props.getMaxRooms() + ")");
        }
        String roomId = ulid.nextULID();
        String name = c.name() == null || c.name().isBlank() ? "room-" + roomId.toLowerCase(Locale.ROOT) : c.name().trim();
        boolean taken = rooms.values().stream()
                .anyMatch(r -> r.name().equalsIgnoreCase(name));
        if (taken) {
            throw new RoomNameTakenException("Ya existe una sala con el nombre " + name);
        }
        Visibility visibility = c.visibility() == null ? Visibility.PUBLIC : c.visibility();
        if (visibility == Visibility.PASSWORD && (c.password() == null || c.password().isEmpty())) {
            throw new IllegalArgumentException("Una sala PASSWORD necesita contraseña");
        }
        Instant now = clock.instant();
        Room room = new Room(roomId, name, clampCapacity(c.capacity()), List.of(), null, now,
                visibility, c.password(), c.sceneUrl(), c.image(), c.info(), now);
        rooms.put(roomId, room);
        log.info("Room created roomId={} name={} capacity={} visibility={}",
                roomId, name, room.capacity(), visibility);
        return room;
    }

    private Room joinLocked(String sessionId, Room room) {
        Room after = room.withMember(sessionId);
        rooms.put(room.roomId(), after);
        membership.put(sessionId, room.roomId());
        registry.assignRoom(sessionId, room.roomId());
        log.info("Session {} joined room {} ({}/{})", sessionId, room.roomId(), after.members().size(), after.capacity());
        events.publishEvent(new MemberJoinedEvent(after, sessionId));
        return after;
    }

    private int clampCapacity(Integer requested) {
        int capacity = requested == null ? props.getDefaultCapacity() : requested;
        return Math.max(1, Math.min(capacity, props.getMaxCapacity()));
    }

    private void requireRegistered(String sessionId) {
        if (registry.find(sessionId).isEmpty()) {
            throw new NotRegisteredException("Sesión desconocida: " + sessionId);
        }
    }

    private void requireNotMember(String sessionId) {
        String current = membership.get(sessionId);
        if (current != null) {
            throw new AlreadyMemberException("La sesión ya está en la sala " + current);
        }
    }

    private static void checkPassword(Room room, String password) {
        if (room.visibility() == Visibility.PASSWORD && !Objects.equals(room.password(), password)) {
            throw new AuthenticationException("Contraseña de sala incorrecta");
        }
    }
}
