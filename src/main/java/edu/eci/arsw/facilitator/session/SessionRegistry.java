package edu.eci.arsw.facilitator.session;

import de.huxhorn.sulky.ulid.ULID;
import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.domain.ConnectionState;
import edu.eci.arsw.facilitator.domain.Endpoint;
import edu.eci.arsw.facilitator.domain.EndpointKind;
import edu.eci.arsw.facilitator.domain.Session;
import edu.eci.arsw.facilitator.exception.AuthenticationException;
import edu.eci.arsw.facilitator.exception.CapacityException;
import edu.eci.arsw.facilitator.exception.NotRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro de sesiones conectadas.
 *
 * Las mutaciones se serializan con un candado propio; las lecturas devuelven
 * instantáneas inmutables sin bloquear. Los {@link SessionClosedEvent} se
 * publican después de soltar el candado.
 */
@Service
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final TokenAuthenticator authenticator;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final Duration livenessTimeout;
    private final int maxSessions;
    private final ULID ulid = new ULID();

    private final Object lock = new Object();
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> byToken = new ConcurrentHashMap<>();
    private final Map<InetSocketAddress, String> byEndpoint = new ConcurrentHashMap<>();

    public SessionRegistry(TokenAuthenticator authenticator,
                           ApplicationEventPublisher events,
                           Clock clock,
                           FacilitatorProperties props) {
        this.authenticator = authenticator;
        this.events = events;
        this.clock = clock;
        this.livenessTimeout = props.getSession().getLivenessTimeout();
        this.maxSessions = props.getSession().getMaxSessions();
    }

    /**
     * Registra un cliente. Si el endpoint observado pertenecía a otra sesión, esa
     * sesión se cierra primero (reinicio del cliente).
     *
     * @param token          token de sesión
     * @param localEndpoints endpoints locales declarados por el cliente
     * @param observed       dirección de origen observada
     * @param name           nombre visible, opcional
     * @return la sesión creada
     * @throws AuthenticationException si el token se rechaza o ya tiene una sesión activa
     * @throws CapacityException       si se alcanzó el máximo de sesiones
     */
    public Session register(String token, List<Endpoint> localEndpoints, InetSocketAddress observed, String name) {
        String identity = authenticator.authenticate(token);
        List<SessionClosedEvent> closed = new ArrayList<>();
        Session session;
        try {
            synchronized (lock) {
                if (byToken.containsKey(token)) {
                    throw new AuthenticationException("Token ya vinculado a una sesión activa");
                }
                String previous = byEndpoint.get(observed);
                if (previous != null) {
                    removeLocked(previous).ifPresent(s -> closed.add(new SessionClosedEvent(s, CloseReason.REPLACED)));
                }
                if (sessions.size() >= maxSessions) {
                    throw new CapacityException("Máximo de sesiones alcanzado (" + maxSessions + ")");
                }
                Instant now = clock.instant();
                session = new Session(ulid.nextULID(), token, identity, name, null,
                        candidates(localEndpoints, observed), observed, now, now, ConnectionState.CONNECTED);
                sessions.put(session.sessionId(), session);
                byToken.put(token, session.sessionId());
                byEndpoint.put(observed, session.sessionId());
            }
        } finally {
            closed.forEach(this::publish);
        }
        log.info("Session registered sessionId={} identity={} endpoint={}", session.sessionId(), identity, observed);
        return session;
    }

    /**
     * Actualiza solo la marca de última actividad.
     *
     * @param sessionId id de sesión
     * @return false si la sesión ya no existe
     */
    public boolean touch(String sessionId) {
        synchronized (lock) {
            Session s = sessions.get(sessionId);
            if (s == null) {
                return false;
            }
            sessions.put(sessionId, s.withLastSeen(clock.instant()));
            return true;
        }
    }

    /**
     * Cierra las sesiones cuya última actividad supera el tiempo de vida.
     *
     * @return ids de las sesiones expiradas
     */
    public List<String> expireSweep() {
        Instant deadline = clock.instant().minus(livenessTimeout);
        List<SessionClosedEvent> closed = new ArrayList<>();
        synchronized (lock) {
            for (Session s : List.copyOf(sessions.values())) {
                if (s.lastSeen().isBefore(deadline)) {
                    removeLocked(s.sessionId()).ifPresent(r -> closed.add(new SessionClosedEvent(r, CloseReason.EXPIRED)));
                }
            }
        }
        closed.forEach(e -> log.info("Session expired sessionId={} lastSeen={}",
                e.session().sessionId(), e.session().lastSeen()));
        closed.forEach(this::publish);
        return closed.stream().map(e -> e.session().sessionId()).toList();
    }

    public boolean unregister(String sessionId) {
        return close(sessionId, CloseReason.UNREGISTERED);
    }

    public boolean disconnect(String sessionId, CloseReason reason) {
        return close(sessionId, reason);
    }

    /**
     * Cierra la sesión ligada a un endpoint que el transporte dio por inalcanzable.
     *
     * @param endpoint endpoint de control
     * @return true si había una sesión
     */
    public boolean disconnectEndpoint(InetSocketAddress endpoint) {
        String id = byEndpoint.get(endpoint);
        return id != null && close(id, CloseReason.UNREACHABLE);
    }

    /**
     * Fija la sala de la sesión. Solo lo usa el directorio de salas.
     *
     * @param sessionId id de sesión
     * @param roomId    sala
     * @throws NotRegisteredException si la sesión no existe
     */
    public void assignRoom(String sessionId, String roomId) {
        synchronized (lock) {
            Session s = sessions.get(sessionId);
            if (s == null) {
                throw new NotRegisteredException("Sesión desconocida: " + sessionId);
            }
            sessions.put(sessionId, s.withRoom(roomId));
        }
    }

    /**
     * Quita la sala de la sesión si sigue siendo {@code roomId}.
     */
    public void clearRoom(String sessionId, String roomId) {
        synchronized (lock) {
            Session s = sessions.get(sessionId);
            if (s != null && roomId.equals(s.roomId())) {
                sessions.put(sessionId, s.withRoom(null));
            }
        }
    }

    public Optional<Session> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<Session> findByEndpoint(InetSocketAddress endpoint) {
        String id = byEndpoint.get(endpoint);
        return id == null ? Optional.empty() : find(id);
    }

    public Collection<Session> activeSessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    private boolean close(String sessionId, CloseReason reason) {
        Optional<Session> removed;
        synchronized (lock) {
            removed = removeLocked(sessionId);
        }
        removed.ifPresent(s -> {
            log.info("Session closed sessionId={} reason={}", sessionId, reason);
            publish(new SessionClosedEvent(s, reason));
        });
        return removed.isPresent();
    }

    private Optional<Session> removeLocked(String sessionId) {
        Session s = sessions.remove(sessionId);
        if (s == null) {
            return Optional.empty();
        }
        byToken.remove(s.token(), sessionId);
        byEndpoint.remove(s.controlEndpoint(), sessionId);
        return Optional.of(s.withState(ConnectionState.DISCONNECTED));
    }

    private void publish(SessionClosedEvent event) {
        try {
            events.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("SessionClosedEvent listener failed for sessionId={}", event.session().sessionId(), e);
        }
    }

    private static List<Endpoint> candidates(List<Endpoint> localEndpoints, InetSocketAddress observed) {
        List<Endpoint> out = new ArrayList<>();
        if (localEndpoints != null) {
            for (Endpoint e : localEndpoints) {
                if (e != null) {
                    out.add(new Endpoint(e.address(), e.port(), e.transport(), EndpointKind.LOCAL));
                }
            }
        }
        Endpoint observedEndpoint = Endpoint.of(observed, EndpointKind.PUBLIC);
        out.removeIf(observedEndpoint::sameTarget);
        out.add(observedEndpoint);
        return out;
    }
}
