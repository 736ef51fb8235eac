package edu.eci.arsw.facilitator.domain;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.List;

/**
 * Instantánea inmutable de un cliente registrado. El registro de sesiones es el
 * único que crea versiones nuevas.
 *
 * @param sessionId       id único (ULID)
 * @param token           token con el que se registró
 * @param identity        identidad resuelta a partir del token
 * @param name            nombre visible opcional
 * @param roomId          sala actual, o null
 * @param candidates      endpoints candidatos (locales y público observado)
 * @param controlEndpoint endpoint desde el que habla con el Facilitator
 * @param registeredAt    instante de registro
 * @param lastSeen        última actividad
 * @param state           estado de conexión
 */
public record Session(String sessionId,
                      String token,
                      String identity,
                      String name,
                      String roomId,
                      List<Endpoint> candidates,
                      InetSocketAddress controlEndpoint,
                      Instant registeredAt,
                      Instant lastSeen,
                      ConnectionState state) {

    public Session {
        candidates = List.copyOf(candidates);
    }

    public Session withLastSeen(Instant instant) {
        return new Session(sessionId, token, identity, name, roomId, candidates, controlEndpoint,
                registeredAt, instant, state);
    }

    public Session withRoom(String newRoomId) {
        return new Session(sessionId, token, identity, name, newRoomId, candidates, controlEndpoint,
                registeredAt, lastSeen, state);
    }

    public Session withState(ConnectionState newState) {
        return new Session(sessionId, token, identity, name, roomId, candidates, controlEndpoint,
                registeredAt, lastSeen, newState);
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }
}
