package edu.eci.arsw.facilitator.api;

import edu.eci.arsw.facilitator.domain.LinkState;
import edu.eci.arsw.facilitator.domain.PeerLink;
import edu.eci.arsw.facilitator.domain.Room;
import edu.eci.arsw.facilitator.domain.RoomFilter;
import edu.eci.arsw.facilitator.domain.RoomSummary;
import edu.eci.arsw.facilitator.metrics.NegotiationMetrics;
import edu.eci.arsw.facilitator.relay.RelayEngine;
import edu.eci.arsw.facilitator.rendezvous.RendezvousCoordinator;
import edu.eci.arsw.facilitator.room.RoomDirectory;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * API REST de solo lectura para operar el Facilitator.
 */
@RestController
@RequestMapping("/api/facilitator")
public class FacilitatorAdminController {

    private final SessionRegistry registry;
    private final RoomDirectory directory;
    private final RendezvousCoordinator coordinator;
    private final RelayEngine relay;
    private final NegotiationMetrics metrics;

    public FacilitatorAdminController(SessionRegistry registry,
                                      RoomDirectory directory,
                                      RendezvousCoordinator coordinator,
                                      RelayEngine relay,
                                      NegotiationMetrics metrics) {
        this.registry = registry;
        this.directory = directory;
        this.coordinator = coordinator;
        this.relay = relay;
        this.metrics = metrics;
    }

    /**
     * Lista las salas visibles.
     *
     * @param name     fragmento del nombre, opcional
     * @param sceneUrl escena, opcional
     * @return resúmenes de sala
     */
    @GetMapping("/rooms")
    public List<RoomSummary> rooms(@RequestParam(required = false) String name,
                                   @RequestParam(required = false) String sceneUrl) {
        return directory.listRooms(new RoomFilter(name, sceneUrl, null)).stream()
                .map(Room::summary)
                .toList();
    }

    /**
     * Detalle de una sala, incluidas las privadas, con el estado de sus enlaces.
     *
     * @param roomId id de la sala
     * @return detalle
     */
    @GetMapping("/rooms/{roomId}")
    public Map<String, Object> room(@PathVariable String roomId) {
        Room room = directory.find(roomId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Sala no encontrada"));
        List<Map<String, Object>> links = coordinator.linksOfRoom(roomId).stream()
                .map(FacilitatorAdminController::linkView)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("room", room.summary());
        body.put("members", room.members());
        body.put("createdAt", room.createdAt().toString());
        body.put("links", links);
        return body;
    }

    /**
     * Estadísticas globales del servicio.
     *
     * @return sesiones, salas, enlaces por estado, canales de relay y métricas de negociación
     */
    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<LinkState, Long> byState = new EnumMap<>(LinkState.class);
        for (LinkState s : LinkState.values()) {
            byState.put(s, 0L);
        }
        for (PeerLink l : coordinator.links()) {
            byState.merge(l.state(), 1L, Long::sum);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessions", registry.size());
        body.put("rooms", directory.size());
        body.put("links", byState);
        body.put("relayChannels", relay.activeChannels());
        body.put("relay", relay.snapshot());
        body.put("negotiation", metrics.snapshot());
        return body;
    }

    private static Map<String, Object> linkView(PeerLink l) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("linkId", l.linkId());
        m.put("initiator", l.initiatorId());
        m.put("responder", l.responderId());
        m.put("state", l.state());
        m.put("attempts", l.attempts());
        if (l.channelId() != null) {
            m.put("channelId", l.channelId());
        }
        return m;
    }
}
