package edu.eci.arsw.facilitator.client;

import java.util.List;

/**
 * Resultado de crear o unirse a una sala.
 */
public record JoinedRoom(String roomId, List<String> members, String hostSessionId) {
}
