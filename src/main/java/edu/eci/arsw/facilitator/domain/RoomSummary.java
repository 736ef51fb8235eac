package edu.eci.arsw.facilitator.domain;

/**
 * Vista pública de una sala para listados; nunca incluye la contraseña.
 */
public record RoomSummary(String roomId,
                          String name,
                          int capacity,
                          int memberCount,
                          String hostSessionId,
                          Visibility visibility,
                          String sceneUrl,
                          String image,
                          String info) {
}
