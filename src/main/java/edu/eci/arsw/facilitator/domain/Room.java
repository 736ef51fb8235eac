package edu.eci.arsw.facilitator.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Instantánea inmutable de una sala. Los miembros están en orden de llegada;
 * ese orden decide el siguiente anfitrión cuando el actual se va.
 */
public record Room(String roomId,
                   String name,
                   int capacity,
                   List<String> members,
                   String hostSessionId,
                   Instant createdAt,
                   Visibility visibility,
                   String password,
                   String sceneUrl,
                   String image,
                   String info,
                   Instant emptySince) {

    public Room {
        members = List.copyOf(members);
    }

    public boolean isFull() {
        return members.size() >= capacity;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean hasMember(String sessionId) {
        return members.contains(sessionId);
    }

    public Room withMember(String sessionId) {
        List<String> next = new ArrayList<>(members);
        next.add(sessionId);
        String host = hostSessionId == null ? sessionId : hostSessionId;
        return new Room(roomId, name, capacity, next, host, createdAt, visibility, password,
                sceneUrl, image, info, null);
    }

    public Room withoutMember(String sessionId, Instant now) {
        List<String> next = new ArrayList<>(members);
        next.remove(sessionId);
        String host = hostSessionId;
        if (sessionId.equals(hostSessionId)) {
            host = next.isEmpty() ? null : next.get(0);
        }
        return new Room(roomId, name, capacity, next, host, createdAt, visibility, password,
                sceneUrl, image, info, next.isEmpty() ? now : null);
    }

    public RoomSummary summary() {
        return new RoomSummary(roomId, name, capacity, members.size(), hostSessionId, visibility,
                sceneUrl, image, info);
    }
}
