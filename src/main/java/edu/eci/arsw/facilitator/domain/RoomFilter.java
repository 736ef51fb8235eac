package edu.eci.arsw.facilitator.domain;

import java.util.Locale;

/**
 * Criterio de búsqueda de salas. Los campos null no filtran.
 *
 * @param name          fragmento del nombre, sin distinguir mayúsculas
 * @param sceneUrl      escena exacta
 * @param onlyWithSpace solo salas con hueco libre
 */
public record RoomFilter(String name, String sceneUrl, Boolean onlyWithSpace) {

    public static RoomFilter any() {
        return new RoomFilter(null, null, null);
    }

    public boolean matches(Room room) {
        if (name != null && !name.isBlank()
                && (room.name() == null
                || !room.name().toLowerCase(Locale.ROOT).contains(name.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (sceneUrl != null && !sceneUrl.equals(room.sceneUrl())) {
            return false;
        }
        return !Boolean.TRUE.equals(onlyWithSpace) || !room.isFull();
    }
}
