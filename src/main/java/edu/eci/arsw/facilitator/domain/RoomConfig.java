package edu.eci.arsw.facilitator.domain;

/**
 * Parámetros para crear una sala.
 *
 * @param name       nombre; si es null se genera
 * @param capacity   capacidad; si es null se usa la configurada por defecto
 * @param visibility visibilidad; PUBLIC si es null
 * @param password   contraseña para salas PASSWORD
 * @param sceneUrl   escena que se va a cargar
 * @param image      imagen asociada
 * @param info       descripción libre
 */
public record RoomConfig(String name,
                         Integer capacity,
                         Visibility visibility,
                         String password,
                         String sceneUrl,
                         String image,
                         String info) {

    public static RoomConfig named(String name, int capacity) {
        return new RoomConfig(name, capacity, Visibility.PUBLIC, null, null, null, null);
    }
}
