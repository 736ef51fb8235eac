package edu.eci.arsw.facilitator.client;

/**
 * Fallo local del cliente: sin conexión, sin respuesta del Facilitator o sin
 * camino hacia un par.
 */
public class ClientException extends RuntimeException {
    public ClientException(String message) {
        super(message);
    }

    public ClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
