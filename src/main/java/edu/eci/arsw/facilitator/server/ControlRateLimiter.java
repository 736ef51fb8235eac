package edu.eci.arsw.facilitator.server;

import java.time.Clock;

/**
 * Limitador de tasa simple para los mensajes de control de un endpoint.
 */
public class ControlRateLimiter {
    private final int limitPerSecond;
    private final Clock clock;
    private int counter;
    private long windowEpoch;

    /**
     * Crea un limitador con el límite especificado por segundo.
     *
     * @param limitPerSecond Límite de mensajes por segundo.
     * @param clock          Reloj con el que se mide la ventana.
     */
    public ControlRateLimiter(int limitPerSecond, Clock clock) {
        this.limitPerSecond = limitPerSecond;
        this.clock = clock;
        this.windowEpoch = clock.instant().getEpochSecond();
    }

    /**
     * Intenta adquirir un permiso para procesar un mensaje.
     *
     * @return true si se adquirió el permiso, false si se excedió el límite.
     */
    public synchronized boolean tryAcquire() {
        long now = clock.instant().getEpochSecond();
        if (now != windowEpoch) {
            windowEpoch = now;
            counter = 0;
        }
        return ++counter <= limitPerSecond;
    }
}
