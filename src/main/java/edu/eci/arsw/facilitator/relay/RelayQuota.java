package edu.eci.arsw.facilitator.relay;

import java.time.Clock;

/**
 * Cuota por ventanas de un segundo sobre datagramas y bytes.
 *
 * Un datagrama más grande que la cuota de bytes pasa si es el primero de la
 * ventana, para que no quede bloqueado para siempre.
 */
public class RelayQuota {
    private final Clock clock;
    private final int datagramsPerSecond;
    private final long bytesPerSecond;

    private long windowEpoch;
    private int datagrams;
    private long bytes;

    public RelayQuota(Clock clock, int datagramsPerSecond, long bytesPerSecond) {
        this.clock = clock;
        this.datagramsPerSecond = datagramsPerSecond;
        this.bytesPerSecond = bytesPerSecond;
        this.windowEpoch = clock.instant().getEpochSecond();
    }

    /**
     * Intenta consumir cuota para un datagrama.
     *
     * @param size tamaño en bytes
     * @return true si cabe en la ventana actual
     */
    public synchronized boolean tryAcquire(int size) {
        roll();
        if (datagrams + 1 > datagramsPerSecond) {
            return false;
        }
        if (datagrams > 0 && bytes + size > bytesPerSecond) {
            return false;
        }
        datagrams++;
        bytes += size;
        return true;
    }

    /**
     * Milisegundos hasta que empiece la próxima ventana.
     */
    public synchronized long millisUntilNextWindow() {
        long nowMs = clock.millis();
        long next = (nowMs / 1000 + 1) * 1000;
        return Math.max(1, next - nowMs);
    }

    private void roll() {
        long now = clock.instant().getEpochSecond();
        if (now != windowEpoch) {
            windowEpoch = now;
            datagrams = 0;
            bytes = 0;
        }
    }
}
