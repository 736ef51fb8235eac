package edu.eci.arsw.facilitator.transport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Estado de recepción de un modo fiable para un par: deduplicación y, en modo
 * ordenado, el buffer de reordenamiento.
 *
 * No es seguro para hilos; {@link PeerConnection} serializa el acceso.
 */
final class InboundWindow {

    private final boolean ordered;
    private final int windowSize;

    /** Primera secuencia aún no recibida. */
    private long nextExpected;
    /** Modo ordenado: cargas retenidas a la espera del hueco. */
    private final TreeMap<Long, byte[]> buffered = new TreeMap<>();
    /** Modo no ordenado: secuencias ya entregadas por encima de nextExpected. */
    private final Set<Long> seen = new HashSet<>();

    InboundWindow(boolean ordered, int windowSize) {
        this.ordered = ordered;
        this.windowSize = windowSize;
    }

    /**
     * Resultado de aceptar una trama.
     *
     * @param ack         hay que confirmar la secuencia recibida
     * @param resend      hay que pedir el reenvío de {@code expected}
     * @param expected    siguiente secuencia esperada tras procesar la trama
     * @param deliverable cargas a entregar, en orden
     */
    record Result(boolean ack, boolean resend, long expected, List<byte[]> deliverable) {
    }

    Result accept(long seq, byte[] payload) {
        if (seq < nextExpected || (ordered ? buffered.containsKey(seq) : seen.contains(seq))) {
            return new Result(true, false, nextExpected, List.of());
        }
        if (seq >= nextExpected + windowSize) {
            return new Result(false, ordered, nextExpected, List.of());
        }
        return ordered ? acceptOrdered(seq, payload) : acceptUnordered(seq, payload);
    }

    private Result acceptOrdered(long seq, byte[] payload) {
        buffered.put(seq, payload);
        List<byte[]> out = new ArrayList<>();
        while (!buffered.isEmpty() && buffered.firstKey() == nextExpected) {
            out.add(buffered.pollFirstEntry().getValue());
            nextExpected++;
        }
        return new Result(true, false, nextExpected, out);
    }

    private Result acceptUnordered(long seq, byte[] payload) {
        if (seq == nextExpected) {
            nextExpected++;
            while (seen.remove(nextExpected)) {
                nextExpected++;
            }
        } else {
            seen.add(seq);
        }
        return new Result(true, false, nextExpected, List.of(payload));
    }

    long nextExpected() {
        return nextExpected;
    }

    int bufferedCount() {
        return ordered ? buffered.size() : 0;
    }
}
