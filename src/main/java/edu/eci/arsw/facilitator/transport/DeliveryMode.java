package edu.eci.arsw.facilitator.transport;

/**
 * Garantía de entrega pedida por el emisor para un datagrama.
 */
public enum DeliveryMode {
    /** Sin acuse ni retransmisión. */
    UNRELIABLE,
    /** Con acuse, retransmisión y deduplicación; se entrega en orden de llegada. */
    RELIABLE_UNORDERED,
    /** Como {@link #RELIABLE_UNORDERED} y además se entrega estrictamente en orden. */
    RELIABLE_ORDERED;

    public boolean isReliable() {
        return this != UNRELIABLE;
    }

    static DeliveryMode fromCode(int code) {
        DeliveryMode[] values = values();
        if (code < 0 || code >= values.length) {
            return null;
        }
        return values[code];
    }
}
