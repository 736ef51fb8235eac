package edu.eci.arsw.facilitator.transport;

/**
 * Tipos de trama del transporte.
 */
enum FrameType {
    DATA(1),
    ACK(2),
    /** Petición de reenvío del número de secuencia indicado. */
    NACK(3);

    private final int code;

    FrameType(int code) {
        this.code = code;
    }

    int code() {
        return code;
    }

    static FrameType fromCode(int code) {
        for (FrameType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return null;
    }
}
