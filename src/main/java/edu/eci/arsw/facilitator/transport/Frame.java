package edu.eci.arsw.facilitator.transport;

/**
 * Trama del transporte ya decodificada.
 *
 * @param type    tipo de trama
 * @param mode    modo de entrega al que pertenece la secuencia
 * @param epoch   época de conexión del emisor; cambia cuando el emisor reinicia
 * @param seq     número de secuencia dentro de (emisor, modo, época)
 * @param payload carga útil, vacía en ACK/NACK
 */
record Frame(FrameType type, DeliveryMode mode, int epoch, long seq, byte[] payload) {

    static Frame data(DeliveryMode mode, int epoch, long seq, byte[] payload) {
        return new Frame(FrameType.DATA, mode, epoch, seq, payload);
    }

    static Frame ack(DeliveryMode mode, int epoch, long seq) {
        return new Frame(FrameType.ACK, mode, epoch, seq, new byte[0]);
    }

    static Frame nack(DeliveryMode mode, int epoch, long seq) {
        return new Frame(FrameType.NACK, mode, epoch, seq, new byte[0]);
    }
}
