package edu.eci.arsw.facilitator.transport;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Codificación binaria de tramas.
 *
 * <pre>
 *  0      1      2          6                  14
 *  +------+------+----------+------------------+-----------
 *  | ver/ | mode |  epoch   |       seq        | payload...
 *  | type |      |  (int)   |      (long)      |
 *  +------+------+----------+------------------+-----------
 * </pre>
 *
 * El nibble alto del primer byte es la versión, el bajo el tipo de trama.
 */
final class FrameCodec {

    static final int VERSION = 1;
    static final int HEADER_SIZE = 14;

    private FrameCodec() {
    }

    static byte[] encode(Frame frame) {
        byte[] payload = frame.payload() == null ? new byte[0] : frame.payload();
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + payload.length);
        buf.put((byte) ((VERSION << 4) | frame.type().code()));
        buf.put((byte) frame.mode().ordinal());
        buf.putInt(frame.epoch());
        buf.putLong(frame.seq());
        buf.put(payload);
        return buf.array();
    }

    /**
     * Decodifica un datagrama. Devuelve vacío si no es una trama válida.
     *
     * @param data bytes recibidos
     * @return la trama, o vacío si el datagrama está mal formado
     */
    static Optional<Frame> decode(byte[] data) {
        if (data == null || data.length < HEADER_SIZE) {
            return Optional.empty();
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(data);
            int first = buf.get() & 0xFF;
            if ((first >>> 4) != VERSION) {
                return Optional.empty();
            }
            FrameType type = FrameType.fromCode(first & 0x0F);
            DeliveryMode mode = DeliveryMode.fromCode(buf.get());
            if (type == null || mode == null) {
                return Optional.empty();
            }
            int epoch = buf.getInt();
            long seq = buf.getLong();
            if (seq < 0) {
                return Optional.empty();
            }
            byte[] payload = new byte[buf.remaining()];
            buf.get(payload);
            return Optional.of(new Frame(type, mode, epoch, seq, payload));
        } catch (BufferUnderflowException e) {
            return Optional.empty();
        }
    }
}
