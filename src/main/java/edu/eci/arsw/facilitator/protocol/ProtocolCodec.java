package edu.eci.arsw.facilitator.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.eci.arsw.facilitator.exception.ProtocolException;

import java.io.IOException;

/**
 * Serializa y deserializa {@link ProtocolMessage} como JSON UTF-8.
 */
public class ProtocolCodec {
    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public byte[] encode(ProtocolMessage message) {
        try {
            return om.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("No se pudo serializar " + message.type, e);
        }
    }

    /**
     * Decodifica un mensaje.
     *
     * @param data bytes recibidos
     * @return mensaje con tipo no nulo
     * @throws ProtocolException si el contenido no es un mensaje válido
     */
    public ProtocolMessage decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ProtocolException("Mensaje vacío");
        }
        ProtocolMessage message;
        try {
            message = om.readValue(data, ProtocolMessage.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ProtocolException("Mensaje mal formado", e);
        }
        if (message == null || message.type == null) {
            throw new ProtocolException("Mensaje sin type");
        }
        return message;
    }
}
