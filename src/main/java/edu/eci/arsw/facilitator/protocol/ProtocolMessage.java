package edu.eci.arsw.facilitator.protocol;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import edu.eci.arsw.facilitator.domain.Endpoint;
import edu.eci.arsw.facilitator.domain.RoomConfig;
import edu.eci.arsw.facilitator.domain.RoomFilter;
import edu.eci.arsw.facilitator.domain.RoomSummary;
import edu.eci.arsw.facilitator.exception.ErrorCode;
import edu.eci.arsw.facilitator.transport.DeliveryMode;

import java.util.List;

/**
 * Sobre de mensaje del protocolo de control. Viaja como JSON dentro de una trama
 * DATA del transporte; los campos que no aplican a un tipo van en null y no se
 * serializan.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProtocolMessage {
    public MessageType type;
    public String traceId;
    public long ts;

    // registro
    public String token;
    public String name;
    public String sessionId;
    public List<Endpoint> endpoints;
    public Endpoint endpoint;

    // salas
    public String roomId;
    public RoomConfig room;
    public RoomFilter criteria;
    public String password;
    public List<String> members;
    public String hostSessionId;
    public List<RoomSummary> rooms;

    // enlaces y relay
    public String peerSessionId;
    public String linkId;
    public String channelId;
    public Boolean initiator;
    public Long punchDelayMs;
    public Long punchWindowMs;
    public Long punchIntervalMs;
    public Long seq;
    public DeliveryMode mode;
    public byte[] payload;

    // errores
    public ErrorCode code;
    public String reason;

    public ProtocolMessage() {
        // Constructor vacío necesario para Jackson
    }

    public static ProtocolMessage of(MessageType type) {
        ProtocolMessage m = new ProtocolMessage();
        m.type = type;
        m.ts = System.currentTimeMillis();
        return m;
    }

    /**
     * Crea una respuesta que conserva el traceId de la solicitud.
     *
     * @param request solicitud original
     * @param type    tipo de la respuesta
     * @return respuesta
     */
    public static ProtocolMessage replyTo(ProtocolMessage request, MessageType type) {
        ProtocolMessage m = of(type);
        m.traceId = request == null ? null : request.traceId;
        return m;
    }

    public static ProtocolMessage error(ProtocolMessage request, ErrorCode code, String reason) {
        ProtocolMessage m = replyTo(request, MessageType.forError(code));
        m.code = code;
        m.reason = reason;
        return m;
    }

    @Override
    public String toString() {
        return "ProtocolMessage{type=" + type + ", traceId=" + traceId + ", sessionId=" + sessionId
                + ", roomId=" + roomId + ", peerSessionId=" + peerSessionId + ", linkId=" + linkId
                + ", channelId=" + channelId + "}";
    }
}
