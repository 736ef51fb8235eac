package edu.eci.arsw.facilitator.server;

import edu.eci.arsw.facilitator.protocol.MessageSender;
import edu.eci.arsw.facilitator.protocol.ProtocolCodec;
import edu.eci.arsw.facilitator.protocol.ProtocolMessage;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import edu.eci.arsw.facilitator.transport.DeliveryMode;
import edu.eci.arsw.facilitator.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entrega mensajes a una sesión por su endpoint de control.
 */
@Component
public class SessionMessenger implements MessageSender {
    private static final Logger log = LoggerFactory.getLogger(SessionMessenger.class);

    private final SessionRegistry registry;
    private final Transport transport;
    private final ProtocolCodec codec;

    public SessionMessenger(SessionRegistry registry, Transport transport, ProtocolCodec codec) {
        this.registry = registry;
        this.transport = transport;
        this.codec = codec;
    }

    @Override
    public void send(String sessionId, ProtocolMessage message, DeliveryMode mode) {
        registry.find(sessionId).ifPresentOrElse(
                s -> transport.send(s.controlEndpoint(), codec.encode(message), mode),
                () -> log.debug("{} to unknown session {} dropped", message.type, sessionId));
    }
}
