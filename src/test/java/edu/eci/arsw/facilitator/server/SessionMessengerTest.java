package edu.eci.arsw.facilitator.server;

import edu.eci.arsw.facilitator.domain.ConnectionState;
import edu.eci.arsw.facilitator.domain.Session;
import edu.eci.arsw.facilitator.protocol.MessageType;
import edu.eci.arsw.facilitator.protocol.ProtocolCodec;
import edu.eci.arsw.facilitator.protocol.ProtocolMessage;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import edu.eci.arsw.facilitator.transport.DeliveryMode;
import edu.eci.arsw.facilitator.transport.Transport;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SessionMessengerTest {

    private final SessionRegistry registry = mock(SessionRegistry.class);
    private final Transport transport = mock(Transport.class);
    private final ProtocolCodec codec = new ProtocolCodec();
    private final SessionMessenger messenger = new SessionMessenger(registry, transport, codec);

    @Test
    void send_deberiaUsarElEndpointDeControl_casoFeliz1() {
        InetSocketAddress addr = new InetSocketAddress("203.0.113.9", 41000);
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        when(registry.find("S1")).thenReturn(Optional.of(
                new Session("S1", "t", "t", null, null, List.of(), addr, now, now, ConnectionState.CONNECTED)));
        ProtocolMessage msg = ProtocolMessage.of(MessageType.PEER_LEFT);
        msg.peerSessionId = "S2";

        messenger.send("S1", msg);

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(transport).send(eq(addr), bytes.capture(), eq(DeliveryMode.RELIABLE_ORDERED));
        assertEquals("S2", codec.decode(bytes.getValue()).peerSessionId);
    }

    @Test
    void send_noDeberiaEnviar_cuandoLaSesionNoExiste() {
        when(registry.find("ghost")).thenReturn(Optional.empty());

        messenger.send("ghost", ProtocolMessage.of(MessageType.PEER_LEFT), DeliveryMode.UNRELIABLE);

        verify(transport, never()).send(any(), any(), any());
    }
}
