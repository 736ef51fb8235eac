package edu.eci.arsw.facilitator.server;

import edu.eci.arsw.facilitator.domain.Room;
import edu.eci.arsw.facilitator.domain.Session;
import edu.eci.arsw.facilitator.protocol.MessageSender;
import edu.eci.arsw.facilitator.protocol.MessageType;
import edu.eci.arsw.facilitator.protocol.ProtocolMessage;
import edu.eci.arsw.facilitator.room.MemberJoinedEvent;
import edu.eci.arsw.facilitator.room.MemberLeftEvent;
import edu.eci.arsw.facilitator.room.RoomCreatedEvent;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Traduce los eventos del directorio de salas a mensajes para los miembros.
 *
 * Corre antes que el coordinador de rendezvous para que ROOM_JOINED llegue antes
 * que CANDIDATE_EXCHANGE. Las respuestas al solicitante toman el traceId del MDC
 * del hilo que atiende la solicitud.
 */
@Component
public class RoomNotifier {
    private final MessageSender sender;
    private final SessionRegistry registry;

    public RoomNotifier(MessageSender sender, SessionRegistry registry) {
        this.sender = sender;
        this.registry = registry;
    }

    @EventListener
    @Order(0)
    public void onRoomCreated(RoomCreatedEvent event) {
        if (event.creatorSessionId() == null) {
            return;
        }
        ProtocolMessage msg = reply(MessageType.ROOM_CREATED, event.room());
        msg.rooms = List.of(event.room().summary());
        sender.send(event.creatorSessionId(), msg);
    }

    @EventListener
    @Order(0)
    public void onMemberJoined(MemberJoinedEvent event) {
        Room room = event.room();
        sender.send(event.sessionId(), reply(MessageType.ROOM_JOINED, room));
        for (String member : room.members()) {
            if (member.equals(event.sessionId())) {
                continue;
            }
            ProtocolMessage msg = notification(MessageType.PEER_JOINED, room);
            msg.peerSessionId = event.sessionId();
            msg.name = registry.find(event.sessionId()).map(Session::name).orElse(null);
            sender.send(member, msg);
        }
    }

    @EventListener
    @Order(0)
    public void onMemberLeft(MemberLeftEvent event) {
        Room room = event.room();
        for (String member : room.members()) {
            ProtocolMessage left = notification(MessageType.PEER_LEFT, room);
            left.peerSessionId = event.sessionId();
            sender.send(member, left);
            if (event.hostChanged()) {
                sender.send(member, notification(MessageType.HOST_CHANGED, room));
            }
        }
    }

    private static ProtocolMessage reply(MessageType type, Room room) {
        ProtocolMessage msg = notification(type, room);
        msg.traceId = MDC.get("traceId");
        return msg;
    }

    private static ProtocolMessage notification(MessageType type, Room room) {
        ProtocolMessage msg = ProtocolMessage.of(type);
        msg.roomId = room.roomId();
        msg.members = room.members();
        msg.hostSessionId = room.hostSessionId();
        return msg;
    }
}
