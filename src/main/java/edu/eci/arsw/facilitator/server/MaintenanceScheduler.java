package edu.eci.arsw.facilitator.server;

import edu.eci.arsw.facilitator.room.RoomDirectory;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Barridos periódicos: sesiones sin actividad, salas vacías fuera de gracia y
 * endpoints sin sesión que dejaron de hablar.
 */
@Component
public class MaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final SessionRegistry registry;
    private final RoomDirectory directory;
    private final MessageDispatcher dispatcher;

    public MaintenanceScheduler(SessionRegistry registry, RoomDirectory directory, MessageDispatcher dispatcher) {
        this.registry = registry;
        this.directory = directory;
        this.dispatcher = dispatcher;
    }

    @Scheduled(fixedDelayString = "#{@facilitatorProperties.session.sweepInterval.toMillis()}")
    public void expireSessions() {
        List<String> expired = registry.expireSweep();
        if (!expired.isEmpty()) {
            log.info("Expiry sweep closed {} sessions", expired.size());
        }
    }

    @Scheduled(fixedDelayString = "#{@facilitatorProperties.room.sweepInterval.toMillis()}")
    public void sweepRooms() {
        int removed = directory.sweepEmptyRooms();
        if (removed > 0) {
            log.info("Room sweep destroyed {} empty rooms", removed);
        }
    }

    @Scheduled(fixedDelayString = "#{@facilitatorProperties.session.sweepInterval.toMillis()}")
    public void sweepIdleEndpoints() {
        int freed = dispatcher.sweepIdleEndpoints();
        if (freed > 0) {
            log.debug("Idle endpoint sweep freed {} endpoints", freed);
        }
    }
}
