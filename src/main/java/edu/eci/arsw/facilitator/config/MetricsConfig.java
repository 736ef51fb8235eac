package edu.eci.arsw.facilitator.config;

import edu.eci.arsw.facilitator.room.RoomDirectory;
import edu.eci.arsw.facilitator.session.SessionRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {
    public MetricsConfig(MeterRegistry registry) {
        registry.config().commonTags("application", "facilitator");
    }

    /**
     * Ocupación del servicio: sesiones activas y salas vivas.
     */
    @Bean
    public MeterBinder occupancyMetrics(SessionRegistry sessions, RoomDirectory rooms) {
        return registry -> {
            Gauge.builder("facilitator.sessions", sessions, SessionRegistry::size).register(registry);
            Gauge.builder("facilitator.rooms", rooms, RoomDirectory::size).register(registry);
        };
    }
}
