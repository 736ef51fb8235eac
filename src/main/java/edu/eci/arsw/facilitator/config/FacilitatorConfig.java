package edu.eci.arsw.facilitator.config;

import edu.eci.arsw.facilitator.protocol.ProtocolCodec;
import edu.eci.arsw.facilitator.security.AuthorizationService;
import edu.eci.arsw.facilitator.session.JwtTokenAuthenticator;
import edu.eci.arsw.facilitator.session.OpaqueTokenAuthenticator;
import edu.eci.arsw.facilitator.session.TokenAuthenticator;
import edu.eci.arsw.facilitator.transport.DatagramEndpoint;
import edu.eci.arsw.facilitator.transport.ReliableTransport;
import edu.eci.arsw.facilitator.transport.ScheduledTimerService;
import edu.eci.arsw.facilitator.transport.TimerService;
import edu.eci.arsw.facilitator.transport.UdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ApplicationEventMulticaster;
import org.springframework.context.event.SimpleApplicationEventMulticaster;
import org.springframework.context.support.AbstractApplicationContext;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Beans de infraestructura del Facilitator: reloj, temporizadores, socket UDP,
 * transporte fiable y autenticación de sesiones.
 */
@Configuration
public class FacilitatorConfig {
    private static final Logger log = LoggerFactory.getLogger(FacilitatorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService facilitatorTimers() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "facilitator-timer-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public TimerService timerService(ScheduledExecutorService facilitatorTimers) {
        return new ScheduledTimerService(facilitatorTimers);
    }

    @Bean
    public DatagramEndpoint datagramEndpoint(FacilitatorProperties props) {
        return new UdpDatagramEndpoint(new InetSocketAddress(props.getBindAddress(), props.getPort()),
                props.getMaxDatagramSize(), "facilitator-udp-io");
    }

    @Bean
    public ReliableTransport transport(DatagramEndpoint datagramEndpoint, TimerService timerService,
                                       Clock clock, FacilitatorProperties props) {
        FacilitatorProperties.Transport t = props.getTransport();
        return new ReliableTransport(datagramEndpoint, timerService, clock,
                t.getRetransmitBase(), t.getMaxAttempts(), t.getReorderWindow());
    }

    @Bean
    public ProtocolCodec protocolCodec() {
        return new ProtocolCodec();
    }

    @Bean
    public TokenAuthenticator tokenAuthenticator(FacilitatorProperties props,
                                                 AuthorizationService authorizationService) {
        return switch (props.getAuth().getMode()) {
            case JWT -> new JwtTokenAuthenticator(authorizationService);
            case OPAQUE -> new OpaqueTokenAuthenticator();
        };
    }

    /**
     * Aísla a los listeners de eventos: el fallo de uno se registra y no corta la
     * cascada ni llega a quien publicó.
     */
    @Bean(name = AbstractApplicationContext.APPLICATION_EVENT_MULTICASTER_BEAN_NAME)
    public ApplicationEventMulticaster applicationEventMulticaster() {
        SimpleApplicationEventMulticaster multicaster = new SimpleApplicationEventMulticaster();
        multicaster.setErrorHandler(t -> log.error("Event listener failed", t));
        return multicaster;
    }
}
