package edu.eci.arsw.facilitator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuración del Facilitator (prefijo {@code facilitator}).
 *
 * Todos los tiempos de espera, ventanas, topes y cuotas son configurables; los
 * valores por defecto son solo un punto de partida para desarrollo local.
 */
@Configuration
@ConfigurationProperties(prefix = "facilitator")
@Validated
public class FacilitatorProperties {

    @NotBlank
    private String bindAddress = "0.0.0.0";
    @Min(0)
    private int port = 9009;
    @Positive
    private int maxDatagramSize = 65507;
    @Positive
    private int workerThreads = 4;
    /** Mensajes de control por segundo y endpoint. */
    @Positive
    private int controlRateLimit = 50;

    @Valid
    private final Auth auth = new Auth();
    @Valid
    private final Transport transport = new Transport();
    @Valid
    private final Session session = new Session();
    @Valid
    private final Room room = new Room();
    @Valid
    private final Rendezvous rendezvous = new Rendezvous();
    @Valid
    private final Relay relay = new Relay();

    public enum AuthMode {
        OPAQUE, JWT
    }

    public static class Auth {
        @NotNull
        private AuthMode mode = AuthMode.OPAQUE;

        public AuthMode getMode() { return mode; }
        public void setMode(AuthMode mode) { this.mode = mode; }
    }

    public static class Transport {
        @NotNull
        private Duration retransmitBase = Duration.ofMillis(200);
        @Positive
        private int maxAttempts = 8;
        @Positive
        private int reorderWindow = 64;

        public Duration getRetransmitBase() { return retransmitBase; }
        public void setRetransmitBase(Duration retransmitBase) { this.retransmitBase = retransmitBase; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public int getReorderWindow() { return reorderWindow; }
        public void setReorderWindow(int reorderWindow) { this.reorderWindow = reorderWindow; }
    }

    public static class Session {
        @NotNull
        private Duration livenessTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration sweepInterval = Duration.ofSeconds(5);
        @Positive
        private int maxSessions = 1000;

        public Duration getLivenessTimeout() { return livenessTimeout; }
        public void setLivenessTimeout(Duration livenessTimeout) { this.livenessTimeout = livenessTimeout; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
        public int getMaxSessions() { return maxSessions; }
        public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
    }

    public static class Room {
        @Positive
        private int defaultCapacity = 8;
        @Positive
        private int maxCapacity = 64;
        @Positive
        private int maxRooms = 200;
        @NotNull
        private Duration emptyGraceTtl = Duration.ofSeconds(30);
        @NotNull
        private Duration sweepInterval = Duration.ofSeconds(5);

        public int getDefaultCapacity() { return defaultCapacity; }
        public void setDefaultCapacity(int defaultCapacity) { this.defaultCapacity = defaultCapacity; }
        public int getMaxCapacity() { return maxCapacity; }
        public void setMaxCapacity(int maxCapacity) { this.maxCapacity = maxCapacity; }
        public int getMaxRooms() { return maxRooms; }
        public void setMaxRooms(int maxRooms) { this.maxRooms = maxRooms; }
        public Duration getEmptyGraceTtl() { return emptyGraceTtl; }
        public void setEmptyGraceTtl(Duration emptyGraceTtl) { this.emptyGraceTtl = emptyGraceTtl; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class Rendezvous {
        @NotNull
        private Duration negotiationWindow = Duration.ofSeconds(5);
        @NotNull
        private Duration responderDelay = Duration.ofMillis(100);
        @NotNull
        private Duration punchInterval = Duration.ofMillis(250);
        @Min(0)
        private int retryCap = 3;
        private boolean forceRelay;

        public Duration getNegotiationWindow() { return negotiationWindow; }
        public void setNegotiationWindow(Duration negotiationWindow) { this.negotiationWindow = negotiationWindow; }
        public Duration getResponderDelay() { return responderDelay; }
        public void setResponderDelay(Duration responderDelay) { this.responderDelay = responderDelay; }
        public Duration getPunchInterval() { return punchInterval; }
        public void setPunchInterval(Duration punchInterval) { this.punchInterval = punchInterval; }
        public int getRetryCap() { return retryCap; }
        public void setRetryCap(int retryCap) { this.retryCap = retryCap; }
        public boolean isForceRelay() { return forceRelay; }
        public void setForceRelay(boolean forceRelay) { this.forceRelay = forceRelay; }
    }

    public static class Relay {
        @Positive
        private int maxLinks = 100;
        @Positive
        private int datagramsPerSecond = 500;
        @Positive
        private long bytesPerSecond = 1_000_000L;
        @Min(0)
        private int backlogSize = 256;

        public int getMaxLinks() { return maxLinks; }
        public void setMaxLinks(int maxLinks) { this.maxLinks = maxLinks; }
        public int getDatagramsPerSecond() { return datagramsPerSecond; }
        public void setDatagramsPerSecond(int datagramsPerSecond) { this.datagramsPerSecond = datagramsPerSecond; }
        public long getBytesPerSecond() { return bytesPerSecond; }
        public void setBytesPerSecond(long bytesPerSecond) { this.bytesPerSecond = bytesPerSecond; }
        public int getBacklogSize() { return backlogSize; }
        public void setBacklogSize(int backlogSize) { this.backlogSize = backlogSize; }
    }

    public String getBindAddress() { return bindAddress; }
    public void setBindAddress(String bindAddress) { this.bindAddress = bindAddress; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public int getMaxDatagramSize() { return maxDatagramSize; }
    public void setMaxDatagramSize(int maxDatagramSize) { this.maxDatagramSize = maxDatagramSize; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public int getControlRateLimit() { return controlRateLimit; }
    public void setControlRateLimit(int controlRateLimit) { this.controlRateLimit = controlRateLimit; }
    public Auth getAuth() { return auth; }
    public Transport getTransport() { return transport; }
    public Session getSession() { return session; }
    public Room getRoom() { return room; }
    public Rendezvous getRendezvous() { return rendezvous; }
    public Relay getRelay() { return relay; }
}
