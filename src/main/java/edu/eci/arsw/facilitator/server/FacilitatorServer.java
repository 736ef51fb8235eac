package edu.eci.arsw.facilitator.server;

import edu.eci.arsw.facilitator.config.FacilitatorProperties;
import edu.eci.arsw.facilitator.transport.InboundMessage;
import edu.eci.arsw.facilitator.transport.Transport;
import edu.eci.arsw.facilitator.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Proceso del Facilitator: liga el socket y reparte los mensajes entre
 * trabajadores de un solo hilo elegidos por el endpoint remitente. Los mensajes
 * de un mismo remitente se procesan en orden; los de remitentes distintos, en
 * paralelo.
 */
@Component
public class FacilitatorServer implements SmartLifecycle, TransportListener {
    private static final Logger log = LoggerFactory.getLogger(FacilitatorServer.class);

    private final Transport transport;
    private final MessageDispatcher dispatcher;
    private final int workerCount;

    private volatile ExecutorService[] workers;
    private volatile boolean running;

    public FacilitatorServer(Transport transport, MessageDispatcher dispatcher, FacilitatorProperties props) {
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.workerCount = props.getWorkerThreads();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        ExecutorService[] w = new ExecutorService[workerCount];
        for (int i = 0; i < workerCount; i++) {
            String name = "facilitator-worker-" + i;
            w[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
        workers = w;
        transport.setListener(this);
        transport.start();
        running = true;
        log.info("Facilitator started with {} workers", workerCount);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        transport.stop();
        for (ExecutorService w : workers) {
            w.shutdown();
        }
        for (ExecutorService w : workers) {
            try {
                if (!w.awaitTermination(2, TimeUnit.SECONDS)) {
                    w.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                w.shutdownNow();
            }
        }
        log.info("Facilitator stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void onMessage(InboundMessage message) {
        submit(message.sender(), () -> dispatcher.dispatch(message));
    }

    @Override
    public void onPeerUnreachable(InetSocketAddress peer) {
        submit(peer, () -> dispatcher.onPeerUnreachable(peer));
    }

    private void submit(InetSocketAddress key, Runnable task) {
        ExecutorService[] w = workers;
        if (w == null || !running) {
            return;
        }
        try {
            w[Math.floorMod(key.hashCode(), w.length)].execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Worker rejected task for {} during shutdown", key);
        }
    }
}
