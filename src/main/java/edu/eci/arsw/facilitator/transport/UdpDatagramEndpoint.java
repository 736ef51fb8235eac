package edu.eci.arsw.facilitator.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.DatagramChannel;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link DatagramEndpoint} sobre un {@link DatagramChannel} en modo bloqueante.
 *
 * Un único hilo recibe; los envíos pueden hacerse desde cualquier hilo.
 */
public class UdpDatagramEndpoint implements DatagramEndpoint {
    private static final Logger log = LoggerFactory.getLogger(UdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;
    private final int maxDatagramSize;
    private final String threadName;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile DatagramChannel channel;
    private volatile DatagramEndpointListener listener;
    private Thread receiver;

    public UdpDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramSize, String threadName) {
        this.bindAddress = bindAddress;
        this.maxDatagramSize = maxDatagramSize;
        this.threadName = threadName;
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = listener;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            channel = DatagramChannel.open();
            channel.bind(bindAddress);
        } catch (IOException e) {
            running.set(false);
            throw new UncheckedIOException("No se pudo ligar el puerto UDP " + bindAddress, e);
        }
        receiver = new Thread(this::receiveLoop, threadName);
        receiver.setDaemon(true);
        receiver.start();
        log.info("UDP endpoint listening on {}", localAddress());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Error cerrando el canal UDP: {}", e.toString());
        }
        if (receiver != null) {
            receiver.interrupt();
        }
    }

    @Override
    public void send(InetSocketAddress remote, byte[] payload) {
        DatagramChannel ch = channel;
        if (ch == null || !ch.isOpen()) {
            log.debug("Send to {} dropped, endpoint closed", remote);
            return;
        }
        try {
            ch.send(ByteBuffer.wrap(payload), remote);
        } catch (IOException e) {
            // un envío fallido equivale a un datagrama perdido
            log.debug("Send to {} failed: {}", remote, e.toString());
        }
    }

    @Override
    public InetSocketAddress localAddress() {
        try {
            DatagramChannel ch = channel;
            return ch == null ? bindAddress : (InetSocketAddress) ch.getLocalAddress();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void receiveLoop() {
        ByteBuffer buf = ByteBuffer.allocate(maxDatagramSize);
        while (running.get()) {
            try {
                buf.clear();
                SocketAddress from = channel.receive(buf);
                if (from == null) {
                    continue;
                }
                buf.flip();
                byte[] data = new byte[buf.remaining()];
                buf.get(data);
                deliver((InetSocketAddress) from, data);
            } catch (ClosedChannelException e) {
                // incluye AsynchronousCloseException al cerrar desde stop()
                break;
            } catch (IOException e) {
                if (running.get()) {
                    log.warn("Error recibiendo datagrama: {}", e.toString());
                }
            }
        }
        log.debug("UDP receive loop finished");
    }

    private void deliver(InetSocketAddress from, byte[] data) {
        DatagramEndpointListener l = listener;
        if (l == null) {
            return;
        }
        try {
            l.onDatagram(from, data);
        } catch (RuntimeException e) {
            log.error("Datagram listener failed for {}", from, e);
        }
    }
}
