package edu.eci.arsw.facilitator.client;

import edu.eci.arsw.facilitator.domain.Endpoint;
import edu.eci.arsw.facilitator.domain.EndpointKind;
import edu.eci.arsw.facilitator.transport.TimerService;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Golpes de NAT hacia todos los candidatos de un par en paralelo: una tarea de
 * sondeo por candidato, cada una reprogramada en su intervalo hasta agotar la
 * ventana. El primer éxito cancela las demás.
 */
class HolePuncher {
    private final String linkId;
    private final String peerSessionId;
    private final List<InetSocketAddress> targets = new ArrayList<>();
    private final TimerService timers;
    private final Duration delay;
    private final Duration interval;
    private final int maxProbes;
    private final Consumer<InetSocketAddress> probe;

    private final List<ProbeTask> tasks = new ArrayList<>();
    private TimerService.Timer startTimer;
    private InetSocketAddress winner;
    private boolean cancelled;

    HolePuncher(String linkId, String peerSessionId, List<Endpoint> candidates, TimerService timers,
                Duration delay, Duration interval, Duration window, Consumer<InetSocketAddress> probe) {
        this.linkId = linkId;
        this.peerSessionId = peerSessionId;
        this.timers = timers;
        this.delay = delay;
        this.interval = interval;
        this.probe = probe;
        long ratio = interval.isZero() ? 1 : window.toMillis() / Math.max(1, interval.toMillis());
        this.maxProbes = (int) Math.max(1, ratio);
        if (candidates != null) {
            for (Endpoint e : candidates) {
                if (e.kind() != EndpointKind.RELAY) {
                    targets.add(e.toSocketAddress());
                }
            }
        }
    }

    String linkId() {
        return linkId;
    }

    String peerSessionId() {
        return peerSessionId;
    }

    synchronized void start() {
        if (cancelled) {
            return;
        }
        startTimer = timers.schedule(delay, this::launch);
    }

    /**
     * Marca el éxito en {@code at}. Solo el primero cuenta.
     *
     * @param at endpoint en el que se vio al par
     * @return true si es el primer éxito
     */
    synchronized boolean succeed(InetSocketAddress at) {
        if (winner != null) {
            return false;
        }
        winner = at;
        stopTasks();
        return true;
    }

    synchronized InetSocketAddress winner() {
        return winner;
    }

    synchronized void cancel() {
        cancelled = true;
        stopTasks();
    }

    synchronized int activeProbes() {
        return (int) tasks.stream().filter(t -> !t.done).count();
    }

    List<InetSocketAddress> targets() {
        return List.copyOf(targets);
    }

    private synchronized void launch() {
        startTimer = null;
        if (cancelled || winner != null) {
            return;
        }
        for (InetSocketAddress target : targets) {
            ProbeTask task = new ProbeTask(target);
            tasks.add(task);
            task.fire();
        }
    }

    private void stopTasks() {
        if (startTimer != null) {
            startTimer.cancel();
            startTimer = null;
        }
        tasks.forEach(ProbeTask::stop);
    }

    private final class ProbeTask {
        private final InetSocketAddress target;
        private int sent;
        private boolean done;
        private TimerService.Timer timer;

        ProbeTask(InetSocketAddress target) {
            this.target = target;
        }

        void fire() {
            synchronized (HolePuncher.this) {
                timer = null;
                if (done || cancelled || winner != null) {
                    return;
                }
                probe.accept(target);
                sent++;
                if (sent >= maxProbes) {
                    done = true;
                    return;
                }
                timer = timers.schedule(interval, this::fire);
            }
        }

        void stop() {
            done = true;
            if (timer != null) {
                timer.cancel();
                timer = null;
            }
        }
    }
}
