package edu.eci.arsw.facilitator.transport;

import java.time.Duration;

/**
 * Temporizadores de un solo disparo usados por el transporte, la negociación y
 * el relay. Permite sustituir el reloj en las pruebas.
 */
public interface TimerService {

    /**
     * Programa una tarea.
     *
     * @param delay retardo antes de ejecutar
     * @param task  tarea
     * @return manejador para cancelar
     */
    Timer schedule(Duration delay, Runnable task);

    /**
     * Temporizador programado.
     */
    interface Timer {
        /** Cancela el temporizador; no tiene efecto si ya se ejecutó. */
        void cancel();
    }
}
