package edu.eci.arsw.facilitator.domain;

/**
 * Estado de un {@link PeerLink}. NEGOTIATING es el único no terminal; FAILED
 * puede volver a NEGOTIATING si el cliente lo pide y quedan reintentos.
 */
public enum LinkState {
    NEGOTIATING,
    DIRECT,
    RELAYED,
    FAILED;

    public boolean isTerminal() {
        return this != NEGOTIATING;
    }
}
