package edu.eci.arsw.facilitator.client;

@FunctionalInterface
public interface PeerListener {
    void onEvent(PeerEvent event);
}
