package edu.eci.arsw.facilitator.domain;

public enum ConnectionState {
    CONNECTED,
    DISCONNECTED
}
