package edu.eci.arsw.facilitator.domain;

public enum TransportKind {
    UDP,
    TCP
}
