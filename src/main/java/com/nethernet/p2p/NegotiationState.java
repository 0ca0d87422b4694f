package com.nethernet.p2p;

/**
 * Lifecycle of one connection identifier on the host.
 *
 * <p>{@code UNSEEN} and {@code PENDING} have no {@link Connection} yet: an unseen id has nothing on
 * the host, a pending id only has buffered candidates. A connection object starts in
 * {@code NEGOTIATING}. {@code CLOSED} is terminal.
 */
public enum NegotiationState {
    UNSEEN,
    PENDING,
    NEGOTIATING,
    ESTABLISHED,
    CLOSED
}
