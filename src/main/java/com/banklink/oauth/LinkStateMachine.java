package com.banklink.oauth;

import com.banklink.common.exception.IllegalLinkTransitionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Guards transitions of one link (a user's authorization flow or one
 * connection's refresh cycle) against {@link LinkState}'s transition table.
 */
@Slf4j
public class LinkStateMachine {

    private final String subject;
    private LinkState state;

    public LinkStateMachine(String subject, LinkState initial) {
        this.subject = subject;
        this.state = initial;
    }

    public synchronized LinkState getState() {
        return state;
    }

    /**
     * @throws IllegalLinkTransitionException if the table forbids the move
     */
    public synchronized void transitionTo(LinkState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalLinkTransitionException(subject, state.name(), target.name());
        }
        log.debug("{}: {} -> {}", subject, state, target);
        state = target;
    }

    /**
     * Move to {@code target} if allowed, otherwise stay put.
     *
     * @return true if the state changed
     */
    public synchronized boolean tryTransitionTo(LinkState target) {
        if (!state.canTransitionTo(target)) {
            return false;
        }
        log.debug("{}: {} -> {}", subject, state, target);
        state = target;
        return true;
    }
}
