package com.songadvisor.recommender;

/**
 * Signals a logic error against the blackboard: retracting a permanent hypothesis or admitting a
 * candidate whose identity is already in the pool. Not recovered anywhere in the core.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
