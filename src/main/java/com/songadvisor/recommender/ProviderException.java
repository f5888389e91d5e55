package com.songadvisor.recommender;

/**
 * Raised when the music data provider cannot answer a lookup (network failure, non-200 status,
 * an error payload or a missing record). The core never retries; the exception travels up through
 * the calling knowledge source and ends the current recommendation cycle.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class ProviderException extends RuntimeException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
