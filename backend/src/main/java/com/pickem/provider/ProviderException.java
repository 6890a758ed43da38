package com.pickem.provider;

/**
 * Transient failure fetching data from a schedule or event provider.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
