package dev.buyergroup.service;

/**
 * Thrown when the provider could not serve any search of a run.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }
}
