package dev.buyergroup.service;

/**
 * Raised when a seller profile is unknown or malformed. Fatal for a pipeline run and
 * always thrown before any provider call is issued.
 */
public class InvalidSellerProfileException extends RuntimeException {

    private final String profileName;

    public InvalidSellerProfileException(String profileName, String message) {
        super("Invalid seller profile '" + profileName + "': " + message);
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}
