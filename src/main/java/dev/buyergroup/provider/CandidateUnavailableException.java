package dev.buyergroup.provider;

/**
 * The provider answered, but has no usable profile for the candidate.
 */
public class CandidateUnavailableException extends RuntimeException {

    private final String candidateId;

    public CandidateUnavailableException(String candidateId, String message) {
        super("Candidate " + candidateId + " unavailable: " + message);
        this.candidateId = candidateId;
    }

    public String getCandidateId() {
        return candidateId;
    }
}
