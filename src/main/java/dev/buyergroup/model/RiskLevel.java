package dev.buyergroup.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public RiskLevel escalate() {
        return this == LOW ? MEDIUM : HIGH;
    }
}
