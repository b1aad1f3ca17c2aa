package dev.buyergroup.model;

import dev.buyergroup.model.CreditLedger.CreditsUsed;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Output of one pipeline run, handed to the persistence collaborator as-is.
 */
@Value
@Builder
public class Report {
    String companyName;
    String sellerProfile;
    PipelineState state;
    boolean dryRun;
    BuyerGroup buyerGroup;
    CreditsUsed creditsUsed;

    @Singular
    List<String> warnings;

    int queriesIssued;
    int candidatesFound;
    int profilesCollected;
    int profilesQualified;
    Instant generatedAt;

    public boolean hasWarning(ReportWarning warning) {
        return warnings.stream().anyMatch(warning::matches);
    }
}
