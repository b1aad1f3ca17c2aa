package dev.buyergroup.provider;

import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.SearchQuery;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for professional-network data providers.
 * Searches are cheap and return candidate ids; collects are expensive and return full profiles.
 */
public interface ProfileProvider {

    /**
     * Get the name of this provider (e.g., "CoreSignal")
     */
    String getName();

    /**
     * Run one search and return the matching candidate ids in provider order.
     */
    Mono<List<String>> search(SearchQuery query);

    /**
     * Fetch the full profile for a candidate id.
     * Completes with {@link CandidateUnavailableException} when the provider has no usable record.
     */
    Mono<PersonProfile> collect(String candidateId);

    /**
     * Render a query in this provider's wire format. Identical queries render identically.
     */
    String render(SearchQuery query);
}
