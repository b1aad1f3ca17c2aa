package dev.buyergroup.provider.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.buyergroup.config.ProviderConfig;
import dev.buyergroup.metrics.EngineMetrics;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.SearchQuery;
import dev.buyergroup.provider.CandidateUnavailableException;
import dev.buyergroup.provider.ProfileProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Employee search and collect against a CoreSignal-style REST API.
 * Searches post an Elasticsearch DSL body and get back an array of ids.
 */
@Slf4j
@Component
public class CoreSignalProvider implements ProfileProvider {

    static final String SEARCH_PATH = "/cdapi/v2/employee_multi_source/search/es_dsl";
    static final String COLLECT_PATH = "/cdapi/v2/employee_multi_source/collect/{id}";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final EngineMetrics metrics;

    public CoreSignalProvider(WebClient.Builder webClientBuilder, ProviderConfig config, ObjectMapper objectMapper,
                              EngineMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("apikey", config.getApiKey())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return "CoreSignal";
    }

    @Override
    public Mono<List<String>> search(SearchQuery query) {
        long start = System.currentTimeMillis();
        return webClient.post()
                .uri(uri -> uri.path(SEARCH_PATH).queryParam("items_per_page", query.getResultLimit()).build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(toDsl(query))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::readIds)
                .defaultIfEmpty(List.of())
                .doOnTerminate(() -> metrics.recordCallLatency("search", System.currentTimeMillis() - start));
    }

    @Override
    public Mono<PersonProfile> collect(String candidateId) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(COLLECT_PATH, candidateId)
                .retrieve()
                .bodyToMono(CoreSignalEmployee.class)
                .switchIfEmpty(Mono.error(() -> new CandidateUnavailableException(candidateId, "empty body")))
                .map(employee -> employee.toProfile(candidateId))
                .doOnTerminate(() -> metrics.recordCallLatency("collect", System.currentTimeMillis() - start));
    }

    @Override
    public String render(SearchQuery query) {
        try {
            return objectMapper.writeValueAsString(toDsl(query));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render query " + query.getId(), e);
        }
    }

    /**
     * Build the Elasticsearch DSL body: the active experience must be at one of the company
     * variations and not at a non-corporate employer; title and department filters are OR-ed
     * within themselves; excluded headline terms go into must_not.
     */
    Map<String, Object> toDsl(SearchQuery query) {
        List<Object> experienceMust = new ArrayList<>();
        experienceMust.add(Map.of("term", Map.of("experience.active_experience", 1)));
        experienceMust.add(anyPhrase("experience.company_name", query.getCompanyVariations()));

        Map<String, Object> experienceBool = new LinkedHashMap<>();
        experienceBool.put("must", experienceMust);
        if (!query.getExcludedCompanyTerms().isEmpty()) {
            experienceBool.put("must_not", phrases("experience.company_name", query.getExcludedCompanyTerms()));
        }

        List<Object> must = new ArrayList<>();
        must.add(Map.of("nested", orderedMap(
                "path", "experience",
                "query", Map.of("bool", experienceBool))));
        if (!query.getTitleFilters().isEmpty()) {
            must.add(anyPhrase("active_experience_title", query.getTitleFilters()));
        }
        if (!query.getDepartmentFilters().isEmpty()) {
            must.add(anyPhrase("active_experience_department", query.getDepartmentFilters()));
        }

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("must", must);
        if (!query.getExcludedHeadlineTerms().isEmpty()) {
            bool.put("must_not", phrases("headline", query.getExcludedHeadlineTerms()));
        }
        return Map.of("query", Map.of("bool", bool));
    }

    private Map<String, Object> anyPhrase(String field, List<String> values) {
        return Map.of("bool", orderedMap(
                "should", phrases(field, values),
                "minimum_should_match", 1));
    }

    private List<Object> phrases(String field, List<String> values) {
        List<Object> clauses = new ArrayList<>();
        for (String value : values) {
            clauses.add(Map.of("match_phrase", Map.of(field, value)));
        }
        return clauses;
    }

    private Map<String, Object> orderedMap(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }

    /**
     * The search endpoint answers with a bare id array; some deployments wrap it or return objects.
     */
    private List<String> readIds(JsonNode body) {
        JsonNode items = body;
        if (body.isObject()) {
            items = body.has("ids") ? body.get("ids") : body.path("data");
        }
        List<String> ids = new ArrayList<>();
        for (JsonNode item : items) {
            JsonNode id = item.isObject() ? item.get("id") : item;
            if (id != null && !id.isNull() && !id.asText().isBlank()) {
                ids.add(id.asText());
            }
        }
        return ids;
    }
}
