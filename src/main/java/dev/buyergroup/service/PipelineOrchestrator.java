package dev.buyergroup.service;

import dev.buyergroup.config.PipelineConfig;
import dev.buyergroup.config.ProviderConfig;
import dev.buyergroup.config.ScoringConfig;
import dev.buyergroup.metrics.EngineMetrics;
import dev.buyergroup.model.BuyerGroup;
import dev.buyergroup.model.EarlyStopMode;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.PipelineState;
import dev.buyergroup.model.Report;
import dev.buyergroup.model.ReportWarning;
import dev.buyergroup.model.RunConfig;
import dev.buyergroup.model.SearchQuery;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.provider.ProviderClient;
import dev.buyergroup.provider.ProviderResult;
import dev.buyergroup.provider.ProviderResult.Status;
import dev.buyergroup.service.BuyerGroupIdentifier.Identification;
import dev.buyergroup.service.ProfileAnalyzer.AnalysisResult;
import dev.buyergroup.service.ProfileAnalyzer.Target;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Main orchestration service for the buyer group pipeline:
 * search, collect, analyze, classify, select.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private static final String SEPARATOR = "========================================";

    private final SellerProfileRegistry sellerProfileRegistry;
    private final QueryBuilder queryBuilder;
    private final ProviderClient providerClient;
    private final ProfileAnalyzer profileAnalyzer;
    private final BuyerGroupIdentifier buyerGroupIdentifier;
    private final ProviderConfig providerConfig;
    private final PipelineConfig pipelineConfig;
    private final ScoringConfig scoringConfig;
    private final EngineMetrics metrics;
    private final Clock clock;

    /**
     * Execute the full pipeline for one company.
     * Provider failures, budget and deadline stops end up as report warnings; only an
     * invalid seller profile or company name fails before any provider call.
     *
     * @param companyName       Target company
     * @param sellerProfileName Name of a configured seller profile
     * @param runConfig         Budgets and switches for this run
     * @return the report; the Mono does not error for provider failures
     * @throws InvalidSellerProfileException if the profile is unknown or malformed
     */
    public Mono<Report> runPipeline(String companyName, String sellerProfileName, RunConfig runConfig) {
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("Company name is required");
        }
        SellerProfile sellerProfile = sellerProfileRegistry.get(sellerProfileName);
        RunConfig config = runConfig != null ? runConfig : RunConfig.builder().build();
        ScoringStrategy strategy = ScoringStrategy.of(scoringConfig, config.getEarlyStopMode());
        PipelineRun run = new PipelineRun(companyName.trim(), sellerProfile, config, strategy, clock);

        List<SearchQuery> queries = queryBuilder.build(run.getCompanyName(), config.getCompanyAliases(),
                sellerProfile, config.getMaxQueries());

        log.info(SEPARATOR);
        log.info("Buyer Group Pipeline Starting: {} / {}", run.getCompanyName(), sellerProfile.getName());
        log.info(SEPARATOR);
        log.info("Queries planned: {} (~{} search credits)", queries.size(), queryBuilder.estimateCredits(queries));
        log.info("Budgets: search {} / collect {} credits, max group size {}, early stop {}, dry run {}",
                config.getSearchBudget(), config.getCollectBudget(), run.getMaxGroupSize(),
                config.getEarlyStopMode(), config.isDryRun());

        return Mono.defer(() -> search(run, queries))
                .flatMap(candidates -> afterSearch(run, candidates))
                .onErrorResume(e -> Mono.just(failed(run, e)))
                .doOnNext(this::recordMetrics);
    }

    // ---------------------------------------------------------------- searching

    private Mono<Candidates> search(PipelineRun run, List<SearchQuery> queries) {
        run.transitionTo(PipelineState.SEARCHING);

        return Flux.fromIterable(queries)
                .flatMapSequential(query -> searchOne(run, query), providerConfig.getParallelism())
                .collectList()
                .map(outcomes -> collectCandidateIds(run, outcomes));
    }

    private Mono<SearchOutcome> searchOne(PipelineRun run, SearchQuery query) {
        return Mono.defer(() -> {
            if (run.deadlinePassed()) {
                return Mono.empty();
            }
            RunConfig config = run.getRunConfig();
            return providerClient.search(query, run.getLedger(), config.getSearchBudget(), config.isDryRun())
                    .map(result -> new SearchOutcome(query, result));
        });
    }

    private Candidates collectCandidateIds(PipelineRun run, List<SearchOutcome> outcomes) {
        Set<String> ids = new LinkedHashSet<>();
        int issued = 0;
        int hardFailures = 0;
        int dryRunSearches = 0;

        for (SearchOutcome outcome : outcomes) {
            ProviderResult<List<String>> result = outcome.result();
            switch (result.status()) {
                case SUCCESS, CACHED -> {
                    issued++;
                    ids.addAll(result.value());
                }
                case DRY_RUN -> {
                    issued++;
                    dryRunSearches++;
                }
                case SOFT_FAIL -> {
                    issued++;
                    log.warn("Search {} returned no usable result: {}", outcome.query().getId(), result.error());
                }
                case HARD_FAIL -> {
                    issued++;
                    hardFailures++;
                    run.warn(ReportWarning.PROVIDER_UNAVAILABLE,
                            "search " + outcome.query().getId() + " failed after retry (" + result.error() + ")");
                }
                case BUDGET_EXHAUSTED -> {
                    if (run.getSearchBudgetExhausted().compareAndSet(false, true)) {
                        run.warn(ReportWarning.BUDGET_EXHAUSTED, "search budget of "
                                + run.getRunConfig().getSearchBudget() + " credits reached, remaining queries skipped");
                    }
                }
            }
        }

        run.setQueriesIssued(issued);
        run.setCandidatesFound(ids.size());
        log.info("Searches issued: {}, candidates found: {}", issued, ids.size());

        if (issued > 0 && hardFailures == issued) {
            throw new ProviderUnavailableException("all " + issued + " searches failed");
        }
        return new Candidates(List.copyOf(ids), dryRunSearches);
    }

    /**
     * Dry run of the collect stage. Known candidate ids go through the provider client as
     * dry-run collects, so they are charged exactly as a live run would be charged (cached
     * profiles are free). Searches that were not served from cache have unknown results;
     * each of them is charged as a full page of collects, capped by the remaining budget.
     */
    private Mono<Report> dryRunCollects(PipelineRun run, Candidates candidates) {
        RunConfig config = run.getRunConfig();
        DryRunPlan plan = new DryRunPlan();

        return Flux.fromIterable(candidates.ids())
                .concatMap(id -> providerClient.collect(id, run.getLedger(), config.getCollectBudget(), true))
                .doOnNext(result -> {
                    switch (result.status()) {
                        case DRY_RUN -> plan.charged++;
                        case CACHED -> plan.cached++;
                        default -> plan.skipped++;
                    }
                })
                .then(Mono.fromSupplier(() -> {
                    int collectCost = providerClient.getCollectCost();
                    long upperBound = (long) candidates.unresolvedSearches() * providerConfig.getResultLimit();
                    while (plan.unresolved < upperBound && collectCost > 0
                            && run.getLedger().tryChargeCollect(collectCost, config.getCollectBudget())) {
                        plan.unresolved++;
                    }

                    run.warn(ReportWarning.DRY_RUN, "no provider calls issued; " + run.getQueriesIssued()
                            + " searches, " + plan.charged + " collects for known candidates ("
                            + plan.cached + " cached, " + plan.skipped + " over budget), upper bound of "
                            + plan.unresolved + " collects for " + candidates.unresolvedSearches()
                            + " uncached searches; " + run.getLedger().getTotalCredits() + " credits");
                    run.transitionTo(PipelineState.DONE);
                    return report(run, BuyerGroup.empty(run.getCompanyName()));
                }));
    }

    private Mono<Report> afterSearch(PipelineRun run, Candidates candidates) {
        if (run.isDryRun()) {
            return dryRunCollects(run, candidates);
        }
        List<String> candidateIds = candidates.ids();
        if (candidateIds.isEmpty()) {
            run.warn(ReportWarning.NO_CANDIDATES_FOUND, "no candidates found for " + run.getCompanyName());
            run.transitionTo(PipelineState.DONE);
            return Mono.just(report(run, BuyerGroup.empty(run.getCompanyName())));
        }
        return collect(run, candidateIds).map(profiles -> identify(run, profiles));
    }

    // ---------------------------------------------------------------- collecting

    private Mono<List<PersonProfile>> collect(PipelineRun run, List<String> candidateIds) {
        run.transitionTo(PipelineState.COLLECTING);
        Target target = Target.of(run.getCompanyName(), mergedAliases(run));
        Map<String, PersonProfile> collected = new LinkedHashMap<>();
        CollectStats stats = new CollectStats();
        int batchSize = Math.max(1, pipelineConfig.getBatchSize());

        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < candidateIds.size(); i += batchSize) {
            batches.add(candidateIds.subList(i, Math.min(i + batchSize, candidateIds.size())));
        }

        return Flux.fromIterable(batches)
                .concatMap(batch -> collectBatch(run, batch))
                .map(results -> {
                    absorb(run, results, collected, stats);
                    return stopCollecting(run, target, collected, stats, candidateIds.size());
                })
                .takeUntil(Boolean::booleanValue)
                .then(Mono.fromSupplier(() -> {
                    if (stats.softFailures > 0) {
                        run.warn(ReportWarning.CANDIDATE_UNAVAILABLE,
                                stats.softFailures + " candidate profiles could not be collected");
                    }
                    if (stats.hardFailures > 0) {
                        run.warn(ReportWarning.PROVIDER_UNAVAILABLE,
                                stats.hardFailures + " collect calls failed after retry");
                    }
                    run.setProfilesCollected(collected.size());
                    log.info("Profiles collected: {} of {} candidates ({} collect credits)",
                            collected.size(), candidateIds.size(), run.getLedger().getCollectCredits());
                    return List.copyOf(collected.values());
                }));
    }

    private Mono<List<ProviderResult<PersonProfile>>> collectBatch(PipelineRun run, List<String> batch) {
        RunConfig config = run.getRunConfig();
        return Flux.fromIterable(batch)
                .flatMapSequential(id -> Mono.defer(() -> run.deadlinePassed()
                        ? Mono.<ProviderResult<PersonProfile>>empty()
                        : providerClient.collect(id, run.getLedger(), config.getCollectBudget(), false)),
                        providerConfig.getParallelism())
                .collectList();
    }

    private void absorb(PipelineRun run, List<ProviderResult<PersonProfile>> results,
                        Map<String, PersonProfile> collected, CollectStats stats) {
        for (ProviderResult<PersonProfile> result : results) {
            stats.attempted++;
            if (result.hasValue()) {
                collected.putIfAbsent(result.value().getId(), result.value());
            } else if (result.status() == Status.SOFT_FAIL) {
                stats.softFailures++;
            } else if (result.status() == Status.HARD_FAIL) {
                stats.hardFailures++;
            } else if (result.status() == Status.BUDGET_EXHAUSTED
                    && run.getCollectBudgetExhausted().compareAndSet(false, true)) {
                run.warn(ReportWarning.BUDGET_EXHAUSTED, "collect budget of "
                        + run.getRunConfig().getCollectBudget() + " credits reached, remaining candidates skipped");
            }
        }
    }

    /**
     * Decide after a batch whether to issue the next one.
     */
    private boolean stopCollecting(PipelineRun run, Target target, Map<String, PersonProfile> collected,
                                   CollectStats stats, int totalCandidates) {
        if (run.getCollectBudgetExhausted().get() || run.getDeadlineExceeded().get()) {
            return true;
        }
        EarlyStopMode mode = run.getStrategy().earlyStopMode();
        if (mode == EarlyStopMode.ACCURACY_FIRST || stats.attempted >= totalCandidates) {
            return false;
        }

        List<ClassifiedCandidate> classified = buyerGroupIdentifier.classify(
                qualified(run, target, collected.values()), run.getSellerProfile(), run.getStrategy());
        boolean met = buyerGroupIdentifier.minimumsMet(classified, run.getSellerProfile());
        boolean stop = mode == EarlyStopMode.COST_FIRST
                ? met
                : met && classified.size() >= run.getMaxGroupSize();
        if (stop) {
            run.warn(ReportWarning.EARLY_STOP, mode + ": role targets met after " + stats.attempted + " of "
                    + totalCandidates + " candidates, " + (totalCandidates - stats.attempted) + " collects skipped");
        }
        return stop;
    }

    // ---------------------------------------------------------------- analyze, classify, select

    private Report identify(PipelineRun run, List<PersonProfile> profiles) {
        SellerProfile sellerProfile = run.getSellerProfile();
        Target target = Target.of(run.getCompanyName(), mergedAliases(run));

        run.transitionTo(PipelineState.ANALYZING);
        List<PersonProfile> qualified = qualified(run, target, profiles);
        run.setProfilesQualified(qualified.size());
        metrics.recordProfilesQualified(qualified.size());
        metrics.recordProfilesExcluded(profiles.size() - qualified.size());
        log.info("Qualified profiles: {} of {}", qualified.size(), profiles.size());

        run.transitionTo(PipelineState.CLASSIFYING);
        List<ClassifiedCandidate> classified = buyerGroupIdentifier.classify(qualified, sellerProfile, run.getStrategy());

        run.transitionTo(PipelineState.SELECTING);
        Identification identification = buyerGroupIdentifier.assemble(run.getCompanyName(), classified,
                sellerProfile, run.getMaxGroupSize());
        run.addWarnings(identification.warnings());

        run.transitionTo(PipelineState.DONE);
        return report(run, identification.buyerGroup());
    }

    private List<PersonProfile> qualified(PipelineRun run, Target target, Iterable<PersonProfile> profiles) {
        List<PersonProfile> sorted = new ArrayList<>();
        profiles.forEach(sorted::add);
        sorted.sort(Comparator.comparing(PersonProfile::getId));

        List<PersonProfile> accepted = new ArrayList<>();
        for (PersonProfile profile : sorted) {
            AnalysisResult result = profileAnalyzer.analyze(profile, target, run.getSellerProfile());
            if (result.accepted()) {
                accepted.add(result.profile());
            }
        }
        return accepted;
    }

    private List<String> mergedAliases(PipelineRun run) {
        Set<String> aliases = new LinkedHashSet<>(run.getRunConfig().getCompanyAliases());
        aliases.addAll(run.getSellerProfile().getCompanyAliases());
        return new ArrayList<>(aliases);
    }

    // ---------------------------------------------------------------- report

    private Report failed(PipelineRun run, Throwable e) {
        if (e instanceof ProviderUnavailableException) {
            log.error("Pipeline for {} failed: {}", run.getCompanyName(), e.getMessage());
        } else {
            log.error("Pipeline for {} failed in {}: {}", run.getCompanyName(), run.getState(), e.getMessage(), e);
            run.warn(ReportWarning.PIPELINE_FAILED, "unexpected error in " + run.getState() + ": " + e.getMessage());
        }
        if (!run.getState().isTerminal()) {
            run.transitionTo(PipelineState.FAILED);
        }
        return report(run, BuyerGroup.empty(run.getCompanyName()));
    }

    private Report report(PipelineRun run, BuyerGroup group) {
        return Report.builder()
                .companyName(run.getCompanyName())
                .sellerProfile(run.getSellerProfile().getName())
                .state(run.getState())
                .dryRun(run.isDryRun())
                .buyerGroup(group)
                .creditsUsed(run.getLedger().snapshot(providerConfig.getUsdPerCredit()))
                .warnings(run.getWarnings())
                .queriesIssued(run.getQueriesIssued())
                .candidatesFound(run.getCandidatesFound())
                .profilesCollected(run.getProfilesCollected())
                .profilesQualified(run.getProfilesQualified())
                .generatedAt(clock.instant())
                .build();
    }

    private void recordMetrics(Report report) {
        metrics.recordRun(report.getState());
        metrics.recordCandidatesFound(report.getCandidatesFound());
        metrics.recordProfilesCollected(report.getProfilesCollected());
        metrics.recordMembersSelected(report.getBuyerGroup().getTotalMembers());
        metrics.updateLastRunStats(report.getCandidatesFound(), report.getBuyerGroup().getTotalMembers(),
                report.getCreditsUsed().total());

        log.info(SEPARATOR);
        log.info("PIPELINE SUMMARY: {} -> {} ({} members, {} credits, {} warnings)",
                report.getCompanyName(), report.getState(), report.getBuyerGroup().getTotalMembers(),
                report.getCreditsUsed().total(), report.getWarnings().size());
        log.info(SEPARATOR);
    }

    private record SearchOutcome(SearchQuery query, ProviderResult<List<String>> result) {
    }

    /**
     * De-duplicated candidate ids in query order, plus the number of dry-run searches whose ids are unknown.
     */
    private record Candidates(List<String> ids, int unresolvedSearches) {
    }

    private static final class DryRunPlan {
        private int charged;
        private int cached;
        private int skipped;
        private long unresolved;
    }

    private static final class CollectStats {
        private int attempted;
        private int softFailures;
        private int hardFailures;
    }
}
