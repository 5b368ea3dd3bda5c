package com.leadhunter.search.service;

import com.leadhunter.enrichment.EnrichmentResult;
import com.leadhunter.enrichment.LeadEnricher;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.search.model.ExpandedQuery;
import com.leadhunter.search.model.Lead;
import com.leadhunter.search.model.LeadRecord;
import com.leadhunter.search.model.LeadSearchRequest;
import com.leadhunter.search.model.LeadSearchResult;
import com.leadhunter.search.model.Query;
import com.leadhunter.search.model.RawHit;
import com.leadhunter.search.model.SourceRunStats;
import com.leadhunter.search.query.QueryExpander;
import com.leadhunter.search.source.AcquisitionException;
import com.leadhunter.search.source.SourceAcquirer;
import com.leadhunter.search.throttle.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One lead-generation run: expand the query per region, dispatch every acquirer in parallel for each region,
 * merge hits by url, enrich the seeds in parallel and order the result. Owns its acquirers and worker pools;
 * closing the generator releases them.
 */
public class LeadGenerator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeadGenerator.class);

    private final QueryExpander queryExpander;
    private final List<SourceAcquirer> acquirers;
    private final LeadEnricher enricher;
    private final LeadSeedFactory seedFactory;
    private final ResultAggregator aggregator;
    private final GeneratorSettings settings;
    private final ExecutorService acquisitionExecutor;
    private final ExecutorService enrichmentExecutor;
    private final Sleeper sleeper;
    private final Clock clock;
    private final CancellationSignal cancellation = new CancellationSignal();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile RunState state = RunState.NEW;
    private boolean closed;

    public LeadGenerator(
        QueryExpander queryExpander,
        List<SourceAcquirer> acquirers,
        LeadEnricher enricher,
        LeadSeedFactory seedFactory,
        ResultAggregator aggregator,
        GeneratorSettings settings,
        ExecutorService acquisitionExecutor,
        ExecutorService enrichmentExecutor,
        Sleeper sleeper,
        Clock clock
    ) {
        this.queryExpander = queryExpander;
        this.acquirers = List.copyOf(acquirers);
        this.enricher = enricher;
        this.seedFactory = seedFactory;
        this.aggregator = aggregator;
        this.settings = settings;
        this.acquisitionExecutor = acquisitionExecutor;
        this.enrichmentExecutor = enrichmentExecutor;
        this.sleeper = sleeper;
        this.clock = clock;
        cancellation.onCancel(() -> {
            for (Future<?> future : inFlight) {
                future.cancel(true);
            }
        });
    }

    public RunState state() {
        return state;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Stops in-flight acquisitions and enrichments. The running {@link #generate} call returns what it has.
     */
    public void cancel() {
        log.info("Cancelling lead generation in state {}", state);
        cancellation.cancel();
    }

    public LeadSearchResult generate(LeadSearchRequest request) {
        Instant startedAt = clock.instant();
        Query base = toQuery(request);

        transition(RunState.EXPANDING);
        List<ExpandedQuery> expandedQueries = new ArrayList<>();
        for (Query regionQuery : regionQueries(base, request.normalizedRegions())) {
            expandedQueries.add(queryExpander.expand(regionQuery));
        }

        transition(RunState.DISPATCHING);
        Map<String, SourceTally> tallies = new LinkedHashMap<>();
        for (SourceAcquirer acquirer : acquirers) {
            tallies.put(acquirer.name(), new SourceTally(acquirer.name()));
        }
        List<RawHit> hits = dispatch(expandedQueries, tallies);

        transition(RunState.MERGING);
        List<Lead> seeds = seedFactory.merge(hits, settings.maxResults());
        log.info("Merged {} raw hits into {} unique leads", hits.size(), seeds.size());

        transition(RunState.DONE);
        Map<String, List<StageOutcome>> outcomes = new LinkedHashMap<>();
        List<Lead> enriched = enrich(seeds, outcomes);
        List<LeadRecord> leads = aggregator.aggregate(enriched);

        if (cancellation.isCancelled()) {
            closeAcquirers();
        }
        List<SourceRunStats> sources = tallies.values().stream().map(SourceTally::snapshot).toList();
        String status = status(tallies);
        log.info("Lead generation finished with status {}: {} leads from {} raw hits", status, leads.size(), hits.size());
        return new LeadSearchResult(startedAt, clock.instant(), status, hits.size(), sources, leads, outcomes);
    }

    /**
     * Regions are searched one after another; within a region all acquirers run in parallel. Hits are collected in
     * region order, then acquirer order, so merge order does not depend on timing.
     */
    List<RawHit> dispatch(List<ExpandedQuery> expandedQueries, Map<String, SourceTally> tallies) {
        List<RawHit> collected = new ArrayList<>();
        for (ExpandedQuery expanded : expandedQueries) {
            if (cancellation.isCancelled()) {
                break;
            }
            log.info("Dispatching {} sources for location '{}'", acquirers.size(), expanded.query().location());
            List<Future<List<RawHit>>> futures = new ArrayList<>();
            for (SourceAcquirer acquirer : acquirers) {
                SourceTally tally = tallies.get(acquirer.name());
                futures.add(track(acquisitionExecutor.submit(() -> acquireWithRetry(acquirer, expanded, tally))));
            }
            for (int i = 0; i < futures.size(); i++) {
                collected.addAll(await(futures.get(i), acquirers.get(i).name(), List.of()));
            }
        }
        return collected;
    }

    private List<RawHit> acquireWithRetry(SourceAcquirer acquirer, ExpandedQuery query, SourceTally tally) {
        tally.startAcquisition();
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            if (cancellation.isCancelled()) {
                return List.of();
            }
            tally.attempt();
            try {
                List<RawHit> hits = acquirer.acquire(query);
                tally.succeeded(hits.size());
                return hits;
            } catch (AcquisitionException e) {
                tally.error(e.kind() + ": " + e.getMessage());
                if (!e.isRetryable()) {
                    log.warn("{} returned no usable results for '{}': {}", acquirer.name(), query.query().location(), e.getMessage());
                    tally.failed();
                    return List.of();
                }
                if (attempt < settings.maxAttempts()) {
                    log.info("{} attempt {}/{} failed ({}), retrying in {} ms",
                        acquirer.name(), attempt, settings.maxAttempts(), e.kind(), settings.retryDelay().toMillis());
                    try {
                        sleeper.sleep(settings.retryDelay());
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        return List.of();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("{} acquisition interrupted", acquirer.name());
                return List.of();
            } catch (RuntimeException e) {
                log.warn("{} acquisition failed unexpectedly", acquirer.name(), e);
                tally.error(e.toString());
                tally.failed();
                return List.of();
            }
        }
        log.warn("{} gave up on '{}' after {} attempts", acquirer.name(), query.query().location(), settings.maxAttempts());
        tally.failed();
        return List.of();
    }

    private List<Lead> enrich(List<Lead> seeds, Map<String, List<StageOutcome>> outcomes) {
        if (seeds.isEmpty()) {
            return List.of();
        }
        List<Future<EnrichmentResult>> futures = new ArrayList<>();
        if (!cancellation.isCancelled()) {
            for (Lead seed : seeds) {
                futures.add(track(enrichmentExecutor.submit(() -> enricher.enrich(seed))));
            }
        }
        List<Lead> enriched = new ArrayList<>(seeds.size());
        for (int i = 0; i < seeds.size(); i++) {
            Lead seed = seeds.get(i);
            EnrichmentResult result = i < futures.size() ? await(futures.get(i), seed.getUrl(), null) : null;
            if (result == null) {
                enriched.add(seed);
                outcomes.put(seed.getUrl(), List.of());
            } else {
                enriched.add(result.lead());
                outcomes.put(seed.getUrl(), result.outcomes());
            }
        }
        return enriched;
    }

    /**
     * Registers a submitted task for cancellation. A cancel that ran its listener before the registration is caught
     * by the second check.
     */
    private <T> Future<T> track(Future<T> future) {
        inFlight.add(future);
        if (cancellation.isCancelled()) {
            future.cancel(true);
        }
        return future;
    }

    private <T> T await(Future<T> future, String label, T fallback) {
        try {
            return future.get();
        } catch (CancellationException e) {
            log.debug("Task for {} cancelled", label);
            return fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            return fallback;
        } catch (ExecutionException e) {
            log.warn("Task for {} failed", label, e.getCause());
            return fallback;
        } finally {
            inFlight.remove(future);
        }
    }

    private String status(Map<String, SourceTally> tallies) {
        if (cancellation.isCancelled()) {
            return LeadSearchResult.CANCELLED;
        }
        boolean allFailed = !tallies.isEmpty() && tallies.values().stream().allMatch(SourceTally::allFailed);
        if (allFailed) {
            return LeadSearchResult.NO_SOURCES_REACHABLE;
        }
        boolean anyFailed = tallies.values().stream().anyMatch(tally -> tally.snapshot().failedAcquisitions() > 0);
        return anyFailed ? LeadSearchResult.COMPLETED_WITH_ERRORS : LeadSearchResult.COMPLETED;
    }

    private Query toQuery(LeadSearchRequest request) {
        if (request == null || request.jobTitle() == null || request.jobTitle().isBlank()) {
            throw new IllegalArgumentException("jobTitle is required");
        }
        String language = request.languageCode() == null || request.languageCode().isBlank()
            ? settings.defaultLanguageCode()
            : request.languageCode();
        return new Query(request.jobTitle(), request.industry(), request.location(), language);
    }

    /**
     * One query per region code; a location that already names a place keeps it and gains the code as suffix.
     */
    static List<Query> regionQueries(Query base, List<String> regions) {
        if (regions.isEmpty()) {
            return List.of(base);
        }
        List<Query> out = new ArrayList<>();
        for (String region : regions) {
            String location = base.location().contains(",") ? base.location() + ", " + region : region;
            out.add(base.withLocation(location));
        }
        return out;
    }

    private void transition(RunState next) {
        log.debug("Lead generation {} -> {}", state, next);
        state = next;
    }

    private void closeAcquirers() {
        for (SourceAcquirer acquirer : acquirers) {
            try {
                acquirer.close();
            } catch (RuntimeException e) {
                log.warn("Closing {} failed", acquirer.name(), e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        acquisitionExecutor.shutdownNow();
        enrichmentExecutor.shutdownNow();
        closeAcquirers();
    }
}
