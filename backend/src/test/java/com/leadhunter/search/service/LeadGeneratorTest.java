package com.leadhunter.search.service;

import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.LeadEnricher;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.enrichment.stage.DomainDerivationStage;
import com.leadhunter.enrichment.stage.EmailPatternStage;
import com.leadhunter.enrichment.stage.NormalizationStage;
import com.leadhunter.enrichment.stage.ScoringStage;
import com.leadhunter.search.model.ExpandedQuery;
import com.leadhunter.search.model.Lead;
import com.leadhunter.search.model.LeadRecord;
import com.leadhunter.search.model.LeadSearchRequest;
import com.leadhunter.search.model.LeadSearchResult;
import com.leadhunter.search.model.Query;
import com.leadhunter.search.model.SourceRunStats;
import com.leadhunter.search.query.QueryExpander;
import com.leadhunter.search.source.AcquisitionException;
import com.leadhunter.search.source.SourceAcquirer;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.leadhunter.search.service.StubAcquirer.hit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeadGeneratorTest {
    private static final LeadSearchRequest REQUEST = new LeadSearchRequest("Director", "technology", "Berlin", null, null);

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    private LeadGenerator generator(List<SourceAcquirer> acquirers, int maxResults) {
        LeadEnricher enricher = new LeadEnricher(List.of(
            new DomainDerivationStage(),
            new EmailPatternStage(),
            new ScoringStage(),
            new NormalizationStage()
        ));
        return new LeadGenerator(
            new QueryExpander(3),
            acquirers,
            enricher,
            new LeadSeedFactory(),
            new ResultAggregator(),
            new GeneratorSettings(3, Duration.ofSeconds(5), maxResults, "en"),
            Executors.newFixedThreadPool(3),
            Executors.newFixedThreadPool(2),
            sleeps::add,
            Clock.systemUTC()
        );
    }

    @Test
    void sameUrlFromTwoSourcesBecomesOneEnrichedLead() {
        StubAcquirer network = StubAcquirer.returning("linkedin",
            hit("linkedin", "https://x/in/jdoe", "John Doe", "Engineering Director at Acme"));
        StubAcquirer search = StubAcquirer.returning("google",
            hit("google", "https://x/in/jdoe", null, "John Doe - Director - Acme | LinkedIn"));

        LeadSearchResult result;
        try (LeadGenerator generator = generator(List.of(network, search), 100)) {
            result = generator.generate(REQUEST);
            assertThat(generator.state()).isEqualTo(RunState.DONE);
        }

        assertThat(result.status()).isEqualTo(LeadSearchResult.COMPLETED);
        assertThat(result.rawHits()).isEqualTo(2);
        assertThat(result.leads()).singleElement().satisfies(lead -> {
            assertThat(lead.source()).isEqualTo("linkedin");
            assertThat(lead.name()).isEqualTo("John Doe");
            assertThat(lead.title()).isEqualTo("Engineering Director");
            assertThat(lead.company()).isEqualTo("Acme");
            assertThat(lead.emails()).hasSize(5).allSatisfy(email -> assertThat(email).endsWith("@acme.com"));
            assertThat(lead.emails().get(0)).isEqualTo("john.doe@acme.com");
            assertThat(lead.score()).isEqualTo(0.9);
        });
        assertThat(result.enrichmentOutcomes().get("https://x/in/jdoe"))
            .extracting(StageOutcome::stage)
            .containsExactly("domain-derivation", "email-patterns", "scoring", "normalization");
    }

    @Test
    void blockedSourceIsRetriedWithFixedDelayWithoutFailingTheRun() {
        StubAcquirer healthy = StubAcquirer.returning("linkedin",
            hit("linkedin", "https://x/in/a", "Ann Lee", "Director at Initech"));
        StubAcquirer blocked = StubAcquirer.failing("google", AcquisitionException.Kind.BLOCKED);

        LeadSearchResult result;
        try (LeadGenerator generator = generator(List.of(healthy, blocked), 100)) {
            result = generator.generate(REQUEST);
        }

        assertThat(result.status()).isEqualTo(LeadSearchResult.COMPLETED_WITH_ERRORS);
        assertThat(result.leads()).extracting(LeadRecord::url).containsExactly("https://x/in/a");
        assertThat(blocked.queries).hasSize(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(5));
        SourceRunStats googleStats = result.sources().get(1);
        assertThat(googleStats.sourceName()).isEqualTo("google");
        assertThat(googleStats.attempts()).isEqualTo(3);
        assertThat(googleStats.failedAcquisitions()).isEqualTo(1);
        assertThat(googleStats.lastError()).startsWith("BLOCKED");
    }

    @Test
    void emptyResultPageIsNotRetried() {
        StubAcquirer empty = StubAcquirer.failing("baidu", AcquisitionException.Kind.PARSE_EMPTY);
        StubAcquirer healthy = StubAcquirer.returning("linkedin",
            hit("linkedin", "https://x/in/a", "Ann Lee", "Director at Initech"));

        LeadSearchResult result;
        try (LeadGenerator generator = generator(List.of(healthy, empty), 100)) {
            result = generator.generate(REQUEST);
        }

        assertThat(empty.queries).hasSize(1);
        assertThat(sleeps).isEmpty();
        assertThat(result.leads()).hasSize(1);
    }

    @Test
    void everySourceFailingIsReportedButNotThrown() {
        StubAcquirer first = StubAcquirer.failing("linkedin", AcquisitionException.Kind.TRANSPORT);
        StubAcquirer second = StubAcquirer.failing("google", AcquisitionException.Kind.BLOCKED);

        LeadSearchResult result;
        try (LeadGenerator generator = generator(List.of(first, second), 100)) {
            result = generator.generate(REQUEST);
        }

        assertThat(result.status()).isEqualTo(LeadSearchResult.NO_SOURCES_REACHABLE);
        assertThat(result.leads()).isEmpty();
        assertThat(result.sources()).allSatisfy(stats -> assertThat(stats.failedAcquisitions()).isEqualTo(1));
    }

    @Test
    void leadsAreOrderedByScoreAndCappedAtMaxResults() {
        StubAcquirer source = StubAcquirer.returning("linkedin",
            hit("linkedin", "https://x/in/intern", "Sam", "Intern at Acme"),
            hit("linkedin", "https://x/in/vp", "Kim Park", "VP Sales at Acme"),
            hit("linkedin", "https://x/in/founder", "Lee Chen", "Founder at Beta"),
            hit("linkedin", "https://x/in/extra", "Extra Person", "Director at Gamma"));

        LeadSearchResult result;
        try (LeadGenerator generator = generator(List.of(source), 3)) {
            result = generator.generate(REQUEST);
        }

        assertThat(result.leads()).extracting(LeadRecord::url)
            .containsExactly("https://x/in/vp", "https://x/in/founder", "https://x/in/intern");
        assertThat(result.leads()).extracting(LeadRecord::score).containsExactly(0.9, 0.85, 0.5);
    }

    @Test
    void eachRegionIsSearchedInTurn() {
        StubAcquirer source = StubAcquirer.returning("linkedin");
        LeadSearchRequest request = new LeadSearchRequest("Director", "technology", "Berlin", "de", List.of("de", " us ", "DE"));

        try (LeadGenerator generator = generator(List.of(source), 100)) {
            generator.generate(request);
        }

        assertThat(source.queries).extracting(expanded -> expanded.query().location()).containsExactly("DE", "US");
        assertThat(source.queries).extracting(expanded -> expanded.query().languageCode()).containsOnly("de");
    }

    @Test
    void regionKeepsAnExplicitCityAndCountry() {
        Query base = new Query("cto", "", "Berlin, Germany", "en");

        assertThat(LeadGenerator.regionQueries(base, List.of("DE")))
            .extracting(Query::location)
            .containsExactly("Berlin, Germany, DE");
        assertThat(LeadGenerator.regionQueries(base, List.of())).containsExactly(base);
    }

    @Test
    void blankJobTitleIsRejected() {
        try (LeadGenerator generator = generator(List.of(), 100)) {
            assertThatThrownBy(() -> generator.generate(new LeadSearchRequest(" ", null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void cancellationReturnsWhatWasCollected() throws Exception {
        AtomicReference<LeadGenerator> current = new AtomicReference<>();
        CountDownLatch fastCalled = new CountDownLatch(1);
        StubAcquirer fast = new StubAcquirer("linkedin", query -> {
            fastCalled.countDown();
            return List.of(hit("linkedin", "https://x/in/a", "Ann Lee", "Director at Initech"));
        });
        StubAcquirer slow = new StubAcquirer("google", query -> {
            fastCalled.await();
            Thread.sleep(100);
            current.get().cancel();
            new CountDownLatch(1).await();
            return List.of();
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try (LeadGenerator generator = generator(List.of(fast, slow), 100)) {
            current.set(generator);
            Future<LeadSearchResult> running = caller.submit(() -> generator.generate(REQUEST));

            LeadSearchResult result = running.get(10, TimeUnit.SECONDS);

            assertThat(generator.isCancelled()).isTrue();
            assertThat(result.status()).isEqualTo(LeadSearchResult.CANCELLED);
            assertThat(result.leads()).extracting(LeadRecord::url).containsExactly("https://x/in/a");
            assertThat(slow.closed).isTrue();
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void expansionFeedsTheAcquirers() {
        StubAcquirer source = StubAcquirer.returning("linkedin");

        try (LeadGenerator generator = generator(List.of(source), 100)) {
            generator.generate(REQUEST);
        }

        ExpandedQuery expanded = source.queries.get(0);
        assertThat(expanded.titles()).hasSize(3).contains("vp");
        assertThat(expanded.locations()).containsExactly("Berlin");
    }

    @Test
    void cancelArrivingWhileEnrichmentIsSubmittedStillStopsThatTask() throws Exception {
        AtomicReference<LeadGenerator> current = new AtomicReference<>();
        EnrichmentStage stall = new EnrichmentStage() {
            @Override
            public String name() {
                return "stall";
            }

            @Override
            public StageOutcome apply(Lead lead) throws InterruptedException {
                new CountDownLatch(1).await();
                return StageOutcome.skipped("stall", "never released");
            }
        };
        ExecutorService cancellingOnSubmit = new ThreadPoolExecutor(
            1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>()
        ) {
            @Override
            public <T> Future<T> submit(Callable<T> task) {
                current.get().cancel();
                return super.submit(task);
            }
        };
        StubAcquirer source = StubAcquirer.returning("linkedin",
            hit("linkedin", "https://x/in/a", "Ann Lee", "Director at Initech"));

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try (LeadGenerator generator = new LeadGenerator(
            new QueryExpander(3),
            List.of(source),
            new LeadEnricher(List.of(stall)),
            new LeadSeedFactory(),
            new ResultAggregator(),
            new GeneratorSettings(3, Duration.ofSeconds(5), 100, "en"),
            Executors.newFixedThreadPool(1),
            cancellingOnSubmit,
            sleeps::add,
            Clock.systemUTC()
        )) {
            current.set(generator);
            Future<LeadSearchResult> running = caller.submit(() -> generator.generate(REQUEST));

            LeadSearchResult result = running.get(10, TimeUnit.SECONDS);

            assertThat(result.status()).isEqualTo(LeadSearchResult.CANCELLED);
            assertThat(result.leads()).extracting(LeadRecord::url).containsExactly("https://x/in/a");
            assertThat(result.enrichmentOutcomes().get("https://x/in/a")).isEmpty();
        } finally {
            caller.shutdownNow();
        }
    }
}
