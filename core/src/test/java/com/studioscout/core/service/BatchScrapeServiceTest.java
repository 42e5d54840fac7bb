package com.studioscout.core.service;

import com.studioscout.core.api.IDocumentLoader;
import com.studioscout.core.extract.fields.Fixtures;
import com.studioscout.core.http.RetrievalException;
import com.studioscout.core.model.ContactKind;
import com.studioscout.core.model.ExtractionError;
import com.studioscout.core.model.FacilityRecord;
import com.studioscout.core.model.FetchedPage;
import com.studioscout.core.model.ItemState;
import com.studioscout.core.model.ScrapeConfig;
import com.studioscout.core.util.ProgressListener;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchScrapeServiceTest {

    private HttpServer server;
    private String base;

    @BeforeEach
    void startServer() throws Exception {
        byte[] page = Fixtures.html(Fixtures.STUDIO_PAGE).getBytes(StandardCharsets.UTF_8);
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/s/poda-studio", ex -> {
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, page.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(page); }
        });
        server.createContext("/s/gone", ex -> {
            ex.sendResponseHeaders(404, -1);
            ex.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        if (server != null) server.stop(0);
    }

    private static ScrapeConfig fastCfg() {
        ScrapeConfig c = ScrapeConfig.defaults().setRps(1000).setConcurrency(2).setTimeoutMs(5000);
        c.getRetry().setMaxAttempts(1);
        return c;
    }

    @Test
    @DisplayName("성공 1건 + 404 1건 ⇒ 레코드 1, RetrievalError 1, 배치는 계속")
    void one_good_one_missing() {
        URI ok = URI.create(base + "/s/poda-studio");
        URI gone = URI.create(base + "/s/gone");

        BatchResult r = new BatchScrapeService(fastCfg()).run(List.of(gone, ok));

        assertThat(r.getRecords()).hasSize(1);
        FacilityRecord rec = r.getRecords().get(0);
        assertThat(rec.getLocator()).isEqualTo(ok);
        assertThat(rec.getName()).contains("Poda Studio");
        assertThat(rec.contact(ContactKind.PHONE)).contains("+49301234567");
        assertThat(rec.getAmenities()).containsExactly("Duschen", "Umkleide", "Matten");

        assertThat(r.getErrors()).singleElement().satisfies(e -> {
            assertThat(e.getKind()).isEqualTo(ExtractionError.Kind.RETRIEVAL);
            assertThat(e.getLocator()).isEqualTo(gone);
        });
        assertThat(r.getOutcomes()).extracting(BatchResult.ItemOutcome::state)
                .containsExactly(ItemState.LOAD_FAILED, ItemState.DONE);
        assertThat(r.allFailed()).isFalse();
        assertThat(r.getStats().requestsTotal).isEqualTo(2);
    }

    @Test
    void records_follow_input_order_and_duplicates_are_scraped_each_time() {
        List<URI> seen = new ArrayList<>();
        IDocumentLoader loader = url -> {
            synchronized (seen) { seen.add(url); }
            return FetchedPage.builder().url(url).statusCode(200)
                    .body("<h1 class='MuiTypography-root MuiTypography-h1 css-qinhw0'>" + url.getPath() + "</h1>")
                    .build();
        };
        List<URI> in = new ArrayList<>();
        for (int i = 0; i < 12; i++) in.add(URI.create("https://example.com/p" + i));
        in.add(URI.create("https://example.com/p3"));

        BatchResult r = new BatchScrapeService(fastCfg().setConcurrency(4), loader).run(in);

        assertThat(seen).hasSize(13);
        assertThat(r.getRecords()).extracting(rec -> rec.getName().orElse(""))
                .containsExactly("/p0", "/p1", "/p2", "/p3", "/p4", "/p5", "/p6", "/p7", "/p8", "/p9", "/p10", "/p11", "/p3");
        assertThat(r.getOutcomes()).hasSize(13);
        assertThat(r.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("같은 로케이터 두 번 ⇒ 레코드 2, 결과 2")
    void same_locator_twice_yields_two_records() {
        URI a = URI.create("https://example.com/a");
        IDocumentLoader loader = url -> FetchedPage.builder().url(url).statusCode(200).body("<p>x</p>").build();

        BatchResult r = new BatchScrapeService(fastCfg(), loader).run(List.of(a, a));

        assertThat(r.getRecords()).extracting(FacilityRecord::getLocator).containsExactly(a, a);
        assertThat(r.getOutcomes()).extracting(BatchResult.ItemOutcome::state)
                .containsExactly(ItemState.DONE, ItemState.DONE);
    }

    @Test
    void stats_are_counted_per_run() {
        IDocumentLoader loader = url -> FetchedPage.builder().url(url).statusCode(200).attempts(2).build();
        BatchScrapeService svc = new BatchScrapeService(fastCfg(), loader);

        BatchResult first = svc.run(List.of(URI.create("https://example.com/1")));
        BatchResult second = svc.run(List.of(URI.create("https://example.com/2")));

        assertThat(first.getStats().requestsTotal).isEqualTo(2);
        assertThat(second.getStats().requestsTotal).isEqualTo(2);
        assertThat(second.getStats().retriesTotal).isEqualTo(1);
    }

    @Test
    void attempts_of_a_failed_load_are_counted() {
        IDocumentLoader loader = url -> { throw new RetrievalException(url, 503, "HTTP status 503", null, 3); };

        BatchResult r = new BatchScrapeService(fastCfg(), loader).run(List.of(URI.create("https://example.com/x")));

        assertThat(r.getStats().requestsTotal).isEqualTo(3);
        assertThat(r.getStats().retriesTotal).isEqualTo(2);
    }

    @Test
    void observed_concurrency_never_exceeds_configured_limit() {
        final int CC = 3;
        AtomicInteger live = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        IDocumentLoader loader = url -> {
            int now = live.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try { Thread.sleep(50); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
            live.decrementAndGet();
            return FetchedPage.builder().url(url).statusCode(200).body("<p>x</p>").build();
        };
        List<URI> in = new ArrayList<>();
        for (int i = 0; i < 20; i++) in.add(URI.create("https://example.com/c" + i));

        BatchScrapeService svc = new BatchScrapeService(fastCfg().setConcurrency(CC), loader);
        BatchResult r = svc.run(in);

        assertThat(peak.get()).isLessThanOrEqualTo(CC);
        assertThat(r.getStats().maxObservedConcurrency).isBetween(1, CC);
        assertThat(r.getRecords()).hasSize(20);
        assertThat(r.getRecords()).allMatch(FacilityRecord::isEmpty);
    }

    @Test
    void unexpected_loader_failure_becomes_retrieval_error() {
        IDocumentLoader loader = url -> {
            if (url.getPath().endsWith("bad")) throw new IllegalStateException("driver crashed");
            return FetchedPage.builder().url(url).statusCode(200).body("").build();
        };
        URI bad = URI.create("https://example.com/bad");

        BatchResult r = new BatchScrapeService(fastCfg(), loader)
                .run(List.of(URI.create("https://example.com/good"), bad));

        assertThat(r.getRecords()).hasSize(1);
        assertThat(r.getErrors()).singleElement().satisfies(e -> {
            assertThat(e.isRetrieval()).isTrue();
            assertThat(e.getLocator()).isEqualTo(bad);
            assertThat(e.getCauseType()).isEqualTo("IllegalStateException");
        });
    }

    @Test
    void every_locator_failing_is_reported_as_all_failed() {
        IDocumentLoader loader = url -> { throw new RetrievalException(url, 500, "HTTP status 500"); };

        BatchResult r = new BatchScrapeService(fastCfg(), loader)
                .run(List.of(URI.create("https://example.com/a"), URI.create("https://example.com/b")));

        assertThat(r.getRecords()).isEmpty();
        assertThat(r.retrievalErrorCount()).isEqualTo(2);
        assertThat(r.allFailed()).isTrue();
    }

    @Test
    void empty_input_is_a_valid_empty_batch() {
        BatchResult r = new BatchScrapeService(fastCfg(), url -> { throw new AssertionError("not called"); })
                .run(List.of());
        assertThat(r.getRecords()).isEmpty();
        assertThat(r.getErrors()).isEmpty();
        assertThat(r.allFailed()).isFalse();
    }

    @Test
    void cancel_flag_set_before_run_raises_cancellation() {
        BatchScrapeService svc = new BatchScrapeService(fastCfg(),
                url -> FetchedPage.builder().url(url).statusCode(200).build());
        assertThatThrownBy(() -> svc.run(List.of(URI.create("https://example.com/")), null, new AtomicBoolean(true)))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void progress_reaches_total() {
        List<Integer> done = new ArrayList<>();
        List<ProgressListener.Phase> phases = new ArrayList<>();
        BatchScrapeService svc = new BatchScrapeService(fastCfg(),
                url -> FetchedPage.builder().url(url).statusCode(200).build());
        svc.run(List.of(URI.create("https://example.com/1"), URI.create("https://example.com/2")),
                (phase, d, t) -> {
                    synchronized (done) {
                        phases.add(phase);
                        if (phase == ProgressListener.Phase.EXTRACT) done.add(d);
                    }
                },
                null);
        assertThat(phases.get(0)).isEqualTo(ProgressListener.Phase.LOAD);
        assertThat(done).containsExactlyInAnyOrder(1, 2);
    }
}
