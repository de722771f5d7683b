package com.landrecords.ec.service;

import com.landrecords.ec.config.BackoffPolicy;
import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.CrawlSummary;
import com.landrecords.ec.model.District;
import com.landrecords.ec.model.Hobli;
import com.landrecords.ec.model.Taluka;
import com.landrecords.ec.model.Village;
import com.landrecords.ec.repository.LocationStore;
import com.landrecords.ec.repository.ReferentialIntegrityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Walks the remote hierarchy top-down and writes it into the {@link LocationStore}.
 *
 * Districts are fetched first; a failure there aborts the crawl. Each district subtree
 * (talukas, hoblis, villages) then runs on a bounded worker pool. Inside a subtree every
 * parent is written before its children are fetched. A fetch that still fails after the
 * backoff policy is exhausted skips that subtree and is counted, so one bad node never
 * stops the rest of the crawl. A node whose write fails is counted and not descended into.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchyCrawler {

    private final HierarchyApiClient apiClient;
    private final LocationStore store;
    private final BackoffPolicy backoffPolicy;
    private final EcSearchProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public boolean isRunning() {
        return running.get();
    }

    /** Crawl every district. */
    public CrawlSummary crawl() {
        return crawl(null);
    }

    /**
     * Crawl the hierarchy, optionally limited to one district's subtree.
     *
     * @param onlyDistrict district code to descend into, or null for all
     * @throws FetchFailureException if the district list cannot be fetched
     */
    public CrawlSummary crawl(Integer onlyDistrict) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A crawl is already running");
        }
        Counters counters = new Counters();
        LocalDateTime startedAt = LocalDateTime.now(clock);
        ThreadPoolTaskExecutor executor = null;

        try {
            log.info("Starting hierarchy crawl{}", onlyDistrict != null ? " for district " + onlyDistrict : "");

            List<District> districts = fetch("districts", apiClient::fetchDistricts);
            districts = writeAll(districts, store::upsertDistrict, counters.districts, counters);
            log.info("{} districts ingested", districts.size());

            if (onlyDistrict != null) {
                districts = districts.stream().filter(d -> d.code() == onlyDistrict).toList();
                if (districts.isEmpty()) {
                    log.warn("District {} not returned by the API; nothing below it to crawl", onlyDistrict);
                }
            }

            executor = newExecutor();
            List<Future<?>> subtrees = new ArrayList<>();
            for (District district : districts) {
                subtrees.add(executor.submit(() -> crawlDistrict(district, counters)));
            }
            for (int i = 0; i < subtrees.size(); i++) {
                awaitSubtree(subtrees.get(i), districts.get(i), counters);
            }

            CrawlSummary summary = counters.toSummary(startedAt, LocalDateTime.now(clock));
            store.recordCrawlSummary(summary);
            log.info("Crawl complete. districts={} talukas={} hoblis={} villages={} | skipped fetches: "
                            + "taluka={} hobli={} village={} | write failures={} | failed subtrees={}",
                    summary.getDistrictsIngested(), summary.getTalukasIngested(),
                    summary.getHoblisIngested(), summary.getVillagesIngested(),
                    summary.getTalukaFetchesSkipped(), summary.getHobliFetchesSkipped(),
                    summary.getVillageFetchesSkipped(), summary.getWriteFailures(), summary.getSubtreeFailures());
            return summary;

        } catch (FetchFailureException e) {
            log.error("Crawl aborted, district list unavailable: {}", e.getMessage());
            throw e;
        } finally {
            if (executor != null) {
                executor.shutdown();
            }
            running.set(false);
        }
    }

    // ── Subtree walk ─────────────────────────────────────────────────────────

    private void crawlDistrict(District district, Counters counters) {
        List<Taluka> talukas = fetchOrSkip("talukas of district " + district.code(),
                () -> apiClient.fetchTalukas(district.code()), counters.talukaSkips);
        if (talukas == null) return;
        talukas = writeAll(talukas, store::upsertTaluka, counters.talukas, counters);
        log.info("District {} ({}): {} talukas", district.name(), district.code(), talukas.size());

        for (Taluka taluka : talukas) {
            List<Hobli> hoblis = fetchOrSkip("hoblis of taluka " + taluka.code(),
                    () -> apiClient.fetchHoblis(taluka.code()), counters.hobliSkips);
            if (hoblis == null) continue;
            hoblis = writeAll(hoblis, store::upsertHobli, counters.hoblis, counters);

            for (Hobli hobli : hoblis) {
                List<Village> villages = fetchOrSkip("villages of hobli " + hobli.code(),
                        () -> apiClient.fetchVillages(hobli.code()), counters.villageSkips);
                if (villages != null) {
                    writeAll(villages, store::upsertVillage, counters.villages, counters);
                }
                sleep(properties.getCrawl().getVillageFetchDelay().toMillis());
            }
            log.debug("  Taluka {} ({}): {} hoblis", taluka.name(), taluka.code(), hoblis.size());
        }
    }

    private void awaitSubtree(Future<?> subtree, District district, Counters counters) {
        try {
            subtree.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for district {} subtree", district.code());
        } catch (ExecutionException e) {
            counters.subtreeFailures.incrementAndGet();
            log.error("District {} subtree failed: {}", district.code(), e.getCause().getMessage(), e.getCause());
        }
    }

    // ── Fetch + write helpers ────────────────────────────────────────────────

    private <T> List<T> fetch(String node, Supplier<List<T>> call) {
        return backoffPolicy.execute("fetch " + node, call);
    }

    /** Returns null when the node is given up on. */
    private <T> List<T> fetchOrSkip(String node, Supplier<List<T>> call, AtomicInteger skipCounter) {
        try {
            return fetch(node, call);
        } catch (FetchFailureException e) {
            skipCounter.incrementAndGet();
            log.warn("Skipping {} after {} attempts: {}", node, backoffPolicy.getMaxAttempts(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            skipCounter.incrementAndGet();
            log.error("Skipping {}: {}", node, e.getMessage(), e);
            return null;
        }
    }

    /** Returns the rows that were stored; only those are descended into. */
    private <T> List<T> writeAll(List<T> rows, Consumer<T> upsert, AtomicInteger ingested, Counters counters) {
        List<T> written = new ArrayList<>(rows.size());
        for (T row : rows) {
            try {
                upsert.accept(row);
                ingested.incrementAndGet();
                written.add(row);
            } catch (ReferentialIntegrityException e) {
                counters.writeFailures.incrementAndGet();
                log.error("Write rejected: {}", e.getMessage());
            } catch (RuntimeException e) {
                counters.writeFailures.incrementAndGet();
                log.error("Write failed for {}: {}", row, e.getMessage(), e);
            }
        }
        return written;
    }

    private ThreadPoolTaskExecutor newExecutor() {
        int workers = Math.max(1, properties.getCrawl().getWorkers());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("CrawlWorker-");
        executor.initialize();
        return executor;
    }

    private void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    // ── Counters shared by worker threads ────────────────────────────────────

    private static final class Counters {
        final AtomicInteger districts = new AtomicInteger();
        final AtomicInteger talukas = new AtomicInteger();
        final AtomicInteger hoblis = new AtomicInteger();
        final AtomicInteger villages = new AtomicInteger();
        final AtomicInteger talukaSkips = new AtomicInteger();
        final AtomicInteger hobliSkips = new AtomicInteger();
        final AtomicInteger villageSkips = new AtomicInteger();
        final AtomicInteger writeFailures = new AtomicInteger();
        final AtomicInteger subtreeFailures = new AtomicInteger();

        CrawlSummary toSummary(LocalDateTime startedAt, LocalDateTime completedAt) {
            return CrawlSummary.builder()
                    .startedAt(startedAt)
                    .completedAt(completedAt)
                    .districtsIngested(districts.get())
                    .talukasIngested(talukas.get())
                    .hoblisIngested(hoblis.get())
                    .villagesIngested(villages.get())
                    .talukaFetchesSkipped(talukaSkips.get())
                    .hobliFetchesSkipped(hobliSkips.get())
                    .villageFetchesSkipped(villageSkips.get())
                    .writeFailures(writeFailures.get())
                    .subtreeFailures(subtreeFailures.get())
                    .build();
        }
    }
}
