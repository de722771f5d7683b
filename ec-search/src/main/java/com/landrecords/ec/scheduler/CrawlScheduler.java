package com.landrecords.ec.scheduler;

import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.output.SearchResultJdbcWriter;
import com.landrecords.ec.repository.LocationStore;
import com.landrecords.ec.service.HierarchyCrawler;
import com.landrecords.ec.service.SearchOrchestrator;
import com.landrecords.ec.session.SessionFileStore;
import com.landrecords.ec.session.SessionManager;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Startup initialisation and the periodic refresh of the location hierarchy.
 *
 * Default schedule: 1st of each month at 03:00 UTC. Village lists change rarely, so a
 * monthly refresh keeps the local copy current without loading the portal.
 *
 * Override with the ec-search.crawl.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CrawlScheduler {

    private final HierarchyCrawler crawler;
    private final SearchOrchestrator orchestrator;
    private final LocationStore locationStore;
    private final SearchResultJdbcWriter resultWriter;
    private final SessionManager sessionManager;
    private final SessionFileStore sessionFileStore;
    private final EcSearchProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Restore a saved session that is still inside its TTL
     *  3. Optionally crawl the hierarchy in the background
     */
    @PostConstruct
    public void onStartup() {
        locationStore.ensureSchema();
        resultWriter.ensureSchema();

        if (properties.getSession().isRestoreOnStartup()) {
            restoreSession();
        }

        if (properties.getCrawl().isRunOnStartup()) {
            log.info("Crawl on startup enabled, starting background crawl");
            new Thread(this::runCrawl, "startup-crawl").start();
        } else {
            log.info("Location store ready {}. Next scheduled crawl: {}",
                    locationStore.counts(), properties.getCrawl().getCron());
        }
    }

    @Scheduled(cron = "${ec-search.crawl.cron:0 0 3 1 * ?}", zone = "UTC")
    public void scheduledCrawl() {
        log.info("Scheduled crawl triggered");
        if (orchestrator.isRunning()) {
            log.info("Search run in progress, skipping scheduled crawl");
            return;
        }
        if (crawler.isRunning()) {
            log.info("Crawl already running, skipping scheduled crawl");
            return;
        }
        runCrawl();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void runCrawl() {
        try {
            crawler.crawl();
        } catch (Exception e) {
            log.error("Crawl failed: {}", e.getMessage(), e);
        }
    }

    private void restoreSession() {
        if (!sessionFileStore.exists()) {
            log.info("No saved session. Complete the external login and POST it to /session.");
            return;
        }
        try {
            sessionManager.acquire(sessionFileStore);
            log.info("Restored saved session");
        } catch (IllegalArgumentException e) {
            log.info("Saved session not usable ({}). Please login again.", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not restore saved session: {}", e.getMessage());
        }
    }
}
