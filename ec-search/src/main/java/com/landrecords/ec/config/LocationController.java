package com.landrecords.ec.config;

import com.landrecords.ec.model.CrawlSummary;
import com.landrecords.ec.model.Expansion;
import com.landrecords.ec.model.LocationFilter;
import com.landrecords.ec.repository.LocationStore;
import com.landrecords.ec.service.CombinationExpander;
import com.landrecords.ec.service.HierarchyCrawler;
import com.landrecords.ec.service.SearchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class LocationController {

    private final HierarchyCrawler crawler;
    private final LocationStore locationStore;
    private final CombinationExpander expander;
    private final SearchOrchestrator orchestrator;

    // ── Crawl ────────────────────────────────────────────────────────────────

    @PostMapping("/crawl/trigger")
    public ResponseEntity<Map<String, String>> triggerCrawl(@RequestParam(required = false) Integer district) {
        if (crawler.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A crawl is already running"));
        }
        if (orchestrator.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A search run is in progress; crawl after it finishes"));
        }
        new Thread(() -> {
            try {
                crawler.crawl(district);
            } catch (Exception e) {
                log.error("Manual crawl failed: {}", e.getMessage(), e);
            }
        }, "manual-crawl").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted",
                "target", district == null ? "all" : String.valueOf(district)));
    }

    @GetMapping("/crawl/summary")
    public ResponseEntity<Map<String, Object>> crawlSummary() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", crawler.isRunning());
        body.put("counts", locationStore.counts());
        CrawlSummary last = locationStore.lastCrawlSummary().orElse(null);
        body.put("lastCrawl", last);
        if (last != null) {
            body.put("totalSkipped", last.totalSkipped());
        }
        return ResponseEntity.ok(body);
    }

    // ── Location queries ─────────────────────────────────────────────────────

    @GetMapping("/locations/districts")
    public ResponseEntity<?> districts() {
        return ResponseEntity.ok(locationStore.listDistricts());
    }

    @GetMapping("/locations/talukas")
    public ResponseEntity<?> talukas(@RequestParam(required = false) Integer districtCode) {
        return ResponseEntity.ok(locationStore.listTalukas(districtCode));
    }

    @GetMapping("/locations/hoblis")
    public ResponseEntity<?> hoblis(@RequestParam(required = false) Integer talukaCode) {
        return ResponseEntity.ok(locationStore.listHoblis(talukaCode));
    }

    @GetMapping("/locations/villages")
    public ResponseEntity<?> villages(@RequestParam(required = false) Integer hobliCode) {
        return ResponseEntity.ok(locationStore.listVillages(hobliCode));
    }

    /**
     * Find districts, talukas and hoblis by name part or code.
     *
     * GET /locations/search?q=anekal
     */
    @GetMapping("/locations/search")
    public ResponseEntity<?> search(@RequestParam("q") String term) {
        if (term.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "q must not be blank"));
        }
        return ResponseEntity.ok(locationStore.search(term));
    }

    /**
     * Preview the targets a filter expands to.
     *
     * POST /locations/expand {"districtCode": 2, "allTaluks": true, "hobliCode": 7}
     */
    @PostMapping("/locations/expand")
    public ResponseEntity<?> expand(@RequestBody LocationFilter filter) {
        try {
            Expansion expansion = expander.expand(filter);
            return ResponseEntity.ok(Map.of(
                    "count", expansion.targets().size(),
                    "duplicatesRemoved", expansion.duplicatesRemoved(),
                    "targets", expansion.targets()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Expansion failed for {}: {}", filter, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }
}
