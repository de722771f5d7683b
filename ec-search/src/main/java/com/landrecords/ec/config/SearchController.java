package com.landrecords.ec.config;

import com.landrecords.ec.captcha.CaptchaException;
import com.landrecords.ec.captcha.CaptchaResolverSelector;
import com.landrecords.ec.captcha.ManualCaptchaResolver;
import com.landrecords.ec.model.BatchOutcome;
import com.landrecords.ec.model.Expansion;
import com.landrecords.ec.model.SearchBatchRequest;
import com.landrecords.ec.model.SessionArtifact;
import com.landrecords.ec.model.TargetOutcome;
import com.landrecords.ec.model.ValidationResult;
import com.landrecords.ec.output.SearchResultJdbcWriter;
import com.landrecords.ec.service.CombinationExpander;
import com.landrecords.ec.service.RunContext;
import com.landrecords.ec.service.SearchOrchestrator;
import com.landrecords.ec.session.SessionFileStore;
import com.landrecords.ec.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@Slf4j
@RequiredArgsConstructor
public class SearchController {

    private final SessionManager sessionManager;
    private final SessionFileStore sessionFileStore;
    private final CombinationExpander expander;
    private final SearchOrchestrator orchestrator;
    private final CaptchaResolverSelector resolverSelector;
    private final ManualCaptchaResolver manualResolver;
    private final SearchResultJdbcWriter resultWriter;
    private final EcSearchProperties properties;

    // ── Session ──────────────────────────────────────────────────────────────

    /**
     * Hand over the token and cookies captured by the external login.
     *
     * POST /session {"authToken": "...", "cookies": [{"name": "...", "value": "..."}]}
     */
    @PostMapping("/session")
    public ResponseEntity<?> activateSession(@RequestBody SessionArtifact artifact) {
        try {
            sessionManager.activate(artifact);
            sessionFileStore.save(sessionManager.current());
            return ResponseEntity.ok(sessionManager.describe());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Session activation failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/session")
    public ResponseEntity<Map<String, Object>> sessionInfo() {
        return ResponseEntity.ok(sessionManager.describe());
    }

    @PostMapping("/session/validate")
    public ResponseEntity<ValidationResult> validateSession() {
        return ResponseEntity.ok(sessionManager.validate());
    }

    @DeleteMapping("/session")
    public ResponseEntity<Map<String, String>> clearSession() {
        sessionManager.clear();
        sessionFileStore.delete();
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }

    // ── Batch search ─────────────────────────────────────────────────────────

    @PostMapping("/search")
    public ResponseEntity<?> startSearch(@RequestBody SearchBatchRequest request) {
        try {
            if (orchestrator.isRunning()) {
                throw new IllegalStateException("A search run is already in progress");
            }
            if (!sessionManager.isActive()) {
                throw new IllegalStateException("No active session. Please login again.");
            }
            if (request.getLocations() == null) {
                throw new IllegalArgumentException("locations is required");
            }
            Expansion expansion = expander.expand(request.getLocations());
            RunContext ctx = toRunContext(request, expansion);
            orchestrator.validate(ctx);

            new Thread(() -> {
                try {
                    orchestrator.run(ctx);
                } catch (Exception e) {
                    log.error("Search run {} failed: {}", ctx.getRunId(), e.getMessage(), e);
                }
            }, "search-" + ctx.getRunId()).start();

            return ResponseEntity.accepted().body(Map.of(
                    "status", "accepted",
                    "runId", ctx.getRunId(),
                    "targets", expansion.targets().size(),
                    "duplicatesRemoved", expansion.duplicatesRemoved()));

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Search trigger failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/search/cancel")
    public ResponseEntity<Map<String, Object>> cancelSearch() {
        boolean cancelled = orchestrator.cancel();
        return ResponseEntity.ok(Map.of("cancelRequested", cancelled));
    }

    @GetMapping("/search/status")
    public ResponseEntity<Map<String, Object>> searchStatus() {
        Map<String, Object> body = new LinkedHashMap<>();
        orchestrator.activeRun().ifPresent(ctx -> {
            body.put("running", true);
            body.put("runId", ctx.getRunId());
            body.put("party", ctx.fullPartyName());
            body.put("targetsDone", ctx.getTargetsDone().get());
            body.put("targetsTotal", ctx.getTargets().size());
            body.put("cancelRequested", ctx.isCancelRequested());
        });
        if (body.isEmpty()) {
            body.put("running", false);
        }
        orchestrator.lastOutcome().ifPresent(outcome -> body.put("lastRun", summarise(outcome)));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/search/runs/{runId}")
    public ResponseEntity<?> batchRun(@PathVariable String runId) {
        return resultWriter.findBatchRun(runId)
                .<ResponseEntity<?>>map(run -> ResponseEntity.ok(Map.of(
                        "run", run,
                        "results", resultWriter.findByRun(runId))))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Unknown run " + runId)));
    }

    // ── Manual CAPTCHA ───────────────────────────────────────────────────────

    @GetMapping("/captcha/pending")
    public ResponseEntity<?> pendingCaptcha() {
        return manualResolver.pendingChallenge()
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok()
                        .contentType(MediaType.IMAGE_PNG)
                        .header("X-Captcha-Id", p.challengeId())
                        .body(p.image()))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "No CAPTCHA is waiting for an answer")));
    }

    @PostMapping("/captcha/answer")
    public ResponseEntity<?> answerCaptcha(@RequestBody Map<String, String> body) {
        try {
            if (!manualResolver.submitAnswer(body.get("text"))) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "No CAPTCHA is waiting for an answer"));
            }
            return ResponseEntity.ok(Map.of("status", "accepted"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/captcha/balance")
    public ResponseEntity<?> captchaBalance(@RequestParam(required = false) EcSearchProperties.Captcha.Backend backend) {
        EcSearchProperties.Captcha.Backend chosen = backend != null ? backend : properties.getCaptcha().getBackend();
        try {
            double balance = resolverSelector.automatic(chosen).balance();
            return ResponseEntity.ok(Map.of("backend", chosen.name(), "balance", balance));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (CaptchaException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RunContext toRunContext(SearchBatchRequest request, Expansion expansion) {
        EcSearchProperties.Search search = properties.getSearch();
        EcSearchProperties.Captcha.Backend backend = request.getCaptchaBackend() != null
                ? request.getCaptchaBackend()
                : properties.getCaptcha().getBackend();

        return RunContext.builder()
                .runId(UUID.randomUUID().toString())
                .targets(expansion.targets())
                .partyName(request.getFirstName())
                .middleName(request.getMiddleName())
                .lastName(request.getLastName())
                .fromDate(request.getFromDate())
                .toDate(request.getToDate())
                .captchaReuse(request.getCaptchaReuse() != null ? request.getCaptchaReuse() : search.isCaptchaReuse())
                .interTargetDelay(search.getInterTargetDelay())
                .resolver(resolverSelector.select(backend))
                .build();
    }

    private Map<String, Object> summarise(BatchOutcome outcome) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("runId", outcome.runId());
        summary.put("total", outcome.total());
        summary.put("attempted", outcome.attempted());
        summary.put("rowsFound", outcome.rowsFound());
        summary.put("sessionExpired", outcome.sessionExpired());
        summary.put("cancelled", outcome.cancelled());
        List<Map<String, Object>> errors = outcome.errors().stream()
                .map(this::describe)
                .toList();
        summary.put("errors", errors);
        return summary;
    }

    private Map<String, Object> describe(TargetOutcome o) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("village", o.target().villageCode());
        row.put("label", o.target().label());
        row.put("status", o.status().name());
        row.put("error", o.error());
        return row;
    }
}
