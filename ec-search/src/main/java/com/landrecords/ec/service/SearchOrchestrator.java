package com.landrecords.ec.service;

import com.landrecords.ec.captcha.CaptchaException;
import com.landrecords.ec.config.BackoffPolicy;
import com.landrecords.ec.model.BatchOutcome;
import com.landrecords.ec.model.BatchRun;
import com.landrecords.ec.model.CaptchaChallenge;
import com.landrecords.ec.model.CaptchaSolution;
import com.landrecords.ec.model.SearchRequest;
import com.landrecords.ec.model.SearchResponse;
import com.landrecords.ec.model.SearchResult;
import com.landrecords.ec.model.SearchTarget;
import com.landrecords.ec.model.SessionArtifact;
import com.landrecords.ec.model.TargetOutcome;
import com.landrecords.ec.output.OutputRouter;
import com.landrecords.ec.session.SessionExpiredException;
import com.landrecords.ec.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a batch of village searches for one party, strictly one target at a time.
 *
 * Per target: check the session, fetch and solve a CAPTCHA, search, then classify the
 * response. Rows are written as soon as a target succeeds. A rejected session ends the run
 * and leaves the remaining targets not attempted; any other failure is recorded against
 * its target and the run moves on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SearchOrchestrator {

    private final EcSearchApiClient apiClient;
    private final SessionManager sessionManager;
    private final BackoffPolicy backoffPolicy;
    private final OutputRouter outputRouter;
    private final Clock clock;

    private final AtomicReference<RunContext> activeRun = new AtomicReference<>();
    private final AtomicReference<BatchOutcome> lastOutcome = new AtomicReference<>();

    public BatchOutcome run(RunContext ctx) {
        validate(ctx);
        if (!activeRun.compareAndSet(null, ctx)) {
            throw new IllegalStateException("A search run is already in progress: " + activeRun.get().getRunId());
        }

        ctx.getResolver().reset();

        List<SearchTarget> targets = ctx.getTargets();
        List<TargetOutcome> outcomes = new ArrayList<>(targets.size());
        RunState state = new RunState();

        BatchRun run = BatchRun.builder()
                .runId(ctx.getRunId())
                .partyName(ctx.fullPartyName())
                .fromDate(ctx.getFromDate())
                .toDate(ctx.getToDate())
                .startedAt(LocalDateTime.now(clock))
                .status("RUNNING")
                .targetsTotal(targets.size())
                .build();
        outputRouter.writeBatchRun(run);
        log.info("Run {} started: '{}' across {} targets using {} CAPTCHA solving{}",
                ctx.getRunId(), ctx.fullPartyName(), targets.size(), ctx.getResolver().name(),
                ctx.isCaptchaReuse() ? " (reuse on)" : "");

        try {
            for (int i = 0; i < targets.size(); i++) {
                SearchTarget target = targets.get(i);

                if (ctx.isCancelRequested()) {
                    state.cancelled = true;
                    log.info("Run {} cancelled before target {}/{}", ctx.getRunId(), i + 1, targets.size());
                    markRemaining(targets, i, outcomes);
                    break;
                }
                if (!sessionManager.isActive()) {
                    state.sessionExpired = true;
                    log.warn("Run {} halted at target {}/{}: session is no longer active. Please login again.",
                            ctx.getRunId(), i + 1, targets.size());
                    markRemaining(targets, i, outcomes);
                    break;
                }

                log.info("[{}/{}] {}", i + 1, targets.size(), target.label());
                TargetOutcome outcome = searchTarget(ctx, target, state);
                outcomes.add(outcome);
                ctx.getTargetsDone().incrementAndGet();

                if (outcome.status() == TargetOutcome.Status.SESSION_EXPIRED) {
                    state.sessionExpired = true;
                    log.warn("Run {} halted: {}. Please login again.", ctx.getRunId(), outcome.error());
                    markRemaining(targets, i + 1, outcomes);
                    break;
                }

                if (i < targets.size() - 1 && !pause(ctx)) {
                    state.cancelled = true;
                    markRemaining(targets, i + 1, outcomes);
                    break;
                }
            }

            BatchOutcome outcome = new BatchOutcome(ctx.getRunId(), outcomes, state.sessionExpired, state.cancelled);
            run.setStatus(state.sessionExpired ? "SESSION_EXPIRED" : state.cancelled ? "CANCELLED" : "COMPLETED");
            lastOutcome.set(outcome);
            log.info("Run {} {}: {}/{} targets attempted, {} rows found, {} errors",
                    ctx.getRunId(), run.getStatus(), outcome.attempted(), outcome.total(),
                    outcome.rowsFound(), outcome.errors().size());
            return outcome;

        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", ctx.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            run.setTargetsAttempted((int) outcomes.stream().filter(TargetOutcome::attempted).count());
            run.setRowsFound(outcomes.stream().mapToInt(TargetOutcome::rowsFound).sum());
            run.setErrorCount((int) outcomes.stream().filter(TargetOutcome::isError).count());
            run.setSessionExpired(state.sessionExpired);
            run.setCancelled(state.cancelled);
            outputRouter.writeBatchRun(run);
            activeRun.set(null);
        }
    }

    /**
     * Ask the active run to stop once the in-flight target finishes.
     *
     * @return false if no run is active
     */
    public boolean cancel() {
        RunContext ctx = activeRun.get();
        if (ctx == null) {
            return false;
        }
        ctx.requestCancel();
        ctx.getResolver().abandon("Run " + ctx.getRunId() + " cancelled");
        log.info("Cancellation requested for run {}", ctx.getRunId());
        return true;
    }

    public Optional<RunContext> activeRun() {
        return Optional.ofNullable(activeRun.get());
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    public Optional<BatchOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    // ── Per target ───────────────────────────────────────────────────────────

    private TargetOutcome searchTarget(RunContext ctx, SearchTarget target, RunState state) {
        SessionArtifact session;
        try {
            session = sessionManager.requireActive();
        } catch (SessionExpiredException e) {
            return TargetOutcome.sessionExpired(target, e.getMessage());
        }

        try {
            boolean reusing = ctx.isCaptchaReuse() && state.reusableSolution != null;
            CaptchaSolution solution = reusing ? state.reusableSolution : solveFresh(ctx, session);
            SearchResponse response = apiClient.search(request(ctx, target, solution), session);

            if (reusing && response.status() == SearchResponse.Status.INVALID_CAPTCHA) {
                log.info("Reused CAPTCHA rejected for village {}, solving a fresh one", target.villageCode());
                state.reusableSolution = null;
                solution = solveFresh(ctx, session);
                response = apiClient.search(request(ctx, target, solution), session);
            }

            return switch (response.status()) {
                case OK -> {
                    if (ctx.isCaptchaReuse()) {
                        state.reusableSolution = solution;
                    }
                    yield recordRows(ctx, target, response.rows());
                }
                case UNAUTHORIZED -> {
                    sessionManager.markExpired(response.message());
                    yield TargetOutcome.sessionExpired(target, response.message());
                }
                case INVALID_CAPTCHA -> {
                    log.warn("Village {}: CAPTCHA rejected ({})", target.villageCode(), response.message());
                    yield TargetOutcome.failed(target, "Invalid CAPTCHA: " + response.message());
                }
                case ERROR -> {
                    log.warn("Village {}: {}", target.villageCode(), response.message());
                    yield TargetOutcome.failed(target, response.message());
                }
            };

        } catch (SessionExpiredException e) {
            sessionManager.markExpired(e.getMessage());
            return TargetOutcome.sessionExpired(target, e.getMessage());
        } catch (CaptchaException e) {
            log.warn("Village {}: CAPTCHA not solved: {}", target.villageCode(), e.getMessage());
            return TargetOutcome.failed(target, "CAPTCHA: " + e.getMessage());
        } catch (RemoteSearchException e) {
            log.warn("Village {}: {}", target.villageCode(), e.getMessage());
            return TargetOutcome.failed(target, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Village {}: unexpected failure: {}", target.villageCode(), e.getMessage(), e);
            return TargetOutcome.failed(target, "Unexpected failure: " + e.getMessage());
        }
    }

    /** A rejected session is rethrown at once; other challenge failures are retried. */
    private CaptchaSolution solveFresh(RunContext ctx, SessionArtifact session) {
        CaptchaChallenge challenge = backoffPolicy.execute("captcha challenge",
                () -> apiClient.generateCaptcha(session),
                e -> !(e instanceof SessionExpiredException));
        return ctx.getResolver().resolve(challenge);
    }

    private TargetOutcome recordRows(RunContext ctx, SearchTarget target, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            log.info("Village {}: no records", target.villageCode());
            return TargetOutcome.success(target, 0);
        }
        LocalDateTime foundAt = LocalDateTime.now(clock);
        List<SearchResult> results = rows.stream()
                .map(row -> SearchResult.builder()
                        .runId(ctx.getRunId())
                        .districtCode(target.districtCode())
                        .talukaCode(target.talukaCode())
                        .hobliCode(target.hobliCode())
                        .villageCode(target.villageCode())
                        .villageName(target.villageName())
                        .fieldMap(row)
                        .partyName(ctx.fullPartyName())
                        .fromDate(ctx.getFromDate())
                        .toDate(ctx.getToDate())
                        .foundAt(foundAt)
                        .build())
                .toList();
        try {
            outputRouter.write(results);
        } catch (RuntimeException e) {
            log.error("Village {}: {} rows found but not written: {}", target.villageCode(), rows.size(), e.getMessage(), e);
            return new TargetOutcome(target, TargetOutcome.Status.FAILED, rows.size(),
                    "Output write failed: " + e.getMessage());
        }
        log.info("Village {}: {} records", target.villageCode(), rows.size());
        return TargetOutcome.success(target, rows.size());
    }

    private SearchRequest request(RunContext ctx, SearchTarget target, CaptchaSolution solution) {
        return new SearchRequest(target.villageCode(), ctx.getPartyName(), ctx.getMiddleName(), ctx.getLastName(),
                ctx.getFromDate(), ctx.getToDate(), solution.challengeId(), solution.text());
    }

    /** @throws IllegalArgumentException if the run parameters are unusable */
    public void validate(RunContext ctx) {
        if (ctx.getPartyName() == null || ctx.getPartyName().isBlank()) {
            throw new IllegalArgumentException("A party name is required");
        }
        if (ctx.getFromDate() == null || ctx.getToDate() == null || ctx.getFromDate().isAfter(ctx.getToDate())) {
            throw new IllegalArgumentException("Invalid date range: " + ctx.getFromDate() + " to " + ctx.getToDate());
        }
        if (ctx.getTargets() == null || ctx.getResolver() == null) {
            throw new IllegalArgumentException("A run needs targets and a CAPTCHA resolver");
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void markRemaining(List<SearchTarget> targets, int from, List<TargetOutcome> outcomes) {
        for (int j = from; j < targets.size(); j++) {
            outcomes.add(TargetOutcome.notAttempted(targets.get(j)));
        }
    }

    /** @return false if the run should stop */
    private boolean pause(RunContext ctx) {
        long ms = ctx.getInterTargetDelay() == null ? 0 : ctx.getInterTargetDelay().toMillis();
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Mutable per-run bookkeeping that never leaves this class. */
    private static final class RunState {
        boolean sessionExpired;
        boolean cancelled;
        CaptchaSolution reusableSolution;
    }
}
