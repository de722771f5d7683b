package com.landrecords.ec.service;

import com.landrecords.ec.captcha.CaptchaResolver;
import com.landrecords.ec.captcha.CaptchaTimeoutException;
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
import com.landrecords.ec.model.TargetOutcome.Status;
import com.landrecords.ec.output.OutputRouter;
import com.landrecords.ec.session.SessionExpiredException;
import com.landrecords.ec.session.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SearchOrchestratorTest {

    @Mock
    private EcSearchApiClient apiClient;

    @Mock
    private SessionManager sessionManager;

    @Mock
    private OutputRouter outputRouter;

    @Mock
    private CaptchaResolver resolver;

    private SearchOrchestrator orchestrator;

    private final SessionArtifact session = new SessionArtifact("tok", List.of(), Instant.now(), null);

    private static final SearchResponse ONE_ROW = SearchResponse.ok(List.of(Map.of("DocumentNo", "ANK-1-2021")));
    private static final SearchResponse NO_ROWS = SearchResponse.ok(List.of());

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
        orchestrator = new SearchOrchestrator(apiClient, sessionManager,
                new BackoffPolicy(3, Duration.ofMillis(1), 1.0), outputRouter, clock);

        when(sessionManager.isActive()).thenReturn(true);
        when(sessionManager.requireActive()).thenReturn(session);
        when(resolver.name()).thenReturn("test");
        when(apiClient.generateCaptcha(session)).thenReturn(new CaptchaChallenge("cap-1", new byte[]{1}));
        when(resolver.resolve(any())).thenReturn(new CaptchaSolution("cap-1", "AAAAA", 0));
    }

    private List<SearchTarget> targets(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new SearchTarget(10, 20, 30, 40 + i, "Bengaluru Urban", "Anekal", "Attibele", "Village " + i))
                .toList();
    }

    private RunContext.RunContextBuilder context(int targets) {
        return RunContext.builder()
                .runId("run-1")
                .targets(targets(targets))
                .partyName("Ramesh")
                .lastName("Gowda")
                .fromDate(LocalDate.of(2020, 1, 1))
                .toDate(LocalDate.of(2024, 12, 31))
                .interTargetDelay(Duration.ZERO)
                .resolver(resolver);
    }

    private List<Status> statuses(BatchOutcome outcome) {
        return outcome.outcomes().stream().map(TargetOutcome::status).toList();
    }

    private BatchRun lastBatchRun() {
        ArgumentCaptor<BatchRun> run = ArgumentCaptor.forClass(BatchRun.class);
        verify(outputRouter, times(2)).writeBatchRun(run.capture());
        return run.getValue();
    }

    @Nested
    @DisplayName("normal runs")
    class Normal {

        @Test
        void everyTargetSearchedAndRowsWrittenAsFound() {
            when(apiClient.search(any(), any())).thenReturn(ONE_ROW, NO_ROWS, ONE_ROW);

            BatchOutcome outcome = orchestrator.run(context(3).build());

            assertThat(statuses(outcome)).containsOnly(Status.SUCCESS);
            assertThat(outcome.attempted()).isEqualTo(3);
            assertThat(outcome.rowsFound()).isEqualTo(2);
            assertThat(outcome.terminatedEarly()).isFalse();

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<SearchResult>> written = ArgumentCaptor.forClass(List.class);
            verify(outputRouter, times(2)).write(written.capture());
            SearchResult first = written.getAllValues().get(0).get(0);
            assertThat(first.getRunId()).isEqualTo("run-1");
            assertThat(first.getVillageCode()).isEqualTo(40);
            assertThat(first.getPartyName()).isEqualTo("Ramesh Gowda");
            assertThat(first.getFieldMap()).containsEntry("DocumentNo", "ANK-1-2021");

            BatchRun run = lastBatchRun();
            assertThat(run.getStatus()).isEqualTo("COMPLETED");
            assertThat(run.getTargetsAttempted()).isEqualTo(3);
            assertThat(run.getRowsFound()).isEqualTo(2);
            assertThat(orchestrator.isRunning()).isFalse();
            assertThat(orchestrator.lastOutcome()).contains(outcome);
        }

        @Test
        void searchCarriesPartyDatesAndSolvedCaptcha() {
            when(apiClient.search(any(), any())).thenReturn(NO_ROWS);

            orchestrator.run(context(1).build());

            ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
            verify(apiClient).search(request.capture(), any());
            assertThat(request.getValue()).isEqualTo(new SearchRequest(40, "Ramesh", null, "Gowda",
                    LocalDate.of(2020, 1, 1), LocalDate.of(2024, 12, 31), "cap-1", "AAAAA"));
        }

        @Test
        void emptyTargetListCompletesImmediately() {
            BatchOutcome outcome = orchestrator.run(context(0).build());

            assertThat(outcome.total()).isZero();
            verify(apiClient, never()).search(any(), any());
        }
    }

    @Nested
    @DisplayName("session expiry")
    class SessionExpiry {

        @Test
        void unauthorizedHaltsRunAndLeavesRestNotAttempted() {
            when(apiClient.search(any(), any())).thenReturn(ONE_ROW, ONE_ROW,
                    SearchResponse.unauthorized("401 Unauthorized"));

            BatchOutcome outcome = orchestrator.run(context(5).build());

            assertThat(statuses(outcome)).containsExactly(
                    Status.SUCCESS, Status.SUCCESS, Status.SESSION_EXPIRED, Status.NOT_ATTEMPTED, Status.NOT_ATTEMPTED);
            assertThat(outcome.sessionExpired()).isTrue();
            assertThat(outcome.attempted()).isEqualTo(3);
            assertThat(outcome.rowsFound()).isEqualTo(2);
            verify(sessionManager).markExpired("401 Unauthorized");
            verify(apiClient, times(3)).search(any(), any());
            verify(outputRouter, times(2)).write(anyList());
            assertThat(lastBatchRun().getStatus()).isEqualTo("SESSION_EXPIRED");
        }

        @Test
        void inactiveSessionMeansNothingIsAttempted() {
            when(sessionManager.isActive()).thenReturn(false);

            BatchOutcome outcome = orchestrator.run(context(3).build());

            assertThat(statuses(outcome)).containsOnly(Status.NOT_ATTEMPTED);
            assertThat(outcome.sessionExpired()).isTrue();
            verify(apiClient, never()).generateCaptcha(any());
        }

        @Test
        void rejectedChallengeRequestIsNotRetried() {
            when(apiClient.generateCaptcha(session)).thenThrow(new SessionExpiredException("401 on Generate"));

            BatchOutcome outcome = orchestrator.run(context(2).build());

            verify(apiClient, times(1)).generateCaptcha(session);
            verify(sessionManager).markExpired("401 on Generate");
            assertThat(statuses(outcome)).containsExactly(Status.SESSION_EXPIRED, Status.NOT_ATTEMPTED);
        }
    }

    @Nested
    @DisplayName("per-target failures")
    class PerTargetFailures {

        @Test
        void captchaFailureIsRecordedAndRunContinues() {
            when(resolver.resolve(any()))
                    .thenThrow(new CaptchaTimeoutException("not solved within PT2M"))
                    .thenReturn(new CaptchaSolution("cap-1", "AAAAA", 0));
            when(apiClient.search(any(), any())).thenReturn(ONE_ROW);

            BatchOutcome outcome = orchestrator.run(context(2).build());

            assertThat(statuses(outcome)).containsExactly(Status.FAILED, Status.SUCCESS);
            assertThat(outcome.errors()).singleElement()
                    .satisfies(e -> assertThat(e.error()).contains("not solved"));
            assertThat(outcome.sessionExpired()).isFalse();
        }

        @Test
        void invalidCaptchaWithoutReuseIsAnError() {
            when(apiClient.search(any(), any())).thenReturn(SearchResponse.invalidCaptcha("Invalid Captcha"), ONE_ROW);

            BatchOutcome outcome = orchestrator.run(context(2).build());

            assertThat(statuses(outcome)).containsExactly(Status.FAILED, Status.SUCCESS);
            verify(apiClient, times(2)).search(any(), any());
        }

        @Test
        void challengeFetchIsRetried() {
            when(apiClient.generateCaptcha(session))
                    .thenThrow(new RemoteSearchException("CAPTCHA generation failed: 502"))
                    .thenReturn(new CaptchaChallenge("cap-2", new byte[]{2}));
            when(apiClient.search(any(), any())).thenReturn(NO_ROWS);

            BatchOutcome outcome = orchestrator.run(context(1).build());

            assertThat(statuses(outcome)).containsExactly(Status.SUCCESS);
            verify(apiClient, times(2)).generateCaptcha(session);
        }

        @Test
        void failedWriteIsRecordedAgainstItsTarget() {
            when(apiClient.search(any(), any())).thenReturn(ONE_ROW);
            doThrow(new IllegalStateException("disk full")).doNothing().when(outputRouter).write(anyList());

            BatchOutcome outcome = orchestrator.run(context(2).build());

            assertThat(statuses(outcome)).containsExactly(Status.FAILED, Status.SUCCESS);
            assertThat(outcome.outcomes().get(0).error()).contains("disk full");
        }

        @Test
        void unexpectedSearchFailureIsRecordedAndNextTargetRuns() {
            when(apiClient.search(any(), any()))
                    .thenThrow(new IllegalArgumentException("Cannot deserialize value of type LinkedHashMap"))
                    .thenReturn(ONE_ROW);

            BatchOutcome outcome = orchestrator.run(context(2).build());

            assertThat(statuses(outcome)).containsExactly(Status.FAILED, Status.SUCCESS);
            assertThat(outcome.outcomes().get(0).error()).contains("Cannot deserialize");
            assertThat(orchestrator.lastOutcome()).contains(outcome);
            assertThat(lastBatchRun().getStatus()).isEqualTo("COMPLETED");
        }

        @Test
        void invalidParametersAreRejectedUpFront() {
            assertThatThrownBy(() -> orchestrator.run(context(1).partyName(" ").build()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> orchestrator.run(context(1)
                    .fromDate(LocalDate.of(2025, 1, 1)).toDate(LocalDate.of(2024, 1, 1)).build()))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(outputRouter, never()).writeBatchRun(any());
        }
    }

    @Nested
    @DisplayName("captcha reuse")
    class Reuse {

        @Test
        void rejectedReuseSolvesFreshOnceAndKeepsReusingTheNewSolution() {
            when(apiClient.generateCaptcha(session)).thenReturn(
                    new CaptchaChallenge("cap-1", new byte[]{1}),
                    new CaptchaChallenge("cap-2", new byte[]{2}));
            when(resolver.resolve(any())).thenReturn(
                    new CaptchaSolution("cap-1", "AAAAA", 0),
                    new CaptchaSolution("cap-2", "BBBBB", 0));
            when(apiClient.search(any(), any())).thenReturn(
                    ONE_ROW,                                        // target 1, fresh
                    SearchResponse.invalidCaptcha("Invalid Captcha"), // target 2, reused
                    ONE_ROW,                                        // target 2, fresh retry
                    ONE_ROW);                                       // target 3, reused

            BatchOutcome outcome = orchestrator.run(context(3).captchaReuse(true).build());

            assertThat(statuses(outcome)).containsOnly(Status.SUCCESS);
            verify(resolver, times(2)).resolve(any());

            ArgumentCaptor<SearchRequest> requests = ArgumentCaptor.forClass(SearchRequest.class);
            verify(apiClient, times(4)).search(requests.capture(), any());
            assertThat(requests.getAllValues()).extracting(SearchRequest::captchaText)
                    .containsExactly("AAAAA", "AAAAA", "BBBBB", "BBBBB");
            assertThat(requests.getAllValues()).extracting(SearchRequest::villageCode)
                    .containsExactly(40, 41, 41, 42);
        }

        @Test
        void secondRejectionAfterFreshSolveIsAnError() {
            when(apiClient.search(any(), any())).thenReturn(
                    ONE_ROW,
                    SearchResponse.invalidCaptcha("Invalid Captcha"),
                    SearchResponse.invalidCaptcha("Invalid Captcha"));

            BatchOutcome outcome = orchestrator.run(context(2).captchaReuse(true).build());

            assertThat(statuses(outcome)).containsExactly(Status.SUCCESS, Status.FAILED);
            verify(apiClient, times(3)).search(any(), any());
        }
    }

    @Nested
    @DisplayName("run control")
    class RunControl {

        @Test
        void cancelStopsAfterInFlightTarget() {
            when(resolver.resolve(any())).thenAnswer(inv -> {
                assertThat(orchestrator.cancel()).isTrue();
                return new CaptchaSolution("cap-1", "AAAAA", 0);
            });
            when(apiClient.search(any(), any())).thenReturn(ONE_ROW);

            BatchOutcome outcome = orchestrator.run(context(3).build());

            assertThat(statuses(outcome)).containsExactly(Status.SUCCESS, Status.NOT_ATTEMPTED, Status.NOT_ATTEMPTED);
            assertThat(outcome.cancelled()).isTrue();
            assertThat(outcome.rowsFound()).isEqualTo(1);
            verify(resolver).reset();
            verify(resolver).abandon(anyString());
            assertThat(lastBatchRun().getStatus()).isEqualTo("CANCELLED");
        }

        @Test
        void cancelWithoutActiveRun() {
            assertThat(orchestrator.cancel()).isFalse();
        }

        @Test
        void onlyOneRunAtATime() {
            when(resolver.resolve(any())).thenAnswer(inv -> {
                assertThat(orchestrator.activeRun()).map(RunContext::getRunId).contains("run-1");
                assertThatThrownBy(() -> orchestrator.run(context(1).runId("run-2").build()))
                        .isInstanceOf(IllegalStateException.class);
                return new CaptchaSolution("cap-1", "AAAAA", 0);
            });
            when(apiClient.search(any(), any())).thenReturn(NO_ROWS);

            orchestrator.run(context(1).build());

            assertThat(orchestrator.isRunning()).isFalse();
        }
    }
}
