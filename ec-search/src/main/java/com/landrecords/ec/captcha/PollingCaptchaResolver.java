package com.landrecords.ec.captcha;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.CaptchaChallenge;
import com.landrecords.ec.model.CaptchaSolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.Base64;
import java.util.function.Supplier;

/**
 * Submit-then-poll flow shared by the paid solving services.
 *
 * The image is submitted once, then the task is polled every {@code pollInterval} until it
 * is ready or {@code timeout} has elapsed.
 */
@Slf4j
public abstract class PollingCaptchaResolver implements CaptchaResolver {

    protected final ObjectMapper objectMapper;
    protected final EcSearchProperties.Captcha config;

    protected PollingCaptchaResolver(ObjectMapper objectMapper, EcSearchProperties properties) {
        this.objectMapper = objectMapper;
        this.config = properties.getCaptcha();
    }

    /** State of a submitted task. Text is null until ready. */
    protected record PollResult(boolean ready, String text, double cost) {

        static PollResult notReady() {
            return new PollResult(false, null, 0.0);
        }

        static PollResult ready(String text, double cost) {
            return new PollResult(true, text, cost);
        }
    }

    /** @return the service's task id */
    protected abstract String submit(String imageBase64);

    protected abstract PollResult poll(String taskId);

    /** Remaining account balance in the service's currency. */
    public abstract double balance();

    @Override
    public final CaptchaSolution resolve(CaptchaChallenge challenge) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new CaptchaServiceException(name() + " needs ec-search.captcha.api-key");
        }
        String taskId = submit(Base64.getEncoder().encodeToString(challenge.imageBytes()));
        log.debug("{} task {} submitted for challenge {}", name(), taskId, challenge.challengeId());

        Duration timeout = config.getTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            pause(config.getPollInterval());
            PollResult result = poll(taskId);
            if (result.ready()) {
                log.info("{} solved challenge {} (cost {})", name(), challenge.challengeId(), result.cost());
                return new CaptchaSolution(challenge.challengeId(), result.text(), result.cost());
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new CaptchaTimeoutException(name() + " task " + taskId + " not solved within " + timeout);
            }
        }
    }

    // ── Helpers for subclasses ───────────────────────────────────────────────

    protected JsonNode callJson(String what, Supplier<String> call) {
        String body;
        try {
            body = call.get();
        } catch (RestClientException e) {
            throw new CaptchaServiceException(name() + " " + what + " failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new CaptchaServiceException(name() + " " + what + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CaptchaServiceException(name() + " " + what + " returned unreadable JSON", e);
        }
    }

    private void pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptchaServiceException("Interrupted while polling " + name(), e);
        }
    }
}
