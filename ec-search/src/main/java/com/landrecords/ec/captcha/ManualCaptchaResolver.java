package com.landrecords.ec.captcha;

import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.CaptchaChallenge;
import com.landrecords.ec.model.CaptchaSolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Operator-in-the-loop solving. The image is written to the configured directory and
 * published as the pending challenge; {@link #resolve} then blocks, without a timeout,
 * until {@link #submitAnswer} is called.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ManualCaptchaResolver implements CaptchaResolver {

    private final EcSearchProperties properties;

    private final AtomicReference<PendingChallenge> pending = new AtomicReference<>();
    private final AtomicReference<String> abandonedReason = new AtomicReference<>();

    public record PendingChallenge(String challengeId, Path imagePath, byte[] image,
                                   CompletableFuture<String> answer) {}

    @Override
    public String name() {
        return "manual";
    }

    @Override
    public CaptchaSolution resolve(CaptchaChallenge challenge) {
        Path image = saveImage(challenge);
        PendingChallenge waiting = new PendingChallenge(
                challenge.challengeId(), image, challenge.imageBytes(), new CompletableFuture<>());
        if (!pending.compareAndSet(null, waiting)) {
            throw new CaptchaServiceException("Another CAPTCHA is already waiting for an answer");
        }
        String abandoned = abandonedReason.getAndSet(null);
        if (abandoned != null) {
            // abandon() arrived before this challenge was published
            waiting.answer().completeExceptionally(new IllegalStateException(abandoned));
        } else {
            log.info("CAPTCHA {} saved to {}, waiting for operator input", challenge.challengeId(), image);
        }

        try {
            String text = waiting.answer().get();
            log.info("CAPTCHA {} answered", challenge.challengeId());
            return new CaptchaSolution(challenge.challengeId(), text, 0.0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptchaServiceException("Interrupted while waiting for CAPTCHA input", e);
        } catch (ExecutionException e) {
            throw new CaptchaServiceException("CAPTCHA input abandoned: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pending.compareAndSet(waiting, null);
        }
    }

    /**
     * Hand the operator's text to the waiting search.
     *
     * @return false if nothing is waiting
     */
    public boolean submitAnswer(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("CAPTCHA text must not be blank");
        }
        PendingChallenge waiting = pending.get();
        if (waiting == null) {
            return false;
        }
        return waiting.answer().complete(text.trim());
    }

    public Optional<PendingChallenge> pendingChallenge() {
        return Optional.ofNullable(pending.get());
    }

    @Override
    public void abandon(String reason) {
        abandonedReason.set(reason);
        PendingChallenge waiting = pending.get();
        if (waiting != null && waiting.answer().completeExceptionally(new IllegalStateException(reason))) {
            abandonedReason.compareAndSet(reason, null);
        }
    }

    @Override
    public void reset() {
        abandonedReason.set(null);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Path saveImage(CaptchaChallenge challenge) {
        try {
            Path dir = Paths.get(properties.getCaptcha().getImageDir());
            Files.createDirectories(dir);
            Path file = dir.resolve("captcha_" + challenge.challengeId().replaceAll("[^A-Za-z0-9_-]", "_") + ".png");
            Files.write(file, challenge.imageBytes());
            return file;
        } catch (IOException e) {
            throw new CaptchaServiceException("Cannot save CAPTCHA image: " + e.getMessage(), e);
        }
    }
}
