package com.landrecords.ec.captcha;

import com.landrecords.ec.model.CaptchaChallenge;
import com.landrecords.ec.model.CaptchaSolution;

/**
 * Turns a challenge image into its text. Implementations never retry a challenge
 * themselves; a failed resolution is reported to the caller, who decides what to do.
 */
public interface CaptchaResolver {

    /**
     * @throws CaptchaTimeoutException if no answer arrived in time
     * @throws CaptchaServiceException if the solver rejected the image or was unreachable
     */
    CaptchaSolution resolve(CaptchaChallenge challenge);

    String name();

    /**
     * Release a caller blocked in {@link #resolve}, if the backend can block. A backend that
     * blocks also fails the next {@link #resolve} when nothing is waiting yet.
     */
    default void abandon(String reason) {
    }

    /** Forget an abandon left over from an earlier run. */
    default void reset() {
    }
}
