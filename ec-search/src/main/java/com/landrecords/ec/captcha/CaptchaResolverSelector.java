package com.landrecords.ec.captcha;

import com.landrecords.ec.config.EcSearchProperties.Captcha.Backend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps a configured or per-run backend choice to its resolver bean.
 */
@Component
@RequiredArgsConstructor
public class CaptchaResolverSelector {

    private final ManualCaptchaResolver manual;
    private final TwoCaptchaResolver twoCaptcha;
    private final AntiCaptchaResolver antiCaptcha;

    public CaptchaResolver select(Backend backend) {
        return switch (backend) {
            case MANUAL -> manual;
            case TWO_CAPTCHA -> twoCaptcha;
            case ANTI_CAPTCHA -> antiCaptcha;
        };
    }

    public PollingCaptchaResolver automatic(Backend backend) {
        return switch (backend) {
            case TWO_CAPTCHA -> twoCaptcha;
            case ANTI_CAPTCHA -> antiCaptcha;
            case MANUAL -> throw new IllegalArgumentException("The manual backend has no account balance");
        };
    }
}
