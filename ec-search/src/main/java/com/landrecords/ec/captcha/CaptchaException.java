package com.landrecords.ec.captcha;

/**
 * Base of the CAPTCHA failure taxonomy. Fatal to the current target only.
 */
public abstract class CaptchaException extends RuntimeException {
    protected CaptchaException(String m) { super(m); }
    protected CaptchaException(String m, Throwable c) { super(m, c); }
}
