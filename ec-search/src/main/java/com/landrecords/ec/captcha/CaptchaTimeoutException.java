package com.landrecords.ec.captcha;

public class CaptchaTimeoutException extends CaptchaException {
    public CaptchaTimeoutException(String m) { super(m); }
}
