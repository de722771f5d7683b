package com.landrecords.ec.captcha;

public class CaptchaServiceException extends CaptchaException {
    public CaptchaServiceException(String m) { super(m); }
    public CaptchaServiceException(String m, Throwable c) { super(m, c); }
}
