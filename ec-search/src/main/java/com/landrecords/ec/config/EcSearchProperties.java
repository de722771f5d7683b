package com.landrecords.ec.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ec-search")
@Data
public class EcSearchProperties {

    private Api api = new Api();
    private Crawl crawl = new Crawl();
    private Retry retry = new Retry();
    private Session session = new Session();
    private Captcha captcha = new Captcha();
    private Search search = new Search();
    private Output output = new Output();

    @Data
    public static class Api {
        private String baseUrl = "https://kaveri.karnataka.gov.in/api";
        private String origin = "https://kaveri.karnataka.gov.in";
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Crawl {
        private int workers = 2;
        private Duration villageFetchDelay = Duration.ofMillis(200);
        private String cron = "0 0 3 1 * ?";
        private boolean runOnStartup = false;
    }

    /** Shared by hierarchy fetches and CAPTCHA challenge fetches. */
    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
    }

    @Data
    public static class Session {
        private Duration ttl = Duration.ofHours(1);
        private String file = ".ec_session.json";
        private boolean restoreOnStartup = true;
    }

    @Data
    public static class Captcha {
        private Backend backend = Backend.MANUAL;
        private String apiKey;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration timeout = Duration.ofSeconds(120);
        private String imageDir = "captcha";
        /** Price per solve reported by 2Captcha, which does not return it per task. */
        private double twoCaptchaCostPerSolve = 0.001;
        private TwoCaptchaEndpoints twoCaptcha = new TwoCaptchaEndpoints();
        private AntiCaptchaEndpoints antiCaptcha = new AntiCaptchaEndpoints();

        public enum Backend {
            MANUAL, TWO_CAPTCHA, ANTI_CAPTCHA
        }

        @Data
        public static class TwoCaptchaEndpoints {
            private String submitUrl = "http://2captcha.com/in.php";
            private String resultUrl = "http://2captcha.com/res.php";
        }

        @Data
        public static class AntiCaptchaEndpoints {
            private String submitUrl = "https://api.anti-captcha.com/createTask";
            private String resultUrl = "https://api.anti-captcha.com/getTaskResult";
            private String balanceUrl = "https://api.anti-captcha.com/getBalance";
        }
    }

    @Data
    public static class Search {
        private Duration interTargetDelay = Duration.ofMillis(1500);
        private boolean captchaReuse = false;
        /** Applied to responseMessage of a non-OK response to detect a rejected CAPTCHA. */
        private String invalidCaptchaPattern = "(?i).*captcha.*";
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.JDBC;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "exports";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            JDBC, CSV, BOTH
        }
    }
}
