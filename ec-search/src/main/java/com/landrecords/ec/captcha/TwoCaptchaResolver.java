package com.landrecords.ec.captcha;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrecords.ec.config.EcSearchProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 2Captcha via its in.php / res.php API with {@code json=1} responses.
 */
@Component
public class TwoCaptchaResolver extends PollingCaptchaResolver {

    private static final String NOT_READY = "CAPCHA_NOT_READY";

    private final RestTemplate restTemplate;

    public TwoCaptchaResolver(RestTemplate restTemplate, ObjectMapper objectMapper, EcSearchProperties properties) {
        super(objectMapper, properties);
        this.restTemplate = restTemplate;
    }

    @Override
    public String name() {
        return "2captcha";
    }

    @Override
    protected String submit(String imageBase64) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("key", config.getApiKey());
        form.add("method", "base64");
        form.add("body", imageBase64);
        form.add("json", "1");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        JsonNode reply = callJson("submit", () -> restTemplate.postForObject(
                config.getTwoCaptcha().getSubmitUrl(), new HttpEntity<>(form, headers), String.class));
        if (reply.path("status").asInt() != 1) {
            throw new CaptchaServiceException("2captcha rejected the image: " + reply.path("request").asText());
        }
        return reply.path("request").asText();
    }

    @Override
    protected PollResult poll(String taskId) {
        String url = UriComponentsBuilder.fromHttpUrl(config.getTwoCaptcha().getResultUrl())
                .queryParam("key", config.getApiKey())
                .queryParam("action", "get")
                .queryParam("id", taskId)
                .queryParam("json", 1)
                .toUriString();

        JsonNode reply = callJson("poll", () -> restTemplate.getForObject(url, String.class));
        String request = reply.path("request").asText();
        if (reply.path("status").asInt() == 1) {
            return PollResult.ready(request, config.getTwoCaptchaCostPerSolve());
        }
        if (NOT_READY.equals(request)) {
            return PollResult.notReady();
        }
        throw new CaptchaServiceException("2captcha failed task " + taskId + ": " + request);
    }

    @Override
    public double balance() {
        String url = UriComponentsBuilder.fromHttpUrl(config.getTwoCaptcha().getResultUrl())
                .queryParam("key", config.getApiKey())
                .queryParam("action", "getbalance")
                .queryParam("json", 1)
                .toUriString();

        JsonNode reply = callJson("balance", () -> restTemplate.getForObject(url, String.class));
        if (reply.path("status").asInt() != 1) {
            throw new CaptchaServiceException("2captcha balance query failed: " + reply.path("request").asText());
        }
        return reply.path("request").asDouble();
    }
}
