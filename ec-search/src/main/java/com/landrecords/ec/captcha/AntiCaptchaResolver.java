package com.landrecords.ec.captcha;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrecords.ec.config.EcSearchProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anti-Captcha ImageToTextTask. Task constraints match the portal's CAPTCHA:
 * 5 to 6 case-sensitive characters, no maths.
 */
@Component
public class AntiCaptchaResolver extends PollingCaptchaResolver {

    private final RestTemplate restTemplate;

    public AntiCaptchaResolver(RestTemplate restTemplate, ObjectMapper objectMapper, EcSearchProperties properties) {
        super(objectMapper, properties);
        this.restTemplate = restTemplate;
    }

    @Override
    public String name() {
        return "anti-captcha";
    }

    @Override
    protected String submit(String imageBase64) {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("type", "ImageToTextTask");
        task.put("body", imageBase64);
        task.put("phrase", false);
        task.put("case", true);
        task.put("numeric", 0);
        task.put("math", false);
        task.put("minLength", 5);
        task.put("maxLength", 6);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("clientKey", config.getApiKey());
        payload.put("task", task);

        JsonNode reply = post("createTask", config.getAntiCaptcha().getSubmitUrl(), payload);
        return reply.path("taskId").asText();
    }

    @Override
    protected PollResult poll(String taskId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("clientKey", config.getApiKey());
        payload.put("taskId", Long.parseLong(taskId));

        JsonNode reply = post("getTaskResult", config.getAntiCaptcha().getResultUrl(), payload);
        if (!"ready".equals(reply.path("status").asText())) {
            return PollResult.notReady();
        }
        return PollResult.ready(reply.path("solution").path("text").asText(), reply.path("cost").asDouble());
    }

    @Override
    public double balance() {
        JsonNode reply = post("getBalance", config.getAntiCaptcha().getBalanceUrl(),
                Map.of("clientKey", config.getApiKey()));
        return reply.path("balance").asDouble();
    }

    private JsonNode post(String what, String url, Map<String, ?> payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        JsonNode reply = callJson(what, () -> restTemplate.postForObject(url, new HttpEntity<>(payload, headers), String.class));
        if (reply.path("errorId").asInt() != 0) {
            throw new CaptchaServiceException("anti-captcha " + what + " error "
                    + reply.path("errorCode").asText() + ": " + reply.path("errorDescription").asText());
        }
        return reply;
    }
}
