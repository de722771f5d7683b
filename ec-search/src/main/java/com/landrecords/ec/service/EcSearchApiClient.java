package com.landrecords.ec.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.ApiSearchResponse;
import com.landrecords.ec.model.CaptchaChallenge;
import com.landrecords.ec.model.SearchRequest;
import com.landrecords.ec.model.SearchResponse;
import com.landrecords.ec.model.SessionArtifact;
import com.landrecords.ec.session.SessionExpiredException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Authenticated calls against the EC search side of the portal: CAPTCHA generation,
 * the party-name search itself, and a cheap liveness probe for the session.
 *
 * Search responses are classified rather than thrown, so the orchestrator can decide
 * which outcomes end the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EcSearchApiClient {

    private static final TypeReference<List<LinkedHashMap<String, Object>>> ROWS = new TypeReference<>() {};
    private static final String CAPTCHA_ID_HEADER = "i";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final EcSearchProperties properties;

    public enum ProbeStatus { OK, UNAUTHORIZED, ERROR }

    public record ProbeResult(ProbeStatus status, String message) {}

    /**
     * Request a new challenge. The id comes back in the {@code i} response header,
     * the image as the body.
     */
    public CaptchaChallenge generateCaptcha(SessionArtifact session) {
        String url = properties.getApi().getBaseUrl() + "/Generate";
        HttpHeaders headers = RemoteApiHeaders.authenticated(properties.getApi(), session);
        headers.setAccept(List.of(MediaType.ALL));
        try {
            ResponseEntity<byte[]> response = restTemplate.exchange(url, HttpMethod.GET,
                    new HttpEntity<>(headers), byte[].class);
            String challengeId = response.getHeaders().getFirst(CAPTCHA_ID_HEADER);
            byte[] image = response.getBody();
            if (challengeId == null || image == null || image.length == 0) {
                throw new RemoteSearchException("CAPTCHA endpoint returned no challenge");
            }
            log.debug("Generated CAPTCHA {}", challengeId);
            return new CaptchaChallenge(challengeId, image);

        } catch (HttpClientErrorException.Unauthorized e) {
            throw new SessionExpiredException("CAPTCHA generation rejected the session (401)", e);
        } catch (RestClientException e) {
            throw new RemoteSearchException("CAPTCHA generation failed: " + e.getMessage(), e);
        }
    }

    public SearchResponse search(SearchRequest request, SessionArtifact session) {
        String url = properties.getApi().getBaseUrl() + "/NewECSearch";

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("_VillageCode", String.valueOf(request.villageCode()));
        payload.put("_FromDate", request.fromDate().toString());
        payload.put("_ToDate", request.toDate().toString());
        payload.put("EcFilter", "n");
        payload.put("firstName", request.firstName());
        payload.put("middleName", request.middleName() == null ? "" : request.middleName());
        payload.put("lastName", request.lastName() == null ? "" : request.lastName());
        payload.put("captchaID", request.captchaId());
        payload.put("captchaCode", request.captchaText());

        ApiSearchResponse body;
        try {
            body = restTemplate.postForObject(url,
                    new HttpEntity<>(payload, RemoteApiHeaders.authenticated(properties.getApi(), session)),
                    ApiSearchResponse.class);
        } catch (HttpClientErrorException.Unauthorized e) {
            return SearchResponse.unauthorized("401 Unauthorized - session expired, login again");
        } catch (RestClientException e) {
            return SearchResponse.error("Search call failed: " + e.getMessage());
        }

        if (body == null) {
            return SearchResponse.error("Empty search response");
        }
        if (body.getResponseCode() == null || body.getResponseCode() != ApiSearchResponse.RESPONSE_OK) {
            String message = body.getResponseMessage() == null ? "" : body.getResponseMessage();
            if (Pattern.matches(properties.getSearch().getInvalidCaptchaPattern(), message)) {
                return SearchResponse.invalidCaptcha(message);
            }
            return SearchResponse.error("responseCode " + body.getResponseCode() + ": " + message);
        }

        try {
            return SearchResponse.ok(parseRows(body.getData()));
        } catch (JsonProcessingException e) {
            return SearchResponse.error("Unreadable result data: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            // data parsed as JSON but its items are not objects
            return SearchResponse.error("Unreadable result data: " + e.getMessage());
        }
    }

    /**
     * Lightweight authenticated call: list districts with the session's credentials.
     */
    public ProbeResult probe(SessionArtifact session) {
        String url = properties.getApi().getBaseUrl() + "/GetDistrictAsync";
        try {
            JsonNode districts = restTemplate.postForObject(url,
                    new HttpEntity<>(Map.of(), RemoteApiHeaders.authenticated(properties.getApi(), session)),
                    JsonNode.class);
            if (districts != null && districts.isArray() && districts.size() > 0) {
                return new ProbeResult(ProbeStatus.OK, "Session valid, got " + districts.size() + " districts");
            }
            return new ProbeResult(ProbeStatus.ERROR, "Unexpected probe response");
        } catch (HttpClientErrorException.Unauthorized e) {
            return new ProbeResult(ProbeStatus.UNAUTHORIZED, "401 Unauthorized - session invalid");
        } catch (RestClientException e) {
            return new ProbeResult(ProbeStatus.ERROR, "Probe failed: " + e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Map<String, Object>> parseRows(JsonNode data) throws JsonProcessingException {
        if (data == null || data.isNull()) {
            return List.of();
        }
        JsonNode array = data.isTextual() ? objectMapper.readTree(data.asText("[]")) : data;
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<LinkedHashMap<String, Object>> rows = objectMapper.convertValue(array, ROWS);
        return new ArrayList<>(rows);
    }
}
