package com.landrecords.ec.service;

import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.ApiDistrict;
import com.landrecords.ec.model.ApiHobli;
import com.landrecords.ec.model.ApiTaluka;
import com.landrecords.ec.model.ApiVillage;
import com.landrecords.ec.model.District;
import com.landrecords.ec.model.Hobli;
import com.landrecords.ec.model.Taluka;
import com.landrecords.ec.model.Village;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin client over the four location endpoints.
 *
 * Every call is a single POST returning the children of one node. An HTTP error, an
 * unreadable body or an empty list all surface as {@link FetchFailureException}; retrying
 * is the crawler's job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchyApiClient {

    private final RestTemplate restTemplate;
    private final EcSearchProperties properties;

    public List<District> fetchDistricts() {
        ApiDistrict[] rows = call("GetDistrictAsync", Map.of(), ApiDistrict[].class);
        // code 0 is a placeholder entry, not a real district
        return Arrays.stream(rows)
                .filter(d -> d.getCode() != null && d.getCode() != 0)
                .map(ApiDistrict::toDistrict)
                .toList();
    }

    public List<Taluka> fetchTalukas(int districtCode) {
        ApiTaluka[] rows = call("GetTalukaAsync", Map.of("districtCode", String.valueOf(districtCode)), ApiTaluka[].class);
        return Arrays.stream(rows)
                .filter(t -> t.getCode() != null)
                .map(t -> t.toTaluka(districtCode))
                .toList();
    }

    public List<Hobli> fetchHoblis(int talukaCode) {
        ApiHobli[] rows = call("GetHobliAsync", Map.of("talukaCode", String.valueOf(talukaCode)), ApiHobli[].class);
        return Arrays.stream(rows)
                .filter(h -> h.getCode() != null)
                .map(h -> h.toHobli(talukaCode))
                .toList();
    }

    public List<Village> fetchVillages(int hobliCode) {
        ApiVillage[] rows = call("GetVillageAsync", Map.of("hobliCode", String.valueOf(hobliCode)), ApiVillage[].class);
        return Arrays.stream(rows)
                .filter(v -> v.getCode() != null)
                .map(v -> v.toVillage(hobliCode))
                .toList();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T[] call(String endpoint, Map<String, String> payload, Class<T[]> type) {
        String url = properties.getApi().getBaseUrl() + "/" + endpoint;
        log.debug("Calling hierarchy API: {} {}", url, payload);
        T[] response;
        try {
            response = restTemplate.postForObject(url,
                    new HttpEntity<>(payload, RemoteApiHeaders.json(properties.getApi())), type);
        } catch (RestClientException e) {
            throw new FetchFailureException(endpoint + " " + payload + " failed: " + e.getMessage(), e);
        }
        if (response == null || response.length == 0 || Arrays.stream(response).allMatch(Objects::isNull)) {
            throw new FetchFailureException(endpoint + " " + payload + " returned no rows");
        }
        log.debug("{} returned {} rows", endpoint, response.length);
        return response;
    }
}
