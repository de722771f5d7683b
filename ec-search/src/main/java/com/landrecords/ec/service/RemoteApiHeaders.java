package com.landrecords.ec.service;

import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.SessionArtifact;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.List;

/**
 * Browser-like headers the portal expects on every API call.
 */
final class RemoteApiHeaders {

    static final String TOKEN_HEADER = "_append";

    private RemoteApiHeaders() {}

    static HttpHeaders json(EcSearchProperties.Api api) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.ORIGIN, api.getOrigin());
        headers.set(HttpHeaders.REFERER, api.getOrigin() + "/");
        headers.set(HttpHeaders.USER_AGENT, api.getUserAgent());
        return headers;
    }

    static HttpHeaders authenticated(EcSearchProperties.Api api, SessionArtifact session) {
        HttpHeaders headers = json(api);
        if (session.hasToken()) {
            headers.set(TOKEN_HEADER, session.authToken());
        }
        if (session.hasCookies()) {
            headers.set(HttpHeaders.COOKIE, session.cookieHeader());
        }
        return headers;
    }
}
