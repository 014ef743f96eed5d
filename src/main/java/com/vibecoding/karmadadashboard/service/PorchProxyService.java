package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.PorchException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Collections;
import java.util.Set;

/**
 * Porch API (porch.kpt.dev/v1alpha1, default 네임스페이스) 로 요청을 그대로 전달
 */
@Service
public class PorchProxyService {

    private static final Logger log = LoggerFactory.getLogger(PorchProxyService.class);

    static final String PORCH_BASE_PATH = "/apis/porch.kpt.dev/v1alpha1/namespaces/default/";
    static final String REPOSITORIES = "repositories";
    static final String PACKAGE_REVISIONS = "packagerevisions";
    static final String PACKAGE_REVISION_RESOURCES = "packagerevisionresources";

    // 요청/응답 복사에서 제외할 헤더
    private static final Set<String> SKIPPED_REQUEST_HEADERS = Set.of(
        HttpHeaders.AUTHORIZATION.toLowerCase(), HttpHeaders.HOST.toLowerCase(), HttpHeaders.CONTENT_LENGTH.toLowerCase());
    private static final Set<String> SKIPPED_RESPONSE_HEADERS = Set.of(
        HttpHeaders.TRANSFER_ENCODING.toLowerCase(), HttpHeaders.CONTENT_LENGTH.toLowerCase(), HttpHeaders.CONNECTION.toLowerCase());

    private final RestTemplate restTemplate;
    private final ServiceAccountTokenCache tokenCache;
    private final DashboardProperties properties;

    public PorchProxyService(@Qualifier("porchRestTemplate") RestTemplate restTemplate,
                             ServiceAccountTokenCache tokenCache,
                             DashboardProperties properties) {
        this.restTemplate = restTemplate;
        this.tokenCache = tokenCache;
        this.properties = properties;
    }

    // ========== Repository ==========

    public ResponseEntity<byte[]> repositories(HttpServletRequest request, byte[] body) {
        return proxy(request, body, REPOSITORIES);
    }

    public ResponseEntity<byte[]> repository(String name, HttpServletRequest request, byte[] body) {
        requireName(name, "repository name is required");
        return proxy(request, body, REPOSITORIES + "/" + name);
    }

    // ========== PackageRevision ==========

    public ResponseEntity<byte[]> packageRevisions(HttpServletRequest request, byte[] body) {
        return proxy(request, body, PACKAGE_REVISIONS);
    }

    public ResponseEntity<byte[]> packageRevision(String name, HttpServletRequest request, byte[] body) {
        requireName(name, "packagerevision name is required");
        return proxy(request, body, PACKAGE_REVISIONS + "/" + name);
    }

    public ResponseEntity<byte[]> packageRevisionResources(String name, HttpServletRequest request, byte[] body) {
        requireName(name, "packagerevision name is required");
        return proxy(request, body, PACKAGE_REVISION_RESOURCES + "/" + name);
    }

    // ========== Proxy ==========

    /**
     * method / body / 헤더(Authorization 제외) / query 를 전달하고
     * upstream 의 status / content-type / body 를 그대로 반환
     */
    ResponseEntity<byte[]> proxy(HttpServletRequest request, byte[] body, String resourcePath) {
        String porchUrl = properties.getPorch().getApiUrl();
        if (porchUrl == null || porchUrl.isBlank()) {
            log.error("Porch API URL is not configured");
            throw new PorchException("Porch API is not configured");
        }

        DashboardProperties.Porch porch = properties.getPorch();
        String token = tokenCache.getToken(porch.getServiceAccountNamespace(), porch.getServiceAccountName());

        HttpHeaders headers = new HttpHeaders();
        for (String headerName : Collections.list(request.getHeaderNames())) {
            if (!SKIPPED_REQUEST_HEADERS.contains(headerName.toLowerCase())) {
                headers.put(headerName, Collections.list(request.getHeaders(headerName)));
            }
        }
        headers.setBearerAuth(token);

        String url = trimTrailingSlash(porchUrl) + PORCH_BASE_PATH + resourcePath;
        if (request.getQueryString() != null && !request.getQueryString().isEmpty()) {
            url = url + "?" + request.getQueryString();
        }
        HttpMethod method = HttpMethod.valueOf(request.getMethod());
        log.debug("Proxying {} {}", method, url);

        ResponseEntity<byte[]> upstream;
        try {
            upstream = restTemplate.exchange(URI.create(url), method,
                new HttpEntity<>(body != null && body.length > 0 ? body : null, headers), byte[].class);
        } catch (RestClientException e) {
            log.error("Failed to call Porch API: {} {}", method, url, e);
            throw new PorchException("Failed to call Porch API", e);
        }

        HttpHeaders responseHeaders = new HttpHeaders();
        upstream.getHeaders().forEach((headerName, values) -> {
            if (!SKIPPED_RESPONSE_HEADERS.contains(headerName.toLowerCase())) {
                responseHeaders.put(headerName, values);
            }
        });
        return ResponseEntity.status(upstream.getStatusCode())
            .headers(responseHeaders)
            .body(upstream.getBody());
    }

    private static void requireName(String name, String message) {
        if (name == null || name.isBlank()) {
            throw new BadRequestException(message);
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
