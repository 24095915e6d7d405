package org.disnet.dcdb.api;

/*
 * This file is part of DISNET DCDB.
 *
 * Copyright (C) 2025 DISNET
 *
 * DISNET DCDB is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DISNET DCDB is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DISNET DCDB.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.disnet.dcdb.util.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Base for the JSON-over-HTTP clients.
 * <ul>
 * <li>2xx: body parsed into a {@link JsonNode} (empty body yields {@code null}).</li>
 * <li>404: {@code null}, the entity does not exist.</li>
 * <li>5xx and transport errors: retried with exponential backoff, then
 * {@link ServiceException}.</li>
 * <li>Any other status: {@link ServiceException} immediately.</li>
 * </ul>
 */
public abstract class ServiceClient {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private static final long INITIAL_BACKOFF_MS = 500;

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;
    private final int maxRetries;

    protected ServiceClient(String baseUrl, Duration timeout, int maxRetries) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), baseUrl, timeout, maxRetries);
    }

    protected ServiceClient(HttpClient http, String baseUrl, Duration timeout, int maxRetries) {
        this.http = Objects.requireNonNull(http, "http");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.maxRetries = Math.max(0, maxRetries);
    }

    /** GET {@code baseUrl + pathAndQuery}. */
    protected JsonNode getJson(String pathAndQuery) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    /** POST a JSON body to {@code baseUrl + path}. */
    protected JsonNode postJson(String path, Object body) {
        String payload;
        try {
            payload = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new ServiceException("Unable to serialize request body for " + path, ex);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        return send(request);
    }

    private JsonNode send(HttpRequest request) {
        int attempt = 0;
        long sleepMs = INITIAL_BACKOFF_MS;
        while (true) {
            HttpResponse<String> response;
            try {
                response = http.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException ex) {
                if (attempt++ >= maxRetries) {
                    throw new ServiceException(request.method() + " " + request.uri() + " failed: " + ex.getMessage(), ex);
                }
                Logger.warn("{} {} failed ({}), retry {} in {} ms", request.method(), request.uri(), ex.getMessage(), attempt, sleepMs);
                sleepMs = backoff(sleepMs);
                continue;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ServiceException("Interrupted calling " + request.uri(), ie);
            }

            int status = response.statusCode();
            if (status == 404) {
                return null;
            }
            if (status >= 500 && attempt < maxRetries) {
                attempt++;
                Logger.warn("{} {} returned {}, retry {} in {} ms", request.method(), request.uri(), status, attempt, sleepMs);
                sleepMs = backoff(sleepMs);
                continue;
            }
            if (status < 200 || status >= 300) {
                throw new ServiceException("HTTP " + status + " from " + request.uri(), status, null);
            }
            return parse(request.uri(), response.body());
        }
    }

    static JsonNode parse(URI uri, String body) {
        if (StringUtils.isBlank(body)) {
            return null;
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new ServiceException("Unparseable JSON from " + uri + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static long backoff(long sleepMs) {
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Interrupted during retry backoff", ie);
        }
        return Math.min(sleepMs * 2, 10_000);
    }

    /** URL-encode one query value or path segment. */
    protected static String enc(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Text at {@code node}, or null for missing, JSON null or blank. */
    protected static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String v = node.asText();
        return StringUtils.isBlank(v) ? null : v.trim();
    }

    /** Number at {@code node}, or null for missing, JSON null or non-numeric text. */
    protected static Double number(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        String v = node.asText();
        if (StringUtils.isBlank(v)) {
            return null;
        }
        try {
            return Double.valueOf(v.trim());
        } catch (NumberFormatException nfe) {
            return null;
        }
    }
}
