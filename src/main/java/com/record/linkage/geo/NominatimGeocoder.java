package com.record.linkage.geo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Geocoder backed by the OpenStreetMap Nominatim search API.
 *
 * <p>Requests are throttled by a token bucket (Nominatim's public instance allows one request
 * per second) and retried with exponential backoff on network errors, HTTP 429 and 5xx.
 * Every other outcome that does not yield a location, including a {@code (0, 0)} hit, resolves
 * to empty.</p>
 *
 * Usage:
 * <pre>
 * Geocoder geocoder = NominatimGeocoder.builder()
 *     .userAgent("my-dedup-job")
 *     .requestsPerSecond(1)
 *     .build();
 * </pre>
 */
public class NominatimGeocoder implements Geocoder {
    private static final Logger log = LoggerFactory.getLogger(NominatimGeocoder.class);

    private static final String DEFAULT_BASE_URL = "https://nominatim.openstreetmap.org";
    private static final String DEFAULT_USER_AGENT = "company-location-linkage";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);
    private static final double DEFAULT_REQUESTS_PER_SECOND = 1.0;

    private final String baseUrl;
    private final String userAgent;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;

    private NominatimGeocoder(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.userAgent = builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay != null ? builder.retryDelay : DEFAULT_RETRY_DELAY;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper();
        this.rateLimiter = new RateLimiter(builder.requestsPerSecond);
    }

    @Override
    public Optional<Coordinates> geocode(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                rateLimiter.acquire();
                HttpResponse<String> response = httpClient.send(buildRequest(address),
                        HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();

                if (status == 200) {
                    return parseResponse(address, response.body());
                }
                if (status == 429 || status >= 500) {
                    log.warn("geocode.retryable address='{}' status={} attempt={}", address, status, attempt + 1);
                } else {
                    log.warn("geocode.rejected address='{}' status={}", address, status);
                    return Optional.empty();
                }
            } catch (IOException e) {
                log.warn("geocode.io_error address='{}' attempt={} error={}", address, attempt + 1, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("geocode.interrupted address='{}'", address);
                return Optional.empty();
            }

            if (attempt + 1 < maxRetries && !backoff(attempt)) {
                return Optional.empty();
            }
        }

        log.warn("geocode.gave_up address='{}' retries={}", address, maxRetries);
        return Optional.empty();
    }

    @Override
    public String getName() {
        return "Nominatim";
    }

    private HttpRequest buildRequest(String address) {
        String query = URLEncoder.encode(address, StandardCharsets.UTF_8);
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/search?format=json&limit=1&q=" + query))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    private Optional<Coordinates> parseResponse(String address, String body) {
        try {
            NominatimPlace[] places = objectMapper.readValue(body, NominatimPlace[].class);
            if (places.length == 0) {
                log.debug("geocode.not_found address='{}'", address);
                return Optional.empty();
            }
            NominatimPlace place = places[0];
            Coordinates coordinates = new Coordinates(
                    Double.parseDouble(place.lat()), Double.parseDouble(place.lon()));
            if (coordinates.isNullIsland()) {
                return Optional.empty();
            }
            log.debug("geocode.resolved address='{}' coordinates={} match='{}'",
                    address, coordinates, place.displayName());
            return Optional.of(coordinates);
        } catch (IOException | RuntimeException e) {
            log.warn("geocode.unparseable address='{}' error={}", address, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Sleeps {@code retryDelay * 2^attempt}. Returns false when interrupted.
     */
    private boolean backoff(int attempt) {
        long delayMillis = retryDelay.toMillis() * (1L << attempt);
        try {
            Thread.sleep(delayMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String userAgent;
        private Duration timeout;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay;
        private double requestsPerSecond = DEFAULT_REQUESTS_PER_SECOND;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries <= 0) {
                throw new IllegalArgumentException("maxRetries must be > 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative");
            }
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder requestsPerSecond(double requestsPerSecond) {
            if (!(requestsPerSecond > 0)) {
                throw new IllegalArgumentException("requestsPerSecond must be > 0");
            }
            this.requestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public NominatimGeocoder build() {
            return new NominatimGeocoder(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record NominatimPlace(
            @JsonProperty("lat") String lat,
            @JsonProperty("lon") String lon,
            @JsonProperty("display_name") String displayName
    ) {}
}
