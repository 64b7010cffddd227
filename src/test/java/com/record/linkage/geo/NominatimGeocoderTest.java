package com.record.linkage.geo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NominatimGeocoderTest {

    private static final String BOSTON_JSON =
            "[{\"place_id\":1,\"lat\":\"42.3601\",\"lon\":\"-71.0589\",\"display_name\":\"Boston, MA\",\"importance\":0.8}]";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> okResponse;

    @Mock
    private HttpResponse<String> errorResponse;

    private NominatimGeocoder geocoder;

    @BeforeEach
    void setUp() {
        geocoder = NominatimGeocoder.builder()
                .baseUrl("http://localhost:8080/")
                .userAgent("linkage-test")
                .httpClient(httpClient)
                .retryDelay(Duration.ZERO)
                .requestsPerSecond(1000)
                .build();
    }

    @Test
    @DisplayName("Should parse the first search hit")
    void testResolves() throws Exception {
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn(BOSTON_JSON);
        doReturn(okResponse).when(httpClient).send(any(), any());

        Optional<Coordinates> result = geocoder.geocode("123 MAIN ST BOSTON MA");

        assertEquals(Optional.of(new Coordinates(42.3601, -71.0589)), result);
    }

    @Test
    @DisplayName("Should send an encoded search query with the user agent")
    void testRequest() throws Exception {
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn("[]");
        doReturn(okResponse).when(httpClient).send(any(), any());

        geocoder.geocode("123 MAIN ST BOSTON MA");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertEquals("http://localhost:8080/search?format=json&limit=1&q=123+MAIN+ST+BOSTON+MA",
                request.uri().toString());
        assertEquals(Optional.of("linkage-test"), request.headers().firstValue("User-Agent"));
    }

    @Test
    @DisplayName("No hit should resolve to empty")
    void testNoHit() throws Exception {
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn("[]");
        doReturn(okResponse).when(httpClient).send(any(), any());

        assertTrue(geocoder.geocode("NOWHERE").isEmpty());
    }

    @Test
    @DisplayName("A (0, 0) hit should resolve to empty")
    void testNullIsland() throws Exception {
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn("[{\"lat\":\"0\",\"lon\":\"0\",\"display_name\":\"Null Island\"}]");
        doReturn(okResponse).when(httpClient).send(any(), any());

        assertTrue(geocoder.geocode("NULL ISLAND").isEmpty());
    }

    @Test
    @DisplayName("A malformed body should resolve to empty")
    void testMalformedBody() throws Exception {
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn("<html>rate limited</html>");
        doReturn(okResponse).when(httpClient).send(any(), any());

        assertTrue(geocoder.geocode("123 MAIN ST").isEmpty());
    }

    @Test
    @DisplayName("Should retry server errors and succeed")
    void testRetryThenSuccess() throws Exception {
        when(errorResponse.statusCode()).thenReturn(503);
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn(BOSTON_JSON);
        doReturn(errorResponse, okResponse).when(httpClient).send(any(), any());

        assertTrue(geocoder.geocode("123 MAIN ST BOSTON MA").isPresent());
        verify(httpClient, times(2)).send(any(), any());
    }

    @Test
    @DisplayName("Should retry rate limiting up to the retry limit and give up")
    void testGivesUp() throws Exception {
        when(errorResponse.statusCode()).thenReturn(429);
        doReturn(errorResponse).when(httpClient).send(any(), any());

        assertTrue(geocoder.geocode("123 MAIN ST BOSTON MA").isEmpty());
        verify(httpClient, times(3)).send(any(), any());
    }

    @Test
    @DisplayName("Should retry network errors")
    void testRetryOnIOException() throws Exception {
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn(BOSTON_JSON);
        doThrow(new IOException("connection reset")).doReturn(okResponse).when(httpClient).send(any(), any());

        assertTrue(geocoder.geocode("123 MAIN ST BOSTON MA").isPresent());
        verify(httpClient, times(2)).send(any(), any());
    }

    @Test
    @DisplayName("Should not retry client errors")
    void testClientErrorNotRetried() throws Exception {
        when(errorResponse.statusCode()).thenReturn(400);
        doReturn(errorResponse).when(httpClient).send(any(), any());

        assertTrue(geocoder.geocode("123 MAIN ST BOSTON MA").isEmpty());
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    @DisplayName("Blank addresses should not reach the network")
    void testBlankAddress() {
        assertTrue(geocoder.geocode("  ").isEmpty());
        assertTrue(geocoder.geocode(null).isEmpty());
        verifyNoInteractions(httpClient);
    }

    @Test
    @DisplayName("Builder should validate settings and apply defaults")
    void testBuilder() {
        assertThrows(IllegalArgumentException.class, () -> NominatimGeocoder.builder().maxRetries(0));
        assertThrows(IllegalArgumentException.class, () -> NominatimGeocoder.builder().requestsPerSecond(0));
        assertThrows(IllegalArgumentException.class,
                () -> NominatimGeocoder.builder().retryDelay(Duration.ofSeconds(-1)));

        NominatimGeocoder defaults = NominatimGeocoder.builder().httpClient(httpClient).build();
        assertEquals("https://nominatim.openstreetmap.org", defaults.getBaseUrl());
        assertEquals(3, defaults.getMaxRetries());
        assertEquals("http://localhost:8080", geocoder.getBaseUrl());
    }
}
