package fr.lapetina.dopc.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonHttpServerTest {

    @Test
    @DisplayName("should decode query parameters")
    void shouldDecodeQueryParameters() {
        Map<String, String> parameters = JsonHttpServer.parseQuery(
                "venue_slug=home%20venue&cart_value=1000&user_lat=60.17&user_lon=24.93");

        assertThat(parameters)
                .containsEntry("venue_slug", "home venue")
                .containsEntry("cart_value", "1000")
                .containsEntry("user_lat", "60.17")
                .containsEntry("user_lon", "24.93");
    }

    @Test
    @DisplayName("should keep the first occurrence of a repeated key")
    void shouldKeepFirstOccurrence() {
        assertThat(JsonHttpServer.parseQuery("cart_value=1&cart_value=2")).containsEntry("cart_value", "1");
    }

    @Test
    @DisplayName("should map a bare key to the empty string")
    void shouldMapBareKeyToEmptyString() {
        assertThat(JsonHttpServer.parseQuery("venue_slug&&cart_value=")).containsOnly(
                Map.entry("venue_slug", ""),
                Map.entry("cart_value", ""));
    }

    @Test
    @DisplayName("should return no parameters for an absent query")
    void shouldHandleAbsentQuery() {
        assertThat(JsonHttpServer.parseQuery(null)).isEmpty();
        assertThat(JsonHttpServer.parseQuery("")).isEmpty();
    }
}
