package fr.lapetina.dopc.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeliveryOrderRequestTest {

    @Test
    @DisplayName("should accept a valid request")
    void shouldAcceptValidRequest() {
        DeliveryOrderRequest request = new DeliveryOrderRequest("home-assignment-venue-helsinki", 1000, 60.17, 24.93);

        assertThat(request.venueSlug()).isEqualTo("home-assignment-venue-helsinki");
        assertThat(request.cartValue()).isEqualTo(1000L);
    }

    @Test
    @DisplayName("should reject a blank venue slug")
    void shouldRejectBlankSlug() {
        assertThatThrownBy(() -> new DeliveryOrderRequest("  ", 1000, 60.17, 24.93))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Venue slug");
    }

    @Test
    @DisplayName("should reject a non-positive cart value")
    void shouldRejectNonPositiveCartValue() {
        assertThatThrownBy(() -> new DeliveryOrderRequest("venue", 0, 60.17, 24.93))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cart value");
        assertThatThrownBy(() -> new DeliveryOrderRequest("venue", -5, 60.17, 24.93))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject out-of-range coordinates")
    void shouldRejectOutOfRangeCoordinates() {
        assertThatThrownBy(() -> new DeliveryOrderRequest("venue", 1000, 95, 24.93))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("latitude");
        assertThatThrownBy(() -> new DeliveryOrderRequest("venue", 1000, 60.17, 200))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("longitude");
    }
}
