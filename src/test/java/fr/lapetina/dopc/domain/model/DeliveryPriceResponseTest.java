package fr.lapetina.dopc.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeliveryPriceResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should compute the total from its components")
    void shouldComputeTotal() {
        DeliveryPriceResponse response = DeliveryPriceResponse.of(500, 390, 64, 500);

        assertThat(response.totalPrice()).isEqualTo(1390L);
        assertThat(response.smallOrderSurcharge()).isEqualTo(500L);
        assertThat(response.cartValue()).isEqualTo(500L);
        assertThat(response.delivery().fee()).isEqualTo(390L);
        assertThat(response.delivery().distance()).isEqualTo(64L);
    }

    @Test
    @DisplayName("should reject a total that does not match the components")
    void shouldRejectInconsistentTotal() {
        assertThatThrownBy(() -> new DeliveryPriceResponse(1000, 0, 500, new DeliveryPriceResponse.Delivery(390, 64)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    @DisplayName("should reject components whose sum overflows")
    void shouldRejectOverflowingSum() {
        assertThatThrownBy(() -> DeliveryPriceResponse.of(1000, 390, 64, Long.MAX_VALUE - 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds maximum");
    }

    @Test
    @DisplayName("should reject zero distance and out-of-bounds fee")
    void shouldRejectDeliveryOutOfBounds() {
        assertThatThrownBy(() -> new DeliveryPriceResponse.Delivery(390, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeliveryPriceResponse.Delivery(0, 64))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeliveryPriceResponse.Delivery(DeliveryPriceResponse.Delivery.MAX_FEE + 1, 64))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeliveryPriceResponse.Delivery(390,
                DeliveryPriceResponse.Delivery.MAX_DISTANCE + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should serialize with snake_case field names")
    void shouldSerializeWithSnakeCase() throws Exception {
        JsonNode json = objectMapper.valueToTree(DeliveryPriceResponse.of(1000, 390, 64, 0));

        assertThat(json.get("total_price").asLong()).isEqualTo(1390L);
        assertThat(json.get("small_order_surcharge").asLong()).isZero();
        assertThat(json.get("cart_value").asLong()).isEqualTo(1000L);
        assertThat(json.get("delivery").get("fee").asLong()).isEqualTo(390L);
        assertThat(json.get("delivery").get("distance").asLong()).isEqualTo(64L);
        assertThat(json.size()).isEqualTo(4);
    }
}
