package com.nodeguardian.unit.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.nodeguardian.gateway.KubernetesQuantity;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class KubernetesQuantityTest {

    @ParameterizedTest
    @CsvSource({
        "250m, 0.25",
        "3920706458n, 3.920706458",
        "4, 4",
        "16Gi, 17179869184",
        "8048112Ki, 8241266688",
        "1M, 1000000",
        "1e3, 1000"
    })
    void parse_validQuantity_returnsBaseUnits(String quantity, String expected) {
        assertThat(KubernetesQuantity.parse(quantity)).isEqualByComparingTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "Gi", "12Q", "fast"})
    void parse_invalidQuantity_throws(String quantity) {
        assertThatThrownBy(() -> KubernetesQuantity.parse(quantity)).isInstanceOf(NumberFormatException.class);
    }
}
