package com.hhplus.furniture.domain.inventory;

import com.hhplus.furniture.common.exception.DomainException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StockDirection 단위 테스트")
class StockDirectionTest {

    @ParameterizedTest
    @ValueSource(strings = {"+", "1", "+1", "increase", "INCREASE"})
    @DisplayName("증가 sign")
    void testIncrease(String sign) {
        assertThat(StockDirection.fromSign(sign)).isEqualTo(StockDirection.INCREASE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"-", "-1", "decrease", " Decrease "})
    @DisplayName("감소 sign")
    void testDecrease(String sign) {
        assertThat(StockDirection.fromSign(sign)).isEqualTo(StockDirection.DECREASE);
    }

    @Test
    @DisplayName("알 수 없는 sign은 예외")
    void testUnknown() {
        assertThatThrownBy(() -> StockDirection.fromSign("*")).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> StockDirection.fromSign(null)).isInstanceOf(DomainException.class);
    }
}
