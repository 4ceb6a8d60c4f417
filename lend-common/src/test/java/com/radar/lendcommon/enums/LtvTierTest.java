package com.radar.lendcommon.enums;

import com.radar.lendcommon.exception.BizException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LtvTierTest {

    @ParameterizedTest
    @CsvSource({"20,0", "25,1", "33,5", "50,8"})
    void eachLtvMapsToItsApy(int ltv, int apy) {
        assertThat(LtvTier.of(ltv).getApy()).isEqualTo(apy);
        assertThat(LtvTier.isValidPair(ltv, apy)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 10, 30, 51, 100})
    void unknownLtvIsInvalid(int ltv) {
        assertThatThrownBy(() -> LtvTier.of(ltv))
                .isInstanceOf(BizException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_LTV);
    }

    @Test
    void mismatchedPairIsInvalid() {
        assertThat(LtvTier.isValidPair(50, 5)).isFalse();
        assertThat(LtvTier.isValidPair(40, 8)).isFalse();
    }
}
