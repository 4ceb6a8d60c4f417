package com.radar.lendservice.config;

import com.radar.lendservice.service.model.LedgerParams;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LendingConfigTest {

    @Test
    void defaultsMatchLedgerDefaults() {
        assertThat(new LendingConfig().toParams()).isEqualTo(LedgerParams.defaults());
    }

    @Test
    void sharedTreasuryAndVaultAreRejected() {
        LendingConfig config = new LendingConfig();
        config.setVaultAccount(config.getTreasuryAccount());

        assertThatThrownBy(config::toParams).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonPositiveScaleIsRejected() {
        LendingConfig config = new LendingConfig();
        config.setPriceScale(0);

        assertThatThrownBy(config::toParams).isInstanceOf(IllegalArgumentException.class);
    }
}
