package com.unihousing.backend.modules.clearance.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

class ClearanceProgressTest {

    @ParameterizedTest
    @CsvSource({
            "false, false, 0, PENDING",
            "true, false, 50, PENDING",
            "false, true, 50, PENDING",
            "true, true, 100, COMPLETED"
    })
    void percentageAndStatusFollowCheckpoints(boolean roomCheck, boolean keys, int percentage, ClearanceStatus status) {
        ClearanceProgress progress = new ClearanceProgress(true, roomCheck, keys);

        assertThat(progress.percentage()).isEqualTo(percentage);
        assertThat(progress.status()).isEqualTo(status);
    }

    @Test
    void notInitiatedReportsZero() {
        ClearanceProgress progress = ClearanceProgress.notInitiated();

        assertThat(progress.status()).isEqualTo(ClearanceStatus.NOT_INITIATED);
        assertThat(progress.percentage()).isZero();
    }
}
