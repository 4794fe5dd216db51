package com.phillippitts.ttsbatch.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(0)).isZero();
        assertThat(TimeUtils.nanosToMillis(1_999_999)).isEqualTo(1);
        assertThat(TimeUtils.nanosToMillis(2_500_000_000L)).isEqualTo(2500);
    }

    @Test
    void elapsedMillisIsNonNegative() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(5);
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(4);
    }
}
