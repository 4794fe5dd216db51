package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.exception.SynthesisException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGuardTest {

    @Test
    void rejectsWhenNoPermitFreesUpInTime() {
        ConcurrencyGuard guard = new ConcurrencyGuard(1, 20, "piper");
        guard.acquire();

        assertThatThrownBy(guard::acquire)
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("piper concurrency limit reached after 20ms wait");

        guard.release();
        assertThat(guard.availablePermits()).isEqualTo(1);
    }

    @Test
    void clampsNonPositivePermitsToOne() {
        assertThat(new ConcurrencyGuard(0, 0, "piper").availablePermits()).isEqualTo(1);
    }
}
