package io.providerbridge.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeTest {

    @Test
    void ordersBySecondsThenNanos() {
        Time a = new Time(1, 999_999_999);
        Time b = new Time(2, 0);
        Time c = new Time(2, 1);

        assertThat(a).isLessThan(b);
        assertThat(b).isLessThan(c);
        assertThat(new Time(2, 0)).isEqualByComparingTo(b);
    }

    @Test
    void convertsToAndFromNanos() {
        Time t = Time.ofNanos(3_000_000_042L);

        assertThat(t).isEqualTo(new Time(3, 42));
        assertThat(t.toNanos()).isEqualTo(3_000_000_042L);
    }

    @Test
    void negativeNanosRoundTowardNegativeInfinity() {
        assertThat(Time.ofNanos(-1)).isEqualTo(new Time(-1, 999_999_999));
    }

    @Test
    void rejectsOutOfRangeNanos() {
        assertThatThrownBy(() -> new Time(0, 1_000_000_000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Time(0, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rendersPaddedNanos() {
        assertThat(new Time(5, 7)).hasToString("5.000000007");
    }
}
