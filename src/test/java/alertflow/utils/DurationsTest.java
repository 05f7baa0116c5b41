package alertflow.utils;

import alertflow.exception.ValidationException;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DurationsTest {

    @Test
    void shouldParseShortForms() {
        assertThat(Durations.parse("10m"), equalTo(Duration.ofMinutes(10)));
        assertThat(Durations.parse("2h"), equalTo(Duration.ofHours(2)));
        assertThat(Durations.parse("1d"), equalTo(Duration.ofDays(1)));
        assertThat(Durations.parse("45"), equalTo(Duration.ofSeconds(45)));
        assertThat(Durations.parse(90), equalTo(Duration.ofSeconds(90)));
    }

    @Test
    void shouldParseMapAndIsoForms() {
        assertThat(Durations.parse(ImmutableMap.of("hours", 1, "minutes", 30)), equalTo(Duration.ofMinutes(90)));
        assertThat(Durations.parse("PT15M"), equalTo(Duration.ofMinutes(15)));
        assertThat(Durations.parse(""), nullValue());
        assertThat(Durations.parse(null), nullValue());
    }

    @Test
    void shouldRejectUnknownUnits() {
        assertThrows(ValidationException.class, () -> Durations.parse("10w"));
        assertThrows(ValidationException.class, () -> Durations.parse(ImmutableMap.of("weeks", 1)));
        assertThrows(ValidationException.class, () -> Durations.parse("PTXM"));
    }
}
