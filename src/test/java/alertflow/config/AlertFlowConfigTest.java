package alertflow.config;

import alertflow.exception.AlertFlowException;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AlertFlowConfigTest {

    @Test
    void shouldLoadBundledDefaults() {
        AlertFlowConfig config = AlertFlowConfig.load("classpath:alertflow.yml");
        config.validate();

        assertThat(config.getString("status.default"), equalTo("open"));
        assertThat(config.getStringList("status.resolved", Collections.emptyList()), contains("closed", "expired"));
        assertThat(config.getInt("severity.ranking.critical"), is(9));
        assertThat(config.getInt("oncall.lookahead-days", 0), is(14));
        assertThat(config.getZone(), equalTo(ZoneId.of("UTC")));
    }

    @Test
    void shouldFallBackToDefaults() {
        AlertFlowConfig config = AlertFlowConfig.of(ImmutableMap.of("history", ImmutableMap.of("limit", "abc")));

        assertThat(config.getInt("history.limit", 100), is(100));
        assertThat(config.getString("missing.key", "x"), equalTo("x"));
        assertThat(config.getStringList("missing.list", Arrays.asList("a")), contains("a"));
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThrows(AlertFlowException.class, () -> AlertFlowConfig.load("classpath:missing.yml"));
        assertThrows(IllegalArgumentException.class,
                () -> AlertFlowConfig.of(ImmutableMap.of("history", ImmutableMap.of("limit", 0))).validate());
    }
}
