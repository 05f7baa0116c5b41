package alertflow.alert;

import alertflow.config.AlertFlowConfig;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 告警级别排序,用于计算趋势 (moreSevere/lessSevere/noChange)
 */
public class SeverityRanking {

    // ISA 18.2 告警模型的默认级别
    static final Map<String, Integer> DEFAULT_RANKING = ImmutableMap.<String, Integer>builder()
            .put("security", 10)
            .put("critical", 9)
            .put("major", 8)
            .put("minor", 7)
            .put("warning", 6)
            .put("indeterminate", 5)
            .put("informational", 4)
            .put("normal", 3)
            .put("ok", 3)
            .put("cleared", 3)
            .put("debug", 2)
            .put("trace", 1)
            .put("unknown", 0)
            .build();

    private static final List<String> DEFAULT_CLEARED = Arrays.asList("normal", "ok", "cleared");

    private final Map<String, Integer> ranking;
    private final Set<String> cleared;
    private final String defaultPrevious;

    public SeverityRanking(Map<String, Integer> ranking, Set<String> cleared, String defaultPrevious) {
        this.ranking = ImmutableMap.copyOf(ranking);
        this.cleared = ImmutableSet.copyOf(cleared);
        this.defaultPrevious = defaultPrevious;
    }

    public static SeverityRanking defaults() {
        return new SeverityRanking(DEFAULT_RANKING, ImmutableSet.copyOf(DEFAULT_CLEARED), "normal");
    }

    public static SeverityRanking fromConfig(AlertFlowConfig config) {
        Map<String, Object> configured = config.getSubConfig("severity.ranking");
        Map<String, Integer> ranking;
        if (configured.isEmpty()) {
            ranking = DEFAULT_RANKING;
        } else {
            ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
            configured.forEach((label, rank) -> builder.put(label.toLowerCase(Locale.ROOT), ((Number) rank).intValue()));
            ranking = builder.build();
        }
        return new SeverityRanking(
                ranking,
                ImmutableSet.copyOf(config.getStringList("severity.cleared", DEFAULT_CLEARED)),
                config.getString("severity.default-previous", "normal"));
    }

    /**
     * 未配置的级别按 0 处理
     */
    public int rank(String severity) {
        if (severity == null) {
            return 0;
        }
        return ranking.getOrDefault(severity.toLowerCase(Locale.ROOT), 0);
    }

    public TrendIndication trend(String previous, String current) {
        int diff = rank(current) - rank(previous);
        if (diff > 0) {
            return TrendIndication.MORE_SEVERE;
        }
        if (diff < 0) {
            return TrendIndication.LESS_SEVERE;
        }
        return TrendIndication.NO_CHANGE;
    }

    public boolean isCleared(String severity) {
        return severity != null && cleared.contains(severity.toLowerCase(Locale.ROOT));
    }

    public boolean isKnown(String severity) {
        return severity != null && ranking.containsKey(severity.toLowerCase(Locale.ROOT));
    }

    public String getDefaultPrevious() {
        return defaultPrevious;
    }
}
