package alertflow.alert;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * 告警历史记录,写入后不再修改
 */
@Data
@Builder
public class HistoryEntry {
    private final String id;
    private final String event;
    private final String severity;
    private final String status;
    private final String value;
    private final String text;
    private final String type;          // new/severity/status/text/correlate
    private final Instant updateTime;
    private final String user;
    private final Duration timeout;
}
