package alertflow.alert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 告警实体 - 一个独立的故障状态
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Alert {
    private String id;

    // 唯一标识
    private String environment;
    private String resource;
    private String event;
    private String customer;

    // 状态
    private String severity;
    private String previousSeverity;
    private TrendIndication trendIndication;
    private String status;
    private String value;
    private String text;

    // 分类信息
    private String group;
    private String origin;
    private String type;
    private Set<String> tags;
    private Set<String> service;
    private List<String> correlate;     // 可关联的其他事件名
    private Map<String, Object> attributes;

    // 时间与计数
    private Instant createTime;
    private Instant receiveTime;
    private Instant lastReceiveTime;
    private String lastReceiveId;
    private Instant updateTime;
    private Duration timeout;
    private int duplicateCount;
    private boolean repeat;

    private List<HistoryEntry> history;

    // 乐观锁版本号,存储层按版本做条件更新
    private long version;

    public AlertKey identityKey() {
        return new AlertKey(environment, resource, event, customer);
    }

    /**
     * 深拷贝集合字段,避免状态机修改存储中的对象
     */
    public Alert copy() {
        return toBuilder()
                .tags(tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags))
                .service(service == null ? new LinkedHashSet<>() : new LinkedHashSet<>(service))
                .correlate(correlate == null ? new ArrayList<>() : new ArrayList<>(correlate))
                .attributes(attributes == null ? new HashMap<>() : new HashMap<>(attributes))
                .history(history == null ? new ArrayList<>() : new ArrayList<>(history))
                .build();
    }
}
