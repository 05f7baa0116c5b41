package alertflow.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 通知规则与升级规则的公共结构: 作用域、标签、时间窗口和触发条件
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class AlertRule {
    private String id;
    private String name;
    private boolean active = true;
    private Instant reactivate;             // 临时停用的规则到点自动恢复

    // 作用域
    private String environment;
    private Set<String> service = new LinkedHashSet<>();
    private String resource;
    private String event;
    private String group;
    private String customer;

    // 标签
    private List<AdvancedTag> tags = new ArrayList<>();
    private List<AdvancedTag> excludedTags = new ArrayList<>();

    // 时间窗口
    private Set<String> days = new LinkedHashSet<>();    // Mon/Tue/...
    private LocalTime startTime;
    private LocalTime endTime;

    private List<Trigger> triggers = new ArrayList<>();

    private Integer priority;
    private String text;
    private String user;
    private Instant createTime;
    private long sequence;                  // 保存顺序,优先级相同时按创建顺序
    private String sourcePath;              // 规则文件路径

    public abstract RuleKind getKind();

    /**
     * 未显式配置优先级时按作用域的具体程度计算
     */
    public int effectivePriority() {
        if (priority != null) {
            return priority;
        }
        boolean hasResource = StringUtils.isNotEmpty(resource);
        boolean hasEvent = StringUtils.isNotEmpty(event);
        if (hasResource && !hasEvent) {
            return 2;
        }
        if (service != null && !service.isEmpty()) {
            return 3;
        }
        if (hasEvent && !hasResource) {
            return 4;
        }
        if (StringUtils.isNotEmpty(group)) {
            return 5;
        }
        if (hasResource) {
            return 6;
        }
        if (tags != null && tags.stream().anyMatch(tag -> !tag.isEmpty())) {
            return 7;
        }
        return 1;
    }

    /**
     * 规则启用,或者停用后已过自动恢复时间
     */
    public boolean isActiveAt(Instant now) {
        return active || (reactivate != null && !now.isBefore(reactivate));
    }
}
