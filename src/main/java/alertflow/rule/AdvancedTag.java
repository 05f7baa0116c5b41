package alertflow.rule;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.collections4.CollectionUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 高级标签条件: all 中的标签全部存在,且 any 中至少一个存在(any 为空不限制)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdvancedTag {
    private Set<String> all = new LinkedHashSet<>();
    private Set<String> any = new LinkedHashSet<>();

    public static AdvancedTag ofAll(Set<String> all) {
        return new AdvancedTag(new LinkedHashSet<>(all), new LinkedHashSet<>());
    }

    public boolean isEmpty() {
        return CollectionUtils.isEmpty(all) && CollectionUtils.isEmpty(any);
    }

    /**
     * 规则标签匹配
     */
    public boolean matches(Set<String> tags) {
        return containsAll(tags) && containsAny(tags);
    }

    /**
     * 排除标签判断,all/any 都为空的条目不排除任何告警
     */
    public boolean excludes(Set<String> tags) {
        if (isEmpty()) {
            return false;
        }
        return containsAll(tags) && containsAny(tags);
    }

    private boolean containsAll(Set<String> tags) {
        return CollectionUtils.isEmpty(all) || (tags != null && tags.containsAll(all));
    }

    private boolean containsAny(Set<String> tags) {
        return CollectionUtils.isEmpty(any) || (tags != null && CollectionUtils.containsAny(tags, any));
    }
}
