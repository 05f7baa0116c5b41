package alertflow.rule;

import alertflow.alert.Transition;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.Set;

/**
 * 判断一次具体的级别/状态迁移是否满足规则的触发条件
 */
public class TriggerEvaluator {
    static final String DEFAULT_PLACEHOLDER = "{default}";

    /**
     * 未配置触发条件的规则对任何迁移都触发
     */
    public boolean fires(AlertRule rule, Transition transition) {
        if (CollectionUtils.isEmpty(rule.getTriggers())) {
            return true;
        }
        return firingTrigger(rule, transition).isPresent();
    }

    public Optional<Trigger> firingTrigger(AlertRule rule, Transition transition) {
        if (rule.getTriggers() == null) {
            return Optional.empty();
        }
        return rule.getTriggers().stream()
                .filter(trigger -> matches(trigger, transition))
                .findFirst();
    }

    /**
     * 消息模板: 命中触发器的 text(其中 {default} 替换为规则 text),否则规则 text,都没有时返回 null
     */
    public String messageTemplate(AlertRule rule, Transition transition) {
        Optional<Trigger> trigger = firingTrigger(rule, transition);
        if (trigger.isPresent() && StringUtils.isNotEmpty(trigger.get().getText())) {
            return trigger.get().getText().replace(DEFAULT_PLACEHOLDER, StringUtils.defaultString(rule.getText()));
        }
        return StringUtils.defaultIfEmpty(rule.getText(), null);
    }

    private static boolean matches(Trigger trigger, Transition transition) {
        return contains(trigger.getFromSeverity(), transition.getPreviousSeverity())
                && contains(trigger.getToSeverity(), transition.getSeverity())
                && contains(trigger.getStatus(), transition.getStatus());
    }

    private static boolean contains(Set<String> allowed, String value) {
        return CollectionUtils.isEmpty(allowed) || (value != null && allowed.contains(value));
    }
}
