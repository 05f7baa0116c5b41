package alertflow.store;

import alertflow.blackout.Blackout;
import alertflow.dispatch.NotificationChannel;
import alertflow.exception.ValidationException;
import alertflow.oncall.NotificationGroup;
import alertflow.oncall.OnCall;
import alertflow.rule.AlertRule;
import alertflow.rule.RuleKind;
import alertflow.rule.RuleValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
public class InMemoryConfigStore implements ConfigStore {
    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final Map<String, Blackout> blackouts = new ConcurrentHashMap<>();
    private final Map<String, OnCall> onCalls = new ConcurrentHashMap<>();
    private final Map<String, NotificationGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, NotificationChannel> channels = new ConcurrentHashMap<>();

    private final AtomicLong version = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();

    private final RuleValidator validator;
    private final Clock clock;

    public InMemoryConfigStore(RuleValidator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public List<AlertRule> listRules(RuleKind kind, String environment) {
        return rules.values().stream()
                .filter(rule -> rule.getKind() == kind)
                .filter(rule -> Objects.equals(rule.getEnvironment(), environment))
                .sorted(Comparator.comparingLong(AlertRule::getSequence))
                .collect(Collectors.toList());
    }

    @Override
    public List<AlertRule> listAllRules() {
        return rules.values().stream()
                .sorted(Comparator.comparingLong(AlertRule::getSequence))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AlertRule> getRule(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    @Override
    public AlertRule saveRule(AlertRule rule) {
        validator.validate(rule);
        if (StringUtils.isBlank(rule.getId())) {
            rule.setId(UUID.randomUUID().toString());
        }
        AlertRule existing = rules.get(rule.getId());
        if (existing != null && existing.getKind() != rule.getKind()) {
            throw new ValidationException("规则ID已被其他类型的规则使用: " + rule.getId());
        }
        if (existing != null) {
            rule.setSequence(existing.getSequence());
            if (rule.getCreateTime() == null) {
                rule.setCreateTime(existing.getCreateTime());
            }
        } else {
            rule.setSequence(sequence.incrementAndGet());
        }
        if (rule.getCreateTime() == null) {
            rule.setCreateTime(clock.instant());
        }
        rules.put(rule.getId(), rule);
        version.incrementAndGet();
        return rule;
    }

    @Override
    public boolean deleteRule(String id) {
        return changed(rules.remove(id) != null);
    }

    @Override
    public List<Blackout> listBlackouts(String environment) {
        return blackouts.values().stream()
                .filter(blackout -> Objects.equals(blackout.getEnvironment(), environment))
                .collect(Collectors.toList());
    }

    @Override
    public Blackout saveBlackout(Blackout blackout) {
        validator.validate(blackout);
        if (StringUtils.isBlank(blackout.getId())) {
            blackout.setId(UUID.randomUUID().toString());
        }
        blackouts.put(blackout.getId(), blackout);
        version.incrementAndGet();
        return blackout;
    }

    @Override
    public boolean deleteBlackout(String id) {
        return changed(blackouts.remove(id) != null);
    }

    @Override
    public List<OnCall> listOnCalls(String customer) {
        return onCalls.values().stream()
                .filter(onCall -> onCall.getCustomer() == null || Objects.equals(onCall.getCustomer(), customer))
                .collect(Collectors.toList());
    }

    @Override
    public OnCall saveOnCall(OnCall onCall) {
        validator.validate(onCall);
        if (StringUtils.isBlank(onCall.getId())) {
            onCall.setId(UUID.randomUUID().toString());
        }
        onCalls.put(onCall.getId(), onCall);
        version.incrementAndGet();
        return onCall;
    }

    @Override
    public boolean deleteOnCall(String id) {
        return changed(onCalls.remove(id) != null);
    }

    @Override
    public Optional<NotificationGroup> getGroup(String id) {
        return Optional.ofNullable(groups.get(id));
    }

    @Override
    public NotificationGroup saveGroup(NotificationGroup group) {
        if (StringUtils.isBlank(group.getId())) {
            throw new ValidationException("通知分组 id 不能为空");
        }
        groups.put(group.getId(), group);
        version.incrementAndGet();
        return group;
    }

    @Override
    public Optional<NotificationChannel> getChannel(String id) {
        return Optional.ofNullable(channels.get(id));
    }

    @Override
    public NotificationChannel saveChannel(NotificationChannel channel) {
        validator.validate(channel);
        channels.put(channel.getId(), channel);
        version.incrementAndGet();
        return channel;
    }

    @Override
    public int deleteBySource(String sourcePath) {
        int removed = 0;
        removed += removeBySource(rules, sourcePath, AlertRule::getSourcePath);
        removed += removeBySource(blackouts, sourcePath, Blackout::getSourcePath);
        removed += removeBySource(onCalls, sourcePath, OnCall::getSourcePath);
        removed += removeBySource(groups, sourcePath, NotificationGroup::getSourcePath);
        removed += removeBySource(channels, sourcePath, NotificationChannel::getSourcePath);
        changed(removed > 0);
        return removed;
    }

    @Override
    public List<AlertRule> reactivateRules(Instant now) {
        List<AlertRule> reactivated = new ArrayList<>();
        for (AlertRule rule : rules.values()) {
            if (!rule.isActive() && rule.getReactivate() != null && !now.isBefore(rule.getReactivate())) {
                rule.setActive(true);
                rule.setReactivate(null);
                reactivated.add(rule);
            }
        }
        changed(!reactivated.isEmpty());
        return reactivated;
    }

    @Override
    public long version() {
        return version.get();
    }

    private boolean changed(boolean changed) {
        if (changed) {
            version.incrementAndGet();
        }
        return changed;
    }

    private static <T> int removeBySource(Map<String, T> map, String sourcePath,
                                          Function<T, String> source) {
        List<String> ids = map.entrySet().stream()
                .filter(entry -> Objects.equals(source.apply(entry.getValue()), sourcePath))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        ids.forEach(map::remove);
        return ids.size();
    }
}
