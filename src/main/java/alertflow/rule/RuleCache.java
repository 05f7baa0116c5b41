package alertflow.rule;

import alertflow.store.ConfigStore;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 规则缓存,按 (kind, environment, 配置版本号) 缓存;版本号变化后旧条目整体失效,
 * 版本号变化前开始的加载只会写入旧版本的条目
 */
@Slf4j
public class RuleCache {
    private final ConfigStore configStore;
    private final Cache<String, List<AlertRule>> cache;
    private volatile long cachedVersion = -1;

    public RuleCache(ConfigStore configStore) {
        this.configStore = configStore;
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(1000)
                .build();
    }

    public List<NotificationRule> getNotificationRules(String environment) {
        return get(RuleKind.NOTIFICATION, environment).stream()
                .map(NotificationRule.class::cast)
                .collect(ImmutableList.toImmutableList());
    }

    public List<EscalationRule> getEscalationRules(String environment) {
        return get(RuleKind.ESCALATION, environment).stream()
                .map(EscalationRule.class::cast)
                .collect(ImmutableList.toImmutableList());
    }

    private List<AlertRule> get(RuleKind kind, String environment) {
        long version = configStore.version();
        if (version > cachedVersion) {
            synchronized (this) {
                if (version > cachedVersion) {
                    log.debug("配置版本变化 {} -> {},清空规则缓存", cachedVersion, version);
                    cache.invalidateAll();
                    cachedVersion = version;
                }
            }
        }
        try {
            return cache.get(kind + "|" + environment + "|" + version,
                    () -> ImmutableList.copyOf(configStore.listRules(kind, environment)));
        } catch (ExecutionException e) {
            throw new IllegalStateException("加载规则失败: " + kind + "/" + environment, e.getCause());
        }
    }
}
