package alertflow.dispatch;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.time.Duration;

public class LocalDispatchDedupCache implements DispatchDedupCache {
    private final Cache<String, Boolean> cache;

    public LocalDispatchDedupCache(Duration ttl) {
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(100000)
                .build();
    }

    @Override
    public boolean markIfAbsent(String alertId, String ruleId, String transitionId) {
        return cache.asMap().putIfAbsent(key(alertId, ruleId, transitionId), Boolean.TRUE) == null;
    }

    @Override
    public boolean exists(String alertId, String ruleId, String transitionId) {
        return cache.getIfPresent(key(alertId, ruleId, transitionId)) != null;
    }

    @Override
    public void cleanup() {
        cache.cleanUp();
    }

    private static String key(String alertId, String ruleId, String transitionId) {
        return alertId + "|" + ruleId + "|" + transitionId;
    }
}
