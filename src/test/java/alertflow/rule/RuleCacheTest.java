package alertflow.rule;

import alertflow.store.ConfigStore;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RuleCacheTest {

    @Test
    void shouldReloadWhenStoreVersionChanges() {
        ConfigStore configStore = mock(ConfigStore.class);
        NotificationRule rule = RuleMatcherTest.rule("r1");
        given(configStore.version()).willReturn(1L, 1L, 2L);
        given(configStore.listRules(RuleKind.NOTIFICATION, "Production"))
                .willReturn(Collections.emptyList(), Collections.singletonList(rule));

        RuleCache cache = new RuleCache(configStore);

        assertThat(cache.getNotificationRules("Production"), empty());
        assertThat(cache.getNotificationRules("Production"), empty());
        List<NotificationRule> reloaded = cache.getNotificationRules("Production");

        assertThat(reloaded, contains(rule));
        verify(configStore, times(2)).listRules(RuleKind.NOTIFICATION, "Production");
    }

    @Test
    void shouldNotServeListLoadedBeforeVersionMoved() {
        ConfigStore configStore = mock(ConfigStore.class);
        NotificationRule stale = RuleMatcherTest.rule("stale");
        NotificationRule fresh = RuleMatcherTest.rule("fresh");
        AtomicLong version = new AtomicLong(1);
        AtomicReference<RuleCache> cacheRef = new AtomicReference<>();
        AtomicBoolean first = new AtomicBoolean(true);
        given(configStore.version()).willAnswer(invocation -> version.get());
        given(configStore.listRules(RuleKind.NOTIFICATION, "Production")).willAnswer(invocation -> {
            if (first.getAndSet(false)) {
                // 加载过程中配置被修改,另一个读取方看到了新版本
                version.set(2);
                assertThat(cacheRef.get().getNotificationRules("Production"), contains(fresh));
                return Collections.singletonList(stale);
            }
            return Collections.singletonList(fresh);
        });

        RuleCache cache = new RuleCache(configStore);
        cacheRef.set(cache);

        assertThat(cache.getNotificationRules("Production"), contains(stale));
        assertThat(cache.getNotificationRules("Production"), contains(fresh));
        verify(configStore, times(2)).listRules(RuleKind.NOTIFICATION, "Production");
    }

    @Test
    void shouldCacheByKindAndEnvironment() {
        ConfigStore configStore = mock(ConfigStore.class);
        EscalationRule escalation = new EscalationRule();
        escalation.setId("e1");
        given(configStore.version()).willReturn(1L);
        given(configStore.listRules(RuleKind.ESCALATION, "Production")).willReturn(Collections.singletonList(escalation));
        given(configStore.listRules(RuleKind.NOTIFICATION, "Production")).willReturn(Collections.emptyList());

        RuleCache cache = new RuleCache(configStore);

        assertThat(cache.getEscalationRules("Production"), contains(escalation));
        assertThat(cache.getNotificationRules("Production"), empty());
        cache.getEscalationRules("Production");
        verify(configStore, times(1)).listRules(RuleKind.ESCALATION, "Production");
    }
}
