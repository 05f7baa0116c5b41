package alertflow.blackout;

import alertflow.alert.Alert;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 屏蔽判断: 告警命中某个生效中的屏蔽窗口时不发送通知。每次发送前重新判断,不缓存在告警上
 */
@Slf4j
public class SuppressionGate {

    public boolean suppressed(Alert alert, List<Blackout> blackouts, Instant now) {
        Optional<Blackout> blackout = findActive(alert, blackouts, now);
        blackout.ifPresent(b -> log.info("告警处于屏蔽窗口内: alert={}, blackout={}", alert.getId(), b.getId()));
        return blackout.isPresent();
    }

    public Optional<Blackout> findActive(Alert alert, List<Blackout> blackouts, Instant now) {
        if (blackouts == null) {
            return Optional.empty();
        }
        return blackouts.stream()
                .filter(blackout -> blackout.isInWindow(now))
                .filter(blackout -> covers(blackout, alert))
                .findFirst();
    }

    static boolean covers(Blackout blackout, Alert alert) {
        if (!Objects.equals(blackout.getEnvironment(), alert.getEnvironment())) {
            return false;
        }
        if (!matches(blackout.getResource(), alert.getResource())
                || !matches(blackout.getEvent(), alert.getEvent())
                || !matches(blackout.getGroup(), alert.getGroup())
                || !matches(blackout.getOrigin(), alert.getOrigin())
                || !matches(blackout.getCustomer(), alert.getCustomer())) {
            return false;
        }
        if (CollectionUtils.isNotEmpty(blackout.getService())
                && (alert.getService() == null || !alert.getService().containsAll(blackout.getService()))) {
            return false;
        }
        return CollectionUtils.isEmpty(blackout.getTags())
                || blackout.getTags().stream().anyMatch(tag -> tag.matches(alert.getTags()));
    }

    private static boolean matches(String expected, String actual) {
        return StringUtils.isEmpty(expected) || expected.equals(actual);
    }
}
