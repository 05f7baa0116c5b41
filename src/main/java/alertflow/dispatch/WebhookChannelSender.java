package alertflow.dispatch;

import alertflow.oncall.Recipient;
import alertflow.utils.HttpUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Webhook 渠道: 以 JSON POST 推送通知
 */
@Slf4j
public class WebhookChannelSender implements ChannelSender {
    private final Clock clock;

    public WebhookChannelSender(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getType() {
        return "webhook";
    }

    @Override
    public void send(NotificationChannel channel, DispatchIntent intent) throws IOException {
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", "AlertFlow/1.0");
        if (channel.getHeaders() != null) {
            headers.putAll(channel.getHeaders());
        }

        String response = HttpUtils.postJson(channel.getUrl(), headers, buildPayload(channel, intent));
        log.info("Webhook响应: channel={}, body={}", channel.getId(), response);
    }

    private Map<String, Object> buildPayload(NotificationChannel channel, DispatchIntent intent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert_id", intent.getAlertId());
        payload.put("rule_id", intent.getRuleId());
        payload.put("transition_id", intent.getTransitionId());
        payload.put("transition", intent.getTransitionType() == null ? null : intent.getTransitionType().name());
        payload.put("timestamp", clock.instant().toString());
        payload.put("sender", channel.getSender());
        payload.put("text", intent.getMessage());
        payload.put("recipients", recipients(intent.getRecipients()));
        return payload;
    }

    private static List<Map<String, String>> recipients(List<Recipient> recipients) {
        return recipients.stream()
                .map(recipient -> {
                    Map<String, String> item = new LinkedHashMap<>();
                    item.put("type", recipient.getKind().name().toLowerCase());
                    item.put("id", recipient.getId());
                    return item;
                })
                .collect(Collectors.toList());
    }
}
