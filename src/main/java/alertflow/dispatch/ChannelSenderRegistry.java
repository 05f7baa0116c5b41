package alertflow.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 渠道类型 -> 发送器
 */
@Slf4j
public class ChannelSenderRegistry {
    private final Map<String, ChannelSender> senders = new ConcurrentHashMap<>();

    public ChannelSenderRegistry(List<ChannelSender> senders) {
        senders.forEach(this::register);
    }

    public void register(ChannelSender sender) {
        senders.put(sender.getType().toLowerCase(), sender);
        log.info("注册通知渠道类型: {}", sender.getType());
    }

    public Optional<ChannelSender> get(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(senders.get(type.toLowerCase()));
    }
}
