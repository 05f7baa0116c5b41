package alertflow.dispatch;

import lombok.extern.slf4j.Slf4j;

/**
 * 只写日志的渠道,用于演练
 */
@Slf4j
public class LogChannelSender implements ChannelSender {

    @Override
    public String getType() {
        return "log";
    }

    @Override
    public void send(NotificationChannel channel, DispatchIntent intent) {
        log.info("[{}] alert={}, rule={}, recipients={}, message={}",
                channel.getId(), intent.getAlertId(), intent.getRuleId(), intent.getRecipients(), intent.getMessage());
    }
}
