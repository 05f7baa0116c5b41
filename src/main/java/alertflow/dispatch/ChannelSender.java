package alertflow.dispatch;

import java.io.IOException;

/**
 * 通知渠道发送器,一个实现对应一种渠道类型
 */
public interface ChannelSender {

    /**
     * 渠道类型,与 NotificationChannel.type 对应
     */
    String getType();

    /**
     * 发送通知,失败时抛出异常,由调用方记录并重试
     */
    void send(NotificationChannel channel, DispatchIntent intent) throws IOException;
}
