package alertflow;

import alertflow.dispatch.ChannelSender;
import alertflow.dispatch.DispatchIntent;
import alertflow.dispatch.NotificationChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录发送内容的 log 类型渠道
 */
public class RecordingChannelSender implements ChannelSender {
    private final List<DispatchIntent> sent = new CopyOnWriteArrayList<>();

    @Override
    public String getType() {
        return "log";
    }

    @Override
    public void send(NotificationChannel channel, DispatchIntent intent) {
        sent.add(intent);
    }

    public List<DispatchIntent> getSent() {
        return sent;
    }
}
