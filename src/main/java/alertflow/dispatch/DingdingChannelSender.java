package alertflow.dispatch;

import alertflow.oncall.Recipient;
import com.dingtalk.api.DefaultDingTalkClient;
import com.dingtalk.api.DingTalkClient;
import com.dingtalk.api.request.OapiRobotSendRequest;
import com.dingtalk.api.response.OapiRobotSendResponse;
import com.taobao.api.ApiException;
import org.apache.commons.collections4.CollectionUtils;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 钉钉机器人渠道,发送 markdown 消息。
 * 只有固定接收人(手机号)会被 @,值班用户和分组以名称列出
 */
public class DingdingChannelSender implements ChannelSender {
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final Clock clock;
    private final ZoneId zone;

    public DingdingChannelSender(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public String getType() {
        return "dingding";
    }

    @Override
    public void send(NotificationChannel channel, DispatchIntent intent) throws IOException {
        DingTalkClient client = new DefaultDingTalkClient(channel.getUrl());
        OapiRobotSendRequest request = new OapiRobotSendRequest();
        request.setMsgtype("markdown");

        List<String> mobiles = mobiles(intent);
        OapiRobotSendRequest.Markdown markdown = new OapiRobotSendRequest.Markdown();
        markdown.setTitle("【告警】" + intent.getAlertId());
        markdown.setText(markdownText(intent, mobiles));
        request.setMarkdown(markdown);

        OapiRobotSendRequest.At at = new OapiRobotSendRequest.At();
        at.setAtMobiles(mobiles);
        at.setIsAtAll(false);
        request.setAt(at);

        OapiRobotSendResponse response;
        try {
            response = client.execute(request);
        } catch (ApiException e) {
            throw new IOException("钉钉发送失败: " + e.getMessage(), e);
        }
        if (response == null || !response.isSuccess()) {
            throw new IOException("钉钉发送失败: "
                    + (response == null ? "无响应" : response.getErrcode() + " " + response.getErrmsg()));
        }
    }

    static List<String> mobiles(DispatchIntent intent) {
        return CollectionUtils.emptyIfNull(intent.getRecipients()).stream()
                .filter(recipient -> recipient.getKind() == Recipient.Kind.RECEIVER)
                .map(Recipient::getId)
                .collect(Collectors.toList());
    }

    String markdownText(DispatchIntent intent, List<String> mobiles) {
        StringBuilder recipientsStr = new StringBuilder();
        for (String mobile : mobiles) {
            recipientsStr.append("@").append(mobile).append(" ");
        }
        for (Recipient recipient : CollectionUtils.emptyIfNull(intent.getRecipients())) {
            if (recipient.getKind() != Recipient.Kind.RECEIVER) {
                recipientsStr.append(recipient.getId()).append(" ");
            }
        }
        String time = TIME_FORMAT.format(clock.instant().atZone(zone));

        return "# 🚨 告警通知\n" +
                "\n\n" +
                "**时间**: " + time + "  \n" +
                "\n" +
                "**描述**: " + intent.getMessage() + "\n" +
                "\n" +
                "**负责人**: " + recipientsStr +
                "\n\n" +
                "---\n";
    }
}
