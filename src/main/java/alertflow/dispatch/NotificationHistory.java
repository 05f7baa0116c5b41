package alertflow.dispatch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 通知发送记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationHistory {
    private String id;
    private boolean sent;
    private DispatchState state;
    private String message;
    private String channel;
    private String rule;
    private String alert;
    private String transitionId;
    private List<String> receivers;         // kind:id
    private String sender;
    private Instant sentTime;
    private String error;
    private int attempts;
}
