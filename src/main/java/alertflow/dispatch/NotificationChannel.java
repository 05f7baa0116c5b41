package alertflow.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * 通知渠道配置,type 决定使用哪个发送器
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationChannel {
    private String id;
    private String type;                    // webhook/dingding/log
    private String sender;
    private String url;
    private Map<String, String> headers = new HashMap<>();
    private String sourcePath;
}
