package alertflow.alert;

import lombok.Data;

/**
 * 标识解析结果: 新告警,或需要修改的已有告警(精确匹配或通过关联事件)
 */
@Data
public class KeyResolution {
    private final Alert existing;
    private final boolean correlated;

    public static KeyResolution newAlert() {
        return new KeyResolution(null, false);
    }

    public static KeyResolution exact(Alert existing) {
        return new KeyResolution(existing, false);
    }

    public static KeyResolution correlated(Alert existing) {
        return new KeyResolution(existing, true);
    }

    public boolean isNew() {
        return existing == null;
    }
}
