package alertflow.oncall;

import lombok.Data;

/**
 * 通知接收方: 渠道地址、用户或分组
 */
@Data
public class Recipient {
    private final Kind kind;
    private final String id;

    public enum Kind {
        RECEIVER,
        USER,
        GROUP
    }

    public static Recipient receiver(String address) {
        return new Recipient(Kind.RECEIVER, address);
    }

    public static Recipient user(String userId) {
        return new Recipient(Kind.USER, userId);
    }

    public static Recipient group(String groupId) {
        return new Recipient(Kind.GROUP, groupId);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + id;
    }
}
