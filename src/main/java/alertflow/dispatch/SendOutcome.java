package alertflow.dispatch;

import lombok.Data;

@Data
public class SendOutcome {
    private final boolean success;
    private final String error;
    private final int attempts;

    public static SendOutcome success(int attempts) {
        return new SendOutcome(true, null, attempts);
    }

    public static SendOutcome failure(String error, int attempts) {
        return new SendOutcome(false, error, attempts);
    }
}
