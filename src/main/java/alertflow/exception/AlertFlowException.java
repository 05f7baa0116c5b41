package alertflow.exception;

/**
 * 告警处理异常
 */
public class AlertFlowException extends RuntimeException {
    public AlertFlowException(String message) {
        super(message);
    }

    public AlertFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
