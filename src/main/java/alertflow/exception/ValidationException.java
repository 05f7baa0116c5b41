package alertflow.exception;

/**
 * 校验异常 - 告警上报或规则配置不合法
 */
public class ValidationException extends AlertFlowException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
