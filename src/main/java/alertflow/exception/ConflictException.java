package alertflow.exception;

/**
 * 并发冲突异常 - 同一告警标识被并发修改
 */
public class ConflictException extends AlertFlowException {
    public ConflictException(String message) {
        super(message);
    }
}
