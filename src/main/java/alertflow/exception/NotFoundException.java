package alertflow.exception;

public class NotFoundException extends AlertFlowException {
    public NotFoundException(String message) {
        super(message);
    }
}
