package alertflow.alert;

import lombok.Data;

@Data
public class IngestResult {
    private final Alert alert;
    private final Transition transition;
}
