package alertflow.oncall;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RepeatType {
    NONE("none"),
    LIST("list");

    private final String value;

    RepeatType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RepeatType fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
