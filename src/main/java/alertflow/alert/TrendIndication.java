package alertflow.alert;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendIndication {
    MORE_SEVERE("moreSevere"),
    LESS_SEVERE("lessSevere"),
    NO_CHANGE("noChange");

    private final String value;

    TrendIndication(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
