package im.arun.tlfextract.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TlfKind {
    TABLE("table"),
    FIGURE("figure");

    private final String label;

    TlfKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
