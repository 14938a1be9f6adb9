package fr.lapetina.taskflow.domain.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How bad an error is from the user's point of view.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
