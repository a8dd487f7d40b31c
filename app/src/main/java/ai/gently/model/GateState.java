package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** State of a decision gate. Serialized in lowercase. */
public enum GateState {
    OPEN("○"),
    YES("●"),
    NO("✕"),
    HALF("◐");

    private final String glyph;

    GateState(String glyph) {
        this.glyph = glyph;
    }

    /** Single-character symbol used in stamps and status output. */
    public String glyph() {
        return glyph;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient reader for persisted documents: anything unrecognized reads as {@link #OPEN}. */
    @JsonCreator
    public static GateState fromWire(@Nullable String value) {
        if (value == null) {
            return OPEN;
        }
        for (var s : values()) {
            if (s.wireName().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        return OPEN;
    }

    /** Strict parser for user input. */
    public static GateState parse(String value) {
        for (var s : values()) {
            if (s.wireName().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Invalid gate state '" + value + "'. Valid: "
                + Arrays.stream(values()).map(GateState::wireName).collect(Collectors.joining(", ")));
    }
}
