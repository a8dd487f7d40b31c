package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** One entry of a clan's gate checklist, also carried in constant snapshots. */
public record GateMark(@JsonProperty("letter") String letter, @JsonProperty("state") GateState state) {
    public GateMark {
        Objects.requireNonNull(letter, "letter");
        state = Objects.requireNonNullElse(state, GateState.OPEN);
    }

    /** Compact form used in stamps: the letter followed by the state glyph. */
    public String glyphForm() {
        return letter + state.glyph();
    }

    /** Form used in synthesis prompts: the letter followed by the state name. */
    public String wireForm() {
        return letter + state.wireName();
    }
}
