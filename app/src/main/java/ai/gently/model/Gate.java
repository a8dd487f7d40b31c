package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** A project-level decision gate. */
public record Gate(
        @JsonProperty("letter") String letter,
        @JsonProperty("question") String question,
        @JsonProperty("state") GateState state) {

    public static final List<String> LETTERS = List.of("A", "B", "C", "D", "E");

    public Gate {
        question = Objects.requireNonNullElse(question, "");
        state = Objects.requireNonNullElse(state, GateState.OPEN);
    }

    /** The fixed five-gate template, all open. */
    public static List<Gate> template() {
        return LETTERS.stream().map(l -> new Gate(l, "", GateState.OPEN)).toList();
    }

    public Gate withState(GateState newState) {
        return new Gate(letter, question, newState);
    }

    public Gate withQuestion(@Nullable String newQuestion) {
        return new Gate(letter, newQuestion == null ? question : newQuestion, state);
    }
}
