package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A checkpoint of accumulated constants. A window's constant list always begins with its parent's list, in the same
 * order. Windows are never modified after creation.
 */
public record Window(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("parentWindow") @Nullable String parentWindow,
        @JsonProperty("constants") List<Constant> constants,
        @JsonProperty("gitBranch") String gitBranch,
        @JsonProperty("gitCommitAtBirth") @Nullable String gitCommitAtBirth) {

    public static final String ROOT_ID = "win-root";

    public Window {
        constants = List.copyOf(Objects.requireNonNullElse(constants, List.of()));
    }

    public static Window root(String projectName, String branch) {
        return new Window(ROOT_ID, projectName, null, List.of(), branch, null);
    }
}
