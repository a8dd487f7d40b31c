package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Contents of a clan's {@code state.json}: the working state that lives inside its worktree. */
public record ClanState(
        @JsonProperty("schemaVersion") int schemaVersion,
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("depth") int depth,
        @JsonProperty("pin") String pin,
        @JsonProperty("state") ClanStatus state,
        @JsonProperty("gates") List<GateMark> gates) {

    public static final String FILE_NAME = "state.json";

    public ClanState {
        schemaVersion = schemaVersion == 0 ? SchemaVersion.CURRENT : schemaVersion;
        pin = Objects.requireNonNullElse(pin, "");
        state = Objects.requireNonNullElse(state, ClanStatus.ACTIVE);
        gates = List.copyOf(Objects.requireNonNullElse(gates, List.of()));
    }

    public static ClanState initial(String id, String name) {
        return new ClanState(SchemaVersion.CURRENT, id, name, 0, "", ClanStatus.ACTIVE, List.of());
    }

    @JsonIgnore
    public boolean isFrozen() {
        return state == ClanStatus.FROZEN;
    }

    public ClanState withPin(String newPin) {
        return new ClanState(schemaVersion, id, name, depth, newPin, state, gates);
    }

    public ClanState withDepth(int newDepth) {
        return new ClanState(schemaVersion, id, name, newDepth, pin, state, gates);
    }

    public ClanState withState(ClanStatus newState) {
        return new ClanState(schemaVersion, id, name, depth, pin, newState, gates);
    }

    /** Adds or replaces the checklist entry for {@code mark.letter()}, keeping entries ordered by letter. */
    public ClanState withGate(GateMark mark) {
        var updated = new ArrayList<GateMark>();
        for (var g : gates) {
            if (!g.letter().equals(mark.letter())) {
                updated.add(g);
            }
        }
        updated.add(mark);
        updated.sort(Comparator.comparing(GateMark::letter));
        return new ClanState(schemaVersion, id, name, depth, pin, state, updated);
    }
}
