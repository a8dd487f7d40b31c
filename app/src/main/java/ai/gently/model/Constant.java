package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/** Immutable snapshot of one frozen clan, addressable through its git tag. */
public record Constant(
        @JsonProperty("schemaVersion") int schemaVersion,
        @JsonProperty("id") String id,
        @JsonProperty("sourceName") String sourceName,
        @JsonProperty("summary") String summary,
        @JsonProperty("gateSnapshot") List<GateMark> gateSnapshot,
        @JsonProperty("gitTag") String gitTag,
        @JsonProperty("gitCommit") String gitCommit,
        @JsonProperty("depth") int depth) {

    public Constant {
        schemaVersion = schemaVersion == 0 ? SchemaVersion.CURRENT : schemaVersion;
        summary = Objects.requireNonNullElse(summary, "");
        gateSnapshot = List.copyOf(Objects.requireNonNullElse(gateSnapshot, List.of()));
    }

    public static String idFor(String clanId) {
        return "const-" + clanId;
    }

    public static String tagFor(String clanId) {
        return "const/" + clanId;
    }

    /** Builds the constant for a clan from the state it was frozen with. */
    public static Constant freeze(Clan clan, ClanState state, String commit) {
        return new Constant(
                SchemaVersion.CURRENT,
                idFor(clan.id()),
                clan.name(),
                state.pin(),
                state.gates(),
                tagFor(clan.id()),
                commit,
                state.depth());
    }
}
