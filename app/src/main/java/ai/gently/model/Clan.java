package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import java.util.Objects;

/** Project-facing metadata for a clan. Its mutable working state lives in the worktree, see {@link ClanState}. */
public record Clan(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("branch") String branch,
        @JsonProperty("worktree") Path worktree,
        @JsonProperty("state") ClanStatus state,
        @JsonProperty("desktopChatId") String desktopChatId) {

    public Clan {
        state = Objects.requireNonNullElse(state, ClanStatus.ACTIVE);
        desktopChatId = Objects.requireNonNullElse(desktopChatId, "chat-" + id);
    }

    public static String branchFor(String clanId) {
        return "clan/" + clanId;
    }

    @JsonIgnore
    public boolean isActive() {
        return state == ClanStatus.ACTIVE;
    }

    public Clan frozen() {
        return new Clan(id, name, branch, worktree, ClanStatus.FROZEN, desktopChatId);
    }
}
