package ai.gently.clan;

/** Thrown when something tries to change a clan that has been frozen into a constant. */
public class FrozenClanException extends IllegalStateException {
    public FrozenClanException(String clanId) {
        super("Clan " + clanId + " is frozen; its worktree is a permanent constant");
    }
}
