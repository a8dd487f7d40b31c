package ai.gently.stamp;

import ai.gently.git.IGitBackend;
import ai.gently.model.GateMark;
import ai.gently.project.ProjectStore;
import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Produces the one-line orientation marker for a clan:
 *
 * <pre>[OLO|🌿branch|📍depth|🔒gates|📌pin|#hash|⏱MMddTHHmm]</pre>
 */
public class StampFormatter {
    private static final Logger logger = LogManager.getLogger(StampFormatter.class);

    public static final String UNKNOWN_STAMP = "[OLO|?]";
    static final int PIN_LENGTH = 20;
    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("MMdd'T'HHmm").withZone(ZoneOffset.UTC);

    private final ProjectStore store;
    private final IGitBackend git;
    private final Clock clock;

    public StampFormatter(ProjectStore store, IGitBackend git, Clock clock) {
        this.store = store;
        this.git = git;
        this.clock = clock;
    }

    /** @return the clan's stamp, or {@link #UNKNOWN_STAMP} if the project has no such clan */
    public String generateStamp(String projectId, String clanId) throws IOException {
        var clan = store.load(projectId).findClan(clanId).orElse(null);
        if (clan == null) {
            logger.debug("No clan {} in {}", clanId, projectId);
            return UNKNOWN_STAMP;
        }
        var state = store.readClanState(clan.worktree());
        var hash = git.resolveShortHash(clan.worktree());
        return format(clan.branch(), state.depth(), state.gates(), state.pin(), hash, TIMESTAMP.format(clock.instant()));
    }

    public static String format(
            String branch, int depth, List<GateMark> gates, String pin, String hash, String timestamp) {
        var gs = gates.stream().map(GateMark::glyphForm).collect(Collectors.joining());
        return "[OLO|🌿" + branch
                + "|📍" + depth
                + "|🔒" + gs
                + "|📌" + normalizePin(pin)
                + "|#" + hash
                + "|⏱" + timestamp
                + "]";
    }

    /** First {@value #PIN_LENGTH} characters, each whitespace character replaced with {@code -}. */
    static String normalizePin(String pin) {
        var truncated = pin.length() > PIN_LENGTH ? pin.substring(0, PIN_LENGTH) : pin;
        var sb = new StringBuilder(truncated.length());
        for (int i = 0; i < truncated.length(); i++) {
            char c = truncated.charAt(i);
            sb.append(Character.isWhitespace(c) || Character.isSpaceChar(c) ? '-' : c);
        }
        return sb.toString();
    }
}
