package ai.gently.stamp;

import ai.gently.git.IGitBackend;
import ai.gently.model.Clan;
import ai.gently.model.ClanState;
import ai.gently.model.Gate;
import ai.gently.project.ProjectStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Text views of a project for terminal output. */
public class StatusRenderer {
    private static final Logger logger = LogManager.getLogger(StatusRenderer.class);

    private final ProjectStore store;
    private final IGitBackend git;

    public StatusRenderer(ProjectStore store, IGitBackend git) {
        this.store = store;
        this.git = git;
    }

    /** Project tree: gates, active and frozen clans, windows with the active one marked. */
    public String renderStatus(String projectId) throws IOException {
        var config = store.load(projectId);
        var lines = new ArrayList<String>();
        lines.add("◆ " + config.name());
        lines.add("│ git: " + git.resolveShortHash(store.projectDir(projectId)));
        lines.add("│ gates: " + config.gates().stream()
                .map(g -> g.letter() + g.state().glyph())
                .collect(Collectors.joining(" ")));
        lines.add("│");

        var active = config.clans().stream().filter(Clan::isActive).toList();
        var frozen = config.clans().stream().filter(c -> !c.isActive()).toList();
        if (!active.isEmpty()) {
            lines.add("│ ACTIVE CLANS:");
            for (var clan : active) {
                var state = readStateOrInitial(clan);
                lines.add("│   ◆ " + clan.name() + " [d=" + state.depth() + "] \"" + state.pin() + "\" #"
                        + git.resolveShortHash(clan.worktree()));
            }
        }
        if (!frozen.isEmpty()) {
            lines.add("│ FROZEN:");
            for (var clan : frozen) {
                lines.add("│   ❄ " + clan.name());
            }
        }

        lines.add("│");
        lines.add("│ WINDOWS: " + config.windows().size());
        for (var w : config.windows()) {
            var marker = w.id().equals(config.activeWindow()) ? "◆" : "○";
            lines.add("│   " + marker + " " + w.name() + " [" + w.constants().size() + " constants] " + w.gitBranch());
        }
        return String.join("\n", lines);
    }

    /** Every window with its branch and the constants it carries. */
    public String renderWindows(String projectId) throws IOException {
        var config = store.load(projectId);
        var lines = new ArrayList<String>();
        for (var w : config.windows()) {
            var marker = w.id().equals(config.activeWindow()) ? "◆" : "○";
            lines.add(marker + " " + w.name());
            lines.add("  branch: " + w.gitBranch() + " | constants: " + w.constants().size());
            for (var c : w.constants()) {
                lines.add("    ▒ " + c.sourceName() + ": \"" + c.summary() + "\"");
            }
        }
        return String.join("\n", lines);
    }

    /** Lists the project gates with their questions. */
    public static String renderGates(List<Gate> gates) {
        return gates.stream()
                .map(g -> "  " + g.letter() + g.state().glyph() + "  "
                        + (g.question().isEmpty() ? "(no question)" : g.question()))
                .collect(Collectors.joining("\n"));
    }

    private ClanState readStateOrInitial(Clan clan) {
        try {
            return store.readClanState(clan.worktree());
        } catch (IOException e) {
            logger.warn("Cannot read state of clan {} at {}: {}", clan.id(), clan.worktree(), e.getMessage());
            return ClanState.initial(clan.id(), clan.name());
        }
    }
}
