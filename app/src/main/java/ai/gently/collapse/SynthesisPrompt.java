package ai.gently.collapse;

import ai.gently.model.Constant;
import ai.gently.model.GateMark;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Renders the text handed to downstream consumers when a new window is born. */
public final class SynthesisPrompt {
    public static final String BANNER = "=== BUILD ON THESE CONSTANTS ===";

    private SynthesisPrompt() {}

    public static String build(String windowName, List<Constant> constants, String branch, String hash) {
        var lines = new ArrayList<String>();
        lines.add("=== GENTLY WINDOW: " + windowName + " ===");
        lines.add("Git: " + branch + " @ " + hash);
        lines.add("Constants (immutable, " + constants.size() + " total):");
        lines.add("");
        for (var c : constants) {
            lines.add("  [" + c.gitTag() + "] " + c.sourceName());
            lines.add("    \"" + c.summary() + "\"");
            if (!c.gateSnapshot().isEmpty()) {
                var gates = c.gateSnapshot().stream().map(GateMark::wireForm).collect(Collectors.joining(" "));
                lines.add("    gates: " + gates + " | depth: " + c.depth());
            }
            lines.add("");
        }
        lines.add(BANNER);
        return String.join("\n", lines);
    }
}
