package ai.gently.model;

import java.util.List;

/**
 * Outcome of a collapse.
 *
 * @param constants the new window's full constant list: the parent window's constants followed by the new ones
 */
public record CollapseResult(String windowId, List<Constant> constants, String synthesisPrompt, String mergeHash) {
    public CollapseResult {
        constants = List.copyOf(constants);
    }
}
