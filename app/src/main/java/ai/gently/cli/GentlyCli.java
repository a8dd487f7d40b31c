package ai.gently.cli;

import ai.gently.GentlyService;
import ai.gently.git.GitBackend;
import ai.gently.model.Clan;
import ai.gently.model.GateState;
import ai.gently.project.GentlyConfig;
import ai.gently.project.ProjectStore;
import ai.gently.stamp.StatusRenderer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // picocli injects fields before call()
@CommandLine.Command(
        name = "gently",
        mixinStandardHelpOptions = true,
        description = "Branch an exploration into clans, collapse them into constants.",
        subcommands = {
            GentlyCli.Init.class,
            GentlyCli.AddClan.class,
            GentlyCli.Collapse.class,
            GentlyCli.Stamp.class,
            GentlyCli.Gate.class,
            GentlyCli.Pin.class,
            GentlyCli.Descend.class,
            GentlyCli.Status.class,
            GentlyCli.Windows.class,
            GentlyCli.Hash.class,
            GentlyCli.Log.class,
            GentlyCli.Config.class
        })
public final class GentlyCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(GentlyCli.class);

    @CommandLine.Option(
            names = "--projects-dir",
            description = "Directory holding all projects. Defaults to the configured one, else ~/projects.")
    @Nullable
    private Path projectsDir;

    @CommandLine.Option(
            names = {"-p", "--project"},
            description = "Project id. Defaults to the project containing the working directory.")
    @Nullable
    private String projectId;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        logger.info("Starting gently CLI...");
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /** Builds the command line with the error handling every entry point shares: domain errors exit with 1. */
    public static CommandLine commandLine() {
        var cmd = new CommandLine(new GentlyCli());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            logger.debug("Command failed", ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    GentlyService openService() {
        var dir = projectsDir != null ? projectsDir : new GentlyConfig().getProjectsDir();
        return new GentlyService(new ProjectStore(dir), new GitBackend(), Clock.systemUTC());
    }

    /** @return the project id from {@code --project} or the working directory, or null with a message printed */
    @Nullable
    String resolveProject(GentlyService service) throws IOException {
        if (projectId != null) {
            return projectId;
        }
        var found = service.findProjectId(Path.of("").toAbsolutePath());
        if (found == null) {
            spec.commandLine().getErr().println("Not in a gently project.");
        }
        return found;
    }

    /** Base for subcommands that operate on an existing project. */
    abstract static class ProjectCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        GentlyCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            try (var service = parent.openService()) {
                var id = parent.resolveProject(service);
                if (id == null) {
                    return 1;
                }
                return run(service, id);
            }
        }

        abstract int run(GentlyService service, String projectId) throws Exception;

        void out(String line) {
            spec.commandLine().getOut().println(line);
        }

        void err(String line) {
            spec.commandLine().getErr().println(line);
        }

        Clan requireClan(GentlyService service, String projectId, @Nullable String ref) throws IOException {
            return service.resolveClan(projectId, ref)
                    .orElseThrow(() -> new IllegalArgumentException(
                            ref == null ? "No active clan found." : "No clan matching '" + ref + "'."));
        }
    }

    @CommandLine.Command(name = "init", description = "Create a project.")
    static final class Init implements Callable<Integer> {
        @CommandLine.ParentCommand
        GentlyCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Project name.")
        String name;

        @Override
        public Integer call() throws Exception {
            try (var service = parent.openService()) {
                var config = service.createProject(name);
                var dir = service.getStore().projectDir(config.id());
                var out = spec.commandLine().getOut();
                out.println("✓ Project created: " + config.name());
                out.println("  id: " + config.id());
                out.println("  path: " + dir);
                out.println("  hash: " + service.getHash(dir));
                return 0;
            }
        }
    }

    @CommandLine.Command(name = "clan", description = "Start a clan in its own worktree.")
    static final class AddClan extends ProjectCommand {
        @CommandLine.Parameters(index = "0", description = "Clan name.")
        String name;

        @CommandLine.Parameters(index = "1", arity = "0..1", description = "Context written to context.md.")
        String context = "";

        @Override
        int run(GentlyService service, String projectId) throws Exception {
            var clan = service.addClan(projectId, name, context);
            out("✓ Clan created: " + clan.name());
            out("  id: " + clan.id());
            out("  branch: " + clan.branch());
            out("  worktree: " + clan.worktree());
            out("  hash: " + service.getHash(clan.worktree()));
            return 0;
        }
    }

    @CommandLine.Command(name = "collapse", description = "Freeze clans into constants of a new window.")
    static final class Collapse extends ProjectCommand {
        @CommandLine.Parameters(arity = "1..*", description = "Clan ids or name fragments.")
        List<String> clanRefs = new ArrayList<>();

        @CommandLine.Option(names = "--name", required = true, description = "Name of the new window.")
        String windowName;

        @Override
        int run(GentlyService service, String projectId) throws Exception {
            var ids = new ArrayList<String>();
            for (var ref : clanRefs) {
                ids.add(service.resolveClan(projectId, ref).map(Clan::id).orElse(ref));
            }
            var result = service.collapse(projectId, ids, windowName);
            if (result == null) {
                err("Need at least 2 active clans to collapse.");
                return 1;
            }
            out(result.synthesisPrompt());
            return 0;
        }
    }

    @CommandLine.Command(name = "stamp", description = "Print the stamp of a clan.")
    static final class Stamp extends ProjectCommand {
        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Clan id or name fragment.")
        @Nullable
        String clanRef;

        @Override
        int run(GentlyService service, String projectId) throws Exception {
            var clan = requireClan(service, projectId, clanRef);
            out(service.getStamp(projectId, clan.id()));
            return 0;
        }
    }

    @CommandLine.Command(name = "gate", description = "Show or set project gates, or a clan's gate checklist.")
    static final class Gate extends ProjectCommand {
        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Gate letter.")
        @Nullable
        String letter;

        @CommandLine.Parameters(index = "1", arity = "0..1", description = "open, yes, no or half.")
        @Nullable
        String state;

        @CommandLine.Option(names = "--clan", description = "Set the gate on this clan instead of the project.")
        @Nullable
        String clanRef;

        @CommandLine.Option(names = "--question", description = "Question of a project gate.")
        @Nullable
        String question;

        @Override
        int run(GentlyService service, String projectId) throws Exception {
            var config = service.load(projectId);
            if (letter == null) {
                out(StatusRenderer.renderGates(config.gates()));
                return 0;
            }
            if (state == null) {
                var wanted = letter.toUpperCase(Locale.ROOT);
                var gate = config.gates().stream().filter(g -> g.letter().equals(wanted)).findFirst();
                if (gate.isEmpty()) {
                    err("Gate " + letter + " not found.");
                    return 1;
                }
                out(StatusRenderer.renderGates(List.of(gate.get())));
                return 0;
            }

            GateState parsed;
            try {
                parsed = GateState.parse(state);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
            }
            if (clanRef != null) {
                var clan = requireClan(service, projectId, clanRef);
                var updated = service.setClanGate(projectId, clan.id(), letter, parsed);
                out(clan.name() + ": " + String.join(
                        " ", updated.gates().stream().map(g -> g.glyphForm()).toList()));
            } else {
                var updated = service.setProjectGate(projectId, letter, parsed, question);
                var wanted = letter.toUpperCase(Locale.ROOT);
                out(StatusRenderer.renderGates(updated.gates().stream()
                        .filter(g -> g.letter().equals(wanted))
                        .toList()));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "pin", description = "Set a clan's pin.")
    static final class Pin extends ProjectCommand {
        @CommandLine.Parameters(index = "0", description = "Clan id or name fragment.")
        String clanRef;

        @CommandLine.Parameters(index = "1..*", arity = "1..*", description = "Pin text.")
        List<String> text = new ArrayList<>();

        @Override
        int run(GentlyService service, String projectId) throws Exception {
            var clan = requireClan(service, projectId, clanRef);
            var state = service.setPin(projectId, clan.id(), String.join(" ", text));
            out("📌 " + clan.name() + ": " + state.pin());
            return 0;
        }
    }

    @CommandLine.Command(name = "descend", description = "Move a clan one level deeper.")
    static final class Descend extends ProjectCommand {
        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Clan id or name fragment.")
        @Nullable
        String clanRef;

        @Override
        int run(GentlyService service, String projectId) throws Exception {
            var clan = requireClan(service, projectId, clanRef);
            var state = service.descend(projectId, clan.id());
            out("📍 " + clan.name() + ": depth " + state.depth());
            return 0;
        }
    }

    @CommandLine.Command(name = "status", description = "Show the project tree.")
    static final class Status extends ProjectCommand {
        @Override
        int run(GentlyService service, String projectId) throws Exception {
            out(service.status(projectId));
            return 0;
        }
    }

    @CommandLine.Command(name = "windows", description = "List windows and their constants.")
    static final class Windows extends ProjectCommand {
        @Override
        int run(GentlyService service, String projectId) throws Exception {
            out(service.windows(projectId));
            return 0;
        }
    }

    @CommandLine.Command(name = "log", description = "Show recent commits across all clan and window branches.")
    static final class Log extends ProjectCommand {
        @CommandLine.Option(names = {"-n", "--max-count"}, description = "Number of commits, default 20.")
        int maxCount = 20;

        @Override
        int run(GentlyService service, String projectId) throws Exception {
            service.log(projectId, maxCount).forEach(this::out);
            return 0;
        }
    }

    @CommandLine.Command(name = "hash", description = "Print the short commit hash of a directory.")
    static final class Hash implements Callable<Integer> {
        @CommandLine.ParentCommand
        GentlyCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Directory, default the working one.")
        @Nullable
        Path dir;

        @Override
        public Integer call() {
            try (var service = parent.openService()) {
                var target = dir != null ? dir : Path.of("").toAbsolutePath();
                spec.commandLine().getOut().println(service.getHash(target));
                return 0;
            }
        }
    }

    @CommandLine.Command(name = "config", description = "Show or set the default projects directory.")
    static final class Config implements Callable<Integer> {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = "--set-projects-dir", description = "Store a new default projects directory.")
        @Nullable
        Path newProjectsDir;

        @Override
        public Integer call() throws IOException {
            var config = new GentlyConfig();
            if (newProjectsDir != null) {
                config.setProjectsDir(newProjectsDir);
            }
            spec.commandLine().getOut().println("projects.dir: " + config.getProjectsDir());
            return 0;
        }
    }
}
