package ai.gently.stamp;

import static org.junit.jupiter.api.Assertions.*;

import ai.gently.model.Clan;
import ai.gently.model.ClanState;
import ai.gently.model.ClanStatus;
import ai.gently.model.Gate;
import ai.gently.model.GateMark;
import ai.gently.model.GateState;
import ai.gently.model.ProjectConfig;
import ai.gently.model.SchemaVersion;
import ai.gently.model.Window;
import ai.gently.project.ProjectStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class StampFormatterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T14:05:33.123Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private ProjectStore store;
    private StampFormatter formatter;
    private Clan clan;

    @BeforeEach
    void setUp() throws Exception {
        store = new ProjectStore(tempDir);
        var worktree = store.projectDir("demo").resolve("worktrees").resolve("clan-0-alpha");
        Files.createDirectories(worktree);
        clan = new Clan("clan-0-alpha", "Alpha", "clan/clan-0-alpha", worktree, ClanStatus.ACTIVE, null);
        store.create(new ProjectConfig(
                SchemaVersion.CURRENT,
                0,
                "demo",
                "Demo",
                "2026-10-19T00:00:00Z",
                Gate.template(),
                List.of(clan),
                List.of(Window.root("Demo", "main")),
                Window.ROOT_ID));
        formatter = new StampFormatter(store, new FixedHashBackend("a1b2c3d"), CLOCK);
    }

    @Test
    void testStampForClan() throws Exception {
        var state = ClanState.initial(clan.id(), clan.name())
                .withDepth(3)
                .withPin("cache first")
                .withGate(new GateMark("A", GateState.YES))
                .withGate(new GateMark("B", GateState.NO))
                .withGate(new GateMark("C", GateState.HALF))
                .withGate(new GateMark("D", GateState.OPEN));
        store.writeClanState(clan.worktree(), state);

        assertEquals(
                "[OLO|🌿clan/clan-0-alpha|📍3|🔒A●B✕C◐D○|📌cache-first|#a1b2c3d|⏱1019T1405]",
                formatter.generateStamp("demo", clan.id()));
    }

    @Test
    void testStampIsDeterministic() throws Exception {
        store.writeClanState(clan.worktree(), ClanState.initial(clan.id(), clan.name()));
        var first = formatter.generateStamp("demo", clan.id());
        assertEquals(first, formatter.generateStamp("demo", clan.id()));
        assertEquals("[OLO|🌿clan/clan-0-alpha|📍0|🔒|📌|#a1b2c3d|⏱1019T1405]", first);
    }

    @Test
    void testUnknownClan() throws Exception {
        assertEquals(StampFormatter.UNKNOWN_STAMP, formatter.generateStamp("demo", "clan-5-nobody"));
    }

    @Test
    void testPinNormalization() {
        assertEquals("a-b-c", StampFormatter.normalizePin("a b\tc"));
        assertEquals("twenty-characters-ex", StampFormatter.normalizePin("twenty characters exactly and more"));
        assertEquals(20, StampFormatter.normalizePin("x                          y").length());
        assertEquals("", StampFormatter.normalizePin(""));
    }

    @Test
    void testTimestampIsUtcMinuteResolution() {
        var stamp = StampFormatter.format(
                "main", 0, List.of(), "", "00000000", StampFormatter.TIMESTAMP.format(Instant.parse("2026-01-02T03:04:59Z")));
        assertTrue(stamp.endsWith("|#00000000|⏱0102T0304]"));
    }
}
