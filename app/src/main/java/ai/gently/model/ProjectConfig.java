package ai.gently.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Contents of a project's {@code gently.json}. Every mutation produces a new instance and rewrites the whole document.
 *
 * <p>{@code version} counts successful saves and is checked on write so a stale copy cannot overwrite newer changes.
 */
public record ProjectConfig(
        @JsonProperty("schemaVersion") int schemaVersion,
        @JsonProperty("version") long version,
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("created") String created,
        @JsonProperty("gates") List<Gate> gates,
        @JsonProperty("clans") List<Clan> clans,
        @JsonProperty("windows") List<Window> windows,
        @JsonProperty("activeWindow") String activeWindow) {

    public static final String FILE_NAME = "gently.json";

    public ProjectConfig {
        schemaVersion = schemaVersion == 0 ? SchemaVersion.CURRENT : schemaVersion;
        gates = List.copyOf(Objects.requireNonNullElse(gates, List.of()));
        clans = List.copyOf(Objects.requireNonNullElse(clans, List.of()));
        windows = List.copyOf(Objects.requireNonNullElse(windows, List.of()));
    }

    public Optional<Clan> findClan(String clanId) {
        return clans.stream().filter(c -> c.id().equals(clanId)).findFirst();
    }

    public Optional<Window> findWindow(String windowId) {
        return windows.stream().filter(w -> w.id().equals(windowId)).findFirst();
    }

    @JsonIgnore
    public Optional<Window> currentWindow() {
        return findWindow(activeWindow);
    }

    public ProjectConfig withVersion(long newVersion) {
        return new ProjectConfig(schemaVersion, newVersion, id, name, created, gates, clans, windows, activeWindow);
    }

    public ProjectConfig withGates(List<Gate> newGates) {
        return new ProjectConfig(schemaVersion, version, id, name, created, newGates, clans, windows, activeWindow);
    }

    public ProjectConfig withClans(List<Clan> newClans) {
        return new ProjectConfig(schemaVersion, version, id, name, created, gates, newClans, windows, activeWindow);
    }

    public ProjectConfig withClanAppended(Clan clan) {
        var newClans = new ArrayList<>(clans);
        newClans.add(clan);
        return withClans(newClans);
    }

    /** Appends {@code window} and makes it the active window. */
    public ProjectConfig withWindowActivated(Window window) {
        var newWindows = new ArrayList<>(windows);
        newWindows.add(window);
        return new ProjectConfig(schemaVersion, version, id, name, created, gates, clans, newWindows, window.id());
    }
}
