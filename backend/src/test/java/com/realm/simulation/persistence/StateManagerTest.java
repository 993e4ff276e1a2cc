package com.realm.simulation.persistence;

import com.realm.TestFixtures;
import com.realm.generator.ContentGenerator;
import com.realm.simulation.world.SimulationSettings;
import com.realm.simulation.world.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateManagerTest {

    @TempDir
    Path dir;

    private StateManager stateManager;
    private World world;

    @BeforeEach
    void setUp() {
        stateManager = new StateManager(dir);
        SimulationSettings settings = SimulationSettings.builder().worldName("Saved").locationCount(2).build();
        world = World.createNew(new ContentGenerator(TestFixtures.templates(), 55L), settings);
        world.simulateHours(5);
    }

    @ParameterizedTest
    @CsvSource({"JSON, false", "JSON, true", "YAML, false", "YAML, true"})
    @DisplayName("各种格式存档后读回相同的世界状态")
    void saveAndLoadRoundTrip(SnapshotFormat format, boolean compressed) throws Exception {
        Path file = world.save(stateManager, "slot", format, compressed);
        assertThat(file.getFileName().toString()).isEqualTo(format.fileName("slot", compressed));
        assertThat(dir.resolve("slot.tmp")).doesNotExist();

        WorldState loaded = stateManager.load("slot", format);
        WorldState source = world.toState();
        assertThat(loaded.getName()).isEqualTo("Saved");
        assertThat(loaded.getSeed()).isEqualTo(55L);
        assertThat(loaded.getRandomDraws()).isEqualTo(source.getRandomDraws());
        assertThat(loaded.getTime()).isEqualTo(source.getTime());
        assertThat(loaded.getNpcs()).isEqualTo(source.getNpcs());
        assertThat(loaded.getLocations()).isEqualTo(source.getLocations());
        assertThat(loaded.getEvents().getHistorySize()).isEqualTo(source.getEvents().getHistorySize());
    }

    @Test
    @DisplayName("读档时不指定格式也能找到压缩存档")
    void loadDetectsFormat() throws Exception {
        world.save(stateManager, "auto", SnapshotFormat.YAML, true);
        World restored = World.load(stateManager, "auto", null, TestFixtures.templates(), SimulationSettings.DEFAULTS);
        assertThat(restored.getName()).isEqualTo("Saved");
        assertThat(restored.getNpcs()).hasSameSizeAs(world.getNpcs());
        assertThat(restored.getTime().getTotalMinutes()).isEqualTo(300);
    }

    @Test
    @DisplayName("版本不一致只记录警告，照常加载")
    void versionMismatchStillLoads() throws Exception {
        Path file = world.save(stateManager, "old", SnapshotFormat.JSON, false);
        String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8)
            .replace("\"version\" : \"" + StateManager.VERSION + "\"", "\"version\" : \"0.9.0\"");
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));

        WorldSnapshot snapshot = stateManager.readSnapshot("old", SnapshotFormat.JSON);
        assertThat(snapshot.getVersion()).isEqualTo("0.9.0");
        assertThat(snapshot.getWorldState().getName()).isEqualTo("Saved");
    }

    @Test
    @DisplayName("列出与删除存档")
    void listAndDelete() throws Exception {
        world.save(stateManager, "first", SnapshotFormat.JSON, false);
        world.save(stateManager, "second", SnapshotFormat.YAML, true);
        Files.write(dir.resolve("notes.txt"), "ignore me".getBytes(StandardCharsets.UTF_8));

        List<SaveInfo> saves = stateManager.listSaves();
        assertThat(saves).extracting(SaveInfo::getName).containsExactlyInAnyOrder("first", "second");
        SaveInfo second = saves.stream().filter(s -> s.getName().equals("second")).findFirst().orElseThrow();
        assertThat(second.getFormat()).isEqualTo(SnapshotFormat.YAML);
        assertThat(second.isCompressed()).isTrue();
        assertThat(second.getSize()).isPositive();

        assertThat(stateManager.deleteSave("first")).isTrue();
        assertThat(stateManager.deleteSave("first")).isFalse();
        assertThat(stateManager.listSaves()).extracting(SaveInfo::getName).containsExactly("second");
    }

    @Test
    @DisplayName("存档不存在或名称非法时报错")
    void missingSaveAndBadNames() {
        assertThatThrownBy(() -> stateManager.load("ghost", null)).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> stateManager.load("../escape", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> stateManager.deleteSave(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("解析与识别存档格式")
    void formatHelpers() {
        assertThat(SnapshotFormat.parse("yaml")).isEqualTo(SnapshotFormat.YAML);
        assertThat(SnapshotFormat.parse(null)).isEqualTo(SnapshotFormat.JSON);
        assertThat(SnapshotFormat.detect("world.yaml.gz")).isEqualTo(SnapshotFormat.YAML);
        assertThat(SnapshotFormat.detect("readme.md")).isNull();
        assertThatThrownBy(() -> SnapshotFormat.parse("xml")).isInstanceOf(IllegalArgumentException.class);
    }
}
