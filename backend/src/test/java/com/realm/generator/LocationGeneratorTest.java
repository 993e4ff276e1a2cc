package com.realm.generator;

import com.realm.common.TemplateNotFoundException;
import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.GeneratedWorld;
import com.realm.generator.template.TemplateStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocationGeneratorTest {

    private static TemplateStore store;

    @BeforeAll
    static void load() {
        store = TemplateStore.load("classpath:data/");
    }

    @Test
    @DisplayName("单个地点：邻居只回连根节点，不再继续扩展")
    void neighboursDoNotExpand() {
        ContentGenerator generator = new ContentGenerator(store, 77L);
        GeneratedLocation root = generator.generateLocation("village", true, 3, null);

        assertThat(root.getId()).matches("village_\\d{4}");
        assertThat(root.getConnections()).hasSizeBetween(1, 3);
        assertThat(store.getLocationTemplate("village").getCanConnectTo())
            .containsAll(root.getConnections().keySet());

        WorldGraph graph = generator.getGraph();
        assertThat(graph.size()).isEqualTo(1 + root.getConnections().size());
        root.getConnections().forEach((slot, neighbourId) -> {
            GeneratedLocation neighbour = graph.get(neighbourId);
            assertThat(neighbour.getTemplate()).isEqualTo(slot);
            assertThat(neighbour.getConnections()).containsExactly(Map.entry("village", root.getId()));
        });
    }

    @Test
    @DisplayName("connect=false 时不生成连接")
    void noConnections() {
        ContentGenerator generator = new ContentGenerator(store, 3L);
        GeneratedLocation location = generator.generateLocation("tavern", false, 3, null);
        assertThat(location.getConnections()).isEmpty();
        assertThat(generator.getGraph().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("maxConnections 限制连接数量")
    void maxConnectionsRespected() {
        for (long seed = 0; seed < 30; seed++) {
            GeneratedLocation location = new ContentGenerator(store, seed).generateLocation("village", true, 1, null);
            assertThat(location.getConnections()).hasSize(1);
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 42L, 1000L})
    @DisplayName("世界图中的每条边都是双向的")
    void worldEdgesAreBidirectional(long seed) {
        GeneratedWorld world = new ContentGenerator(store, seed).generateWorld(6);
        Map<String, GeneratedLocation> locations = world.getLocations();

        assertThat(world.getSummary().keySet()).isEqualTo(locations.keySet());
        locations.values().forEach(location -> location.getConnections().forEach((slot, neighbourId) -> {
            GeneratedLocation neighbour = locations.get(neighbourId);
            assertThat(neighbour).as("neighbour %s of %s", neighbourId, location.getId()).isNotNull();
            assertThat(neighbour.getTemplate()).isEqualTo(slot);
            assertThat(neighbour.getConnections().get(location.getTemplate())).isEqualTo(location.getId());
        }));
    }

    @Test
    @DisplayName("地点内容：生物群系、标签、NPC与物品")
    void locationContents() {
        ContentGenerator generator = new ContentGenerator(store, 5L);
        GeneratedLocation market = generator.generateLocation("market", false, 0, "grassland");
        assertThat(market.getBiome()).isEqualTo("grassland");
        assertThat(market.getEnvironmentTags()).contains("open_air", "busy").doesNotHaveDuplicates();
        assertThat(market.getNpcs()).hasSizeBetween(2, 4);
        assertThat(market.getItems()).hasSizeBetween(2, 4);
        assertThat(market.getDescription()).isNotBlank().doesNotContain("{");

        GeneratedLocation forest = generator.generateLocation("forest", false, 0, null);
        assertThat(forest.getItems()).isEmpty();
        assertThat(forest.getBiome()).isEqualTo("temperate_forest");
    }

    @Test
    @DisplayName("重新生成世界时先清空会话图")
    void generateWorldResetsGraph() {
        ContentGenerator generator = new ContentGenerator(store, 9L);
        generator.generateWorld(5);
        GeneratedWorld second = generator.generateWorld(1);
        assertThat(second.getLocations()).hasSizeBetween(1, 1 + LocationGenerator.WORLD_MAX_CONNECTIONS);
        assertThat(generator.generateWorld(0).getLocations()).isEmpty();
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void invalidArgumentsRejected() {
        ContentGenerator generator = new ContentGenerator(store, 1L);
        assertThatThrownBy(() -> generator.generateWorld(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generateLocation("castle"))
            .isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> generator.generateLocation("village", true, 3, "moon"))
            .isInstanceOf(TemplateNotFoundException.class);
    }
}
