package com.realm.simulation.entity;

import com.realm.TestFixtures;
import com.realm.generator.model.Item;
import com.realm.simulation.event.EventTypes;
import com.realm.simulation.time.TimeManager;
import com.realm.simulation.world.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LivingLocationTest {

    private World world;

    @BeforeEach
    void setUp() {
        world = TestFixtures.emptyWorld(8L, new TimeManager(1, 1, 7));
    }

    private int published(String type) {
        world.getEvents().processEvents();
        return world.getEvents().getEventsByType(type, null).size();
    }

    @Test
    @DisplayName("市场只在开闭状态翻转时发布事件")
    void marketEventsOnlyOnChange() {
        LivingLocation market = new LivingLocation("m", TestFixtures.location("m", "market"));

        market.update(1, world);
        assertThat(market.isMarketOpen()).isFalse();
        assertThat(published(EventTypes.MARKET_OPENED)).isZero();

        world.getTime().advanceHours(1);
        market.update(1, world);
        market.update(1, world);
        assertThat(market.isMarketOpen()).isTrue();
        assertThat(published(EventTypes.MARKET_OPENED)).isEqualTo(1);

        world.getTime().advanceHours(9);
        market.update(1, world);
        market.update(1, world);
        assertThat(market.isMarketOpen()).isFalse();
        assertThat(published(EventTypes.MARKET_CLOSED)).isEqualTo(1);
    }

    @Test
    @DisplayName("非市场类型的地点没有开闭状态")
    void wildernessHasNoMarket() {
        LivingLocation forest = new LivingLocation("f", TestFixtures.location("f", "wilderness"));
        world.getTime().advanceHours(2);
        forest.update(1, world);
        assertThat(forest.isMarketOpen()).isFalse();
        assertThat(published(EventTypes.MARKET_OPENED)).isZero();
    }

    @Test
    @DisplayName("首次更新生成天气，同一小时内不重算")
    void weatherPerHour() {
        LivingLocation village = new LivingLocation("v", TestFixtures.location("v", "settlement"));
        village.update(1, world);
        assertThat(village.getCurrentWeather()).isNotNull();
        assertThat(village.getCurrentWeather().getSeason()).isEqualTo("spring");
        assertThat(village.getCurrentWeather().getTimeOfDay()).isEqualTo("dawn");

        long drawsBefore = world.getRandom().getDraws();
        village.update(1, world);
        assertThat(world.getRandom().getDraws()).isEqualTo(drawsBefore);
    }

    @Test
    @DisplayName("天气变化事件的数量不超过天气重算的次数")
    void weatherChangedOnlyWhenConditionDiffers() {
        LivingLocation village = new LivingLocation("v", TestFixtures.location("v", "settlement"));
        int changes = 0;
        String previous = null;
        for (int hour = 0; hour < 48; hour++) {
            village.update(60, world);
            String condition = village.getCurrentWeather().getCondition();
            if (previous != null && !previous.equals(condition)) {
                changes++;
            }
            previous = condition;
            world.getTime().advanceHours(1);
        }
        assertThat(published(EventTypes.WEATHER_CHANGED)).isEqualTo(changes);
    }

    @Test
    @DisplayName("NPC进出发布事件，物品按ID存取")
    void membershipAndItems() {
        LivingLocation tavern = new LivingLocation("t", TestFixtures.location("t", "building"));
        tavern.addNpc("n1", world.getEvents());
        tavern.addNpc("n2", null);
        tavern.removeNpc("n1", world.getEvents());

        assertThat(tavern.getNpcIds()).containsExactly("n2");
        assertThat(published(EventTypes.NPC_ENTERED_LOCATION)).isEqualTo(1);
        assertThat(world.getEvents().getEventsByType(EventTypes.NPC_EXITED_LOCATION, null)).hasSize(1);

        Item ale = world.getGenerator().generateItem("bread");
        tavern.addItem("item-1", ale);
        assertThat(tavern.getItems()).containsEntry("item-1", ale);
        assertThat(tavern.removeItem("item-1")).isEqualTo(ale);
        assertThat(tavern.getItemIds()).isEmpty();
    }

    @Test
    @DisplayName("序列化后还原出相同状态")
    void serializeRoundTrip() {
        LivingLocation market = new LivingLocation("m", TestFixtures.location("m", "market"));
        market.addNpc("n1", null);
        world.getTime().advanceHours(2);
        market.update(1, world);

        LocationState state = market.serialize();
        LivingLocation restored = (LivingLocation) new EntityFactory(world.getRandom()).restore(EntityKind.LOCATION, state);

        assertThat(restored.getNpcIds()).containsExactly("n1");
        assertThat(restored.isMarketOpen()).isTrue();
        assertThat(restored.getCurrentWeather()).isEqualTo(market.getCurrentWeather());
        assertThat(restored.serialize()).isEqualTo(state);
    }
}
