package com.realm.simulation.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventBusTest {

    private AtomicLong clock;
    private EventBus bus;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong();
        bus = new EventBus(100, clock::get);
    }

    private static Event event(String type, String source) {
        return Event.builder().type(type).sourceId(source).build();
    }

    @Test
    @DisplayName("历史上限为3时发布5个事件只保留最新3个")
    void historyIsBounded() {
        EventBus small = new EventBus(3, () -> 0L);
        for (int i = 1; i <= 5; i++) {
            small.publish(event("tick", "s" + i), true);
        }
        assertThat(small.getHistorySize()).isEqualTo(3);
        assertThat(small.getHistory()).extracting(Event::getSourceId).containsExactly("s3", "s4", "s5");
    }

    @Test
    @DisplayName("队列按先进先出处理")
    void queueIsFifo() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("tick", e -> seen.add(e.getSourceId()));
        bus.publish(event("tick", "a"));
        bus.publish(event("tick", "b"));
        bus.publish(event("tick", "c"));

        assertThat(seen).isEmpty();
        assertThat(bus.getQueueSize()).isEqualTo(3);

        DispatchReport report = bus.processEvents(2);
        assertThat(seen).containsExactly("a", "b");
        assertThat(report.getDispatched()).isEqualTo(2);

        bus.processEvents();
        assertThat(seen).containsExactly("a", "b", "c");
        assertThat(bus.getQueueSize()).isZero();
    }

    @Test
    @DisplayName("处理器失败被隔离，其它处理器和历史不受影响")
    void handlerFailureIsolated() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("tick", e -> {
            throw new IllegalStateException("broken handler");
        });
        bus.subscribe("tick", e -> seen.add("second"));
        bus.addGlobalListener(e -> seen.add("global"));

        DispatchReport report = bus.publish(event("tick", "x"), true);

        assertThat(seen).containsExactly("global", "second");
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.getFailures()).hasSize(1);
        HandlerFailure failure = report.getFailures().get(0);
        assertThat(failure.getEventType()).isEqualTo("tick");
        assertThat(failure.isGlobal()).isFalse();
        assertThat(failure.getError()).hasMessage("broken handler");
        assertThat(bus.getHistorySize()).isEqualTo(1);
    }

    @Test
    @DisplayName("事件在发布时分配ID，在处理时写入模拟时间")
    void idAndTimestamp() {
        Event queued = event("tick", "a");
        bus.publish(queued);
        assertThat(queued.getId()).isEqualTo("evt-1");
        assertThat(queued.getTimestamp()).isNull();

        clock.set(90);
        bus.processEvents();
        assertThat(queued.getTimestamp()).isEqualTo(90L);
    }

    @Test
    @DisplayName("按类型、来源、地点查询，新的在前")
    void queriesNewestFirst() {
        bus.publish(Event.builder().type("a").sourceId("n1").locationId("L1").build(), true);
        bus.publish(Event.builder().type("b").sourceId("n2").locationId("L1").build(), true);
        bus.publish(Event.builder().type("a").sourceId("n1").locationId("L2").build(), true);

        assertThat(bus.getEventsByType("a", null)).extracting(Event::getLocationId).containsExactly("L2", "L1");
        assertThat(bus.getEventsBySource("n1", 1)).extracting(Event::getLocationId).containsExactly("L2");
        assertThat(bus.getEventsByLocation("L1", null)).extracting(Event::getType).containsExactly("b", "a");
        assertThat(bus.getRecentEvents(2)).extracting(Event::getType).containsExactly("a", "b");
    }

    @Test
    @DisplayName("取消订阅与清空")
    void unsubscribeAndClear() {
        List<String> seen = new ArrayList<>();
        EventHandler handler = e -> seen.add(e.getType());
        bus.subscribe("tick", handler);
        assertThat(bus.unsubscribe("tick", handler)).isTrue();
        bus.publish(event("tick", null), true);
        assertThat(seen).isEmpty();

        bus.publish(event("tick", null));
        bus.clearQueue();
        bus.clearHistory();
        assertThat(bus.getQueueSize()).isZero();
        assertThat(bus.getHistorySize()).isZero();
    }

    @Test
    @DisplayName("摘要包含最近的事件")
    void summaryContainsRecentEvents() {
        for (int i = 0; i < 25; i++) {
            bus.publish(event("tick", "s" + i), true);
        }
        bus.publish(event("pending", null));
        EventBusSummary summary = bus.summary();
        assertThat(summary.getQueueSize()).isEqualTo(1);
        assertThat(summary.getHistorySize()).isEqualTo(25);
        assertThat(summary.getMaxHistory()).isEqualTo(100);
        assertThat(summary.getRecentEvents()).hasSize(EventBus.SUMMARY_RECENT_EVENTS);
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void invalidArgumentsRejected() {
        assertThatThrownBy(() -> new EventBus(0, () -> 0L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Event.of("")).isInstanceOf(IllegalArgumentException.class);
    }
}
