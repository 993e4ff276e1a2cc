package com.realm.simulation.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * 事件总线
 *
 * 支持立即分发或入队，队列按先进先出处理。
 * 分发顺序：写时间戳 → 全局监听器 → 该类型订阅者 → 写入历史。
 * 历史有上限，超出时丢弃最旧的事件。
 */
public class EventBus {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_MAX_HISTORY = 1000;
    public static final int SUMMARY_RECENT_EVENTS = 20;

    private final Map<String, List<EventHandler>> subscribers = new LinkedHashMap<>();
    private final List<EventHandler> globalListeners = new ArrayList<>();
    private final Deque<Event> queue = new ArrayDeque<>();
    private final Deque<Event> history = new ArrayDeque<>();
    private final int maxHistory;
    private final LongSupplier clock;
    private long nextId = 1;

    public EventBus() {
        this(DEFAULT_MAX_HISTORY, () -> 0L);
    }

    /**
     * @param clock 分发时刻的时间来源（模拟总分钟数）
     */
    public EventBus(int maxHistory, LongSupplier clock) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("max_history 必须为正: " + maxHistory);
        }
        this.maxHistory = maxHistory;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- subscription

    public void subscribe(String type, EventHandler handler) {
        subscribers.computeIfAbsent(type, k -> new ArrayList<>()).add(handler);
    }

    public boolean unsubscribe(String type, EventHandler handler) {
        List<EventHandler> handlers = subscribers.get(type);
        return handlers != null && handlers.remove(handler);
    }

    public void addGlobalListener(EventHandler listener) {
        globalListeners.add(listener);
    }

    public boolean removeGlobalListener(EventHandler listener) {
        return globalListeners.remove(listener);
    }

    // ---------------------------------------------------------------- publishing

    /**
     * 发布事件
     *
     * @param immediate true 时同步分发，否则入队等待 {@link #processEvents(Integer)}
     */
    public DispatchReport publish(Event event, boolean immediate) {
        event.assignId("evt-" + nextId++);
        if (!immediate) {
            queue.addLast(event);
            return DispatchReport.empty();
        }
        DispatchReport report = new DispatchReport();
        dispatch(event, report);
        return report;
    }

    /**
     * 入队发布
     */
    public void publish(Event event) {
        publish(event, false);
    }

    /**
     * 处理队列中最旧的 max 个事件，max 为空时处理全部
     * 处理期间新入队的事件也会在本次处理（不超过 max）
     */
    public DispatchReport processEvents(Integer max) {
        DispatchReport report = new DispatchReport();
        int limit = max != null ? max : Integer.MAX_VALUE;
        int processed = 0;
        while (processed < limit && !queue.isEmpty()) {
            dispatch(queue.pollFirst(), report);
            processed++;
        }
        return report;
    }

    public DispatchReport processEvents() {
        return processEvents(null);
    }

    private void dispatch(Event event, DispatchReport report) {
        event.stamp(clock.getAsLong());

        for (EventHandler listener : new ArrayList<>(globalListeners)) {
            invoke(listener, event, true, report);
        }
        List<EventHandler> handlers = subscribers.get(event.getType());
        if (handlers != null) {
            for (EventHandler handler : new ArrayList<>(handlers)) {
                invoke(handler, event, false, report);
            }
        }

        history.addLast(event);
        while (history.size() > maxHistory) {
            history.pollFirst();
        }
        report.recordDispatched();
    }

    private void invoke(EventHandler handler, Event event, boolean global, DispatchReport report) {
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            logger.error("事件处理器执行失败: type={}, id={}, global={}", event.getType(), event.getId(), global, e);
            report.recordFailure(new HandlerFailure(event.getId(), event.getType(), global, e));
        }
    }

    // ---------------------------------------------------------------- history

    /**
     * 历史（按插入顺序，最旧在前）
     */
    public List<Event> getHistory() {
        return new ArrayList<>(history);
    }

    public List<Event> getEventsByType(String type, Integer limit) {
        return newestFirst(event -> type.equals(event.getType()), limit);
    }

    public List<Event> getEventsBySource(String sourceId, Integer limit) {
        return newestFirst(event -> sourceId.equals(event.getSourceId()), limit);
    }

    public List<Event> getEventsByLocation(String locationId, Integer limit) {
        return newestFirst(event -> locationId.equals(event.getLocationId()), limit);
    }

    /**
     * 最近的事件，新的在前
     */
    public List<Event> getRecentEvents(int limit) {
        return newestFirst(event -> true, limit);
    }

    private List<Event> newestFirst(Predicate<Event> filter, Integer limit) {
        List<Event> result = new ArrayList<>();
        Iterator<Event> it = history.descendingIterator();
        while (it.hasNext() && (limit == null || result.size() < limit)) {
            Event event = it.next();
            if (filter.test(event)) {
                result.add(event);
            }
        }
        return result;
    }

    public void clearHistory() {
        history.clear();
    }

    public void clearQueue() {
        queue.clear();
    }

    public int getQueueSize() {
        return queue.size();
    }

    public int getHistorySize() {
        return history.size();
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public EventBusSummary summary() {
        List<EventRecord> recent = new ArrayList<>();
        for (Event event : getRecentEvents(SUMMARY_RECENT_EVENTS)) {
            recent.add(EventRecord.of(event));
        }
        return EventBusSummary.builder()
            .queueSize(queue.size())
            .historySize(history.size())
            .maxHistory(maxHistory)
            .recentEvents(recent)
            .build();
    }
}
