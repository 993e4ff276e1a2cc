package com.realm.simulation.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 模拟时间管理
 *
 * 简化历法：60分钟/小时，24小时/天，30天/月，12个月/年（360天），四季各90天。
 * 总分钟数从模拟开始时的 0 起算，定时回调按绝对总分钟数登记。
 */
public class TimeManager {

    private static final Logger logger = LoggerFactory.getLogger(TimeManager.class);

    public static final int MINUTES_PER_HOUR = 60;
    public static final int HOURS_PER_DAY = 24;
    public static final int MINUTES_PER_DAY = MINUTES_PER_HOUR * HOURS_PER_DAY;
    public static final int DAYS_PER_MONTH = 30;
    public static final int MONTHS_PER_YEAR = 12;
    public static final int DAYS_PER_YEAR = DAYS_PER_MONTH * MONTHS_PER_YEAR;
    public static final int DAYS_PER_SEASON = 90;

    public static final int DAYTIME_START = 6;
    public static final int DAYTIME_END = 19;
    public static final int WORK_START = 8;
    public static final int WORK_END = 17;

    private int year;
    private int day;
    private int hour;
    private int minute;
    private long totalMinutes;
    private double timeScale = 1.0;

    private CallbackPolicy callbackPolicy = CallbackPolicy.EXACT_TICK;

    /**
     * 触发时刻 → 回调（同一时刻按登记顺序）
     */
    private final NavigableMap<Long, List<Runnable>> scheduled = new TreeMap<>();

    public TimeManager() {
        this(1, 1, WORK_START);
    }

    public TimeManager(int year, int day, int hour) {
        this(year, day, hour, 0);
    }

    public TimeManager(int year, int day, int hour, int minute) {
        if (day < 1 || day > DAYS_PER_YEAR || hour < 0 || hour >= HOURS_PER_DAY
            || minute < 0 || minute >= MINUTES_PER_HOUR) {
            throw new IllegalArgumentException(
                String.format("非法的起始时间: year=%d, day=%d, %02d:%02d", year, day, hour, minute));
        }
        this.year = year;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
    }

    // ---------------------------------------------------------------- advancing

    /**
     * 推进若干分钟：先进位（分→时→日→年），再检查定时回调
     *
     * @return 本次执行失败的回调，失败不会中断其它回调
     */
    public List<CallbackFailure> advanceMinutes(int minutes) {
        if (minutes < 0) {
            throw new IllegalArgumentException("不能倒退时间: " + minutes);
        }
        totalMinutes += minutes;
        minute += minutes;

        hour += minute / MINUTES_PER_HOUR;
        minute %= MINUTES_PER_HOUR;

        day += hour / HOURS_PER_DAY;
        hour %= HOURS_PER_DAY;

        while (day > DAYS_PER_YEAR) {
            day -= DAYS_PER_YEAR;
            year++;
        }

        return fireScheduled();
    }

    public List<CallbackFailure> advanceHours(int hours) {
        return advanceMinutes(hours * MINUTES_PER_HOUR);
    }

    public List<CallbackFailure> advanceDays(int days) {
        return advanceHours(days * HOURS_PER_DAY);
    }

    /**
     * 推进到下一次出现的 hour:minute（严格在未来，当前时刻则推进一整天）
     */
    public List<CallbackFailure> advanceToTime(int targetHour, int targetMinute) {
        int target = targetHour * MINUTES_PER_HOUR + targetMinute;
        int current = hour * MINUTES_PER_HOUR + minute;
        int delta = target > current ? target - current : MINUTES_PER_DAY - current + target;
        return advanceMinutes(delta);
    }

    // ---------------------------------------------------------------- scheduling

    /**
     * 在 minutesFromNow 分钟之后触发回调
     *
     * @return 回调登记的绝对时刻
     */
    public long schedule(int minutesFromNow, Runnable callback) {
        if (minutesFromNow < 0) {
            throw new IllegalArgumentException("不能登记过去的回调: " + minutesFromNow);
        }
        long trigger = totalMinutes + minutesFromNow;
        scheduled.computeIfAbsent(trigger, k -> new ArrayList<>()).add(callback);
        return trigger;
    }

    public int getPendingCallbackCount() {
        int count = 0;
        for (List<Runnable> callbacks : scheduled.values()) {
            count += callbacks.size();
        }
        return count;
    }

    private List<CallbackFailure> fireScheduled() {
        // 先摘出到期回调再执行，回调内部登记的新回调不会影响本轮
        List<Map.Entry<Long, List<Runnable>>> due = new ArrayList<>();
        if (callbackPolicy == CallbackPolicy.ON_OR_AFTER) {
            NavigableMap<Long, List<Runnable>> head = scheduled.headMap(totalMinutes, true);
            int overdue = head.headMap(totalMinutes, false).size();
            if (overdue > 0) {
                logger.warn("补发{}个已错过的定时回调时刻, 当前总分钟数={}", overdue, totalMinutes);
            }
            for (Map.Entry<Long, List<Runnable>> entry : head.entrySet()) {
                due.add(Map.entry(entry.getKey(), entry.getValue()));
            }
            head.clear();
        } else {
            List<Runnable> exact = scheduled.remove(totalMinutes);
            if (exact != null) {
                due.add(Map.entry(totalMinutes, exact));
            }
        }

        if (due.isEmpty()) {
            return Collections.emptyList();
        }
        List<CallbackFailure> failures = new ArrayList<>();
        for (Map.Entry<Long, List<Runnable>> entry : due) {
            for (Runnable callback : entry.getValue()) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    logger.error("定时回调执行失败: tick={}", entry.getKey(), e);
                    failures.add(new CallbackFailure(entry.getKey(), e));
                }
            }
        }
        return failures;
    }

    // ---------------------------------------------------------------- derived

    public Season getSeason() {
        return Season.ofDay(day);
    }

    public TimeOfDay getTimeOfDay() {
        return TimeOfDay.ofHour(hour);
    }

    /**
     * 月份 1..12
     */
    public int getMonth() {
        return (day - 1) / DAYS_PER_MONTH + 1;
    }

    /**
     * 月内日期 1..30
     */
    public int getDayOfMonth() {
        return (day - 1) % DAYS_PER_MONTH + 1;
    }

    public boolean isDaytime() {
        return hour >= DAYTIME_START && hour < DAYTIME_END;
    }

    public boolean isWorkingHours() {
        return hour >= WORK_START && hour < WORK_END;
    }

    public String getTimeString() {
        return String.format("%02d:%02d", hour, minute);
    }

    public String getDateString() {
        return "Year " + year + ", Day " + day;
    }

    public String getFullDateTimeString() {
        return String.format("Year %d, %s, Month %d, Day %d - %s (%s)",
            year, getSeason().getDisplayName(), getMonth(), getDayOfMonth(),
            getTimeString(), getTimeOfDay().getKey());
    }

    // ---------------------------------------------------------------- state

    public TimeState toState() {
        return TimeState.builder()
            .year(year)
            .day(day)
            .hour(hour)
            .minute(minute)
            .totalMinutes(totalMinutes)
            .timeScale(timeScale)
            .build();
    }

    /**
     * 从快照重建，定时回调不属于快照
     */
    public static TimeManager fromState(TimeState state) {
        TimeManager manager = new TimeManager(state.getYear(), state.getDay(), state.getHour(), state.getMinute());
        manager.totalMinutes = state.getTotalMinutes();
        manager.timeScale = state.getTimeScale();
        return manager;
    }

    public int getYear() {
        return year;
    }

    public int getDay() {
        return day;
    }

    public int getHour() {
        return hour;
    }

    public int getMinute() {
        return minute;
    }

    public long getTotalMinutes() {
        return totalMinutes;
    }

    public double getTimeScale() {
        return timeScale;
    }

    public void setTimeScale(double timeScale) {
        this.timeScale = timeScale;
    }

    public CallbackPolicy getCallbackPolicy() {
        return callbackPolicy;
    }

    public void setCallbackPolicy(CallbackPolicy callbackPolicy) {
        this.callbackPolicy = callbackPolicy != null ? callbackPolicy : CallbackPolicy.EXACT_TICK;
    }

    @Override
    public String toString() {
        return "TimeManager{" + getDateString() + " " + getTimeString() + ", total=" + totalMinutes + "}";
    }
}
