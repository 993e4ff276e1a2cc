package com.realm.simulation.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeManagerTest {

    @Test
    @DisplayName("23:00 推进 120 分钟进位到次日 01:00")
    void rolloverAcrossMidnight() {
        TimeManager time = new TimeManager(1, 1, 23);
        time.advanceMinutes(120);
        assertThat(time.getHour()).isEqualTo(1);
        assertThat(time.getMinute()).isZero();
        assertThat(time.getDay()).isEqualTo(2);
        assertThat(time.getTotalMinutes()).isEqualTo(120);
    }

    @Test
    @DisplayName("第360天之后进入下一年")
    void rolloverAcrossYear() {
        TimeManager time = new TimeManager(1, 360, 23, 30);
        time.advanceMinutes(45);
        assertThat(time.getYear()).isEqualTo(2);
        assertThat(time.getDay()).isEqualTo(1);
        assertThat(time.getTimeString()).isEqualTo("00:15");
    }

    @Test
    @DisplayName("季节、月份与时段")
    void derivedCalendar() {
        TimeManager time = new TimeManager(1, 95, 14);
        assertThat(time.getSeason()).isEqualTo(Season.SUMMER);
        assertThat(time.getMonth()).isEqualTo(4);
        assertThat(time.getDayOfMonth()).isEqualTo(5);
        assertThat(time.getTimeOfDay()).isEqualTo(TimeOfDay.AFTERNOON);
        assertThat(time.isDaytime()).isTrue();
        assertThat(time.isWorkingHours()).isTrue();
        assertThat(time.getFullDateTimeString()).contains("Summer").contains("14:00");

        TimeManager night = new TimeManager(1, 200, 3);
        assertThat(night.getSeason()).isEqualTo(Season.AUTUMN);
        assertThat(night.getSeason().getDisplayName()).isEqualTo("Fall");
        assertThat(night.isDaytime()).isFalse();
        assertThat(night.getTimeOfDay().getKey()).isEqualTo("night");
    }

    @Test
    @DisplayName("精确触发：跨过登记时刻的回调不会执行")
    void exactTickSkipsOvershotCallbacks() {
        TimeManager time = new TimeManager();
        List<String> fired = new ArrayList<>();
        time.schedule(30, () -> fired.add("exact"));
        time.schedule(45, () -> fired.add("skipped"));

        time.advanceMinutes(30);
        time.advanceMinutes(30);

        assertThat(fired).containsExactly("exact");
        assertThat(time.getPendingCallbackCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("ON_OR_AFTER：补发所有到期回调，按时刻先后")
    void onOrAfterFiresOverdueCallbacks() {
        TimeManager time = new TimeManager();
        time.setCallbackPolicy(CallbackPolicy.ON_OR_AFTER);
        List<String> fired = new ArrayList<>();
        time.schedule(45, () -> fired.add("second"));
        time.schedule(10, () -> fired.add("first"));
        time.schedule(200, () -> fired.add("later"));

        time.advanceMinutes(60);

        assertThat(fired).containsExactly("first", "second");
        assertThat(time.getPendingCallbackCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("回调失败被收集，其它回调照常执行")
    void callbackFailuresIsolated() {
        TimeManager time = new TimeManager();
        List<String> fired = new ArrayList<>();
        time.schedule(5, () -> {
            throw new IllegalStateException("boom");
        });
        time.schedule(5, () -> fired.add("ok"));

        List<CallbackFailure> failures = time.advanceMinutes(5);

        assertThat(fired).containsExactly("ok");
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).getTick()).isEqualTo(5);
        assertThat(failures.get(0).getError()).hasMessage("boom");
    }

    @Test
    @DisplayName("advanceToTime 总是推进到未来")
    void advanceToTimeStrictlyFuture() {
        TimeManager time = new TimeManager(1, 1, 8);
        time.advanceToTime(8, 0);
        assertThat(time.getDay()).isEqualTo(2);
        assertThat(time.getHour()).isEqualTo(8);

        time.advanceToTime(20, 30);
        assertThat(time.getDay()).isEqualTo(2);
        assertThat(time.getTimeString()).isEqualTo("20:30");
    }

    @Test
    @DisplayName("时间状态保存后还原一致")
    void stateRoundTrip() {
        TimeManager time = new TimeManager(3, 100, 6, 15);
        time.advanceHours(5);
        TimeManager restored = TimeManager.fromState(time.toState());
        assertThat(restored.getFullDateTimeString()).isEqualTo(time.getFullDateTimeString());
        assertThat(restored.getTotalMinutes()).isEqualTo(300);
    }

    @Test
    @DisplayName("非法输入被拒绝")
    void invalidInputsRejected() {
        assertThatThrownBy(() -> new TimeManager(1, 0, 8)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeManager(1, 1, 24)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeManager().advanceMinutes(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeManager().schedule(-5, () -> { }))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
