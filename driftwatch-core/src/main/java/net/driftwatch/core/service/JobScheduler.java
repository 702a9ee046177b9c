package net.driftwatch.core.service;

import net.driftwatch.core.model.ActiveHours;
import net.driftwatch.core.model.ScheduleConfig;
import net.driftwatch.core.model.ScheduleUpdate;

import java.time.Duration;
import java.time.Instant;

/**
 * 스케줄 관리 + 실행 디스패치.
 * {@link #start()} 전에는 모든 연산이 {@link net.driftwatch.core.error.SchedulerNotInitializedException}.
 * 같은 스케줄의 실행은 겹치지 않는다.
 */
public interface JobScheduler {

    /** 재시작 복구 후 작업 수락 시작. 두 번 불러도 한 번만 복구한다. */
    void start() throws Exception;

    boolean isStarted();

    /** (userId, kind) 기준 생성 또는 덮어쓰기. 스케줄 ID 반환 */
    long add(String userId, String kind, Duration interval, ActiveHours activeHours, boolean enabled) throws Exception;

    ScheduleConfig update(long scheduleId, ScheduleUpdate update) throws Exception;

    /** 없는 ID면 ScheduleNotFoundException */
    boolean remove(long scheduleId) throws Exception;

    /** due 스케줄 디스패치. 디스패치한 건수 반환 */
    int tick(Instant now) throws Exception;

    /** 수동 실행. 이미 실행 중이면 false */
    boolean triggerNow(long scheduleId) throws Exception;

    boolean isRunning(long scheduleId);

    /** 새 작업을 막고 진행 중 실행을 grace 동안 기다린다. */
    void shutdown(Duration grace);
}
