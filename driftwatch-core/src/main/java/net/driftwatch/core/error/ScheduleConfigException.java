package net.driftwatch.core.error;

/** 잘못된 스케줄 설정(간격 <= 0, 활성 시간대 형식 오류). 저장소까지 가지 않는다. */
public class ScheduleConfigException extends IllegalArgumentException {
    public ScheduleConfigException(String message) {
        super(message);
    }
}
