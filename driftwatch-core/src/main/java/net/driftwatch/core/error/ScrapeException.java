package net.driftwatch.core.error;

/** 스크레이퍼 실패. 메시지는 실행 기록의 errorMessage로 그대로 남는다. */
public class ScrapeException extends Exception {
    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
