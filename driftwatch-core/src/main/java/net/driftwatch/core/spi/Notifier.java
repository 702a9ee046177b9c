package net.driftwatch.core.spi;

import net.driftwatch.core.model.ChangeRecord;

import java.util.List;

/** best-effort. 예외는 호출 측에서 로그만 남기고 스케줄 상태에 영향 주지 않는다. */
public interface Notifier {
    void notify(String userId, String kind, List<ChangeRecord> changes) throws Exception;
}
