package net.driftwatch.bootstrap.notify;

import net.driftwatch.core.model.ChangeRecord;
import net.driftwatch.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** 기본 Notifier. 변경 1건당 한 줄 */
public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(String userId, String kind, List<ChangeRecord> changes) {
        log.info("[{}/{}] {} change(s)", userId, kind, changes.size());
        for (ChangeRecord c : changes) {
            log.info("[{}/{}]   {}", userId, kind, line(c));
        }
    }

    static String line(ChangeRecord c) {
        if (c instanceof ChangeRecord.Swapped s) {
            return "SWAPPED " + s.jobA().id() + " " + s.oldDateA() + "→" + s.jobA().scheduledDate()
                    + " <-> " + s.jobB().id() + " " + s.oldDateB() + "→" + s.jobB().scheduledDate();
        }
        if (c instanceof ChangeRecord.DateChanged d) {
            return "DATE_CHANGED " + d.job().id() + " " + d.oldDate() + "→" + d.newDate();
        }
        if (c instanceof ChangeRecord.Replaced r) {
            return "REPLACED " + r.removedJob().id() + " → " + r.addedJob().id() + " on " + r.sharedDate();
        }
        if (c instanceof ChangeRecord.Added a) {
            return "ADDED " + a.job().id() + " " + a.job().scheduledDate() + " " + a.job().groupKey();
        }
        if (c instanceof ChangeRecord.Removed r) {
            return "REMOVED " + r.job().id() + " " + r.job().scheduledDate() + " " + r.job().groupKey();
        }
        return c.type() + " " + c.sortId();
    }
}
