package movepick.engine.search;

import java.util.concurrent.atomic.AtomicBoolean;

final class TimeControl {
    private TimeControl() {
    }

    static boolean aborted(AtomicBoolean stop, long startNs, long budgetNs) {
        if(stop.get()) {
            return true;
        }
        return budgetNs != -1 && System.nanoTime() - startNs >= budgetNs;
    }
}
