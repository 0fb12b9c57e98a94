package tech.oauthplayground.flowengine.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler that records every requested delay. In fast mode delayed tasks run
 * right away, so a polling run with a 5s interval finishes in milliseconds.
 */
public class RecordingScheduler extends ScheduledThreadPoolExecutor {

    private final List<Long> requestedDelaysSeconds = new CopyOnWriteArrayList<>();
    private final boolean fast;

    private RecordingScheduler(boolean fast) {
        super(1);
        this.fast = fast;
        setRemoveOnCancelPolicy(true);
    }

    public static RecordingScheduler fast() {
        return new RecordingScheduler(true);
    }

    public static RecordingScheduler realTime() {
        return new RecordingScheduler(false);
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
        requestedDelaysSeconds.add(unit.toSeconds(delay));
        return super.schedule(command, fast ? 0 : delay, unit);
    }

    public List<Long> requestedDelaysSeconds() {
        return requestedDelaysSeconds;
    }
}
