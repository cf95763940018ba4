package com.dualedit.timing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Named timing controllers of one editing session, all on the same {@link Scheduler}.
 * Creating a controller under an existing id destroys the previous one.
 */
public final class TimingManager {

    private static final Logger log = LoggerFactory.getLogger(TimingManager.class);

    private final Scheduler scheduler;
    private final Map<String, TimingController<?>> controllers = new LinkedHashMap<>();

    public TimingManager(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public <T> TimingController<T> createDebounce(String id, Consumer<T> callback, TimingOptions options) {
        return register(id, new DebounceController<>(id, scheduler, options, callback));
    }

    public <T> TimingController<T> createThrottle(String id, Consumer<T> callback, TimingOptions options) {
        return register(id, new ThrottleController<>(id, scheduler, options, callback));
    }

    /** Creates a debounce or throttle controller depending on {@link TimingOptions#getMode()}. */
    public <T> TimingController<T> create(String id, Consumer<T> callback, TimingOptions options) {
        return options.getMode() == TimingMode.DEBOUNCE
                ? createDebounce(id, callback, options)
                : createThrottle(id, callback, options);
    }

    private <T> TimingController<T> register(String id, TimingController<T> controller) {
        TimingController<?> previous = controllers.put(id, controller);
        if (previous != null) {
            log.debug("Replacing timing controller {}", id);
            previous.destroy();
        }
        return controller;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<TimingController<T>> get(String id) {
        return Optional.ofNullable((TimingController<T>) controllers.get(id));
    }

    public boolean cancel(String id) {
        TimingController<?> c = controllers.get(id);
        if (c == null) return false;
        c.cancel();
        return true;
    }

    public boolean flush(String id) {
        TimingController<?> c = controllers.get(id);
        if (c == null) return false;
        c.flush();
        return true;
    }

    public void cancelAll() {
        for (TimingController<?> c : snapshot()) {
            c.cancel();
        }
    }

    public void flushAll() {
        for (TimingController<?> c : snapshot()) {
            c.flush();
        }
    }

    /** Destroys and forgets the controller. */
    public boolean remove(String id) {
        TimingController<?> c = controllers.remove(id);
        if (c == null) return false;
        c.destroy();
        return true;
    }

    public boolean hasPending() {
        return controllers.values().stream().anyMatch(TimingController::isPending);
    }

    public boolean isPending(String id) {
        TimingController<?> c = controllers.get(id);
        return c != null && c.isPending();
    }

    public int size() {
        return controllers.size();
    }

    /** Destroys every controller. The manager can be reused afterwards. */
    public void destroy() {
        List<TimingController<?>> all = snapshot();
        controllers.clear();
        for (TimingController<?> c : all) {
            c.destroy();
        }
    }

    private List<TimingController<?>> snapshot() {
        return new ArrayList<>(controllers.values());
    }
}
