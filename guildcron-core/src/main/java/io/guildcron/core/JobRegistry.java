package io.guildcron.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Job key to live {@link ScheduledHandle}. At most one live handle exists per key.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final ConcurrentHashMap<String, ScheduledHandle> handles = new ConcurrentHashMap<>();

    /**
     * Store {@code handle} under {@code key}, cancelling whatever was registered there before.
     */
    public void register(String key, ScheduledHandle handle) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(handle, "handle must not be null");

        handles.compute(key, (k, previous) -> {
            if (previous != null && previous != handle) {
                previous.cancel();
                log.debug("guildcron registry replaced handle key={}", k);
            }
            return handle;
        });
    }

    /**
     * Cancel the handle under {@code key} and install the one produced by {@code factory}, holding the key
     * for the whole swap. A factory returning null leaves the key empty.
     *
     * @return the installed handle, or null when nothing was installed
     */
    public ScheduledHandle replace(String key, Supplier<ScheduledHandle> factory) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(factory, "factory must not be null");

        RuntimeException[] failure = new RuntimeException[1];
        ScheduledHandle installed = handles.compute(key, (k, previous) -> {
            if (previous != null) {
                previous.cancel();
                log.debug("guildcron registry cancelled previous handle key={}", k);
            }
            try {
                return factory.get();
            } catch (RuntimeException e) {
                failure[0] = e;
                return null;
            }
        });

        if (failure[0] != null) {
            throw failure[0];
        }
        return installed;
    }

    /**
     * Cancel and forget the handle under {@code key}. No-op when absent.
     *
     * @return true if a handle was removed
     */
    public boolean remove(String key) {
        Objects.requireNonNull(key, "key must not be null");
        ScheduledHandle handle = handles.remove(key);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        return true;
    }

    /**
     * Forget {@code handle} if it is still the one registered under {@code key}. Does not cancel it.
     */
    public boolean unregister(String key, ScheduledHandle handle) {
        if (key == null || handle == null) {
            return false;
        }
        return handles.remove(key, handle);
    }

    public void stopAll() {
        for (String key : handles.keySet()) {
            ScheduledHandle handle = handles.remove(key);
            if (handle != null) {
                handle.cancel();
            }
        }
    }

    public boolean contains(String key) {
        return handles.containsKey(key);
    }

    public ScheduledHandle get(String key) {
        return handles.get(key);
    }

    public Set<String> keys() {
        return Set.copyOf(handles.keySet());
    }

    public int size() {
        return handles.size();
    }
}
