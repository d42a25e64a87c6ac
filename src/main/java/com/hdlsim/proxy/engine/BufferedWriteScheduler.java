package com.hdlsim.proxy.engine;

import com.hdlsim.proxy.api.WriteScheduler;
import com.hdlsim.proxy.handle.NonHierarchyObject;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference {@link WriteScheduler} that buffers deferred writes until the end
 * of the time step.
 *
 * The simulator integration calls {@link #flush()} from its end-of-step
 * (read-write synchronisation) callback. Until then writes are only held here,
 * one per target, the last one winning.
 *
 * Error Handling:
 * A write that fails during the flush does not stop the others. Each failure
 * is logged; once every write has been attempted the first failure is rethrown
 * with the rest attached as suppressed exceptions.
 */
@Log4j2
public final class BufferedWriteScheduler implements WriteScheduler {
    private final Map<NonHierarchyObject, Object> pending = new LinkedHashMap<>();
    private long flushCount;

    @Override
    public void scheduleWrite(NonHierarchyObject target, Object value) {
        pending.put(target, value);
    }

    /**
     * Applies every pending write through the target's immediate write path.
     *
     * @return the number of writes applied
     */
    public int flush() {
        if (pending.isEmpty())
            return 0;

        List<Map.Entry<NonHierarchyObject, Object>> writes = new ArrayList<>(pending.entrySet());
        pending.clear();
        flushCount++;

        RuntimeException firstError = null;
        int applied = 0;
        for (Map.Entry<NonHierarchyObject, Object> write : writes) {
            try {
                write.getKey().setImmediateValue(write.getValue());
                applied++;
            } catch (RuntimeException e) {
                log.error("Deferred write of {} to {} failed: {}", write.getValue(), write.getKey().path(),
                        e.getMessage());
                if (firstError == null)
                    firstError = e;
                else
                    firstError.addSuppressed(e);
            }
        }
        log.debug("Flush {} applied {} of {} writes", flushCount, applied, writes.size());

        if (firstError != null)
            throw firstError;
        return applied;
    }

    /** The value waiting for a target, or null. */
    public Object pendingValue(NonHierarchyObject target) {
        return pending.get(target);
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public long flushCount() {
        return flushCount;
    }
}
