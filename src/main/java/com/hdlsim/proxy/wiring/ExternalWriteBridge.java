package com.hdlsim.proxy.wiring;

import com.hdlsim.proxy.api.WriteScheduler;
import com.hdlsim.proxy.handle.NonHierarchyObject;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventPoller;
import com.lmax.disruptor.RingBuffer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hands writes from other threads to the simulator thread.
 *
 * Proxies are not thread-safe and the simulator only accepts calls from its
 * own callback thread. Producer threads (a stimulus generator, a socket reader)
 * therefore never touch a proxy's write path directly; they {@link #publish}
 * into a Disruptor ring buffer instead. The simulator thread calls
 * {@link #drain()} from its callback, which moves every published write into
 * the {@link WriteScheduler} as if it had been issued there.
 *
 * Polling:
 * The consumer side is an {@link EventPoller} rather than a
 * {@code BatchEventProcessor}, because draining must happen on a thread the
 * simulator owns, at a moment it chooses.
 *
 * Error Handling:
 * A write the scheduler rejects is logged and skipped; the remaining events
 * are still drained.
 */
public final class ExternalWriteBridge {
    private static final Logger log = LogManager.getLogger(ExternalWriteBridge.class);

    private final RingBuffer<WriteEvent> ringBuffer;
    private final EventPoller<WriteEvent> poller;
    private final WriteScheduler scheduler;
    private long drained;
    private long failed;

    /**
     * @param scheduler  where drained writes go
     * @param bufferSize ring size, a power of two
     */
    public ExternalWriteBridge(WriteScheduler scheduler, int bufferSize) {
        this.scheduler = scheduler;
        this.ringBuffer = RingBuffer.createMultiProducer(WriteEvent::new, bufferSize, new BlockingWaitStrategy());
        this.poller = ringBuffer.newPoller();
        ringBuffer.addGatingSequences(poller.getSequence());
        log.info("External write bridge created (bufferSize={})", bufferSize);
    }

    /**
     * Publishes a write from any thread. Blocks while the ring is full.
     */
    public void publish(NonHierarchyObject target, Object value) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).set(target, value, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    /**
     * Publishes without blocking.
     *
     * @return false if the ring is full and the write was not published
     */
    public boolean tryPublish(NonHierarchyObject target, Object value) {
        return ringBuffer.tryPublishEvent((event, seq, t, v) -> event.set(t, v, seq), target, value);
    }

    /**
     * Moves every published write into the scheduler. Must be called on the
     * simulator thread.
     *
     * @return number of writes moved
     */
    public int drain() {
        int[] count = { 0 };
        try {
            poller.poll((event, sequence, endOfBatch) -> {
                try {
                    scheduler.scheduleWrite(event.target(), event.value());
                    count[0]++;
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Dropping write {} to {}: {}", event.sequenceId(),
                            event.target() == null ? null : event.target().path(), e.getMessage(), e);
                } finally {
                    event.clear();
                }
                return true;
            });
        } catch (Exception e) {
            throw new IllegalStateException("Failed to drain external writes", e);
        }
        drained += count[0];
        if (count[0] > 0)
            log.debug("Drained {} external writes", count[0]);
        return count[0];
    }

    /** Total writes moved into the scheduler so far. */
    public long drainedCount() {
        return drained;
    }

    /** Total writes the scheduler rejected. */
    public long failedCount() {
        return failed;
    }

    /** Slots currently free in the ring. */
    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }
}
