package com.openforge.plantmate.gpu;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof of exclusive ownership of a slot with a given model loaded.
 * Closing it is the same as {@link GpuResidencyScheduler#release(Residency)} and
 * may happen any number of times; only the first one hands the slot back.
 */
public final class Residency implements AutoCloseable {

    private final GpuResidencyScheduler scheduler;
    private final ModelSlot             slot;
    private final ModelClass            modelClass;
    private final String                modelId;
    private final Instant               acquiredAt;
    private final AtomicBoolean         released = new AtomicBoolean();

    Residency(GpuResidencyScheduler scheduler, ModelSlot slot, ModelClass modelClass,
              String modelId, Instant acquiredAt) {
        this.scheduler  = scheduler;
        this.slot       = slot;
        this.modelClass = modelClass;
        this.modelId    = modelId;
        this.acquiredAt = acquiredAt;
    }

    public String slotId()         { return slot.id(); }
    public ModelClass modelClass() { return modelClass; }
    public String modelId()        { return modelId; }
    public Instant acquiredAt()    { return acquiredAt; }
    public boolean isReleased()    { return released.get(); }

    ModelSlot slot() {
        return slot;
    }

    /** Flips to released; returns false if that already happened. */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        scheduler.release(this);
    }
}
