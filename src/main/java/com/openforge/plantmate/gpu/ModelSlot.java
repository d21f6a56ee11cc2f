package com.openforge.plantmate.gpu;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Semaphore;

/**
 * One physical accelerator (or CPU inference server) and the model it holds.
 *
 * Ownership is a fair binary semaphore: at most one {@link Residency} exists per
 * slot at any instant and waiters are served in arrival order. The resident-model
 * fields are only written by the current owner.
 */
public final class ModelSlot {

    private final String          id;
    private final String          baseUrl;
    private final Set<ModelClass> hostedClasses;
    private final int             numCtx;
    private final boolean         swapping;
    private final Semaphore       owner = new Semaphore(1, true);

    private volatile ModelClass residentClass;
    private volatile String     residentModel;
    private volatile Instant    acquiredAt;
    private volatile List<String> stranded = List.of();

    public ModelSlot(String id, String baseUrl, Set<ModelClass> hostedClasses, int numCtx, boolean swapping) {
        if (hostedClasses == null || hostedClasses.isEmpty()) {
            throw new IllegalArgumentException("Slot " + id + " hosts no model class");
        }
        this.id            = id;
        this.baseUrl       = baseUrl;
        this.hostedClasses = Collections.unmodifiableSet(EnumSet.copyOf(hostedClasses));
        this.numCtx        = numCtx;
        this.swapping      = swapping;
    }

    public String id()                   { return id; }
    public String baseUrl()              { return baseUrl; }
    public Set<ModelClass> hostedClasses() { return hostedClasses; }
    public int numCtx()                  { return numCtx; }
    public boolean swapping()            { return swapping; }

    /** Null when nothing is confirmed loaded (fresh start or after a failed swap). */
    public ModelClass residentClass()    { return residentClass; }
    public String residentModel()        { return residentModel; }
    public Instant acquiredAt()          { return acquiredAt; }

    public boolean hosts(ModelClass modelClass) {
        return hostedClasses.contains(modelClass);
    }

    /** True when a caller needing {@code modelClass} can run without a swap. */
    boolean holds(ModelClass modelClass) {
        return !swapping || modelClass == residentClass;
    }

    Semaphore owner() {
        return owner;
    }

    /**
     * Models that may occupy the slot's memory, oldest first: the resident model, or
     * after an abandoned swap every model that swap could have left behind.
     */
    List<String> possiblyLoaded() {
        String resident = residentModel;
        return resident != null ? List.of(resident) : stranded;
    }

    void markResident(ModelClass modelClass, String modelId, Instant at) {
        this.residentClass = modelClass;
        this.residentModel = modelId;
        this.acquiredAt    = at;
        this.stranded      = List.of();
    }

    /** A swap to {@code attemptedModel} was given up; its load may still complete. */
    void markAbandoned(String attemptedModel) {
        LinkedHashSet<String> models = new LinkedHashSet<>(possiblyLoaded());
        models.remove(attemptedModel);
        models.add(attemptedModel);
        this.stranded      = List.copyOf(models);
        this.residentClass = null;
        this.residentModel = null;
        this.acquiredAt    = null;
    }

    @Override
    public String toString() {
        return "ModelSlot[%s %s resident=%s]".formatted(id, hostedClasses, residentModel);
    }
}
