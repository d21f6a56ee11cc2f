package com.openforge.plantmate.gpu;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serializes access to model slots and performs bounded-time swaps.
 *
 *   acquire(class, maxWait)
 *     1. wait FIFO for the slot's owner permit (≤ maxWait)
 *     2. requested class already resident → done, no swap
 *     3. otherwise unload + load through {@link ModelSwapper} (≤ swap timeout)
 *   release(residency)
 *     hand the permit back; the model stays warm for the next caller
 *
 * Every failure path hands the permit back before throwing, so a slot can never
 * be leaked by a failed acquisition. A timed-out swap leaves the slot with no
 * known resident model: the next acquirer reloads, and first unloads both the
 * previous resident and the model whose load was given up.
 *
 * This is the only shared mutable state across concurrent turns.
 */
@Slf4j
@Service
public class GpuResidencyScheduler {

    private final Map<String, ModelSlot> slots;
    private final ModelSwapper           swapper;
    private final ModelRoleProperties    models;
    private final ExecutorService        swapExecutor;
    private final Duration               swapTimeout;

    @Autowired
    public GpuResidencyScheduler(GpuProperties properties,
                                 ModelRoleProperties models,
                                 ModelSwapper swapper,
                                 @Qualifier("agentTurnExecutor") ExecutorService swapExecutor) {
        this(properties.effectiveSlots().stream()
                        .map(s -> new ModelSlot(s.id(), s.baseUrl(), s.modelClasses(), s.numCtx(), s.swapping()))
                        .toList(),
                models, swapper, swapExecutor, properties.swapTimeout());
    }

    GpuResidencyScheduler(List<ModelSlot> slots,
                          ModelRoleProperties models,
                          ModelSwapper swapper,
                          ExecutorService swapExecutor,
                          Duration swapTimeout) {
        Map<String, ModelSlot> byId = new LinkedHashMap<>();
        for (ModelSlot slot : slots) {
            if (byId.put(slot.id(), slot) != null) {
                throw new IllegalStateException("Duplicate slot id: " + slot.id());
            }
        }
        this.slots        = Collections.unmodifiableMap(byId);
        this.models       = models;
        this.swapper      = swapper;
        this.swapExecutor = swapExecutor;
        this.swapTimeout  = swapTimeout;
    }

    // ── Acquire ──────────────────────────────────────────────────────────────

    /** Acquire on the first slot able to host {@code modelClass}. */
    public Residency acquire(ModelClass modelClass, Duration maxWait) {
        return acquire(slotFor(modelClass).id(), modelClass, maxWait);
    }

    public Residency acquire(String slotId, ModelClass modelClass, Duration maxWait) {
        ModelSlot slot = slots.get(slotId);
        if (slot == null) {
            throw new IllegalArgumentException("Unknown slot: " + slotId);
        }
        if (!slot.hosts(modelClass)) {
            throw new IllegalArgumentException("Slot %s cannot host %s".formatted(slotId, modelClass));
        }

        long waitStart = System.nanoTime();
        try {
            if (!slot.owner().tryAcquire(Math.max(0, maxWait.toNanos()), TimeUnit.NANOSECONDS)) {
                log.warn("[GPU:{}] {} not granted within {}s, slot busy with {}",
                        slotId, modelClass, maxWait.toSeconds(), slot.residentModel());
                throw new ResidencyUnavailableException(
                        "Slot %s busy for longer than %ds".formatted(slotId, maxWait.toSeconds()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResidencyUnavailableException("Interrupted while waiting for slot " + slotId, e);
        }

        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - waitStart);
        String targetModel = models.modelFor(modelClass);

        if (slot.holds(modelClass)) {
            if (!slot.swapping()) {
                slot.markResident(modelClass, targetModel, Instant.now());
            }
            log.debug("[GPU:{}] {} already resident (waited {}ms)", slotId, targetModel, waitedMs);
            return new Residency(this, slot, modelClass, targetModel, Instant.now());
        }

        swapOrRelease(slot, targetModel);
        Instant now = Instant.now();
        slot.markResident(modelClass, targetModel, now);
        return new Residency(this, slot, modelClass, targetModel, now);
    }

    /**
     * Runs the swap under the swap budget. Called with the permit held; on any
     * failure the permit is released before the exception leaves.
     */
    private void swapOrRelease(ModelSlot slot, String targetModel) {
        List<String> evict = new ArrayList<>(slot.possiblyLoaded());
        evict.remove(targetModel);
        log.info("[GPU:{}] Swap {} → {}", slot.id(), evict.isEmpty() ? "(none)" : evict, targetModel);
        long start = System.nanoTime();

        Future<?> swap = swapExecutor.submit(() -> {
            swapper.swap(slot, List.copyOf(evict), targetModel);
            return null;
        });
        try {
            swap.get(swapTimeout.toNanos(), TimeUnit.NANOSECONDS);
            log.info("[GPU:{}] Swap to {} done in {}ms", slot.id(), targetModel,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        } catch (TimeoutException e) {
            swap.cancel(true);
            abandon(slot, targetModel);
            log.warn("[GPU:{}] Swap to {} exceeded {}s", slot.id(), targetModel, swapTimeout.toSeconds());
            throw new SwapTimeoutException(slot.id(), targetModel, swapTimeout);
        } catch (InterruptedException e) {
            swap.cancel(true);
            abandon(slot, targetModel);
            Thread.currentThread().interrupt();
            throw new ResidencyUnavailableException("Interrupted during swap on slot " + slot.id(), e);
        } catch (ExecutionException e) {
            abandon(slot, targetModel);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[GPU:{}] Swap to {} failed: {}", slot.id(), targetModel, cause.getMessage());
            throw new ResidencyUnavailableException(
                    "Loading %s on slot %s failed: %s".formatted(targetModel, slot.id(), cause.getMessage()), cause);
        }
    }

    private void abandon(ModelSlot slot, String targetModel) {
        slot.markAbandoned(targetModel);
        slot.owner().release();
    }

    // ── Release ──────────────────────────────────────────────────────────────

    /** Returns the slot to idle without unloading. Safe to call more than once. */
    public void release(Residency residency) {
        if (residency == null || !residency.markReleased()) {
            return;
        }
        ModelSlot slot = residency.slot();
        long heldMs = Duration.between(residency.acquiredAt(), Instant.now()).toMillis();
        slot.owner().release();
        log.debug("[GPU:{}] Released {} after {}ms", slot.id(), residency.modelId(), heldMs);
    }

    // ── Introspection ────────────────────────────────────────────────────────

    public Collection<ModelSlot> slots() {
        return slots.values();
    }

    public ModelSlot slotFor(ModelClass modelClass) {
        return slots.values().stream()
                .filter(s -> s.hosts(modelClass))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No slot hosts " + modelClass));
    }
}
