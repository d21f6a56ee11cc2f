package com.openforge.plantmate.gpu;

import java.io.IOException;
import java.util.List;

/**
 * The external call that replaces the model held by a slot.
 * Implementations may block for a long time; the scheduler bounds them.
 */
public interface ModelSwapper {

    /**
     * @param evictModels models to unload first, oldest first; empty when nothing is known to be loaded
     * @param targetModel model to load and keep resident
     */
    void swap(ModelSlot slot, List<String> evictModels, String targetModel) throws IOException, InterruptedException;
}
