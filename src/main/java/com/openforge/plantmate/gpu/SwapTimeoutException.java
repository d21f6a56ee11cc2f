package com.openforge.plantmate.gpu;

import java.time.Duration;

/**
 * Unloading the resident model and loading the requested one took longer than
 * the swap budget. The slot is left with no known resident model.
 */
public class SwapTimeoutException extends ResidencyUnavailableException {

    public SwapTimeoutException(String slotId, String targetModel, Duration budget) {
        super("Swap to %s on slot %s exceeded %ds".formatted(targetModel, slotId, budget.toSeconds()));
    }
}
