package com.stealthradar.monitor.event;

import com.stealthradar.domain.EventIdentity;
import com.stealthradar.domain.StealthEvent;

/**
 * Outcome of processing one raw log: a new typed event, or a skip with its reason.
 */
public sealed interface ProcessingResult permits ProcessingResult.Processed, ProcessingResult.Skipped {

    enum SkipReason {
        DUPLICATE,
        MALFORMED,
        UNKNOWN_EVENT
    }

    record Processed(StealthEvent event) implements ProcessingResult {
    }

    /** {@code identity} is null when the log had no usable identity. */
    record Skipped(EventIdentity identity, SkipReason reason, String detail) implements ProcessingResult {
    }
}
