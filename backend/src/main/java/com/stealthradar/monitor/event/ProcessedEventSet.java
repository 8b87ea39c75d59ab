package com.stealthradar.monitor.event;

import com.stealthradar.domain.EventIdentity;

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Bounded, insertion-ordered set of event identities already processed. Shared by all chain loops; identities
 * embed the chain id so one set covers every chain. Compaction only ever drops the oldest entries.
 */
public class ProcessedEventSet {

    private final LinkedHashSet<EventIdentity> identities = new LinkedHashSet<>();
    private final int ceiling;

    public ProcessedEventSet(int ceiling) {
        if (ceiling < 2) {
            throw new IllegalArgumentException("ceiling must be at least 2");
        }
        this.ceiling = ceiling;
    }

    /**
     * Inserts the identity if absent.
     *
     * @return true if the identity was new
     */
    public synchronized boolean add(EventIdentity identity) {
        return identities.add(identity);
    }

    public synchronized boolean contains(EventIdentity identity) {
        return identities.contains(identity);
    }

    public synchronized int size() {
        return identities.size();
    }

    public int getCeiling() {
        return ceiling;
    }

    /**
     * When the set holds more than the ceiling, keeps only the newest {@code ceiling / 2} identities.
     *
     * @return number of evicted identities (0 when under the ceiling)
     */
    public synchronized int cleanup() {
        int size = identities.size();
        if (size <= ceiling) {
            return 0;
        }
        int evict = size - ceiling / 2;
        Iterator<EventIdentity> it = identities.iterator();
        for (int i = 0; i < evict; i++) {
            it.next();
            it.remove();
        }
        return evict;
    }
}
