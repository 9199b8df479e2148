package com.murmur.eventbus.publish;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks keyed by aggregate id. Held for an append and the dispatch queue bookkeeping
 * only, never while listeners run.
 */
final class AggregateLocks {

    private final ReentrantLock[] stripes;

    AggregateLocks(int stripeCount) {
        if (stripeCount < 1 || Integer.bitCount(stripeCount) != 1) {
            throw new IllegalArgumentException("stripeCount must be a positive power of two");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    <T> T withLock(String aggregateId, Supplier<T> work) {
        ReentrantLock lock = stripeFor(aggregateId);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String aggregateId) {
        int hash = aggregateId.hashCode();
        hash ^= (hash >>> 16);
        return stripes[hash & (stripes.length - 1)];
    }
}
