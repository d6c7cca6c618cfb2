package com.xksgroup.streamarchiver.repo;

/**
 * Remembers which video ids were already handled by the feed monitor.
 */
public interface SeenItemStore {

    /**
     * Atomically records {@code id} as seen.
     *
     * @return {@code true} if it had already been seen before this call
     */
    boolean containsOrInsert(String id);

    /**
     * Forgets {@code id} so a later poll may consider it again.
     */
    void remove(String id);
}
