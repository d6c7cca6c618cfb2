package com.xksgroup.streamarchiver.config;

/**
 * A resettable flag that background loops wait on to learn that the configuration changed.
 * Starts out set so that the first wait returns immediately.
 */
public class ConfigChangeSignal {

    private boolean set = true;

    public synchronized void set() {
        set = true;
        notifyAll();
    }

    public synchronized void clear() {
        set = false;
    }

    public synchronized boolean isSet() {
        return set;
    }

    /**
     * Blocks until the flag is set. Does not clear it.
     */
    public synchronized void await() throws InterruptedException {
        while (!set) {
            wait();
        }
    }
}
