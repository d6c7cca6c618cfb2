package com.xksgroup.streamarchiver.service.notification;

/**
 * Delivers short human-readable notices to whichever targets subscribed to their tag.
 * Implementations must not block the caller or throw on delivery failure.
 */
public interface Notifier {

    /**
     * @param title may be {@code null}
     */
    void notify(String title, String body, String tag);
}
