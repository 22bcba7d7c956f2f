package com.qnet.core.alert;

/**
 * Observer notified synchronously for every recorded alert.
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(Alert alert);
}
