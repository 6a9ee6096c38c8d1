package com.z254.butterfly.drift.notify;

import com.z254.butterfly.drift.domain.model.Change;

/**
 * Downstream channel told about committed changes.
 */
public interface ChangeNotifier {

    String name();

    /**
     * Notify about a committed change.
     *
     * @throws NotificationException when the channel rejects or cannot be reached
     */
    void post(Change change);
}
