package com.phillippitts.transcodeguard.service.monitor;

import com.phillippitts.transcodeguard.domain.ResourceSnapshot;

/**
 * Receives each snapshot produced by a scheduled poll, on the monitor's polling thread.
 * Implementations should return quickly.
 */
@FunctionalInterface
public interface SnapshotListener {

    void onSnapshot(ResourceSnapshot snapshot);
}
