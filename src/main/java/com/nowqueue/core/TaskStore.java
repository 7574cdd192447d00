package com.nowqueue.core;

import java.time.Instant;

/**
 * Source of task snapshots. Implemented outside the engine; the engine only reads
 * from it and never writes back.
 */
public interface TaskStore {

    /**
     * Take an immutable point-in-time snapshot of all tasks.
     *
     * @param asOf Reference instant recorded on the snapshot
     * @return Snapshot that is unaffected by later store mutations
     */
    TaskSnapshot snapshot(Instant asOf);
}
