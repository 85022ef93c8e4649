package com.github.nlayna.transferengine.model;

/**
 * Point-in-time view of the scheduler: queue depth, running transfers and the network gate.
 */
public record SchedulerState(int queuedTasks,
                             int activeTasks,
                             int maxConcurrentTasks,
                             NetworkClass networkClass,
                             boolean networkUsable) {

    public boolean hasCapacity() {
        return activeTasks < maxConcurrentTasks;
    }

    public boolean isIdle() {
        return queuedTasks == 0 && activeTasks == 0;
    }
}
