package com.eyelevel.mediamigrator.model;

public enum RunStatus {
    RUNNING,
    PAUSED_FOR_RETRIES,
    STOPPING,
    STOPPED,
    COMPLETED;

    public boolean isActive() {
        return this == RUNNING || this == PAUSED_FOR_RETRIES || this == STOPPING;
    }
}
