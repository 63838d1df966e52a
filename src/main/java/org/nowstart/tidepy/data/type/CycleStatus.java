package org.nowstart.tidepy.data.type;

public enum CycleStatus {
    COMPLETED,
    ABORTED,
    SKIPPED
}
