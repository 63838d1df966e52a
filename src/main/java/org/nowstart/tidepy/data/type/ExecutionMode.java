package org.nowstart.tidepy.data.type;

public enum ExecutionMode {
    LIVE,
    PAPER
}
