package org.nowstart.tidepy.data.type;

public enum SignalDirection {
    SHORT
}
