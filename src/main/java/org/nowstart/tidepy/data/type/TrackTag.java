package org.nowstart.tidepy.data.type;

public enum TrackTag {
    DEFI,
    MEME,
    INFRA,
    OTHER
}
