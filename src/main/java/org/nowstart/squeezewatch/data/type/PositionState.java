package org.nowstart.squeezewatch.data.type;

public enum PositionState {
    FLAT,
    HALF,
    FULL
}
