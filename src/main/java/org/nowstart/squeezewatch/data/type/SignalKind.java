package org.nowstart.squeezewatch.data.type;

public enum SignalKind {
    BUY,
    SELL_50,
    SELL_ALL
}
