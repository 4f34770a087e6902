package org.nowstart.squeezewatch.data.type;

public enum TradeAction {
    BUY,
    SELL_50,
    SELL_ALL;

    public boolean isSell() {
        return this != BUY;
    }
}
