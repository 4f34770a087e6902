package org.nowstart.squeezewatch.strategy.core;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.squeezewatch.data.type.SignalKind;

public record SignalSet(
        boolean buy,
        boolean sell50,
        boolean sellAll
) {

    public static final SignalSet NONE = new SignalSet(false, false, false);

    public boolean any() {
        return buy || sell50 || sellAll;
    }

    public boolean has(SignalKind kind) {
        return switch (kind) {
            case BUY -> buy;
            case SELL_50 -> sell50;
            case SELL_ALL -> sellAll;
        };
    }

    public List<SignalKind> active() {
        List<SignalKind> kinds = new ArrayList<>(3);
        for (SignalKind kind : SignalKind.values()) {
            if (has(kind)) {
                kinds.add(kind);
            }
        }
        return kinds;
    }
}
