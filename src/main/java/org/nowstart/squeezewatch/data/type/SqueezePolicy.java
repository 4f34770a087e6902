package org.nowstart.squeezewatch.data.type;

public enum SqueezePolicy {
    // 최근 N개 밴드폭 최소값의 배수 미만
    ROLLING_MIN,
    // 최근 lookback 밴드폭 분위수 미만
    QUANTILE
}
