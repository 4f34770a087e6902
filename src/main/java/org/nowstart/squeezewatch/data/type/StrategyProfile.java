package org.nowstart.squeezewatch.data.type;

public enum StrategyProfile {
    CONSERVATIVE(70.0, 0.80, 0.10),
    BALANCED(65.0, 0.75, 0.15),
    AGGRESSIVE(60.0, 0.70, 0.20);

    private final double rsiOverbought;
    private final double sell50Threshold;
    private final double sellAllThreshold;

    StrategyProfile(double rsiOverbought, double sell50Threshold, double sellAllThreshold) {
        this.rsiOverbought = rsiOverbought;
        this.sell50Threshold = sell50Threshold;
        this.sellAllThreshold = sellAllThreshold;
    }

    public double rsiOverbought() {
        return rsiOverbought;
    }

    public double sell50Threshold() {
        return sell50Threshold;
    }

    public double sellAllThreshold() {
        return sellAllThreshold;
    }
}
