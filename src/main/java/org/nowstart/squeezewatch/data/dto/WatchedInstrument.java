package org.nowstart.squeezewatch.data.dto;

public record WatchedInstrument(
        String market,
        String displayName
) {

    public String label() {
        return displayName == null || displayName.isBlank() ? market : displayName;
    }
}
