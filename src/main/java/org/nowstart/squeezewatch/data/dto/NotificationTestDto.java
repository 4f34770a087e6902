package org.nowstart.squeezewatch.data.dto;

import java.time.Instant;

public record NotificationTestDto(
        boolean configured,
        boolean delivered,
        Instant sentAt
) {
}
