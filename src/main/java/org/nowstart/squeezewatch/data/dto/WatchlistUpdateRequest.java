package org.nowstart.squeezewatch.data.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record WatchlistUpdateRequest(
        @NotEmpty(message = "markets must not be empty") List<String> markets
) {
}
