package com.pickem.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public final class ChannelRequests {

    private ChannelRequests() {
    }

    public record UpsertChannelRequest(
            @NotBlank(message = "name is required")
            @Size(max = 100, message = "name must be at most 100 characters")
            String name,

            Long roleId,

            @NotNull(message = "active is required")
            Boolean active,

            Boolean deleteResultMessage
    ) {
        public boolean resolvedDeleteResultMessage() {
            return deleteResultMessage == null || deleteResultMessage;
        }
    }

    public record SetScalingRequest(
            @NotNull(message = "factor is required")
            @Min(value = 0, message = "factor must be non-negative")
            @Max(value = 100, message = "factor must be at most 100")
            Integer factor
    ) {
    }
}
