package com.fabtrack.api.project.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateProjectStatusRequest(
    @NotBlank(message = "Status is required") String status
) {
}
