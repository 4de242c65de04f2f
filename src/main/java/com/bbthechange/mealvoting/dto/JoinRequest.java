package com.bbthechange.mealvoting.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for joining a poll under a display name.
 */
@Data
public class JoinRequest {

    @NotBlank(message = "Display name is required")
    private String name;

    @NotBlank(message = "Owner is required")
    private String owner;

    public JoinRequest() {}

    public JoinRequest(String name, String owner) {
        this.name = name;
        this.owner = owner;
    }
}
