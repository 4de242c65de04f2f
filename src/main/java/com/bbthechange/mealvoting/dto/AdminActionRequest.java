package com.bbthechange.mealvoting.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for StartVote and ClosePoll.
 */
@Data
public class AdminActionRequest {

    @NotBlank(message = "Owner is required")
    private String owner;

    public AdminActionRequest() {}

    public AdminActionRequest(String owner) {
        this.owner = owner;
    }
}
