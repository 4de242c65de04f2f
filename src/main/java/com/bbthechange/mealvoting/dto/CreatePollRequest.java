package com.bbthechange.mealvoting.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Request DTO for creating a new poll chain.
 */
@Data
public class CreatePollRequest {

    @NotBlank(message = "Poll topic is required")
    @Size(max = 200, message = "Poll topic cannot exceed 200 characters")
    private String topic;

    // Unsigned 32-bit on the wire
    @Min(value = 0, message = "Votes per voter cannot be negative")
    @Max(value = 4294967295L, message = "Votes per voter is too large")
    private long votesPerVoter;

    @NotBlank(message = "Owner is required")
    private String owner;

    public CreatePollRequest() {}

    public CreatePollRequest(String topic, long votesPerVoter, String owner) {
        this.topic = topic;
        this.votesPerVoter = votesPerVoter;
        this.owner = owner;
    }
}
