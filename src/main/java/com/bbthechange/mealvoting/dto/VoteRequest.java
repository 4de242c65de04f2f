package com.bbthechange.mealvoting.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * Request DTO for submitting a ranking, first choice first.
 */
@Data
public class VoteRequest {

    @NotNull(message = "Rankings are required")
    private List<@NotBlank(message = "Ranked nomination ids cannot be blank") String> rankings;

    @NotBlank(message = "Owner is required")
    private String owner;

    public VoteRequest() {}

    public VoteRequest(List<String> rankings, String owner) {
        this.rankings = rankings;
        this.owner = owner;
    }
}
