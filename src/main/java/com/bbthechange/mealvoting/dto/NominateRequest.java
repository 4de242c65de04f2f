package com.bbthechange.mealvoting.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class NominateRequest {

    @NotBlank(message = "Nomination text is required")
    @Size(max = 200, message = "Nomination text cannot exceed 200 characters")
    private String text;

    @NotBlank(message = "Owner is required")
    private String owner;

    public NominateRequest() {}

    public NominateRequest(String text, String owner) {
        this.text = text;
        this.owner = owner;
    }
}
