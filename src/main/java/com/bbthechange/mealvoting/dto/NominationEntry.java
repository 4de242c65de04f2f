package com.bbthechange.mealvoting.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NominationEntry {
    private String nominationId;
    private String userId;
    private String text;
}
