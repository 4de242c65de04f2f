package com.bbthechange.mealvoting.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the final tally.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResultEntry {
    private String nominationId;
    private String nominationText;
    private long score;
}
