package com.bbthechange.mealvoting.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single nomination (e.g. "Pizza Place") and the participant who made it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Nomination {
    private String userId;
    private String text;
}
