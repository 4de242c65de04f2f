package com.bbthechange.mealvoting.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantsDTO {
    private List<ParticipantEntry> participants;
    private int count;
}
