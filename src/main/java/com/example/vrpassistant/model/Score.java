package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Score {
    Boolean feasible;
    Long hardScore;
    Long mediumScore;
    Long softScore;
}
