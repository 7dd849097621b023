package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Break {
    String type; // WINDOWED, DRIVE, UNAVAILABILITY
    String from;
    String to;
    Integer duration;
}
