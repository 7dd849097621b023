package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TimeWindow {
    String from;
    String to;
}
