package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Shift {
    String from;
    String to;
    @Singular(value = "shiftBreak", ignoreNullCollections = true)
    List<Break> breaks;
}
