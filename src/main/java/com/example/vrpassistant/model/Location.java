package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Location {
    Double latitude;
    Double longitude;
    String address;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
