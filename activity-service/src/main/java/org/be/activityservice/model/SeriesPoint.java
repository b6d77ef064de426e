package org.be.activityservice.model;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class SeriesPoint {
    LocalDateTime timestamp;
    double value;
}
