package org.be.activityservice.model;

import lombok.Value;

@Value
public class ActivityState {
    String name;
    int index;
}
