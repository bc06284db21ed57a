package com.waterwatch.engine.shift;

import lombok.Value;

import java.time.LocalTime;

/**
 * A named shift that starts at a fixed local time and runs until the next shift starts.
 */
@Value
public class ShiftDefinition {

    String name;

    LocalTime start;
}
