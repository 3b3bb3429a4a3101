package com.whereq.orbit.autoscale;

/**
 * Scale rule directions, in resolution order: ZERO wins over DOWN, DOWN over UP
 */
public enum ScaleDirection {
    ZERO,
    DOWN,
    UP
}
