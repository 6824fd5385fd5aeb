package com.metallisense.common.model;

/**
 * Inclusive acceptable percentage range for one element of a grade.
 */
public record ElementRange(double min, double max) {

    public ElementRange {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException(
                String.format("Invalid element range [%s, %s]: min must not exceed max", min, max));
        }
    }

    public double midpoint() {
        return (min + max) / 2.0;
    }

    public double halfWidth() {
        return (max - min) / 2.0;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
