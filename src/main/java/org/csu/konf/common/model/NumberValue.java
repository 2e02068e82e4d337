package org.csu.konf.common.model;

public record NumberValue(double value) implements ConfigValue {

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
