package com.geometry.deduction.driver;

import com.geometry.deduction.measure.MeasurableEntity;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * One way of producing relations that may pin down a target's measure.
 */
public interface DerivationRule {

    String name();

    void apply(MeasurableEntity target);

    static DerivationRule of(String name, Consumer<MeasurableEntity> action) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(action, "action is required");
        return new DerivationRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void apply(MeasurableEntity target) {
                action.accept(target);
            }

            @Override
            public String toString() {
                return "DerivationRule(" + name + ")";
            }
        };
    }
}
