package com.geometry.deduction.driver;

import com.geometry.deduction.construction.ConstructionLayer;

/**
 * A construction that only adds entities implied by ones already registered.
 * Run once, before the first target is derived.
 */
public interface TypeOneConstruction {

    String name();

    void apply(ConstructionLayer layer);
}
