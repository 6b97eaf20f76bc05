package com.geometry.deduction.constraint;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Unknown;
import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.registry.RegisteredObject;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A registered algebraic residual that must equal zero.
 *
 * <p>Expressions are never changed in place. Substitution produces a successor and
 * retires the original, so reading through an old handle returns the successor's
 * current residual and state.</p>
 */
public class Expression extends RegisteredObject {

    private final Polynomial polynomial;
    private final Expression predecessor;
    private final Map<Unknown, Polynomial> substitutions;
    private ExpressionState state;

    Expression(String key, Polynomial polynomial, ExpressionState state,
               Expression predecessor, Map<Unknown, Polynomial> substitutions) {
        super(key);
        this.polynomial = Objects.requireNonNull(polynomial, "polynomial is required");
        this.state = Objects.requireNonNull(state, "state is required");
        this.predecessor = predecessor;
        this.substitutions = substitutions == null ? Map.of() : Map.copyOf(substitutions);
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.EXPRESSION;
    }

    public Polynomial getPolynomial() {
        return self().polynomial;
    }

    public ExpressionState getState() {
        return self().state;
    }

    /** The expression this one was derived from by substitution, if any. */
    public Optional<Expression> getPredecessor() {
        return Optional.ofNullable(self().predecessor);
    }

    /** Bindings that produced this expression from its predecessor. */
    public Map<Unknown, Polynomial> getSubstitutions() {
        return self().substitutions;
    }

    void markContradiction() {
        state = ExpressionState.CONTRADICTION;
    }

    Polynomial rawPolynomial() {
        return polynomial;
    }

    private Expression self() {
        return (Expression) live();
    }

    @Override
    public String toString() {
        Expression live = self();
        return "Expression(" + live.getKey() + ": " + live.polynomial + " = 0, " + live.state + ")";
    }
}
