package com.largomodo.ramanfit.core.domain;

import java.util.Locale;
import java.util.function.DoubleUnaryOperator;

/**
 * A ledger value: a number, "not applicable", or an iteration count that hit its cap.
 * <p>
 * Replaces the string sentinels {@code na} and {@code >500} with explicit variants.
 * Non-finite numbers (zero-height divisions and the like) are never wrapped as
 * {@link Value}; {@link #of(double)} turns them into {@link NotApplicable}.
 */
public interface ReportedValue {

    /**
     * Wraps a number, mapping NaN and infinities to {@link NotApplicable}.
     */
    static ReportedValue of(double value) {
        return Double.isFinite(value) ? new Value(value) : NotApplicable.INSTANCE;
    }

    static ReportedValue notApplicable() {
        return NotApplicable.INSTANCE;
    }

    static ReportedValue exceededCap(int cap) {
        return new ExceededCap(cap);
    }

    /**
     * {@code numerator / denominator}, or {@link NotApplicable} when the quotient is undefined.
     */
    static ReportedValue ratio(double numerator, double denominator) {
        if (denominator == 0) {
            return NotApplicable.INSTANCE;
        }
        return of(numerator / denominator);
    }

    /**
     * True only for {@link Value}.
     */
    boolean isPresent();

    /**
     * Numeric content of a {@link Value}.
     *
     * @throws IllegalStateException for the other variants
     */
    double asDouble();

    /**
     * Applies {@code op} to a present value; other variants pass through unchanged.
     */
    ReportedValue map(DoubleUnaryOperator op);

    /**
     * Ledger text for this value.
     */
    String render();

    record Value(double value) implements ReportedValue {

        public Value {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Reported value must be finite, got: " + value);
            }
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public ReportedValue map(DoubleUnaryOperator op) {
            return of(op.applyAsDouble(value));
        }

        @Override
        public String render() {
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return String.format(Locale.ROOT, "%.5f", value);
        }
    }

    record NotApplicable() implements ReportedValue {

        static final NotApplicable INSTANCE = new NotApplicable();

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public double asDouble() {
            throw new IllegalStateException("Value is not applicable");
        }

        @Override
        public ReportedValue map(DoubleUnaryOperator op) {
            return this;
        }

        @Override
        public String render() {
            return "na";
        }
    }

    /**
     * Iteration count of a fit that stopped at its cap without converging.
     */
    record ExceededCap(int cap) implements ReportedValue {

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public double asDouble() {
            throw new IllegalStateException("Iteration cap of " + cap + " exceeded");
        }

        @Override
        public ReportedValue map(DoubleUnaryOperator op) {
            return this;
        }

        @Override
        public String render() {
            return ">" + cap;
        }
    }
}
