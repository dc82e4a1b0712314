package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonNumber;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/// JsonNumber implementation class.
///
/// Keeps the literal text and derives numeric views from it on demand.
public final class JsonNumberImpl implements JsonNumber {

    private final String literal;
    private final boolean integral;
    // lazily derived, benign race: every thread computes the same value
    private BigDecimal exact;

    public JsonNumberImpl(String literal) {
        this(literal, null);
    }

    JsonNumberImpl(String literal, BigDecimal exact) {
        this.literal = literal;
        this.integral = literal.indexOf('.') < 0
                && literal.indexOf('e') < 0
                && literal.indexOf('E') < 0;
        this.exact = exact;
    }

    @Override
    public boolean isIntegralLiteral() {
        return integral;
    }

    @Override
    public BigDecimal toBigDecimal() {
        BigDecimal bd = exact;
        if (bd == null) {
            bd = new BigDecimal(literal);
            exact = bd;
        }
        return bd;
    }

    @Override
    public long toLong() {
        try {
            return integral ? Long.parseLong(literal) : toBigDecimal().longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw Utils.composeError(this, this + " cannot be represented as a long.");
        }
    }

    @Override
    public double toDouble() {
        double d = Double.parseDouble(literal);
        if (!Double.isFinite(d)) {
            throw Utils.composeError(this, this + " cannot be represented as a finite double.");
        }
        return d;
    }

    @Override
    public Number toNumber() {
        if (integral) {
            try {
                return Long.parseLong(literal);
            } catch (NumberFormatException e) {
                return new BigInteger(literal);
            }
        }
        double d = Double.parseDouble(literal);
        return Double.isFinite(d) ? (Number) d : toBigDecimal();
    }

    @Override
    public String toString() {
        return literal;
    }

    @Override
    public boolean equals(Object o) {
        return this == o
                || o instanceof JsonNumber ojn && literal.equalsIgnoreCase(ojn.toString());
    }

    @Override
    public int hashCode() {
        return literal.toLowerCase(Locale.ROOT).hashCode();
    }
}
