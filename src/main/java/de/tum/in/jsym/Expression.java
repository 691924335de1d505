/*
 * This file is part of JSym.
 * Copyright (c) 2026 The JSym authors.
 *
 * JSym is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JSym is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JSym. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jsym;

import java.util.Objects;

/**
 * An immutable arithmetic term. Instances share their children, so building large expressions from
 * smaller ones does not copy anything.
 *
 * <p>Equality is structural: two expressions are equal if they have the same shape, the same
 * constants and the same variables (by identity). Semantically equivalent but differently built
 * expressions, such as {@code x + y} and {@code y + x}, are not equal.</p>
 *
 * <p>A few trivial cases are simplified at construction, e.g. {@code x + 0} yields {@code x} and
 * operations on constants are folded.</p>
 */
public final class Expression {
    private static final Expression ZERO = new Expression(new ExpressionCell.Constant(0.0));
    private static final Expression ONE = new Expression(new ExpressionCell.Constant(1.0));

    private final ExpressionCell cell;

    private Expression(ExpressionCell cell) {
        this.cell = Objects.requireNonNull(cell);
    }

    public static Expression zero() {
        return ZERO;
    }

    public static Expression one() {
        return ONE;
    }

    public static Expression constant(double value) {
        Util.checkArgument(!Double.isNaN(value), "NaN is not a valid constant");
        if (value == 0.0 && Double.compare(value, 0.0) == 0) {
            return ZERO;
        }
        if (value == 1.0) {
            return ONE;
        }
        return new Expression(new ExpressionCell.Constant(value));
    }

    public static Expression variable(Variable variable) {
        return new Expression(new ExpressionCell.Var(Objects.requireNonNull(variable)));
    }

    public static Expression log(Expression e) {
        return unary(ExpressionKind.LOG, e);
    }

    public static Expression abs(Expression e) {
        return unary(ExpressionKind.ABS, e);
    }

    public static Expression exp(Expression e) {
        return unary(ExpressionKind.EXP, e);
    }

    public static Expression sqrt(Expression e) {
        return unary(ExpressionKind.SQRT, e);
    }

    public static Expression sin(Expression e) {
        return unary(ExpressionKind.SIN, e);
    }

    public static Expression cos(Expression e) {
        return unary(ExpressionKind.COS, e);
    }

    public static Expression tan(Expression e) {
        return unary(ExpressionKind.TAN, e);
    }

    public static Expression asin(Expression e) {
        return unary(ExpressionKind.ASIN, e);
    }

    public static Expression acos(Expression e) {
        return unary(ExpressionKind.ACOS, e);
    }

    public static Expression atan(Expression e) {
        return unary(ExpressionKind.ATAN, e);
    }

    public static Expression sinh(Expression e) {
        return unary(ExpressionKind.SINH, e);
    }

    public static Expression cosh(Expression e) {
        return unary(ExpressionKind.COSH, e);
    }

    public static Expression tanh(Expression e) {
        return unary(ExpressionKind.TANH, e);
    }

    public static Expression pow(Expression base, Expression exponent) {
        if (exponent.isConstant(1.0)) {
            return base;
        }
        return binary(ExpressionKind.POW, base, exponent);
    }

    public static Expression atan2(Expression y, Expression x) {
        return binary(ExpressionKind.ATAN2, y, x);
    }

    public static Expression min(Expression e1, Expression e2) {
        return binary(ExpressionKind.MIN, e1, e2);
    }

    public static Expression max(Expression e1, Expression e2) {
        return binary(ExpressionKind.MAX, e1, e2);
    }

    private static Expression unary(ExpressionKind kind, Expression e) {
        if (e.kind() == ExpressionKind.CONSTANT) {
            double value = ExpressionCell.apply(kind, e.constantValue());
            if (!Double.isNaN(value)) {
                return constant(value);
            }
        }
        return new Expression(new ExpressionCell.Unary(kind, e));
    }

    private static Expression binary(ExpressionKind kind, Expression e1, Expression e2) {
        if (e1.kind() == ExpressionKind.CONSTANT && e2.kind() == ExpressionKind.CONSTANT) {
            double value = ExpressionCell.apply(kind, e1.constantValue(), e2.constantValue());
            // NaN is not a constant, e.g. inf - inf stays a node and evaluates to NaN
            if (!Double.isNaN(value)) {
                return constant(value);
            }
        }
        return new Expression(new ExpressionCell.Binary(kind, e1, e2));
    }

    public Expression add(Expression other) {
        if (isConstant(0.0)) {
            return other;
        }
        if (other.isConstant(0.0)) {
            return this;
        }
        return binary(ExpressionKind.ADD, this, other);
    }

    public Expression add(double other) {
        return add(constant(other));
    }

    public Expression subtract(Expression other) {
        if (other.isConstant(0.0)) {
            return this;
        }
        return binary(ExpressionKind.SUB, this, other);
    }

    public Expression subtract(double other) {
        return subtract(constant(other));
    }

    public Expression multiply(Expression other) {
        if (isConstant(1.0)) {
            return other;
        }
        if (other.isConstant(1.0)) {
            return this;
        }
        if (isConstant(0.0) || other.isConstant(0.0)) {
            return ZERO;
        }
        return binary(ExpressionKind.MUL, this, other);
    }

    public Expression multiply(double other) {
        return multiply(constant(other));
    }

    /**
     * Division. Fails with an {@link ArithmeticException} if {@code other} is the constant zero.
     */
    public Expression divide(Expression other) {
        if (other.isConstant(0.0)) {
            throw new ArithmeticException(String.format("Division by zero: %s / %s", this, other));
        }
        if (other.isConstant(1.0)) {
            return this;
        }
        return binary(ExpressionKind.DIV, this, other);
    }

    public Expression divide(double other) {
        return divide(constant(other));
    }

    public Expression negate() {
        if (kind() == ExpressionKind.NEG) {
            return ((ExpressionCell.Unary) cell).operand;
        }
        return unary(ExpressionKind.NEG, this);
    }

    public Formula eq(Expression other) {
        return Formula.eq(this, other);
    }

    public Formula eq(double other) {
        return Formula.eq(this, other);
    }

    public Formula neq(Expression other) {
        return Formula.neq(this, other);
    }

    public Formula neq(double other) {
        return Formula.neq(this, other);
    }

    public Formula lt(Expression other) {
        return Formula.lt(this, other);
    }

    public Formula lt(double other) {
        return Formula.lt(this, other);
    }

    public Formula leq(Expression other) {
        return Formula.leq(this, other);
    }

    public Formula leq(double other) {
        return Formula.leq(this, other);
    }

    public Formula gt(Expression other) {
        return Formula.gt(this, other);
    }

    public Formula gt(double other) {
        return Formula.gt(this, other);
    }

    public Formula geq(Expression other) {
        return Formula.geq(this, other);
    }

    public Formula geq(double other) {
        return Formula.geq(this, other);
    }

    public ExpressionKind kind() {
        return cell.kind();
    }

    private boolean isConstant(double value) {
        return kind() == ExpressionKind.CONSTANT && constantValue() == value;
    }

    /**
     * Returns the value of a constant expression.
     *
     * @throws IllegalStateException if this expression is not a constant.
     */
    public double constantValue() {
        Util.checkState(kind() == ExpressionKind.CONSTANT, "%s is not a constant", this);
        return ((ExpressionCell.Constant) cell).value;
    }

    /**
     * Returns the variables occurring in this expression. The returned set is a fresh copy.
     */
    public Variables variables() {
        return cell.variables();
    }

    /**
     * Evaluates this expression under the given {@code environment}.
     *
     * @throws IllegalArgumentException if a variable of this expression is not assigned.
     * @throws ArithmeticException if an operation is applied outside of its domain.
     */
    public double evaluate(Environment environment) {
        return cell.evaluate(environment);
    }

    public boolean equalTo(Expression other) {
        if (cell == other.cell) {
            return true;
        }
        if (kind() != other.kind() || hashCode() != other.hashCode()) {
            return false;
        }
        return cell.equalTo(other.cell);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Expression && equalTo((Expression) o));
    }

    @Override
    public int hashCode() {
        return cell.hash();
    }

    void display(StringBuilder builder) {
        cell.display(builder);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        display(builder);
        return builder.toString();
    }
}
