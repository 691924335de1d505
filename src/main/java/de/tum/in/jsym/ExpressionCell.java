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
 * The immutable node behind an {@link Expression}. The hash is computed once at construction
 * from the kind and the children; structurally equal cells always have the same hash.
 */
abstract class ExpressionCell {
    private final ExpressionKind kind;
    private final int hash;

    ExpressionCell(ExpressionKind kind, int hash) {
        this.kind = kind;
        this.hash = HashUtil.combine(kind.ordinal(), hash);
    }

    final ExpressionKind kind() {
        return kind;
    }

    final int hash() {
        return hash;
    }

    abstract Variables variables();

    /**
     * Structural comparison with a cell of the same kind.
     */
    abstract boolean equalTo(ExpressionCell cell);

    abstract double evaluate(Environment environment);

    abstract void display(StringBuilder builder);

    static double apply(ExpressionKind kind, double value) {
        switch (kind) {
            case NEG:
                return -value;
            case LOG:
                Util.checkDomain(value >= 0.0, "log(%s): argument must be non-negative", value);
                return Math.log(value);
            case ABS:
                return Math.abs(value);
            case EXP:
                return Math.exp(value);
            case SQRT:
                Util.checkDomain(value >= 0.0, "sqrt(%s): argument must be non-negative", value);
                return Math.sqrt(value);
            case SIN:
                return Math.sin(value);
            case COS:
                return Math.cos(value);
            case TAN:
                return Math.tan(value);
            case ASIN:
                Util.checkDomain(value >= -1.0 && value <= 1.0, "asin(%s): argument must be in [-1, 1]", value);
                return Math.asin(value);
            case ACOS:
                Util.checkDomain(value >= -1.0 && value <= 1.0, "acos(%s): argument must be in [-1, 1]", value);
                return Math.acos(value);
            case ATAN:
                return Math.atan(value);
            case SINH:
                return Math.sinh(value);
            case COSH:
                return Math.cosh(value);
            case TANH:
                return Math.tanh(value);
            default:
                throw new IllegalArgumentException("Not a unary operation: " + kind);
        }
    }

    static double apply(ExpressionKind kind, double left, double right) {
        switch (kind) {
            case ADD:
                return left + right;
            case SUB:
                return left - right;
            case MUL:
                return left * right;
            case DIV:
                Util.checkDomain(right != 0.0, "Division by zero: %s / %s", left, right);
                return left / right;
            case POW:
                Util.checkDomain(
                        !(Double.isFinite(left) && left < 0.0 && Double.isFinite(right) && right != Math.rint(right)),
                        "pow(%s, %s): negative base requires an integral exponent",
                        left,
                        right);
                return Math.pow(left, right);
            case ATAN2:
                return Math.atan2(left, right);
            case MIN:
                return Math.min(left, right);
            case MAX:
                return Math.max(left, right);
            default:
                throw new IllegalArgumentException("Not a binary operation: " + kind);
        }
    }

    static final class Constant extends ExpressionCell {
        final double value;

        Constant(double value) {
            super(ExpressionKind.CONSTANT, HashUtil.hash(value));
            this.value = value;
        }

        @Override
        Variables variables() {
            return new Variables();
        }

        @Override
        boolean equalTo(ExpressionCell cell) {
            // Double.compare agrees with Double.hashCode on -0.0 and NaN, == does not.
            return Double.compare(value, ((Constant) cell).value) == 0;
        }

        @Override
        double evaluate(Environment environment) {
            return value;
        }

        @Override
        void display(StringBuilder builder) {
            if (value == Math.rint(value) && Math.abs(value) < 1.0e15) {
                builder.append((long) value);
            } else {
                builder.append(value);
            }
        }
    }

    static final class Var extends ExpressionCell {
        final Variable variable;

        Var(Variable variable) {
            super(ExpressionKind.VAR, variable.hashCode());
            this.variable = variable;
        }

        @Override
        Variables variables() {
            return Variables.of(variable);
        }

        @Override
        boolean equalTo(ExpressionCell cell) {
            return variable.equals(((Var) cell).variable);
        }

        @Override
        double evaluate(Environment environment) {
            return environment.get(variable);
        }

        @Override
        void display(StringBuilder builder) {
            builder.append(variable.name());
        }
    }

    static final class Unary extends ExpressionCell {
        final Expression operand;

        Unary(ExpressionKind kind, Expression operand) {
            super(kind, operand.hashCode());
            assert kind.notation == ExpressionKind.Notation.PREFIX
                    || kind.notation == ExpressionKind.Notation.FUNCTION;
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        Variables variables() {
            return operand.variables();
        }

        @Override
        boolean equalTo(ExpressionCell cell) {
            return operand.equalTo(((Unary) cell).operand);
        }

        @Override
        double evaluate(Environment environment) {
            return apply(kind(), operand.evaluate(environment));
        }

        @Override
        void display(StringBuilder builder) {
            builder.append(kind().symbol).append('(');
            operand.display(builder);
            builder.append(')');
        }
    }

    static final class Binary extends ExpressionCell {
        final Expression left;
        final Expression right;

        Binary(ExpressionKind kind, Expression left, Expression right) {
            super(kind, HashUtil.combine(left.hashCode(), right.hashCode()));
            assert kind.notation == ExpressionKind.Notation.INFIX
                    || kind.notation == ExpressionKind.Notation.FUNCTION;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override
        Variables variables() {
            Variables variables = left.variables();
            variables.insertAll(right.variables());
            return variables;
        }

        @Override
        boolean equalTo(ExpressionCell cell) {
            Binary that = (Binary) cell;
            return left.equalTo(that.left) && right.equalTo(that.right);
        }

        @Override
        double evaluate(Environment environment) {
            return apply(kind(), left.evaluate(environment), right.evaluate(environment));
        }

        @Override
        void display(StringBuilder builder) {
            if (kind().notation == ExpressionKind.Notation.INFIX) {
                builder.append('(');
                left.display(builder);
                builder.append(' ').append(kind().symbol).append(' ');
                right.display(builder);
                builder.append(')');
            } else {
                builder.append(kind().symbol).append('(');
                left.display(builder);
                builder.append(", ");
                right.display(builder);
                builder.append(')');
            }
        }
    }
}
