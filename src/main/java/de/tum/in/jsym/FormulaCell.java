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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The immutable node behind a {@link Formula}.
 *
 * <p>Every kind implements the same four traversals: structural comparison, evaluation, free
 * variable extraction and display. A new kind has to provide all of them.</p>
 */
abstract class FormulaCell {
    private final FormulaKind kind;
    private final int hash;

    FormulaCell(FormulaKind kind, int hash) {
        this.kind = kind;
        this.hash = HashUtil.combine(kind.ordinal(), hash);
    }

    final FormulaKind kind() {
        return kind;
    }

    final int hash() {
        return hash;
    }

    abstract Variables freeVariables();

    /**
     * Structural comparison. Only called with a cell of the same kind, hence implementations may
     * cast {@code cell} to their own type.
     */
    abstract boolean equalTo(FormulaCell cell);

    abstract boolean evaluate(Environment environment);

    abstract void display(StringBuilder builder);

    static final class True extends FormulaCell {
        True() {
            super(FormulaKind.TRUE, "True".hashCode());
        }

        @Override
        Variables freeVariables() {
            return new Variables();
        }

        @Override
        boolean equalTo(FormulaCell cell) {
            return kind() == cell.kind();
        }

        @Override
        boolean evaluate(Environment environment) {
            return true;
        }

        @Override
        void display(StringBuilder builder) {
            builder.append("True");
        }
    }

    static final class False extends FormulaCell {
        False() {
            super(FormulaKind.FALSE, "False".hashCode());
        }

        @Override
        Variables freeVariables() {
            return new Variables();
        }

        @Override
        boolean equalTo(FormulaCell cell) {
            return kind() == cell.kind();
        }

        @Override
        boolean evaluate(Environment environment) {
            return false;
        }

        @Override
        void display(StringBuilder builder) {
            builder.append("False");
        }
    }

    /**
     * A comparison {@code left op right} of two expressions.
     */
    static final class Relational extends FormulaCell {
        final Expression left;
        final Expression right;

        Relational(FormulaKind kind, Expression left, Expression right) {
            super(kind, HashUtil.combine(left.hashCode(), right.hashCode()));
            assert kind.isRelational();
            this.left = left;
            this.right = right;
        }

        @Override
        Variables freeVariables() {
            Variables variables = left.variables();
            variables.insertAll(right.variables());
            return variables;
        }

        @Override
        boolean equalTo(FormulaCell cell) {
            Relational that = (Relational) cell;
            return left.equalTo(that.left) && right.equalTo(that.right);
        }

        @Override
        boolean evaluate(Environment environment) {
            double leftValue = left.evaluate(environment);
            double rightValue = right.evaluate(environment);
            switch (kind()) {
                case EQ:
                    return leftValue == rightValue;
                case NEQ:
                    return leftValue != rightValue;
                case GT:
                    return leftValue > rightValue;
                case GEQ:
                    return leftValue >= rightValue;
                case LT:
                    return leftValue < rightValue;
                case LEQ:
                    return leftValue <= rightValue;
                default:
                    throw new IllegalStateException("Unknown relation " + kind());
            }
        }

        @Override
        void display(StringBuilder builder) {
            builder.append('(');
            left.display(builder);
            builder.append(' ').append(symbol(kind())).append(' ');
            right.display(builder);
            builder.append(')');
        }

        private static String symbol(FormulaKind kind) {
            switch (kind) {
                case EQ:
                    return "=";
                case NEQ:
                    return "!=";
                case GT:
                    return ">";
                case GEQ:
                    return ">=";
                case LT:
                    return "<";
                case LEQ:
                    return "<=";
                default:
                    throw new IllegalStateException("Unknown relation " + kind);
            }
        }
    }

    static final class And extends FormulaCell {
        final Formula left;
        final Formula right;

        And(Formula left, Formula right) {
            super(FormulaKind.AND, HashUtil.combine(left.hashCode(), right.hashCode()));
            this.left = left;
            this.right = right;
        }

        @Override
        Variables freeVariables() {
            Variables variables = left.freeVariables();
            variables.insertAll(right.freeVariables());
            return variables;
        }

        @Override
        boolean equalTo(FormulaCell cell) {
            And that = (And) cell;
            return left.equalTo(that.left) && right.equalTo(that.right);
        }

        @Override
        boolean evaluate(Environment environment) {
            return left.evaluate(environment) && right.evaluate(environment);
        }

        @Override
        void display(StringBuilder builder) {
            builder.append('(');
            left.display(builder);
            builder.append(" and ");
            right.display(builder);
            builder.append(')');
        }
    }

    static final class Or extends FormulaCell {
        final Formula left;
        final Formula right;

        Or(Formula left, Formula right) {
            super(FormulaKind.OR, HashUtil.combine(left.hashCode(), right.hashCode()));
            this.left = left;
            this.right = right;
        }

        @Override
        Variables freeVariables() {
            Variables variables = left.freeVariables();
            variables.insertAll(right.freeVariables());
            return variables;
        }

        @Override
        boolean equalTo(FormulaCell cell) {
            Or that = (Or) cell;
            return left.equalTo(that.left) && right.equalTo(that.right);
        }

        @Override
        boolean evaluate(Environment environment) {
            return left.evaluate(environment) || right.evaluate(environment);
        }

        @Override
        void display(StringBuilder builder) {
            builder.append('(');
            left.display(builder);
            builder.append(" or ");
            right.display(builder);
            builder.append(')');
        }
    }

    static final class Not extends FormulaCell {
        final Formula operand;

        Not(Formula operand) {
            super(FormulaKind.NOT, operand.hashCode());
            this.operand = operand;
        }

        @Override
        Variables freeVariables() {
            return operand.freeVariables();
        }

        @Override
        boolean equalTo(FormulaCell cell) {
            return operand.equalTo(((Not) cell).operand);
        }

        @Override
        boolean evaluate(Environment environment) {
            return !operand.evaluate(environment);
        }

        @Override
        void display(StringBuilder builder) {
            builder.append("!(");
            operand.display(builder);
            builder.append(')');
        }
    }

    static final class Forall extends FormulaCell {
        private static final Logger logger = Logger.getLogger(Forall.class.getName());

        // Private copy, never handed out.
        private final Variables boundVariables;
        final Formula body;

        Forall(Variables boundVariables, Formula body) {
            this(Variables.copyOf(boundVariables), body, boundVariables.hashCode());
        }

        private Forall(Variables boundVariables, Formula body, int variablesHash) {
            super(FormulaKind.FORALL, HashUtil.combine(variablesHash, body.hashCode()));
            this.boundVariables = boundVariables;
            this.body = Objects.requireNonNull(body);
        }

        Variables boundVariables() {
            return Variables.copyOf(boundVariables);
        }

        @Override
        Variables freeVariables() {
            return body.freeVariables().minus(boundVariables);
        }

        @Override
        boolean equalTo(FormulaCell cell) {
            Forall that = (Forall) cell;
            return boundVariables.equals(that.boundVariables) && body.equalTo(that.body);
        }

        @Override
        boolean evaluate(Environment environment) {
            // Would amount to deciding that no assignment of the bound variables satisfies the
            // negated body, which needs a satisfiability check this kernel does not have.
            StringBuilder builder = new StringBuilder();
            display(builder);
            logger.log(Level.FINE, "Refusing to evaluate quantified formula {0}", builder);
            throw new UnsupportedOperationException("Not implemented yet: evaluation of " + builder);
        }

        @Override
        void display(StringBuilder builder) {
            builder.append("forall(").append(boundVariables).append(". ");
            body.display(builder);
            builder.append(')');
        }
    }
}
