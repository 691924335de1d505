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
 * An immutable logical formula over {@link Expression}s.
 *
 * <p>Formulas are built through the static factories of this class, which simplify trivial cases
 * instead of allocating new nodes: {@code e == e} yields {@link #trueFormula()}, {@code tt && f}
 * yields {@code f}, and so on. {@link #trueFormula()} and {@link #falseFormula()} are canonical,
 * i.e. every simplification to a constant returns the very same instance.</p>
 *
 * <p>Equality is structural (see {@link #equalTo(Formula)}) and {@link #hashCode()} is consistent
 * with it. Instances can be shared freely between threads.</p>
 */
public final class Formula {
    private static final Logger logger = Logger.getLogger(Formula.class.getName());

    private static final Formula TRUE = new Formula(new FormulaCell.True());
    private static final Formula FALSE = new Formula(new FormulaCell.False());

    private final FormulaCell cell;

    private Formula(FormulaCell cell) {
        this.cell = Objects.requireNonNull(cell);
    }

    public static Formula trueFormula() {
        return TRUE;
    }

    public static Formula falseFormula() {
        return FALSE;
    }

    public static Formula of(boolean value) {
        return value ? TRUE : FALSE;
    }

    // Relational factories

    public static Formula eq(Expression e1, Expression e2) {
        if (e1.equalTo(e2)) {
            return simplified("E = E", TRUE);
        }
        return relational(FormulaKind.EQ, e1, e2);
    }

    public static Formula eq(double v1, Expression e2) {
        return eq(Expression.constant(v1), e2);
    }

    public static Formula eq(Expression e1, double v2) {
        return eq(e1, Expression.constant(v2));
    }

    public static Formula neq(Expression e1, Expression e2) {
        if (e1.equalTo(e2)) {
            return simplified("E != E", FALSE);
        }
        return relational(FormulaKind.NEQ, e1, e2);
    }

    public static Formula neq(double v1, Expression e2) {
        return neq(Expression.constant(v1), e2);
    }

    public static Formula neq(Expression e1, double v2) {
        return neq(e1, Expression.constant(v2));
    }

    public static Formula lt(Expression e1, Expression e2) {
        if (e1.equalTo(e2)) {
            return simplified("E < E", FALSE);
        }
        return relational(FormulaKind.LT, e1, e2);
    }

    public static Formula lt(double v1, Expression e2) {
        return lt(Expression.constant(v1), e2);
    }

    public static Formula lt(Expression e1, double v2) {
        return lt(e1, Expression.constant(v2));
    }

    public static Formula leq(Expression e1, Expression e2) {
        if (e1.equalTo(e2)) {
            return simplified("E <= E", TRUE);
        }
        return relational(FormulaKind.LEQ, e1, e2);
    }

    public static Formula leq(double v1, Expression e2) {
        return leq(Expression.constant(v1), e2);
    }

    public static Formula leq(Expression e1, double v2) {
        return leq(e1, Expression.constant(v2));
    }

    public static Formula gt(Expression e1, Expression e2) {
        if (e1.equalTo(e2)) {
            return simplified("E > E", FALSE);
        }
        return relational(FormulaKind.GT, e1, e2);
    }

    public static Formula gt(double v1, Expression e2) {
        return gt(Expression.constant(v1), e2);
    }

    public static Formula gt(Expression e1, double v2) {
        return gt(e1, Expression.constant(v2));
    }

    public static Formula geq(Expression e1, Expression e2) {
        if (e1.equalTo(e2)) {
            return simplified("E >= E", TRUE);
        }
        return relational(FormulaKind.GEQ, e1, e2);
    }

    public static Formula geq(double v1, Expression e2) {
        return geq(Expression.constant(v1), e2);
    }

    public static Formula geq(Expression e1, double v2) {
        return geq(e1, Expression.constant(v2));
    }

    private static Formula relational(FormulaKind kind, Expression e1, Expression e2) {
        return new Formula(new FormulaCell.Relational(kind, Objects.requireNonNull(e1), Objects.requireNonNull(e2)));
    }

    // Boolean connectives

    public static Formula and(Formula f1, Formula f2) {
        if (f1.isFalse() || f2.isFalse()) {
            return simplified("ff and f", FALSE);
        }
        if (f1.isTrue()) {
            return simplified("tt and f", f2);
        }
        if (f2.isTrue()) {
            return simplified("f and tt", f1);
        }
        return new Formula(new FormulaCell.And(f1, f2));
    }

    public static Formula or(Formula f1, Formula f2) {
        if (f1.isTrue() || f2.isTrue()) {
            return simplified("tt or f", TRUE);
        }
        if (f1.isFalse()) {
            return simplified("ff or f", f2);
        }
        if (f2.isFalse()) {
            return simplified("f or ff", f1);
        }
        return new Formula(new FormulaCell.Or(f1, f2));
    }

    public static Formula not(Formula f) {
        if (f.isTrue()) {
            return simplified("!tt", FALSE);
        }
        if (f.isFalse()) {
            return simplified("!ff", TRUE);
        }
        return new Formula(new FormulaCell.Not(f));
    }

    /**
     * Universally quantifies {@code f} over {@code variables}. No simplification is applied. Later
     * changes to {@code variables} do not affect the returned formula.
     */
    public static Formula forall(Variables variables, Formula f) {
        return new Formula(new FormulaCell.Forall(Objects.requireNonNull(variables), Objects.requireNonNull(f)));
    }

    private static Formula simplified(String rule, Formula result) {
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "Simplified by {0} to {1}", new Object[] {rule, result});
        }
        return result;
    }

    public Formula and(Formula other) {
        return and(this, other);
    }

    public Formula or(Formula other) {
        return or(this, other);
    }

    public Formula negate() {
        return not(this);
    }

    // Queries

    public FormulaKind kind() {
        return cell.kind();
    }

    public boolean isTrue() {
        return kind() == FormulaKind.TRUE;
    }

    public boolean isFalse() {
        return kind() == FormulaKind.FALSE;
    }

    /**
     * Returns the variables occurring in this formula which are not bound by a quantifier. The
     * returned set is a fresh copy.
     */
    public Variables freeVariables() {
        return cell.freeVariables();
    }

    /**
     * Evaluates this formula under the given {@code environment}.
     *
     * @throws UnsupportedOperationException if the formula contains a quantifier which needs to
     *     be evaluated.
     * @throws IllegalArgumentException if a free variable is not assigned.
     */
    public boolean evaluate(Environment environment) {
        return cell.evaluate(Objects.requireNonNull(environment));
    }

    /**
     * Structural equality. Identical nodes are equal right away, nodes of different kind or hash
     * are rejected without descending, only the remaining candidates are compared child by child.
     */
    public boolean equalTo(Formula other) {
        if (cell == other.cell) {
            return true;
        }
        if (kind() != other.kind()) {
            return false;
        }
        if (hashCode() != other.hashCode()) {
            return false;
        }
        // Same kind and hash, but this may be a collision.
        return cell.equalTo(other.cell);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Formula && equalTo((Formula) o));
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
