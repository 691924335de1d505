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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds reproducible pools of random formulas. Every formula is built twice from the same seed, so
 * tests get pairs of structurally equal but separately allocated trees.
 */
public final class FormulaGenerator {
    private static final Logger logger = Logger.getLogger(FormulaGenerator.class.getName());

    private static final double[] VALUES = {-1.0, 0.0, 1.0, 2.0};
    private static final ExpressionKind[] OPERATIONS = {
        ExpressionKind.ADD, ExpressionKind.SUB, ExpressionKind.MUL, ExpressionKind.NEG,
        ExpressionKind.MIN, ExpressionKind.MAX, ExpressionKind.ABS
    };

    private final List<Expression> variableExpressions;

    private FormulaGenerator(List<Variable> variables) {
        List<Expression> expressions = new ArrayList<>(variables.size());
        for (Variable variable : variables) {
            expressions.add(Expression.variable(variable));
        }
        this.variableExpressions = ImmutableList.copyOf(expressions);
    }

    public static Info generate(long seed, int variableCount, int depth, int unaryCount, int binaryCount) {
        logger.log(Level.INFO, "Generating formulas: {0} variables, depth {1}, {2} unary, {3} binary",
                new Object[] {variableCount, depth, unaryCount, binaryCount});

        VariableIdGenerator ids = VariableIdGenerator.create();
        List<Variable> variables = new ArrayList<>(variableCount);
        for (int i = 0; i < variableCount; i++) {
            variables.add(new Variable("x" + i, ids));
        }
        FormulaGenerator generator = new FormulaGenerator(variables);

        Random random = new Random(seed);
        List<UnaryDataPoint> unary = new ArrayList<>(unaryCount);
        for (int i = 0; i < unaryCount; i++) {
            long formulaSeed = random.nextLong();
            Formula formula = generator.formula(new Random(formulaSeed), depth);
            Formula twin = generator.formula(new Random(formulaSeed), depth);
            unary.add(new UnaryDataPoint(formula, twin));
        }

        Collection<BinaryDataPoint> binary = new LinkedHashSet<>();
        for (int i = 0; i < binaryCount; i++) {
            Formula left = unary.get(random.nextInt(unary.size())).formula;
            Formula right = unary.get(random.nextInt(unary.size())).twin;
            binary.add(new BinaryDataPoint(left, right));
        }

        List<Environment> environments = new ArrayList<>();
        fillEnvironments(variables, 0, new LinkedHashMap<>(), environments);

        logger.log(Level.FINE, "Generated {0} environments", environments.size());
        return new Info(variables, unary, binary, environments);
    }

    private static void fillEnvironments(List<Variable> variables, int index, Map<Variable, Double> prefix,
            List<Environment> environments) {
        if (index == variables.size()) {
            environments.add(Environment.fromValues(prefix));
            return;
        }
        Variable variable = variables.get(index);
        for (double value : VALUES) {
            prefix.put(variable, value);
            fillEnvironments(variables, index + 1, prefix, environments);
        }
        prefix.remove(variable);
    }

    Formula formula(Random random, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) {
            int choice = random.nextInt(10);
            if (choice == 0) {
                return Formula.trueFormula();
            }
            if (choice == 1) {
                return Formula.falseFormula();
            }
            return relation(random);
        }
        switch (random.nextInt(3)) {
            case 0:
                return Formula.and(formula(random, depth - 1), formula(random, depth - 1));
            case 1:
                return Formula.or(formula(random, depth - 1), formula(random, depth - 1));
            default:
                return Formula.not(formula(random, depth - 1));
        }
    }

    private Formula relation(Random random) {
        Expression left = expression(random, 2);
        Expression right = expression(random, 2);
        switch (random.nextInt(6)) {
            case 0:
                return Formula.eq(left, right);
            case 1:
                return Formula.neq(left, right);
            case 2:
                return Formula.lt(left, right);
            case 3:
                return Formula.leq(left, right);
            case 4:
                return Formula.gt(left, right);
            default:
                return Formula.geq(left, right);
        }
    }

    Expression expression(Random random, int depth) {
        if (depth == 0 || random.nextInt(3) == 0) {
            if (random.nextInt(3) == 0) {
                return Expression.constant(VALUES[random.nextInt(VALUES.length)]);
            }
            return variableExpressions.get(random.nextInt(variableExpressions.size()));
        }
        ExpressionKind kind = OPERATIONS[random.nextInt(OPERATIONS.length)];
        Expression left = expression(random, depth - 1);
        switch (kind) {
            case ADD:
                return left.add(expression(random, depth - 1));
            case SUB:
                return left.subtract(expression(random, depth - 1));
            case MUL:
                return left.multiply(expression(random, depth - 1));
            case NEG:
                return left.negate();
            case MIN:
                return Expression.min(left, expression(random, depth - 1));
            case MAX:
                return Expression.max(left, expression(random, depth - 1));
            case ABS:
                return Expression.abs(left);
            default:
                throw new IllegalStateException("Unknown operation " + kind);
        }
    }

    public static final class Info {
        public final ImmutableList<Variable> variables;
        public final ImmutableList<UnaryDataPoint> unaryDataPoints;
        public final ImmutableSet<BinaryDataPoint> binaryDataPoints;
        public final ImmutableList<Environment> environments;

        Info(List<Variable> variables, List<UnaryDataPoint> unaryDataPoints,
                Collection<BinaryDataPoint> binaryDataPoints, List<Environment> environments) {
            this.variables = ImmutableList.copyOf(variables);
            this.unaryDataPoints = ImmutableList.copyOf(unaryDataPoints);
            this.binaryDataPoints = ImmutableSet.copyOf(binaryDataPoints);
            this.environments = ImmutableList.copyOf(environments);
        }
    }

    static final class UnaryDataPoint {
        final Formula formula;
        final Formula twin;

        UnaryDataPoint(Formula formula, Formula twin) {
            this.formula = formula;
            this.twin = twin;
        }

        @Override
        public String toString() {
            return formula.toString();
        }
    }

    static final class BinaryDataPoint {
        final Formula left;
        final Formula right;

        BinaryDataPoint(Formula left, Formula right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof BinaryDataPoint)) {
                return false;
            }
            BinaryDataPoint other = (BinaryDataPoint) object;
            return left.equalTo(other.left) && right.equalTo(other.right);
        }

        @Override
        public int hashCode() {
            return 31 * left.hashCode() + right.hashCode();
        }

        @Override
        public String toString() {
            return String.format("%s, %s", left, right);
        }
    }
}
