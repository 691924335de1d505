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

public enum ExpressionKind {
    CONSTANT(Notation.LEAF, ""),
    VAR(Notation.LEAF, ""),
    NEG(Notation.PREFIX, "-"),
    ADD(Notation.INFIX, "+"),
    SUB(Notation.INFIX, "-"),
    MUL(Notation.INFIX, "*"),
    DIV(Notation.INFIX, "/"),
    POW(Notation.FUNCTION, "pow"),
    ATAN2(Notation.FUNCTION, "atan2"),
    MIN(Notation.FUNCTION, "min"),
    MAX(Notation.FUNCTION, "max"),
    LOG(Notation.FUNCTION, "log"),
    ABS(Notation.FUNCTION, "abs"),
    EXP(Notation.FUNCTION, "exp"),
    SQRT(Notation.FUNCTION, "sqrt"),
    SIN(Notation.FUNCTION, "sin"),
    COS(Notation.FUNCTION, "cos"),
    TAN(Notation.FUNCTION, "tan"),
    ASIN(Notation.FUNCTION, "asin"),
    ACOS(Notation.FUNCTION, "acos"),
    ATAN(Notation.FUNCTION, "atan"),
    SINH(Notation.FUNCTION, "sinh"),
    COSH(Notation.FUNCTION, "cosh"),
    TANH(Notation.FUNCTION, "tanh");

    final Notation notation;
    final String symbol;

    ExpressionKind(Notation notation, String symbol) {
        this.notation = notation;
        this.symbol = symbol;
    }

    enum Notation {
        LEAF, PREFIX, INFIX, FUNCTION
    }
}
