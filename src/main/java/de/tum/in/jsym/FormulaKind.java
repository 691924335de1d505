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

public enum FormulaKind {
    TRUE,
    FALSE,
    EQ,
    NEQ,
    GT,
    GEQ,
    LT,
    LEQ,
    AND,
    OR,
    NOT,
    FORALL;

    boolean isRelational() {
        switch (this) {
            case EQ:
            case NEQ:
            case GT:
            case GEQ:
            case LT:
            case LEQ:
                return true;
            default:
                return false;
        }
    }
}
