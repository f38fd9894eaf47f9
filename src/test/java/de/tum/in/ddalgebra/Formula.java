/*
 * This file is part of JBDD (https://github.com/incaseoftrouble/jbdd).
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.ddalgebra;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Propositional formulas, used as reference semantics for the diagrams built from them.
 */
@SuppressWarnings({"AccessingNonPublicFieldOfAnotherObject", "checkstyle:javadoc"})
abstract class Formula {
    enum BinaryType {
        AND,
        OR,
        XOR,
        IMPLIES,
        IFF
    }

    static Formula constant(boolean value) {
        return new Constant(value);
    }

    static Formula literal(int variable) {
        return new Literal(variable);
    }

    static Formula not(Formula formula) {
        return new Not(formula);
    }

    static Formula binary(BinaryType type, Formula left, Formula right) {
        return new Binary(type, left, right);
    }

    static Formula and(Formula left, Formula right) {
        return binary(BinaryType.AND, left, right);
    }

    static Formula or(Formula left, Formula right) {
        return binary(BinaryType.OR, left, right);
    }

    abstract boolean evaluate(boolean[] assignment);

    abstract void collectVariables(Set<Integer> variables);

    /**
     * Builds the diagram of this formula, using only the operations of the manager.
     */
    abstract DdIndex toIndex(DdManager<?> manager);

    Set<Integer> containedVariables() {
        Set<Integer> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    private static final class Constant extends Formula {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        @Override
        boolean evaluate(boolean[] assignment) {
            return value;
        }

        @Override
        void collectVariables(Set<Integer> variables) {
            // empty
        }

        @Override
        DdIndex toIndex(DdManager<?> manager) {
            return value ? DdIndex.TRUE : DdIndex.FALSE;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Constant && value == ((Constant) o).value);
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "tt" : "ff";
        }
    }

    private static final class Literal extends Formula {
        private final int variable;

        Literal(int variable) {
            this.variable = variable;
        }

        @Override
        boolean evaluate(boolean[] assignment) {
            return assignment[variable];
        }

        @Override
        void collectVariables(Set<Integer> variables) {
            variables.add(variable);
        }

        @Override
        DdIndex toIndex(DdManager<?> manager) {
            return manager.variable(variable);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Literal && variable == ((Literal) o).variable);
        }

        @Override
        public int hashCode() {
            return variable;
        }

        @Override
        public String toString() {
            return "x" + variable;
        }
    }

    private static final class Not extends Formula {
        private final Formula child;

        Not(Formula child) {
            this.child = child;
        }

        @Override
        boolean evaluate(boolean[] assignment) {
            return !child.evaluate(assignment);
        }

        @Override
        void collectVariables(Set<Integer> variables) {
            child.collectVariables(variables);
        }

        @Override
        DdIndex toIndex(DdManager<?> manager) {
            return manager.not(child.toIndex(manager));
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Not && child.equals(((Not) o).child));
        }

        @Override
        public int hashCode() {
            return ~child.hashCode();
        }

        @Override
        public String toString() {
            return "!" + child;
        }
    }

    private static final class Binary extends Formula {
        private final BinaryType type;
        private final Formula left;
        private final Formula right;

        Binary(BinaryType type, Formula left, Formula right) {
            this.type = type;
            this.left = left;
            this.right = right;
        }

        @Override
        boolean evaluate(boolean[] assignment) {
            boolean leftValue = left.evaluate(assignment);
            boolean rightValue = right.evaluate(assignment);
            switch (type) {
                case AND:
                    return leftValue && rightValue;
                case OR:
                    return leftValue || rightValue;
                case XOR:
                    return leftValue != rightValue;
                case IMPLIES:
                    return !leftValue || rightValue;
                case IFF:
                    return leftValue == rightValue;
                default:
                    throw new AssertionError(type);
            }
        }

        @Override
        void collectVariables(Set<Integer> variables) {
            left.collectVariables(variables);
            right.collectVariables(variables);
        }

        @Override
        DdIndex toIndex(DdManager<?> manager) {
            DdIndex leftIndex = left.toIndex(manager);
            DdIndex rightIndex = right.toIndex(manager);
            switch (type) {
                case AND:
                    return manager.and(leftIndex, rightIndex);
                case OR:
                    return manager.or(leftIndex, rightIndex);
                case XOR:
                    return manager.xor(leftIndex, rightIndex);
                case IMPLIES:
                    return manager.implies(leftIndex, rightIndex);
                case IFF:
                    return manager.iff(leftIndex, rightIndex);
                default:
                    throw new AssertionError(type);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Binary)) {
                return false;
            }
            Binary other = (Binary) o;
            return type == other.type && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, left, right);
        }

        @Override
        public String toString() {
            return String.format("(%s %s %s)", left, type, right);
        }
    }
}
