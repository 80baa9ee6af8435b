package com.edsim.fuzzy;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Antecedent of a fuzzy rule: term memberships combined with AND (min), OR (max) and NOT (1 - x).
 */
public interface FuzzyExpression {

    double evaluate(Fuzzification input);

    static FuzzyExpression is(String variable, String term) {
        return new Is(variable, term);
    }

    static FuzzyExpression and(FuzzyExpression... operands) {
        return new And(Arrays.asList(operands));
    }

    static FuzzyExpression and(List<FuzzyExpression> operands) {
        return new And(operands);
    }

    static FuzzyExpression or(FuzzyExpression... operands) {
        return new Or(Arrays.asList(operands));
    }

    static FuzzyExpression or(List<FuzzyExpression> operands) {
        return new Or(operands);
    }

    static FuzzyExpression not(FuzzyExpression operand) {
        return new Not(operand);
    }

    final class Is implements FuzzyExpression {
        private final String variable;
        private final String term;

        Is(String variable, String term) {
            this.variable = variable;
            this.term = term;
        }

        @Override
        public double evaluate(Fuzzification input) {
            return input.degree(variable, term);
        }

        @Override
        public String toString() {
            return variable + " IS " + term;
        }
    }

    final class And implements FuzzyExpression {
        private final List<FuzzyExpression> operands;

        And(List<FuzzyExpression> operands) {
            if (operands.isEmpty()) {
                throw new IllegalArgumentException("AND needs at least one operand");
            }
            this.operands = List.copyOf(operands);
        }

        @Override
        public double evaluate(Fuzzification input) {
            double result = 1.0;
            for (FuzzyExpression operand : operands) {
                result = Math.min(result, operand.evaluate(input));
            }
            return result;
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" AND ", "(", ")"));
        }
    }

    final class Or implements FuzzyExpression {
        private final List<FuzzyExpression> operands;

        Or(List<FuzzyExpression> operands) {
            if (operands.isEmpty()) {
                throw new IllegalArgumentException("OR needs at least one operand");
            }
            this.operands = List.copyOf(operands);
        }

        @Override
        public double evaluate(Fuzzification input) {
            double result = 0.0;
            for (FuzzyExpression operand : operands) {
                result = Math.max(result, operand.evaluate(input));
            }
            return result;
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" OR ", "(", ")"));
        }
    }

    final class Not implements FuzzyExpression {
        private final FuzzyExpression operand;

        Not(FuzzyExpression operand) {
            this.operand = operand;
        }

        @Override
        public double evaluate(Fuzzification input) {
            return 1.0 - operand.evaluate(input);
        }

        @Override
        public String toString() {
            return "NOT " + operand;
        }
    }
}
