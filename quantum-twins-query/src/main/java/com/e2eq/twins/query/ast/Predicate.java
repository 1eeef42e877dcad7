package com.e2eq.twins.query.ast;

import java.util.List;

public interface Predicate {

    record And(Predicate left, Predicate right) implements Predicate {}

    record Or(Predicate left, Predicate right) implements Predicate {}

    record Not(Predicate inner) implements Predicate {}

    record Group(Predicate inner) implements Predicate {}

    record Comparison(ValueExpr left, String operator, ValueExpr right) implements Predicate {}

    record In(ValueExpr value, boolean negated, List<ValueExpr.Literal> values) implements Predicate {
        public In {
            values = List.copyOf(values);
        }
    }

    record FunctionTest(ValueExpr.FunctionCall call) implements Predicate {}

    /**
     * Pre-rendered native condition, used for the edge label disjunctions.
     */
    record Native(String text) implements Predicate {}
}
