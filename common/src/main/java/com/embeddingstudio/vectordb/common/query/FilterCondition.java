package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;

import java.util.List;

/**
 * Backend-neutral boolean condition produced by {@link PayloadFilterCompiler}.
 */
public sealed interface FilterCondition {

    record Comparison(FieldRef field, FilterOperator operator, ValueType valueType, List<PayloadValue> operands)
            implements FilterCondition {
        public Comparison {
            operands = operands == null ? List.of() : List.copyOf(operands);
        }

        public PayloadValue operand() {
            return operands.get(0);
        }
    }

    record And(List<FilterCondition> children) implements FilterCondition {
        public And {
            children = List.copyOf(children);
        }
    }

    record Or(List<FilterCondition> children) implements FilterCondition {
        public Or {
            children = List.copyOf(children);
        }
    }

    record Not(FilterCondition child) implements FilterCondition {
    }

    record Constant(boolean value) implements FilterCondition {
        public static final Constant TRUE = new Constant(true);
        public static final Constant FALSE = new Constant(false);
    }
}
