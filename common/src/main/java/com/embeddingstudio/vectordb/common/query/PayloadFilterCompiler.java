package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.filter.BoolQuery;
import com.embeddingstudio.vectordb.common.filter.ExistsQuery;
import com.embeddingstudio.vectordb.common.filter.FieldFilter;
import com.embeddingstudio.vectordb.common.filter.MatchPhraseQuery;
import com.embeddingstudio.vectordb.common.filter.MatchQuery;
import com.embeddingstudio.vectordb.common.filter.PayloadFilter;
import com.embeddingstudio.vectordb.common.filter.RangeCondition;
import com.embeddingstudio.vectordb.common.filter.RangeQuery;
import com.embeddingstudio.vectordb.common.filter.TermQuery;
import com.embeddingstudio.vectordb.common.filter.TermsQuery;
import com.embeddingstudio.vectordb.common.filter.WildcardQuery;
import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.embeddingstudio.vectordb.common.query.FilterCondition.And;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Comparison;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Constant;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Not;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Or;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a {@link PayloadFilter} tree into a {@link FilterCondition}.
 * Compilation is purely structural: the same filter always yields an equal condition.
 */
@Slf4j
public class PayloadFilterCompiler {

    /**
     * @param filter filter to compile, {@code null} meaning no restriction
     * @return condition tree, {@link Constant#TRUE} for an absent or empty filter
     */
    public FilterCondition compile(PayloadFilter filter) {
        if (filter == null) {
            return Constant.TRUE;
        }
        FilterCondition condition = compileNode(filter);
        log.debug("Compiled payload filter {} into {}", filter, condition);
        return condition;
    }

    private FilterCondition compileNode(PayloadFilter filter) {
        if (filter instanceof MatchQuery query) {
            return comparison(query, FilterOperator.TEXT_MATCH, ValueType.STRING,
                    List.of(PayloadValue.string(query.value())));
        }
        if (filter instanceof MatchPhraseQuery query) {
            return comparison(query, FilterOperator.PHRASE_MATCH, ValueType.STRING,
                    List.of(PayloadValue.string(query.value())));
        }
        if (filter instanceof WildcardQuery query) {
            return comparison(query, FilterOperator.GLOB, ValueType.STRING,
                    List.of(PayloadValue.string(query.value())));
        }
        if (filter instanceof TermQuery query) {
            return comparison(query, FilterOperator.EQ, ValueType.of(query.value()), List.of(query.value()));
        }
        if (filter instanceof TermsQuery query) {
            return compileTerms(query);
        }
        if (filter instanceof ExistsQuery query) {
            return comparison(query, FilterOperator.EXISTS, ValueType.ANY, List.of());
        }
        if (filter instanceof RangeQuery query) {
            return compileRange(query);
        }
        if (filter instanceof BoolQuery query) {
            return compileBool(query);
        }
        throw new IllegalArgumentException("Unsupported payload filter: " + filter.getClass().getSimpleName());
    }

    private FilterCondition compileTerms(TermsQuery query) {
        if (query.values().isEmpty()) {
            return Constant.FALSE;
        }
        // one IN per literal type, in order of first appearance
        Map<ValueType, List<PayloadValue>> byType = new LinkedHashMap<>();
        for (PayloadValue value : query.values()) {
            byType.computeIfAbsent(ValueType.of(value), type -> new ArrayList<>()).add(value);
        }
        List<FilterCondition> groups = new ArrayList<>();
        byType.forEach((type, values) -> groups.add(comparison(query, FilterOperator.IN, type, values)));
        return groups.size() == 1 ? groups.get(0) : new Or(groups);
    }

    private FilterCondition compileRange(RangeQuery query) {
        RangeCondition range = query.range();
        List<FilterCondition> bounds = new ArrayList<>();
        addBound(bounds, query, FilterOperator.GTE, range.gte());
        addBound(bounds, query, FilterOperator.LTE, range.lte());
        addBound(bounds, query, FilterOperator.GT, range.gt());
        addBound(bounds, query, FilterOperator.LT, range.lt());
        addBound(bounds, query, FilterOperator.EQ, range.eq());

        if (bounds.isEmpty()) {
            return Constant.TRUE;
        }
        return bounds.size() == 1 ? bounds.get(0) : new And(bounds);
    }

    private void addBound(List<FilterCondition> bounds, RangeQuery query, FilterOperator operator, BigDecimal bound) {
        if (bound != null) {
            bounds.add(comparison(query, operator, ValueType.NUMBER, List.of(new PayloadValue.NumberValue(bound))));
        }
    }

    private FilterCondition compileBool(BoolQuery query) {
        List<FilterCondition> clauses = new ArrayList<>();
        if (!query.must().isEmpty()) {
            clauses.add(new And(compileAll(query.must())));
        }
        if (!query.should().isEmpty()) {
            clauses.add(new Or(compileAll(query.should())));
        }
        if (!query.filter().isEmpty()) {
            clauses.add(new And(compileAll(query.filter())));
        }
        if (!query.mustNot().isEmpty()) {
            clauses.add(new Not(new And(compileAll(query.mustNot()))));
        }

        if (clauses.isEmpty()) {
            return Constant.TRUE;
        }
        return clauses.size() == 1 ? clauses.get(0) : new And(clauses);
    }

    private List<FilterCondition> compileAll(List<PayloadFilter> filters) {
        return filters.stream().map(this::compileNode).toList();
    }

    private Comparison comparison(FieldFilter filter, FilterOperator operator, ValueType valueType,
                                  List<PayloadValue> operands) {
        return new Comparison(FieldRef.of(filter), operator, valueType, operands);
    }
}
