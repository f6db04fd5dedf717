package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.embeddingstudio.vectordb.common.query.FilterCondition.And;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Comparison;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Constant;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Not;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Or;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a condition as a PostgreSQL boolean expression over a JSONB payload column.
 * Payload keys and literals are always bind parameters. Column names come from {@link StoredColumn}.
 * Every comparison is wrapped in {@code COALESCE(..., FALSE)} so a missing field is false, never NULL.
 */
public class SqlFilterRenderer implements FilterRenderer<SqlFragment> {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final String NUMBER_REGEX = "'^\\s*[-+]?[0-9]+(\\.[0-9]+)?([eE][-+]?[0-9]+)?\\s*$'";
    private static final String TOKEN_SPLIT_REGEX = "'[^[:alnum:]]+'";

    private final String payloadColumn;
    private final String textSearchConfig;

    public SqlFilterRenderer() {
        this("payload", "simple");
    }

    /**
     * @param payloadColumn    JSONB column holding the payload
     * @param textSearchConfig PostgreSQL text search configuration for the text operators
     */
    public SqlFilterRenderer(String payloadColumn, String textSearchConfig) {
        this.payloadColumn = requireIdentifier(payloadColumn);
        this.textSearchConfig = requireIdentifier(textSearchConfig);
    }

    @Override
    public SqlFragment render(FilterCondition condition) {
        List<Object> parameters = new ArrayList<>();
        String sql = renderNode(condition, parameters);
        return new SqlFragment(sql, parameters);
    }

    private String renderNode(FilterCondition condition, List<Object> parameters) {
        if (condition instanceof Constant constant) {
            return constant.value() ? "TRUE" : "FALSE";
        }
        if (condition instanceof And and) {
            return join(and.children(), " AND ", "TRUE", parameters);
        }
        if (condition instanceof Or or) {
            return join(or.children(), " OR ", "FALSE", parameters);
        }
        if (condition instanceof Not not) {
            return "(NOT " + renderNode(not.child(), parameters) + ")";
        }
        return "COALESCE(" + renderComparison((Comparison) condition, parameters) + ", FALSE)";
    }

    private String join(List<FilterCondition> children, String separator, String whenEmpty, List<Object> parameters) {
        if (children.isEmpty()) {
            return whenEmpty;
        }
        List<String> rendered = new ArrayList<>(children.size());
        for (FilterCondition child : children) {
            rendered.add(renderNode(child, parameters));
        }
        return rendered.size() == 1 ? rendered.get(0) : "(" + String.join(separator, rendered) + ")";
    }

    private String renderComparison(Comparison comparison, List<Object> parameters) {
        FieldRef field = comparison.field();
        switch (comparison.operator()) {
            case EXISTS:
                return fieldText(field, parameters) + " IS NOT NULL";
            case TEXT_MATCH:
                return textSearch(field, "plainto_tsquery", comparison.operand(), parameters);
            case PHRASE_MATCH:
                return textSearch(field, "phraseto_tsquery", comparison.operand(), parameters);
            case GLOB:
                return glob(field, comparison.operand(), parameters);
            case EQ: {
                String expression = typedExpression(field, comparison.valueType(), parameters);
                parameters.add(literal(comparison.valueType(), comparison.operand()));
                return expression + " = ?";
            }
            case IN: {
                String expression = typedExpression(field, comparison.valueType(), parameters);
                comparison.operands().forEach(operand -> parameters.add(literal(comparison.valueType(), operand)));
                String placeholders = comparison.operands().stream().map(operand -> "?")
                        .collect(Collectors.joining(", "));
                return expression + " IN (" + placeholders + ")";
            }
            case GTE:
                return numericBound(field, ">=", comparison.operand(), parameters);
            case LTE:
                return numericBound(field, "<=", comparison.operand(), parameters);
            case GT:
                return numericBound(field, ">", comparison.operand(), parameters);
            case LT:
                return numericBound(field, "<", comparison.operand(), parameters);
            default:
                throw new IllegalArgumentException("Unsupported operator: " + comparison.operator());
        }
    }

    private String textSearch(FieldRef field, String queryFunction, PayloadValue value, List<Object> parameters) {
        String document = "to_tsvector('" + textSearchConfig + "', " + fieldText(field, parameters) + ")";
        parameters.add(value.asText());
        return document + " @@ " + queryFunction + "('" + textSearchConfig + "', ?)";
    }

    private String glob(FieldRef field, PayloadValue value, List<Object> parameters) {
        String pattern = likePattern(value.asText());
        String whole = "LOWER(" + fieldText(field, parameters) + ") LIKE ? ESCAPE '\\'";
        parameters.add(pattern);
        String tokens = "EXISTS (SELECT 1 FROM regexp_split_to_table(LOWER(" + fieldText(field, parameters) + "), "
                + TOKEN_SPLIT_REGEX + ") AS token WHERE token LIKE ? ESCAPE '\\')";
        parameters.add(pattern);
        return "(" + whole + " OR " + tokens + ")";
    }

    private String numericBound(FieldRef field, String operator, PayloadValue bound, List<Object> parameters) {
        String expression = numericExpression(field, parameters);
        parameters.add(literal(ValueType.NUMBER, bound));
        return expression + " " + operator + " ?";
    }

    private String typedExpression(FieldRef field, ValueType type, List<Object> parameters) {
        switch (type) {
            case NUMBER:
                return numericExpression(field, parameters);
            case BOOLEAN:
                return "LOWER(" + fieldText(field, parameters) + ")";
            default:
                return fieldText(field, parameters);
        }
    }

    // non-numeric text yields NULL instead of a cast error
    private String numericExpression(FieldRef field, List<Object> parameters) {
        String test = fieldText(field, parameters) + " ~ " + NUMBER_REGEX;
        String cast = "CAST(" + fieldText(field, parameters) + " AS NUMERIC)";
        return "(CASE WHEN " + test + " THEN " + cast + " END)";
    }

    private String fieldText(FieldRef field, List<Object> parameters) {
        if (field.isPayload()) {
            parameters.add(field.payloadKey());
            return "(" + payloadColumn + " ->> ?)";
        }
        return "\"" + field.column().columnName() + "\"";
    }

    private Object literal(ValueType type, PayloadValue value) {
        switch (type) {
            case NUMBER:
                return ((PayloadValue.NumberValue) value).value();
            case BOOLEAN:
                return value.asText().toLowerCase(Locale.ROOT);
            default:
                return value.asText();
        }
    }

    static String likePattern(String glob) {
        StringBuilder pattern = new StringBuilder();
        for (char c : glob.toLowerCase(Locale.ROOT).toCharArray()) {
            switch (c) {
                case '*' -> pattern.append('%');
                case '?' -> pattern.append('_');
                case '%', '_', '\\' -> pattern.append('\\').append(c);
                default -> pattern.append(c);
            }
        }
        return pattern.toString();
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a plain SQL identifier: " + name);
        }
        return name;
    }
}
