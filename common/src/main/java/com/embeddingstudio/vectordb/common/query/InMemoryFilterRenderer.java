package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.embeddingstudio.vectordb.common.query.FilterCondition.And;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Comparison;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Constant;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Not;
import com.embeddingstudio.vectordb.common.query.FilterCondition.Or;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Renders a condition as a predicate over stored objects.
 * A comparison on a missing field is false, so negating it is true.
 */
public class InMemoryFilterRenderer implements FilterRenderer<Predicate<FilterTarget>> {

    @Override
    public Predicate<FilterTarget> render(FilterCondition condition) {
        if (condition instanceof Constant constant) {
            boolean value = constant.value();
            return target -> value;
        }
        if (condition instanceof And and) {
            List<Predicate<FilterTarget>> children = and.children().stream().map(this::render).toList();
            return target -> children.stream().allMatch(child -> child.test(target));
        }
        if (condition instanceof Or or) {
            List<Predicate<FilterTarget>> children = or.children().stream().map(this::render).toList();
            return target -> children.stream().anyMatch(child -> child.test(target));
        }
        if (condition instanceof Not not) {
            return render(not.child()).negate();
        }
        Comparison comparison = (Comparison) condition;
        Predicate<PayloadValue> test = valueTest(comparison);
        return target -> target.resolve(comparison.field()).map(test::test).orElse(false);
    }

    private Predicate<PayloadValue> valueTest(Comparison comparison) {
        switch (comparison.operator()) {
            case EXISTS:
                return value -> true;
            case TEXT_MATCH: {
                List<String> required = TextTokens.tokenize(comparison.operand().asText());
                return value -> TextTokens.containsAll(TextTokens.tokenize(value.asText()), required);
            }
            case PHRASE_MATCH: {
                List<String> phrase = TextTokens.tokenize(comparison.operand().asText());
                return value -> TextTokens.containsSequence(TextTokens.tokenize(value.asText()), phrase);
            }
            case GLOB: {
                Pattern pattern = globPattern(comparison.operand().asText());
                return value -> {
                    String text = value.asText().toLowerCase(Locale.ROOT);
                    return pattern.matcher(text).matches()
                            || TextTokens.tokenize(text).stream().anyMatch(token -> pattern.matcher(token).matches());
                };
            }
            case EQ: {
                PayloadValue operand = comparison.operand();
                return value -> typedEquals(comparison.valueType(), value, operand);
            }
            case IN:
                return value -> comparison.operands().stream()
                        .anyMatch(operand -> typedEquals(comparison.valueType(), value, operand));
            case GTE:
                return numericTest(comparison, cmp -> cmp >= 0);
            case LTE:
                return numericTest(comparison, cmp -> cmp <= 0);
            case GT:
                return numericTest(comparison, cmp -> cmp > 0);
            case LT:
                return numericTest(comparison, cmp -> cmp < 0);
            default:
                throw new IllegalArgumentException("Unsupported operator: " + comparison.operator());
        }
    }

    private Predicate<PayloadValue> numericTest(Comparison comparison, Predicate<Integer> accept) {
        BigDecimal bound = numeric(comparison.operand())
                .orElseThrow(() -> new IllegalArgumentException("Range bound is not a number: " + comparison.operand()));
        return value -> numeric(value).map(number -> accept.test(number.compareTo(bound))).orElse(false);
    }

    private boolean typedEquals(ValueType type, PayloadValue value, PayloadValue operand) {
        if (!isScalar(value)) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return numeric(value).flatMap(number -> numeric(operand).map(other -> number.compareTo(other) == 0))
                        .orElse(false);
            case BOOLEAN:
                return value.asText().equalsIgnoreCase(operand.asText());
            default:
                return value.asText().equals(operand.asText());
        }
    }

    private static boolean isScalar(PayloadValue value) {
        return value instanceof PayloadValue.StringValue
                || value instanceof PayloadValue.NumberValue
                || value instanceof PayloadValue.BoolValue;
    }

    static Optional<BigDecimal> numeric(PayloadValue value) {
        if (value instanceof PayloadValue.NumberValue number) {
            return Optional.of(number.value());
        }
        if (value instanceof PayloadValue.StringValue string) {
            try {
                return Optional.of(new BigDecimal(string.value().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Pattern globPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
