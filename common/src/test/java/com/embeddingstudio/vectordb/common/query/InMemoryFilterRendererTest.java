package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.filter.BoolQuery;
import com.embeddingstudio.vectordb.common.filter.ExistsQuery;
import com.embeddingstudio.vectordb.common.filter.MatchPhraseQuery;
import com.embeddingstudio.vectordb.common.filter.MatchQuery;
import com.embeddingstudio.vectordb.common.filter.PayloadFilter;
import com.embeddingstudio.vectordb.common.filter.RangeCondition;
import com.embeddingstudio.vectordb.common.filter.RangeQuery;
import com.embeddingstudio.vectordb.common.filter.TermQuery;
import com.embeddingstudio.vectordb.common.filter.TermsQuery;
import com.embeddingstudio.vectordb.common.filter.WildcardQuery;
import com.embeddingstudio.vectordb.common.payload.Payload;
import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFilterRendererTest {

    private PayloadFilterCompiler compiler;
    private InMemoryFilterRenderer renderer;

    private final Target shoe = new Target(Payload.of(Map.of(
            "title", "Red running shoes for trail",
            "price", 120,
            "in_stock", true,
            "sku", "SH-001",
            "tags", List.of("sport", "outdoor"))), Map.of(StoredColumn.USER_ID, "u1"));

    private final Target hat = new Target(Payload.of(Map.of(
            "title", "Blue hat",
            "price", "25.5",
            "in_stock", false)), Map.of());

    @BeforeEach
    void setUp() {
        compiler = new PayloadFilterCompiler();
        renderer = new InMemoryFilterRenderer();
    }

    @Test
    @DisplayName("match requires every query token, in any order")
    void match() {
        assertThat(matches(new MatchQuery("title", "shoes red"), shoe)).isTrue();
        assertThat(matches(new MatchQuery("title", "red boots"), shoe)).isFalse();
        assertThat(matches(new MatchQuery("title", "  "), shoe)).isFalse();
    }

    @Test
    @DisplayName("match_phrase requires the tokens to be consecutive and in order")
    void matchPhrase() {
        assertThat(matches(new MatchPhraseQuery("title", "running shoes"), shoe)).isTrue();
        assertThat(matches(new MatchPhraseQuery("title", "shoes running"), shoe)).isFalse();
        assertThat(matches(new MatchPhraseQuery("title", "red shoes"), shoe)).isFalse();
    }

    @Test
    void wildcardMatchesWholeValueOrAnyToken() {
        assertThat(matches(new WildcardQuery("sku", "sh-*"), shoe)).isTrue();
        assertThat(matches(new WildcardQuery("title", "run*"), shoe)).isTrue();
        assertThat(matches(new WildcardQuery("title", "h?t"), hat)).isTrue();
        assertThat(matches(new WildcardQuery("title", "boot*"), shoe)).isFalse();
    }

    @Test
    void termComparesByType() {
        assertThat(matches(new TermQuery("price", 120), shoe)).isTrue();
        assertThat(matches(new TermQuery("price", 120.0), shoe)).isTrue();
        assertThat(matches(new TermQuery("price", "120"), shoe)).isTrue();
        assertThat(matches(new TermQuery("in_stock", true), shoe)).isTrue();
        assertThat(matches(new TermQuery("in_stock", true), hat)).isFalse();
        assertThat(matches(new TermQuery("sku", "sh-001"), shoe)).isFalse();
    }

    @Test
    void termsMatchesAnyValue() {
        assertThat(matches(TermsQuery.of("sku", "X", "SH-001"), shoe)).isTrue();
        assertThat(matches(TermsQuery.of("sku", "X", "Y"), shoe)).isFalse();
    }

    @Test
    void rangeCastsNumericText() {
        PayloadFilter cheap = new RangeQuery("price", RangeCondition.builder().lt(BigDecimal.valueOf(30)).build());

        assertThat(matches(cheap, hat)).isTrue();
        assertThat(matches(cheap, shoe)).isFalse();
        assertThat(matches(new RangeQuery("title", RangeCondition.builder().gt(BigDecimal.ZERO).build()), hat))
                .isFalse();
    }

    @Test
    @DisplayName("a missing field makes the leaf false and its negation true")
    void missingFieldIsFalse() {
        PayloadFilter hasTags = new ExistsQuery("tags");
        PayloadFilter withoutTags = BoolQuery.builder().mustNot(new TermQuery("tags_color", "red")).build();

        assertThat(matches(hasTags, shoe)).isTrue();
        assertThat(matches(hasTags, hat)).isFalse();
        assertThat(matches(new TermQuery("missing", "x"), hat)).isFalse();
        assertThat(matches(withoutTags, hat)).isTrue();
    }

    @Test
    void explicitNullCountsAsMissing() {
        Target target = new Target(Payload.ofValues(Map.of("title", PayloadValue.NullValue.INSTANCE)), Map.of());

        assertThat(matches(new ExistsQuery("title"), target)).isFalse();
    }

    @Test
    void storedColumnsAreAddressedWithForceNotPayload() {
        assertThat(matches(new TermQuery("user_id", PayloadValue.string("u1"), true), shoe)).isTrue();
        assertThat(matches(new ExistsQuery("user_id", true), hat)).isFalse();
    }

    @Test
    void boolCombinesClauses() {
        BoolQuery query = BoolQuery.builder()
                .must(new MatchQuery("title", "shoes"))
                .should(new TermQuery("in_stock", true))
                .should(new RangeQuery("price", RangeCondition.builder().lt(BigDecimal.TEN).build()))
                .filter(new ExistsQuery("sku"))
                .mustNot(new WildcardQuery("title", "boot*"))
                .build();

        assertThat(matches(query, shoe)).isTrue();
        assertThat(matches(query, hat)).isFalse();
    }

    private boolean matches(PayloadFilter filter, Target target) {
        return renderer.render(compiler.compile(filter)).test(target);
    }

    private record Target(Payload payload, Map<StoredColumn, String> columns) implements FilterTarget {

        private Target {
            columns = new HashMap<>(columns);
        }

        @Override
        public Optional<PayloadValue> payloadValue(String key) {
            return payload.get(key);
        }

        @Override
        public Optional<String> columnValue(StoredColumn column) {
            return Optional.ofNullable(columns.get(column));
        }
    }
}
