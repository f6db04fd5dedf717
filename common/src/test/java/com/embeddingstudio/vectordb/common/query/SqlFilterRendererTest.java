package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.filter.BoolQuery;
import com.embeddingstudio.vectordb.common.filter.ExistsQuery;
import com.embeddingstudio.vectordb.common.filter.MatchQuery;
import com.embeddingstudio.vectordb.common.filter.PayloadFilter;
import com.embeddingstudio.vectordb.common.filter.RangeCondition;
import com.embeddingstudio.vectordb.common.filter.RangeQuery;
import com.embeddingstudio.vectordb.common.filter.TermQuery;
import com.embeddingstudio.vectordb.common.filter.TermsQuery;
import com.embeddingstudio.vectordb.common.filter.WildcardQuery;
import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlFilterRendererTest {

    private PayloadFilterCompiler compiler;
    private SqlFilterRenderer renderer;

    @BeforeEach
    void setUp() {
        compiler = new PayloadFilterCompiler();
        renderer = new SqlFilterRenderer();
    }

    @Test
    void stringTermBindsKeyAndValue() {
        SqlFragment fragment = render(new TermQuery("color", "red"));

        assertThat(fragment.sql()).isEqualTo("COALESCE((payload ->> ?) = ?, FALSE)");
        assertThat(fragment.parameters()).containsExactly("color", "red");
    }

    @Test
    @DisplayName("hostile keys and values never reach the SQL text")
    void injectionAttemptsStayInParameters() {
        String hostile = "x'); DROP TABLE dbo_objects; --";

        SqlFragment fragment = render(BoolQuery.builder()
                .must(new TermQuery(hostile, hostile))
                .must(new MatchQuery(hostile, hostile))
                .must(new WildcardQuery(hostile, hostile))
                .build());

        assertThat(fragment.sql()).doesNotContain("DROP TABLE");
        assertThat(fragment.parameters()).contains(hostile);
        assertThat(fragment.sql().chars().filter(c -> c == '?').count())
                .isEqualTo(fragment.parameters().size());
    }

    @Test
    void numericComparisonsGuardTheCast() {
        SqlFragment fragment = render(new RangeQuery("price",
                RangeCondition.builder().gte(BigDecimal.ONE).build()));

        assertThat(fragment.sql()).contains("CAST((payload ->> ?) AS NUMERIC)").contains(">= ?");
        assertThat(fragment.parameters()).containsExactly("price", "price", BigDecimal.ONE);
    }

    @Test
    void termsRendersInList() {
        SqlFragment fragment = render(TermsQuery.of("color", "red", "blue"));

        assertThat(fragment.sql()).isEqualTo("COALESCE((payload ->> ?) IN (?, ?), FALSE)");
        assertThat(fragment.parameters()).containsExactly("color", "red", "blue");
    }

    @Test
    void booleanTermComparesLowerCasedText() {
        SqlFragment fragment = render(new TermQuery("active", true));

        assertThat(fragment.sql()).isEqualTo("COALESCE(LOWER((payload ->> ?)) = ?, FALSE)");
        assertThat(fragment.parameters()).containsExactly("active", "true");
    }

    @Test
    void textMatchUsesFullTextSearch() {
        SqlFragment fragment = render(new MatchQuery("title", "red shoes"));

        assertThat(fragment.sql()).isEqualTo(
                "COALESCE(to_tsvector('simple', (payload ->> ?)) @@ plainto_tsquery('simple', ?), FALSE)");
        assertThat(fragment.parameters()).containsExactly("title", "red shoes");
    }

    @Test
    void wildcardEscapesLikeMetacharacters() {
        SqlFragment fragment = render(new WildcardQuery("sku", "10%_a*"));

        assertThat(fragment.parameters()).containsExactly("sku", "10\\%\\_a%", "sku", "10\\%\\_a%");
    }

    @Test
    void storedColumnsAreQuotedIdentifiers() {
        SqlFragment fragment = render(new ExistsQuery("session_id", true));

        assertThat(fragment.sql()).isEqualTo("COALESCE(\"session_id\" IS NOT NULL, FALSE)");
        assertThat(fragment.parameters()).isEmpty();
    }

    @Test
    void mustNotNegatesTheTwoValuedLeaf() {
        SqlFragment fragment = render(BoolQuery.builder().mustNot(new ExistsQuery("deleted")).build());

        assertThat(fragment.sql()).isEqualTo("(NOT COALESCE((payload ->> ?) IS NOT NULL, FALSE))");
    }

    @Test
    void constantsRenderAsLiterals() {
        assertThat(render(null).sql()).isEqualTo("TRUE");
        assertThat(render(TermsQuery.of("color")).sql()).isEqualTo("FALSE");
    }

    @Test
    void configurationNamesMustBePlainIdentifiers() {
        assertThatThrownBy(() -> new SqlFilterRenderer("payload", "english'); --"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SqlFilterRenderer("doc", "english")
                .render(compiler.compile(new TermQuery("k", PayloadValue.string("v"), false))).sql())
                .isEqualTo("COALESCE((doc ->> ?) = ?, FALSE)");
    }

    private SqlFragment render(PayloadFilter filter) {
        return renderer.render(compiler.compile(filter));
    }
}
