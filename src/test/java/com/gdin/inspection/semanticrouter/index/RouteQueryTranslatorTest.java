package com.gdin.inspection.semanticrouter.index;

import com.gdin.inspection.semanticrouter.index.model.QueryResult;
import com.gdin.inspection.semanticrouter.typesense.model.SearchHit;
import com.gdin.inspection.semanticrouter.typesense.model.SearchResponse;
import org.junit.jupiter.api.Test;
import org.typesense.model.MultiSearchCollectionParameters;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class RouteQueryTranslatorTest {
    private final RouteQueryTranslator translator = new RouteQueryTranslator();

    @Test
    void distanceMapsLinearlyToSimilarity() {
        assertThat(RouteQueryTranslator.toSimilarity(0.0)).isEqualTo(1.0);
        assertThat(RouteQueryTranslator.toSimilarity(1.0)).isEqualTo(0.0);
        assertThat(RouteQueryTranslator.toSimilarity(2.0)).isEqualTo(-1.0);
        assertThat(RouteQueryTranslator.toSimilarity(0.5)).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void missingDistanceIsMinimumSimilarity() {
        assertThat(RouteQueryTranslator.toSimilarity(null)).isEqualTo(-1.0);
    }

    @Test
    void buildsVectorQueryWithoutLabelFilter() {
        MultiSearchCollectionParameters search = translator.toSearch(new float[]{0.9f, 0.1f, 0f}, 2, null);

        assertThat(search.getQ()).isEqualTo("*");
        assertThat(search.getVectorQuery()).isEqualTo("vec:([0.9,0.1,0.0], k:2)");
        assertThat(search.getPerPage()).isEqualTo(2);
        assertThat(search.getFilterBy()).isEqualTo("sr_route:!=`__config__`");
        assertThat(search.getExcludeFields()).isEqualTo("vec");
    }

    @Test
    void labelFilterIsOrOfEqualities() {
        MultiSearchCollectionParameters search = translator.toSearch(new float[]{1f}, 5, List.of("billing", "tech support"));

        assertThat(search.getFilterBy())
                .isEqualTo("(sr_route:=`billing` || sr_route:=`tech support`) && sr_route:!=`__config__`");
    }

    @Test
    void emptyLabelFilterMeansNoRestriction() {
        assertThat(translator.toSearch(new float[]{1f}, 5, List.of()).getFilterBy())
                .isEqualTo("sr_route:!=`__config__`");
    }

    @Test
    void perPageIsCappedAtBackendMaximum() {
        MultiSearchCollectionParameters search = translator.toSearch(new float[]{1f}, 1000, null);

        assertThat(search.getPerPage()).isEqualTo(250);
        assertThat(search.getVectorQuery()).endsWith("k:1000)");
    }

    @Test
    void backtickInLabelCannotBeQuoted() {
        assertThatThrownBy(() -> translator.toSearch(new float[]{1f}, 5, List.of("a`b")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RouteQueryTranslator.labelEquals("a`b")).isInstanceOf(IllegalArgumentException.class);
        assertThat(RouteQueryTranslator.labelEquals("c++ help")).isEqualTo("sr_route:=`c++ help`");
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> translator.toSearch(new float[0], 1, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> translator.toSearch(new float[]{1f}, 0, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertsHitsKeepingBackendOrder() {
        SearchResponse response = new SearchResponse(2L, 1, List.of(
                new SearchHit(Map.of("sr_route", "billing"), 0.1),
                new SearchHit(Map.of("sr_route", "chitchat"), null)
        ));

        QueryResult result = translator.toResult(response);

        assertThat(result.routes()).containsExactly("billing", "chitchat");
        assertThat(result.scores()[0]).isCloseTo(0.95, within(1e-12));
        assertThat(result.scores()[1]).isEqualTo(-1.0);
    }
}
