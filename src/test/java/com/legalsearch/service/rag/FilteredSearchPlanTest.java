package com.legalsearch.service.rag;

import static com.legalsearch.TestFixtures.hit;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.legalsearch.dto.internal.SearchHit;

class FilteredSearchPlanTest {

    @Test
    void planIsCappedToMaxSteps() {
        FilteredSearchPlan plan = FilteredSearchPlan.of(List.of("الطلاق", "الحضانة", "النفقة"), 2);

        assertThat(plan.getTopics()).containsExactly("الطلاق", "الحضانة");
        assertThat(plan.isEmpty()).isFalse();
    }

    @Test
    void stopsAtFirstTopicWithHits() {
        List<String> calls = new ArrayList<>();
        SearchHit found = hit("a", "نص");

        FilteredSearchPlan.Outcome outcome = FilteredSearchPlan.of(List.of("الطلاق", "الحضانة"), 2)
                .execute(topic -> {
                    calls.add(topic);
                    return List.of(found);
                });

        assertThat(calls).containsExactly("الطلاق");
        assertThat(outcome.matched()).isTrue();
        assertThat(outcome.topic()).isEqualTo("الطلاق");
        assertThat(outcome.hits()).containsExactly(found);
        assertThat(outcome.attempted()).containsExactly("الطلاق");
    }

    @Test
    void fallsThroughToSecondTopic() {
        SearchHit found = hit("b", "نص الحضانة");
        Map<String, List<SearchHit>> byTopic = Map.of(
                "الطلاق", List.of(),
                "الحضانة", List.of(found));

        FilteredSearchPlan.Outcome outcome = FilteredSearchPlan.of(List.of("الطلاق", "الحضانة"), 2)
                .execute(byTopic::get);

        assertThat(outcome.topic()).isEqualTo("الحضانة");
        assertThat(outcome.hits()).containsExactly(found);
        assertThat(outcome.attempted()).containsExactly("الطلاق", "الحضانة");
    }

    @Test
    void noStepSucceeds() {
        FilteredSearchPlan.Outcome outcome = FilteredSearchPlan.of(List.of("الطلاق", "الحضانة"), 2)
                .execute(topic -> null);

        assertThat(outcome.matched()).isFalse();
        assertThat(outcome.hits()).isEmpty();
        assertThat(outcome.attempted()).containsExactly("الطلاق", "الحضانة");
    }

    @Test
    void emptyPlanNeverSearches() {
        List<String> calls = new ArrayList<>();

        FilteredSearchPlan plan = FilteredSearchPlan.of(List.of(), 2);
        FilteredSearchPlan.Outcome outcome = plan.execute(topic -> {
            calls.add(topic);
            return List.of();
        });

        assertThat(plan.isEmpty()).isTrue();
        assertThat(FilteredSearchPlan.of(null, 2).isEmpty()).isTrue();
        assertThat(calls).isEmpty();
        assertThat(outcome.matched()).isFalse();
    }
}
