package com.legalsearch.service.rag;

import static com.legalsearch.TestFixtures.hit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.legalsearch.dto.internal.SearchHit;

class PrecisionFirstMergePolicyTest {

    private final PrecisionFirstMergePolicy policy = new PrecisionFirstMergePolicy(100);

    @Test
    void filteredHitsRankFirstAndDuplicatesAreDropped() {
        SearchHit a = hit("a", "المادة الأولى: عدة الحامل وضع الحمل");
        SearchHit b = hit("b", "المادة الثانية: عدة المتوفى عنها زوجها");
        SearchHit aAgain = hit("a2", "المادة الأولى: عدة الحامل وضع الحمل");
        SearchHit c = hit("c", "المادة الثالثة: نفقة المعتدة");
        SearchHit d = hit("d", "المادة الرابعة: السكنى");

        List<SearchHit> merged = policy.merge(List.of(c, aAgain, d), List.of(a, b), 5);

        assertThat(merged).containsExactly(a, b, c, d);
    }

    @Test
    void filteredOrderIsNeverResortedByScore() {
        SearchHit weakFiltered = hit("f", "نص مقيد بالموضوع", "العدة", 0.9);
        SearchHit strongSemantic = hit("s", "نص دلالي قريب", "", 0.05);

        List<SearchHit> merged = policy.merge(List.of(strongSemantic), List.of(weakFiltered), 5);

        assertThat(merged).containsExactly(weakFiltered, strongSemantic);
    }

    @Test
    void dedupComparesOnlyTheLeadingCharacters() {
        String prefix = "ب".repeat(100);
        SearchHit first = hit("1", prefix + " نهاية أولى");
        SearchHit samePrefix = hit("2", prefix + " نهاية ثانية");
        SearchHit differentEarly = hit("3", "ج" + prefix);

        List<SearchHit> merged = policy.merge(List.of(samePrefix, differentEarly), List.of(first), 5);

        assertThat(merged).containsExactly(first, differentEarly);
    }

    @Test
    void duplicatesInsideFilteredListAreDropped() {
        SearchHit a = hit("a", "نص مكرر");
        SearchHit copy = hit("b", "نص مكرر");

        assertThat(policy.merge(List.of(), List.of(a, copy), 5)).containsExactly(a);
    }

    @Test
    void emptyFilteredFallsBackToSemantic() {
        SearchHit a = hit("a", "أ");
        SearchHit b = hit("b", "ب");
        SearchHit c = hit("c", "ج");

        assertThat(policy.merge(List.of(a, b, c), List.of(), 2)).containsExactly(a, b);
        assertThat(policy.merge(List.of(a, b, c), null, 5)).containsExactly(a, b, c);
    }

    @Test
    void resultIsBoundedByTopK() {
        List<SearchHit> filtered = List.of(hit("1", "١"), hit("2", "٢"), hit("3", "٣"));
        List<SearchHit> semantic = List.of(hit("4", "٤"), hit("5", "٥"));

        assertThat(policy.merge(semantic, filtered, 2))
                .extracting(h -> h.getPassage().getId())
                .containsExactly("1", "2");
    }

    @Test
    void nothingFoundAnywhere() {
        assertThat(policy.merge(List.of(), List.of(), 5)).isEmpty();
        assertThat(policy.merge(null, null, 5)).isEmpty();
    }

    @Test
    void dedupPrefixMustBePositive() {
        assertThatThrownBy(() -> new PrecisionFirstMergePolicy(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
