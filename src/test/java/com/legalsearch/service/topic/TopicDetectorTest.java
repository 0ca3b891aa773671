package com.legalsearch.service.topic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.legalsearch.TestFixtures;

class TopicDetectorTest {

    private TopicDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TopicDetector(TestFixtures.topicTable());
    }

    @Test
    void compoundPhraseWinsOverTermsInsideIt() {
        assertThat(detector.detectTopics("ما حكم الشروط في عقد الزواج؟"))
                .containsExactly("الشروط في عقد الزواج");
    }

    @Test
    void pregnantWidowWaitingPeriodMapsToIddah() {
        assertThat(detector.detectTopics("ما عدة الحامل؟"))
                .containsExactly("العدة");
    }

    @Test
    void shortAmbiguousTermNeedsItsOwnToken() {
        assertThat(detector.detectTopics("هل هذه مساعدة قانونية؟")).isEmpty();
        assertThat(detector.detectTopics("المطلقة الرجعية")).isEmpty();
    }

    @Test
    void shortAmbiguousTermMatchesBeforePunctuation() {
        assertThat(detector.detectTopics("متى تنتهي عدة؟")).containsExactly("العدة");
        assertThat(detector.detectTopics("طلاق رجعي")).containsExactly("الطلاق");
    }

    @Test
    void unrelatedQuestionHasNoTopics() {
        assertThat(detector.detectTopics("ما حكم الزبائن في المحل")).isEmpty();
    }

    @Test
    void definiteArticleIsToggled() {
        assertThat(detector.detectTopics("ما هي محرمات النكاح"))
                .containsExactly("المحرمات", "عقد الزواج");
    }

    @Test
    void verbPatternsComeBeforeTerms() {
        assertThat(detector.detectTopics("طلقني زوجي وأبي حضانة عيالي"))
                .containsExactly("الطلاق", "الحضانة");
    }

    @Test
    void procedureVerbsAndTerms() {
        assertThat(detector.detectTopics("كيف أرفع دعوى نفقة"))
                .containsExactly("رفع الدعوى", "النفقة");
        assertThat(detector.detectTopics("متى أقدر أعترض على الحكم؟"))
                .containsExactly("مرافعات - أحكام ختامية");
    }

    @Test
    void topicsAreDistinct() {
        assertThat(detector.detectTopics("النفقة النفقة")).containsExactly("النفقة");
    }

    @Test
    void emptyInput() {
        assertThat(detector.detectTopics(null)).isEmpty();
        assertThat(detector.detectTopics("")).isEmpty();
        assertThat(detector.detectTopics("   ")).isEmpty();
    }

    @Test
    void resultIsImmutable() {
        List<String> topics = detector.detectTopics("هل لها نفقة؟");

        assertThatThrownBy(() -> topics.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void longerTermClaimsSpanInCustomTable() {
        TopicTable table = TopicTable.builder()
                .term("عقد الزواج", "A")
                .term("الشروط في عقد الزواج", "B")
                .build();

        assertThat(new TopicDetector(table).detectTopics("الشروط في عقد الزواج"))
                .containsExactly("B");
        assertThat(new TopicDetector(table).detectTopics("الشروط في عقد الزواج وفسخ عقد الزواج"))
                .containsExactly("B", "A");
    }

    @Test
    void tokenBoundaries() {
        assertThat(TopicDetector.isTokenBounded("عدة", 0, 3)).isTrue();
        assertThat(TopicDetector.isTokenBounded("ما عدة؟", 3, 6)).isTrue();
        assertThat(TopicDetector.isTokenBounded("(عدة)", 1, 4)).isTrue();
        assertThat(TopicDetector.isTokenBounded("مساعدة", 3, 6)).isFalse();
    }
}
