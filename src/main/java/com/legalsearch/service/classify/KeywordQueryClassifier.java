package com.legalsearch.service.classify;

import com.legalsearch.dto.internal.Classification;
import com.legalsearch.service.topic.TopicDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule-based classifier: the law family comes from the detected topics, the intent
 * from the question form, the deadline flag from deadline vocabulary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeywordQueryClassifier implements QueryClassifier {

    public static final String CATEGORY_PERSONAL_STATUS = "الأحوال الشخصية";
    public static final String CATEGORY_EVIDENCE = "الإثبات";
    public static final String CATEGORY_PROCEDURE = "المرافعات";
    public static final String CATEGORY_GENERAL = "عام";

    public static final String INTENT_CONSULTATION = "استشارة";
    public static final String INTENT_PROCEDURE = "إجراء";
    public static final String INTENT_DEADLINE = "مهلة";
    public static final String INTENT_RULING = "حكم";

    private static final Set<String> EVIDENCE_TOPICS = Set.of("إقرار", "شهادة", "يمين", "قرائن", "خبرة");

    private static final Set<String> DEADLINE_TOPICS = Set.of("العدة", "مرافعات - أحكام ختامية");

    private static final Set<String> DEADLINE_WORDS = Set.of(
            "مهلة", "المهلة", "مدة", "المدة", "موعد", "مواعيد", "متى", "خلال",
            "أيام", "يوم", "شهر", "أشهر", "سنة", "تقادم", "ميعاد", "عدة", "العدة"
    );

    private static final Set<String> PROCEDURE_WORDS = Set.of(
            "كيف", "إجراءات", "الإجراءات", "خطوات", "أرفع", "ارفع", "أقدم", "اقدم", "وين", "أين"
    );

    private static final Set<String> RULING_WORDS = Set.of(
            "حكم", "يجوز", "هل", "يحق", "يعتبر", "شروط"
    );

    private final TopicDetector topicDetector;

    @Override
    public Classification classify(String question) {
        if (question == null || question.isBlank()) {
            return Classification.builder()
                    .category(CATEGORY_GENERAL)
                    .intent(INTENT_CONSULTATION)
                    .needsDeadlineCheck(false)
                    .build();
        }

        List<String> topics = topicDetector.detectTopics(question);
        Set<String> words = tokenize(question);

        boolean deadline = words.stream().anyMatch(DEADLINE_WORDS::contains)
                || topics.stream().anyMatch(DEADLINE_TOPICS::contains);

        Classification classification = Classification.builder()
                .category(category(topics))
                .intent(intent(words))
                .needsDeadlineCheck(deadline)
                .build();

        log.debug("Classified question: {}", classification);
        return classification;
    }

    private String category(List<String> topics) {
        if (topics.isEmpty()) {
            return CATEGORY_GENERAL;
        }
        String first = topics.get(0);
        if (EVIDENCE_TOPICS.contains(first)) {
            return CATEGORY_EVIDENCE;
        }
        if (first.startsWith("مرافعات") || first.equals("رفع الدعوى")) {
            return CATEGORY_PROCEDURE;
        }
        return CATEGORY_PERSONAL_STATUS;
    }

    private String intent(Set<String> words) {
        if (words.contains("متى") || words.contains("مهلة") || words.contains("موعد") || words.contains("مواعيد")) {
            return INTENT_DEADLINE;
        }
        if (words.stream().anyMatch(PROCEDURE_WORDS::contains)) {
            return INTENT_PROCEDURE;
        }
        if (words.stream().anyMatch(RULING_WORDS::contains)) {
            return INTENT_RULING;
        }
        return INTENT_CONSULTATION;
    }

    private static Set<String> tokenize(String text) {
        return Arrays.stream(text.split("[\\s\\p{Punct}؟،؛]+"))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toSet());
    }
}
