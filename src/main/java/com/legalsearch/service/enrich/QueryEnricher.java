package com.legalsearch.service.enrich;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.request.ChatTurn;
import com.legalsearch.service.topic.TopicDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.ListIterator;

/**
 * Expands context-poor follow-up questions with the topics of the latest user turn
 * that had any.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryEnricher {

    private static final String USER_ROLE = "user";

    private final TopicDetector topicDetector;
    private final RetrievalProperties properties;

    /**
     * Returns the question unchanged, or the question with up to two history topics
     * appended in parentheses.
     */
    public String enrich(String question, List<ChatTurn> history) {
        if (question == null || history == null || history.isEmpty()) {
            return question;
        }

        // a question naming two topics already carries enough signal
        if (topicDetector.detectTopics(question).size() >= 2) {
            return question;
        }

        List<String> borrowed = topicsFromRecentUserTurn(history);
        if (borrowed.isEmpty()) {
            return question;
        }

        int maxTopics = Math.max(1, properties.getEnrichment().getMaxTopics());
        List<String> appended = borrowed.subList(0, Math.min(maxTopics, borrowed.size()));
        String enriched = question + " (" + String.join(" ", appended) + ")";

        log.debug("Enriched follow-up: '{}' -> '{}'", question, enriched);
        return enriched;
    }

    private List<String> topicsFromRecentUserTurn(List<ChatTurn> history) {
        int remaining = properties.getEnrichment().getMaxUserTurns();
        ListIterator<ChatTurn> it = history.listIterator(history.size());

        while (it.hasPrevious() && remaining > 0) {
            ChatTurn turn = it.previous();
            if (!isUserTurn(turn)) {
                continue;
            }
            remaining--;

            List<String> topics = topicDetector.detectTopics(turn.getContent());
            if (!topics.isEmpty()) {
                return topics;
            }
        }
        return List.of();
    }

    private static boolean isUserTurn(ChatTurn turn) {
        return turn != null
                && turn.getRole() != null
                && USER_ROLE.equalsIgnoreCase(turn.getRole().trim())
                && turn.getContent() != null;
    }
}
