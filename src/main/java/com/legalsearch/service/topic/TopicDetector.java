package com.legalsearch.service.topic;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Deterministic keyword/verb classifier mapping a question to canonical legal topics.
 *
 * <p>Verb patterns are scanned first, then terms longest-first. Every accepted match
 * claims its character span, so a shorter term can never match inside a longer phrase
 * that already matched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopicDetector {

    private final TopicTable table;

    /**
     * Returns distinct topics, most confident first. Empty when nothing matched.
     */
    public List<String> detectTopics(String question) {
        if (question == null || question.isBlank()) {
            return List.of();
        }

        boolean[] claimed = new boolean[question.length()];
        Set<String> topics = new LinkedHashSet<>();

        for (VerbPattern verb : table.getVerbs()) {
            if (claimPattern(question, verb, claimed)) {
                topics.add(verb.topic());
            }
        }

        for (TopicTerm term : table.getTerms()) {
            if (claimTerm(question, term, claimed)) {
                topics.add(term.topic());
            }
        }

        if (log.isDebugEnabled() && !topics.isEmpty()) {
            log.debug("Topics for '{}': {}", abbreviate(question), topics);
        }
        return List.copyOf(topics);
    }

    private boolean claimPattern(String question, VerbPattern verb, boolean[] claimed) {
        Matcher matcher = verb.pattern().matcher(question);
        boolean matched = false;
        while (matcher.find()) {
            if (matcher.end() > matcher.start() && isFree(claimed, matcher.start(), matcher.end())) {
                claim(claimed, matcher.start(), matcher.end());
                matched = true;
            }
        }
        return matched;
    }

    private boolean claimTerm(String question, TopicTerm term, boolean[] claimed) {
        if (term.wholeWord()) {
            return claimOccurrences(question, term.term(), true, claimed);
        }
        if (claimOccurrences(question, term.term(), false, claimed)) {
            return true;
        }
        return term.variant() != null && claimOccurrences(question, term.variant(), false, claimed);
    }

    private boolean claimOccurrences(String question, String needle, boolean wholeWord, boolean[] claimed) {
        boolean matched = false;
        int from = 0;
        int idx;
        while ((idx = question.indexOf(needle, from)) >= 0) {
            int end = idx + needle.length();
            if ((!wholeWord || isTokenBounded(question, idx, end)) && isFree(claimed, idx, end)) {
                claim(claimed, idx, end);
                matched = true;
                from = end;
            } else {
                from = idx + 1;
            }
        }
        return matched;
    }

    static boolean isTokenBounded(String text, int start, int end) {
        return (start == 0 || isSeparator(text.charAt(start - 1)))
                && (end == text.length() || isSeparator(text.charAt(end)));
    }

    private static boolean isSeparator(char c) {
        if (Character.isWhitespace(c)) {
            return true;
        }
        int type = Character.getType(c);
        return type == Character.OTHER_PUNCTUATION
                || type == Character.DASH_PUNCTUATION
                || type == Character.START_PUNCTUATION
                || type == Character.END_PUNCTUATION
                || type == Character.INITIAL_QUOTE_PUNCTUATION
                || type == Character.FINAL_QUOTE_PUNCTUATION;
    }

    private static boolean isFree(boolean[] claimed, int start, int end) {
        for (int i = start; i < end; i++) {
            if (claimed[i]) {
                return false;
            }
        }
        return true;
    }

    private static void claim(boolean[] claimed, int start, int end) {
        for (int i = start; i < end; i++) {
            claimed[i] = true;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
