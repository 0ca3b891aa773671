package com.legalsearch.service.topic;

import java.util.regex.Pattern;

/**
 * Person/tense variants of a legal action ("I object", "he objects") and the topic they imply.
 */
public record VerbPattern(Pattern pattern, String topic) {

    public static VerbPattern of(String regex, String topic) {
        return new VerbPattern(Pattern.compile(regex), topic);
    }
}
