package com.legalsearch.service.topic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable term/verb to topic table. Terms are held longest surface form first;
 * ties keep their configuration order. Each canonical topic name is also a term for
 * itself unless the configuration already lists that exact surface form.
 */
public final class TopicTable {

    static final String ARTICLE = "ال";

    private final List<VerbPattern> verbs;
    private final List<TopicTerm> terms;
    private final List<String> topics;

    private TopicTable(List<VerbPattern> verbs, List<TopicTerm> terms, Set<String> topics) {
        this.verbs = List.copyOf(verbs);
        this.terms = List.copyOf(terms);
        this.topics = List.copyOf(topics);
    }

    public List<VerbPattern> getVerbs() {
        return verbs;
    }

    public List<TopicTerm> getTerms() {
        return terms;
    }

    /**
     * Distinct canonical topics known to the table, in configuration order
     */
    public List<String> getTopics() {
        return topics;
    }

    public int size() {
        return terms.size() + verbs.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<VerbPattern> verbs = new ArrayList<>();
        private final List<RawTerm> terms = new ArrayList<>();

        public Builder verb(String regex, String topic) {
            verbs.add(VerbPattern.of(regex, topic));
            return this;
        }

        public Builder term(String term, String topic) {
            return term(term, topic, false);
        }

        public Builder term(String term, String topic, boolean wholeWord) {
            terms.add(new RawTerm(term, topic, wholeWord));
            return this;
        }

        public TopicTable build() {
            Set<String> ambiguous = terms.stream()
                    .filter(RawTerm::wholeWord)
                    .map(RawTerm::term)
                    .collect(Collectors.toSet());

            Set<String> topics = new LinkedHashSet<>();
            verbs.forEach(v -> topics.add(v.topic()));
            terms.forEach(t -> topics.add(t.topic()));

            // Every canonical name detects itself, so enriched queries keep their borrowed topics
            List<RawTerm> all = new ArrayList<>(terms);
            Set<String> surfaces = terms.stream().map(RawTerm::term).collect(Collectors.toSet());
            for (String topic : topics) {
                if (surfaces.add(topic)) {
                    all.add(new RawTerm(topic, topic, false));
                }
            }

            List<TopicTerm> built = new ArrayList<>(all.size());
            for (RawTerm raw : all) {
                String variant = toggleArticle(raw.term());
                if (variant != null && ambiguous.contains(variant)) {
                    variant = null;
                }
                built.add(new TopicTerm(raw.term(), raw.topic(), raw.wholeWord(), variant));
            }

            // List.sort is stable: equal lengths keep table order
            built.sort(Comparator.comparingInt(TopicTerm::length).reversed());
            return new TopicTable(verbs, built, topics);
        }
    }

    /**
     * Strips a leading definite article, or prepends one when absent.
     */
    static String toggleArticle(String term) {
        if (term == null || term.isBlank()) {
            return null;
        }
        if (term.startsWith(ARTICLE)) {
            String bare = term.substring(ARTICLE.length());
            return bare.isBlank() ? null : bare;
        }
        return ARTICLE + term;
    }

    private record RawTerm(String term, String topic, boolean wholeWord) {
    }
}
