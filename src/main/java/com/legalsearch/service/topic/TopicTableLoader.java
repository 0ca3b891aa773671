package com.legalsearch.service.topic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalsearch.exception.RetrievalException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the static topic configuration (verbs + terms) from JSON.
 */
@Slf4j
public class TopicTableLoader {

    private final ObjectMapper objectMapper;

    public TopicTableLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TopicTable load(InputStream in, String origin) {
        TopicConfig config;
        try {
            config = objectMapper.readValue(in, TopicConfig.class);
        } catch (IOException e) {
            throw new RetrievalException("Failed to read topic table from " + origin, e);
        }

        TopicTable.Builder builder = TopicTable.builder();

        for (VerbEntry verb : config.getVerbs()) {
            builder.verb(verb.getPattern(), verb.getTopic());
        }
        for (TermEntry term : config.getTerms()) {
            builder.term(term.getTerm(), term.getTopic(), term.isWholeWord());
        }

        TopicTable table = builder.build();
        log.info("Loaded topic table from {}: {} terms, {} verb patterns, {} topics",
                origin, table.getTerms().size(), table.getVerbs().size(), table.getTopics().size());
        return table;
    }

    // ============================================================
    // JSON shape
    // ============================================================

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TopicConfig {
        private List<VerbEntry> verbs = new ArrayList<>();
        private List<TermEntry> terms = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VerbEntry {
        private String pattern;
        private String topic;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TermEntry {
        private String term;
        private String topic;

        @JsonProperty("whole_word")
        private boolean wholeWord;
    }
}
