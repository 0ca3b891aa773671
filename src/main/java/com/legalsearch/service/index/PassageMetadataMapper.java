package com.legalsearch.service.index;

import com.legalsearch.dto.internal.LegalPassage;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns flat passage metadata, as stored next to the vectors, into a {@link LegalPassage}.
 */
public final class PassageMetadataMapper {

    public static final String TOPIC = "topic";

    private PassageMetadataMapper() {
    }

    public static LegalPassage toPassage(String id, String text, Map<String, Object> metadata) {
        Map<String, Object> meta = metadata != null ? metadata : Map.of();

        boolean hasDeadline = asBoolean(meta.get("has_deadline"));
        String deadlineDetail = hasDeadline
                ? firstString(meta, "deadline_details", "deadline_detail")
                : "";

        return LegalPassage.builder()
                .id(id)
                .text(text != null ? text : "")
                .law(asString(meta.get("law")))
                .chapter(asString(meta.get("chapter")))
                .section(asString(meta.get("section")))
                .topic(asString(meta.get(TOPIC)))
                .topicTags(asTags(meta.get("topic_tags")))
                .hasDeadline(hasDeadline)
                .deadlineDetail(deadlineDetail)
                .sourcePages(asString(meta.get("source_pages")))
                .build();
    }

    /**
     * Metadata value used for equality filtering, or null for an unknown field.
     */
    public static String fieldValue(LegalPassage passage, String field) {
        switch (field) {
            case "topic":
                return passage.getTopic();
            case "chapter":
                return passage.getChapter();
            case "section":
                return passage.getSection();
            case "law":
                return passage.getLaw();
            case "id":
                return passage.getId();
            default:
                return null;
        }
    }

    static boolean asBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        // corpus export writes Python booleans as "True"/"False"
        return value != null && "true".equalsIgnoreCase(String.valueOf(value).trim());
    }

    private static String asString(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static String firstString(Map<String, Object> meta, String... keys) {
        for (String key : keys) {
            Object value = meta.get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return "";
    }

    private static Set<String> asTags(Object value) {
        if (value == null) {
            return Set.of();
        }
        Collection<?> raw = value instanceof Collection
                ? (Collection<?>) value
                : Arrays.asList(String.valueOf(value).split(","));
        Set<String> tags = raw.stream()
                .map(String::valueOf)
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return Collections.unmodifiableSet(tags);
    }
}
