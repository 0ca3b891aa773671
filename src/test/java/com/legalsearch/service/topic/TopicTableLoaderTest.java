package com.legalsearch.service.topic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalsearch.TestFixtures;
import com.legalsearch.exception.RetrievalException;

class TopicTableLoaderTest {

    private final TopicTableLoader loader = new TopicTableLoader(new ObjectMapper());

    @Test
    void readsVerbsAndTerms() {
        String json = "{"
                + "\"verbs\": [{\"pattern\": \"طلقني|طلقها\", \"topic\": \"الطلاق\"}],"
                + "\"terms\": ["
                + "  {\"term\": \"عدة\", \"topic\": \"العدة\", \"whole_word\": true},"
                + "  {\"term\": \"حضانة\", \"topic\": \"الحضانة\"}"
                + "],"
                + "\"comment\": \"ignored\""
                + "}";

        TopicTable table = loader.load(stream(json), "inline");

        assertThat(table.getVerbs()).hasSize(1);
        assertThat(table.getTerms())
                .extracting(TopicTerm::term, TopicTerm::wholeWord)
                .containsExactly(
                        tuple("الحضانة", false),
                        tuple("الطلاق", false),
                        tuple("حضانة", false),
                        tuple("العدة", false),
                        tuple("عدة", true));
        assertThat(table.getTopics()).containsExactly("الطلاق", "العدة", "الحضانة");
    }

    @Test
    void malformedJsonFails() {
        assertThatThrownBy(() -> loader.load(stream("{\"terms\": ["), "broken"))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void bundledTableCoversCoreTopics() {
        TopicTable table = TestFixtures.topicTable();

        assertThat(table.getTopics()).contains(
                "العدة", "الحضانة", "النفقة", "الطلاق", "الخلع",
                "الشروط في عقد الزواج", "أحكام الإرث", "رفع الدعوى");
        assertThat(table.getTerms()).allSatisfy(term ->
                assertThat(term.topic()).isNotBlank());
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
