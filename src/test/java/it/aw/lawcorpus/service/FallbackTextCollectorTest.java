package it.aw.lawcorpus.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackTextCollector Tests")
class FallbackTextCollectorTest {

    @Test
    @DisplayName("should collect #text leaves depth-first in field order then sequence order")
    void shouldCollectInDocumentOrder() throws Exception {
        var tree = new ObjectMapper().readTree("""
                {"b": {"#text": " primo "},
                 "a": [{"#text": "secondo"}, {"x": {"#text": "terzo"}}, {"#text": ""}],
                 "plain": "ignorato",
                 "#text": "quarto",
                 "n": {"#text": 5}}
                """);

        assertThat(FallbackTextCollector.collect(tree)).containsExactly("primo", "secondo", "terzo", "quarto");
    }

    @Test
    @DisplayName("should return an empty list for trees without text")
    void shouldReturnEmptyWithoutText() throws Exception {
        assertThat(FallbackTextCollector.collect(null)).isEmpty();
        assertThat(FallbackTextCollector.collect(new ObjectMapper().readTree("{\"@Era\": \"Showa\"}"))).isEmpty();
    }
}
