package it.aw.lawcorpus.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Voce del corpus: un articolo (o paragrafo, o testo di ripiego) con il suo titolo.
 * <p>
 * La posizione nasce locale al documento e viene riscritta una sola volta,
 * via {@link #withPosition(int)}, dall'assemblatore del corpus al valore globale.
 */
@JsonPropertyOrder({"title", "body", "position"})
public record CorpusEntry(
        String title,
        String body,
        int    position     // 0-based, densa su tutto il corpus
) {
    public CorpusEntry withPosition(int newPosition) {
        return new CorpusEntry(title, body, newPosition);
    }
}
