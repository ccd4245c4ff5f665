package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;
import it.aw.lawcorpus.model.CorpusEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Estrae le voci di una disposizione supplementare ({@code SupplProvision}).
 * <p>
 * Titolo base: {@code "{titolo legge} - {etichetta} ({legge di modifica})"}.
 * Scatta uno solo dei tre livelli:
 * <ol>
 *   <li>articoli: una voce per articolo non vuoto</li>
 *   <li>paragrafi, se gli articoli non hanno prodotto voci: una voce per paragrafo</li>
 *   <li>altrimenti una voce unica con tutto il testo {@code #text} della disposizione</li>
 * </ol>
 * Le posizioni restituite sono segnaposto (0): le assegna il chiamante.
 */
public final class SupplementaryProvisionProcessor {

    private SupplementaryProvisionProcessor() {}

    public static List<CorpusEntry> process(JsonNode provision, int index, String documentTitle) {
        String title = provisionTitle(provision, index, documentTitle);

        List<CorpusEntry> entries = new ArrayList<>();
        List<JsonNode> articles = ArticleExtractor.collectArticles(provision);
        for (int i = 0; i < articles.size(); i++) {
            JsonNode article = articles.get(i);
            String body = ArticleExtractor.extract(article);
            if (!body.isBlank()) {
                entries.add(new CorpusEntry(title + " - " + ArticleExtractor.label(article, i + 1), body, 0));
            }
        }
        if (!entries.isEmpty()) return entries;

        entries.addAll(paragraphEntries(provision.get(LawKeys.PARAGRAPH), title));
        if (!entries.isEmpty()) return entries;

        String fallback = String.join("\n", FallbackTextCollector.collect(provision));
        if (!fallback.isBlank()) {
            entries.add(new CorpusEntry(title, fallback, 0));
        }
        return entries;
    }

    static String provisionTitle(JsonNode provision, int index, String documentTitle) {
        String label = LawNodes.text(provision, LawKeys.SUPPL_PROVISION_LABEL);
        if (label.isEmpty()) label = "Supplementary Provision " + (index + 1);
        String amendLawNum = LawNodes.text(provision, LawKeys.ATTR_AMEND_LAW_NUM);
        return amendLawNum.isEmpty()
                ? documentTitle + " - " + label
                : documentTitle + " - " + label + " (" + amendLawNum + ")";
    }

    /** Una voce {@code "{titolo} - Paragraph {numero}"} per ogni paragrafo non vuoto. */
    static List<CorpusEntry> paragraphEntries(JsonNode paragraphs, String baseTitle) {
        List<CorpusEntry> entries = new ArrayList<>();
        List<JsonNode> list = LawNodes.asList(paragraphs);
        for (int i = 0; i < list.size(); i++) {
            JsonNode paragraph = list.get(i);
            String body = ParagraphAssembler.assemble(paragraph);
            if (body.isBlank()) continue;
            String num = LawNodes.text(paragraph, LawKeys.PARAGRAPH_NUM);
            if (num.isEmpty()) num = String.valueOf(i + 1);
            entries.add(new CorpusEntry(baseTitle + " - Paragraph " + num, body, 0));
        }
        return entries;
    }
}
