package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;
import it.aw.lawcorpus.model.CorpusEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Trasforma l'albero JSON di una legge nelle sue voci di corpus.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Titolo: {@link TitleComposer} su {@code LawTitle} e {@code LawNum}</li>
 *   <li>Disposizioni principali: un articolo per voce, anche dentro capitoli e sezioni;
 *       in assenza di articoli, un paragrafo per voce</li>
 *   <li>Disposizioni supplementari: {@link SupplementaryProvisionProcessor}, in ordine</li>
 *   <li>Nessuna voce: una sola voce con tutto il testo del documento o, se manca
 *       anche quello, con i metadati della legge</li>
 * </ol>
 * Funzione pura: nessun I/O, nessuno stato condiviso. Le posizioni restituite
 * sono locali al documento (0..n-1).
 */
public final class LawDocumentTransformer {

    private LawDocumentTransformer() {}

    /**
     * @param root       albero del file ({@code {"Law": {...}}})
     * @param sourceName nome del file, usato come titolo se la legge non ne ha uno
     */
    public static List<CorpusEntry> transform(JsonNode root, String sourceName) {
        JsonNode law = root.path(LawKeys.LAW);
        JsonNode body = law.path(LawKeys.LAW_BODY);

        String lawNum = LawNodes.text(law, LawKeys.LAW_NUM);
        String title = TitleComposer.compose(body.get(LawKeys.LAW_TITLE), lawNum);
        if (title.isEmpty()) title = sourceName;

        List<CorpusEntry> entries = new ArrayList<>(mainProvisionEntries(body.get(LawKeys.MAIN_PROVISION), title));

        List<JsonNode> provisions = LawNodes.asList(body.get(LawKeys.SUPPL_PROVISION));
        for (int i = 0; i < provisions.size(); i++) {
            entries.addAll(SupplementaryProvisionProcessor.process(provisions.get(i), i, title));
        }

        if (entries.isEmpty()) {
            entries.add(new CorpusEntry(title, fallbackBody(root, law, lawNum), 0));
        }

        List<CorpusEntry> numbered = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            numbered.add(entries.get(i).withPosition(i));
        }
        return numbered;
    }

    private static List<CorpusEntry> mainProvisionEntries(JsonNode mainProvision, String title) {
        List<CorpusEntry> entries = new ArrayList<>();
        List<JsonNode> articles = ArticleExtractor.collectArticles(mainProvision);
        for (int i = 0; i < articles.size(); i++) {
            JsonNode article = articles.get(i);
            String text = ArticleExtractor.extract(article);
            if (!text.isBlank()) {
                entries.add(new CorpusEntry(title + " - " + ArticleExtractor.label(article, i + 1), text, 0));
            }
        }
        if (articles.isEmpty()) {
            // leggi brevi: paragrafi direttamente sotto MainProvision
            for (JsonNode provision : LawNodes.asList(mainProvision)) {
                if (provision.isObject()) {
                    entries.addAll(SupplementaryProvisionProcessor.paragraphEntries(
                            provision.get(LawKeys.PARAGRAPH), title));
                }
            }
        }
        return entries;
    }

    private static String fallbackBody(JsonNode root, JsonNode law, String lawNum) {
        List<String> texts = FallbackTextCollector.collect(root);
        if (!texts.isEmpty()) return String.join("\n", texts);
        return "Law: " + lawNum + "\n"
                + "Era: " + LawNodes.text(law, LawKeys.ATTR_ERA) + ", "
                + "Year: " + LawNodes.text(law, LawKeys.ATTR_YEAR) + ", "
                + "Number: " + LawNodes.text(law, LawKeys.ATTR_NUM);
    }
}
