package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rende un articolo: riga di intestazione ({@code ## titolo (rubrica)}) seguita
 * dai paragrafi, separati da una riga vuota.
 * <p>
 * I campi non riconosciuti dell'articolo passano comunque da {@link ParagraphAssembler}.
 * Un articolo senza titolo e senza contenuto produce "": il chiamante lo scarta.
 */
public final class ArticleExtractor {

    private static final String HEADING_PREFIX = "## ";

    private static final Set<String> HANDLED = Set.of(
            LawKeys.ARTICLE_TITLE, LawKeys.ARTICLE_CAPTION, LawKeys.PARAGRAPH);

    private ArticleExtractor() {}

    public static String extract(JsonNode article) {
        if (article == null || !article.isObject()) return ParagraphAssembler.assemble(article);

        List<String> parts = new ArrayList<>();
        String heading = LawNodes.joinNonBlank(" ", List.of(
                LawNodes.text(article, LawKeys.ARTICLE_TITLE),
                LawNodes.text(article, LawKeys.ARTICLE_CAPTION)));
        if (!heading.isEmpty()) parts.add(HEADING_PREFIX + heading);

        for (JsonNode paragraph : LawNodes.asList(article.get(LawKeys.PARAGRAPH))) {
            parts.add(ParagraphAssembler.assemble(paragraph));
        }

        Iterator<Map.Entry<String, JsonNode>> it = article.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            if (HANDLED.contains(field.getKey()) || LawKeys.isAttribute(field.getKey())) continue;
            parts.add(ParagraphAssembler.assemble(field.getValue()));
        }
        return LawNodes.joinNonBlank("\n\n", parts);
    }

    /** Titolo dell'articolo per la voce del corpus, oppure {@code "Article {ordinal}"}. */
    public static String label(JsonNode article, int ordinal) {
        String title = LawNodes.text(article, LawKeys.ARTICLE_TITLE);
        return title.isEmpty() ? "Article " + ordinal : title;
    }

    /**
     * Articoli di un contenitore in ordine di documento, anche se annidati in
     * Part / Chapter / Section / Subsection / Division.
     */
    public static List<JsonNode> collectArticles(JsonNode container) {
        List<JsonNode> articles = new ArrayList<>();
        for (JsonNode node : LawNodes.asList(container)) {
            collectArticles(node, articles);
        }
        return articles;
    }

    private static void collectArticles(JsonNode node, List<JsonNode> articles) {
        if (!node.isObject()) return;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            if (LawKeys.ARTICLE.equals(field.getKey())) {
                articles.addAll(LawNodes.asList(field.getValue()));
            } else if (LawKeys.ARTICLE_GROUPS.contains(field.getKey())) {
                for (JsonNode group : LawNodes.asList(field.getValue())) {
                    collectArticles(group, articles);
                }
            }
        }
    }
}
