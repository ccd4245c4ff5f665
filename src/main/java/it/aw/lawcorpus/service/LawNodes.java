package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Utility per navigare l'albero JSON senza schema.
 * <p>
 * Il convertitore codifica un elemento singolo come oggetto e un elemento ripetuto
 * come array: {@link #asList(JsonNode)} riporta entrambi i casi a una lista.
 */
public final class LawNodes {

    private LawNodes() {}

    /** Nodo singolo → lista di un elemento, array → i suoi elementi, null/assente → lista vuota. */
    public static List<JsonNode> asList(JsonNode node) {
        if (isAbsent(node)) return Collections.emptyList();
        if (!node.isArray()) return List.of(node);
        List<JsonNode> items = new ArrayList<>(node.size());
        node.forEach(items::add);
        return items;
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /** Testo di un campo qualsiasi (stringa, oggetto con #text, frase annidata), "" se assente. */
    public static String text(JsonNode parent, String key) {
        if (parent == null || !parent.isObject()) return "";
        return SentenceNode.of(parent.get(key)).resolve().strip();
    }

    /** Unisce le parti non vuote con il separatore dato. */
    public static String joinNonBlank(String separator, List<String> parts) {
        List<String> kept = new ArrayList<>(parts.size());
        for (String part : parts) {
            if (part != null && !part.isBlank()) kept.add(part);
        }
        return String.join(separator, kept);
    }
}
