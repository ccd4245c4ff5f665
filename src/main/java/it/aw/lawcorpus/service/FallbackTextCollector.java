package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Raccolta esaustiva di ripiego: tutte le stringhe sotto {@code #text}, ripulite
 * dagli spazi, scartando quelle vuote.
 * <p>
 * Visita in profondità: i campi di un oggetto nell'ordine in cui compaiono nel
 * documento (Jackson conserva l'ordine di inserimento), poi gli elementi di un
 * array nel loro ordine. L'ordine del testo in uscita dipende solo dall'albero.
 */
public final class FallbackTextCollector {

    private FallbackTextCollector() {}

    public static List<String> collect(JsonNode root) {
        List<String> texts = new ArrayList<>();
        collect(root, texts);
        return texts;
    }

    private static void collect(JsonNode node, List<String> texts) {
        if (LawNodes.isAbsent(node)) return;
        if (node.isArray()) {
            node.forEach(item -> collect(item, texts));
            return;
        }
        if (!node.isObject()) return;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode value = field.getValue();
            if (LawKeys.TEXT.equals(field.getKey()) && value.isTextual()) {
                String text = value.asText().strip();
                if (!text.isEmpty()) texts.add(text);
            } else {
                collect(value, texts);
            }
        }
    }
}
