package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rende il contenuto misto di un paragrafo come testo unico.
 * <p>
 * Ordine fisso, parti non vuote unite da uno spazio:
 * <ol>
 *   <li>frase diretta ({@code ParagraphSentence})</li>
 *   <li>elenco ({@code List}), ogni voce come {@code "- testo"}</li>
 *   <li>tabelle ({@code TableStruct}) in markdown via {@link TableRenderer}</li>
 *   <li>tutti gli altri campi non attributo, in ordine di documento, ricorsivamente</li>
 * </ol>
 * L'ultimo passo raccoglie varianti dello schema non documentate (voci {@code Item},
 * {@code Subitem1}, didascalie...) invece di perderle.
 */
public final class ParagraphAssembler {

    private static final Set<String> HANDLED = Set.of(
            LawKeys.PARAGRAPH_SENTENCE, LawKeys.LIST, LawKeys.TABLE_STRUCT, LawKeys.PARAGRAPH_NUM);

    private ParagraphAssembler() {}

    /**
     * @param node un paragrafo, un array di paragrafi o un qualsiasi sotto-albero
     * @return testo del nodo, eventualmente vuoto
     */
    public static String assemble(JsonNode node) {
        if (LawNodes.isAbsent(node)) return "";
        if (node.isArray()) {
            List<String> parts = new ArrayList<>(node.size());
            node.forEach(item -> parts.add(assemble(item)));
            return LawNodes.joinNonBlank(" ", parts);
        }
        if (node.isObject()) return assembleObject(node);
        return node.isTextual() ? node.asText().strip() : "";
    }

    private static String assembleObject(JsonNode paragraph) {
        List<String> parts = new ArrayList<>();
        if (paragraph.has(LawKeys.PARAGRAPH_SENTENCE)) {
            parts.add(SentenceNode.of(paragraph.get(LawKeys.PARAGRAPH_SENTENCE)).resolve().strip());
        }
        if (paragraph.has(LawKeys.LIST)) {
            parts.add(renderList(paragraph.get(LawKeys.LIST)));
        }
        if (paragraph.has(LawKeys.TABLE_STRUCT)) {
            parts.add(TableRenderer.render(paragraph.get(LawKeys.TABLE_STRUCT)));
        }
        Iterator<Map.Entry<String, JsonNode>> it = paragraph.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            if (HANDLED.contains(field.getKey()) || LawKeys.isAttribute(field.getKey())) continue;
            parts.add(assemble(field.getValue()));
        }
        return LawNodes.joinNonBlank(" ", parts);
    }

    private static String renderList(JsonNode list) {
        List<String> items = new ArrayList<>();
        for (JsonNode item : LawNodes.asList(list)) {
            JsonNode sentence = item.isObject() && item.has(LawKeys.LIST_SENTENCE)
                    ? item.get(LawKeys.LIST_SENTENCE)
                    : item;
            String text = SentenceNode.of(sentence).resolve().strip();
            if (!text.isEmpty()) items.add("- " + text);
        }
        return String.join(" ", items);
    }
}
