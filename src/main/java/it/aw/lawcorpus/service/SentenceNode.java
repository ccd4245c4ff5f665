package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Nodo che porta testo, nelle quattro forme in cui il convertitore lo produce.
 * <p>
 * La forma viene decisa una sola volta da {@link #of(JsonNode)}; ogni variante
 * implementa la propria risoluzione in {@link #resolve()}. La risoluzione non
 * fallisce mai: in assenza di testo restituisce la stringa vuota.
 * <ul>
 *   <li>{@link TextLeaf}: stringa semplice, numero o oggetto con {@code #text}</li>
 *   <li>{@link Wrapped}: oggetto con un {@code Sentence} annidato</li>
 *   <li>{@link Composite}: oggetto con altri campi, attributi esclusi, in ordine di documento</li>
 *   <li>{@link NodeList}: sequenza di frasi</li>
 * </ul>
 */
public sealed interface SentenceNode
        permits SentenceNode.TextLeaf, SentenceNode.Wrapped, SentenceNode.Composite, SentenceNode.NodeList {

    String resolve();

    record TextLeaf(String text) implements SentenceNode {

        static final TextLeaf EMPTY = new TextLeaf("");

        @Override
        public String resolve() {
            return text == null ? "" : text;
        }
    }

    record Wrapped(SentenceNode inner) implements SentenceNode {

        @Override
        public String resolve() {
            return inner.resolve();
        }
    }

    /** Restituisce il primo campo che produce testo non vuoto. */
    record Composite(List<SentenceNode> fields) implements SentenceNode {

        @Override
        public String resolve() {
            for (SentenceNode field : fields) {
                String text = field.resolve();
                if (!text.isBlank()) return text;
            }
            return "";
        }
    }

    /** Risolve ogni elemento e unisce quelli non vuoti con uno spazio. */
    record NodeList(List<SentenceNode> items) implements SentenceNode {

        @Override
        public String resolve() {
            List<String> texts = new ArrayList<>(items.size());
            for (SentenceNode item : items) {
                texts.add(item.resolve());
            }
            return LawNodes.joinNonBlank(" ", texts);
        }
    }

    static SentenceNode of(JsonNode node) {
        if (LawNodes.isAbsent(node)) return TextLeaf.EMPTY;
        if (node.isArray()) {
            List<SentenceNode> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(of(item)));
            return new NodeList(items);
        }
        if (node.isObject()) {
            if (node.has(LawKeys.TEXT)) {
                JsonNode leaf = node.get(LawKeys.TEXT);
                return leaf.isContainerNode() ? new Wrapped(of(leaf)) : leaf(leaf);
            }
            if (node.has(LawKeys.SENTENCE)) {
                return new Wrapped(of(node.get(LawKeys.SENTENCE)));
            }
            List<SentenceNode> fields = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                if (!LawKeys.isAttribute(field.getKey())) fields.add(of(field.getValue()));
            }
            return new Composite(fields);
        }
        return leaf(node);
    }

    private static TextLeaf leaf(JsonNode value) {
        return LawNodes.isAbsent(value) ? TextLeaf.EMPTY : new TextLeaf(value.asText());
    }
}
