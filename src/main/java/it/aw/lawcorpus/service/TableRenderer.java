package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converte le tabelle ({@code TableStruct} / {@code Table}) in righe markdown.
 * <p>
 * Tabelle, righe e colonne possono arrivare come elemento singolo o come array:
 * ogni livello viene normalizzato a lista. Ogni colonna è una frase risolta con
 * {@link SentenceNode}. Le righe con tutte le celle vuote vengono scartate; le
 * celle vuote di una riga non vuota restano, per non spostare le colonne.
 */
public final class TableRenderer {

    private TableRenderer() {}

    /**
     * @param tables un {@code TableStruct}, una {@code Table} o un array di questi
     * @return righe {@code | c1 | c2 |} separate da newline, "" se non c'è testo
     */
    public static String render(JsonNode tables) {
        List<String> rendered = new ArrayList<>();
        for (JsonNode entry : LawNodes.asList(tables)) {
            JsonNode table = entry.isObject() && entry.has(LawKeys.TABLE) ? entry.get(LawKeys.TABLE) : entry;
            for (JsonNode single : LawNodes.asList(table)) {
                rendered.add(renderTable(single));
            }
        }
        return LawNodes.joinNonBlank("\n", rendered);
    }

    private static String renderTable(JsonNode table) {
        // una tabella senza TableRow è trattata come riga singola
        JsonNode rows = table.isObject() && table.has(LawKeys.TABLE_ROW) ? table.get(LawKeys.TABLE_ROW) : table;
        List<String> lines = new ArrayList<>();
        for (JsonNode row : LawNodes.asList(rows)) {
            if (!row.isObject() || !row.has(LawKeys.TABLE_COLUMN)) continue;
            String line = renderRow(LawNodes.asList(row.get(LawKeys.TABLE_COLUMN)));
            if (line != null) lines.add(line);
        }
        return String.join("\n", lines);
    }

    private static String renderRow(List<JsonNode> columns) {
        List<String> cells = new ArrayList<>(columns.size());
        boolean empty = true;
        for (JsonNode column : columns) {
            String cell = SentenceNode.of(column).resolve().strip().replace('\n', ' ');
            if (!cell.isEmpty()) empty = false;
            cells.add(cell);
        }
        if (empty) return null;
        return "| " + String.join(" | ", cells) + " |";
    }
}
