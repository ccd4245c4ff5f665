package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Compone il titolo canonico di una legge: {@code "{numero}: {titolo} ({abbreviazione})"}.
 * <p>
 * L'abbreviazione compare solo se diversa dal titolo; il numero di legge viene
 * anteposto solo se non è già contenuto nel titolo. I campi assenti valgono "".
 */
public final class TitleComposer {

    private TitleComposer() {}

    public static String compose(JsonNode lawTitle, String lawNum) {
        String main = SentenceNode.of(lawTitle).resolve().strip();
        String abbrev = lawTitle != null && lawTitle.isObject()
                ? LawNodes.text(lawTitle, LawKeys.ATTR_ABBREV)
                : "";
        return compose(main, abbrev, lawNum);
    }

    public static String compose(String mainTitle, String abbrev, String lawNum) {
        String main = mainTitle == null ? "" : mainTitle;
        String title = main;
        if (abbrev != null && !abbrev.isEmpty() && !abbrev.equals(main)) {
            title = main + " (" + abbrev + ")";
        }
        if (lawNum != null && !lawNum.isEmpty() && !title.contains(lawNum)) {
            title = lawNum + ": " + title;
        }
        return title.strip();
    }
}
