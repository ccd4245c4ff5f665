package it.aw.lawcorpus.service;

import java.util.Set;

/**
 * Nomi dei campi prodotti dalla conversione XML → JSON delle leggi.
 * <p>
 * Convenzione del convertitore: gli attributi XML hanno il prefisso {@code @},
 * il testo di un elemento con attributi finisce sotto {@code #text}, un elemento
 * senza attributi con solo testo diventa una stringa semplice.
 */
public final class LawKeys {

    public static final String ATTRIBUTE_PREFIX = "@";
    public static final String TEXT = "#text";

    public static final String LAW = "Law";
    public static final String LAW_NUM = "LawNum";
    public static final String LAW_BODY = "LawBody";
    public static final String LAW_TITLE = "LawTitle";
    public static final String MAIN_PROVISION = "MainProvision";
    public static final String SUPPL_PROVISION = "SupplProvision";
    public static final String SUPPL_PROVISION_LABEL = "SupplProvisionLabel";

    public static final String ARTICLE = "Article";
    public static final String ARTICLE_TITLE = "ArticleTitle";
    public static final String ARTICLE_CAPTION = "ArticleCaption";
    public static final String PARAGRAPH = "Paragraph";
    public static final String PARAGRAPH_NUM = "ParagraphNum";
    public static final String PARAGRAPH_SENTENCE = "ParagraphSentence";
    public static final String SENTENCE = "Sentence";

    public static final String LIST = "List";
    public static final String LIST_SENTENCE = "ListSentence";

    public static final String TABLE_STRUCT = "TableStruct";
    public static final String TABLE = "Table";
    public static final String TABLE_ROW = "TableRow";
    public static final String TABLE_COLUMN = "TableColumn";

    public static final String ATTR_ABBREV = "@Abbrev";
    public static final String ATTR_AMEND_LAW_NUM = "@AmendLawNum";
    public static final String ATTR_ERA = "@Era";
    public static final String ATTR_YEAR = "@Year";
    public static final String ATTR_NUM = "@Num";

    /** Contenitori che raggruppano articoli senza portare testo proprio. */
    public static final Set<String> ARTICLE_GROUPS =
            Set.of("Part", "Chapter", "Section", "Subsection", "Division");

    private LawKeys() {}

    public static boolean isAttribute(String key) {
        return key.startsWith(ATTRIBUTE_PREFIX);
    }
}
