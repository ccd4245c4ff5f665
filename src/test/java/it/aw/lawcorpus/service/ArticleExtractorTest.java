package it.aw.lawcorpus.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ArticleExtractor Tests")
class ArticleExtractorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    @DisplayName("should render heading with caption and paragraphs separated by a blank line")
    void shouldRenderHeadingAndParagraphs() throws Exception {
        JsonNode article = json("""
                {"@Num": "1", "ArticleCaption": "（定義）", "ArticleTitle": "第二条",
                 "Paragraph": [
                   {"ParagraphNum": null, "ParagraphSentence": {"Sentence": "第一項"}},
                   {"ParagraphNum": "２", "ParagraphSentence": {"Sentence": "第二項"}}
                 ]}
                """);

        assertThat(ArticleExtractor.extract(article))
                .isEqualTo("## 第二条 （定義）\n\n第一項\n\n第二項");
    }

    @Test
    @DisplayName("should accept a single paragraph object")
    void shouldAcceptSingleParagraph() throws Exception {
        JsonNode article = json("""
                {"ArticleTitle": "第一条", "Paragraph": {"ParagraphSentence": {"Sentence": "本文"}}}
                """);

        assertThat(ArticleExtractor.extract(article)).isEqualTo("## 第一条\n\n本文");
    }

    @Test
    @DisplayName("should mine unrecognized fields and skip delete/hide attributes")
    void shouldMineUnrecognizedFields() throws Exception {
        JsonNode article = json("""
                {"@Delete": "false", "@Hide": "false", "ArticleTitle": "第五条",
                 "SupplNote": {"#text": "（注記）"}}
                """);

        assertThat(ArticleExtractor.extract(article)).isEqualTo("## 第五条\n\n（注記）");
    }

    @Test
    @DisplayName("should yield empty text for an article without title and content")
    void shouldYieldEmptyForEmptyArticle() throws Exception {
        assertThat(ArticleExtractor.extract(json("{\"@Num\": \"9\", \"Paragraph\": {\"ParagraphNum\": null}}")))
                .isEmpty();
    }

    @Test
    @DisplayName("should synthesize the label from the ordinal when the title is missing")
    void shouldSynthesizeLabel() throws Exception {
        assertThat(ArticleExtractor.label(json("{\"ArticleTitle\": \"第七条\"}"), 3)).isEqualTo("第七条");
        assertThat(ArticleExtractor.label(json("{\"Paragraph\": {}}"), 3)).isEqualTo("Article 3");
    }

    @Test
    @DisplayName("should collect articles nested in parts, chapters and sections in document order")
    void shouldCollectNestedArticles() throws Exception {
        JsonNode mainProvision = json("""
                {"Part": {"PartTitle": "第一編",
                  "Chapter": [
                    {"ChapterTitle": "第一章", "Article": {"ArticleTitle": "第一条"}},
                    {"ChapterTitle": "第二章",
                     "Section": [
                       {"SectionTitle": "第一節", "Article": [{"ArticleTitle": "第二条"}, {"ArticleTitle": "第三条"}]},
                       {"SectionTitle": "第二節", "Subsection": {"Division": {"Article": {"ArticleTitle": "第四条"}}}}
                     ]}
                  ]}}
                """);

        List<JsonNode> articles = ArticleExtractor.collectArticles(mainProvision);

        assertThat(articles.stream().map(a -> a.get("ArticleTitle").asText()).collect(Collectors.toList()))
                .containsExactly("第一条", "第二条", "第三条", "第四条");
    }
}
