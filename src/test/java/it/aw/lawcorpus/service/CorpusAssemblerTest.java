package it.aw.lawcorpus.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.lawcorpus.config.CorpusSettings;
import it.aw.lawcorpus.exception.CorpusBuildException;
import it.aw.lawcorpus.exception.MalformedDocumentException;
import it.aw.lawcorpus.model.CorpusBuildReport;
import it.aw.lawcorpus.model.CorpusEntry;
import it.aw.lawcorpus.model.FailurePolicy;
import it.aw.lawcorpus.model.FileFailure;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

@DisplayName("CorpusAssembler Tests")
class CorpusAssemblerTest {

    @TempDir Path tempDir;

    private Path inputDir;
    private Path outputFile;
    private CorpusSettings settings;
    private CorpusWriter writer;
    private CorpusAssembler assembler;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("laws"));
        outputFile = tempDir.resolve("out").resolve("_corpus.json");

        settings = new CorpusSettings();
        ReflectionTestUtils.setField(settings, "inputDir", inputDir.toString());
        ReflectionTestUtils.setField(settings, "outputFile", outputFile.toString());
        ReflectionTestUtils.setField(settings, "fileSuffix", ".json");
        ReflectionTestUtils.setField(settings, "failurePolicy", FailurePolicy.FAIL_FAST);
        ReflectionTestUtils.setField(settings, "parallelism", 1);

        ObjectMapper objectMapper = new ObjectMapper();
        writer = new CorpusWriter(objectMapper);
        assembler = new CorpusAssembler(new LawDocumentReader(objectMapper), writer, settings);
    }

    private static String law(String lawNum, int articles) {
        String items = IntStream.rangeClosed(1, articles)
                .mapToObj(i -> "{\"ArticleTitle\": \"第" + i + "条\", "
                        + "\"Paragraph\": {\"ParagraphSentence\": {\"Sentence\": \"" + lawNum + " 本文" + i + "\"}}}")
                .collect(Collectors.joining(", "));
        return "{\"Law\": {\"LawNum\": \"" + lawNum + "\", \"LawBody\": {\"LawTitle\": \"法\", "
                + "\"MainProvision\": {\"Article\": [" + items + "]}}}}";
    }

    private void writeInput(String filename, String content) throws IOException {
        Files.writeString(inputDir.resolve(filename), content, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should number entries densely across files processed in filename order")
    void shouldNumberEntriesAcrossSortedFiles() throws IOException {
        writeInput("b.json", law("乙", 2));
        writeInput("a.json", law("甲", 1));
        writeInput("c.json", law("丙", 3));
        writeInput("notes.txt", "not a law");

        CorpusBuildReport report = assembler.build();

        assertThat(report.filesProcessed()).isEqualTo(3);
        assertThat(report.entryCount()).isEqualTo(6);
        assertThat(report.failures()).isEmpty();

        List<CorpusEntry> corpus = writer.read(outputFile);
        assertThat(corpus).extracting(CorpusEntry::position).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(corpus).extracting(CorpusEntry::title).containsExactly(
                "甲: 法 - 第1条",
                "乙: 法 - 第1条", "乙: 法 - 第2条",
                "丙: 法 - 第1条", "丙: 法 - 第2条", "丙: 法 - 第3条");
    }

    @Test
    @DisplayName("should abort without writing any output on the first malformed file")
    void shouldFailFastWithoutOutput() throws IOException {
        writeInput("a.json", law("甲", 1));
        writeInput("b.json", "{\"Law\": ");
        writeInput("c.json", law("丙", 1));

        assertThatThrownBy(() -> assembler.build())
                .isInstanceOf(CorpusBuildException.class)
                .hasMessageContaining("b.json")
                .hasCauseInstanceOf(MalformedDocumentException.class);
        assertThat(outputFile).doesNotExist();
    }

    @Test
    @DisplayName("should reject a document that is not a JSON object")
    void shouldRejectNonObjectDocument() throws IOException {
        writeInput("a.json", "[1, 2, 3]");

        assertThatThrownBy(() -> assembler.build()).isInstanceOf(CorpusBuildException.class);
        assertThat(outputFile).doesNotExist();
    }

    @Test
    @DisplayName("should skip and report malformed files under the collect policy")
    void shouldCollectFailures() throws IOException {
        writeInput("a.json", law("甲", 1));
        writeInput("b.json", "{broken");
        writeInput("c.json", law("丙", 2));

        CorpusBuildReport report = assembler.build(inputDir, outputFile, FailurePolicy.COLLECT);

        assertThat(report.filesProcessed()).isEqualTo(2);
        assertThat(report.entryCount()).isEqualTo(3);
        assertThat(report.failures()).extracting(FileFailure::filename).containsExactly("b.json");
        assertThat(writer.read(outputFile)).extracting(CorpusEntry::position).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("should produce the same corpus with a worker pool as sequentially")
    void shouldMatchSequentialOutputWhenParallel() throws IOException {
        for (int i = 0; i < 12; i++) {
            writeInput(String.format("law%02d.json", i), law("第" + i + "号", 1 + i % 3));
        }
        assembler.build();
        List<CorpusEntry> sequential = writer.read(outputFile);

        ReflectionTestUtils.setField(settings, "parallelism", 4);
        Path parallelOutput = tempDir.resolve("parallel.json");
        assembler.build(inputDir, parallelOutput, FailurePolicy.FAIL_FAST);

        assertThat(writer.read(parallelOutput)).isEqualTo(sequential);
    }

    @Test
    @DisplayName("should write an empty corpus for an empty directory")
    void shouldWriteEmptyCorpus() throws IOException {
        CorpusBuildReport report = assembler.build();

        assertThat(report.entryCount()).isZero();
        assertThat(writer.read(outputFile)).isEmpty();
    }

    @Test
    @DisplayName("should fail when the input directory does not exist")
    void shouldFailOnMissingInputDirectory() {
        assertThatThrownBy(() -> assembler.build(tempDir.resolve("missing"), outputFile, FailurePolicy.COLLECT))
                .isInstanceOf(CorpusBuildException.class);
    }
}
