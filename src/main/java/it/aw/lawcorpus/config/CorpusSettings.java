package it.aw.lawcorpus.config;

import it.aw.lawcorpus.model.FailurePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parametri della build del corpus, letti da {@code application.properties}.
 *
 * corpus.input-dir       directory con un file JSON per legge
 * corpus.output-file     file del corpus prodotto
 * corpus.file-suffix     suffisso dei file da elaborare
 * corpus.failure-policy  FAIL_FAST | COLLECT
 * corpus.parallelism     thread per la trasformazione dei documenti
 */
@Component
public class CorpusSettings {

    @Value("${corpus.input-dir:data/json_documents}")
    private String inputDir;

    @Value("${corpus.output-file:data/_corpus.json}")
    private String outputFile;

    @Value("${corpus.file-suffix:.json}")
    private String fileSuffix;

    @Value("${corpus.failure-policy:FAIL_FAST}")
    private FailurePolicy failurePolicy;

    @Value("${corpus.parallelism:1}")
    private int parallelism;

    public Path inputDir() {
        return Paths.get(inputDir);
    }

    public Path outputFile() {
        return Paths.get(outputFile);
    }

    public String fileSuffix() {
        return fileSuffix;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public int parallelism() {
        return Math.max(1, parallelism);
    }
}
