package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;
import it.aw.lawcorpus.config.CorpusSettings;
import it.aw.lawcorpus.exception.CorpusBuildException;
import it.aw.lawcorpus.model.CorpusBuildReport;
import it.aw.lawcorpus.model.CorpusEntry;
import it.aw.lawcorpus.model.FailurePolicy;
import it.aw.lawcorpus.model.FileFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Costruisce il corpus di una directory di leggi.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Elenco dei file, ordinati per nome</li>
 *   <li>Per ogni file: lettura + {@link LawDocumentTransformer} (in parallelo se
 *       {@code corpus.parallelism > 1})</li>
 *   <li>Nell'ordine dei file: riscrittura delle posizioni con un unico {@link PositionCounter}</li>
 *   <li>Scrittura del corpus, una sola volta, via {@link CorpusWriter}</li>
 * </ol>
 * Con {@link FailurePolicy#FAIL_FAST} il primo errore interrompe la build senza
 * scrivere nulla; con {@link FailurePolicy#COLLECT} il file viene saltato e riportato.
 */
@Service
public class CorpusAssembler {

    private static final Logger log = LoggerFactory.getLogger(CorpusAssembler.class);

    private final LawDocumentReader reader;
    private final CorpusWriter writer;
    private final CorpusSettings settings;

    public CorpusAssembler(LawDocumentReader reader, CorpusWriter writer, CorpusSettings settings) {
        this.reader = reader;
        this.writer = writer;
        this.settings = settings;
    }

    /** Build con i parametri di configurazione. */
    public CorpusBuildReport build() {
        return build(settings.inputDir(), settings.outputFile(), settings.failurePolicy());
    }

    public CorpusBuildReport build(Path inputDir, Path outputFile, FailurePolicy policy) {
        List<Path> files;
        try {
            files = reader.listDocuments(inputDir, settings.fileSuffix());
        } catch (IOException e) {
            throw new CorpusBuildException("Directory di input non leggibile: " + inputDir, e);
        }
        log.info("Inizio build corpus: {} file in {} — policy={}, parallelism={}",
                files.size(), inputDir.toAbsolutePath(), policy, settings.parallelism());

        List<CorpusEntry> corpus = new ArrayList<>();
        List<FileFailure> failures = new ArrayList<>();
        PositionCounter positions = new PositionCounter();

        int processed;
        if (settings.parallelism() > 1) {
            processed = assembleParallel(files, policy, corpus, failures, positions);
        } else {
            processed = 0;
            for (Path file : files) {
                if (append(transformFile(file), policy, corpus, failures, positions)) processed++;
            }
        }

        try {
            writer.write(corpus, outputFile);
        } catch (IOException e) {
            throw new CorpusBuildException("Impossibile scrivere il corpus su " + outputFile.toAbsolutePath(), e);
        }
        log.info("Corpus creato: {} voci da {} file in {} ({} file scartati)",
                positions.assigned(), processed, outputFile.toAbsolutePath(), failures.size());
        return new CorpusBuildReport(processed, positions.assigned(),
                outputFile.toAbsolutePath().toString(), LocalDateTime.now(), List.copyOf(failures));
    }

    /**
     * Trasforma i documenti su un pool di thread; numerazione e accumulo restano
     * su questo thread, nell'ordine dei file.
     */
    private int assembleParallel(List<Path> files, FailurePolicy policy, List<CorpusEntry> corpus,
                                 List<FileFailure> failures, PositionCounter positions) {
        ExecutorService executor = Executors.newFixedThreadPool(settings.parallelism());
        try {
            List<Future<DocumentResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> transformFile(file)));
            }
            int processed = 0;
            for (Future<DocumentResult> future : futures) {
                if (append(future.get(), policy, corpus, failures, positions)) processed++;
            }
            return processed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CorpusBuildException("Build del corpus interrotta", e);
        } catch (ExecutionException e) {
            throw new CorpusBuildException("Errore inatteso nella trasformazione", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /** @return true se il documento è stato aggiunto al corpus */
    private boolean append(DocumentResult result, FailurePolicy policy, List<CorpusEntry> corpus,
                           List<FileFailure> failures, PositionCounter positions) {
        if (result.failure() != null) {
            if (policy == FailurePolicy.FAIL_FAST) {
                log.error("Build annullata: errore su {}", result.filename(), result.failure());
                throw new CorpusBuildException(
                        "Elaborazione fallita per " + result.filename() + ": " + result.failure().getMessage(),
                        result.failure());
            }
            log.warn("File scartato: {} — {}", result.filename(), result.failure().getMessage());
            failures.add(new FileFailure(result.filename(), result.failure().getMessage()));
            return false;
        }
        for (CorpusEntry entry : result.entries()) {
            corpus.add(entry.withPosition(positions.next()));
        }
        log.info("Elaborato: {} -> {} voci", result.filename(), result.entries().size());
        return true;
    }

    private DocumentResult transformFile(Path file) {
        String filename = file.getFileName().toString();
        try {
            JsonNode root = reader.read(file);
            List<CorpusEntry> entries = LawDocumentTransformer.transform(root, stem(filename));
            log.debug("Trasformato {}: {} voci", filename, entries.size());
            return new DocumentResult(filename, entries, null);
        } catch (RuntimeException e) {
            return new DocumentResult(filename, List.of(), e);
        }
    }

    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private record DocumentResult(String filename, List<CorpusEntry> entries, RuntimeException failure) {}
}
