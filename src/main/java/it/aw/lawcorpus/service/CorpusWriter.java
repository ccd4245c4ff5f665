package it.aw.lawcorpus.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.lawcorpus.model.CorpusEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Serializza il corpus come array JSON indentato, UTF-8, senza escape dei caratteri
 * non ASCII (default di Jackson).
 * <p>
 * Scrive su un file temporaneo accanto alla destinazione e poi lo sposta: un file
 * di output esiste solo se la scrittura è andata a buon fine.
 */
@Component
public class CorpusWriter {

    private static final Logger log = LoggerFactory.getLogger(CorpusWriter.class);

    private static final TypeReference<List<CorpusEntry>> ENTRY_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CorpusWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(List<CorpusEntry> entries, Path outputFile) throws IOException {
        Path target = outputFile.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Corpus scritto: {} ({} voci)", target, entries.size());
    }

    public List<CorpusEntry> read(Path corpusFile) throws IOException {
        return objectMapper.readValue(corpusFile.toFile(), ENTRY_LIST_TYPE);
    }
}
