package it.aw.lawcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.lawcorpus.exception.MalformedDocumentException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Legge i file JSON delle leggi.
 * <p>
 * L'unico controllo è che il file sia un oggetto JSON ben formato: non esiste
 * uno schema da validare, le anomalie di struttura sono gestite dall'estrazione.
 */
@Component
public class LawDocumentReader {

    private final ObjectMapper objectMapper;

    public LawDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode read(Path file) {
        String filename = file.getFileName().toString();
        try {
            return requireObject(filename, objectMapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new MalformedDocumentException(filename, "JSON non leggibile: " + e.getMessage(), e);
        }
    }

    public JsonNode parse(String filename, String json) {
        try {
            return requireObject(filename, objectMapper.readTree(json));
        } catch (IOException e) {
            throw new MalformedDocumentException(filename, "JSON non leggibile: " + e.getMessage(), e);
        }
    }

    /**
     * File regolari della directory con il suffisso dato, ordinati per nome.
     * L'ordine del filesystem non è deterministico: l'ordinamento fissa l'ordine del corpus.
     */
    public List<Path> listDocuments(Path inputDir, String suffix) throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.list(inputDir)) {
            stream.filter(Files::isRegularFile)
                  .filter(p -> p.getFileName().toString().endsWith(suffix))
                  .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                  .forEach(files::add);
        }
        return files;
    }

    private static JsonNode requireObject(String filename, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedDocumentException(filename, "il documento non è un oggetto JSON");
        }
        return root;
    }
}
