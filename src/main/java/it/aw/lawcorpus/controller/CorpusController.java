package it.aw.lawcorpus.controller;

import com.fasterxml.jackson.databind.JsonNode;
import it.aw.lawcorpus.exception.CorpusBuildException;
import it.aw.lawcorpus.exception.MalformedDocumentException;
import it.aw.lawcorpus.model.CorpusBuildReport;
import it.aw.lawcorpus.model.CorpusEntry;
import it.aw.lawcorpus.service.CorpusAssembler;
import it.aw.lawcorpus.service.LawDocumentReader;
import it.aw.lawcorpus.service.LawDocumentTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Espone la build del corpus e la trasformazione di una singola legge.
 *
 * Endpoint disponibili:
 *   POST /api/corpus/build      — costruisce il corpus dalla directory configurata
 *   POST /api/corpus/transform  — voci di una singola legge (JSON nel body)
 */
@RestController
@RequestMapping("/api/corpus")
public class CorpusController {

    private static final Logger log = LoggerFactory.getLogger(CorpusController.class);

    private final CorpusAssembler assembler;
    private final LawDocumentReader reader;

    public CorpusController(CorpusAssembler assembler, LawDocumentReader reader) {
        this.assembler = assembler;
        this.reader = reader;
    }

    // -------------------------------------------------------------------------
    // POST /api/corpus/build
    // -------------------------------------------------------------------------

    /**
     * Costruisce il corpus con i parametri {@code corpus.*} e restituisce il report.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/corpus/build
     */
    @PostMapping("/build")
    public ResponseEntity<CorpusBuildReport> build() {
        try {
            return ResponseEntity.ok(assembler.build());
        } catch (CorpusBuildException e) {
            log.error("Build del corpus fallita: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    // -------------------------------------------------------------------------
    // POST /api/corpus/transform
    // -------------------------------------------------------------------------

    /**
     * Trasforma una legge e restituisce le sue voci con posizioni locali 0..n-1.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/corpus/transform?name=345AC0000000048" \
     *        -H "Content-Type: application/json" --data-binary @345AC0000000048.json
     */
    @PostMapping(value = "/transform", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<CorpusEntry>> transform(
            @RequestBody String json,
            @RequestParam(value = "name", defaultValue = "document") String name) {
        try {
            JsonNode root = reader.parse(name, json);
            return ResponseEntity.ok(LawDocumentTransformer.transform(root, name));
        } catch (MalformedDocumentException e) {
            log.warn("Documento non valido: {} — {}", e.getFilename(), e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }
}
