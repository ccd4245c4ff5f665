package it.aw.lawcorpus.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Esito di una build del corpus.
 * <p>
 * Restituito da POST /api/corpus/build e loggato dal runner di avvio.
 */
public record CorpusBuildReport(
        int               filesProcessed,   // file trasformati con successo
        int               entryCount,       // voci scritte (posizioni 0..entryCount-1)
        String            outputFile,
        LocalDateTime     builtAt,
        List<FileFailure> failures          // vuota in FAIL_FAST
) {}
