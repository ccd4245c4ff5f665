package it.aw.lawcorpus.model;

/** Comportamento del batch quando un file non può essere elaborato. */
public enum FailurePolicy {
    /** Il primo errore annulla l'intero batch; nessun output. */
    FAIL_FAST,
    /** I file in errore vengono saltati e riportati nel report. */
    COLLECT
}
