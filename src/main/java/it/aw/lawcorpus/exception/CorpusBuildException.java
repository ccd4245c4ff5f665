package it.aw.lawcorpus.exception;

/** La costruzione del corpus è stata interrotta; nessun file di output è stato scritto. */
public class CorpusBuildException extends RuntimeException {

    public CorpusBuildException(String message) {
        super(message);
    }

    public CorpusBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
