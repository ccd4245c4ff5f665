package it.aw.lawcorpus.exception;

/** Il file di una legge non è leggibile o non contiene un oggetto JSON. */
public class MalformedDocumentException extends RuntimeException {

    private final String filename;

    public MalformedDocumentException(String filename, String message) {
        super(message);
        this.filename = filename;
    }

    public MalformedDocumentException(String filename, String message, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
