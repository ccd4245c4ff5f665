package it.aw.lawcorpus.service;

/**
 * Contatore delle posizioni globali del corpus, a partire da 0.
 * <p>
 * Ne esiste uno per build, posseduto da {@link CorpusAssembler}: non è thread-safe
 * e non deve uscire dal thread che assegna le posizioni.
 */
public class PositionCounter {

    private int next;

    public int next() {
        return next++;
    }

    /** Numero di posizioni assegnate finora. */
    public int assigned() {
        return next;
    }
}
