package it.aw.lawcorpus.model;

/** File scartato durante una build in modalità {@link FailurePolicy#COLLECT}. */
public record FileFailure(String filename, String message) {}
