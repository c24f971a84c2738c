package dev.ibuilder.engine;

/**
 * Thrown when the value is requested while at least one required field is still missing.
 */
public class FinalizeException extends Exception {

    public FinalizeException() {
        super("There is at least a missing field");
    }
}
