package com.raditha.approx.generation;

/**
 * A single variant could not be written. The generator logs it and moves on.
 */
public class GenerationException extends Exception {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
