package com.raditha.approx.parser;

import java.io.IOException;

/**
 * Raised when a kernel source file cannot be opened or read.
 * Fatal for the run that requested the parse.
 */
public class ParseException extends IOException {

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
