package org.dxworks.formframe.parser;

/**
 * Thrown when an import string cannot yield any document tree. It is the only import failure
 * surfaced to callers; every other problem is recovered and reported as a warning.
 */
public class MalformedInputException extends Exception {

    public MalformedInputException(String message) {
        super(message);
    }
}
