package com.scipatom.atomizer.index;

/**
 * The decoded index is structurally inconsistent. Fatal: the run stops before any output is written.
 */
public class MalformedIndexException extends RuntimeException {
    public MalformedIndexException(String message) { super(message); }
    public MalformedIndexException(String message, Throwable cause) { super(message, cause); }
}
