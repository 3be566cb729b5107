package com.taskmate.exception;

/**
 * A tool argument is missing, malformed, or outside its allowed domain.
 * Recovered by the tool executor and reported back to the model as text.
 */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }
}
