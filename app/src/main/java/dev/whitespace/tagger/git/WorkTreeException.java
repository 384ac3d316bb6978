package dev.whitespace.tagger.git;

/**
 * Runtime exception for failures while inspecting a Git work tree.
 */
public class WorkTreeException extends RuntimeException {

    public WorkTreeException(String message) {
        super(message);
    }

    public WorkTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
