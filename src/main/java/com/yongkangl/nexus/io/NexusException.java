package com.yongkangl.nexus.io;

/**
 * Base of every failure raised while reading a NEXUS or Newick document. The message names the
 * offending position so that callers can report it without further lookup.
 */
public class NexusException extends RuntimeException {
    private final SourcePosition position;

    public NexusException(String message, SourcePosition position) {
        super(position == null ? message : message + " (" + position + ")");
        this.position = position;
    }

    public NexusException(String message, SourcePosition position, Throwable cause) {
        super(position == null ? message : message + " (" + position + ")", cause);
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
