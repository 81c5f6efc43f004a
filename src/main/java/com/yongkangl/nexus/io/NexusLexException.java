package com.yongkangl.nexus.io;

/**
 * Malformed characters: an unterminated quoted label or comment, or a stray closing bracket.
 */
public class NexusLexException extends NexusException {
    public NexusLexException(String message, SourcePosition position) {
        super(message, position);
    }
}
