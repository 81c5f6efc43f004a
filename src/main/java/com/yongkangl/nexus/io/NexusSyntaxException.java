package com.yongkangl.nexus.io;

public class NexusSyntaxException extends NexusException {
    public NexusSyntaxException(String message, SourcePosition position) {
        super(message, position);
    }
}
