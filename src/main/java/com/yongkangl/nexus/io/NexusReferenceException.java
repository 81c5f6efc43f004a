package com.yongkangl.nexus.io;

/**
 * A tree refers to a taxon that neither the translate table nor the taxon registry can resolve.
 */
public class NexusReferenceException extends NexusException {
    public NexusReferenceException(String message, SourcePosition position) {
        super(message, position);
    }
}
