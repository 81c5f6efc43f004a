package com.yongkangl.nexus.io;

/**
 * Well-formed input whose declarations contradict each other, such as an NTAX count that disagrees with TAXLABELS.
 */
public class NexusValidationException extends NexusException {
    public NexusValidationException(String message, SourcePosition position) {
        super(message, position);
    }
}
