package com.yongkangl.nexus.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.yongkangl.nexus.model.Rooting;

import java.util.Locale;

public enum RootingInterpretation {
    AS_GIVEN,
    DEFAULT_ROOTED,
    DEFAULT_UNROOTED,
    FORCE_ROOTED,
    FORCE_UNROOTED;

    public Rooting apply(Rooting stated) {
        switch (this) {
            case DEFAULT_ROOTED:
                return stated == Rooting.UNSPECIFIED ? Rooting.ROOTED : stated;
            case DEFAULT_UNROOTED:
                return stated == Rooting.UNSPECIFIED ? Rooting.UNROOTED : stated;
            case FORCE_ROOTED:
                return Rooting.ROOTED;
            case FORCE_UNROOTED:
                return Rooting.UNROOTED;
            default:
                return stated;
        }
    }

    // Accepts both FORCE_ROOTED and force-rooted.
    @JsonCreator
    public static RootingInterpretation fromString(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
