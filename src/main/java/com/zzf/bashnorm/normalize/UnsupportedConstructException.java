package com.zzf.bashnorm.normalize;

import com.zzf.bashnorm.syntax.RawKind;

/**
 * A grammar shape the normalized grammar deliberately excludes.
 */
public class UnsupportedConstructException extends NormalizationException {

    private final RawKind rawKind;

    public UnsupportedConstructException(RawKind rawKind) {
        this(rawKind, "Unsupported: " + rawKind.tag());
    }

    public UnsupportedConstructException(RawKind rawKind, String message) {
        super(message);
        this.rawKind = rawKind;
    }

    public RawKind getRawKind() {
        return rawKind;
    }

    @Override
    public String category() {
        return "unsupported-construct";
    }
}
