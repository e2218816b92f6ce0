package com.zzf.bashnorm.normalize;

/**
 * Base of every failure raised while converting a raw parse tree. Normalization is all-or-nothing:
 * any of these discards the tree under construction.
 */
public abstract class NormalizationException extends RuntimeException {

    protected NormalizationException(String message) {
        super(message);
    }

    /**
     * Short category used in diagnostics.
     */
    public abstract String category();
}
