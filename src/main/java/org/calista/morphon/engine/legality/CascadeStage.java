package org.calista.morphon.engine.legality;

import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.Locale;

/**
 * One filter of the legality cascade. Stages only ever remove candidates, so any
 * composition of them is an intersection.
 */
public enum CascadeStage {
    /** Candidate MIDDLE must be in the governing vocabulary. */
    MIDDLE {
        @Override
        public boolean admits(MorphemeComponents c, VocabularyBundle b) {
            return b.middles().contains(c.middle());
        }
    },
    /** Unprefixed candidates pass; otherwise the prefix must be in use. */
    PREFIX {
        @Override
        public boolean admits(MorphemeComponents c, VocabularyBundle b) {
            return !c.hasPrefix() || b.prefixes().contains(c.prefix());
        }
    },
    /** Unsuffixed candidates pass; otherwise the suffix must be in use. */
    SUFFIX {
        @Override
        public boolean admits(MorphemeComponents c, VocabularyBundle b) {
            return !c.hasSuffix() || b.suffixes().contains(c.suffix());
        }
    };

    public abstract boolean admits(MorphemeComponents candidate, VocabularyBundle bundle);

    public static CascadeStage parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("cascade stage is blank");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown cascade stage: " + s, e);
        }
    }
}
