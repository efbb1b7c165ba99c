package org.calista.morphon.engine.morphology;

import java.util.Objects;

/**
 * Result of decomposing one token: [ARTICULATOR] + PREFIX? + MIDDLE + SUFFIX?.
 *
 * <p>Parsed components always carry a non-empty MIDDLE. Unparsed tokens carry a
 * {@link DecodeFailure} and no morphemes; they are kept for accounting only.
 * Optional parts are {@code null} when absent.
 */
public final class MorphemeComponents {

    private final String token;
    private final String articulator;
    private final String prefix;
    private final String prefixFamily;
    private final String sister;
    private final String middle;
    private final String suffix;
    private final String suffixFamily;
    private final DecodeFailure failure;

    private MorphemeComponents(String token, String articulator, String prefix, String prefixFamily, String sister,
                               String middle, String suffix, String suffixFamily, DecodeFailure failure) {
        this.token = Objects.requireNonNull(token, "token");
        this.articulator = articulator;
        this.prefix = prefix;
        this.prefixFamily = prefixFamily;
        this.sister = sister;
        this.middle = middle;
        this.suffix = suffix;
        this.suffixFamily = suffixFamily;
        this.failure = failure;
    }

    public static MorphemeComponents parsed(String token, String articulator,
                                            String prefix, String prefixFamily, String sister,
                                            String middle,
                                            String suffix, String suffixFamily) {
        if (middle == null || middle.isEmpty()) {
            throw new IllegalArgumentException("MIDDLE is mandatory: " + token);
        }
        if ((prefix == null) != (prefixFamily == null)) {
            throw new IllegalArgumentException("prefix and prefixFamily must be both set or both absent: " + token);
        }
        if ((suffix == null) != (suffixFamily == null)) {
            throw new IllegalArgumentException("suffix and suffixFamily must be both set or both absent: " + token);
        }
        return new MorphemeComponents(token, articulator, prefix, prefixFamily, sister,
                middle, suffix, suffixFamily, null);
    }

    public static MorphemeComponents unparsed(String token, DecodeFailure failure) {
        return new MorphemeComponents(token == null ? "" : token, null, null, null, null,
                null, null, null, Objects.requireNonNull(failure, "failure"));
    }

    public String token() { return token; }
    public String articulator() { return articulator; }
    public String prefix() { return prefix; }
    public String prefixFamily() { return prefixFamily; }
    public String sister() { return sister; }
    public String middle() { return middle; }
    public String suffix() { return suffix; }
    public String suffixFamily() { return suffixFamily; }
    public DecodeFailure failure() { return failure; }

    public boolean isParsed() { return failure == null; }
    public boolean hasPrefix() { return prefix != null; }
    public boolean hasSuffix() { return suffix != null; }

    /** No prefix: routes to the restricted bare-form classes. */
    public boolean isBare() { return isParsed() && prefix == null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MorphemeComponents)) return false;
        MorphemeComponents that = (MorphemeComponents) o;
        return token.equals(that.token)
                && Objects.equals(articulator, that.articulator)
                && Objects.equals(prefix, that.prefix)
                && Objects.equals(prefixFamily, that.prefixFamily)
                && Objects.equals(sister, that.sister)
                && Objects.equals(middle, that.middle)
                && Objects.equals(suffix, that.suffix)
                && Objects.equals(suffixFamily, that.suffixFamily)
                && failure == that.failure;
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, articulator, prefix, prefixFamily, sister, middle, suffix, suffixFamily, failure);
    }

    @Override
    public String toString() {
        if (!isParsed()) return token + " => UNPARSED(" + failure + ")";
        StringBuilder b = new StringBuilder(token.length() * 3 + 16);
        b.append(token).append(" => ");
        if (articulator != null) b.append(articulator).append('+');
        if (prefix != null) b.append(prefix).append('[').append(prefixFamily).append("]+");
        b.append('<').append(middle).append('>');
        if (suffix != null) b.append('+').append(suffix).append('[').append(suffixFamily).append(']');
        return b.toString();
    }
}
