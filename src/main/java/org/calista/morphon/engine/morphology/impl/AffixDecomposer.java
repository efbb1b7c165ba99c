package org.calista.morphon.engine.morphology.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.morphology.AffixTable;
import org.calista.morphon.engine.morphology.AffixTable.Affix;
import org.calista.morphon.engine.morphology.DecodeFailure;
import org.calista.morphon.engine.morphology.Decomposer;
import org.calista.morphon.engine.morphology.MatchOrder;
import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AffixDecomposer — maximal-munch stripping against an ordered {@link AffixTable}.
 *
 * <ol>
 *     <li>prefix at position 0; a prefix matches only if something is left after it</li>
 *     <li>no direct prefix: articulator followed by a prefix</li>
 *     <li>suffix at the end of what remains</li>
 *     <li>empty MIDDLE: keep the prefix and drop the suffix, or take the whole token as MIDDLE
 *     when there is no prefix</li>
 * </ol>
 *
 * Results are memoized per token. Safe for concurrent use.
 */
public final class AffixDecomposer implements Decomposer {
    private static final Logger log = LogManager.getLogger(AffixDecomposer.class);

    private final AffixTable table;
    private final MatchOrder order;
    private final List<Affix> prefixes;
    private final List<Affix> suffixes;
    private final Map<String, MorphemeComponents> memo = new ConcurrentHashMap<>();

    public AffixDecomposer(AffixTable table) {
        this(table, MatchOrder.LONGEST_FIRST);
    }

    public AffixDecomposer(AffixTable table, MatchOrder order) {
        this.table = Objects.requireNonNull(table, "table");
        this.order = Objects.requireNonNull(order, "order");
        this.prefixes = table.prefixes(order);
        this.suffixes = table.suffixes(order);
    }

    public AffixTable table() { return table; }

    public MatchOrder order() { return order; }

    @Override
    public MorphemeComponents decompose(String token) {
        if (token == null || token.isEmpty()) return MorphemeComponents.unparsed(token, DecodeFailure.EMPTY);
        return memo.computeIfAbsent(token, this::compute);
    }

    private MorphemeComponents compute(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (!table.inAlphabet(token.charAt(i))) {
                log.debug("Unparsed token '{}': illegal character '{}' at {}", token, token.charAt(i), i);
                return MorphemeComponents.unparsed(token, DecodeFailure.ILLEGAL_CHARACTER);
            }
        }

        String articulator = null;
        Affix prefix = findPrefix(token);
        String remainder = (prefix == null) ? token : token.substring(prefix.text.length());

        if (prefix == null) {
            for (String art : table.articulators()) {
                if (!token.startsWith(art) || token.length() <= art.length()) continue;
                String afterArt = token.substring(art.length());
                Affix p = findPrefix(afterArt);
                if (p != null) {
                    articulator = art;
                    prefix = p;
                    remainder = afterArt.substring(p.text.length());
                    break;
                }
            }
        }

        Affix suffix = findSuffix(remainder);
        String middle = (suffix == null) ? remainder : remainder.substring(0, remainder.length() - suffix.text.length());

        if (middle.isEmpty()) {
            // prefix + suffix consumed everything
            if (prefix != null) {
                return build(token, articulator, prefix, remainder, null);
            }
            return build(token, null, null, token, null);
        }
        return build(token, articulator, prefix, middle, suffix);
    }

    private Affix findPrefix(String s) {
        for (Affix p : prefixes) {
            if (s.length() > p.text.length() && s.startsWith(p.text)) return p;
        }
        return null;
    }

    private Affix findSuffix(String s) {
        for (Affix x : suffixes) {
            if (s.endsWith(x.text)) return x;
        }
        return null;
    }

    private MorphemeComponents build(String token, String articulator, Affix prefix, String middle, Affix suffix) {
        String pf = (prefix == null) ? null : prefix.family;
        return MorphemeComponents.parsed(
                token,
                articulator,
                prefix == null ? null : prefix.text,
                pf,
                table.sisterOf(pf),
                middle,
                suffix == null ? null : suffix.text,
                suffix == null ? null : suffix.family
        );
    }
}
