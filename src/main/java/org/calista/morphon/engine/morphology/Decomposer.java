package org.calista.morphon.engine.morphology;

import java.util.ArrayList;
import java.util.List;

/**
 * Total, deterministic token decomposition. Never throws for token content:
 * anything outside the alphabet comes back as an unparsed value.
 */
public interface Decomposer {

    MorphemeComponents decompose(String token);

    default List<MorphemeComponents> decomposeAll(List<String> tokens) {
        List<MorphemeComponents> out = new ArrayList<>(tokens.size());
        for (String t : tokens) out.add(decompose(t));
        return out;
    }
}
