package org.calista.morphon.engine.classify;

import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.ArrayList;
import java.util.List;

/** Pure, deterministic mapping from decomposed components to an instruction class. */
public interface Classifier {

    ClassifiedToken classify(MorphemeComponents components);

    default List<ClassifiedToken> classifyAll(List<MorphemeComponents> components) {
        List<ClassifiedToken> out = new ArrayList<>(components.size());
        for (MorphemeComponents c : components) out.add(classify(c));
        return out;
    }
}
