package org.calista.morphon.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.classify.UnparsedPolicy;
import org.calista.morphon.engine.classify.impl.TableClassifier;
import org.calista.morphon.engine.core.EngineConfig;
import org.calista.morphon.engine.core.EngineKernel;
import org.calista.morphon.engine.corpus.CorpusLoader;
import org.calista.morphon.engine.corpus.CorpusSnapshot;
import org.calista.morphon.engine.hazard.HazardTable;
import org.calista.morphon.engine.morphology.AffixTable;
import org.calista.morphon.engine.morphology.impl.AffixDecomposer;
import org.calista.morphon.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** Bundled tables and sample corpus, loaded once per JVM. */
public final class Fixtures {

    public static final ObjectMapper MAPPER = EngineKernel.Builder.defaultMapper();

    private static final FileIO IO = new FileIO(Path.of(System.getProperty("java.io.tmpdir")));

    private static AffixTable affixes;
    private static AffixDecomposer decomposer;
    private static ClassTable classes;
    private static HazardTable hazards;

    private Fixtures() {}

    public static FileIO io() {
        return IO;
    }

    public static synchronized AffixTable affixes() {
        if (affixes == null) {
            affixes = AffixTable.fromJson("test:affixes", resource(EngineConfig.DEFAULT_AFFIXES), MAPPER);
        }
        return affixes;
    }

    public static synchronized AffixDecomposer decomposer() {
        if (decomposer == null) decomposer = new AffixDecomposer(affixes());
        return decomposer;
    }

    public static synchronized ClassTable classes() {
        if (classes == null) {
            classes = ClassTable.fromJson("test:classes", resource(EngineConfig.DEFAULT_CLASSES), MAPPER, decomposer());
        }
        return classes;
    }

    public static synchronized HazardTable hazards() {
        if (hazards == null) {
            hazards = HazardTable.fromJson("test:hazards", resource(EngineConfig.DEFAULT_HAZARDS), MAPPER);
        }
        return hazards;
    }

    public static TableClassifier classifier() {
        return new TableClassifier(classes(), UnparsedPolicy.DROP);
    }

    public static CorpusSnapshot sampleCorpus() {
        try {
            return new CorpusLoader(IO, MAPPER).loadResource(EngineConfig.DEFAULT_CORPUS);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String resource(String name) {
        try {
            return IO.readResource(name);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
