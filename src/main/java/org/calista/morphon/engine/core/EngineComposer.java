package org.calista.morphon.engine.core;

import org.calista.morphon.engine.classify.Classifier;
import org.calista.morphon.engine.classify.impl.TableClassifier;
import org.calista.morphon.engine.pipeline.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wires a {@link Pipeline} from a bootstrapped kernel and its config.
 */
public final class EngineComposer {

    private static final Logger log = LoggerFactory.getLogger(EngineComposer.class);

    private EngineComposer() {}

    public static Pipeline.Config pipelineConfig(EngineConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        Pipeline.Config c = new Pipeline.Config();
        c.supportThreshold = cfg.graph.supportThreshold;
        c.stages = cfg.cascadeStages();
        c.hazardPolicy = cfg.hazardPolicy();
        c.checkTolerance = cfg.check.tolerance;
        c.parallelism = cfg.resolvedParallelism();
        c.queueCapacity = cfg.workers.queueCapacity;
        c.threadNamePrefix = cfg.workers.threadNamePrefix;
        c.shutdownTimeoutMs = cfg.workers.shutdownTimeoutMs;
        return c;
    }

    public static Pipeline buildPipeline(EngineKernel kernel) {
        Objects.requireNonNull(kernel, "kernel");
        EngineConfig cfg = kernel.config();

        Classifier classifier = new TableClassifier(kernel.classTable(), cfg.unparsedPolicy());
        Pipeline p = Pipeline.builder(kernel.decomposer(), classifier, kernel.hazardTable())
                .config(pipelineConfig(cfg))
                .cache(kernel.cache(), kernel.tablesFingerprint())
                .build();

        log.debug("Pipeline composed: matchOrder={}, unparsedPolicy={}", cfg.matchOrder(), cfg.unparsedPolicy().label());
        return p;
    }
}
