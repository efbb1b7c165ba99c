package org.calista.morphon.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.classify.ClassificationGap;
import org.calista.morphon.engine.check.CheckEntry;
import org.calista.morphon.engine.check.Verdict;
import org.calista.morphon.engine.core.EngineComposer;
import org.calista.morphon.engine.core.EngineKernel;
import org.calista.morphon.engine.events.EventStore;
import org.calista.morphon.engine.events.RunEvent;
import org.calista.morphon.engine.pipeline.Pipeline;
import org.calista.morphon.engine.pipeline.PipelineResult;
import org.calista.morphon.engine.report.ReportWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * MorphonApp — batch runner.
 *
 * Lifecycle:
 *  1) build kernel (config, report dir; no inputs yet)
 *  2) kernel.bootstrap() (corpus snapshot + tables + assertions)
 *  3) compose Pipeline
 *  4) run once, write the five reports, journal the run
 *  5) close Pipeline (owns worker pool) + Kernel
 *
 * Usage: {@code MorphonApp [config.json]}, default {@code config/config.json}.
 */
public final class MorphonApp {

    private static final Logger log = LogManager.getLogger(MorphonApp.class);

    private final Path cfgPath;
    private final Path configRoot;
    private EngineKernel kernel;
    private Pipeline pipeline;

    public static void main(String[] args) throws Exception {
        Path cfg = (args != null && args.length > 0) ? Path.of(args[0]) : Path.of("config/config.json");
        new MorphonApp(Path.of("."), cfg).run();
    }

    public MorphonApp(Path configRoot, Path cfgPath) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
    }

    public PipelineResult run() throws IOException {
        try {
            kernel = EngineKernel.builder()
                    .configRoot(configRoot)
                    .build(cfgPath);

            kernel.bootstrap();

            pipeline = EngineComposer.buildPipeline(kernel);

            String runId = "run-" + Long.toHexString(System.nanoTime());
            EventStore journal = kernel.eventStore();
            journal.append(RunEvent.of("RUN_START", runId, kernel.corpus().source(),
                    "records=" + kernel.corpus().size(), System.currentTimeMillis()));

            PipelineResult result = pipeline.run(kernel.corpus(), kernel.ledger().latestView());

            for (ClassificationGap g : result.gaps) {
                journal.append(RunEvent.of("CLASSIFICATION_GAP", runId, g.token, g.toString(), System.currentTimeMillis()));
            }
            journal.append(RunEvent.of("HAZARD_SUMMARY", runId, null,
                    "violations=" + result.hazards.violations().size() + ", compliancePct=" + result.hazards.compliancePct(),
                    System.currentTimeMillis()));
            for (CheckEntry e : result.checks) {
                if (e.verdict == Verdict.AGREE) continue;
                journal.append(RunEvent.of("CHECK", runId, e.assertionId,
                        e.verdict + "/" + e.severity + " computed=" + e.computed + " asserted=" + e.asserted,
                        System.currentTimeMillis()));
            }

            Map<String, Path> written = new ReportWriter(kernel.io(), kernel.mapper(), kernel.config().reports)
                    .writeAll(result, kernel.classTable());

            journal.append(RunEvent.of("RUN_DONE", runId, null, "reports=" + written.size(), System.currentTimeMillis()));
            return result;
        } finally {
            shutdown();
        }
    }

    private void shutdown() {
        if (pipeline != null) pipeline.close();   // owned worker pool
        if (kernel != null) kernel.close();
    }

    public EngineKernel getKernel() { return kernel; }
}
