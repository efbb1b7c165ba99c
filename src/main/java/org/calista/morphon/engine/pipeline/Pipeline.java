package org.calista.morphon.engine.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.check.CheckEntry;
import org.calista.morphon.engine.check.ConsistencyChecker;
import org.calista.morphon.engine.check.ConstraintAssertion;
import org.calista.morphon.engine.check.SnapshotMetricProbe;
import org.calista.morphon.engine.check.Verdict;
import org.calista.morphon.engine.classify.ClassificationGap;
import org.calista.morphon.engine.classify.ClassifiedToken;
import org.calista.morphon.engine.classify.Classifier;
import org.calista.morphon.engine.classify.MatchKind;
import org.calista.morphon.engine.core.Chunks;
import org.calista.morphon.engine.core.DerivedCache;
import org.calista.morphon.engine.corpus.CorpusSnapshot;
import org.calista.morphon.engine.corpus.Record;
import org.calista.morphon.engine.corpus.SystemTag;
import org.calista.morphon.engine.graph.CompatibilityGraph;
import org.calista.morphon.engine.graph.CompatibilityGraphBuilder;
import org.calista.morphon.engine.hazard.HazardPolicy;
import org.calista.morphon.engine.hazard.HazardReport;
import org.calista.morphon.engine.hazard.HazardTable;
import org.calista.morphon.engine.hazard.HazardValidator;
import org.calista.morphon.engine.hazard.TransitionProfile;
import org.calista.morphon.engine.legality.CascadeStage;
import org.calista.morphon.engine.legality.LegalityPropagator;
import org.calista.morphon.engine.legality.LegalitySet;
import org.calista.morphon.engine.legality.VocabularyBundle;
import org.calista.morphon.engine.legality.ZoneVocabularyIndex;
import org.calista.morphon.engine.morphology.Decomposer;
import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pipeline — batch orchestrator over one immutable snapshot.
 *
 * <p>decompose (all records) → classify (executable) → graph → hazards → legality → check.
 * Per-token and per-record work runs as chunked tasks on a bounded worker pool; chunk
 * results are merged in corpus order, so output does not depend on scheduling.
 *
 * <p>Owns its pool unless one is injected; {@link #close()} only shuts down an owned pool.
 */
public final class Pipeline implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(Pipeline.class);

    private static final int MIN_CHUNK = 32;

    private final Config config;
    private final Decomposer decomposer;
    private final Classifier classifier;
    private final HazardTable hazardTable;
    private final DerivedCache cache;
    private final long tablesFingerprint;

    private final ExecutorService pool;
    private final boolean ownsPool;

    private Pipeline(Builder b) {
        this.decomposer = Objects.requireNonNull(b.decomposer, "decomposer");
        this.classifier = Objects.requireNonNull(b.classifier, "classifier");
        this.hazardTable = Objects.requireNonNull(b.hazardTable, "hazardTable");
        this.config = Objects.requireNonNull(b.config, "config").freezeAndValidate();
        this.cache = (b.cache != null) ? b.cache : new DerivedCache();
        this.tablesFingerprint = b.tablesFingerprint;

        this.ownsPool = (b.pool == null);
        this.pool = ownsPool ? createPool(config) : b.pool;

        logCreation();
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    public PipelineResult run(CorpusSnapshot corpus, List<ConstraintAssertion> assertions) {
        Objects.requireNonNull(corpus, "corpus");
        Objects.requireNonNull(assertions, "assertions");
        long t0 = System.nanoTime();

        // 1) decompose every record
        List<Record> records = corpus.records();
        List<List<List<MorphemeComponents>>> parts = Chunks.map(pool, config.parallelism, records, MIN_CHUNK,
                chunk -> {
                    List<List<MorphemeComponents>> out = new ArrayList<>(chunk.size());
                    for (Record r : chunk) out.add(decomposer.decomposeAll(r.tokens()));
                    return out;
                });
        Map<String, List<MorphemeComponents>> components = new LinkedHashMap<>();
        List<List<MorphemeComponents>> perRecord = new ArrayList<>(records.size());
        int i = 0;
        for (List<List<MorphemeComponents>> part : parts) {
            for (List<MorphemeComponents> rc : part) {
                components.put(records.get(i++).id(), rc);
                perRecord.add(rc);
            }
        }

        long unparsed = 0;
        for (List<MorphemeComponents> rc : perRecord) {
            for (MorphemeComponents c : rc) {
                if (!c.isParsed()) {
                    unparsed++;
                    log.debug("Unparsed token '{}': {}", c.token(), c.failure());
                }
            }
        }

        // 2) classify executable records
        List<Record> exec = corpus.records(SystemTag.EXECUTABLE);
        List<List<List<ClassifiedToken>>> classifiedParts = Chunks.map(pool, config.parallelism, exec, MIN_CHUNK,
                chunk -> {
                    List<List<ClassifiedToken>> out = new ArrayList<>(chunk.size());
                    for (Record r : chunk) out.add(classifier.classifyAll(components.get(r.id())));
                    return out;
                });
        Map<String, List<ClassifiedToken>> classified = new LinkedHashMap<>();
        int j = 0;
        for (List<List<ClassifiedToken>> part : classifiedParts) {
            for (List<ClassifiedToken> ct : part) classified.put(exec.get(j++).id(), ct);
        }

        Map<String, ClassificationGap> gaps = new TreeMap<>();
        for (List<ClassifiedToken> ct : classified.values()) {
            for (ClassifiedToken t : ct) {
                if (t.kind() == MatchKind.GAP) gaps.putIfAbsent(t.token(), ClassificationGap.of(t));
            }
        }

        // 3) compatibility graph (cached per snapshot + tables + threshold)
        String graphKey = DerivedCache.key("graph", corpus.fingerprint(), tablesFingerprint, config.supportThreshold);
        CompatibilityGraph graph = cache.getOrBuild(graphKey,
                () -> new CompatibilityGraphBuilder(config.supportThreshold)
                        .pool(pool, config.parallelism)
                        .build(perRecord));

        // 4) hazards (advisory)
        List<HazardValidator.RecordScan> scans;
        HazardReport hazardReport;
        TransitionProfile profile = new TransitionProfile();
        List<List<ClassifiedToken>> execSeqs = new ArrayList<>(classified.values());
        for (TransitionProfile p : Chunks.map(pool, config.parallelism, execSeqs, MIN_CHUNK, chunk -> {
            TransitionProfile local = new TransitionProfile();
            for (List<ClassifiedToken> seq : chunk) local.add(seq);
            return local;
        })) {
            profile.merge(p);
        }

        if (config.hazardPolicy == HazardPolicy.NONE) {
            scans = List.of();
            hazardReport = HazardReport.disabled();
        } else {
            HazardValidator validator = new HazardValidator(hazardTable);
            List<Map.Entry<String, List<ClassifiedToken>>> entries = new ArrayList<>(classified.entrySet());
            scans = new ArrayList<>();
            for (List<HazardValidator.RecordScan> part : Chunks.map(pool, config.parallelism, entries, MIN_CHUNK, chunk -> {
                List<HazardValidator.RecordScan> out = new ArrayList<>(chunk.size());
                for (Map.Entry<String, List<ClassifiedToken>> e : chunk) out.add(validator.scan(e.getKey(), e.getValue()));
                return out;
            })) {
                scans.addAll(part);
            }
            hazardReport = HazardReport.of(config.hazardPolicy, scans);
        }

        // 5) legality for every non-executable record
        List<MorphemeComponents> vocabulary = new ArrayList<>();
        for (Record r : exec) vocabulary.addAll(components.get(r.id()));

        ZoneVocabularyIndex.Builder zb = ZoneVocabularyIndex.builder();
        for (Record r : corpus.records(SystemTag.POSITIONAL)) {
            zb.add(r.id(), r.zone(), VocabularyBundle.fromComponents(components.get(r.id())));
        }
        LegalityPropagator propagator = new LegalityPropagator(vocabulary, graph, zb.build(), config.stages);

        List<Record> gated = new ArrayList<>();
        for (Record r : records) {
            if (r.system() != SystemTag.EXECUTABLE) gated.add(r);
        }
        List<LegalitySet> legality = new ArrayList<>(gated.size());
        for (List<LegalitySet> part : Chunks.map(pool, config.parallelism, gated, MIN_CHUNK, chunk -> {
            List<LegalitySet> out = new ArrayList<>(chunk.size());
            for (Record r : chunk) out.add(propagator.propagate(r, components.get(r.id())));
            return out;
        })) {
            legality.addAll(part);
        }

        // 6) consistency check
        List<ClassifiedToken> flat = new ArrayList<>();
        for (List<ClassifiedToken> ct : classified.values()) flat.addAll(ct);

        SnapshotMetricProbe probe = SnapshotMetricProbe.builder()
                .corpus(corpus)
                .tokens(flat)
                .unparsed(unparsed)
                .graph(graph)
                .hazards(hazardTable, hazardReport)
                .legality(legality)
                .build();
        List<CheckEntry> checks = new ConsistencyChecker(probe, config.checkTolerance).checkAll(assertions);

        PipelineResult result = new PipelineResult(corpus, components, classified, new ArrayList<>(gaps.values()),
                unparsed, graph, scans, hazardReport, profile, legality, checks);

        logSummary(result, (System.nanoTime() - t0) / 1_000_000L);
        return result;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (ownsPool) {
            shutdownExecutor(pool, config.shutdownTimeoutMs);
        } else {
            log.debug("Pipeline.close(): pool is externally owned; skipping shutdown");
        }
    }

    // ---------------------------------------------------------------------
    // Builder / Config
    // ---------------------------------------------------------------------

    public static Builder builder(Decomposer decomposer, Classifier classifier, HazardTable hazardTable) {
        return new Builder(decomposer, classifier, hazardTable);
    }

    public static final class Builder {
        private final Decomposer decomposer;
        private final Classifier classifier;
        private final HazardTable hazardTable;

        private Config config = new Config();
        private ExecutorService pool;
        private DerivedCache cache;
        private long tablesFingerprint;

        private Builder(Decomposer decomposer, Classifier classifier, HazardTable hazardTable) {
            this.decomposer = decomposer;
            this.classifier = classifier;
            this.hazardTable = hazardTable;
        }

        public Builder config(Config config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** External pool; the pipeline will not shut it down. */
        public Builder pool(ExecutorService pool) {
            this.pool = pool;
            return this;
        }

        public Builder cache(DerivedCache cache, long tablesFingerprint) {
            this.cache = cache;
            this.tablesFingerprint = tablesFingerprint;
            return this;
        }

        public Pipeline build() {
            return new Pipeline(this);
        }
    }

    public static final class Config {
        public int supportThreshold = 1;
        public List<CascadeStage> stages = List.of(CascadeStage.MIDDLE, CascadeStage.PREFIX, CascadeStage.SUFFIX);
        public HazardPolicy hazardPolicy = HazardPolicy.ADVISORY;
        public double checkTolerance = 0.5;

        public int parallelism = 1;
        public int queueCapacity = 1024;
        public String threadNamePrefix = "morphon-worker-";
        public long shutdownTimeoutMs = 2500;

        private boolean frozen;

        public Config freezeAndValidate() {
            if (frozen) return this;

            if (supportThreshold < 1) throw new IllegalArgumentException("supportThreshold must be >= 1: " + supportThreshold);
            if (stages == null) stages = List.of();
            Set<CascadeStage> seen = EnumSet.noneOf(CascadeStage.class);
            for (CascadeStage s : stages) {
                if (!seen.add(Objects.requireNonNull(s, "stage"))) {
                    throw new IllegalArgumentException("cascade stage listed twice: " + s);
                }
            }
            stages = List.copyOf(stages);
            if (hazardPolicy == null) hazardPolicy = HazardPolicy.ADVISORY;
            if (!Double.isFinite(checkTolerance) || checkTolerance < 0) checkTolerance = 0.5;

            parallelism = Math.max(1, parallelism);
            queueCapacity = Math.max(32, queueCapacity);
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) threadNamePrefix = "morphon-worker-";
            shutdownTimeoutMs = Math.max(250, shutdownTimeoutMs);

            frozen = true;
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static ExecutorService createPool(Config cfg) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = Math.max(1, cfg.parallelism);

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, cfg.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        // bounded queue + CallerRunsPolicy => backpressure
        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(cfg.queueCapacity),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        if (es == null) return;

        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                if (!es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker pool did not terminate within {} ms", timeoutMs);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }

    private void logCreation() {
        if (!log.isInfoEnabled()) return;

        log.info("\n" + LogFmt.box("Pipeline initialized", b -> {
            b.kv("decomposer", decomposer.getClass().getName());
            b.kv("classifier", classifier.getClass().getName());
            b.kv("hazardEdges", hazardTable.size());
            b.sep();
            b.kv("supportThreshold", config.supportThreshold);
            b.kv("cascadeStages", config.stages);
            b.kv("hazardPolicy", config.hazardPolicy);
            b.kv("checkTolerance", config.checkTolerance);
            b.sep();
            b.kv("parallelism", config.parallelism);
            b.kv("queueCapacity", config.queueCapacity);
            b.kv("threadNamePrefix", config.threadNamePrefix);
            b.kv("poolOwnership", ownsPool ? "owned" : "external");
        }));
    }

    private void logSummary(PipelineResult r, long elapsedMs) {
        if (!log.isInfoEnabled()) return;

        int agree = 0;
        int disagree = 0;
        int insufficient = 0;
        for (CheckEntry e : r.checks) {
            if (e.verdict == Verdict.AGREE) agree++;
            else if (e.verdict == Verdict.DISAGREE) disagree++;
            else insufficient++;
        }
        final int a = agree;
        final int d = disagree;
        final int n = insufficient;

        log.info("\n" + LogFmt.box("Run finished (" + elapsedMs + " ms)", b -> {
            b.kv("records", r.corpus.size());
            b.kv("tokens", r.corpus.tokenCount());
            b.kv("unparsed", r.unparsed);
            b.kv("classificationGaps", r.gaps.size());
            b.sep();
            b.kv("graphNodes", r.graph.nodeCount());
            b.kv("graphEdges", r.graph.edgeCount());
            b.kv("graphDensityPct", 100.0 * r.graph.density());
            b.sep();
            b.kv("hazardViolations", r.hazards.violations().size());
            b.kv("hazardCompliancePct", r.hazards.compliancePct());
            b.kv("legalitySets", r.legality.size());
            b.sep();
            b.kv("checks", a + " agree / " + d + " disagree / " + n + " insufficient");
        }));
    }
}
