package org.calista.morphon.engine.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.morphon.engine.check.AssertionLedger;
import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.corpus.CorpusLoader;
import org.calista.morphon.engine.corpus.CorpusSnapshot;
import org.calista.morphon.engine.events.EventStore;
import org.calista.morphon.engine.hazard.HazardTable;
import org.calista.morphon.engine.morphology.AffixTable;
import org.calista.morphon.engine.morphology.Decomposer;
import org.calista.morphon.engine.morphology.impl.AffixDecomposer;
import org.calista.morphon.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * EngineKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config)  -> loadOrCreate config + init report IO / journal (NO inputs loaded)
 *   2) bootstrap()    -> load corpus snapshot, affix/class/hazard tables, assertion ledger
 *   3) use            -> Pipeline runs against the loaded inputs
 *   4) close()
 *
 * Malformed inputs fail bootstrap with {@link InvalidInputException}.
 */
public final class EngineKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EngineKernel.class);

    private final FileIO io;
    private final FileIO external;
    private final ObjectMapper mapper;
    private final EngineConfig cfg;
    private final EventStore events;
    private final DerivedCache cache = new DerivedCache();

    // bootstrap state
    private volatile boolean bootstrapped = false;
    private CorpusSnapshot corpus;
    private AffixTable affixes;
    private Decomposer decomposer;
    private ClassTable classes;
    private HazardTable hazards;
    private AssertionLedger ledger;
    private long tablesFingerprint;

    private EngineKernel(FileIO io, FileIO external, ObjectMapper mapper, EngineConfig cfg, EventStore events) {
        this.io = Objects.requireNonNull(io, "io");
        this.external = Objects.requireNonNull(external, "external");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.events = Objects.requireNonNull(events, "events");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /**
         * Loads/creates config and prepares the report directory. Does NOT load inputs.
         */
        public EngineKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            EngineConfig cfg = EngineConfig.loadOrCreate(external, cfgPath, om);

            // report dir is relative to configRoot unless absolute
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base.toAbsolutePath().normalize(), charset, true);
            io.ensureBaseDir();

            EventStore events = new EventStore(io, om, io.resolve(cfg.reports.events));

            EngineKernel k = new EngineKernel(io, external, om, cfg, events);
            log.info("EngineKernel created (no bootstrap yet): config={}, reportDir={}", cfgPath, io.baseDir());
            return k;
        }

        public static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Bootstrap (explicit)
    // ---------------------------------------------------------------------

    /**
     * Loads corpus and tables according to config.
     * Can be called once; repeated calls become no-op.
     */
    public synchronized void bootstrap() throws IOException {
        if (bootstrapped) return;

        CRC32 crc = new CRC32();

        String affixJson = readInput(cfg.tables.affixes, EngineConfig.DEFAULT_AFFIXES);
        crc.update(affixJson.getBytes(StandardCharsets.UTF_8));
        affixes = AffixTable.fromJson(sourceOf(cfg.tables.affixes, EngineConfig.DEFAULT_AFFIXES), affixJson, mapper);
        decomposer = new AffixDecomposer(affixes, cfg.matchOrder());

        String classJson = readInput(cfg.tables.classes, EngineConfig.DEFAULT_CLASSES);
        crc.update(classJson.getBytes(StandardCharsets.UTF_8));
        classes = ClassTable.fromJson(sourceOf(cfg.tables.classes, EngineConfig.DEFAULT_CLASSES), classJson, mapper, decomposer);

        String hazardJson = readInput(cfg.tables.hazards, EngineConfig.DEFAULT_HAZARDS);
        hazards = HazardTable.fromJson(sourceOf(cfg.tables.hazards, EngineConfig.DEFAULT_HAZARDS), hazardJson, mapper);

        crc.update(cfg.matchOrder().name().getBytes(StandardCharsets.UTF_8));
        tablesFingerprint = crc.getValue();

        if (cfg.tables.assertions.isBlank()) {
            ledger = AssertionLedger.loadResource(external, mapper, EngineConfig.DEFAULT_ASSERTIONS);
        } else {
            ledger = AssertionLedger.load(external, mapper, external.resolveExternal(cfg.tables.assertions));
        }

        CorpusLoader loader = new CorpusLoader(external, mapper);
        corpus = cfg.corpus.file.isBlank()
                ? loader.loadResource(EngineConfig.DEFAULT_CORPUS)
                : loader.loadFile(external.resolveExternal(cfg.corpus.file));

        bootstrapped = true;
        log.info("EngineKernel bootstrap done: corpus={} ({} records), classes={}, hazards={}, assertions={}",
                corpus.source(), corpus.size(), classes.classes().size(), hazards.size(), ledger.latestView().size());
    }

    public boolean isBootstrapped() {
        return bootstrapped;
    }

    private String readInput(String configured, String defaultResource) throws IOException {
        if (configured == null || configured.isBlank()) return external.readResource(defaultResource);
        return external.readString(external.resolveExternal(configured));
    }

    private static String sourceOf(String configured, String defaultResource) {
        return (configured == null || configured.isBlank()) ? "classpath:" + defaultResource : configured;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public EngineConfig config() { return cfg; }
    public EventStore eventStore() { return events; }
    public DerivedCache cache() { return cache; }

    public CorpusSnapshot corpus() { return requireBootstrapped(corpus); }
    public AffixTable affixTable() { return requireBootstrapped(affixes); }
    public Decomposer decomposer() { return requireBootstrapped(decomposer); }
    public ClassTable classTable() { return requireBootstrapped(classes); }
    public HazardTable hazardTable() { return requireBootstrapped(hazards); }
    public AssertionLedger ledger() { return requireBootstrapped(ledger); }

    /** CRC of the affix/class tables and match order; part of every derived-cache key. */
    public long tablesFingerprint() {
        requireBootstrapped(affixes);
        return tablesFingerprint;
    }

    private <T> T requireBootstrapped(T v) {
        if (!bootstrapped) throw new IllegalStateException("EngineKernel is not bootstrapped");
        return v;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        cache.invalidateAll();
        log.debug("EngineKernel closed");
    }
}
