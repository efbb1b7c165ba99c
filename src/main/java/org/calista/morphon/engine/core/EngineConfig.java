package org.calista.morphon.engine.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.morphon.engine.classify.UnparsedPolicy;
import org.calista.morphon.engine.hazard.HazardPolicy;
import org.calista.morphon.engine.legality.CascadeStage;
import org.calista.morphon.engine.morphology.MatchOrder;
import org.calista.morphon.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * EngineConfig — простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения и отвергает недопустимые режимы
 *
 * <p>Пустые пути таблиц и корпуса означают встроенные ресурсы classpath.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_CORPUS = "/corpus/sample.jsonl";
    public static final String DEFAULT_AFFIXES = "/tables/affixes.json";
    public static final String DEFAULT_CLASSES = "/tables/classes.json";
    public static final String DEFAULT_HAZARDS = "/tables/hazards.json";
    public static final String DEFAULT_ASSERTIONS = "/tables/assertions.jsonl";

    public String baseDir = "reports";
    public Corpus corpus = new Corpus();
    public Tables tables = new Tables();
    public Decompose decompose = new Decompose();
    public Graph graph = new Graph();
    public Hazard hazard = new Hazard();
    public Cascade cascade = new Cascade();
    public Check check = new Check();
    public Workers workers = new Workers();
    public Reports reports = new Reports();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Corpus {
        /** JSONL snapshot; blank = bundled sample. */
        public String file = "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Tables {
        public String affixes = "";
        public String classes = "";
        public String hazards = "";
        public String assertions = "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Decompose {
        /** drop | retain-as-overflow */
        public String unparsedPolicy = "drop";
        /** LONGEST_FIRST | FAMILY_FIRST */
        public String matchOrder = "LONGEST_FIRST";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Graph {
        public int supportThreshold = 1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Hazard {
        /** advisory | none */
        public String policy = "advisory";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Cascade {
        public List<String> stages = List.of("MIDDLE", "PREFIX", "SUFFIX");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Check {
        /** Default absolute tolerance (percentage points for *_pct metrics). */
        public double tolerance = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Workers {
        /** 0 => availableProcessors. */
        public int parallelism = 0;
        /** Bounded queue capacity (backpressure via CallerRunsPolicy). */
        public int queueCapacity = 1024;
        public String threadNamePrefix = "morphon-worker-";
        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Reports {
        public String tokens = "tokens.jsonl";
        public String graph = "graph.json";
        public String hazards = "hazards.jsonl";
        public String legality = "legality.jsonl";
        public String check = "check.jsonl";
        public String events = "events.jsonl";
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой) — создаёт дефолтный и пишет на диск.
     *
     * @throws IllegalArgumentException when a mode is not supported (e.g. hazard policy "reject")
     */
    public static EngineConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            EngineConfig created = new EngineConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            EngineConfig created = new EngineConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        EngineConfig cfg = mapper.readValue(json, EngineConfig.class);
        if (cfg == null) cfg = new EngineConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "reports";

        if (corpus == null) corpus = new Corpus();
        if (corpus.file == null) corpus.file = "";

        if (tables == null) tables = new Tables();
        if (tables.affixes == null) tables.affixes = "";
        if (tables.classes == null) tables.classes = "";
        if (tables.hazards == null) tables.hazards = "";
        if (tables.assertions == null) tables.assertions = "";

        if (decompose == null) decompose = new Decompose();
        decompose.unparsedPolicy = unparsedPolicy().label();
        decompose.matchOrder = matchOrder().name();

        if (graph == null) graph = new Graph();
        if (graph.supportThreshold < 1) graph.supportThreshold = 1;

        if (hazard == null) hazard = new Hazard();
        hazard.policy = hazardPolicy().name().toLowerCase(Locale.ROOT);

        if (cascade == null) cascade = new Cascade();
        List<String> names = new ArrayList<>();
        for (CascadeStage s : cascadeStages()) names.add(s.name());
        cascade.stages = names;

        if (check == null) check = new Check();
        if (!Double.isFinite(check.tolerance) || check.tolerance < 0) check.tolerance = 0.5;

        if (workers == null) workers = new Workers();
        if (workers.parallelism < 0) workers.parallelism = 0;
        if (workers.queueCapacity < 32) workers.queueCapacity = 32;
        if (workers.threadNamePrefix == null || workers.threadNamePrefix.isBlank())
            workers.threadNamePrefix = "morphon-worker-";
        if (workers.shutdownTimeoutMs < 250) workers.shutdownTimeoutMs = 250;

        if (reports == null) reports = new Reports();
        if (reports.tokens == null || reports.tokens.isBlank()) reports.tokens = "tokens.jsonl";
        if (reports.graph == null || reports.graph.isBlank()) reports.graph = "graph.json";
        if (reports.hazards == null || reports.hazards.isBlank()) reports.hazards = "hazards.jsonl";
        if (reports.legality == null || reports.legality.isBlank()) reports.legality = "legality.jsonl";
        if (reports.check == null || reports.check.isBlank()) reports.check = "check.jsonl";
        if (reports.events == null || reports.events.isBlank()) reports.events = "events.jsonl";
    }

    // -------------------- Typed views --------------------

    public UnparsedPolicy unparsedPolicy() {
        return UnparsedPolicy.parse(decompose == null ? null : decompose.unparsedPolicy);
    }

    public MatchOrder matchOrder() {
        return MatchOrder.parse(decompose == null ? null : decompose.matchOrder);
    }

    public HazardPolicy hazardPolicy() {
        return HazardPolicy.parse(hazard == null ? null : hazard.policy);
    }

    /** Configured order; a stage listed twice is kept once, at its first position. */
    public List<CascadeStage> cascadeStages() {
        List<String> raw = (cascade == null || cascade.stages == null) ? List.of() : cascade.stages;
        Set<CascadeStage> seen = EnumSet.noneOf(CascadeStage.class);
        List<CascadeStage> out = new ArrayList<>(3);
        for (String s : raw) {
            CascadeStage st = CascadeStage.parse(s);
            if (seen.add(st)) out.add(st);
            else log.warn("Cascade stage {} listed twice; keeping first position", st);
        }
        return out;
    }

    /** Configured worker count, or the processor count when set to 0. */
    public int resolvedParallelism() {
        int p = (workers == null) ? 0 : workers.parallelism;
        return p > 0 ? p : Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
