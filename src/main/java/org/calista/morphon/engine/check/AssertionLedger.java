package org.calista.morphon.engine.check;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.core.InvalidInputException;
import org.calista.morphon.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * AssertionLedger — append-only, versioned log of assertions.
 *
 * <p>Каждая запись получает номер ревизии (1, 2, ...). Ревизия, заменяющая предыдущую,
 * хранит ссылку {@code supersedes} на её номер. Latest view = последняя ревизия каждого id.
 *
 * <p>A new revision of an id whose latest revision is tier 0/1 must go through
 * {@link #supersede}; {@link #append} refuses it with {@link AssertionGovernanceException}.
 *
 * <p>Формат: JSONL, первой строкой {"_schema":"assertions-jsonl-v1"}.
 */
public final class AssertionLedger {
    private static final Logger log = LogManager.getLogger(AssertionLedger.class);

    private static final String SCHEMA_LINE = "{\"_schema\":\"assertions-jsonl-v1\"}";

    /** One immutable revision. */
    public static final class Revision {
        public final int revision;
        public final ConstraintAssertion assertion;
        /** Revision number this one replaces, or {@code null} for the first revision of an id. */
        public final Integer supersedes;
        public final String reason;

        Revision(int revision, ConstraintAssertion assertion, Integer supersedes, String reason) {
            this.revision = revision;
            this.assertion = assertion;
            this.supersedes = supersedes;
            this.reason = reason;
        }
    }

    private final String source;
    private final List<Revision> entries = new ArrayList<>();
    private final Map<String, Revision> latest = new LinkedHashMap<>();

    public AssertionLedger(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public String source() { return source; }

    /**
     * Adds a revision. For a new id this is the first revision; for an existing
     * unprotected id it implicitly supersedes the latest one.
     */
    public synchronized Revision append(ConstraintAssertion a) {
        Objects.requireNonNull(a, "assertion");
        Revision prev = latest.get(a.id());
        if (prev != null && prev.assertion.isProtected()) {
            throw new AssertionGovernanceException(source, a.id(),
                    "assertion " + a.id() + " is tier " + prev.assertion.tier()
                            + " (revision " + prev.revision + "); use supersede with a reason");
        }
        return add(a, prev, null);
    }

    /** Explicitly replaces the latest revision of {@code a.id()}, protected or not. */
    public synchronized Revision supersede(ConstraintAssertion a, String reason) {
        Objects.requireNonNull(a, "assertion");
        if (reason == null || reason.isBlank()) {
            throw new InvalidInputException(source, "supersession of " + a.id() + " needs a reason");
        }
        Revision prev = latest.get(a.id());
        if (prev == null) {
            throw new InvalidInputException(source, "nothing to supersede: no assertion " + a.id());
        }
        log.info("Assertion {} superseded: revision {} -> {} ({})", a.id(), prev.revision, this.entries.size() + 1, reason);
        return add(a, prev, reason);
    }

    private Revision add(ConstraintAssertion a, Revision prev, String reason) {
        Revision r = new Revision(this.entries.size() + 1, a, prev == null ? null : prev.revision, reason);
        this.entries.add(r);
        latest.put(a.id(), r);
        return r;
    }

    /** Latest revision per id, in first-seen order. */
    public synchronized List<ConstraintAssertion> latestView() {
        List<ConstraintAssertion> out = new ArrayList<>(latest.size());
        for (Revision r : latest.values()) out.add(r.assertion);
        return Collections.unmodifiableList(out);
    }

    public synchronized Optional<ConstraintAssertion> latest(String id) {
        Revision r = latest.get(id);
        return r == null ? Optional.empty() : Optional.of(r.assertion);
    }

    /** Every revision of one id, oldest first. */
    public synchronized List<Revision> history(String id) {
        List<Revision> out = new ArrayList<>();
        for (Revision r : this.entries) {
            if (r.assertion.id().equals(id)) out.add(r);
        }
        return out;
    }

    public synchronized List<Revision> revisions() {
        return Collections.unmodifiableList(new ArrayList<>(this.entries));
    }

    public synchronized int size() { return this.entries.size(); }

    // ---------------------------------------------------------------------
    // JSONL
    // ---------------------------------------------------------------------

    /**
     * Replays JSONL lines. A line carrying {@code supersedes} goes through
     * {@link #supersede}; any other line through {@link #append}.
     */
    public static AssertionLedger fromJsonl(String source, List<String> lines, ObjectMapper mapper) {
        AssertionLedger ledger = new AssertionLedger(source);
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line == null || line.isBlank() || line.contains("\"_schema\"")) continue;

            AssertionLine d;
            try {
                d = mapper.readValue(line, AssertionLine.class);
            } catch (JsonProcessingException e) {
                throw new InvalidInputException(source + ":" + lineNo, "not valid JSON: " + e.getOriginalMessage(), e);
            }

            ConstraintAssertion a;
            try {
                a = d.toAssertion();
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException(source + ":" + lineNo, e.getMessage(), e);
            }

            if (d.supersedes != null) ledger.supersede(a, d.reason == null ? "revision " + d.supersedes : d.reason);
            else ledger.append(a);
        }
        log.info("Assertion ledger loaded: source={}, revisions={}, live={}", source, ledger.size(), ledger.latest.size());
        return ledger;
    }

    public static AssertionLedger load(FileIO io, ObjectMapper mapper, Path file) throws IOException {
        return fromJsonl(file.toString(), io.readJsonl(file), mapper);
    }

    public static AssertionLedger loadResource(FileIO io, ObjectMapper mapper, String resource) throws IOException {
        return fromJsonl("classpath:" + resource, io.readResourceJsonl(resource), mapper);
    }

    public void save(FileIO io, ObjectMapper mapper, Path file) throws IOException {
        List<Revision> snapshot = revisions();
        FileIO.WriterHandle h = io.openWriter(file);
        try {
            h.writer.write(SCHEMA_LINE);
            h.writer.newLine();
            for (Revision r : snapshot) {
                h.writer.write(mapper.writeValueAsString(AssertionLine.of(r)));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h, e);
            if (e instanceof IOException) throw (IOException) e;
            throw new IOException("Failed to save assertion ledger: " + file, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class AssertionLine {
        public String id;
        public Integer tier;
        public String claim;
        public String scope;
        public String metric;
        public Double value;
        public String comparison;
        public Double tolerance;
        public Integer revision;
        public Integer supersedes;
        public String reason;

        ConstraintAssertion toAssertion() {
            if (tier == null) throw new IllegalArgumentException("assertion " + id + ": tier is missing");
            if (value == null) throw new IllegalArgumentException("assertion " + id + ": value is missing");
            return new ConstraintAssertion(id, tier, claim, scope, metric, value, Comparison.parse(comparison), tolerance);
        }

        static AssertionLine of(Revision r) {
            ConstraintAssertion a = r.assertion;
            AssertionLine l = new AssertionLine();
            l.id = a.id();
            l.tier = a.tier();
            l.claim = a.claim();
            l.scope = a.scope();
            l.metric = a.metric();
            l.value = a.value();
            l.comparison = a.comparison().name();
            l.tolerance = a.tolerance();
            l.revision = r.revision;
            l.supersedes = r.supersedes;
            l.reason = r.reason;
            return l;
        }
    }
}
