package org.calista.morphon.engine.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.check.CheckEntry;
import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.classify.ClassifiedToken;
import org.calista.morphon.engine.classify.InstructionClass;
import org.calista.morphon.engine.core.EngineConfig;
import org.calista.morphon.engine.graph.CompatibilityGraph;
import org.calista.morphon.engine.hazard.HazardCategory;
import org.calista.morphon.engine.hazard.HazardReport;
import org.calista.morphon.engine.hazard.Violation;
import org.calista.morphon.engine.legality.LegalitySet;
import org.calista.morphon.engine.morphology.MorphemeComponents;
import org.calista.morphon.engine.pipeline.PipelineResult;
import org.calista.morphon.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * ReportWriter — пишет пять производных отчётов прогона.
 *
 * <p>JSONL-отчёты начинаются со строки схемы ({"_schema":"tokens-jsonl-v1"} и т.п.).
 * Каждый файл пишется атомарно через {@link FileIO#openWriter}; при ошибке временный
 * файл удаляется, целевой остаётся прежним. NaN пишется как null.
 */
public final class ReportWriter {
    private static final Logger log = LogManager.getLogger(ReportWriter.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final EngineConfig.Reports names;

    public ReportWriter(FileIO io, ObjectMapper mapper, EngineConfig.Reports names) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.names = Objects.requireNonNull(names, "names");
    }

    /** @return report name -> written file, in write order */
    public Map<String, Path> writeAll(PipelineResult r, ClassTable classes) throws IOException {
        Map<String, Path> out = new LinkedHashMap<>();
        out.put("tokens", writeTokens(r, classes));
        out.put("graph", writeGraph(r.graph));
        out.put("hazards", writeHazards(r.hazards));
        out.put("legality", writeLegality(r.legality));
        out.put("check", writeChecks(r.checks));
        log.info("Reports written to {}: {}", io.baseDir(), out.keySet());
        return out;
    }

    public Path writeTokens(PipelineResult r, ClassTable classes) throws IOException {
        Path file = io.resolve(names.tokens);
        FileIO.WriterHandle h = io.openWriter(file);
        try {
            line(h, schema("tokens-jsonl-v1"));
            for (Map.Entry<String, List<MorphemeComponents>> e : r.components.entrySet()) {
                List<ClassifiedToken> cls = r.classified.get(e.getKey());
                List<MorphemeComponents> comps = e.getValue();
                for (int i = 0; i < comps.size(); i++) {
                    ObjectNode n = tokenNode(e.getKey(), i, comps.get(i));
                    if (cls != null) {
                        ClassifiedToken t = cls.get(i);
                        n.put("outcome", t.outcome().name());
                        n.put("classId", t.classId());
                        n.put("match", t.kind().name());
                    }
                    line(h, n);
                }
            }
            if (classes != null) {
                for (InstructionClass c : classes.classes().values()) {
                    ObjectNode n = mapper.createObjectNode();
                    n.put("type", "class");
                    n.put("id", c.id());
                    n.put("role", c.role().name());
                    ArrayNode m = n.putArray("members");
                    for (String s : c.members()) m.add(s);
                    line(h, n);
                }
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            fail(h, file, e);
        }
        return file;
    }

    public Path writeGraph(CompatibilityGraph g) throws IOException {
        Path file = io.resolve(names.graph);
        ObjectNode root = mapper.createObjectNode();
        root.put("_schema", "graph-json-v1");
        root.put("threshold", g.threshold());
        root.put("nodeCount", g.nodeCount());
        root.put("edgeCount", g.edgeCount());
        root.put("density", g.density());
        root.put("crossFamilyDensity", g.crossFamilyDensity());
        ObjectNode fam = root.putObject("familyDensity");
        for (Map.Entry<String, Double> e : g.familyDensity().entrySet()) fam.put(e.getKey(), e.getValue());
        ArrayNode nodes = root.putArray("nodes");
        for (String n : g.nodes()) {
            ObjectNode o = nodes.addObject();
            o.put("middle", n);
            o.put("family", g.familyOf(n));
        }
        ArrayNode edges = root.putArray("edges");
        for (CompatibilityGraph.Edge e : g.edges()) {
            ObjectNode o = edges.addObject();
            o.put("a", e.a);
            o.put("b", e.b);
            o.put("support", e.support);
        }

        FileIO.WriterHandle h = io.openWriter(file);
        try {
            h.writer.write(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
            h.writer.newLine();
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            fail(h, file, e);
        }
        return file;
    }

    public Path writeHazards(HazardReport report) throws IOException {
        Path file = io.resolve(names.hazards);
        FileIO.WriterHandle h = io.openWriter(file);
        try {
            line(h, schema("hazards-jsonl-v1"));
            for (Violation v : report.violations()) {
                ObjectNode n = mapper.createObjectNode();
                n.put("type", "violation");
                n.put("record", v.recordId);
                n.put("position", v.position);
                n.put("from", v.fromClass);
                n.put("to", v.toClass);
                n.put("fromToken", v.fromToken);
                n.put("toToken", v.toToken);
                n.put("category", v.category.label());
                n.put("severity", v.severity);
                line(h, n);
            }
            ObjectNode s = mapper.createObjectNode();
            s.put("type", "summary");
            s.put("policy", report.policy().name().toLowerCase(Locale.ROOT));
            s.put("records", report.records());
            s.put("transitions", report.transitions());
            s.put("opportunities", report.opportunities());
            s.put("violations", report.violations().size());
            s.put("compliancePct", nullIfNaN(report.compliancePct()));
            ObjectNode by = s.putObject("byCategory");
            for (Map.Entry<HazardCategory, Integer> e : report.byCategory().entrySet()) by.put(e.getKey().label(), e.getValue());
            line(h, s);
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            fail(h, file, e);
        }
        return file;
    }

    public Path writeLegality(List<LegalitySet> sets) throws IOException {
        Path file = io.resolve(names.legality);
        FileIO.WriterHandle h = io.openWriter(file);
        try {
            line(h, schema("legality-jsonl-v1"));
            for (LegalitySet s : sets) {
                ObjectNode n = mapper.createObjectNode();
                n.put("record", s.recordId());
                n.put("zone", s.zone().name());
                n.put("status", s.status().name());
                n.put("governedBy", s.governingRecordId());
                n.put("initial", s.initialSize());
                ArrayNode trace = n.putArray("trace");
                for (LegalitySet.Step st : s.trace()) {
                    ObjectNode o = trace.addObject();
                    o.put("stage", st.stage.name());
                    o.put("size", st.size);
                }
                n.put("size", s.size());
                ArrayNode toks = n.putArray("tokens");
                for (String t : s.tokens()) toks.add(t);
                line(h, n);
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            fail(h, file, e);
        }
        return file;
    }

    public Path writeChecks(List<CheckEntry> entries) throws IOException {
        Path file = io.resolve(names.check);
        FileIO.WriterHandle h = io.openWriter(file);
        try {
            line(h, schema("check-jsonl-v1"));
            for (CheckEntry e : entries) {
                ObjectNode n = mapper.createObjectNode();
                n.put("id", e.assertionId);
                n.put("tier", e.tier);
                n.put("metric", e.metric);
                n.put("scope", e.scope);
                n.put("comparison", e.comparison.name());
                n.put("asserted", e.asserted);
                n.put("computed", nullIfNaN(e.computed));
                n.put("tolerance", e.tolerance);
                n.put("verdict", e.verdict.name());
                n.put("severity", e.severity.name());
                line(h, n);
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            fail(h, file, e);
        }
        return file;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private ObjectNode tokenNode(String recordId, int position, MorphemeComponents c) {
        ObjectNode n = mapper.createObjectNode();
        n.put("type", "token");
        n.put("record", recordId);
        n.put("position", position);
        n.put("token", c.token());
        if (!c.isParsed()) {
            n.put("failure", c.failure().name());
            return n;
        }
        n.put("articulator", c.articulator());
        n.put("prefix", c.prefix());
        n.put("prefixFamily", c.prefixFamily());
        n.put("sister", c.sister());
        n.put("middle", c.middle());
        n.put("suffix", c.suffix());
        n.put("suffixFamily", c.suffixFamily());
        return n;
    }

    private ObjectNode schema(String name) {
        ObjectNode n = mapper.createObjectNode();
        n.put("_schema", name);
        return n;
    }

    private void line(FileIO.WriterHandle h, ObjectNode n) throws IOException {
        h.writer.write(mapper.writeValueAsString(n));
        h.writer.newLine();
    }

    private void fail(FileIO.WriterHandle h, Path file, Exception e) throws IOException {
        io.rollback(h, e);
        if (e instanceof IOException) throw (IOException) e;
        throw new IOException("Failed to write report: " + file, e);
    }

    private static Double nullIfNaN(double v) {
        return Double.isNaN(v) ? null : v;
    }
}
