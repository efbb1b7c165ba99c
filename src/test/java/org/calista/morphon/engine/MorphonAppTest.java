package org.calista.morphon.engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.morphon.engine.check.Severity;
import org.calista.morphon.engine.check.Verdict;
import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.core.EngineConfig;
import org.calista.morphon.engine.core.EngineKernel;
import org.calista.morphon.engine.events.RunEvent;
import org.calista.morphon.engine.pipeline.PipelineResult;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class MorphonAppTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testEndToEndWithDefaults() throws Exception {
        Path root = tmp.getRoot().toPath();
        MorphonApp app = new MorphonApp(root, Path.of("config.json"));
        PipelineResult r = app.run();

        assertTrue(Files.exists(root.resolve("config.json")));
        Path reports = root.resolve("reports");
        for (String name : List.of("tokens.jsonl", "graph.json", "hazards.jsonl", "legality.jsonl", "check.jsonl", "events.jsonl")) {
            assertTrue(name, Files.exists(reports.resolve(name)));
        }

        assertEquals(Verdict.DISAGREE, r.checkOf("GR-01").verdict);
        assertEquals("f57v.C1", r.legalityOf("f1r.2").governingRecordId());
        assertEquals(13, r.legalityOf("f1r.2").size());

        JsonNode graph = Fixtures.MAPPER.readTree(Files.readString(reports.resolve("graph.json")));
        assertEquals("graph-json-v1", graph.get("_schema").asText());
        assertEquals(r.graph.edgeCount(), graph.get("edgeCount").asLong());
        assertEquals(r.graph.nodeCount(), graph.get("nodes").size());

        List<String> checks = Files.readAllLines(reports.resolve("check.jsonl"));
        assertEquals("{\"_schema\":\"check-jsonl-v1\"}", checks.get(0));
        assertEquals(1 + r.checks.size(), checks.size());
        boolean grSeen = false;
        for (String line : checks.subList(1, checks.size())) {
            JsonNode n = Fixtures.MAPPER.readTree(line);
            if ("GR-01".equals(n.get("id").asText())) {
                assertEquals("DISAGREE", n.get("verdict").asText());
                assertEquals("WARNING", n.get("severity").asText());
                grSeen = true;
            }
        }
        assertTrue(grSeen);

        List<String> hazards = Files.readAllLines(reports.resolve("hazards.jsonl"));
        JsonNode summary = Fixtures.MAPPER.readTree(hazards.get(hazards.size() - 1));
        assertEquals("summary", summary.get("type").asText());
        assertEquals(r.hazards.violations().size(), summary.get("violations").asInt());

        long tokenRows = 0;
        for (String line : Files.readAllLines(reports.resolve("tokens.jsonl"))) {
            if (line.contains("\"type\":\"token\"")) tokenRows++;
        }
        assertEquals(r.corpus.tokenCount(), tokenRows);
    }

    @Test
    public void testRunJournal() throws Exception {
        Path root = tmp.getRoot().toPath();
        MorphonApp app = new MorphonApp(root, Path.of("config.json"));
        app.run();

        List<RunEvent> events = app.getKernel().eventStore().readAll();
        List<String> types = new ArrayList<>();
        for (RunEvent e : events) types.add(e.type);

        assertEquals("RUN_START", types.get(0));
        assertEquals("RUN_DONE", types.get(types.size() - 1));
        assertTrue(types.contains("HAZARD_SUMMARY"));

        boolean gap = false;
        boolean check = false;
        for (RunEvent e : events) {
            if ("CLASSIFICATION_GAP".equals(e.type) && "qotchedy".equals(e.subject)) gap = true;
            if ("CHECK".equals(e.type) && "GR-01".equals(e.subject)) check = true;
            assertEquals(events.get(0).runId, e.runId);
        }
        assertTrue(gap);
        assertTrue(check);
    }

    @Test
    public void testCustomCorpusAndReportDir() throws Exception {
        Path root = tmp.getRoot().toPath();
        Path corpus = root.resolve("mini.jsonl");
        Files.writeString(corpus,
                "{\"id\":\"e1\",\"system\":\"executable\",\"tokens\":[\"ol\",\"shor\",\"chol\"]}\n"
                        + "{\"id\":\"p1\",\"zone\":\"C\",\"system\":\"positional\",\"tokens\":[\"chol\",\"shor\"]}\n"
                        + "{\"id\":\"r1\",\"zone\":\"C\",\"system\":\"registry\",\"tokens\":[\"chol\"]}\n");
        Path out = root.resolve("out");
        Files.writeString(root.resolve("config.json"),
                "{\"baseDir\":" + Fixtures.MAPPER.writeValueAsString(out.toString())
                        + ",\"corpus\":{\"file\":" + Fixtures.MAPPER.writeValueAsString(corpus.toString()) + "}}");

        MorphonApp app = new MorphonApp(root, Path.of("config.json"));
        PipelineResult r = app.run();
        assertEquals(3, r.corpus.size());
        assertEquals(1, r.hazards.violations().size());
        assertEquals("p1", r.legalityOf("r1").governingRecordId());
        assertEquals(Verdict.INSUFFICIENT_DATA, r.checkOf("LG-01").verdict);
        assertEquals(Severity.NONE, r.checkOf("LG-01").severity);
        assertTrue(Files.exists(out.resolve("legality.jsonl")));

        // unanswerable checks still reach the journal
        boolean journaled = false;
        for (RunEvent e : app.getKernel().eventStore().readAll()) {
            if ("CHECK".equals(e.type) && "LG-01".equals(e.subject)) {
                assertTrue(e.text, e.text.startsWith("INSUFFICIENT_DATA/NONE"));
                journaled = true;
            }
        }
        assertTrue(journaled);
    }

    @Test
    public void testKernelBootstrapLoadsDefaults() throws Exception {
        try (EngineKernel k = EngineKernel.builder().configRoot(tmp.getRoot().toPath()).build(Path.of("config.json"))) {
            assertFalse(k.isBootstrapped());
            k.bootstrap();
            k.bootstrap();
            assertTrue(k.isBootstrapped());
            assertEquals(16, k.corpus().size());
            assertEquals("classpath:" + EngineConfig.DEFAULT_AFFIXES, k.affixTable().source());
            assertEquals(ClassTable.CLASS_COUNT, k.classTable().classes().size());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testKernelAccessBeforeBootstrap() throws Exception {
        try (EngineKernel k = EngineKernel.builder().configRoot(tmp.getRoot().toPath()).build(Path.of("config.json"))) {
            k.corpus();
        }
    }
}
