package org.calista.morphon.engine.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.core.InvalidInputException;
import org.calista.morphon.io.FileIO;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a corpus snapshot from JSONL, one record per line:
 * <pre>{"id":"f1r.1","zone":"C","system":"registry","tokens":["qotedy","chol"]}</pre>
 *
 * Any malformed line fails the whole load.
 */
public final class CorpusLoader {
    private static final Logger log = LogManager.getLogger(CorpusLoader.class);

    private final FileIO io;
    private final ObjectMapper mapper;

    public CorpusLoader(FileIO io, ObjectMapper mapper) {
        this.io = io;
        this.mapper = mapper;
    }

    public CorpusSnapshot loadFile(Path jsonlFile) throws IOException {
        if (!io.exists(jsonlFile)) {
            log.warn("Corpus not found: {}", jsonlFile);
            throw new NoSuchFileException(jsonlFile.toString());
        }
        return parse(jsonlFile.toString(), io.readJsonl(jsonlFile));
    }

    public CorpusSnapshot loadResource(String resource) throws IOException {
        return parse("classpath:" + resource, io.readResourceJsonl(resource));
    }

    CorpusSnapshot parse(String source, List<String> lines) {
        List<Record> records = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            records.add(toRecord(source, lineNo, line));
        }

        CorpusSnapshot snapshot;
        try {
            snapshot = new CorpusSnapshot(source, records);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(source, e.getMessage(), e);
        }

        Report r = Report.of(snapshot);
        log.info("Corpus loaded: {} (records={}, tokens={}, byTag={})", source, r.records, r.tokens, r.byTag);
        return snapshot;
    }

    private Record toRecord(String source, int lineNo, String line) {
        RecordLine rl;
        try {
            rl = mapper.readValue(line, RecordLine.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(source, "line " + lineNo + " is not a record: " + e.getOriginalMessage(), e);
        }
        if (rl == null || rl.id == null || rl.id.isBlank()) {
            throw new InvalidInputException(source, "line " + lineNo + " has no record id");
        }
        if (rl.tokens == null || rl.tokens.isEmpty()) {
            throw new InvalidInputException(source, "record " + rl.id + " is empty");
        }
        for (String t : rl.tokens) {
            if (t == null) throw new InvalidInputException(source, "record " + rl.id + " contains a null token");
        }
        try {
            return new Record(rl.id.trim(), Zone.parse(rl.zone), SystemTag.parse(rl.system), rl.tokens);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(source, "record " + rl.id + ": " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class RecordLine {
        public String id;
        public String zone;
        public String system;
        public List<String> tokens;
    }

    public static final class Report {
        public final int records;
        public final long tokens;
        public final Map<SystemTag, Integer> byTag;

        private Report(int records, long tokens, Map<SystemTag, Integer> byTag) {
            this.records = records;
            this.tokens = tokens;
            this.byTag = byTag;
        }

        public static Report of(CorpusSnapshot s) {
            Map<SystemTag, Integer> m = new EnumMap<>(SystemTag.class);
            for (Record r : s.records()) m.merge(r.system(), 1, Integer::sum);
            return new Report(s.size(), s.tokenCount(), m);
        }
    }
}
