package org.calista.morphon.engine.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.morphon.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Append-only JSONL journal of pipeline runs. */
public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = io;
        this.mapper = mapper;
        this.file = file;
    }

    public Path file() { return file; }

    public synchronized void append(RunEvent e) throws IOException {
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    public List<String> readAllRawLines() throws IOException {
        if (!io.exists(file)) return List.of();
        return io.readJsonl(file);
    }

    public List<RunEvent> readAll() throws IOException {
        List<RunEvent> out = new ArrayList<>();
        for (String line : readAllRawLines()) {
            if (line == null || line.isBlank()) continue;
            out.add(mapper.readValue(line, RunEvent.class));
        }
        return out;
    }
}
