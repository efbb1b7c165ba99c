package org.calista.morphon.engine.corpus;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Immutable corpus snapshot. Records keep their load order; ids are unique.
 * The fingerprint keys derived caches (graph, class tables).
 */
public final class CorpusSnapshot {

    private final String source;
    private final List<Record> records;
    private final Map<String, Record> byId;
    private final long fingerprint;

    public CorpusSnapshot(String source, List<Record> records) {
        this.source = Objects.requireNonNull(source, "source");
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));

        Map<String, Record> m = new LinkedHashMap<>(this.records.size() * 2);
        for (Record r : this.records) {
            if (m.putIfAbsent(r.id(), r) != null) {
                throw new IllegalArgumentException("Duplicate record id: " + r.id());
            }
        }
        this.byId = Collections.unmodifiableMap(m);
        this.fingerprint = computeFingerprint(this.records);
    }

    public String source() { return source; }

    public List<Record> records() { return records; }

    public List<Record> records(SystemTag tag) {
        List<Record> out = new ArrayList<>();
        for (Record r : records) {
            if (r.system() == tag) out.add(r);
        }
        return out;
    }

    public Optional<Record> record(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() { return records.size(); }

    public long tokenCount() {
        long n = 0;
        for (Record r : records) n += r.size();
        return n;
    }

    public long fingerprint() { return fingerprint; }

    private static long computeFingerprint(List<Record> records) {
        CRC32 crc = new CRC32();
        for (Record r : records) {
            update(crc, r.id());
            update(crc, r.zone().name());
            update(crc, r.system().name());
            for (String t : r.tokens()) update(crc, t);
            crc.update('\n');
        }
        return crc.getValue();
    }

    private static void update(CRC32 crc, String s) {
        crc.update(s.getBytes(StandardCharsets.UTF_8));
        crc.update(0);
    }
}
