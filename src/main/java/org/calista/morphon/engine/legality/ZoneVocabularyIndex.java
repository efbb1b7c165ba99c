package org.calista.morphon.engine.legality;

import org.calista.morphon.engine.corpus.Zone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit lookup from (MIDDLEs in use, zone) to the records that can supply them.
 *
 * <p>A candidate lies in the requested zone and its MIDDLE vocabulary contains every
 * requested MIDDLE. Candidates are ranked by vocabulary size (smaller is more specific),
 * then by record id.
 */
public final class ZoneVocabularyIndex {

    /** One indexed record. */
    public static final class Entry {
        public final String recordId;
        public final Zone zone;
        public final VocabularyBundle vocabulary;

        Entry(String recordId, Zone zone, VocabularyBundle vocabulary) {
            this.recordId = recordId;
            this.zone = zone;
            this.vocabulary = vocabulary;
        }
    }

    private static final Comparator<Entry> SPECIFICITY =
            Comparator.<Entry>comparingInt(e -> e.vocabulary.size()).thenComparing(e -> e.recordId);

    private final Map<Zone, List<Entry>> byZone;

    private ZoneVocabularyIndex(Map<Zone, List<Entry>> byZone) {
        this.byZone = byZone;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Entry> candidates(Set<String> middlesInUse, Zone zone) {
        Objects.requireNonNull(middlesInUse, "middlesInUse");
        List<Entry> out = new ArrayList<>();
        for (Entry e : byZone.getOrDefault(zone, List.of())) {
            if (e.vocabulary.middles().containsAll(middlesInUse)) out.add(e);
        }
        return out; // already ranked
    }

    public Optional<Entry> governing(Set<String> middlesInUse, Zone zone) {
        List<Entry> c = candidates(middlesInUse, zone);
        return c.isEmpty() ? Optional.empty() : Optional.of(c.get(0));
    }

    public int size(Zone zone) {
        return byZone.getOrDefault(zone, List.of()).size();
    }

    public static final class Builder {
        private final Map<Zone, List<Entry>> byZone = new EnumMap<>(Zone.class);

        public Builder add(String recordId, Zone zone, VocabularyBundle vocabulary) {
            Objects.requireNonNull(recordId, "recordId");
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(vocabulary, "vocabulary");
            byZone.computeIfAbsent(zone, z -> new ArrayList<>()).add(new Entry(recordId, zone, vocabulary));
            return this;
        }

        public ZoneVocabularyIndex build() {
            Map<Zone, List<Entry>> frozen = new EnumMap<>(Zone.class);
            for (Map.Entry<Zone, List<Entry>> e : byZone.entrySet()) {
                List<Entry> l = new ArrayList<>(e.getValue());
                l.sort(SPECIFICITY);
                frozen.put(e.getKey(), Collections.unmodifiableList(l));
            }
            return new ZoneVocabularyIndex(frozen);
        }
    }
}
