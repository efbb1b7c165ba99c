package org.calista.morphon.engine.check;

import java.util.OptionalDouble;

/** Re-derives a live quantity by metric key. Empty means unknown metric or no data. */
public interface MetricProbe {

    OptionalDouble measure(String metric, String scope);
}
