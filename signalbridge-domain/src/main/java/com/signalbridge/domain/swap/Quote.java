package com.signalbridge.domain.swap;

import java.util.List;
import java.util.Objects;

/**
 * Aggregator quote. Valid only until consumed by the assemble phase; a stale path id fails at assemble time.
 *
 * @param priceImpact percent, may be null when the aggregator does not report it
 */
public record Quote(
        String pathId,
        List<String> inValues,
        List<String> outValues,
        double gasEstimate,
        Double priceImpact
) {

    public Quote {
        Objects.requireNonNull(pathId, "pathId");
        inValues = inValues == null ? List.of() : List.copyOf(inValues);
        outValues = outValues == null ? List.of() : List.copyOf(outValues);
    }

    public String firstInValue() {
        return inValues.isEmpty() ? "n/a" : inValues.get(0);
    }

    public String firstOutValue() {
        return outValues.isEmpty() ? "n/a" : outValues.get(0);
    }
}
