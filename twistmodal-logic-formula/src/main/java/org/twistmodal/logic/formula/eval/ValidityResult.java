package org.twistmodal.logic.formula.eval;

import org.twistmodal.logic.algebra.TruthPair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param aggregate    weak meet of the values in all worlds
 * @param valid        the aggregate is {@code (top, bottom)} and so is every single value
 * @param results      value per world, keyed and ordered by long name
 * @param failedWorlds long names of the worlds whose value differs from {@code (top, bottom)}
 */
public record ValidityResult(TruthPair aggregate,
                             boolean valid,
                             Map<String, TruthPair> results,
                             List<String> failedWorlds) {

    public ValidityResult {
        assert !valid || failedWorlds.isEmpty();
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        failedWorlds = List.copyOf(failedWorlds);
    }
}
