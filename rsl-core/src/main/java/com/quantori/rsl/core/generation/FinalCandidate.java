package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.FinalPattern;
import com.quantori.rsl.api.model.Lineage;

/**
 * A fully substituted pattern and the lineage it was derived from.
 */
public record FinalCandidate(Lineage lineage, FinalPattern pattern) {
}
