package com.quantori.rsl.core.model;

import com.quantori.rsl.api.model.FinalPattern;
import com.quantori.rsl.api.model.HierarchyRow;
import com.quantori.rsl.api.model.Lineage;
import com.quantori.rsl.api.model.Position;
import java.util.List;

/**
 * A table row together with the pattern it was rendered from.
 *
 * @param canonicalKey dihedral canonical key of the final pattern, unique within a table
 * @param lineage      skeleton, core and mask the pattern descends from
 * @param pattern      representative final pattern of the orbit
 * @param row          rendered patterns
 */
public record HierarchyEntry(List<Position> canonicalKey, Lineage lineage, FinalPattern pattern, HierarchyRow row) {
}
