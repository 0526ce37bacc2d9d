package com.workbook.calc.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.workbook.calc.api.ReferenceKind;
import com.workbook.calc.node.CalculationField;

import lombok.extern.log4j.Log4j2;

/**
 * Resolves reference tokens to symbols.
 *
 * <p>
 * Calculations live in an arena (a list indexed by id); this table maps every
 * caption and internal name to an arena index so that resolution is one hash
 * lookup. Parameters are matched by caption or internal name.
 *
 * <p>
 * Caption collisions never drop a calculation. Which one a bare reference
 * resolves to follows the {@link AnalysisOptions.DuplicateCaptionPolicy}.
 */
@Log4j2
public final class SymbolTable {
    private final List<CalculationField> arena;
    private final Map<String, Integer> calcIndex;
    private final Set<String> parameterNames;
    private final List<DuplicateCaption> duplicates;

    private SymbolTable(List<CalculationField> arena, Map<String, Integer> calcIndex, Set<String> parameterNames,
            List<DuplicateCaption> duplicates) {
        this.arena = arena;
        this.calcIndex = calcIndex;
        this.parameterNames = parameterNames;
        this.duplicates = duplicates;
    }

    /**
     * Indexes the arena. Under {@code QUALIFY} colliding calculations get a
     * {@code Caption (datasource)} display name.
     */
    public static SymbolTable index(List<CalculationField> arena, Set<String> parameterNames,
            AnalysisOptions.DuplicateCaptionPolicy policy) {
        Map<String, List<Integer>> byCaption = new LinkedHashMap<>();
        for (CalculationField calc : arena)
            byCaption.computeIfAbsent(calc.caption(), k -> new ArrayList<>()).add(calc.id());

        boolean keepLast = policy == AnalysisOptions.DuplicateCaptionPolicy.KEEP_LAST;
        Map<String, Integer> index = new HashMap<>(arena.size() * 4);
        for (CalculationField calc : arena) {
            register(index, calc.caption(), calc.id(), keepLast);
            register(index, calc.name(), calc.id(), keepLast);
        }

        List<DuplicateCaption> duplicates = new ArrayList<>();
        for (var entry : byCaption.entrySet()) {
            List<Integer> ids = entry.getValue();
            if (ids.size() < 2)
                continue;
            List<String> datasources = new ArrayList<>(ids.size());
            for (int id : ids)
                datasources.add(arena.get(id).datasource());
            int winner = index.get(entry.getKey());
            duplicates.add(new DuplicateCaption(entry.getKey(), datasources, arena.get(winner).datasource()));
            log.warn("Caption '{}' is declared by {} calculations in datasources {}; references resolve to '{}'",
                    entry.getKey(), ids.size(), datasources, arena.get(winner).datasource());
            if (policy == AnalysisOptions.DuplicateCaptionPolicy.QUALIFY) {
                for (int id : ids) {
                    CalculationField calc = arena.get(id);
                    calc.setDisplayName(calc.caption() + " (" + calc.datasource() + ")");
                }
            }
        }
        return new SymbolTable(arena, index, parameterNames, Collections.unmodifiableList(duplicates));
    }

    private static void register(Map<String, Integer> index, String key, int id, boolean keepLast) {
        if (key == null || key.isEmpty())
            return;
        if (keepLast)
            index.put(key, id);
        else
            index.putIfAbsent(key, id);
    }

    /** Parameter first, then calculation, else source field. Never null. */
    public ReferenceKind classify(String reference) {
        if (parameterNames.contains(reference))
            return ReferenceKind.PARAMETER;
        if (calcIndex.containsKey(reference))
            return ReferenceKind.CALCULATION;
        return ReferenceKind.SOURCE_FIELD;
    }

    /** Arena index of the calculation a reference names, or -1. */
    public int calculationId(String reference) {
        Integer id = calcIndex.get(reference);
        return id == null ? -1 : id;
    }

    public CalculationField calculation(int id) {
        return arena.get(id);
    }

    public int calculationCount() {
        return arena.size();
    }

    public List<DuplicateCaption> duplicates() {
        return duplicates;
    }
}
