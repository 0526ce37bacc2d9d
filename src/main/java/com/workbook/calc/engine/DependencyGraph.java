package com.workbook.calc.engine;

import java.util.*;

import com.workbook.calc.formula.ReferenceTokenizer;
import com.workbook.calc.node.CalculationField;
import com.workbook.calc.node.Parameter;
import com.workbook.calc.node.SourceField;

import lombok.extern.log4j.Log4j2;

/**
 * The calculation dependency graph of one workbook.
 *
 * <p>
 * Calculations are held in an arena: {@code calculations.get(id)} is the node
 * with that id. Forward adjacency is each node's {@code dependsOnCalcs},
 * reverse adjacency its {@code usedBy}; both hold arena ids.
 *
 * <p>
 * A graph is built fresh per analysis by {@link Builder#build()}, which runs
 * resolution, reverse-edge derivation and cycle detection in that order. The
 * finished graph is not modified afterwards and is safe to read from any thread.
 */
@Log4j2
public final class DependencyGraph {
    private final List<CalculationField> calculations;
    private final List<Parameter> parameters;
    private final List<SourceField> sourceFields;
    private final Set<String> sourceFieldNames;
    private final List<List<Integer>> cycles;
    private final SymbolTable symbols;

    private DependencyGraph(List<CalculationField> calculations, List<Parameter> parameters,
            List<SourceField> sourceFields, Set<String> sourceFieldNames, List<List<Integer>> cycles,
            SymbolTable symbols) {
        this.calculations = calculations;
        this.parameters = parameters;
        this.sourceFields = sourceFields;
        this.sourceFieldNames = sourceFieldNames;
        this.cycles = cycles;
        this.symbols = symbols;
    }

    public int calculationCount() {
        return calculations.size();
    }

    public boolean isEmpty() {
        return calculations.isEmpty();
    }

    /** All calculations in declaration order; index equals id. */
    public List<CalculationField> calculations() {
        return calculations;
    }

    public CalculationField calculation(int id) {
        return calculations.get(id);
    }

    /** Looks a calculation up by caption or internal name. */
    public CalculationField calculation(String captionOrName) {
        int id = symbols.calculationId(captionOrName);
        if (id < 0)
            throw new IllegalArgumentException("Unknown calculation: " + captionOrName);
        return calculations.get(id);
    }

    public Optional<CalculationField> findCalculation(String captionOrName) {
        int id = symbols.calculationId(captionOrName);
        return id < 0 ? Optional.empty() : Optional.of(calculations.get(id));
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public List<SourceField> sourceFields() {
        return sourceFields;
    }

    /** Distinct source field captions and names. */
    public Set<String> sourceFieldNames() {
        return sourceFieldNames;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public List<DuplicateCaption> duplicateCaptions() {
        return symbols.duplicates();
    }

    /** Display names of the calculations {@code calc} depends on. */
    public List<String> dependsOnCalcNames(CalculationField calc) {
        return displayNames(calc.dependsOnCalcs());
    }

    /** Display names of the calculations that use {@code calc}. */
    public List<String> usedByNames(CalculationField calc) {
        return displayNames(calc.usedBy());
    }

    public List<String> displayNames(Collection<Integer> ids) {
        List<String> out = new ArrayList<>(ids.size());
        for (int id : ids)
            out.add(calculations.get(id).displayName());
        return out;
    }

    /** Discovered cycles as id sequences, each starting and ending at the same node. */
    public List<List<Integer>> cycleIds() {
        return cycles;
    }

    /** Discovered cycles as display-name sequences. */
    public List<List<String>> cycles() {
        List<List<String>> out = new ArrayList<>(cycles.size());
        for (List<Integer> cycle : cycles)
            out.add(displayNames(cycle));
        return out;
    }

    public int maxDepth() {
        int max = 0;
        for (CalculationField calc : calculations)
            if (!calc.isCircular())
                max = Math.max(max, calc.depth());
        return max;
    }

    public List<CalculationField> roots() {
        List<CalculationField> out = new ArrayList<>();
        for (CalculationField calc : calculations)
            if (calc.isRoot() && !calc.isCircular())
                out.add(calc);
        return out;
    }

    public List<CalculationField> leaves() {
        List<CalculationField> out = new ArrayList<>();
        for (CalculationField calc : calculations)
            if (calc.isLeaf() && !calc.isCircular())
                out.add(calc);
        return out;
    }

    public List<CalculationField> intermediates() {
        List<CalculationField> out = new ArrayList<>();
        for (CalculationField calc : calculations)
            if (!calc.isRoot() && !calc.isLeaf() && !calc.isCircular())
                out.add(calc);
        return out;
    }

    public List<CalculationField> circular() {
        List<CalculationField> out = new ArrayList<>();
        for (CalculationField calc : calculations)
            if (calc.isCircular())
                out.add(calc);
        return out;
    }

    /**
     * Calculations grouped by depth ({@code level0}, {@code level1}, ...) with
     * circular ones under {@code circular}, levels in ascending order.
     */
    public Map<String, List<CalculationField>> depthLevels() {
        Map<Integer, List<CalculationField>> byDepth = new TreeMap<>();
        List<CalculationField> circular = new ArrayList<>();
        for (CalculationField calc : calculations) {
            if (calc.isCircular())
                circular.add(calc);
            else
                byDepth.computeIfAbsent(calc.depth(), k -> new ArrayList<>()).add(calc);
        }
        Map<String, List<CalculationField>> levels = new LinkedHashMap<>();
        byDepth.forEach((depth, calcs) -> levels.put("level" + depth, calcs));
        if (!circular.isEmpty())
            levels.put("circular", circular);
        return levels;
    }

    public static Builder builder() {
        return new Builder(AnalysisOptions.defaults());
    }

    public static Builder builder(AnalysisOptions options) {
        return new Builder(options);
    }

    /**
     * Collects calculations, parameters and source fields, then resolves the
     * graph in {@link #build()}.
     */
    public static final class Builder {
        private final AnalysisOptions options;
        private final List<CalculationField> calculations = new ArrayList<>();
        private final List<Parameter> parameters = new ArrayList<>();
        private final Set<String> parameterNames = new HashSet<>();
        private final List<SourceField> sourceFields = new ArrayList<>();
        private final Set<String> sourceFieldNames = new LinkedHashSet<>();

        private Builder(AnalysisOptions options) {
            this.options = options;
        }

        /** Adds a calculation; its references are tokenized from the formula here. */
        public Builder addCalculation(String name, String caption, String formula, String datasource,
                boolean hidden, String datatype, String role) {
            int id = calculations.size();
            calculations.add(new CalculationField(id, name, caption, formula, datasource, hidden, datatype, role,
                    ReferenceTokenizer.extract(formula)));
            return this;
        }

        /** Shorthand for a visible calculation with no datatype or role. */
        public Builder addCalculation(String caption, String formula) {
            return addCalculation(caption, caption, formula, "", false, "unknown", "unknown");
        }

        /** Adds a parameter, referenceable by caption or internal name. */
        public Builder addParameter(Parameter parameter) {
            parameters.add(parameter);
            if (!parameter.caption().isEmpty())
                parameterNames.add(parameter.caption());
            if (!parameter.name().isEmpty())
                parameterNames.add(parameter.name());
            return this;
        }

        public Builder addSourceField(SourceField field) {
            sourceFields.add(field);
            sourceFieldNames.add(field.caption());
            sourceFieldNames.add(field.name());
            return this;
        }

        public int calculationCount() {
            return calculations.size();
        }

        public int parameterCount() {
            return parameters.size();
        }

        public int sourceFieldCount() {
            return sourceFields.size();
        }

        /**
         * Resolves references, derives reverse edges and assigns depths.
         * Never fails on content; an empty builder yields an empty graph.
         */
        public DependencyGraph build() {
            SymbolTable symbols = SymbolTable.index(calculations, parameterNames,
                    options.getDuplicateCaptionPolicy());
            new DependencyResolver(symbols).resolve(calculations);
            ReverseEdgeBuilder.apply(calculations);
            CycleDetector.Result result = CycleDetector.detect(calculations);
            if (!result.cycles().isEmpty())
                log.debug("{} cycle(s) among {} calculations", result.cycles().size(), calculations.size());
            return new DependencyGraph(
                    Collections.unmodifiableList(calculations),
                    List.copyOf(parameters),
                    List.copyOf(sourceFields),
                    Collections.unmodifiableSet(sourceFieldNames),
                    result.cycles(),
                    symbols);
        }
    }
}
