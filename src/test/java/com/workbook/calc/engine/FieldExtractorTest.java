package com.workbook.calc.engine;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.workbook.calc.io.WorkbookDefinition;
import com.workbook.calc.io.WorkbookDefinition.ColumnDef;
import com.workbook.calc.node.CalculationField;
import com.workbook.calc.node.Parameter;

import static org.junit.Assert.*;

public class FieldExtractorTest {

    private static WorkbookDefinition workbook() {
        ColumnDef sales = WorkbookDefinition.column("[Sales]", "Sales", null);
        sales.setDatatype("real");
        sales.setRole("measure");
        ColumnDef region = WorkbookDefinition.column("[Region]", null, "   ");
        ColumnDef adjusted = WorkbookDefinition.column("[Calculation_1]", "Adjusted Sales",
                "[Sales] * [Parameters].[Parameter 1]");
        ColumnDef flag = WorkbookDefinition.column("[Calculation_2]", "Big Order",
                "IF [Adjusted Sales] &gt; 100 THEN &quot;big&quot; END");
        flag.setHidden(true);
        ColumnDef nameless = WorkbookDefinition.column(null, "  ", "1");

        ColumnDef growth = WorkbookDefinition.column("[Parameter 1]", "Growth Rate", null);
        growth.setDatatype("real");
        growth.setValue("1.1");
        growth.setMembers(List.of("1.0", "1.1", "1.1", "&lt;2"));

        return WorkbookDefinition.of("Sales Review", List.of(
                WorkbookDefinition.datasource("Orders", new ArrayList<>(List.of(sales, region, adjusted, flag,
                        nameless))),
                WorkbookDefinition.datasource("Parameters", List.of(growth))));
    }

    @Test
    public void testSortsColumns() {
        DependencyGraph g = new FieldExtractor().extract(workbook()).build();

        assertEquals(2, g.calculationCount());
        assertEquals(2, g.sourceFields().size());
        assertEquals(1, g.parameters().size());

        Parameter p = g.parameters().get(0);
        assertEquals("Parameter 1", p.name());
        assertEquals("Growth Rate", p.caption());
        assertEquals("1.1", p.currentValue());
        assertEquals(List.of("1.0", "1.1", "<2"), p.allowedValues());
        assertTrue(p.isConstrained());

        assertEquals("Region", g.sourceFields().get(1).caption());
        assertEquals("unknown", g.sourceFields().get(1).datatype());
        assertTrue(g.sourceFieldNames().contains("Sales"));
    }

    @Test
    public void testCalculationResolution() {
        DependencyGraph g = new FieldExtractor().extract(workbook()).build();

        CalculationField adjusted = g.calculation("Adjusted Sales");
        assertEquals("Calculation_1", adjusted.name());
        assertEquals("Orders", adjusted.datasource());
        assertEquals(List.of("Parameter 1"), List.copyOf(adjusted.dependsOnParams()));
        assertEquals(List.of("Sales"), List.copyOf(adjusted.dependsOnSource()));
        assertTrue(adjusted.isRoot());
        assertEquals(0, adjusted.depth());

        CalculationField flag = g.calculation("Calculation_2");
        assertEquals("IF [Adjusted Sales] > 100 THEN \"big\" END", flag.formula());
        assertTrue(flag.hidden());
        assertEquals(1, flag.depth());
        assertEquals(List.of("Big Order"), g.usedByNames(adjusted));
    }

    @Test
    public void testMissingCollectionsAreEmpty() {
        WorkbookDefinition def = new WorkbookDefinition();
        assertTrue(new FieldExtractor().extract(def).build().isEmpty());

        WorkbookDefinition noColumns = WorkbookDefinition.of("Empty", new ArrayList<>());
        WorkbookDefinition.DatasourceDef ds = WorkbookDefinition.datasource("Orders", null);
        noColumns.getWorkbook().getDatasources().add(ds);
        noColumns.getWorkbook().getDatasources().add(null);
        DependencyGraph g = new FieldExtractor().extract(noColumns).build();
        assertTrue(g.isEmpty());
        assertTrue(g.sourceFields().isEmpty());
    }

    @Test
    public void testCustomParametersDatasourceName() {
        AnalysisOptions options = new AnalysisOptions();
        options.setParametersDatasourceName("Params");
        ColumnDef rate = WorkbookDefinition.column("[Rate]", "Rate", null);
        ColumnDef calc = WorkbookDefinition.column("[Calc]", "Calc", "[Rate] * 2");
        WorkbookDefinition def = WorkbookDefinition.of("Custom", List.of(
                WorkbookDefinition.datasource("Params", List.of(rate)),
                WorkbookDefinition.datasource("Data", List.of(calc))));
        DependencyGraph g = new FieldExtractor(options).extract(def).build();
        assertEquals(List.of("Rate"), List.copyOf(g.calculation("Calc").dependsOnParams()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullDefinition() {
        new FieldExtractor().extract(null);
    }

    @Test
    public void testStripBrackets() {
        assertEquals("Order Date", FieldExtractor.stripBrackets("[Order Date]"));
        assertEquals("", FieldExtractor.stripBrackets(null));
    }
}
