package com.workbook.calc.formula;

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

public class ScopedAggregationParserTest {

    @Test
    public void testEntityCohort() {
        List<ScopedAggregationExpression> exprs = ScopedAggregationParser.parse("First Order",
                "{FIXED [Customer] : MIN([Order Date])}");
        assertEquals(1, exprs.size());
        ScopedAggregationExpression e = exprs.get(0);
        assertEquals("First Order", e.owner());
        assertEquals(ScopeKind.FIXED, e.kind());
        assertEquals(List.of("Customer"), e.dimensions());
        assertEquals(AggregationFunction.MIN, e.aggregation());
        assertEquals("MIN([Order Date])", e.expression());
        assertFalse(e.hasNestedScope());
        assertEquals(ScopedAggregationPattern.ENTITY_COHORT, ScopedAggregationPattern.classify(e));
    }

    @Test
    public void testEmptyDimensionList() {
        ScopedAggregationExpression e = ScopedAggregationParser.parse("{FIXED : SUM([Sales])}").get(0);
        assertTrue(e.dimensions().isEmpty());
        assertTrue(e.isTableScoped());
        assertEquals(AggregationFunction.SUM, e.aggregation());
        assertEquals(ScopedAggregationPattern.TABLE_TOTAL, ScopedAggregationPattern.classify(e));
    }

    @Test
    public void testNestedBlocks() {
        List<ScopedAggregationExpression> exprs = ScopedAggregationParser
                .parse("{FIXED [Region] : SUM({FIXED [Customer] : SUM([Sales])})}");
        assertEquals(1, exprs.size());
        ScopedAggregationExpression outer = exprs.get(0);
        assertEquals(List.of("Region"), outer.dimensions());
        assertEquals(AggregationFunction.SUM, outer.aggregation());
        assertEquals("SUM({FIXED [Customer] : SUM([Sales])})", outer.expression());
        assertTrue(outer.hasNestedScope());
        assertEquals(1, outer.nestedExpressions().size());

        ScopedAggregationExpression inner = outer.nestedExpressions().get(0);
        assertEquals(List.of("Customer"), inner.dimensions());
        assertEquals("SUM([Sales])", inner.expression());
        assertFalse(inner.hasNestedScope());
    }

    @Test
    public void testDoubleNesting() {
        ScopedAggregationExpression outer = ScopedAggregationParser.parse(
                "{EXCLUDE [A] : AVG({INCLUDE [B] : MAX({FIXED [C] : SUM([x])})})}").get(0);
        assertEquals(ScopeKind.EXCLUDE, outer.kind());
        ScopedAggregationExpression middle = outer.nestedExpressions().get(0);
        assertEquals(ScopeKind.INCLUDE, middle.kind());
        assertEquals(AggregationFunction.MAX, middle.aggregation());
        ScopedAggregationExpression inner = middle.nestedExpressions().get(0);
        assertEquals(ScopeKind.FIXED, inner.kind());
        assertEquals(List.of("C"), inner.dimensions());
    }

    @Test
    public void testMultipleTopLevelBlocks() {
        List<ScopedAggregationExpression> exprs = ScopedAggregationParser.parse(
                "SUM([Sales]) / {FIXED : SUM([Sales])} - {include [Order ID], [Product] : count([Row])}");
        assertEquals(2, exprs.size());
        assertEquals(ScopeKind.FIXED, exprs.get(0).kind());
        ScopedAggregationExpression second = exprs.get(1);
        assertEquals(ScopeKind.INCLUDE, second.kind());
        assertEquals(List.of("Order ID", "Product"), second.dimensions());
        assertEquals(AggregationFunction.COUNT, second.aggregation());
    }

    @Test
    public void testUnknownAggregationIsNull() {
        ScopedAggregationExpression e = ScopedAggregationParser
                .parse("{FIXED [Region] : [Sales] * 2}").get(0);
        assertNull(e.aggregation());
        assertEquals("[Sales] * 2", e.expression());

        // A name outside the vocabulary is not an aggregation even when followed by '('
        assertNull(ScopedAggregationParser.parse("{FIXED [Region] : ZN(SUM([Sales]))}").get(0).aggregation());
    }

    @Test
    public void testAggregationToleratesSpaceBeforeParen() {
        ScopedAggregationExpression e = ScopedAggregationParser.parse("{ fixed [Region]: countd ([Customer])}")
                .get(0);
        assertEquals(ScopeKind.FIXED, e.kind());
        assertEquals(AggregationFunction.COUNTD, e.aggregation());
    }

    @Test
    public void testQualifiedAndExpressionDimensions() {
        ScopedAggregationExpression e = ScopedAggregationParser.parse(
                "{FIXED [Superstore].[none:Customer Name:nk], DATETRUNC('month', [Order Date]) : SUM([Sales])}")
                .get(0);
        assertEquals(List.of("Customer Name", "Order Date"), e.dimensions());
    }

    @Test
    public void testBracesInsideFieldNamesAndStrings() {
        List<ScopedAggregationExpression> exprs = ScopedAggregationParser.parse(
                "IF [Label {x}] = '{FIXED' THEN {FIXED [Region:Code] : MAX([Sales])} END");
        assertEquals(1, exprs.size());
        assertEquals(List.of("Region:Code"), exprs.get(0).dimensions());
        assertEquals(AggregationFunction.MAX, exprs.get(0).aggregation());
    }

    @Test
    public void testCommentsAreSkipped() {
        List<ScopedAggregationExpression> exprs = ScopedAggregationParser.parse(
                "// {FIXED : SUM([Old])}\n{EXCLUDE [Category] : SUM([Sales])}");
        assertEquals(1, exprs.size());
        assertEquals(ScopeKind.EXCLUDE, exprs.get(0).kind());
    }

    @Test
    public void testMalformedInputNeverFails() {
        assertTrue(ScopedAggregationParser.parse("").isEmpty());
        assertTrue(ScopedAggregationParser.parse(null).isEmpty());
        assertTrue(ScopedAggregationParser.parse("{ SUM([Sales]) }").isEmpty());
        assertTrue(ScopedAggregationParser.parse("{FIXED [Region] SUM([Sales])}").isEmpty());

        // Unterminated block runs to the end of the formula
        List<ScopedAggregationExpression> exprs = ScopedAggregationParser.parse("{FIXED [Region] : SUM([Sales])");
        assertEquals(1, exprs.size());
        assertEquals("SUM([Sales])", exprs.get(0).expression());
    }

    @Test
    public void testBlockInsideNonScopeBraces() {
        List<ScopedAggregationExpression> exprs = ScopedAggregationParser.parse("{ 1 + {FIXED : MIN([x])} }");
        assertEquals(1, exprs.size());
        assertEquals(AggregationFunction.MIN, exprs.get(0).aggregation());
    }

    @Test
    public void testContainsScopeMarker() {
        assertTrue(ScopedAggregationParser.containsScopeMarker("SUM({ Include [a] : SUM([b])})"));
        assertFalse(ScopedAggregationParser.containsScopeMarker("SUM([b])"));
        assertFalse(ScopedAggregationParser.containsScopeMarker("{FIXEDX}"));
        assertFalse(ScopedAggregationParser.containsScopeMarker(null));
    }

    @Test
    public void testScopeKeywordInsideStringIsNotNesting() {
        ScopedAggregationExpression e = ScopedAggregationParser
                .parse("{FIXED [Region] : SUM(IF [x]=\"{FIXED\" THEN 1 END)}").get(0);
        assertEquals(List.of("Region"), e.dimensions());
        assertEquals("SUM(IF [x]=\"{FIXED\" THEN 1 END)", e.expression());
        assertFalse(e.hasNestedScope());
        assertTrue(e.nestedExpressions().isEmpty());
    }

    @Test
    public void testUnrelatedFieldsInOneDimensionEntry() {
        assertEquals(List.of("A", "B"),
                ScopedAggregationParser.parse("{FIXED [A] + [B] : SUM([x])}").get(0).dimensions());
        assertEquals(List.of("Region", "State", "City"), ScopedAggregationParser
                .parse("{INCLUDE [Region] + [State], [Geo] . [City] : SUM([x])}").get(0).dimensions());
    }
}
