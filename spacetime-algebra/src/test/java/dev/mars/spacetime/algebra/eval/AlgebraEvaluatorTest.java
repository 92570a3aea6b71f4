package dev.mars.spacetime.algebra.eval;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.spacetime.algebra.parser.AlgebraParser;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.SpaceTimeException;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.error.ConsistencyViolationException;
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class AlgebraEvaluatorTest {

    private static final SpatialExtent WORLD = new SpatialExtent(80, 0, 120, 0);

    private final MapResolver resolver = new MapResolver()
        .with("A", map("a1", month(1)), map("a2", month(2)), map("a3", month(3)))
        .with("B", map("b1", month(1)), map("b2", month(2)))
        .with("S", map("s1", interval(1, 4)))
        .with("D", map("d1", new RelativeTemporalExtent(1, 2L, CalendarUnit.DAYS)))
        .with("Y", map("y1", new RelativeTemporalExtent(1, 2L, CalendarUnit.YEARS)));

    private static TemporalExtent month(int month) {
        return interval(month, month + 1);
    }

    private static TemporalExtent interval(int startMonth, int endMonth) {
        return new AbsoluteTemporalExtent(LocalDateTime.of(2001, startMonth, 1, 0, 0),
            LocalDateTime.of(2001, endMonth, 1, 0, 0));
    }

    private static AlgebraMap map(String name, TemporalExtent time) {
        return AlgebraMap.of(name + "@PERMANENT", time, WORLD);
    }

    private List<AlgebraMap> evaluate(String expression) {
        return evaluate(expression, false);
    }

    private List<AlgebraMap> evaluate(String expression, boolean spatial) {
        return new AlgebraEvaluator(resolver, spatial).evaluate(AlgebraParser.parseExpression(expression)).getMaps();
    }

    private static List<String> commands(List<AlgebraMap> maps) {
        return maps.stream().map(AlgebraMap::substitution).collect(Collectors.toList());
    }

    @Test
    void testEqualMapsArePaired() {
        List<AlgebraMap> result = evaluate("A + B");

        assertEquals(List.of("(a1@PERMANENT + b1@PERMANENT)", "(a2@PERMANENT + b2@PERMANENT)"), commands(result));
        assertEquals(month(1), result.get(0).getTemporalExtent());
        assertEquals(month(2), result.get(1).getTemporalExtent());
    }

    @Test
    void testScalarIsAppliedToEveryMap() {
        assertEquals(List.of("(a1@PERMANENT * 2)", "(a2@PERMANENT * 2)", "(a3@PERMANENT * 2)"),
            commands(evaluate("A * 2")));
        assertEquals(List.of("((1 + 2) - a1@PERMANENT)", "((1 + 2) - a2@PERMANENT)", "((1 + 2) - a3@PERMANENT)"),
            commands(evaluate("1 + 2 - A")));
    }

    @Test
    void testInputMapsAreNotModified() {
        List<AlgebraMap> inputs = resolver.resolveDataset("A");
        evaluate("A * 2");

        assertFalse(inputs.get(0).hasCommand());
        assertEquals("a1@PERMANENT", inputs.get(0).substitution());
    }

    @Test
    void testRelationSelectsPartners() {
        List<AlgebraMap> result = evaluate("A {+,during} S");

        assertEquals(List.of("(a2@PERMANENT + s1@PERMANENT)"), commands(result));
        assertEquals(month(2), result.get(0).getTemporalExtent());
    }

    @Test
    void testSeveralRelatedMapsAreChained() {
        List<AlgebraMap> result = evaluate("S {+,contains|started|finished} A");

        assertEquals(List.of("(((s1@PERMANENT + a2@PERMANENT) + a1@PERMANENT) + a3@PERMANENT)"), commands(result));
        assertEquals(interval(1, 4), result.get(0).getTemporalExtent());
    }

    @Test
    void testAggregatedLogicalOperator() {
        assertEquals(List.of("(s1@PERMANENT && (a2@PERMANENT || a1@PERMANENT || a3@PERMANENT))"),
            commands(evaluate("S {&&,contains|started|finished,l,|} A")));
    }

    @Test
    void testRightModeYieldsOneResultPerPair() {
        List<AlgebraMap> result = evaluate("S {-,contains|started|finished,r} A");

        assertEquals(List.of("(s1@PERMANENT - a1@PERMANENT)", "(s1@PERMANENT - a2@PERMANENT)",
            "(s1@PERMANENT - a3@PERMANENT)"), commands(result));
        assertEquals(month(3), result.get(2).getTemporalExtent());
    }

    @Test
    void testUnionAndIntersectionModes() {
        List<AlgebraMap> union = evaluate("A {+,precedes,u} B");
        assertEquals(List.of("(a1@PERMANENT + b2@PERMANENT)"), commands(union));
        assertEquals(interval(1, 3), union.get(0).getTemporalExtent());

        assertTrue(evaluate("A {+,precedes,i} B").isEmpty(), "touching maps have no common time");
        assertEquals(interval(1, 3), evaluate("A {+,precedes,d} B").get(0).getTemporalExtent());
    }

    @Test
    void testSelection() {
        assertTrue(evaluate("A : S").isEmpty());
        assertEquals(List.of("a1@PERMANENT", "a2@PERMANENT", "a3@PERMANENT"),
            commands(evaluate("A {:,during|starts|finishes} S")));
        assertEquals(List.of("a1@PERMANENT", "a3@PERMANENT"), commands(evaluate("A {!:,during} S")));
        assertEquals(List.of("a3@PERMANENT"), commands(evaluate("A !: B")));
    }

    @Test
    void testSelectionWithRightMode() {
        List<AlgebraMap> result = evaluate("S {:,contains,r} A");

        assertEquals(1, result.size());
        assertEquals("s1@PERMANENT", result.get(0).substitution());
        assertEquals(month(2), result.get(0).getTemporalExtent());
    }

    @Test
    void testHashCountsRelatedMaps() {
        List<AlgebraMap> result = evaluate("S {#,contains|started|finished} A");

        assertEquals(List.of("3"), commands(result));
        assertEquals(List.of("1", "1"), commands(evaluate("A # B")));
    }

    @Test
    void testFunctionsAndNull() {
        assertEquals("abs(a1@PERMANENT)", evaluate("abs(A)").get(0).substitution());
        assertEquals("!isnull(a1@PERMANENT)", evaluate("isntnull(A)").get(0).substitution());
        assertEquals("(a1@PERMANENT + null())", evaluate("A + null()").get(0).substitution());
    }

    @Test
    void testMapReferenceIsScalar() {
        assertEquals(List.of("(a1@PERMANENT - elevation@PERMANENT)", "(a2@PERMANENT - elevation@PERMANENT)",
            "(a3@PERMANENT - elevation@PERMANENT)"), commands(evaluate("A - map(elevation)")));
    }

    @Test
    void testConditionalWithoutElse() {
        List<AlgebraMap> result = evaluate("if(A > 0, B)");

        assertEquals(List.of("if((a1@PERMANENT > 0), b1@PERMANENT)", "if((a2@PERMANENT > 0), b2@PERMANENT)"),
            commands(result));
        assertEquals(month(1), result.get(0).getTemporalExtent());
    }

    @Test
    void testConditionalWithElse() {
        assertEquals(List.of("if((a1@PERMANENT > 0), a1@PERMANENT, null())",
                "if((a2@PERMANENT > 0), a2@PERMANENT, null())", "if((a3@PERMANENT > 0), a3@PERMANENT, null())"),
            commands(evaluate("if(A > 0, A, null())")));
        assertEquals(List.of("if((a1@PERMANENT > 0), a1@PERMANENT, b1@PERMANENT)",
                "if((a2@PERMANENT > 0), a2@PERMANENT, b2@PERMANENT)"),
            commands(evaluate("if(A > 0, A, B)")));
    }

    @Test
    void testElseBranchTakesLastRelatedMap() {
        List<AlgebraMap> result = evaluate("if({equal|contains|started|finished}, S > 0, S, A)");

        assertEquals(List.of("if((s1@PERMANENT > 0), s1@PERMANENT, a3@PERMANENT)"), commands(result));
        assertEquals(interval(1, 4), result.get(0).getTemporalExtent());
    }

    @Test
    void testTemporalConditional() {
        List<AlgebraMap> result = evaluate("if({contains}, S > 0, A)");

        assertEquals(List.of("if((s1@PERMANENT > 0), a2@PERMANENT)"), commands(result));
        assertEquals(month(2), result.get(0).getTemporalExtent());
    }

    @Test
    void testSpatialEvaluationDropsDisjointMaps() {
        resolver.with("E", AlgebraMap.of("e1@PERMANENT", month(1), new SpatialExtent(10, 0, 10, 0)),
            AlgebraMap.of("e2@PERMANENT", month(2), new SpatialExtent(200, 100, 300, 200)));

        List<AlgebraMap> spatial = evaluate("A + E", true);
        assertEquals(List.of("(a1@PERMANENT + e1@PERMANENT)"), commands(spatial));
        assertEquals(new SpatialExtent(10, 0, 10, 0), spatial.get(0).getSpatialExtent());

        assertEquals(2, evaluate("A + E", false).size());
    }

    @Test
    void testSelectionNeedsDatasets() {
        assertThrows(TemporalSyntaxException.class, () -> evaluate("A : 1"));
    }

    @Test
    void testUnknownDatasetPropagates() {
        SpaceTimeException e = assertThrows(SpaceTimeException.class, () -> evaluate("A + missing"));
        assertEquals(SpaceTimeErrorCodes.DATASET_NOT_FOUND, e.getCode());
    }

    @Test
    void testOperandsWithDifferentTimeAreRejected() {
        ConsistencyViolationException types = assertThrows(ConsistencyViolationException.class,
            () -> evaluate("A + D"));
        assertEquals(SpaceTimeErrorCodes.TEMPORAL_TYPE_MISMATCH, types.getCode());
        assertTrue(types.getMessage().contains("<A>") && types.getMessage().contains("<D>"), types.getMessage());

        ConsistencyViolationException units = assertThrows(ConsistencyViolationException.class,
            () -> evaluate("if(D > 0, Y)"));
        assertEquals(SpaceTimeErrorCodes.RELATIVE_UNIT_MISMATCH, units.getCode());

        assertEquals(List.of("(d1@PERMANENT * 2)"), commands(evaluate("D * 2")));
    }

    private static final class MapResolver implements DatasetResolver {
        private final Map<String, List<AlgebraMap>> datasets = new HashMap<>();

        MapResolver with(String name, AlgebraMap... maps) {
            datasets.put(name, List.of(maps));
            return this;
        }

        @Override
        public List<AlgebraMap> resolveDataset(String name) {
            List<AlgebraMap> maps = datasets.get(name);
            if (maps == null) {
                throw new SpaceTimeException(SpaceTimeErrorCodes.DATASET_NOT_FOUND, "Dataset <" + name + "> not found");
            }
            return maps;
        }

        @Override
        public String resolveMap(String name) {
            return name.contains("@") ? name : name + "@PERMANENT";
        }
    }
}
