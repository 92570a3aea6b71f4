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

import dev.mars.spacetime.algebra.ast.BinaryExpression;
import dev.mars.spacetime.algebra.ast.Conditional;
import dev.mars.spacetime.algebra.ast.DatasetReference;
import dev.mars.spacetime.algebra.ast.Expression;
import dev.mars.spacetime.algebra.ast.ExpressionVisitor;
import dev.mars.spacetime.algebra.ast.FunctionCall;
import dev.mars.spacetime.algebra.ast.MapReference;
import dev.mars.spacetime.algebra.ast.NullLiteral;
import dev.mars.spacetime.algebra.ast.NumberLiteral;
import dev.mars.spacetime.algebra.ast.TemporalExpression;
import dev.mars.spacetime.algebra.operator.CalculatorFunctions;
import dev.mars.spacetime.algebra.operator.ExtentMode;
import dev.mars.spacetime.algebra.operator.OperatorFunction;
import dev.mars.spacetime.algebra.operator.TemporalOperator;
import dev.mars.spacetime.api.error.ConsistencyViolationException;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.relation.TemporalRelation;
import dev.mars.spacetime.temporal.topology.RelationIndex;
import dev.mars.spacetime.temporal.topology.TemporalTopologyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Lowers an algebra syntax tree into working maps carrying calculator command
 * strings.
 * <p>
 * Two map lists are paired through a relation index built between them. For
 * every left map the related right maps are overlaid one after the other
 * according to the extent mode, and their substitutions are chained with the
 * operator, e.g. {@code ((a1 + b1) + b2)}. A left map without related maps,
 * or whose overlay fails, yields no result. In {@link ExtentMode#RIGHT} mode
 * every related pair yields its own result with the right map's extent.
 * <p>
 * Scalars (numbers, {@code null()}, {@code map(name)}) are applied to every map
 * of the other operand.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-22
 * @version 1.0
 */
public class AlgebraEvaluator implements ExpressionVisitor<Operand> {
    private static final Logger logger = LoggerFactory.getLogger(AlgebraEvaluator.class);

    private static final Set<TemporalRelation> EQUAL_ONLY = EnumSet.of(TemporalRelation.EQUAL);

    private final DatasetResolver resolver;
    private final TemporalExtentOverlay overlay;

    // time of the first dataset operand, every other operand must match it
    private TemporalExtent referenceTime;
    private String referenceDataset;

    public AlgebraEvaluator(DatasetResolver resolver, boolean spatial) {
        this.resolver = resolver;
        this.overlay = new TemporalExtentOverlay(spatial);
    }

    public Operand evaluate(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Operand visitDataset(DatasetReference node) {
        List<AlgebraMap> maps = resolver.resolveDataset(node.name());
        for (AlgebraMap map : maps) {
            checkTimeCompatible(node.name(), map.getTemporalExtent());
        }
        return Operand.maps(maps);
    }

    /**
     * @throws ConsistencyViolationException if absolute and relative time, or
     *         relative time in different units, meet in one expression
     */
    private void checkTimeCompatible(String dataset, TemporalExtent time) {
        if (time == null) {
            return;
        }
        if (referenceTime == null) {
            referenceTime = time;
            referenceDataset = dataset;
            return;
        }
        if (time.getType() != referenceTime.getType()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.TEMPORAL_TYPE_MISMATCH,
                "Space time datasets <" + referenceDataset + "> and <" + dataset + "> have different temporal types ("
                    + referenceTime.getType().getName() + ", " + time.getType().getName() + ")");
        }
        if (time instanceof RelativeTemporalExtent relative
                && referenceTime instanceof RelativeTemporalExtent reference
                && relative.getUnit() != reference.getUnit()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.RELATIVE_UNIT_MISMATCH,
                "Space time datasets <" + referenceDataset + "> and <" + dataset + "> use different relative units ("
                    + reference.getUnit().getPlural() + ", " + relative.getUnit().getPlural() + ")");
        }
    }

    @Override
    public Operand visitNumber(NumberLiteral node) {
        return Operand.scalar(node.text());
    }

    @Override
    public Operand visitMap(MapReference node) {
        return Operand.scalar(resolver.resolveMap(node.name()));
    }

    @Override
    public Operand visitNull(NullLiteral node) {
        return Operand.scalar("null()");
    }

    @Override
    public Operand visitFunction(FunctionCall node) {
        Operand argument = evaluate(node.argument());
        return apply(argument, text -> CalculatorFunctions.render(node.function(), text));
    }

    @Override
    public Operand visitBinary(BinaryExpression node) {
        return combine(evaluate(node.left()), evaluate(node.right()), node.operator(), EQUAL_ONLY,
            ExtentMode.LEFT, null);
    }

    @Override
    public Operand visitTemporal(TemporalExpression node) {
        TemporalOperator operator = node.operator();
        Operand left = evaluate(node.left());
        Operand right = evaluate(node.right());

        OperatorFunction function = operator.function();
        if (function.isSelection() || function == OperatorFunction.HASH) {
            if (left.isScalar() || right.isScalar()) {
                throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
                    "Temporal operator " + function.getSymbol() + " needs space time datasets on both sides");
            }
            return function == OperatorFunction.HASH
                ? count(left.getMaps(), right.getMaps(), operator.relations())
                : select(left.getMaps(), right.getMaps(), operator, function == OperatorFunction.SELECT);
        }
        return combine(left, right, function.getSymbol(), operator.relations(), operator.mode(), operator.aggregate());
    }

    @Override
    public Operand visitConditional(Conditional node) {
        Operand condition = evaluate(node.condition());
        Operand then = evaluate(node.then());
        Operand conclusion = node.otherwise() == null
            ? then : conclusion(then, evaluate(node.otherwise()), node.relations());

        if (condition.isScalar() && conclusion.isScalar()) {
            return Operand.scalar("if(" + condition.getScalar() + ", " + conclusion.getScalar() + ")");
        }
        if (conclusion.isScalar()) {
            String text = conclusion.getScalar();
            return apply(condition, cond -> "if(" + cond + ", " + text + ")");
        }
        if (condition.isScalar()) {
            String text = condition.getScalar();
            return apply(conclusion, concl -> "if(" + text + ", " + concl + ")");
        }

        List<AlgebraMap> results = new ArrayList<>();
        RelationIndex<AlgebraMap, AlgebraMap> index = TemporalTopologyBuilder.build(
            condition.getMaps(), conclusion.getMaps(), overlay.isSpatial());
        for (AlgebraMap cond : condition.getMaps()) {
            for (AlgebraMap concl : index.related(cond, node.relations())) {
                overlay.overlay(concl, cond, ExtentMode.LEFT).ifPresent(result -> results.add(
                    result.withCommand("if(" + cond.substitution() + ", " + concl.substitution() + ")")));
            }
        }
        logger.debug("Conditional produced {} maps", results.size());
        return Operand.maps(results);
    }

    /**
     * Joins then and else branches into {@code then, else}. Each then map is
     * paired with its last related else map, in relation then start time
     * order, and keeps its own extent.
     */
    private Operand conclusion(Operand then, Operand otherwise, Set<TemporalRelation> relations) {
        if (then.isScalar() && otherwise.isScalar()) {
            return Operand.scalar(then.getScalar() + ", " + otherwise.getScalar());
        }
        if (otherwise.isScalar()) {
            String text = otherwise.getScalar();
            return apply(then, t -> t + ", " + text);
        }
        if (then.isScalar()) {
            String text = then.getScalar();
            return apply(otherwise, e -> text + ", " + e);
        }

        List<AlgebraMap> results = new ArrayList<>();
        RelationIndex<AlgebraMap, AlgebraMap> index = TemporalTopologyBuilder.build(
            then.getMaps(), otherwise.getMaps(), overlay.isSpatial());
        for (AlgebraMap map : then.getMaps()) {
            List<AlgebraMap> related = index.related(map, relations);
            if (related.isEmpty()) {
                continue;
            }
            AlgebraMap other = related.get(related.size() - 1);
            overlay.overlay(map, other, ExtentMode.LEFT).ifPresent(result -> results.add(
                result.withCommand(map.substitution() + ", " + other.substitution())));
        }
        return Operand.maps(results);
    }

    private Operand combine(Operand left, Operand right, String operator, Set<TemporalRelation> relations,
                            ExtentMode mode, String aggregate) {
        if (left.isScalar() && right.isScalar()) {
            return Operand.scalar(binary(left.getScalar(), operator, right.getScalar()));
        }
        if (right.isScalar()) {
            String text = right.getScalar();
            return apply(left, l -> binary(l, operator, text));
        }
        if (left.isScalar()) {
            String text = left.getScalar();
            return apply(right, r -> binary(text, operator, r));
        }

        List<AlgebraMap> results = new ArrayList<>();
        RelationIndex<AlgebraMap, AlgebraMap> index = TemporalTopologyBuilder.build(
            left.getMaps(), right.getMaps(), overlay.isSpatial());
        for (AlgebraMap map : left.getMaps()) {
            List<AlgebraMap> related = index.related(map, relations);
            if (related.isEmpty()) {
                continue;
            }
            if (mode == ExtentMode.RIGHT) {
                for (AlgebraMap other : related) {
                    overlay.overlay(map, other, mode).ifPresent(result -> results.add(
                        result.withCommand(binary(map.substitution(), operator, other.substitution()))));
                }
                continue;
            }
            pairWithAll(map, related, mode).ifPresent(result -> results.add(
                result.withCommand(chain(map, related, operator, aggregate))));
        }
        logger.debug("{} combined {} x {} maps into {} results", operator, left.getMaps().size(),
            right.getMaps().size(), results.size());
        return Operand.maps(results);
    }

    private Optional<AlgebraMap> pairWithAll(AlgebraMap map, List<AlgebraMap> related, ExtentMode mode) {
        AlgebraMap combined = map;
        for (AlgebraMap other : related) {
            Optional<AlgebraMap> next = overlay.overlay(combined, other, mode);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            combined = next.get();
        }
        return Optional.of(combined);
    }

    private static String chain(AlgebraMap map, List<AlgebraMap> related, String operator, String aggregate) {
        if (aggregate != null && related.size() > 1) {
            List<String> parts = new ArrayList<>();
            for (AlgebraMap other : related) {
                parts.add(other.substitution());
            }
            String joined = "(" + String.join(" " + aggregate + aggregate + " ", parts) + ")";
            return binary(map.substitution(), operator, joined);
        }
        String command = map.substitution();
        for (AlgebraMap other : related) {
            command = binary(command, operator, other.substitution());
        }
        return command;
    }

    private Operand select(List<AlgebraMap> left, List<AlgebraMap> right, TemporalOperator operator, boolean keepRelated) {
        List<AlgebraMap> results = new ArrayList<>();
        RelationIndex<AlgebraMap, AlgebraMap> index = TemporalTopologyBuilder.build(left, right, overlay.isSpatial());
        for (AlgebraMap map : left) {
            List<AlgebraMap> related = index.related(map, operator.relations());
            if (!keepRelated) {
                if (related.isEmpty()) {
                    results.add(map);
                }
                continue;
            }
            if (related.isEmpty()) {
                continue;
            }
            if (operator.mode() == ExtentMode.RIGHT) {
                for (AlgebraMap other : related) {
                    overlay.overlay(map, other, ExtentMode.RIGHT).ifPresent(results::add);
                }
            } else {
                pairWithAll(map, related, operator.mode()).ifPresent(results::add);
            }
        }
        return Operand.maps(results);
    }

    private Operand count(List<AlgebraMap> left, List<AlgebraMap> right, Set<TemporalRelation> relations) {
        List<AlgebraMap> results = new ArrayList<>();
        RelationIndex<AlgebraMap, AlgebraMap> index = TemporalTopologyBuilder.build(left, right, overlay.isSpatial());
        for (AlgebraMap map : left) {
            int related = index.related(map, relations).size();
            if (related > 0) {
                results.add(map.withCommand(Integer.toString(related)));
            }
        }
        return Operand.maps(results);
    }

    private static Operand apply(Operand operand, UnaryOperator<String> render) {
        if (operand.isScalar()) {
            return Operand.scalar(render.apply(operand.getScalar()));
        }
        List<AlgebraMap> results = new ArrayList<>();
        for (AlgebraMap map : operand.getMaps()) {
            results.add(map.withCommand(render.apply(map.substitution())));
        }
        return Operand.maps(results);
    }

    private static String binary(String left, String operator, String right) {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
