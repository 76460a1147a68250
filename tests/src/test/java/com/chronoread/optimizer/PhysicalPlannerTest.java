package com.chronoread.optimizer;

import com.chronoread.exception.ValidationException;
import com.chronoread.expression.BinaryExpression;
import com.chronoread.expression.Expression;
import com.chronoread.expression.FunctionExpression;
import com.chronoread.expression.Literal;
import com.chronoread.expression.MemberExpression;
import com.chronoread.plan.DistinctSpec;
import com.chronoread.plan.FilterSpec;
import com.chronoread.plan.FromSpec;
import com.chronoread.plan.GroupMode;
import com.chronoread.plan.GroupSpec;
import com.chronoread.plan.KeysSpec;
import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureKind;
import com.chronoread.plan.RangeSpec;
import com.chronoread.time.Bounds;
import com.chronoread.time.TimeRange;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the physical planning driver, from logical plan to validated
 * physical plan.
 *
 * <p>Test ID prefix: TC-PLANNER-*
 */
@DisplayName("PhysicalPlanner Tests")
public class PhysicalPlannerTest {

    private final PhysicalPlanner planner = new PhysicalPlanner(StorageRules.all(), new PlannerConfig(10));

    private static Expression member(String property) {
        return MemberExpression.of("r", property);
    }

    // ==================== End To End ====================

    @Nested
    @DisplayName("End To End")
    class EndToEnd {

        @Test
        @DisplayName("TC-PLANNER-001: Range, filter and group all collapse into one read")
        void testFullPushdown() {
            PlanGraph graph = new PlanGraph();
            PlanNode from = graph.add("from0", new FromSpec("telegraf/autogen", ""));
            PlanNode range = graph.add("range1", new RangeSpec(Bounds.absolute(0, 100)), from);
            Expression body = BinaryExpression.and(
                BinaryExpression.greaterThan(member("_value"), Literal.of(5L)),
                BinaryExpression.equal(member("host"), Literal.of("a")));
            PlanNode filter = graph.add("filter2", new FilterSpec(FunctionExpression.predicate("r", body)), range);
            graph.add("group3", GroupSpec.by(Collections.singletonList("host")), filter);

            planner.plan(graph);

            assertThat(graph.size()).isEqualTo(1);
            PlanNode read = graph.nodes().get(0);
            assertThat(read.kind()).isEqualTo(ProcedureKind.PHYSICAL_FROM);
            assertThat(read.id().value()).isEqualTo("merged_merged_merged_from0_range1_filter2_group3");
            PhysicalFromSpec spec = (PhysicalFromSpec) read.spec();
            assertThat(spec.timeBounds()).contains(new TimeRange(0, 100));
            assertThat(spec.getFilter().body()).isEqualTo(body);
            assertThat(spec.getGroupMode()).isEqualTo(GroupMode.BY);
            assertThat(spec.getGroupKeys()).containsExactly("host");
        }

        @Test
        @DisplayName("TC-PLANNER-002: Read without a range fails validation")
        void testUnbounded() {
            PlanGraph graph = new PlanGraph();
            PlanNode from = graph.add("from0", new FromSpec("telegraf", ""));
            graph.add("keys1", new KeysSpec(), from);

            assertThatThrownBy(() -> planner.plan(graph))
                .isInstanceOf(ValidationException.class)
                .hasMessage("from0: results from \"telegraf\" must be bounded");
        }

        @Test
        @DisplayName("TC-PLANNER-003: Unpushable filter stays above the bounded read")
        void testResidualFilter() {
            PlanGraph graph = new PlanGraph();
            PlanNode from = graph.add("from0", new FromSpec("telegraf", ""));
            PlanNode range = graph.add("range1", new RangeSpec(Bounds.absolute(0, 100)), from);
            Expression body = BinaryExpression.or(
                BinaryExpression.greaterThan(member("_value"), Literal.of(5L)),
                BinaryExpression.equal(member("host"), Literal.of("a")));
            PlanNode filter = graph.add("filter2", new FilterSpec(FunctionExpression.predicate("r", body)), range);

            planner.plan(graph);

            assertThat(graph.size()).isEqualTo(2);
            assertThat(graph.contains(filter)).isTrue();
            PlanNode read = filter.predecessors().get(0);
            assertThat(read.id().value()).isEqualTo("merged_from0_range1");
            assertThat(((PhysicalFromSpec) read.spec()).isFilterSet()).isFalse();
        }

        @Test
        @DisplayName("TC-PLANNER-004: Distinct over a tag caps the read and keeps the distinct")
        void testDistinct() {
            PlanGraph graph = new PlanGraph();
            PlanNode from = graph.add("from0", new FromSpec("telegraf", ""));
            PlanNode range = graph.add("range1", new RangeSpec(Bounds.absolute(0, 100)), from);
            PlanNode distinct = graph.add("distinct2", new DistinctSpec("host"), range);

            planner.plan(graph);

            assertThat(graph.contains(distinct)).isTrue();
            PhysicalFromSpec read = (PhysicalFromSpec) distinct.predecessors().get(0).spec();
            assertThat(read.isFirstPointOnly()).isTrue();
        }

        @Test
        @DisplayName("TC-PLANNER-005: A read shared by two branches keeps its operations apart")
        void testSharedRead() {
            PlanGraph graph = new PlanGraph();
            PlanNode from = graph.add("from0", new FromSpec("telegraf", ""));
            PlanNode range = graph.add("range1", new RangeSpec(Bounds.absolute(0, 100)), from);
            PlanNode keys = graph.add("keys2", new KeysSpec(), range);
            PlanNode group = graph.add("group3", GroupSpec.by(Arrays.asList("host")), range);

            planner.plan(graph);

            PlanNode read = keys.predecessors().get(0);
            assertThat(group.predecessors()).containsExactly(read);
            assertThat(graph.contains(group)).isTrue();
            PhysicalFromSpec spec = (PhysicalFromSpec) read.spec();
            assertThat(spec.isGroupingSet()).isFalse();
            assertThat(spec.isLimitSet()).isFalse();
        }

        @Test
        @DisplayName("TC-PLANNER-006: Planning a planned graph changes nothing")
        void testFixedPoint() {
            PlanGraph graph = new PlanGraph();
            PlanNode from = graph.add("from0", new FromSpec("telegraf", ""));
            PlanNode range = graph.add("range1", new RangeSpec(Bounds.absolute(0, 100)), from);
            graph.add("keys2", new KeysSpec(), range);

            assertThat(planner.rewrite(graph)).isPositive();
            String planned = graph.toString();

            assertThat(planner.rewrite(graph)).isZero();
            assertThat(graph.toString()).isEqualTo(planned);
        }
    }

    // ==================== Configuration ====================

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @AfterEach
        void clearProperty() {
            System.clearProperty(PlannerConfig.PROP_MAX_ITERATIONS);
        }

        @Test
        @DisplayName("TC-PLANNER-007: Pass cap stops a rule that never settles")
        void testIterationCap() {
            RewriteRule restless = new RewriteRule() {
                private final Pattern pattern = Pattern.of(ProcedureKind.KEYS);

                @Override
                public Pattern pattern() {
                    return pattern;
                }

                @Override
                public RewriteResult rewrite(PlanNode node, PlanGraph graph) {
                    graph.replaceSpec(node, new KeysSpec());
                    return RewriteResult.changed(node);
                }
            };
            PlanGraph graph = new PlanGraph();
            PlanNode from = graph.add("from0", new FromSpec("telegraf", ""));
            graph.add("keys1", new KeysSpec(), from);

            PhysicalPlanner capped = new PhysicalPlanner(Collections.singletonList(restless), new PlannerConfig(3));

            assertThat(capped.rewrite(graph)).isEqualTo(3);
        }

        @Test
        @DisplayName("TC-PLANNER-008: Pass cap is read from system properties")
        void testSystemProperty() {
            System.setProperty(PlannerConfig.PROP_MAX_ITERATIONS, "7");
            assertThat(new PhysicalPlanner().maxIterations()).isEqualTo(7);

            System.setProperty(PlannerConfig.PROP_MAX_ITERATIONS, "seven");
            assertThat(PlannerConfig.fromSystemProperties().maxIterations())
                .isEqualTo(PlannerConfig.DEFAULT_MAX_ITERATIONS);

            System.setProperty(PlannerConfig.PROP_MAX_ITERATIONS, "0");
            assertThat(PlannerConfig.fromSystemProperties().maxIterations())
                .isEqualTo(PlannerConfig.DEFAULT_MAX_ITERATIONS);
        }

        @Test
        @DisplayName("TC-PLANNER-009: Non-positive cap is rejected")
        void testInvalidCap() {
            assertThatThrownBy(() -> new PlannerConfig(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
