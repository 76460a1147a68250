package com.chronoread.plan;

import com.chronoread.expression.BinaryExpression;
import com.chronoread.expression.FunctionExpression;
import com.chronoread.expression.Literal;
import com.chronoread.expression.MemberExpression;
import com.chronoread.time.Bounds;
import com.chronoread.time.TimeValue;
import com.chronoread.time.Window;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PlanSpecSerializer.
 *
 * <p>Test ID prefix: TC-EXPLAIN-*
 */
@DisplayName("PlanSpecSerializer Tests")
public class PlanSpecSerializerTest {

    @Test
    @DisplayName("TC-EXPLAIN-001: Every read field is written, including unset ones")
    void testAllFieldsPresent() {
        ObjectNode json = PlanSpecSerializer.toJson(new PhysicalFromSpec(new FromSpec("telegraf", "")));

        assertThat(json.fieldNames()).toIterable().containsExactly(
            "bucket", "bucketID",
            "boundsSet", "bounds",
            "filterSet", "filter",
            "descendingSet", "descending",
            "limitSet", "pointsLimit", "seriesLimit", "seriesOffset",
            "windowSet", "window",
            "groupingSet", "orderByTime", "groupMode", "groupKeys",
            "aggregateSet", "aggregateMethod");
        assertThat(json.get("bucket").asText()).isEqualTo("telegraf");
        assertThat(json.get("boundsSet").asBoolean()).isFalse();
        assertThat(json.get("bounds").isNull()).isTrue();
        assertThat(json.get("groupMode").asText()).isEqualTo("none");
    }

    @Test
    @DisplayName("TC-EXPLAIN-002: Populated read serializes its values")
    void testPopulated() throws Exception {
        PhysicalFromSpec spec = new PhysicalFromSpec(new FromSpec("telegraf/autogen", ""));
        spec.setBounds(new Bounds(TimeValue.relative(-3_600_000_000_000L), TimeValue.now(),
            Instant.parse("2024-01-01T00:00:00Z")));
        spec.setFilter(FunctionExpression.predicate("r",
            BinaryExpression.greaterThan(MemberExpression.of("r", "_value"), Literal.of(5L))));
        spec.setPointsLimit(PhysicalFromSpec.FIRST_POINT_ONLY);
        spec.setWindow(new Window(10, 10, 0));
        spec.setGrouping(GroupMode.BY, Arrays.asList("host", "dc"));

        JsonNode json = new ObjectMapper().readTree(PlanSpecSerializer.toJsonString(spec));

        assertThat(json.get("bounds").get("start").get("relative").asBoolean()).isTrue();
        assertThat(json.get("bounds").get("start").get("nanos").asLong()).isEqualTo(-3_600_000_000_000L);
        assertThat(json.get("bounds").get("now").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.get("filter").asText()).isEqualTo("(r) => (r._value > 5)");
        assertThat(json.get("limitSet").asBoolean()).isTrue();
        assertThat(json.get("pointsLimit").asLong()).isEqualTo(-1L);
        assertThat(json.get("window").get("every").asLong()).isEqualTo(10L);
        assertThat(json.get("groupMode").asText()).isEqualTo("by");
        assertThat(json.get("groupKeys").get(1).asText()).isEqualTo("dc");
    }
}
