package com.opspilot.test.domain;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.PlanFilter;
import com.opspilot.types.enums.PlanFilterFieldEnum;
import com.opspilot.types.enums.PlanFilterOperatorEnum;
import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.SortDirectionEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class InventoryQueryPlanTest {

    @Test
    public void shouldRejectGroupedRows() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> InventoryQueryPlan.builder()
                .metric(PlanMetricEnum.ROWS)
                .groupBy(PlanGroupByEnum.CATEGORY)
                .sortBy("name")
                .build());
    }

    @Test
    public void shouldRejectScalarWithRowSort() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> InventoryQueryPlan.builder()
                .metric(PlanMetricEnum.SUM_QUANTITY)
                .groupBy(PlanGroupByEnum.NONE)
                .sortBy("name")
                .build());
    }

    @Test
    public void shouldRejectGroupedSortOutsideMetricOrGroup() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> InventoryQueryPlan.builder()
                .metric(PlanMetricEnum.COUNT_ITEMS)
                .groupBy(PlanGroupByEnum.VENDOR)
                .sortBy("quantity")
                .build());
    }

    @Test
    public void shouldRejectLimitOutOfRange() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> InventoryQueryPlan.builder().sortBy("name").limit(0).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> InventoryQueryPlan.builder().sortBy("name").limit(101).build());
    }

    @Test
    public void shouldParseModelPayloadWithCamelCaseKeys() {
        Map<String, Object> filter = new HashMap<>();
        filter.put("field", "category");
        filter.put("operator", "eq");
        filter.put("value", " office ");
        Map<String, Object> payload = new HashMap<>();
        payload.put("metric", "count_items");
        payload.put("groupBy", "vendor");
        payload.put("filters", List.of(filter));
        payload.put("sortBy", "group");
        payload.put("sortDirection", "asc");
        payload.put("limit", "7");

        InventoryQueryPlan plan = InventoryQueryPlan.fromPayload(payload);

        Assertions.assertEquals(PlanMetricEnum.COUNT_ITEMS, plan.getMetric());
        Assertions.assertEquals(PlanGroupByEnum.VENDOR, plan.getGroupBy());
        Assertions.assertEquals(InventoryQueryPlan.SORT_BY_GROUP, plan.getSortBy());
        Assertions.assertEquals(SortDirectionEnum.ASC, plan.getSortDirection());
        Assertions.assertEquals(7, plan.getLimit());
        Assertions.assertEquals("office", plan.getFilters().get(0).getValue());
        Assertions.assertEquals("vendor", plan.toPayload().get("group_by"));
    }

    @Test
    public void shouldRejectFractionalLimitAndUnknownEnums() {
        Map<String, Object> fractional = new HashMap<>();
        fractional.put("metric", "rows");
        fractional.put("sort_by", "name");
        fractional.put("limit", 2.5D);
        Map<String, Object> unknownMetric = new HashMap<>();
        unknownMetric.put("metric", "average_price");

        Assertions.assertThrows(IllegalArgumentException.class, () -> InventoryQueryPlan.fromPayload(fractional));
        Assertions.assertThrows(IllegalArgumentException.class, () -> InventoryQueryPlan.fromPayload(unknownMetric));
        Assertions.assertThrows(IllegalArgumentException.class, () -> InventoryQueryPlan.fromPayload(new HashMap<>()));
    }

    @Test
    public void shouldValidateFilterOperatorsAndCoerceValues() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFilter.of(PlanFilterFieldEnum.QUANTITY, PlanFilterOperatorEnum.CONTAINS, 3));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFilter.of(PlanFilterFieldEnum.LOW_STOCK, PlanFilterOperatorEnum.GT, true));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFilter.of(PlanFilterFieldEnum.QUANTITY, PlanFilterOperatorEnum.LT, "a few"));

        Assertions.assertEquals(5.0D,
                PlanFilter.of(PlanFilterFieldEnum.QUANTITY, PlanFilterOperatorEnum.LT, "5").getValue());
        Assertions.assertEquals(Boolean.TRUE,
                PlanFilter.of(PlanFilterFieldEnum.LOW_STOCK, PlanFilterOperatorEnum.EQ, "yes").getValue());
    }
}
