package com.opspilot.test.domain;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryResult;
import com.opspilot.domain.copilot.service.InventoryResultFormatDomainService;
import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.QueryResultKindEnum;
import com.opspilot.types.enums.SortDirectionEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class InventoryResultFormatDomainServiceTest {

    private final InventoryResultFormatDomainService service = new InventoryResultFormatDomainService();

    @Test
    public void shouldFormatScalarRatioAsPercent() {
        InventoryQueryResult result = InventoryQueryResult.builder()
                .kind(QueryResultKindEnum.SCALAR)
                .metric(PlanMetricEnum.LOW_STOCK_RATIO)
                .metricValue(0.25D)
                .build();

        Assertions.assertEquals("Overall low-stock ratio is 25.0%.", service.format("ratio?", null, result));
    }

    @Test
    public void shouldFormatOtherScalarsVerbatim() {
        InventoryQueryResult result = InventoryQueryResult.builder()
                .kind(QueryResultKindEnum.SCALAR)
                .metric(PlanMetricEnum.SUM_QUANTITY)
                .metricValue(42)
                .build();

        Assertions.assertEquals("Result: 42", service.format("total quantity", null, result));
    }

    @Test
    public void shouldReturnFixedMessageWhenNoCategoryIsLowStock() {
        InventoryQueryResult result = groupedResult(PlanMetricEnum.LOW_STOCK_RATIO, PlanGroupByEnum.CATEGORY,
                List.of(groupRow("category", "office", 0.0D), groupRow("category", "groceries", 0.0D)));

        Assertions.assertEquals(InventoryResultFormatDomainService.NO_LOW_STOCK_CATEGORIES,
                service.zeroLowStockMessage(result));
    }

    @Test
    public void shouldSkipZeroLowStockMessageForOtherShapes() {
        InventoryQueryResult ratioByVendor = groupedResult(PlanMetricEnum.LOW_STOCK_RATIO, PlanGroupByEnum.VENDOR,
                List.of(groupRow("vendor", "acme", 0.0D)));
        InventoryQueryResult pressured = groupedResult(PlanMetricEnum.LOW_STOCK_RATIO, PlanGroupByEnum.CATEGORY,
                List.of(groupRow("category", "office", 0.4D)));

        Assertions.assertNull(service.zeroLowStockMessage(ratioByVendor));
        Assertions.assertNull(service.zeroLowStockMessage(pressured));
        Assertions.assertNull(service.zeroLowStockMessage(null));
    }

    @Test
    public void shouldDescribeLowestPressureCategory() {
        InventoryQueryResult result = groupedResult(PlanMetricEnum.LOW_STOCK_RATIO, PlanGroupByEnum.CATEGORY,
                List.of(groupRow("category", "electronics", 0.1D)));

        Assertions.assertEquals(
                "Category with lowest low-stock pressure: electronics (10.0% low-stock ratio).",
                service.format("which category has the lowest stock", null, result));
    }

    @Test
    public void shouldPreviewGroupedRows() {
        InventoryQueryResult result = groupedResult(PlanMetricEnum.COUNT_ITEMS, PlanGroupByEnum.VENDOR,
                List.of(groupRow("vendor", "Acme", 3), groupRow("vendor", "Globex", 2)));

        Assertions.assertEquals("vendor count_items: Acme=3, Globex=2",
                service.format("count items per vendor", null, result));
        Assertions.assertEquals("No matching grouped data found.",
                service.format("count items per vendor", null,
                        groupedResult(PlanMetricEnum.COUNT_ITEMS, PlanGroupByEnum.VENDOR, List.of())));
    }

    @Test
    public void shouldDescribeLowestStockItem() {
        InventoryQueryPlan plan = InventoryQueryPlan.builder()
                .metric(PlanMetricEnum.ROWS)
                .sortBy("quantity")
                .sortDirection(SortDirectionEnum.ASC)
                .limit(1)
                .build();
        Map<String, Object> row = itemRow("Packing Tape", 2);
        row.put("vendor", null);

        Assertions.assertEquals("Item with the lowest stock is Packing Tape (2 rolls, supplies, vendor: unknown).",
                service.format("what item has the lowest stock", plan, rowsResult(List.of(row))));
    }

    @Test
    public void shouldSummarizeRowsBeyondPreview() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            rows.add(itemRow("Item " + i, i));
        }
        InventoryQueryPlan plan = InventoryQueryPlan.builder().sortBy("name").build();

        String answer = service.format("list items", plan, rowsResult(rows));

        Assertions.assertTrue(answer.startsWith("Item 1 (1 rolls, supplies, vendor: Acme); Item 2"));
        Assertions.assertTrue(answer.endsWith("; and 2 more"));
        Assertions.assertEquals("No matching inventory items found.",
                service.format("list items", plan, rowsResult(List.of())));
    }

    @Test
    public void shouldDetectJsonLikeModelOutput() {
        Assertions.assertTrue(service.looksLikeJsonText("{\"answer\": 1}"));
        Assertions.assertTrue(service.looksLikeJsonText("```json\n[]\n```"));
        Assertions.assertTrue(service.looksLikeJsonText("Here: \"kind\": \"rows\", \"rows\": [], \"metric\": \"rows\""));
        Assertions.assertFalse(service.looksLikeJsonText("You have 3 low stock items."));
        Assertions.assertFalse(service.looksLikeJsonText("  "));
    }

    private InventoryQueryResult groupedResult(PlanMetricEnum metric, PlanGroupByEnum groupBy,
                                               List<Map<String, Object>> rows) {
        return InventoryQueryResult.builder()
                .kind(QueryResultKindEnum.GROUPED)
                .metric(metric)
                .groupBy(groupBy)
                .rows(rows)
                .build();
    }

    private InventoryQueryResult rowsResult(List<Map<String, Object>> rows) {
        return InventoryQueryResult.builder()
                .kind(QueryResultKindEnum.ROWS)
                .metric(PlanMetricEnum.ROWS)
                .groupBy(PlanGroupByEnum.NONE)
                .rows(rows)
                .build();
    }

    private Map<String, Object> groupRow(String key, String group, Number metric) {
        Map<String, Object> row = new HashMap<>();
        row.put(key, group);
        row.put("metric", metric);
        return row;
    }

    private Map<String, Object> itemRow(String name, int quantity) {
        Map<String, Object> row = new HashMap<>();
        row.put("name", name);
        row.put("quantity", quantity);
        row.put("unit", "rolls");
        row.put("category", "supplies");
        row.put("vendor", "Acme");
        return row;
    }
}
