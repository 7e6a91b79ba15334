package com.opspilot.domain.copilot.service;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryResult;
import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.QueryResultKindEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 结果格式化领域服务：把执行结果渲染为确定性的自然语言答案。
 */
@Service
public class InventoryResultFormatDomainService {

    public static final String NO_LOW_STOCK_CATEGORIES =
            "No categories are currently low stock (all low-stock ratios are 0%).";

    private static final int PREVIEW_SIZE = 5;

    /**
     * 分组 low_stock_ratio（按 category）且首行指标 &lt;= 0 时返回固定提示，否则返回 null。
     */
    public String zeroLowStockMessage(InventoryQueryResult result) {
        if (result == null
                || result.getKind() != QueryResultKindEnum.GROUPED
                || result.getMetric() != PlanMetricEnum.LOW_STOCK_RATIO
                || result.getGroupBy() != PlanGroupByEnum.CATEGORY
                || result.safeRows().isEmpty()) {
            return null;
        }
        Double topMetric = toDouble(result.safeRows().get(0).get("metric"));
        if (topMetric != null && topMetric <= 0) {
            return NO_LOW_STOCK_CATEGORIES;
        }
        return null;
    }

    /**
     * 判断模型输出是否为重新序列化的结构化数据。
     */
    public boolean looksLikeJsonText(String text) {
        String stripped = StringUtils.trimToEmpty(text);
        if (stripped.isEmpty()) {
            return false;
        }
        if (stripped.startsWith("```")) {
            return true;
        }
        if ((stripped.startsWith("{") && stripped.endsWith("}"))
                || (stripped.startsWith("[") && stripped.endsWith("]"))) {
            return true;
        }
        String lowered = stripped.toLowerCase(Locale.ROOT);
        return lowered.contains("\"kind\"") && lowered.contains("\"rows\"") && lowered.contains("\"metric\"");
    }

    public String format(String query, InventoryQueryPlan plan, InventoryQueryResult result) {
        QueryResultKindEnum kind = result == null ? null : result.getKind();
        if (kind == QueryResultKindEnum.SCALAR) {
            return formatScalar(result);
        }
        if (kind == QueryResultKindEnum.GROUPED) {
            return formatGrouped(query, result);
        }
        return formatRows(plan, result == null ? List.of() : result.safeRows());
    }

    private String formatScalar(InventoryQueryResult result) {
        Number value = result.getMetricValue();
        if (result.getMetric() == PlanMetricEnum.LOW_STOCK_RATIO && value != null) {
            return "Overall low-stock ratio is " + percent(value.doubleValue()) + "%.";
        }
        return "Result: " + text(value);
    }

    private String formatGrouped(String query, InventoryQueryResult result) {
        List<Map<String, Object>> rows = result.safeRows();
        if (rows.isEmpty()) {
            return "No matching grouped data found.";
        }
        String groupKey = result.getGroupBy() == null ? null : result.getGroupBy().getCode();
        Map<String, Object> top = rows.get(0);
        String lowered = StringUtils.defaultString(query).toLowerCase(Locale.ROOT);
        if (lowered.contains("lowest") && lowered.contains("stock")
                && result.getGroupBy() == PlanGroupByEnum.CATEGORY) {
            Double topMetric = toDouble(top.get("metric"));
            if (result.getMetric() == PlanMetricEnum.LOW_STOCK_RATIO && topMetric != null) {
                return "Category with lowest low-stock pressure: " + text(groupValue(top, groupKey))
                        + " (" + percent(topMetric) + "% low-stock ratio).";
            }
            if (result.getMetric() == PlanMetricEnum.COUNT_LOW_STOCK) {
                return "Category with most low-stock items: " + text(groupValue(top, groupKey))
                        + " (" + text(top.get("metric")) + ").";
            }
        }
        List<String> preview = new ArrayList<>();
        for (Map<String, Object> row : rows.subList(0, Math.min(PREVIEW_SIZE, rows.size()))) {
            preview.add(text(groupValue(row, groupKey)) + "=" + text(row.get("metric")));
        }
        String metricCode = result.getMetric() == null ? "None" : result.getMetric().getCode();
        return text(groupKey) + " " + metricCode + ": " + String.join(", ", preview);
    }

    private String formatRows(InventoryQueryPlan plan, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return "No matching inventory items found.";
        }
        if (plan != null && plan.isLowestStockItemShape()) {
            return "Item with the lowest stock is " + text(rows.get(0).get("name"))
                    + " (" + describeItem(rows.get(0)) + ").";
        }
        List<String> preview = new ArrayList<>();
        for (Map<String, Object> row : rows.subList(0, Math.min(PREVIEW_SIZE, rows.size()))) {
            preview.add(text(row.get("name")) + " (" + describeItem(row) + ")");
        }
        String joined = String.join("; ", preview);
        if (rows.size() > PREVIEW_SIZE) {
            joined += "; and " + (rows.size() - PREVIEW_SIZE) + " more";
        }
        return joined;
    }

    private String describeItem(Map<String, Object> row) {
        Object vendor = row.get("vendor");
        String vendorText = vendor == null || StringUtils.isEmpty(String.valueOf(vendor)) ? "unknown" : String.valueOf(vendor);
        return text(row.get("quantity")) + " " + text(row.get("unit")) + ", " + text(row.get("category"))
                + ", vendor: " + vendorText;
    }

    private Object groupValue(Map<String, Object> row, String groupKey) {
        if (groupKey != null && row.containsKey(groupKey)) {
            return row.get(groupKey);
        }
        return row.get("group");
    }

    private String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f", ratio * 100);
    }

    private String text(Object value) {
        return value == null ? "None" : String.valueOf(value);
    }

    private Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
