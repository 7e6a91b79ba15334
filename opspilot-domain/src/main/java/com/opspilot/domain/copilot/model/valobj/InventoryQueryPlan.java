package com.opspilot.domain.copilot.model.valobj;

import com.opspilot.types.common.Constants;
import com.opspilot.types.enums.PlanFilterFieldEnum;
import com.opspilot.types.enums.PlanFilterOperatorEnum;
import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.SortDirectionEnum;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 库存分析查询计划值对象。
 * <p>
 * NL 层与执行层之间唯一的契约。构造即校验，违反任何约束都会抛出
 * {@link IllegalArgumentException}，不存在部分生效的计划：
 * <ol>
 *   <li>limit 位于 [1, 100]</li>
 *   <li>metric = rows 时 group_by 必须为 none，sort_by 只能是明细字段</li>
 *   <li>metric != rows 且 group_by = none 时为单值指标，sort_by 必须为 metric</li>
 *   <li>group_by != none 时 sort_by 只能是 metric 或 group</li>
 * </ol>
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class InventoryQueryPlan {

    public static final String SORT_BY_METRIC = "metric";
    public static final String SORT_BY_GROUP = "group";
    public static final Set<String> ROW_SORT_FIELDS = Set.of("name", "quantity", "vendor", "category", "status", "unit");

    private final PlanMetricEnum metric;
    private final PlanGroupByEnum groupBy;
    private final List<PlanFilter> filters;
    private final String sortBy;
    private final SortDirectionEnum sortDirection;
    private final int limit;

    @Builder(toBuilder = true)
    private InventoryQueryPlan(PlanMetricEnum metric,
                               PlanGroupByEnum groupBy,
                               List<PlanFilter> filters,
                               String sortBy,
                               SortDirectionEnum sortDirection,
                               Integer limit) {
        this.metric = metric == null ? PlanMetricEnum.ROWS : metric;
        this.groupBy = groupBy == null ? PlanGroupByEnum.NONE : groupBy;
        this.filters = filters == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(filters));
        this.sortBy = sortBy == null ? SORT_BY_METRIC : sortBy.trim();
        this.sortDirection = sortDirection == null ? SortDirectionEnum.DESC : sortDirection;
        this.limit = limit == null ? 20 : limit;
        validate();
    }

    private void validate() {
        if (limit < Constants.PLAN_MIN_LIMIT || limit > Constants.PLAN_MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }
        if (metric == PlanMetricEnum.ROWS) {
            if (groupBy != PlanGroupByEnum.NONE) {
                throw new IllegalArgumentException("rows metric requires group_by='none'");
            }
            if (!ROW_SORT_FIELDS.contains(sortBy)) {
                throw new IllegalArgumentException(
                        "rows metric supports sort_by in name, quantity, vendor, category, status, unit");
            }
            return;
        }
        if (groupBy == PlanGroupByEnum.NONE) {
            if (!metric.isAggregate()) {
                throw new IllegalArgumentException("invalid scalar metric for group_by='none'");
            }
            if (!SORT_BY_METRIC.equals(sortBy)) {
                throw new IllegalArgumentException("scalar metrics require sort_by='metric'");
            }
            return;
        }
        if (!SORT_BY_METRIC.equals(sortBy) && !SORT_BY_GROUP.equals(sortBy)) {
            throw new IllegalArgumentException("grouped metrics require sort_by='metric' or 'group'");
        }
    }

    public boolean isScalar() {
        return metric.isAggregate() && groupBy == PlanGroupByEnum.NONE;
    }

    /**
     * 是否为“库存最低的单个条目”形态：rows / none / quantity / asc / 1。
     */
    public boolean isLowestStockItemShape() {
        return metric == PlanMetricEnum.ROWS
                && groupBy == PlanGroupByEnum.NONE
                && "quantity".equals(sortBy)
                && sortDirection == SortDirectionEnum.ASC
                && limit == 1;
    }

    /**
     * 从模型返回的 JSON 结构构造计划；键名兼容 snake_case 与 camelCase。
     *
     * @throws IllegalArgumentException 结构或取值不合法
     */
    public static InventoryQueryPlan fromPayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("plan payload is empty");
        }
        InventoryQueryPlanBuilder builder = InventoryQueryPlan.builder()
                .metric(PlanMetricEnum.fromText(getString(payload, "metric")))
                .groupBy(PlanGroupByEnum.fromText(getString(payload, "group_by", "groupBy")))
                .filters(parseFilters(payload.get("filters")))
                .sortBy(getString(payload, "sort_by", "sortBy"))
                .sortDirection(SortDirectionEnum.fromText(getString(payload, "sort_direction", "sortDirection")));
        Object limit = payload.get("limit");
        if (limit != null) {
            builder.limit(parseLimit(limit));
        }
        return builder.build();
    }

    /**
     * 转为与执行层、模型提示词共享的结构。
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("metric", metric.getCode());
        payload.put("group_by", groupBy.getCode());
        List<Map<String, Object>> filterPayload = new ArrayList<>();
        for (PlanFilter filter : filters) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("field", filter.getField().getCode());
            item.put("op", filter.getOp().getCode());
            item.put("value", filter.getValue());
            filterPayload.add(item);
        }
        payload.put("filters", filterPayload);
        payload.put("sort_by", sortBy);
        payload.put("sort_direction", sortDirection.getCode());
        payload.put("limit", limit);
        return payload;
    }

    private static List<PlanFilter> parseFilters(Object raw) {
        if (raw == null) {
            return Collections.emptyList();
        }
        if (!(raw instanceof List<?>)) {
            throw new IllegalArgumentException("filters must be a list");
        }
        List<PlanFilter> result = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            if (!(item instanceof Map<?, ?>)) {
                throw new IllegalArgumentException("filter must be an object");
            }
            Map<?, ?> filter = (Map<?, ?>) item;
            Object op = filter.get("op") != null ? filter.get("op") : filter.get("operator");
            result.add(PlanFilter.of(
                    PlanFilterFieldEnum.fromText(filter.get("field") == null ? null : String.valueOf(filter.get("field"))),
                    PlanFilterOperatorEnum.fromText(op == null ? null : String.valueOf(op)),
                    filter.get("value")));
        }
        return result;
    }

    private static int parseLimit(Object limit) {
        if (limit instanceof Number) {
            Number number = (Number) limit;
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw new IllegalArgumentException("limit must be an integer");
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(limit).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("limit must be an integer");
        }
    }

    private static String getString(Map<String, Object> source, String... keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return null;
    }
}
