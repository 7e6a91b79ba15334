package com.opspilot.domain.copilot.model.valobj;

import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.QueryResultKindEnum;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行层返回的计划结果。
 * <p>
 * rows / grouped 结果使用 {@code rows}；scalar 结果使用 {@code metricValue}。
 * 分组行以分组维度的 code 作为分组值的键（如 {@code category}），并带有 {@code metric}。
 * </p>
 */
@Data
@Builder
public class InventoryQueryResult {

    private QueryResultKindEnum kind;
    private PlanMetricEnum metric;
    private PlanGroupByEnum groupBy;
    private List<Map<String, Object>> rows;
    private Number metricValue;

    public List<Map<String, Object>> safeRows() {
        return rows == null ? Collections.emptyList() : rows;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", kind == null ? null : kind.getCode());
        payload.put("metric", metric == null ? null : metric.getCode());
        payload.put("group_by", groupBy == null ? null : groupBy.getCode());
        if (kind == QueryResultKindEnum.SCALAR) {
            payload.put("metric_value", metricValue);
        } else {
            payload.put("rows", new ArrayList<>(safeRows()));
        }
        return payload;
    }
}
