package com.opspilot.domain.copilot.service;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.SortDirectionEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * 计划归一领域服务：按原始提问纠正“最低库存”歧义。
 * <p>
 * 对任何来源的计划都执行，且幂等。
 * </p>
 */
@Slf4j
@Service
public class PlanNormalizeDomainService {

    private static final String[] ITEM_CUES = {"item", "items", "product", "sku", "which", "what"};
    private static final String[] ITEM_SINGLE_CUES = {"what", "which", "lowest"};
    private static final String[] CATEGORY_SINGLE_CUES = {"what", "which", "the category"};
    private static final int MULTI_ANSWER_LIMIT = 5;

    public InventoryQueryPlan normalize(String query, InventoryQueryPlan plan) {
        if (plan == null) {
            return null;
        }
        String lowered = StringUtils.defaultString(query).toLowerCase(Locale.ROOT);
        boolean asksLowestStock = lowered.contains("lowest") && lowered.contains("stock");
        boolean asksCategory = asksLowestStock && lowered.contains("category");
        boolean asksItem = asksLowestStock && containsAny(lowered, ITEM_CUES);

        InventoryQueryPlan normalized = plan;
        if (asksItem && !asksCategory) {
            normalized = plan.toBuilder()
                    .metric(PlanMetricEnum.ROWS)
                    .groupBy(PlanGroupByEnum.NONE)
                    .sortBy("quantity")
                    .sortDirection(SortDirectionEnum.ASC)
                    .limit(containsAny(lowered, ITEM_SINGLE_CUES) ? 1 : Math.min(plan.getLimit(), MULTI_ANSWER_LIMIT))
                    .build();
        } else if (asksCategory) {
            normalized = plan.toBuilder()
                    .metric(PlanMetricEnum.LOW_STOCK_RATIO)
                    .groupBy(PlanGroupByEnum.CATEGORY)
                    .sortBy(InventoryQueryPlan.SORT_BY_METRIC)
                    .sortDirection(SortDirectionEnum.ASC)
                    .limit(containsAny(lowered, CATEGORY_SINGLE_CUES) ? 1 : Math.min(plan.getLimit(), MULTI_ANSWER_LIMIT))
                    .build();
        }
        if (!normalized.equals(plan)) {
            log.debug("COPILOT_PLAN_NORMALIZED before={}, after={}", plan.toPayload(), normalized.toPayload());
        }
        return normalized;
    }

    private boolean containsAny(String text, String[] cues) {
        for (String cue : cues) {
            if (text.contains(cue)) {
                return true;
            }
        }
        return false;
    }
}
