package com.opspilot.domain.copilot.service;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.PlanFilter;
import com.opspilot.types.common.Constants;
import com.opspilot.types.enums.PlanFilterFieldEnum;
import com.opspilot.types.enums.PlanFilterOperatorEnum;
import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.SortDirectionEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 确定性规划领域服务：不依赖模型，按关键字规则级联生成合法计划。
 * <p>
 * 规则按声明顺序匹配，首个命中生效；未命中时为 rows / none / name / asc / 20。
 * 供应商短语（from|by|for vendor &lt;name&gt;）与命中的规则无关，总是追加 vendor contains 过滤。
 * </p>
 */
@Service
public class DeterministicPlannerDomainService {

    private static final Pattern VENDOR_PATTERN = Pattern.compile(
            "\\b(?:from|by|for)\\s+vendor\\s+([a-z0-9][a-z0-9 &._-]{1,80})\\b", Pattern.CASE_INSENSITIVE);
    private static final String AVAILABILITY_PREFIX = "do we have";

    private static final List<PlanRule> RULES = List.of(
            new PlanRule("lowest_stock_item",
                    q -> q.contains("lowest") && q.contains("stock") && !q.contains("category"),
                    (q, plan) -> plan.metric(PlanMetricEnum.ROWS)
                            .sortBy("quantity").sortDirection(SortDirectionEnum.ASC).limit(1)),
            new PlanRule("lowest_stock_category",
                    q -> q.contains("lowest") && q.contains("category") && q.contains("stock"),
                    (q, plan) -> plan.metric(PlanMetricEnum.LOW_STOCK_RATIO).groupBy(PlanGroupByEnum.CATEGORY)
                            .sortBy(InventoryQueryPlan.SORT_BY_METRIC).sortDirection(SortDirectionEnum.ASC).limit(5)),
            new PlanRule("low_stock_by_category",
                    q -> q.contains("low stock") && q.contains("category"),
                    (q, plan) -> plan.metric(PlanMetricEnum.COUNT_LOW_STOCK).groupBy(PlanGroupByEnum.CATEGORY)
                            .sortBy(InventoryQueryPlan.SORT_BY_METRIC).sortDirection(SortDirectionEnum.DESC).limit(10)),
            new PlanRule("count_by_vendor",
                    q -> q.contains("vendor") && asksCount(q),
                    (q, plan) -> plan.metric(PlanMetricEnum.COUNT_ITEMS).groupBy(PlanGroupByEnum.VENDOR)
                            .sortBy(InventoryQueryPlan.SORT_BY_METRIC).sortDirection(SortDirectionEnum.DESC).limit(10)),
            new PlanRule("count_by_category",
                    q -> q.contains("category") && asksCount(q),
                    (q, plan) -> plan.metric(PlanMetricEnum.COUNT_ITEMS).groupBy(PlanGroupByEnum.CATEGORY)
                            .sortBy(InventoryQueryPlan.SORT_BY_METRIC).sortDirection(SortDirectionEnum.DESC).limit(10)),
            new PlanRule("low_stock_items",
                    q -> q.contains("low stock"),
                    (q, plan) -> plan.metric(PlanMetricEnum.ROWS)
                            .filter(PlanFilter.of(PlanFilterFieldEnum.LOW_STOCK, PlanFilterOperatorEnum.EQ, Boolean.TRUE))
                            .sortBy("quantity").sortDirection(SortDirectionEnum.ASC).limit(25)),
            new PlanRule("availability",
                    q -> q.startsWith(AVAILABILITY_PREFIX) || q.contains("have"),
                    (q, plan) -> {
                        String term = extractAvailabilityTerm(q);
                        if (StringUtils.isNotEmpty(term)) {
                            plan.filter(PlanFilter.of(PlanFilterFieldEnum.NAME, PlanFilterOperatorEnum.CONTAINS, term));
                        }
                        plan.metric(PlanMetricEnum.ROWS).sortBy("name").sortDirection(SortDirectionEnum.ASC).limit(25);
                    }),
            new PlanRule("total_quantity",
                    q -> q.contains("quantity") && (q.contains("sum") || q.contains("total")),
                    (q, plan) -> plan.metric(PlanMetricEnum.SUM_QUANTITY)
                            .sortBy(InventoryQueryPlan.SORT_BY_METRIC).sortDirection(SortDirectionEnum.DESC).limit(1))
    );

    public InventoryQueryPlan plan(String query) {
        String lowered = StringUtils.defaultString(query).trim().toLowerCase(Locale.ROOT);
        PlanDraft draft = new PlanDraft();
        PlanRule matched = matchRule(lowered);
        if (matched != null) {
            matched.outcome().accept(lowered, draft);
        }

        Matcher vendor = VENDOR_PATTERN.matcher(lowered);
        if (vendor.find()) {
            String vendorName = vendor.group(1).trim();
            if (!vendorName.isEmpty()) {
                draft.filter(PlanFilter.of(PlanFilterFieldEnum.VENDOR, PlanFilterOperatorEnum.CONTAINS, vendorName));
            }
        }
        return draft.build();
    }

    /**
     * 返回首个命中规则的名称，未命中返回 null。
     */
    public String matchedRuleName(String query) {
        PlanRule rule = matchRule(StringUtils.defaultString(query).trim().toLowerCase(Locale.ROOT));
        return rule == null ? null : rule.name();
    }

    private PlanRule matchRule(String lowered) {
        for (PlanRule rule : RULES) {
            if (rule.predicate().test(lowered)) {
                return rule;
            }
        }
        return null;
    }

    private static boolean asksCount(String lowered) {
        return lowered.contains("count") || lowered.contains("how many");
    }

    private static String extractAvailabilityTerm(String lowered) {
        String term = lowered.replace(AVAILABILITY_PREFIX, "");
        return StringUtils.strip(term, " ?\"'");
    }

    /**
     * 规则：名称、谓词与命中后的计划调整。
     */
    private record PlanRule(String name, Predicate<String> predicate, BiConsumer<String, PlanDraft> outcome) {
    }

    /**
     * 规则执行过程中的可变草稿，最终构造为不可变计划。
     */
    private static final class PlanDraft {

        private PlanMetricEnum metric = PlanMetricEnum.ROWS;
        private PlanGroupByEnum groupBy = PlanGroupByEnum.NONE;
        private final List<PlanFilter> filters = new ArrayList<>();
        private String sortBy = "name";
        private SortDirectionEnum sortDirection = SortDirectionEnum.ASC;
        private int limit = 20;

        PlanDraft metric(PlanMetricEnum metric) {
            this.metric = metric;
            return this;
        }

        PlanDraft groupBy(PlanGroupByEnum groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        PlanDraft filter(PlanFilter filter) {
            this.filters.add(filter);
            return this;
        }

        PlanDraft sortBy(String sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        PlanDraft sortDirection(SortDirectionEnum sortDirection) {
            this.sortDirection = sortDirection;
            return this;
        }

        PlanDraft limit(int limit) {
            this.limit = limit;
            return this;
        }

        InventoryQueryPlan build() {
            return InventoryQueryPlan.builder()
                    .metric(metric)
                    .groupBy(groupBy)
                    .filters(filters)
                    .sortBy(sortBy)
                    .sortDirection(sortDirection)
                    .limit(Math.max(Constants.PLAN_MIN_LIMIT, Math.min(limit, Constants.PLAN_MAX_LIMIT)))
                    .build();
        }
    }
}
