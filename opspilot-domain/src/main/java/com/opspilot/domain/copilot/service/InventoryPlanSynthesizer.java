package com.opspilot.domain.copilot.service;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;

/**
 * 计划合成服务接口。
 * <p>
 * 实现必须是全函数：模型不可用、输出不合法时降级到确定性规划，永不抛出。
 * 返回的计划总是经过 {@link PlanNormalizeDomainService} 归一。
 * </p>
 */
public interface InventoryPlanSynthesizer {

    /**
     * 合成查询计划。
     *
     * @param query 用户提问
     * @param allowModel 是否允许调用生成式模型
     * @return 合法计划
     */
    InventoryQueryPlan synthesize(String query, boolean allowModel);
}
