package com.opspilot.domain.copilot.adapter.gateway;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryResult;

/**
 * 查询计划执行端口：把已校验的计划转为明细行、分组或单值结果。
 * <p>
 * 由外部执行引擎实现。执行失败时直接抛出异常，由调用方记录后原样上抛。
 * </p>
 */
@FunctionalInterface
public interface IInventoryQueryExecutor {

    InventoryQueryResult execute(InventoryQueryPlan plan);
}
