package com.opspilot.domain.copilot.service;

import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryResult;

/**
 * 答案措辞服务接口：把执行结果转为自然语言，失败时回退确定性格式化。
 */
public interface InventoryAnswerPhraser {

    String phrase(String query, InventoryQueryPlan plan, InventoryQueryResult result, boolean allowModel);
}
