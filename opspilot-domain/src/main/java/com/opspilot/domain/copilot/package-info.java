/**
 * Copilot 领域 - 自然语言到库存分析计划
 *
 * <p>职责：对不可信的自由文本提问做风险评估、生成受约束的分析计划、纠正已知的规划偏差，
 * 并在同样的信任约束下把结构化结果还原为自然语言回答。</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>护栏：判断提问是否在库存范围内，以及允许模型参与的程度</li>
 *   <li>计划：metric / group_by / filters / sort / limit 组成的受约束查询描述</li>
 *   <li>确定性模式：只使用固定规则，不调用生成式模型</li>
 *   <li>混合模式：允许调用模型，但输出必须校验，失败即降级</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>GuardrailDomainService - 护栏判定</li>
 *   <li>DeterministicPlannerDomainService - 规则规划</li>
 *   <li>PlanNormalizeDomainService - 计划纠偏</li>
 *   <li>InventoryResultFormatDomainService - 确定性回答格式化</li>
 * </ul>
 *
 * @author opspilot
 * @since 2026-03-02
 */
package com.opspilot.domain.copilot;
