package com.opspilot.types.common;

/**
 * 全局常量定义类。
 *
 * @author opspilot
 * @since 2026-03-02
 */
public class Constants {

    /** Copilot 调用执行器时登记的工具名 */
    public final static String TOOL_QUERY_INVENTORY = "query_inventory";

    /** 计划允许的最小条数 */
    public final static int PLAN_MIN_LIMIT = 1;

    /** 计划允许的最大条数 */
    public final static int PLAN_MAX_LIMIT = 100;

    /** AI 调用记录中的提示词版本 */
    public final static String PROMPT_VERSION = "v1";

    /** 抽取结果的默认单位 */
    public final static String DEFAULT_UNIT = "units";

}
