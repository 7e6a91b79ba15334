package com.opspilot.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 *
 * @author opspilot
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 库存查询计划执行失败 */
    PLAN_EXECUTION_FAILED("0003", "查询计划执行失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
