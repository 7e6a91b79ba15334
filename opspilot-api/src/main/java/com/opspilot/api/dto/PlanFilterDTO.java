package com.opspilot.api.dto;

import lombok.Data;

/**
 * 计划过滤条件视图。
 */
@Data
public class PlanFilterDTO {

    private String field;
    private String op;
    private Object value;
}
