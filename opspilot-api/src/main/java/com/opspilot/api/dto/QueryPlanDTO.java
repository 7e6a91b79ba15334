package com.opspilot.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 库存分析计划视图。
 */
@Data
public class QueryPlanDTO {

    private String metric;
    private String groupBy;
    private List<PlanFilterDTO> filters;
    private String sortBy;
    private String sortDirection;
    private Integer limit;
}
