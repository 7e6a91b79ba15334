package com.opspilot.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 收据抽取结果。
 */
@Data
public class ReceiptExtractionDTO {

    private String vendor;
    private String date;
    private List<ReceiptItemDTO> items;
}
