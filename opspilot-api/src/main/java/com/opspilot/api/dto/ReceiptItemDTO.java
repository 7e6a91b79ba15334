package com.opspilot.api.dto;

import lombok.Data;

/**
 * 收据条目。
 */
@Data
public class ReceiptItemDTO {

    private String name;
    private Double quantity;
    private String unit;
    private String vendor;
    private String category;
    private Double price;
}
