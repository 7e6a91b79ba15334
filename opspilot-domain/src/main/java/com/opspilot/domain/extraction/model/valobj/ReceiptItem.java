package com.opspilot.domain.extraction.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 收据条目。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptItem {

    private String name;
    private Double quantity;
    private String unit;
    private String vendor;
    private String category;
    private Double price;
}
