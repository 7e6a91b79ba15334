package com.opspilot.domain.extraction.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 收据抽取结果。vendor、date 可为空，items 有序且不为 null。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptExtraction {

    private String vendor;
    private String date;
    @Builder.Default
    private List<ReceiptItem> items = new ArrayList<>();
}
