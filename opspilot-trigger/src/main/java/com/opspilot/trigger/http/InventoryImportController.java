package com.opspilot.trigger.http;

import com.opspilot.api.dto.ReceiptExtractionDTO;
import com.opspilot.api.dto.ReceiptParseRequestDTO;
import com.opspilot.api.response.Response;
import com.opspilot.trigger.application.command.ReceiptImportCommandService;
import com.opspilot.trigger.application.common.AssistViewAssembler;
import com.opspilot.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 收据导入解析 API，只返回抽取结果，不落库。
 */
@RestController
@RequestMapping("/api/inventory/import")
public class InventoryImportController {

    private final ReceiptImportCommandService receiptImportCommandService;
    private final AssistViewAssembler assistViewAssembler;

    public InventoryImportController(ReceiptImportCommandService receiptImportCommandService,
                                     AssistViewAssembler assistViewAssembler) {
        this.receiptImportCommandService = receiptImportCommandService;
        this.assistViewAssembler = assistViewAssembler;
    }

    @PostMapping("/parse")
    public Response<ReceiptExtractionDTO> parse(@RequestBody ReceiptParseRequestDTO request) {
        String text = request == null ? null : request.getText();
        return Response.<ReceiptExtractionDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(assistViewAssembler.toReceiptExtractionDTO(receiptImportCommandService.parse(text)))
                .build();
    }
}
