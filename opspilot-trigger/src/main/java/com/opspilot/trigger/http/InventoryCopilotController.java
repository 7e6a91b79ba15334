package com.opspilot.trigger.http;

import com.opspilot.api.dto.CopilotAnswerDTO;
import com.opspilot.api.dto.CopilotQueryRequestDTO;
import com.opspilot.api.response.Response;
import com.opspilot.domain.copilot.adapter.gateway.IInventoryQueryExecutor;
import com.opspilot.domain.copilot.model.valobj.CopilotAnswer;
import com.opspilot.trigger.application.command.InventoryCopilotCommandService;
import com.opspilot.trigger.application.common.AssistViewAssembler;
import com.opspilot.types.enums.ResponseCode;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inventory Copilot API。
 */
@RestController
@RequestMapping("/api/inventory")
public class InventoryCopilotController {

    private final InventoryCopilotCommandService inventoryCopilotCommandService;
    private final ObjectProvider<IInventoryQueryExecutor> inventoryQueryExecutorProvider;
    private final AssistViewAssembler assistViewAssembler;

    public InventoryCopilotController(InventoryCopilotCommandService inventoryCopilotCommandService,
                                      ObjectProvider<IInventoryQueryExecutor> inventoryQueryExecutorProvider,
                                      AssistViewAssembler assistViewAssembler) {
        this.inventoryCopilotCommandService = inventoryCopilotCommandService;
        this.inventoryQueryExecutorProvider = inventoryQueryExecutorProvider;
        this.assistViewAssembler = assistViewAssembler;
    }

    @PostMapping("/copilot")
    public Response<CopilotAnswerDTO> ask(@RequestBody CopilotQueryRequestDTO request) {
        String query = request == null ? null : request.getQuery();
        CopilotAnswer answer = inventoryCopilotCommandService.ask(query, inventoryQueryExecutorProvider.getIfAvailable());
        return Response.<CopilotAnswerDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(assistViewAssembler.toCopilotAnswerDTO(answer))
                .build();
    }
}
