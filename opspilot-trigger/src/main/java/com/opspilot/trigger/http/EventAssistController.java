package com.opspilot.trigger.http;

import com.opspilot.api.dto.EventAlternativeDTO;
import com.opspilot.api.dto.EventAlternativesRequestDTO;
import com.opspilot.api.dto.EventContentRequestDTO;
import com.opspilot.api.dto.EventDescriptionDTO;
import com.opspilot.api.dto.EventDraftDTO;
import com.opspilot.api.dto.EventDraftRequestDTO;
import com.opspilot.api.dto.InviteMessageDTO;
import com.opspilot.api.response.Response;
import com.opspilot.trigger.application.command.EventAssistCommandService;
import com.opspilot.trigger.application.common.AssistViewAssembler;
import com.opspilot.types.enums.ResponseCode;
import com.opspilot.types.exception.AppException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 日程辅助 API。
 */
@RestController
@RequestMapping("/api/events")
public class EventAssistController {

    private final EventAssistCommandService eventAssistCommandService;
    private final AssistViewAssembler assistViewAssembler;

    public EventAssistController(EventAssistCommandService eventAssistCommandService,
                                 AssistViewAssembler assistViewAssembler) {
        this.eventAssistCommandService = eventAssistCommandService;
        this.assistViewAssembler = assistViewAssembler;
    }

    @PostMapping("/nl-create")
    public Response<EventDraftDTO> createDraft(@RequestBody EventDraftRequestDTO request) {
        String prompt = request == null ? null : request.getPrompt();
        return success(assistViewAssembler.toEventDraftDTO(eventAssistCommandService.createDraft(prompt)));
    }

    @PostMapping("/suggest-alternatives")
    public Response<List<EventAlternativeDTO>> suggestAlternatives(@RequestBody EventAlternativesRequestDTO request) {
        requireBody(request);
        return success(assistViewAssembler.toEventAlternativeDTOs(eventAssistCommandService.suggestAlternatives(
                request.getStartAt(),
                request.getEndAt(),
                assistViewAssembler.toTimeWindows(request.getBusyWindows()))));
    }

    @PostMapping("/generate-description")
    public Response<EventDescriptionDTO> generateDescription(@RequestBody EventContentRequestDTO request) {
        requireBody(request);
        EventDescriptionDTO dto = new EventDescriptionDTO();
        dto.setDescription(eventAssistCommandService.generateDescription(
                request.getTitle(), request.getStartAt(), request.getEndAt(),
                request.getLocation(), request.getDescription()));
        return success(dto);
    }

    @PostMapping("/generate-invite")
    public Response<InviteMessageDTO> generateInvite(@RequestBody EventContentRequestDTO request) {
        requireBody(request);
        InviteMessageDTO dto = new InviteMessageDTO();
        dto.setMessage(eventAssistCommandService.generateInviteMessage(
                request.getTitle(), request.getStartAt(), request.getEndAt(),
                request.getLocation(), request.getDescription()));
        return success(dto);
    }

    private void requireBody(Object request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "请求体不能为空");
        }
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
