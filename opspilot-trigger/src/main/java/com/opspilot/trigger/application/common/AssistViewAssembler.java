package com.opspilot.trigger.application.common;

import com.opspilot.api.dto.CopilotAnswerDTO;
import com.opspilot.api.dto.EventAlternativeDTO;
import com.opspilot.api.dto.EventDraftDTO;
import com.opspilot.api.dto.GuardrailDTO;
import com.opspilot.api.dto.PlanFilterDTO;
import com.opspilot.api.dto.QueryPlanDTO;
import com.opspilot.api.dto.ReceiptExtractionDTO;
import com.opspilot.api.dto.ReceiptItemDTO;
import com.opspilot.api.dto.TimeWindowDTO;
import com.opspilot.domain.copilot.model.valobj.CopilotAnswer;
import com.opspilot.domain.copilot.model.valobj.GuardrailAssessment;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.PlanFilter;
import com.opspilot.domain.extraction.model.valobj.EventAlternative;
import com.opspilot.domain.extraction.model.valobj.EventDraft;
import com.opspilot.domain.extraction.model.valobj.ReceiptExtraction;
import com.opspilot.domain.extraction.model.valobj.ReceiptItem;
import com.opspilot.domain.extraction.model.valobj.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Copilot 与抽取结果的视图组装器。
 */
@Component
public class AssistViewAssembler {

    public CopilotAnswerDTO toCopilotAnswerDTO(CopilotAnswer answer) {
        if (answer == null) {
            return null;
        }
        CopilotAnswerDTO dto = new CopilotAnswerDTO();
        dto.setAnswer(answer.getAnswer());
        dto.setToolsUsed(answer.getToolsUsed() == null ? Collections.emptyList() : answer.getToolsUsed());
        dto.setPlan(toQueryPlanDTO(answer.getPlan()));
        dto.setResult(answer.getResult() == null ? null : answer.getResult().toPayload());
        dto.setGuardrail(toGuardrailDTO(answer.getGuardrail()));
        return dto;
    }

    public QueryPlanDTO toQueryPlanDTO(InventoryQueryPlan plan) {
        if (plan == null) {
            return null;
        }
        QueryPlanDTO dto = new QueryPlanDTO();
        dto.setMetric(plan.getMetric().getCode());
        dto.setGroupBy(plan.getGroupBy().getCode());
        List<PlanFilterDTO> filters = new ArrayList<>();
        for (PlanFilter filter : plan.getFilters()) {
            PlanFilterDTO filterDTO = new PlanFilterDTO();
            filterDTO.setField(filter.getField().getCode());
            filterDTO.setOp(filter.getOp().getCode());
            filterDTO.setValue(filter.getValue());
            filters.add(filterDTO);
        }
        dto.setFilters(filters);
        dto.setSortBy(plan.getSortBy());
        dto.setSortDirection(plan.getSortDirection().getCode());
        dto.setLimit(plan.getLimit());
        return dto;
    }

    public GuardrailDTO toGuardrailDTO(GuardrailAssessment guardrail) {
        if (guardrail == null) {
            return null;
        }
        GuardrailDTO dto = new GuardrailDTO();
        dto.setReason(guardrail.getReason().getCode());
        dto.setMode(guardrail.getMode().getCode());
        dto.setRiskScore(guardrail.getRiskScore());
        dto.setSignals(guardrail.getSignalCodes());
        return dto;
    }

    public ReceiptExtractionDTO toReceiptExtractionDTO(ReceiptExtraction extraction) {
        if (extraction == null) {
            return null;
        }
        ReceiptExtractionDTO dto = new ReceiptExtractionDTO();
        dto.setVendor(extraction.getVendor());
        dto.setDate(extraction.getDate());
        List<ReceiptItemDTO> items = new ArrayList<>();
        if (extraction.getItems() != null) {
            for (ReceiptItem item : extraction.getItems()) {
                ReceiptItemDTO itemDTO = new ReceiptItemDTO();
                itemDTO.setName(item.getName());
                itemDTO.setQuantity(item.getQuantity());
                itemDTO.setUnit(item.getUnit());
                itemDTO.setVendor(item.getVendor());
                itemDTO.setCategory(item.getCategory());
                itemDTO.setPrice(item.getPrice());
                items.add(itemDTO);
            }
        }
        dto.setItems(items);
        return dto;
    }

    public EventDraftDTO toEventDraftDTO(EventDraft draft) {
        if (draft == null) {
            return null;
        }
        EventDraftDTO dto = new EventDraftDTO();
        dto.setTitle(draft.getTitle());
        dto.setStartAt(draft.getStartAt());
        dto.setEndAt(draft.getEndAt());
        dto.setLocation(draft.getLocation());
        dto.setDescription(draft.getDescription());
        dto.setInvitees(draft.getInvitees());
        return dto;
    }

    public List<EventAlternativeDTO> toEventAlternativeDTOs(List<EventAlternative> alternatives) {
        List<EventAlternativeDTO> result = new ArrayList<>();
        if (alternatives == null) {
            return result;
        }
        for (EventAlternative alternative : alternatives) {
            EventAlternativeDTO dto = new EventAlternativeDTO();
            dto.setStartAt(alternative.startAt());
            dto.setEndAt(alternative.endAt());
            dto.setReason(alternative.reason());
            result.add(dto);
        }
        return result;
    }

    public List<TimeWindow> toTimeWindows(List<TimeWindowDTO> windows) {
        List<TimeWindow> result = new ArrayList<>();
        if (windows == null) {
            return result;
        }
        for (TimeWindowDTO window : windows) {
            if (window == null || window.getStartAt() == null || window.getEndAt() == null) {
                continue;
            }
            result.add(new TimeWindow(window.getStartAt(), window.getEndAt()));
        }
        return result;
    }
}
