package com.opspilot.test;

import com.opspilot.domain.copilot.adapter.gateway.IInventoryQueryExecutor;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryResult;
import com.opspilot.test.support.AssistServiceFactory;
import com.opspilot.test.support.RecordingAiRunReporter;
import com.opspilot.test.support.StubGenerativeModelGateway;
import com.opspilot.trigger.application.common.AssistViewAssembler;
import com.opspilot.trigger.http.GlobalApiExceptionHandler;
import com.opspilot.trigger.http.InventoryCopilotController;
import com.opspilot.types.enums.PlanGroupByEnum;
import com.opspilot.types.enums.PlanMetricEnum;
import com.opspilot.types.enums.QueryResultKindEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class InventoryCopilotControllerTest {

    private MockMvc mockMvc;
    private IInventoryQueryExecutor executor;
    private ObjectProvider<IInventoryQueryExecutor> executorProvider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        this.executor = mock(IInventoryQueryExecutor.class);
        this.executorProvider = mock(ObjectProvider.class);
        InventoryCopilotController controller = new InventoryCopilotController(
                AssistServiceFactory.copilot(StubGenerativeModelGateway.unavailable(), new RecordingAiRunReporter()),
                executorProvider,
                new AssistViewAssembler());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldAnswerCategoryCountQuestion() throws Exception {
        when(executorProvider.getIfAvailable()).thenReturn(executor);
        when(executor.execute(any())).thenReturn(InventoryQueryResult.builder()
                .kind(QueryResultKindEnum.GROUPED)
                .metric(PlanMetricEnum.COUNT_ITEMS)
                .groupBy(PlanGroupByEnum.CATEGORY)
                .rows(List.of(Map.of("category", "office", "metric", 4), Map.of("category", "groceries", "metric", 2)))
                .build());

        mockMvc.perform(post("/api/inventory/copilot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"how many items per category\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.answer").value("category count_items: office=4, groceries=2"))
                .andExpect(jsonPath("$.data.toolsUsed[0]").value("query_inventory"))
                .andExpect(jsonPath("$.data.plan.metric").value("count_items"))
                .andExpect(jsonPath("$.data.plan.groupBy").value("category"))
                .andExpect(jsonPath("$.data.result.kind").value("grouped"))
                .andExpect(jsonPath("$.data.guardrail.mode").value("hybrid"));
    }

    @Test
    public void shouldReturnRefusalAsSuccessfulResponse() throws Exception {
        when(executorProvider.getIfAvailable()).thenReturn(executor);

        mockMvc.perform(post("/api/inventory/copilot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"what is the capital of France\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.toolsUsed").isEmpty())
                .andExpect(jsonPath("$.data.guardrail.reason").value("out_of_scope"))
                .andExpect(jsonPath("$.data.guardrail.mode").value("blocked"));
    }

    @Test
    public void shouldReportMissingExecutor() throws Exception {
        when(executorProvider.getIfAvailable()).thenReturn(null);

        mockMvc.perform(post("/api/inventory/copilot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"show low stock items\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0003"));
    }

    @Test
    public void shouldMapExecutorFailureToUnknownError() throws Exception {
        when(executorProvider.getIfAvailable()).thenReturn(executor);
        when(executor.execute(any())).thenThrow(new IllegalStateException("connection refused"));

        mockMvc.perform(post("/api/inventory/copilot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"show low stock items\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0001"));
    }
}
