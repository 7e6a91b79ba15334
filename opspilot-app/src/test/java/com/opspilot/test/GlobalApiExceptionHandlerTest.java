package com.opspilot.test;

import com.opspilot.api.response.Response;
import com.opspilot.trigger.http.GlobalApiExceptionHandler;
import com.opspilot.types.enums.ResponseCode;
import com.opspilot.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldKeepAppExceptionCode() throws Exception {
        mockMvc.perform(get("/api/test/execution-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.PLAN_EXECUTION_FAILED.getCode()))
                .andExpect(jsonPath("$.info").value("未配置库存查询执行器"));
    }

    @Test
    public void shouldMapIllegalArgumentToIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/illegal-argument"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("limit must be between 1 and 100"));
    }

    @Test
    public void shouldMapTypeMismatchToIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/limit/not-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldHideUnknownExceptionDetails() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @RestController
    private static class FailingController {

        @GetMapping("/api/test/execution-error")
        public Response<Void> executionError() {
            throw new AppException(ResponseCode.PLAN_EXECUTION_FAILED.getCode(), "未配置库存查询执行器");
        }

        @GetMapping("/api/test/illegal-argument")
        public Response<Void> illegalArgument() {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new IllegalStateException("inventory store password=secret");
        }

        @GetMapping("/api/test/limit/{limit}")
        public Response<Integer> limit(@PathVariable("limit") Integer limit) {
            return Response.<Integer>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(limit)
                    .build();
        }
    }
}
