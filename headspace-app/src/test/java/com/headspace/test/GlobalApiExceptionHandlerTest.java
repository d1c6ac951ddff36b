package com.headspace.test;

import com.headspace.api.response.Response;
import com.headspace.trigger.http.GlobalApiExceptionHandler;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.exception.AppException;
import com.headspace.types.exception.LockReentrancyException;
import com.headspace.types.exception.LockTimeoutException;
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
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldHandleAppException() throws Exception {
        mockMvc.perform(get("/api/test/app-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.AGENT_ENDED.getCode()))
                .andExpect(jsonPath("$.info").value("Agent already ended: 1"));
    }

    @Test
    public void shouldHandleLockTimeout() throws Exception {
        mockMvc.perform(get("/api/test/lock-timeout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.LOCK_TIMEOUT.getCode()));
    }

    @Test
    public void shouldHandleLockReentrancy() throws Exception {
        mockMvc.perform(get("/api/test/lock-reentrancy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.LOCK_REENTRANCY.getCode()));
    }

    @Test
    public void shouldHandleUnknownException() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchExceptionAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/app-error")
        public Response<Void> appError() {
            throw new AppException(ResponseCode.AGENT_ENDED.getCode(), "Agent already ended: 1");
        }

        @GetMapping("/api/test/lock-timeout")
        public Response<Void> lockTimeout() {
            throw new LockTimeoutException(1, 42, 15000L);
        }

        @GetMapping("/api/test/lock-reentrancy")
        public Response<Void> lockReentrancy() {
            throw new LockReentrancyException(1, 42);
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(String.valueOf(id))
                    .build();
        }
    }
}
