package com.teambind.checkout.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teambind.checkout.adapter.in.web.dto.ScanItemRequest;
import com.teambind.checkout.application.port.in.CheckoutView;
import com.teambind.checkout.application.port.in.CloseCheckoutUseCase;
import com.teambind.checkout.application.port.in.GetCheckoutUseCase;
import com.teambind.checkout.application.port.in.OpenCheckoutUseCase;
import com.teambind.checkout.application.port.in.ScanItemCommand;
import com.teambind.checkout.application.port.in.ScanItemUseCase;
import com.teambind.checkout.application.port.in.ScanItemUseCase.ScanResult;
import com.teambind.checkout.domain.exception.CheckoutDomainException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 체크아웃 API 컨트롤러 테스트
 */
@WebMvcTest(CheckoutController.class)
@DisplayName("체크아웃 API 테스트")
class CheckoutControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private OpenCheckoutUseCase openCheckoutUseCase;

    @MockBean
    private ScanItemUseCase scanItemUseCase;

    @MockBean
    private GetCheckoutUseCase getCheckoutUseCase;

    @MockBean
    private CloseCheckoutUseCase closeCheckoutUseCase;

    @Test
    @DisplayName("세션 생성 성공")
    void openCheckout_Success() throws Exception {
        // given
        when(openCheckoutUseCase.openCheckout()).thenReturn(CheckoutView.builder()
                .checkoutId(1L)
                .total(new BigDecimal("0.00"))
                .pendingItemIds(List.of())
                .build());

        // when & then
        mockMvc.perform(post("/api/checkouts"))
                .andDo(print())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.checkoutId").value(1))
                .andExpect(jsonPath("$.total").value(0.0));
    }

    @Test
    @DisplayName("상품 스캔 성공")
    void scan_Success() throws Exception {
        // given
        when(scanItemUseCase.scan(any(ScanItemCommand.class))).thenReturn(ScanResult.builder()
                .checkoutId(1L)
                .itemId("4900")
                .success(true)
                .scannedValue(new BigDecimal("2.00"))
                .appliedRule("Bundle")
                .adjustment(new BigDecimal("-0.50"))
                .total(new BigDecimal("2.50"))
                .message("규칙 Bundle 적용")
                .build());

        // when & then
        mockMvc.perform(post("/api/checkouts/1/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ScanItemRequest("4900"))))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.appliedRule").value("Bundle"))
                .andExpect(jsonPath("$.adjustment").value(-0.5))
                .andExpect(jsonPath("$.total").value(2.5));

        verify(scanItemUseCase).scan(eq(ScanItemCommand.of(1L, "4900")));
    }

    @Test
    @DisplayName("등록되지 않은 상품 스캔은 실패 결과로 응답")
    void scan_UnknownItem() throws Exception {
        // given
        when(scanItemUseCase.scan(any(ScanItemCommand.class))).thenReturn(ScanResult.builder()
                .checkoutId(1L)
                .itemId("0000")
                .success(false)
                .total(new BigDecimal("1.00"))
                .message("스킴에 등록되지 않은 상품입니다: 0000")
                .build());

        // when & then
        mockMvc.perform(post("/api/checkouts/1/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\":\"0000\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.total").value(1.0));
    }

    @Test
    @DisplayName("상품 코드 누락 시 400")
    void scan_BlankItemId() throws Exception {
        mockMvc.perform(post("/api/checkouts/1/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\":\" \"}"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("itemId"));

        verify(scanItemUseCase, never()).scan(any());
    }

    @Test
    @DisplayName("존재하지 않는 세션 스캔 시 404")
    void scan_CheckoutNotFound() throws Exception {
        // given
        when(scanItemUseCase.scan(any(ScanItemCommand.class)))
                .thenThrow(new CheckoutDomainException.CheckoutNotFound(99L));

        // when & then
        mockMvc.perform(post("/api/checkouts/99/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\":\"1983\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CHECKOUT_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/checkouts/99/scans"));
    }

    @Test
    @DisplayName("세션 조회 성공")
    void getCheckout_Success() throws Exception {
        // given
        when(getCheckoutUseCase.getCheckout(1L)).thenReturn(CheckoutView.builder()
                .checkoutId(1L)
                .total(new BigDecimal("1.00"))
                .pendingItemIds(List.of("6732"))
                .build());

        // when & then
        mockMvc.perform(get("/api/checkouts/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1.0))
                .andExpect(jsonPath("$.pendingItemIds[0]").value("6732"));
    }

    @Test
    @DisplayName("세션 종료 시 최종 합계 반환")
    void closeCheckout_Success() throws Exception {
        // given
        when(closeCheckoutUseCase.closeCheckout(1L)).thenReturn(CheckoutView.builder()
                .checkoutId(1L)
                .total(new BigDecimal("2.50"))
                .pendingItemIds(List.of())
                .build());

        // when & then
        mockMvc.perform(delete("/api/checkouts/1"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2.5));
    }

    @Test
    @DisplayName("종료된 세션 재종료 시 404")
    void closeCheckout_NotFound() throws Exception {
        // given
        when(closeCheckoutUseCase.closeCheckout(1L))
                .thenThrow(new CheckoutDomainException.CheckoutNotFound(1L));

        // when & then
        mockMvc.perform(delete("/api/checkouts/1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CHECKOUT_NOT_FOUND"));
    }
}
