package com.teambind.checkout.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상품 스캔 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanItemRequest {

    @NotBlank(message = "상품 코드는 필수입니다")
    private String itemId;
}
