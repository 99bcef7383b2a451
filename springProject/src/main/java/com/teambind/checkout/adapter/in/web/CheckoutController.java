package com.teambind.checkout.adapter.in.web;

import com.teambind.checkout.adapter.in.web.dto.ScanItemRequest;
import com.teambind.checkout.application.port.in.CheckoutView;
import com.teambind.checkout.application.port.in.CloseCheckoutUseCase;
import com.teambind.checkout.application.port.in.GetCheckoutUseCase;
import com.teambind.checkout.application.port.in.OpenCheckoutUseCase;
import com.teambind.checkout.application.port.in.ScanItemCommand;
import com.teambind.checkout.application.port.in.ScanItemUseCase;
import com.teambind.checkout.application.port.in.ScanItemUseCase.ScanResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 체크아웃 API 컨트롤러
 */
@Slf4j
@RestController
@RequestMapping("/api/checkouts")
@RequiredArgsConstructor
public class CheckoutController {

    private final OpenCheckoutUseCase openCheckoutUseCase;
    private final ScanItemUseCase scanItemUseCase;
    private final GetCheckoutUseCase getCheckoutUseCase;
    private final CloseCheckoutUseCase closeCheckoutUseCase;

    /**
     * 체크아웃 세션 생성
     */
    @PostMapping
    public ResponseEntity<CheckoutView> openCheckout() {
        log.info("체크아웃 세션 생성 요청");

        CheckoutView checkout = openCheckoutUseCase.openCheckout();

        return ResponseEntity.status(HttpStatus.CREATED).body(checkout);
    }

    /**
     * 상품 스캔
     * 등록되지 않은 상품은 success=false 로 응답하며 세션 상태는 변하지 않는다.
     *
     * @param checkoutId 체크아웃 ID
     * @param request    스캔 요청
     * @return 스캔 결과
     */
    @PostMapping("/{checkoutId}/scans")
    public ResponseEntity<ScanResult> scan(
            @PathVariable Long checkoutId,
            @Valid @RequestBody ScanItemRequest request) {

        log.info("상품 스캔 요청 - checkoutId: {}, itemId: {}", checkoutId, request.getItemId());

        ScanResult result = scanItemUseCase.scan(ScanItemCommand.of(checkoutId, request.getItemId()));

        return ResponseEntity.ok(result);
    }

    /**
     * 합계와 대기 상품 조회
     */
    @GetMapping("/{checkoutId}")
    public ResponseEntity<CheckoutView> getCheckout(@PathVariable Long checkoutId) {
        return ResponseEntity.ok(getCheckoutUseCase.getCheckout(checkoutId));
    }

    /**
     * 체크아웃 세션 종료
     * 최종 합계를 반환하며 이후 같은 ID 의 요청은 404 로 응답한다.
     */
    @DeleteMapping("/{checkoutId}")
    public ResponseEntity<CheckoutView> closeCheckout(@PathVariable Long checkoutId) {
        log.info("체크아웃 세션 종료 요청 - checkoutId: {}", checkoutId);

        return ResponseEntity.ok(closeCheckoutUseCase.closeCheckout(checkoutId));
    }
}
