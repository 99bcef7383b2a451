package com.teambind.checkout.application.port.in;

import com.teambind.checkout.common.SelfValidating;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 상품 스캔 커맨드
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ScanItemCommand extends SelfValidating<ScanItemCommand> {

    @NotNull(message = "체크아웃 ID는 필수입니다")
    private final Long checkoutId;

    @NotBlank(message = "상품 코드는 필수입니다")
    private final String itemId;

    public ScanItemCommand(Long checkoutId, String itemId) {
        this.checkoutId = checkoutId;
        this.itemId = itemId != null ? itemId.strip() : null;
        validateSelf();
    }

    public static ScanItemCommand of(Long checkoutId, String itemId) {
        return new ScanItemCommand(checkoutId, itemId);
    }
}
