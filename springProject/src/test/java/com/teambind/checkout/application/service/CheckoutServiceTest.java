package com.teambind.checkout.application.service;

import com.teambind.checkout.application.port.in.CheckoutView;
import com.teambind.checkout.application.port.in.ScanItemCommand;
import com.teambind.checkout.application.port.in.ScanItemUseCase.ScanResult;
import com.teambind.checkout.application.port.out.LoadCheckoutPort;
import com.teambind.checkout.application.port.out.LoadSchemePort;
import com.teambind.checkout.application.port.out.PublishRuleAppliedPort;
import com.teambind.checkout.application.port.out.RemoveCheckoutPort;
import com.teambind.checkout.application.port.out.SaveCheckoutPort;
import com.teambind.checkout.common.util.CheckoutIdGenerator;
import com.teambind.checkout.domain.exception.CheckoutDomainException;
import com.teambind.checkout.domain.model.Checkout;
import com.teambind.checkout.domain.model.Product;
import com.teambind.checkout.domain.model.Rule;
import com.teambind.checkout.domain.model.RuleApplication;
import com.teambind.checkout.domain.model.Scheme;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CheckoutService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CheckoutService 테스트")
class CheckoutServiceTest {

    @Mock
    private LoadSchemePort loadSchemePort;

    @Mock
    private SaveCheckoutPort saveCheckoutPort;

    @Mock
    private LoadCheckoutPort loadCheckoutPort;

    @Mock
    private RemoveCheckoutPort removeCheckoutPort;

    @Mock
    private PublishRuleAppliedPort publishRuleAppliedPort;

    @Mock
    private CheckoutIdGenerator checkoutIdGenerator;

    @InjectMocks
    private CheckoutService service;

    private Scheme scheme;

    @BeforeEach
    void setUp() {
        Product chips = Product.of("6732", "1.00");
        Product salsa = Product.of("4900", "2.00");
        scheme = Scheme.builder()
                .item(chips)
                .item(salsa)
                .item(Product.of("1983", "1.99"))
                .rule(new Rule("Bundle", List.of(chips, salsa), new BigDecimal("2.50")))
                .build();
    }

    @Test
    @DisplayName("새 세션은 합계 0 으로 시작하고 저장된다")
    void openCheckout() {
        // given
        when(loadSchemePort.loadScheme()).thenReturn(scheme);
        when(checkoutIdGenerator.nextId()).thenReturn(100L);

        // when
        CheckoutView view = service.openCheckout();

        // then
        assertThat(view.getCheckoutId()).isEqualTo(100L);
        assertThat(view.getTotal()).isEqualByComparingTo("0.00");
        assertThat(view.getPendingItemIds()).isEmpty();

        ArgumentCaptor<Checkout> captor = ArgumentCaptor.forClass(Checkout.class);
        verify(saveCheckoutPort).save(captor.capture());
        assertThat(captor.getValue().getScheme()).isSameAs(scheme);
    }

    @Nested
    @DisplayName("상품 스캔")
    class Scan {

        private Checkout checkout;

        @BeforeEach
        void setUp() {
            checkout = new Checkout(1L, scheme, publishRuleAppliedPort::publish);
            when(loadCheckoutPort.loadById(1L)).thenReturn(Optional.of(checkout));
        }

        @Test
        @DisplayName("규칙 없이 스캔하면 가격만 더해진다")
        void scanWithoutRule() {
            // when
            ScanResult result = service.scan(ScanItemCommand.of(1L, "1983"));

            // then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getScannedValue()).isEqualByComparingTo("1.99");
            assertThat(result.isRuleApplied()).isFalse();
            assertThat(result.getTotal()).isEqualByComparingTo("1.99");
            verify(publishRuleAppliedPort, never()).publish(any());
        }

        @Test
        @DisplayName("규칙이 적용되면 결과와 이벤트에 반영된다")
        void scanAppliesRule() {
            // given
            service.scan(ScanItemCommand.of(1L, "6732"));

            // when
            ScanResult result = service.scan(ScanItemCommand.of(1L, "4900"));

            // then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getAppliedRule()).isEqualTo("Bundle");
            assertThat(result.getAdjustment()).isEqualByComparingTo("-0.50");
            assertThat(result.getTotal()).isEqualByComparingTo("2.50");

            ArgumentCaptor<RuleApplication> captor = ArgumentCaptor.forClass(RuleApplication.class);
            verify(publishRuleAppliedPort).publish(captor.capture());
            assertThat(captor.getValue().getCheckoutId()).isEqualTo(1L);
            assertThat(captor.getValue().getItemIds()).containsExactly("6732", "4900");
        }

        @Test
        @DisplayName("등록되지 않은 상품은 실패 결과를 반환하고 상태를 바꾸지 않는다")
        void unknownItem() {
            // given
            service.scan(ScanItemCommand.of(1L, "6732"));

            // when
            ScanResult result = service.scan(ScanItemCommand.of(1L, "0000"));

            // then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getMessage()).contains("0000");
            assertThat(result.getTotal()).isEqualByComparingTo("1.00");
            assertThat(checkout.getPendingItemIds()).containsExactly("6732");
        }
    }

    @Test
    @DisplayName("존재하지 않는 세션 스캔 시도")
    void scanUnknownCheckout() {
        // given
        when(loadCheckoutPort.loadById(999L)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> service.scan(ScanItemCommand.of(999L, "1983")))
                .isInstanceOf(CheckoutDomainException.CheckoutNotFound.class);
    }

    @Test
    @DisplayName("세션 조회는 합계와 대기 상품을 반환한다")
    void getCheckout() {
        // given
        Checkout checkout = new Checkout(5L, scheme, publishRuleAppliedPort::publish);
        checkout.scan("6732");
        when(loadCheckoutPort.loadById(5L)).thenReturn(Optional.of(checkout));

        // when
        CheckoutView view = service.getCheckout(5L);

        // then
        assertThat(view.getTotal()).isEqualByComparingTo("1.00");
        assertThat(view.getPendingItemIds()).containsExactly("6732");
    }

    @Test
    @DisplayName("상품 코드가 비어 있으면 커맨드 생성이 실패한다")
    void blankItemId() {
        assertThatThrownBy(() -> ScanItemCommand.of(1L, "  "))
                .isInstanceOf(ConstraintViolationException.class);
        assertThatThrownBy(() -> ScanItemCommand.of(null, "1983"))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Nested
    @DisplayName("세션 종료")
    class Close {

        @Test
        @DisplayName("종료하면 최종 합계를 반환하고 저장소에서 제거한다")
        void closeCheckout() {
            // given
            Checkout checkout = new Checkout(7L, scheme, publishRuleAppliedPort::publish);
            checkout.scan("6732");
            checkout.scan("4900");
            when(loadCheckoutPort.loadById(7L)).thenReturn(Optional.of(checkout));
            when(removeCheckoutPort.remove(7L)).thenReturn(true);

            // when
            CheckoutView view = service.closeCheckout(7L);

            // then
            assertThat(view.getCheckoutId()).isEqualTo(7L);
            assertThat(view.getTotal()).isEqualByComparingTo("2.50");
            verify(removeCheckoutPort).remove(7L);
        }

        @Test
        @DisplayName("이미 종료된 세션은 CHECKOUT_NOT_FOUND")
        void closeUnknownCheckout() {
            // given
            when(loadCheckoutPort.loadById(8L)).thenReturn(Optional.empty());

            // when & then
            assertThatThrownBy(() -> service.closeCheckout(8L))
                    .isInstanceOf(CheckoutDomainException.CheckoutNotFound.class)
                    .extracting("code")
                    .isEqualTo("CHECKOUT_NOT_FOUND");
            verify(removeCheckoutPort, never()).remove(any());
        }

        @Test
        @DisplayName("동시에 종료되어 삭제할 세션이 없으면 CHECKOUT_NOT_FOUND")
        void closeRemovedConcurrently() {
            // given
            Checkout checkout = new Checkout(9L, scheme, publishRuleAppliedPort::publish);
            when(loadCheckoutPort.loadById(9L)).thenReturn(Optional.of(checkout));
            when(removeCheckoutPort.remove(9L)).thenReturn(false);

            // when & then
            assertThatThrownBy(() -> service.closeCheckout(9L))
                    .isInstanceOf(CheckoutDomainException.CheckoutNotFound.class);
        }
    }
}
