package com.teambind.checkout.adapter.in.cli;

import com.teambind.checkout.application.port.in.CheckoutView;
import com.teambind.checkout.application.port.in.GetCheckoutUseCase;
import com.teambind.checkout.application.port.in.OpenCheckoutUseCase;
import com.teambind.checkout.application.port.in.ScanItemCommand;
import com.teambind.checkout.application.port.in.ScanItemUseCase;
import com.teambind.checkout.application.port.in.ScanItemUseCase.ScanResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 시나리오 실행기
 * 시나리오 파일(한 줄에 상품 코드 하나) 또는 기본 시나리오를 순서대로 스캔하고 합계를 출력한다.
 *
 * 실행 예: --checkout.cli.enabled=true --checkout.cli.scenario-location=file:input.txt
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "checkout.cli", name = "enabled", havingValue = "true")
public class CheckoutScenarioRunner implements ApplicationRunner {

    private final OpenCheckoutUseCase openCheckoutUseCase;
    private final ScanItemUseCase scanItemUseCase;
    private final GetCheckoutUseCase getCheckoutUseCase;
    private final ResourceLoader resourceLoader;

    @Value("${checkout.cli.scenario-location:}")
    private String scenarioLocation;

    @Value("${checkout.cli.default-scans:1983,4900,8873,6732,0923,1983,1983,1983}")
    private List<String> defaultScans;

    private PrintStream out = System.out;

    @Override
    public void run(ApplicationArguments args) {
        List<String> scans = scenarioLocation == null || scenarioLocation.isBlank()
                ? defaultScans
                : readScenario(scenarioLocation);

        BigDecimal total = runScenario(scans);
        out.println("Total: " + total);
    }

    /**
     * 새 세션에서 상품 코드를 순서대로 스캔
     *
     * @return 최종 합계
     */
    public BigDecimal runScenario(List<String> scans) {
        CheckoutView checkout = openCheckoutUseCase.openCheckout();
        Long checkoutId = checkout.getCheckoutId();

        for (String itemId : scans) {
            if (itemId == null || itemId.isBlank()) {
                continue;
            }
            ScanResult result = scanItemUseCase.scan(ScanItemCommand.of(checkoutId, itemId));
            if (result.isSuccess()) {
                log.info("Scanning {} - price: {}, total: {}", result.getItemId(), result.getScannedValue(), result.getTotal());
            }
        }

        return getCheckoutUseCase.getCheckout(checkoutId).getTotal();
    }

    List<String> readScenario(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("시나리오 파일을 찾을 수 없습니다: " + location);
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().map(String::strip).toList();
        } catch (IOException e) {
            throw new IllegalStateException("시나리오 파일을 읽을 수 없습니다: " + location, e);
        }
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}
