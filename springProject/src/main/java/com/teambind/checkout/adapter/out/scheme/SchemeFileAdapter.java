package com.teambind.checkout.adapter.out.scheme;

import com.teambind.checkout.application.port.out.LoadSchemePort;
import com.teambind.checkout.domain.model.Scheme;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 스킴 파일 어댑터
 * 설정된 리소스 위치(classpath:, file:)에서 스킴을 한 번 읽고 이후에는 재사용한다.
 * 스킴은 애플리케이션 시작 시 읽으며, 파일이 없으면 컨텍스트 기동이 실패한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemeFileAdapter implements LoadSchemePort {

    private final ResourceLoader resourceLoader;
    private final SchemeEntryParser schemeEntryParser;

    @Value("${checkout.scheme.location:classpath:scheme/Scheme.txt}")
    private String schemeLocation;

    private volatile Scheme scheme;

    @PostConstruct
    void init() {
        loadScheme();
    }

    @Override
    public Scheme loadScheme() {
        Scheme loaded = scheme;
        if (loaded == null) {
            synchronized (this) {
                if (scheme == null) {
                    scheme = read(schemeLocation).getScheme();
                }
                loaded = scheme;
            }
        }
        return loaded;
    }

    /**
     * 스킴 파일 읽기
     *
     * @param location Spring 리소스 위치
     * @return 파싱 결과 (건너뛴 라인 포함)
     * @throws IllegalStateException 파일이 없거나 읽을 수 없을 때
     */
    public SchemeParseResult read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("스킴 파일을 찾을 수 없습니다: " + location);
        }

        List<String> lines;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            lines = reader.lines().toList();
        } catch (IOException e) {
            log.error("스킴 파일 읽기 실패 - location: {}, error: {}", location, e.getMessage(), e);
            throw new IllegalStateException("스킴 파일을 읽을 수 없습니다: " + location, e);
        }

        SchemeParseResult result = schemeEntryParser.parse(lines);
        log.info("스킴 로딩 완료 - location: {}, items: {}, rules: {}, skipped: {}",
                location, result.getScheme().getItems().size(), result.getScheme().getRules().size(),
                result.getSkippedEntries().size());
        return result;
    }
}
