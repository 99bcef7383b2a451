package com.teambind.checkout.adapter.out.scheme;

import com.teambind.checkout.domain.model.Scheme;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 스킴 파싱 결과
 * 건너뛴 라인은 진단 정보와 함께 보관된다.
 */
@Value
@Builder
public class SchemeParseResult {
    Scheme scheme;
    List<SkippedEntry> skippedEntries;

    public boolean hasSkippedEntries() {
        return !skippedEntries.isEmpty();
    }

    /**
     * 건너뛴 스킴 라인
     */
    @Value
    public static class SkippedEntry {
        int lineNumber;
        String line;
        String code;
        String message;
    }
}
