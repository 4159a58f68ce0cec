package com.ryuqq.classdrop.adapter.runner.cache;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.RecordKind;

/**
 * 캐시 한도를 넘는 카탈로그 축소기.
 *
 * <p><strong>단계:</strong></p>
 * <ol>
 *   <li>과제/자료는 앞 100개, 공지는 앞 50개만 유지</li>
 *   <li>그래도 크면 공지 → 자료 → 과제 순으로 통째로 제거</li>
 * </ol>
 *
 * <p>결과는 항상 {@code truncated = true}입니다. 모두 제거해도 한도를 넘으면
 * 그 상태 그대로 반환합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
final class PayloadTruncator {

    static final int MAX_ASSIGNMENTS = 100;
    static final int MAX_MATERIALS = 100;
    static final int MAX_ANNOUNCEMENTS = 50;

    private static final RecordKind[] DROP_ORDER = {
        RecordKind.ANNOUNCEMENT, RecordKind.MATERIAL, RecordKind.ASSIGNMENT
    };

    private final JsonCodec codec;

    PayloadTruncator(JsonCodec codec) {
        this.codec = codec;
    }

    CatalogSnapshot truncate(CatalogSnapshot snapshot, long thresholdBytes) {
        CatalogSnapshot trimmed = snapshot
            .limit(RecordKind.ASSIGNMENT, MAX_ASSIGNMENTS)
            .limit(RecordKind.MATERIAL, MAX_MATERIALS)
            .limit(RecordKind.ANNOUNCEMENT, MAX_ANNOUNCEMENTS);

        for (RecordKind kind : DROP_ORDER) {
            if (sizeOf(trimmed) <= thresholdBytes) {
                return trimmed;
            }
            trimmed = trimmed.limit(kind, 0);
        }
        return trimmed;
    }

    private long sizeOf(CatalogSnapshot snapshot) {
        return JsonCodec.byteSize(codec.write(snapshot));
    }
}
