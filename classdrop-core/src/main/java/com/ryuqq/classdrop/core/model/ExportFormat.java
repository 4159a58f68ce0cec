package com.ryuqq.classdrop.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * Google Workspace 문서의 변환 대상 포맷.
 *
 * <p>Workspace 네이티브 문서는 원본 바이트를 받을 수 없으므로
 * {@code convertAndFetch}로 변환본을 받습니다.</p>
 *
 * <pre>
 * document     → PDF
 * spreadsheet  → XLSX
 * presentation → PDF
 * drawing      → PNG
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public enum ExportFormat {

    PDF("application/pdf", ".pdf"),
    XLSX("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", ".xlsx"),
    PNG("image/png", ".png");

    /**
     * Workspace 문서 MIME 타입 접두사.
     */
    public static final String WORKSPACE_MIME_PREFIX = "application/vnd.google-apps.";

    private static final Map<String, ExportFormat> BY_SOURCE_MIME = Map.of(
        WORKSPACE_MIME_PREFIX + "document", PDF,
        WORKSPACE_MIME_PREFIX + "spreadsheet", XLSX,
        WORKSPACE_MIME_PREFIX + "presentation", PDF,
        WORKSPACE_MIME_PREFIX + "drawing", PNG
    );

    private final String mimeType;
    private final String extension;

    ExportFormat(String mimeType, String extension) {
        this.mimeType = mimeType;
        this.extension = extension;
    }

    /**
     * 원본 MIME 타입에 대응하는 변환 포맷 조회.
     *
     * @param sourceMimeType 원본 MIME 타입 (null 허용)
     * @return 변환이 필요한 경우 포맷, 아니면 empty
     */
    public static Optional<ExportFormat> forSource(String sourceMimeType) {
        if (sourceMimeType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SOURCE_MIME.get(sourceMimeType));
    }

    /**
     * Workspace 네이티브 문서인지 확인.
     *
     * @param mimeType MIME 타입 (null 허용)
     * @return Workspace 문서이면 true
     */
    public static boolean isWorkspaceNative(String mimeType) {
        return mimeType != null && mimeType.startsWith(WORKSPACE_MIME_PREFIX);
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }
}
