package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.core.model.Attachment;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CourseRecord;
import com.ryuqq.classdrop.core.model.DownloadJob;
import com.ryuqq.classdrop.core.model.DriveFile;
import com.ryuqq.classdrop.core.model.ExportFormat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 카탈로그와 선택 식별자로 배치를 구성.
 *
 * <p><strong>구성 규칙:</strong></p>
 * <ul>
 *   <li>과제 → 자료 → 공지 순서로 모든 레코드의 첨부를 순회</li>
 *   <li>requestedIds에 있는 첨부만 포함, 같은 식별자는 처음 발견된 것만 유지</li>
 *   <li>Drive 파일은 콘텐츠 작업, 나머지는 링크 항목</li>
 *   <li>콘텐츠 작업의 파일 이름은 제출 순서대로 배치 내 고유하게 할당</li>
 * </ul>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
final class BatchPlanner {

    // Utility class - prevent instantiation
    private BatchPlanner() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static BatchPlan plan(CatalogSnapshot catalog, Set<String> requestedIds) {
        String folder = FilenameAllocator.sanitize(catalog.collectionName(), "Classroom Download");
        FilenameAllocator allocator = new FilenameAllocator();

        Set<String> seen = new HashSet<>();
        List<PlannedJob> contentJobs = new ArrayList<>();
        List<LinkEntry> links = new ArrayList<>();

        for (CourseRecord record : catalog.allRecords()) {
            for (Attachment attachment : record.attachments()) {
                if (!requestedIds.contains(attachment.id()) || !seen.add(attachment.id())) {
                    continue;
                }
                if (attachment instanceof DriveFile file) {
                    DownloadJob job = DownloadJob.pending(file);
                    String name = allocator.allocate(fileNameFor(file));
                    contentJobs.add(new PlannedJob(job, folder + "/" + name));
                } else {
                    links.add(new LinkEntry(attachment, record.title()));
                }
            }
        }
        return new BatchPlan(folder, catalog.collectionName(), contentJobs, links);
    }

    /**
     * 변환 대상이면 변환 형식의 확장자를 붙인 이름.
     */
    static String fileNameFor(DriveFile file) {
        Optional<ExportFormat> format = file.exportFormat();
        if (format.isEmpty()) {
            return file.title();
        }
        String extension = format.get().getExtension();
        return file.title().toLowerCase(Locale.ROOT).endsWith(extension)
            ? file.title()
            : file.title() + extension;
    }
}
