package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CourseRecord;
import com.ryuqq.classdrop.core.model.DriveFile;
import com.ryuqq.classdrop.core.model.FormLink;
import com.ryuqq.classdrop.core.model.RecordKind;
import com.ryuqq.classdrop.core.model.WebLink;
import com.ryuqq.classdrop.core.model.YoutubeVideo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * BatchPlanner 단위 테스트.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
@DisplayName("BatchPlanner 단위 테스트")
class BatchPlannerTest {

    private static final DriveFile SHARED = new DriveFile("f-shared", "handout.pdf", "application/pdf", 10L, null);
    private static final DriveFile DOC = new DriveFile("f-doc", "Essay", "application/vnd.google-apps.document", null, null);
    private static final DriveFile SHEET = new DriveFile("f-sheet", "Grades.xlsx",
        "application/vnd.google-apps.spreadsheet", null, null);
    private static final YoutubeVideo VIDEO = new YoutubeVideo(null, "vid1", "Lecture 1", null);
    private static final WebLink LINK = new WebLink(null, "Syllabus", "https://example.com/syllabus");
    private static final FormLink FORM = new FormLink(null, "Exit ticket", "https://forms.example.com/t", null);

    private static CatalogSnapshot catalog() {
        return new CatalogSnapshot("c1", "Biology: Unit 1",
            List.of(new CourseRecord("a1", "Essay assignment", RecordKind.ASSIGNMENT, List.of(SHARED, DOC, VIDEO))),
            List.of(new CourseRecord("m1", "Week 1", RecordKind.MATERIAL, List.of(SHARED, SHEET, LINK))),
            List.of(new CourseRecord("n1", "Reminder", RecordKind.ANNOUNCEMENT, List.of(LINK, FORM))),
            0L, false);
    }

    @Test
    @DisplayName("여러 레코드에 있는 같은 첨부는 한 번만 계획된다")
    void dedupesAcrossRecords() {
        // when
        BatchPlan plan = BatchPlanner.plan(catalog(), Set.of(SHARED.id(), LINK.id()));

        // then
        assertEquals(1, plan.contentJobs().size());
        assertEquals(1, plan.links().size());
        assertEquals(2, plan.total());
        assertEquals("Week 1", plan.links().get(0).parentTitle());
    }

    @Test
    @DisplayName("순회 순서대로 작업과 링크를 나눈다")
    void splitsInWalkOrder() {
        BatchPlan plan = BatchPlanner.plan(catalog(),
            Set.of(SHARED.id(), DOC.id(), SHEET.id(), VIDEO.id(), LINK.id(), FORM.id()));

        List<String> jobIds = plan.contentJobs().stream().map(j -> j.job().fileId()).collect(Collectors.toList());
        List<String> linkIds = plan.links().stream().map(l -> l.attachment().id()).collect(Collectors.toList());

        assertThat(jobIds).containsExactly(SHARED.id(), DOC.id(), SHEET.id());
        assertThat(linkIds).containsExactly(VIDEO.id(), LINK.id(), FORM.id());
        assertTrue(plan.hasWork());
        assertTrue(plan.hasLinks());
    }

    @Test
    @DisplayName("경로는 정리된 폴더 이름 아래에 변환 확장자를 붙인다")
    void pathsUseFolderAndExportExtension() {
        BatchPlan plan = BatchPlanner.plan(catalog(), Set.of(DOC.id(), SHEET.id()));

        List<String> paths = plan.contentJobs().stream().map(PlannedJob::path).collect(Collectors.toList());

        assertEquals("Biology_ Unit 1", plan.batchId());
        assertThat(paths).containsExactly("Biology_ Unit 1/Essay.pdf", "Biology_ Unit 1/Grades.xlsx");
    }

    @Test
    @DisplayName("일치하는 ID가 없으면 빈 계획")
    void nothingMatched() {
        BatchPlan plan = BatchPlanner.plan(catalog(), Set.of("unknown"));

        assertFalse(plan.hasWork());
        assertEquals(0, plan.total());
    }

    @Test
    @DisplayName("같은 이름의 파일은 번호가 붙는다")
    void collidingNamesNumbered() {
        DriveFile a = new DriveFile("x1", "notes.pdf", "application/pdf", 1L, null);
        DriveFile b = new DriveFile("x2", "Notes.pdf", "application/pdf", 1L, null);
        CatalogSnapshot catalog = new CatalogSnapshot("c2", "Chem", List.of(),
            List.of(new CourseRecord("m1", "W1", RecordKind.MATERIAL, List.of(a, b))), List.of(), 0L, false);

        BatchPlan plan = BatchPlanner.plan(catalog, Set.of("x1", "x2"));

        assertThat(plan.contentJobs()).extracting(PlannedJob::path)
            .containsExactly("Chem/notes.pdf", "Chem/Notes(1).pdf");
    }
}
