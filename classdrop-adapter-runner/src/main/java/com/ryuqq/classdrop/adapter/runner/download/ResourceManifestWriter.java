package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.core.model.FormLink;
import com.ryuqq.classdrop.core.model.WebLink;
import com.ryuqq.classdrop.core.model.YoutubeVideo;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 링크 매니페스트 ({@value #FILE_NAME}) 작성기.
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * # Resources and Links
 * # Course: Physics 101
 * # Generated: 2024-05-01T10:00:00Z
 * # Total: 3 items
 *
 * ============================================================
 *
 * ## YouTube Videos (1)
 *
 * - Lecture 1
 *    URL: https://www.youtube.com/watch?v=abc
 *    From: Week 1
 * </pre>
 *
 * <p>비어 있는 섹션은 생략합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
final class ResourceManifestWriter {

    static final String FILE_NAME = "_Links_and_Resources.txt";

    String write(String collectionName, List<LinkEntry> links, Instant generatedAt) {
        List<LinkEntry> videos = new ArrayList<>();
        List<LinkEntry> forms = new ArrayList<>();
        List<LinkEntry> webLinks = new ArrayList<>();
        for (LinkEntry entry : links) {
            if (entry.attachment() instanceof YoutubeVideo) {
                videos.add(entry);
            } else if (entry.attachment() instanceof FormLink) {
                forms.add(entry);
            } else if (entry.attachment() instanceof WebLink) {
                webLinks.add(entry);
            }
        }

        StringBuilder content = new StringBuilder();
        content.append("# Resources and Links\n");
        content.append("# Course: ").append(collectionName).append('\n');
        content.append("# Generated: ").append(DateTimeFormatter.ISO_INSTANT.format(generatedAt)).append('\n');
        content.append("# Total: ").append(links.size()).append(" items\n");
        content.append('\n').append("=".repeat(60)).append("\n\n");

        if (!videos.isEmpty()) {
            content.append("## YouTube Videos (").append(videos.size()).append(")\n\n");
            for (LinkEntry entry : videos) {
                YoutubeVideo video = (YoutubeVideo) entry.attachment();
                content.append("- ").append(video.title()).append('\n');
                content.append("   URL: ").append(video.url()).append('\n');
                appendParent(content, entry);
                content.append('\n');
            }
            content.append('\n');
        }

        if (!forms.isEmpty()) {
            content.append("## Google Forms (").append(forms.size()).append(")\n\n");
            for (LinkEntry entry : forms) {
                FormLink form = (FormLink) entry.attachment();
                content.append("- ").append(form.title()).append('\n');
                content.append("   Form URL: ").append(form.formUrl()).append('\n');
                if (form.responseUrl() != null && !form.responseUrl().isBlank()) {
                    content.append("   Response URL: ").append(form.responseUrl()).append('\n');
                }
                appendParent(content, entry);
                content.append('\n');
            }
            content.append('\n');
        }

        if (!webLinks.isEmpty()) {
            content.append("## External Links (").append(webLinks.size()).append(")\n\n");
            for (LinkEntry entry : webLinks) {
                WebLink link = (WebLink) entry.attachment();
                content.append("- ").append(link.title()).append('\n');
                content.append("   URL: ").append(link.url()).append('\n');
                appendParent(content, entry);
                content.append('\n');
            }
        }

        return content.toString();
    }

    private static void appendParent(StringBuilder content, LinkEntry entry) {
        if (entry.parentTitle() != null && !entry.parentTitle().isBlank()) {
            content.append("   From: ").append(entry.parentTitle()).append('\n');
        }
    }
}
