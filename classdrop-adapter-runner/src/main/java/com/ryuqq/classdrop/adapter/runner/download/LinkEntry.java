package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.core.model.Attachment;

/**
 * 매니페스트에 기록될 링크 항목.
 *
 * @param attachment 링크형 첨부 (YouTube, Form, 웹 링크)
 * @param parentTitle 첨부가 처음 발견된 레코드 제목
 * @author ClassDrop Team
 * @since 1.0.0
 */
record LinkEntry(Attachment attachment, String parentTitle) {
}
