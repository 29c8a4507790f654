package com.callflow.domain.transcript.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 通话记录领域实体，流水线输入，创建后不可变。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
public class TranscriptEntity {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 客户 ID
     */
    private String customerId;

    /**
     * 顾问 ID
     */
    private String advisorId;

    /**
     * 通话主题
     */
    private String topic;

    /**
     * 原始内容
     */
    private String content;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 验证通话记录是否有效
     */
    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalStateException("Transcript ID cannot be empty");
        }
        if (content == null || content.trim().isEmpty()) {
            throw new IllegalStateException("Transcript content cannot be empty");
        }
    }
}
