package com.callflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 通话记录 PO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptPO {

    private String id;

    private String customerId;

    private String advisorId;

    private String topic;

    private String content;

    private Integer version;

    private LocalDateTime createdAt;
}
