package com.callflow.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 面向单一角色的子计划。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RolePlan {

    private String summary;

    @Builder.Default
    private List<ActionItem> actionItems = new ArrayList<>();
}
