package com.sqllint.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 自动修复结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FixReport {

    private String fileName;

    /** 修复前的 SQL */
    private String originalSql;

    /** 修复后的 SQL */
    private String fixedSql;

    /** 实际执行的修复轮数 */
    private int passes;

    /** 修复前的违规数 */
    private int violationsBefore;

    /** 修复后剩余的违规数 */
    private int violationsAfter;

    /** 是否因达到轮数上限而停止 */
    private boolean runawayLimitReached;
}
