package com.sqllint.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 检查结果报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LintReport {

    /** 被检查的文件名 */
    private String fileName;

    /** 检查时间 */
    private LocalDateTime lintTime;

    /** SQL 语句总数 */
    private int totalStatements;

    /** 违规总数 */
    private int totalViolations;

    /** 可自动修复的违规数 */
    private int fixableCount;

    /** 所有违规记录 */
    private List<LintViolation> violations;

    /** 执行失败的规则（前置条件不满足或换行计算出错） */
    private List<String> ruleFailures;

    /** 提示信息（如编码回退） */
    private List<String> notices;

    /** 是否因为违规过多达上限而截断 */
    private boolean limitReached;
}
