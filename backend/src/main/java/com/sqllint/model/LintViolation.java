package com.sqllint.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条违规记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LintViolation {

    /** 违反的规则编码 */
    private String ruleCode;

    /** 违反的规则名称 */
    private String ruleName;

    /** 具体违规描述 */
    private String description;

    /** 违规所在行号 */
    private int line;

    /** 违规所在列号 */
    private int column;

    /** 锚点节点的原始文本 */
    private String matchedText;

    /** 是否可自动修复 */
    private boolean fixable;
}
