package com.sqllint.model;

import java.util.List;

/**
 * 单条检查结果：锚点、描述以及建议的修复集合
 */
public record LintResult(Segment anchor, String description, List<LintFix> fixes) {

    public LintResult {
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }

    public boolean isFixable() {
        return !fixes.isEmpty();
    }
}
