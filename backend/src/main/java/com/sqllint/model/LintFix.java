package com.sqllint.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 锚定在某个语法节点上的单个修复编辑
 *
 * @param editType 编辑类型
 * @param anchor   锚点节点
 * @param edit     新内容（DELETE 时为空）
 */
public record LintFix(EditType editType, Segment anchor, List<Segment> edit) {

    public enum EditType {
        REPLACE, DELETE, CREATE_BEFORE, CREATE_AFTER
    }

    public LintFix {
        edit = edit == null ? List.of() : List.copyOf(edit);
    }

    public static LintFix replace(Segment anchor, List<Segment> edit) {
        return new LintFix(EditType.REPLACE, anchor, edit);
    }

    public static LintFix delete(Segment anchor) {
        return new LintFix(EditType.DELETE, anchor, List.of());
    }

    public static LintFix createBefore(Segment anchor, List<Segment> edit) {
        return new LintFix(EditType.CREATE_BEFORE, anchor, edit);
    }

    public static LintFix createAfter(Segment anchor, List<Segment> edit) {
        return new LintFix(EditType.CREATE_AFTER, anchor, edit);
    }

    public String editRaw() {
        return edit.stream().map(Segment::getRaw).collect(Collectors.joining());
    }
}
