package com.sqllint.model;

/**
 * 某类节点相对换行的期望位置
 */
public enum LinePosition {
    /** 前后都需要换行，节点独占一行 */
    ALONE,
    /** 仅需在节点之前换行 */
    LEADING,
    /** 仅需在节点之后换行 */
    TRAILING;

    public boolean requiresBreakBefore() {
        return this == ALONE || this == LEADING;
    }

    public boolean requiresBreakAfter() {
        return this == ALONE || this == TRAILING;
    }
}
