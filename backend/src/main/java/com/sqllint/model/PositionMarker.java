package com.sqllint.model;

/**
 * 语法节点在源 SQL 中的位置标记
 * <p>
 * 以 workingLoc（从 0 开始的字符偏移）作为全序比较依据，line / column 仅用于报告展示。
 *
 * @param workingLoc 源文本中的字符偏移
 * @param line       起始行号（从 1 开始）
 * @param column     起始列号（从 1 开始）
 */
public record PositionMarker(int workingLoc, int line, int column) implements Comparable<PositionMarker> {

    public boolean isBefore(PositionMarker other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(PositionMarker other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(PositionMarker other) {
        return Integer.compare(workingLoc, other.workingLoc);
    }
}
