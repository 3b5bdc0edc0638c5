package com.sqllint.model;

import java.util.Map;
import java.util.Optional;

/**
 * 传递给规则和换行计算的布局配置（不可变）
 *
 * @param linePositions 节点类型 -> 换行位置
 */
public record LayoutConfig(Map<String, LinePosition> linePositions) {

    public LayoutConfig {
        linePositions = linePositions == null ? Map.of() : Map.copyOf(linePositions);
    }

    public static LayoutConfig defaults() {
        return new LayoutConfig(Map.of(SegmentType.SET_OPERATOR, LinePosition.ALONE));
    }

    public Optional<LinePosition> linePositionOf(String segmentType) {
        return Optional.ofNullable(linePositions.get(segmentType));
    }
}
