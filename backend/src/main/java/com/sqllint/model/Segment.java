package com.sqllint.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 不可变的语法树节点
 * <p>
 * 叶子节点直接持有源文本；复合节点的 raw 为所有子节点 raw 的拼接，
 * 位置标记取第一个子节点的位置。由修复生成的新节点没有位置标记。
 */
@Getter
public final class Segment {

    private final String type;
    private final String raw;
    private final PositionMarker positionMarker;
    private final List<Segment> segments;

    private Segment(String type, String raw, PositionMarker positionMarker, List<Segment> segments) {
        this.type = type;
        this.raw = raw;
        this.positionMarker = positionMarker;
        this.segments = segments;
    }

    public static Segment leaf(String type, String raw, PositionMarker positionMarker) {
        return new Segment(type, raw, positionMarker, List.of());
    }

    /**
     * 修复时插入的新节点，没有源位置
     */
    public static Segment generated(String type, String raw) {
        return new Segment(type, raw, null, List.of());
    }

    public static Segment composite(String type, List<Segment> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("复合节点至少需要一个子节点: " + type);
        }
        String raw = children.stream().map(Segment::getRaw).collect(Collectors.joining());
        return new Segment(type, raw, children.get(0).getPositionMarker(), List.copyOf(children));
    }

    public boolean isType(String... types) {
        for (String t : types) {
            if (type.equals(t)) {
                return true;
            }
        }
        return false;
    }

    public boolean isRaw() {
        return segments.isEmpty();
    }

    public boolean isWhitespace() {
        return isType(SegmentType.WHITESPACE, SegmentType.NEWLINE);
    }

    public boolean isNewline() {
        return isType(SegmentType.NEWLINE);
    }

    public boolean isComment() {
        return isType(SegmentType.INLINE_COMMENT, SegmentType.BLOCK_COMMENT);
    }

    public boolean isCode() {
        if (isRaw()) {
            return !isWhitespace() && !isComment();
        }
        return segments.stream().anyMatch(Segment::isCode);
    }

    /**
     * 源文本中的结束偏移（不含）；没有位置标记时返回 -1
     */
    public int endOffset() {
        if (positionMarker == null) {
            return -1;
        }
        return positionMarker.workingLoc() + raw.length();
    }

    /**
     * 深度优先展开所有叶子节点
     */
    public List<Segment> rawSegments() {
        if (isRaw()) {
            return List.of(this);
        }
        List<Segment> result = new ArrayList<>();
        collectRaw(this, result);
        return Collections.unmodifiableList(result);
    }

    private static void collectRaw(Segment segment, List<Segment> sink) {
        if (segment.isRaw()) {
            sink.add(segment);
            return;
        }
        for (Segment child : segment.segments) {
            collectRaw(child, sink);
        }
    }

    /**
     * 先序遍历整棵树，返回类型命中 types 的节点
     */
    public List<Segment> recursiveCrawl(Set<String> types) {
        List<Segment> result = new ArrayList<>();
        crawl(this, types, result);
        return result;
    }

    private static void crawl(Segment segment, Set<String> types, List<Segment> sink) {
        if (types.contains(segment.type)) {
            sink.add(segment);
        }
        for (Segment child : segment.segments) {
            crawl(child, types, sink);
        }
    }

    @Override
    public String toString() {
        String loc = positionMarker == null ? "?" : positionMarker.line() + ":" + positionMarker.column();
        return type + "@" + loc + "[" + raw.replace("\n", "\\n") + "]";
    }
}
