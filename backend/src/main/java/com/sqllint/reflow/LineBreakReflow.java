package com.sqllint.reflow;

import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LinePosition;
import com.sqllint.model.LintFix;
import com.sqllint.model.Segment;
import com.sqllint.model.SegmentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于叶子节点序列的换行重排实现
 * <p>
 * 目标前后的空白区间（whitespace / newline 组成）若不含换行，则生成一个编辑：
 * 有空白时用「换行 + 缩进」替换该空白，没有空白时在相邻节点之后（前）插入。
 * 因此编辑锚点总是严格位于目标之前或之后。缩进取目标所在源行的行首空白。
 */
@Component
public class LineBreakReflow implements RebreakReflow {

    private static final String DEFAULT_NEWLINE = "\n";

    @Override
    public List<LintFix> computeRebreakEdits(Segment target, Segment root, LayoutConfig config) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(root, "root");
        LayoutConfig layout = config == null ? LayoutConfig.defaults() : config;

        Optional<LinePosition> position = layout.linePositionOf(target.getType());
        if (position.isEmpty()) {
            return List.of();
        }

        List<Segment> raws = root.rawSegments();
        List<Segment> targetRaws = target.rawSegments();
        int start = indexOf(raws, targetRaws.get(0));
        if (start < 0) {
            throw new ReflowException("目标节点不在语法树中: " + target);
        }
        int end = start + targetRaws.size() - 1;

        String newline = detectNewline(raws);
        String indent = lineIndent(raws, start);

        List<LintFix> fixes = new ArrayList<>(2);
        if (position.get().requiresBreakBefore()) {
            breakBefore(raws, start, newline, indent).ifPresent(fixes::add);
        }
        if (position.get().requiresBreakAfter()) {
            breakAfter(raws, end, newline, indent).ifPresent(fixes::add);
        }
        return fixes;
    }

    private Optional<LintFix> breakBefore(List<Segment> raws, int start, String newline, String indent) {
        Segment whitespace = null;
        int i = start - 1;
        while (i >= 0 && raws.get(i).isWhitespace()) {
            if (raws.get(i).isNewline()) {
                return Optional.empty();
            }
            whitespace = raws.get(i);
            i--;
        }
        if (i < 0) {
            return Optional.empty();
        }
        List<Segment> edit = breakEdit(newline, indent);
        return Optional.of(whitespace != null
                ? LintFix.replace(whitespace, edit)
                : LintFix.createAfter(raws.get(i), edit));
    }

    private Optional<LintFix> breakAfter(List<Segment> raws, int end, String newline, String indent) {
        Segment whitespace = null;
        int i = end + 1;
        while (i < raws.size() && raws.get(i).isWhitespace()) {
            if (raws.get(i).isNewline()) {
                return Optional.empty();
            }
            if (whitespace == null) {
                whitespace = raws.get(i);
            }
            i++;
        }
        if (i >= raws.size()) {
            return Optional.empty();
        }
        List<Segment> edit = breakEdit(newline, indent);
        return Optional.of(whitespace != null
                ? LintFix.replace(whitespace, edit)
                : LintFix.createBefore(raws.get(i), edit));
    }

    private static List<Segment> breakEdit(String newline, String indent) {
        if (indent.isEmpty()) {
            return List.of(Segment.generated(SegmentType.NEWLINE, newline));
        }
        return List.of(
                Segment.generated(SegmentType.NEWLINE, newline),
                Segment.generated(SegmentType.WHITESPACE, indent));
    }

    private static String lineIndent(List<Segment> raws, int start) {
        int i = start - 1;
        while (i >= 0 && !raws.get(i).isNewline()) {
            i--;
        }
        int lineStart = i + 1;
        if (lineStart < start && raws.get(lineStart).isType(SegmentType.WHITESPACE)) {
            return raws.get(lineStart).getRaw();
        }
        return "";
    }

    private static String detectNewline(List<Segment> raws) {
        for (Segment raw : raws) {
            if (raw.isNewline()) {
                return raw.getRaw();
            }
        }
        return DEFAULT_NEWLINE;
    }

    private static int indexOf(List<Segment> raws, Segment segment) {
        for (int i = 0; i < raws.size(); i++) {
            if (raws.get(i) == segment) {
                return i;
            }
        }
        return -1;
    }
}
