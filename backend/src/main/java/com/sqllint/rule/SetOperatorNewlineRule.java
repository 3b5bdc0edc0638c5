package com.sqllint.rule;

import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LintFix;
import com.sqllint.model.LintResult;
import com.sqllint.model.PositionMarker;
import com.sqllint.model.RuleDescriptor;
import com.sqllint.model.Segment;
import com.sqllint.model.SegmentType;
import com.sqllint.reflow.RebreakReflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * L065 集合运算符（UNION / INTERSECT / EXCEPT / MINUS）前后必须换行
 * <p>
 * 换行编辑由 {@link RebreakReflow} 计算，本规则只按锚点位置把编辑划分到运算符之前或之后，
 * 每一侧有编辑时各报告一条结果，先前后后。两条结果都携带完整的编辑集合。
 */
@Component
public class SetOperatorNewlineRule implements LintRule {

    private static final Logger log = LoggerFactory.getLogger(SetOperatorNewlineRule.class);

    private static final String DESCRIPTION_PREFIX = "Set operators should be surrounded by newlines. ";

    private final RebreakReflow reflow;
    private final RuleDescriptor descriptor;

    public SetOperatorNewlineRule(RebreakReflow reflow) {
        this.reflow = reflow;
        this.descriptor = RuleDescriptor.builder()
                .code("L065")
                .name("layout.set_operators")
                .description("Set operators should be surrounded by newlines.")
                .antiPattern("SELECT 'a' AS col UNION ALL\nSELECT 'b' AS col")
                .bestPractice("SELECT 'a' AS col\nUNION ALL\nSELECT 'b' AS col")
                .groups(List.of("all"))
                .fixCompatible(true)
                .crawlTypes(Set.of(SegmentType.SET_OPERATOR))
                .build();
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public EvaluationResult evaluate(Segment target, Segment root, LayoutConfig config) {
        PositionMarker targetPos = target.getPositionMarker();
        if (targetPos == null) {
            return EvaluationResult.failure("集合运算符 '" + target.getRaw() + "' 缺少位置标记");
        }

        List<LintFix> fixes;
        try {
            fixes = reflow.computeRebreakEdits(target, root, config);
        } catch (RuntimeException e) {
            log.warn("计算 {} 附近的换行编辑失败: {}", target, e.getMessage());
            return EvaluationResult.failure("换行计算失败 (" + target.getRaw() + "): " + e.getMessage());
        }
        if (fixes == null || fixes.isEmpty()) {
            return EvaluationResult.empty();
        }

        boolean missingBefore = fixes.stream().anyMatch(f -> isAnchoredBefore(f, targetPos));
        boolean missingAfter = fixes.stream().anyMatch(f -> isAnchoredAfter(f, targetPos));

        List<LintResult> results = new ArrayList<>(2);
        if (missingBefore) {
            results.add(new LintResult(target,
                    DESCRIPTION_PREFIX + "Missing newline before set operator " + target.getRaw() + ".",
                    fixes));
        }
        if (missingAfter) {
            results.add(new LintResult(target,
                    DESCRIPTION_PREFIX + "Missing newline after set operator " + target.getRaw() + ".",
                    fixes));
        }
        return EvaluationResult.success(results);
    }

    // 锚点没有位置标记、或恰好与目标同位置的编辑不归入任何一侧
    static boolean isAnchoredBefore(LintFix fix, PositionMarker targetPos) {
        PositionMarker anchorPos = fix.anchor().getPositionMarker();
        return anchorPos != null && anchorPos.isBefore(targetPos);
    }

    static boolean isAnchoredAfter(LintFix fix, PositionMarker targetPos) {
        PositionMarker anchorPos = fix.anchor().getPositionMarker();
        return anchorPos != null && anchorPos.isAfter(targetPos);
    }
}
