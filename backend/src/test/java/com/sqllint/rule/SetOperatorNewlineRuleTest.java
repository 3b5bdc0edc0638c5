package com.sqllint.rule;

import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LintFix;
import com.sqllint.model.LintResult;
import com.sqllint.model.PositionMarker;
import com.sqllint.model.Segment;
import com.sqllint.model.SegmentType;
import com.sqllint.parser.SqlLexer;
import com.sqllint.reflow.LineBreakReflow;
import com.sqllint.reflow.ReflowException;
import com.sqllint.rule.LintRule.EvaluationResult;
import com.sqllint.service.FixApplier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SetOperatorNewlineRuleTest {

    private static final String BEFORE = "Set operators should be surrounded by newlines. "
            + "Missing newline before set operator UNION ALL.";
    private static final String AFTER = "Set operators should be surrounded by newlines. "
            + "Missing newline after set operator UNION ALL.";

    private final SqlLexer lexer = new SqlLexer();
    private final SetOperatorNewlineRule rule = new SetOperatorNewlineRule(new LineBreakReflow());

    private EvaluationResult evaluateFirst(String sql) {
        Segment root = lexer.lex(sql);
        Segment op = root.recursiveCrawl(Set.of(SegmentType.SET_OPERATOR)).get(0);
        return rule.evaluate(op, root, LayoutConfig.defaults());
    }

    @Test
    void shouldReportMissingNewlineBefore() {
        EvaluationResult result = evaluateFirst("SELECT 'a' AS col UNION ALL\nSELECT 'b' AS col");

        assertFalse(result.isFailure());
        assertEquals(1, result.results().size());
        LintResult lint = result.results().get(0);
        assertEquals(BEFORE, lint.description());
        assertEquals("UNION ALL", lint.anchor().getRaw());
        assertEquals(1, lint.fixes().size());
    }

    @Test
    void shouldReportMissingNewlineAfter() {
        EvaluationResult result = evaluateFirst("SELECT 'a' AS col\nUNION ALL SELECT 'b' AS col");

        assertEquals(1, result.results().size());
        assertEquals(AFTER, result.results().get(0).description());
    }

    @Test
    void shouldPassWhenSurroundedByNewlines() {
        EvaluationResult result = evaluateFirst("SELECT 'a' AS col\nUNION ALL\nSELECT 'b' AS col");

        assertFalse(result.isFailure());
        assertTrue(result.results().isEmpty());
    }

    @Test
    void shouldReportBothSidesInOrderWithSharedFixes() {
        EvaluationResult result = evaluateFirst("SELECT 'a' AS col UNION ALL SELECT 'b' AS col");

        List<LintResult> results = result.results();
        assertEquals(2, results.size());
        assertEquals(BEFORE, results.get(0).description());
        assertEquals(AFTER, results.get(1).description());
        assertSame(results.get(0).anchor(), results.get(1).anchor());
        assertEquals(2, results.get(0).fixes().size());
        assertEquals(results.get(0).fixes(), results.get(1).fixes());
    }

    @Test
    void shouldUseSourceSpellingInDescription() {
        EvaluationResult result = evaluateFirst("select 1 union select 2");

        assertEquals("Set operators should be surrounded by newlines. Missing newline before set operator union.",
                result.results().get(0).description());
    }

    @Test
    void shouldBeIdempotentAfterApplyingAnyFix() {
        FixApplier applier = new FixApplier();
        for (String sql : List.of(
                "SELECT 'a' AS col UNION ALL\nSELECT 'b' AS col",
                "SELECT 'a' AS col\nUNION ALL SELECT 'b' AS col",
                "SELECT 'a' AS col UNION ALL SELECT 'b' AS col",
                "SELECT a FROM (\n  SELECT 1 EXCEPT(SELECT 2)\n)")) {
            for (LintResult lint : evaluateFirst(sql).results()) {
                String fixed = applier.apply(sql, lint.fixes());

                EvaluationResult again = evaluateFirst(fixed);
                assertTrue(again.results().isEmpty(), () -> "still failing after fix: " + fixed);
            }
        }
    }

    @Test
    void shouldExcludeEditAnchoredAtTargetItself() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2");
        Segment op = root.recursiveCrawl(Set.of(SegmentType.SET_OPERATOR)).get(0);
        Segment sameSpot = Segment.leaf(SegmentType.WHITESPACE, " ", op.getPositionMarker());
        Segment unpositioned = Segment.generated(SegmentType.WHITESPACE, " ");

        SetOperatorNewlineRule stubbed = new SetOperatorNewlineRule((target, tree, config) -> List.of(
                LintFix.delete(sameSpot),
                LintFix.delete(unpositioned)));

        EvaluationResult result = stubbed.evaluate(op, root, LayoutConfig.defaults());
        assertFalse(result.isFailure());
        assertTrue(result.results().isEmpty());
    }

    @Test
    void shouldPlaceEachEditOnExactlyOneSide() {
        PositionMarker target = new PositionMarker(10, 1, 11);
        LintFix before = LintFix.delete(Segment.leaf(SegmentType.WHITESPACE, " ", new PositionMarker(9, 1, 10)));
        LintFix after = LintFix.delete(Segment.leaf(SegmentType.WHITESPACE, " ", new PositionMarker(15, 1, 16)));
        LintFix at = LintFix.delete(Segment.leaf(SegmentType.WHITESPACE, " ", target));

        assertTrue(SetOperatorNewlineRule.isAnchoredBefore(before, target));
        assertFalse(SetOperatorNewlineRule.isAnchoredAfter(before, target));
        assertTrue(SetOperatorNewlineRule.isAnchoredAfter(after, target));
        assertFalse(SetOperatorNewlineRule.isAnchoredBefore(after, target));
        assertFalse(SetOperatorNewlineRule.isAnchoredBefore(at, target));
        assertFalse(SetOperatorNewlineRule.isAnchoredAfter(at, target));
    }

    @Test
    void shouldAttachFullEditSetEvenWhenOnlyOneSideIsReported() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2");
        Segment op = root.recursiveCrawl(Set.of(SegmentType.SET_OPERATOR)).get(0);
        LintFix before = LintFix.delete(root.rawSegments().get(3));
        LintFix atTarget = LintFix.delete(Segment.leaf(SegmentType.WHITESPACE, "", op.getPositionMarker()));

        SetOperatorNewlineRule stubbed = new SetOperatorNewlineRule((target, tree, config) -> List.of(before, atTarget));

        List<LintResult> results = stubbed.evaluate(op, root, LayoutConfig.defaults()).results();
        assertEquals(1, results.size());
        assertEquals(List.of(before, atTarget), results.get(0).fixes());
    }

    @Test
    void shouldFailWhenTargetHasNoPositionMarker() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2");
        Segment unpositioned = Segment.generated(SegmentType.SET_OPERATOR, "UNION");

        EvaluationResult result = rule.evaluate(unpositioned, root, LayoutConfig.defaults());

        assertTrue(result.isFailure());
        assertTrue(result.results().isEmpty());
        assertTrue(result.error().contains("UNION"));
    }

    @Test
    void shouldFailWhenReflowFails() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2");
        Segment op = root.recursiveCrawl(Set.of(SegmentType.SET_OPERATOR)).get(0);
        SetOperatorNewlineRule broken = new SetOperatorNewlineRule((target, tree, config) -> {
            throw new ReflowException("boom");
        });

        EvaluationResult result = broken.evaluate(op, root, LayoutConfig.defaults());

        assertTrue(result.isFailure());
        assertTrue(result.error().contains("boom"));
    }

    @Test
    void shouldDescribeItself() {
        assertEquals("L065", rule.code());
        assertEquals(Set.of(SegmentType.SET_OPERATOR), rule.crawlTypes());
        assertTrue(rule.descriptor().isFixCompatible());
        assertEquals(List.of("all"), rule.descriptor().getGroups());
    }
}
