package com.sqllint.reflow;

import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LinePosition;
import com.sqllint.model.LintFix;
import com.sqllint.model.LintFix.EditType;
import com.sqllint.model.Segment;
import com.sqllint.model.SegmentType;
import com.sqllint.parser.SqlLexer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LineBreakReflowTest {

    private final SqlLexer lexer = new SqlLexer();
    private final LineBreakReflow reflow = new LineBreakReflow();

    private static Segment firstSetOperator(Segment root) {
        return root.recursiveCrawl(Set.of(SegmentType.SET_OPERATOR)).get(0);
    }

    @Test
    void shouldReplaceWhitespaceOnBothSidesWhenInline() {
        Segment root = lexer.lex("SELECT 'a' AS col UNION ALL SELECT 'b' AS col");
        Segment op = firstSetOperator(root);

        List<LintFix> fixes = reflow.computeRebreakEdits(op, root, LayoutConfig.defaults());

        assertEquals(2, fixes.size());
        assertEquals(EditType.REPLACE, fixes.get(0).editType());
        assertEquals(17, fixes.get(0).anchor().getPositionMarker().workingLoc());
        assertEquals("\n", fixes.get(0).editRaw());
        assertEquals(EditType.REPLACE, fixes.get(1).editType());
        assertEquals(27, fixes.get(1).anchor().getPositionMarker().workingLoc());
    }

    @Test
    void shouldReturnNothingWhenAlreadyOnOwnLine() {
        Segment root = lexer.lex("SELECT 'a' AS col\nUNION ALL\nSELECT 'b' AS col");

        assertTrue(reflow.computeRebreakEdits(firstSetOperator(root), root, LayoutConfig.defaults()).isEmpty());
    }

    @Test
    void shouldTreatTrailingSpacesBeforeNewlineAsConformant() {
        Segment root = lexer.lex("SELECT 1   \n   UNION  \n SELECT 2");

        assertTrue(reflow.computeRebreakEdits(firstSetOperator(root), root, LayoutConfig.defaults()).isEmpty());
    }

    @Test
    void shouldInsertAroundNeighboursWhenNoWhitespace() {
        Segment root = lexer.lex("SELECT (1)UNION(SELECT 2)");
        Segment op = firstSetOperator(root);

        List<LintFix> fixes = reflow.computeRebreakEdits(op, root, LayoutConfig.defaults());

        assertEquals(2, fixes.size());
        assertEquals(EditType.CREATE_AFTER, fixes.get(0).editType());
        assertEquals(")", fixes.get(0).anchor().getRaw());
        assertEquals(EditType.CREATE_BEFORE, fixes.get(1).editType());
        assertEquals("(", fixes.get(1).anchor().getRaw());
    }

    @Test
    void shouldCarryLineIndentIntoBreak() {
        Segment root = lexer.lex("SELECT a FROM (\n    SELECT 1 UNION SELECT 2\n)");

        List<LintFix> fixes = reflow.computeRebreakEdits(firstSetOperator(root), root, LayoutConfig.defaults());

        assertEquals(2, fixes.size());
        assertEquals("\n    ", fixes.get(0).editRaw());
        assertEquals("\n    ", fixes.get(1).editRaw());
    }

    @Test
    void shouldReuseNewlineStyleOfFile() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2\r\nSELECT 3");

        List<LintFix> fixes = reflow.computeRebreakEdits(firstSetOperator(root), root, LayoutConfig.defaults());

        assertEquals("\r\n", fixes.get(0).editRaw());
    }

    @Test
    void shouldHonourLeadingAndTrailingPositions() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2");
        Segment op = firstSetOperator(root);

        List<LintFix> leading = reflow.computeRebreakEdits(op, root,
                new LayoutConfig(Map.of(SegmentType.SET_OPERATOR, LinePosition.LEADING)));
        List<LintFix> trailing = reflow.computeRebreakEdits(op, root,
                new LayoutConfig(Map.of(SegmentType.SET_OPERATOR, LinePosition.TRAILING)));

        assertEquals(1, leading.size());
        assertTrue(leading.get(0).anchor().getPositionMarker().isBefore(op.getPositionMarker()));
        assertEquals(1, trailing.size());
        assertTrue(trailing.get(0).anchor().getPositionMarker().isAfter(op.getPositionMarker()));
    }

    @Test
    void shouldNotBreakAtFileBoundaries() {
        Segment root = lexer.lex("UNION");

        assertTrue(reflow.computeRebreakEdits(firstSetOperator(root), root, LayoutConfig.defaults()).isEmpty());
    }

    @Test
    void shouldIgnoreTypesWithoutConfiguredPosition() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2");

        assertTrue(reflow.computeRebreakEdits(firstSetOperator(root), root, new LayoutConfig(Map.of())).isEmpty());
    }

    @Test
    void shouldFailWhenTargetIsNotInTree() {
        Segment root = lexer.lex("SELECT 1 UNION SELECT 2");
        Segment foreign = firstSetOperator(lexer.lex("SELECT 3 UNION SELECT 4"));

        assertThrows(ReflowException.class,
                () -> reflow.computeRebreakEdits(foreign, root, LayoutConfig.defaults()));
    }
}
