package com.sqllint.parser;

import com.sqllint.model.PositionMarker;
import com.sqllint.model.Segment;
import com.sqllint.model.SegmentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * SQL 词法解析器
 * <p>
 * 将 SQL 文本切分为带位置标记的叶子节点，并组装成 file -> statement -> token 的语法树：
 * <ul>
 * <li>分号拆分语句，语句之间的空白、注释和分号挂在 file 节点下</li>
 * <li>UNION / INTERSECT / EXCEPT（可带 ALL、DISTINCT）以及 MINUS 组合为 set_operator 节点</li>
 * <li>未闭合的字符串和块注释一直延伸到文本末尾</li>
 * </ul>
 */
@Component
public class SqlLexer {

    private static final Logger log = LoggerFactory.getLogger(SqlLexer.class);

    private static final Set<String> KEYWORDS = Set.of(
            "select", "from", "where", "and", "or", "not", "in",
            "insert", "into", "values", "update", "set", "delete",
            "join", "left", "right", "inner", "outer", "full", "cross", "on",
            "group", "by", "order", "having", "limit", "offset",
            "as", "is", "null", "like", "between", "exists",
            "union", "intersect", "except", "minus", "all", "distinct",
            "case", "when", "then", "else", "end", "with",
            "create", "alter", "drop", "table", "view", "index",
            "asc", "desc", "true", "false");

    private static final Set<String> SET_OPERATOR_HEADS = Set.of("union", "intersect", "except");
    private static final Set<String> SET_OPERATOR_QUALIFIERS = Set.of("all", "distinct");
    private static final String OPERATOR_CHARS = "<>=!|:&+-*/%^~";

    /**
     * 解析 SQL 文本，返回根节点（类型为 file）
     */
    public Segment lex(String sql) {
        String text = sql == null ? "" : sql;
        if (text.isEmpty()) {
            return Segment.leaf(SegmentType.FILE, "", new PositionMarker(0, 1, 1));
        }

        List<Segment> tokens = tokenize(text);
        List<Segment> grouped = groupSetOperators(tokens);
        Segment file = groupStatements(grouped);
        log.debug("词法解析完成: {} 个 token, {} 个顶层节点", tokens.size(), file.getSegments().size());
        return file;
    }

    private List<Segment> tokenize(String sql) {
        List<Segment> tokens = new ArrayList<>();
        int len = sql.length();
        int i = 0;
        int line = 1;
        int column = 1;

        while (i < len) {
            char c = sql.charAt(i);
            char next = (i + 1 < len) ? sql.charAt(i + 1) : 0;
            int end;
            String type;

            if (c == '\n' || (c == '\r' && next == '\n')) {
                end = c == '\n' ? i + 1 : i + 2;
                type = SegmentType.NEWLINE;
            } else if (isInlineWhitespace(sql, i)) {
                end = i + 1;
                while (end < len && isInlineWhitespace(sql, end)) {
                    end++;
                }
                type = SegmentType.WHITESPACE;
            } else if ((c == '-' && next == '-') || c == '#') {
                end = sql.indexOf('\n', i);
                if (end < 0) {
                    end = len;
                } else if (end > i && sql.charAt(end - 1) == '\r') {
                    end--;
                }
                type = SegmentType.INLINE_COMMENT;
            } else if (c == '/' && next == '*') {
                int close = sql.indexOf("*/", i + 2);
                end = close < 0 ? len : close + 2;
                type = SegmentType.BLOCK_COMMENT;
            } else if (c == '\'') {
                end = scanQuoted(sql, i, '\'');
                type = SegmentType.QUOTED_LITERAL;
            } else if (c == '"' || c == '`') {
                end = scanQuoted(sql, i, c);
                type = SegmentType.QUOTED_IDENTIFIER;
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(next))) {
                end = scanNumber(sql, i);
                type = SegmentType.NUMERIC_LITERAL;
            } else if (Character.isLetter(c) || c == '_') {
                end = i + 1;
                while (end < len && isWordPart(sql.charAt(end))) {
                    end++;
                }
                String word = sql.substring(i, end).toLowerCase(Locale.ROOT);
                type = KEYWORDS.contains(word) ? SegmentType.KEYWORD : SegmentType.IDENTIFIER;
            } else if (c == '(') {
                end = i + 1;
                type = SegmentType.START_BRACKET;
            } else if (c == ')') {
                end = i + 1;
                type = SegmentType.END_BRACKET;
            } else if (c == ',') {
                end = i + 1;
                type = SegmentType.COMMA;
            } else if (c == ';') {
                end = i + 1;
                type = SegmentType.STATEMENT_TERMINATOR;
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                end = i + 1;
                // 注释起始符不并入运算符
                while (end < len && OPERATOR_CHARS.indexOf(sql.charAt(end)) >= 0
                        && !startsComment(sql, end)) {
                    end++;
                }
                type = SegmentType.SYMBOL;
            } else {
                end = i + 1;
                type = SegmentType.SYMBOL;
            }

            String raw = sql.substring(i, end);
            tokens.add(Segment.leaf(type, raw, new PositionMarker(i, line, column)));

            for (int k = 0; k < raw.length(); k++) {
                if (raw.charAt(k) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            i = end;
        }
        return tokens;
    }

    /**
     * 把集合运算关键字（及其后跟的 ALL / DISTINCT）合并为 set_operator 节点；
     * 关键字之间只允许行内空白和块注释，跨行的 ALL 不并入
     */
    private List<Segment> groupSetOperators(List<Segment> tokens) {
        List<Segment> result = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            Segment token = tokens.get(i);
            String word = token.isType(SegmentType.KEYWORD) ? token.getRaw().toLowerCase(Locale.ROOT) : "";

            if ("minus".equals(word)) {
                result.add(Segment.composite(SegmentType.SET_OPERATOR, List.of(token)));
                i++;
                continue;
            }
            if (!SET_OPERATOR_HEADS.contains(word)) {
                result.add(token);
                i++;
                continue;
            }

            int j = i + 1;
            while (j < tokens.size() && isInlineGap(tokens.get(j))) {
                j++;
            }
            if (j < tokens.size() && tokens.get(j).isType(SegmentType.KEYWORD)
                    && SET_OPERATOR_QUALIFIERS.contains(tokens.get(j).getRaw().toLowerCase(Locale.ROOT))) {
                result.add(Segment.composite(SegmentType.SET_OPERATOR, tokens.subList(i, j + 1)));
                i = j + 1;
            } else {
                result.add(Segment.composite(SegmentType.SET_OPERATOR, List.of(token)));
                i++;
            }
        }
        return result;
    }

    /**
     * 按分号拆分语句，语句节点只覆盖首个到末个非空白、非注释 token
     */
    private Segment groupStatements(List<Segment> tokens) {
        List<Segment> fileChildren = new ArrayList<>();
        List<Segment> pending = new ArrayList<>();
        for (Segment token : tokens) {
            if (token.isType(SegmentType.STATEMENT_TERMINATOR)) {
                flushStatement(pending, fileChildren);
                fileChildren.add(token);
            } else {
                pending.add(token);
            }
        }
        flushStatement(pending, fileChildren);
        return Segment.composite(SegmentType.FILE, fileChildren);
    }

    private void flushStatement(List<Segment> pending, List<Segment> sink) {
        int first = -1;
        int last = -1;
        for (int k = 0; k < pending.size(); k++) {
            if (pending.get(k).isCode()) {
                if (first < 0) {
                    first = k;
                }
                last = k;
            }
        }
        if (first < 0) {
            sink.addAll(pending);
        } else {
            sink.addAll(pending.subList(0, first));
            sink.add(Segment.composite(SegmentType.STATEMENT, pending.subList(first, last + 1)));
            sink.addAll(pending.subList(last + 1, pending.size()));
        }
        pending.clear();
    }

    private static boolean isInlineWhitespace(String sql, int index) {
        char c = sql.charAt(index);
        if (c == '\r') {
            return index + 1 >= sql.length() || sql.charAt(index + 1) != '\n';
        }
        return c == ' ' || c == '\t' || c == '\f';
    }

    private static boolean isInlineGap(Segment token) {
        return token.isType(SegmentType.WHITESPACE)
                || (token.isType(SegmentType.BLOCK_COMMENT) && token.getRaw().indexOf('\n') < 0);
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean startsComment(String sql, int index) {
        char c = sql.charAt(index);
        char next = (index + 1 < sql.length()) ? sql.charAt(index + 1) : 0;
        return (c == '-' && next == '-') || (c == '/' && next == '*');
    }

    private static int scanQuoted(String sql, int start, char quote) {
        int j = start + 1;
        while (j < sql.length()) {
            if (sql.charAt(j) == quote) {
                // 连续两个引号视为转义
                if (j + 1 < sql.length() && sql.charAt(j + 1) == quote) {
                    j += 2;
                    continue;
                }
                return j + 1;
            }
            j++;
        }
        return sql.length();
    }

    private static int scanNumber(String sql, int start) {
        int j = start;
        while (j < sql.length() && (Character.isDigit(sql.charAt(j)) || sql.charAt(j) == '.')) {
            j++;
        }
        if (j < sql.length() && (sql.charAt(j) == 'e' || sql.charAt(j) == 'E')) {
            int k = j + 1;
            if (k < sql.length() && (sql.charAt(k) == '+' || sql.charAt(k) == '-')) {
                k++;
            }
            if (k < sql.length() && Character.isDigit(sql.charAt(k))) {
                while (k < sql.length() && Character.isDigit(sql.charAt(k))) {
                    k++;
                }
                j = k;
            }
        }
        return j;
    }
}
