package com.sqllint.model;

/**
 * 语法树节点类型标签
 */
public final class SegmentType {

    public static final String FILE = "file";
    public static final String STATEMENT = "statement";
    public static final String SET_OPERATOR = "set_operator";

    public static final String KEYWORD = "keyword";
    public static final String IDENTIFIER = "identifier";
    public static final String QUOTED_IDENTIFIER = "quoted_identifier";
    public static final String QUOTED_LITERAL = "quoted_literal";
    public static final String NUMERIC_LITERAL = "numeric_literal";
    public static final String SYMBOL = "symbol";
    public static final String COMMA = "comma";
    public static final String START_BRACKET = "start_bracket";
    public static final String END_BRACKET = "end_bracket";
    public static final String STATEMENT_TERMINATOR = "statement_terminator";

    public static final String WHITESPACE = "whitespace";
    public static final String NEWLINE = "newline";
    public static final String INLINE_COMMENT = "inline_comment";
    public static final String BLOCK_COMMENT = "block_comment";

    private SegmentType() {
    }
}
