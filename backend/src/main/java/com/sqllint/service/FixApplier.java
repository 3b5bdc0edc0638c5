package com.sqllint.service;

import com.sqllint.model.LintFix;
import com.sqllint.model.LintFix.EditType;
import com.sqllint.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按锚点偏移把修复应用到源 SQL 文本
 * <p>
 * 同一编辑（类型、锚点位置、新内容均相同）只应用一次；
 * 与前面编辑区间重叠的编辑会被丢弃。
 */
@Component
public class FixApplier {

    private static final Logger log = LoggerFactory.getLogger(FixApplier.class);

    public String apply(String source, List<LintFix> fixes) {
        List<TextEdit> edits = deduplicate(fixes);
        if (edits.isEmpty()) {
            return source;
        }

        edits.sort(Comparator.comparingInt(TextEdit::start).thenComparingInt(TextEdit::end));
        List<TextEdit> accepted = new ArrayList<>();
        int lastEnd = -1;
        for (TextEdit edit : edits) {
            if (edit.start() < lastEnd || (edit.start() == lastEnd && edit.isInsert() && !accepted.isEmpty()
                    && accepted.get(accepted.size() - 1).isInsert())) {
                log.warn("丢弃与前一编辑冲突的修复: [{}, {}) -> '{}'", edit.start(), edit.end(), edit.text());
                continue;
            }
            accepted.add(edit);
            lastEnd = edit.end();
        }

        StringBuilder sb = new StringBuilder(source);
        for (int i = accepted.size() - 1; i >= 0; i--) {
            TextEdit edit = accepted.get(i);
            sb.replace(edit.start(), edit.end(), edit.text());
        }
        return sb.toString();
    }

    private List<TextEdit> deduplicate(List<LintFix> fixes) {
        Map<TextEdit, TextEdit> unique = new LinkedHashMap<>();
        for (LintFix fix : fixes) {
            Segment anchor = fix.anchor();
            if (anchor.getPositionMarker() == null) {
                log.warn("修复锚点 {} 没有位置标记，跳过", anchor);
                continue;
            }
            TextEdit edit = toTextEdit(fix);
            unique.putIfAbsent(edit, edit);
        }
        return new ArrayList<>(unique.values());
    }

    private TextEdit toTextEdit(LintFix fix) {
        int start = fix.anchor().getPositionMarker().workingLoc();
        int end = fix.anchor().endOffset();
        EditType type = fix.editType();
        return switch (type) {
            case REPLACE -> new TextEdit(start, end, fix.editRaw());
            case DELETE -> new TextEdit(start, end, "");
            case CREATE_BEFORE -> new TextEdit(start, start, fix.editRaw());
            case CREATE_AFTER -> new TextEdit(end, end, fix.editRaw());
        };
    }

    record TextEdit(int start, int end, String text) {
        boolean isInsert() {
            return start == end;
        }
    }
}
