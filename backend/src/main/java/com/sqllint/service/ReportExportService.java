package com.sqllint.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqllint.model.LintReport;
import com.sqllint.model.LintViolation;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 检查报告导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportMarkdown(LintReport report) {
        byte[] content = buildMarkdown(report).getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                "sql-lint-report-" + formatFileTs(report.getLintTime()) + ".md",
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(LintReport report) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            return new ExportPayload(
                    "sql-lint-report-" + formatFileTs(report.getLintTime()) + ".json",
                    "application/json;charset=UTF-8",
                    content);
        } catch (Exception e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    String buildMarkdown(LintReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# SQL 布局检查报告\n\n");
        md.append("**检查时间:** ").append(report.getLintTime() != null ? report.getLintTime() : LocalDateTime.now()).append("\n");
        md.append("**文件:** `").append(escapeInlineCode(report.getFileName())).append("`\n\n");

        if (report.isLimitReached()) {
            md.append("> **警告：检查结果被截断**，仅保留前 ").append(report.getTotalViolations()).append(" 条违规。\n\n");
        }

        md.append("## 统计摘要\n");
        md.append("- **SQL 语句总数:** ").append(report.getTotalStatements()).append("\n");
        md.append("- **违规总数:** ").append(report.getTotalViolations())
                .append(" (可自动修复: ").append(report.getFixableCount()).append(")\n\n");

        List<String> notices = orEmpty(report.getNotices());
        if (!notices.isEmpty()) {
            md.append("## 提示\n\n");
            notices.forEach(n -> md.append("- ").append(n).append("\n"));
            md.append("\n");
        }

        List<LintViolation> violations = orEmpty(report.getViolations());
        if (violations.isEmpty()) {
            md.append("**所有 SQL 均符合布局规范**\n");
        } else {
            md.append("## 违规详情\n\n");
            for (Map.Entry<String, List<LintViolation>> entry : groupByRule(violations).entrySet()) {
                md.append("### ").append(entry.getKey()).append(" (")
                        .append(entry.getValue().size()).append(" 项)\n\n");
                for (LintViolation v : entry.getValue()) {
                    md.append("- 行 ").append(v.getLine()).append(", 列 ").append(v.getColumn())
                            .append(": ").append(v.getDescription());
                    if (v.isFixable()) {
                        md.append(" *(可修复)*");
                    }
                    md.append("\n");
                }
                md.append("\n");
            }
        }

        List<String> failures = orEmpty(report.getRuleFailures());
        if (!failures.isEmpty()) {
            md.append("## 规则执行失败\n\n");
            failures.forEach(f -> md.append("- `").append(escapeInlineCode(f)).append("`\n"));
        }
        return md.toString();
    }

    private Map<String, List<LintViolation>> groupByRule(List<LintViolation> violations) {
        Map<String, List<LintViolation>> grouped = new TreeMap<>();
        for (LintViolation v : violations) {
            String key = v.getRuleCode() + " " + (v.getRuleName() == null ? "" : v.getRuleName());
            grouped.computeIfAbsent(key.trim(), k -> new ArrayList<>()).add(v);
        }
        return grouped;
    }

    private String escapeInlineCode(String text) {
        return text == null ? "" : text.replace("`", "\\`");
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private String formatFileTs(LocalDateTime time) {
        LocalDateTime effective = time != null ? time : LocalDateTime.now();
        return effective.format(FILE_TS);
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
