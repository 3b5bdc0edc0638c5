package com.sqllint.controller;

import com.sqllint.model.FixReport;
import com.sqllint.model.LintReport;
import com.sqllint.model.RuleDescriptor;
import com.sqllint.service.LintService;
import com.sqllint.service.ReportExportService;
import com.sqllint.service.RuleService;
import com.sqllint.util.SqlTextDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SQL 布局检查 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class LintController {

    private static final Logger log = LoggerFactory.getLogger(LintController.class);
    private static final String DEFAULT_FILE_NAME = "inline.sql";

    private final LintService lintService;
    private final RuleService ruleService;
    private final ReportExportService reportExportService;

    public LintController(LintService lintService, RuleService ruleService, ReportExportService reportExportService) {
        this.lintService = lintService;
        this.ruleService = ruleService;
        this.reportExportService = reportExportService;
    }

    /**
     * 检查请求体中的 SQL 文本
     */
    @PostMapping("/lint")
    public ResponseEntity<?> lint(@RequestBody Map<String, String> request) {
        String sql = request.get("sql");
        if (sql == null || sql.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供 SQL 文本 (sql)"));
        }
        String fileName = request.getOrDefault("fileName", DEFAULT_FILE_NAME);

        try {
            log.info("收到检查请求: {}, 长度: {}", fileName, sql.length());
            return ResponseEntity.ok(lintService.lintSqlContent(sql, fileName));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("检查失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "检查过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 上传 SQL 脚本文件进行检查
     */
    @PostMapping("/lint/sql")
    public ResponseEntity<?> lintFile(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传文件"));
        }

        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase().endsWith(".sql")) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传 .sql 格式的 SQL 脚本文件"));
        }

        try {
            byte[] bytes = file.getBytes();
            var decoded = SqlTextDecoder.decode(bytes);
            log.info("收到 SQL 脚本检查请求: {}, 大小: {} bytes, 编码: {}", filename, bytes.length, decoded.charsetName());

            List<String> notices = new ArrayList<>();
            String decodeNotice = decoded.buildNotice(filename);
            if (decodeNotice != null) {
                notices.add(decodeNotice);
            }
            return ResponseEntity.ok(lintService.lintSqlContent(decoded.text(), filename, notices));
        } catch (Exception e) {
            log.error("SQL 脚本检查失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "检查过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 自动修复请求体中的 SQL 文本
     */
    @PostMapping("/fix")
    public ResponseEntity<?> fix(@RequestBody Map<String, String> request) {
        String sql = request.get("sql");
        if (sql == null || sql.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供 SQL 文本 (sql)"));
        }

        try {
            FixReport report = lintService.fixSqlContent(sql, request.getOrDefault("fileName", DEFAULT_FILE_NAME));
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("修复失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "修复过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 获取当前启用的规则
     */
    @GetMapping("/rules")
    public ResponseEntity<List<RuleDescriptor>> getAllRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @PostMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdown(@RequestBody(required = false) LintReport report) {
        return exportReport("markdown", report);
    }

    @PostMapping("/report/export/json")
    public ResponseEntity<?> exportJson(@RequestBody(required = false) LintReport report) {
        return exportReport("json", report);
    }

    /**
     * 直接下载最近一次检查的 Markdown 报告
     */
    @GetMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdownLatest() {
        return exportReport("markdown", null);
    }

    /**
     * 直接下载最近一次检查的 JSON 报告
     */
    @GetMapping("/report/export/json")
    public ResponseEntity<?> exportJsonLatest() {
        return exportReport("json", null);
    }

    private ResponseEntity<?> exportReport(String format, LintReport requestReport) {
        try {
            LintReport report = requestReport != null && requestReport.getLintTime() != null
                    ? requestReport
                    : lintService.getLastReport();
            if (report == null) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(Map.of("error", "暂无可导出的检查报告，请先执行一次检查"));
            }

            ReportExportService.ExportPayload payload = "markdown".equals(format)
                    ? reportExportService.exportMarkdown(report)
                    : reportExportService.exportJson(report);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentLength(payload.content().length);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (Exception e) {
            log.error("导出报告失败, format={}", format, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "导出失败: " + e.getMessage()));
        }
    }
}
