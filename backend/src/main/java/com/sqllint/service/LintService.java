package com.sqllint.service;

import com.sqllint.config.LintProperties;
import com.sqllint.model.FixReport;
import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LintFix;
import com.sqllint.model.LintReport;
import com.sqllint.model.LintViolation;
import com.sqllint.model.PositionMarker;
import com.sqllint.model.Segment;
import com.sqllint.model.SegmentType;
import com.sqllint.parser.SqlLexer;
import com.sqllint.service.RuleService.LintOutcome;
import com.sqllint.service.RuleService.RuleFailure;
import com.sqllint.service.RuleService.RuleFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SQL 检查与自动修复服务
 */
@Service
public class LintService {

    private static final Logger log = LoggerFactory.getLogger(LintService.class);

    private final SqlLexer lexer;
    private final RuleService ruleService;
    private final FixApplier fixApplier;
    private final LintProperties properties;
    private final AtomicReference<LintReport> lastReport = new AtomicReference<>();

    public LintService(SqlLexer lexer, RuleService ruleService, FixApplier fixApplier, LintProperties properties) {
        this.lexer = lexer;
        this.ruleService = ruleService;
        this.fixApplier = fixApplier;
        this.properties = properties;
    }

    public LintReport lintSqlContent(String sqlContent, String fileName) {
        return lintSqlContent(sqlContent, fileName, Collections.emptyList());
    }

    /**
     * 检查 SQL 文本
     *
     * @param sqlContent     SQL 脚本文本
     * @param fileName       文件名（用于报告展示）
     * @param initialNotices 调用方已有的提示信息
     * @return 检查报告
     */
    public LintReport lintSqlContent(String sqlContent, String fileName, List<String> initialNotices) {
        if (sqlContent == null) {
            throw new IllegalArgumentException("SQL 内容不能为空");
        }
        log.info("开始检查 SQL: {}", fileName);
        List<String> notices = new ArrayList<>();
        if (initialNotices != null) {
            notices.addAll(initialNotices);
        }

        // 1. 词法解析
        Segment root = lexer.lex(sqlContent);
        int statements = root.recursiveCrawl(Set.of(SegmentType.STATEMENT)).size();

        // 2. 执行规则检查
        LintOutcome outcome = ruleService.lintTree(root, layoutConfig());
        int maxViolations = properties.getMaxViolations();
        List<LintViolation> violations = new ArrayList<>();
        boolean limitReached = false;
        for (RuleFinding finding : outcome.findings()) {
            if (violations.size() >= maxViolations) {
                limitReached = true;
                break;
            }
            violations.add(toViolation(finding));
        }
        if (limitReached) {
            log.warn("违规数量达到上限 {}，截断后续结果", maxViolations);
        } else {
            log.info("{} 中发现 {} 条违规", fileName, violations.size());
        }

        List<String> failures = outcome.failures().stream()
                .map(LintService::describeFailure)
                .toList();
        if (!failures.isEmpty()) {
            notices.add("有 " + failures.size() + " 处规则执行失败，结果可能不完整");
        }

        // 3. 构建报告
        long fixableCount = violations.stream().filter(LintViolation::isFixable).count();
        LintReport report = LintReport.builder()
                .fileName(fileName)
                .lintTime(LocalDateTime.now())
                .totalStatements(statements)
                .totalViolations(violations.size())
                .fixableCount((int) fixableCount)
                .violations(violations)
                .ruleFailures(failures)
                .notices(List.copyOf(notices))
                .limitReached(limitReached)
                .build();
        lastReport.set(report);
        return report;
    }

    /**
     * 反复执行 检查 -> 应用修复，直到没有可修复项或达到轮数上限
     */
    public FixReport fixSqlContent(String sqlContent, String fileName) {
        if (sqlContent == null) {
            throw new IllegalArgumentException("SQL 内容不能为空");
        }
        LayoutConfig config = layoutConfig();
        int runawayLimit = properties.getFix().getRunawayLimit();

        String current = sqlContent;
        LintOutcome outcome = ruleService.lintTree(lexer.lex(current), config);
        int violationsBefore = outcome.findings().size();
        int passes = 0;
        while (outcome.hasFixes() && passes < runawayLimit) {
            List<LintFix> fixes = outcome.findings().stream()
                    .flatMap(f -> f.result().fixes().stream())
                    .toList();
            String fixed = fixApplier.apply(current, fixes);
            passes++;
            if (fixed.equals(current)) {
                log.warn("第 {} 轮修复未改变 SQL，停止修复", passes);
                break;
            }
            current = fixed;
            outcome = ruleService.lintTree(lexer.lex(current), config);
        }

        boolean runaway = outcome.hasFixes() && passes >= runawayLimit;
        if (runaway) {
            log.warn("{} 修复达到轮数上限 {}，仍有 {} 条违规", fileName, runawayLimit, outcome.findings().size());
        } else {
            log.info("{} 修复完成: {} 轮, 违规 {} -> {}", fileName, passes, violationsBefore, outcome.findings().size());
        }

        return FixReport.builder()
                .fileName(fileName)
                .originalSql(sqlContent)
                .fixedSql(current)
                .passes(passes)
                .violationsBefore(violationsBefore)
                .violationsAfter(outcome.findings().size())
                .runawayLimitReached(runaway)
                .build();
    }

    public LintReport getLastReport() {
        return lastReport.get();
    }

    private LayoutConfig layoutConfig() {
        return properties.toLayoutConfig();
    }

    private static LintViolation toViolation(RuleFinding finding) {
        Segment anchor = finding.result().anchor();
        PositionMarker pos = anchor.getPositionMarker();
        return LintViolation.builder()
                .ruleCode(finding.rule().getCode())
                .ruleName(finding.rule().getName())
                .description(finding.result().description())
                .line(pos == null ? 0 : pos.line())
                .column(pos == null ? 0 : pos.column())
                .matchedText(anchor.getRaw())
                .fixable(finding.result().isFixable())
                .build();
    }

    private static String describeFailure(RuleFailure failure) {
        PositionMarker pos = failure.segment().getPositionMarker();
        String loc = pos == null ? "?" : "L" + pos.line() + ":" + pos.column();
        return failure.rule().getCode() + " @ " + loc + ": " + failure.error();
    }
}
