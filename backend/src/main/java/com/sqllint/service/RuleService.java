package com.sqllint.service;

import com.sqllint.config.LintProperties;
import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LintResult;
import com.sqllint.model.RuleDescriptor;
import com.sqllint.model.Segment;
import com.sqllint.rule.LintRule;
import com.sqllint.rule.LintRule.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 规则注册与遍历检查服务
 * <p>
 * 启动时按节点类型建立 类型 -> 规则 的映射，检查时先序遍历语法树，
 * 对每个命中节点调用对应规则一次。
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final List<LintRule> rules;
    private final Map<String, List<LintRule>> rulesByType;

    public RuleService(List<LintRule> rules, LintProperties properties) {
        Set<String> excluded = Set.copyOf(properties.getRules().getExclude());
        this.rules = rules.stream()
                .filter(r -> !excluded.contains(r.code()))
                .toList();
        this.rulesByType = buildTypeIndex(this.rules);
        log.info("加载了 {} 条检查规则 (排除 {}), 覆盖节点类型 {}",
                this.rules.size(), excluded, rulesByType.keySet());
    }

    private static Map<String, List<LintRule>> buildTypeIndex(List<LintRule> rules) {
        Map<String, List<LintRule>> index = new LinkedHashMap<>();
        for (LintRule rule : rules) {
            for (String type : rule.crawlTypes()) {
                index.computeIfAbsent(type, t -> new ArrayList<>()).add(rule);
            }
        }
        index.replaceAll((type, list) -> List.copyOf(list));
        return Map.copyOf(index);
    }

    public List<RuleDescriptor> getAllRules() {
        return rules.stream().map(LintRule::descriptor).toList();
    }

    /**
     * 检查整棵语法树
     */
    public LintOutcome lintTree(Segment root, LayoutConfig config) {
        List<RuleFinding> findings = new ArrayList<>();
        List<RuleFailure> failures = new ArrayList<>();

        for (Segment segment : root.recursiveCrawl(rulesByType.keySet())) {
            for (LintRule rule : rulesByType.getOrDefault(segment.getType(), List.of())) {
                EvaluationResult result = applyRule(rule, segment, root, config);
                if (result.isFailure()) {
                    log.warn("规则 {} 在 {} 处执行失败: {}", rule.code(), segment, result.error());
                    failures.add(new RuleFailure(rule.descriptor(), segment, result.error()));
                    continue;
                }
                for (LintResult lintResult : result.results()) {
                    findings.add(new RuleFinding(rule.descriptor(), lintResult));
                }
            }
        }
        return new LintOutcome(findings, failures);
    }

    private EvaluationResult applyRule(LintRule rule, Segment segment, Segment root, LayoutConfig config) {
        try {
            return rule.evaluate(segment, root, config);
        } catch (RuntimeException e) {
            return EvaluationResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public record RuleFinding(RuleDescriptor rule, LintResult result) {
    }

    public record RuleFailure(RuleDescriptor rule, Segment segment, String error) {
    }

    public record LintOutcome(List<RuleFinding> findings, List<RuleFailure> failures) {

        public boolean hasFixes() {
            return findings.stream().anyMatch(f -> f.result().isFixable());
        }
    }
}
