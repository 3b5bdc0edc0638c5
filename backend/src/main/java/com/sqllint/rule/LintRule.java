package com.sqllint.rule;

import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LintResult;
import com.sqllint.model.RuleDescriptor;
import com.sqllint.model.Segment;

import java.util.List;
import java.util.Set;

/**
 * 基于语法树节点的检查规则接口
 */
public interface LintRule {

    /**
     * 规则元数据，code 对应 sqllint.rules.exclude 中的配置
     */
    RuleDescriptor descriptor();

    default String code() {
        return descriptor().getCode();
    }

    /**
     * 需要检查的节点类型；遍历引擎对每个命中节点调用一次 {@link #evaluate}
     */
    default Set<String> crawlTypes() {
        return descriptor().getCrawlTypes();
    }

    /**
     * 检查单个节点
     *
     * @param target 命中的节点
     * @param root   所在语法树的根节点
     * @param config 布局配置
     */
    EvaluationResult evaluate(Segment target, Segment root, LayoutConfig config);

    record EvaluationResult(List<LintResult> results, String error) {

        public EvaluationResult {
            results = results == null ? List.of() : List.copyOf(results);
        }

        public static EvaluationResult success(List<LintResult> results) {
            return new EvaluationResult(results, null);
        }

        public static EvaluationResult empty() {
            return new EvaluationResult(List.of(), null);
        }

        public static EvaluationResult failure(String error) {
            return new EvaluationResult(List.of(), error);
        }

        public boolean isFailure() {
            return error != null;
        }
    }
}
