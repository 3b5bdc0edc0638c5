package com.sqllint.reflow;

import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LintFix;
import com.sqllint.model.Segment;

import java.util.List;

/**
 * 换行重排计算接口
 * <p>
 * 给定目标节点及其所在语法树，返回让目标附近换行符合布局配置所需的全部编辑。
 * 相同输入必须得到相同结果；返回空列表表示已符合要求。
 */
@FunctionalInterface
public interface RebreakReflow {

    /**
     * @throws ReflowException 无法完成计算时（如目标不在语法树中）
     */
    List<LintFix> computeRebreakEdits(Segment target, Segment root, LayoutConfig config);
}
