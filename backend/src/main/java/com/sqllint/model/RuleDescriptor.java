package com.sqllint.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * 检查规则元数据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleDescriptor {

    /** 规则编码（如 "L065"） */
    private String code;

    /** 规则名称（如 "layout.set_operators"） */
    private String name;

    /** 规则说明 */
    private String description;

    /** 反例 SQL */
    private String antiPattern;

    /** 推荐写法 */
    private String bestPractice;

    /** 所属分组 */
    private List<String> groups;

    /** 是否提供自动修复 */
    private boolean fixCompatible;

    /** 触发检查的节点类型 */
    private Set<String> crawlTypes;
}
