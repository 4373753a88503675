package com.openforge.filemate.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Broad keyword groupings consulted only during forced resolution, after the
 * configured catalog and the oracle both failed to place a document.
 *
 * Unlike {@link RuleCatalog#bestMatch}, a group fires on a single keyword hit.
 * Groups are checked in table order.
 */
public final class GenericRuleTable {

    private final List<Category> groups;

    public GenericRuleTable(List<Category> groups) {
        this.groups = List.copyOf(groups);
    }

    public static GenericRuleTable standard() {
        return new GenericRuleTable(List.of(
                new Category("technology",
                        List.of("技术", "开发", "系统", "软件", "代码", "程序", "工程", "tech", "dev"),
                        List.of("技术", "开发", "工程", "tech"), 1),
                new Category("management",
                        List.of("管理", "项目", "计划", "规划", "策略", "management", "project"),
                        List.of("项目", "管理", "project"), 2),
                new Category("business",
                        List.of("业务", "流程", "规范", "标准", "需求", "business"),
                        List.of("业务", "流程", "business"), 3),
                new Category("hr",
                        List.of("人事", "人力", "员工", "招聘", "培训", "面试", "hr"),
                        List.of("人力资源", "人事", "hr", "培训"), 4),
                new Category("finance",
                        List.of("财务", "预算", "成本", "费用", "报告", "finance"),
                        List.of("财务", "finance", "报告"), 5),
                new Category("meetings",
                        List.of("会议", "纪要", "讨论", "沟通", "meeting"),
                        List.of("会议", "meeting", "沟通"), 6),
                new Category("personal-growth",
                        List.of("学习", "成长", "知识", "教育", "哲学", "思考"),
                        List.of("学习", "成长", "知识", "教育"), 7)
        ));
    }

    public List<Category> groups() {
        return groups;
    }

    /** First group, in table order, with at least one keyword contained in the subject. */
    public Optional<Category> firstHit(String subject) {
        return groups.stream()
                .filter(group -> group.anyKeywordIn(subject))
                .findFirst();
    }

    /** Every group with at least one keyword contained in the subject, in table order. */
    public List<Category> hits(String subject) {
        return groups.stream()
                .filter(group -> group.anyKeywordIn(subject))
                .toList();
    }
}
