package com.openforge.filemate.catalog;

import java.util.List;

/**
 * Built-in rule set, used when no classification_rules.yaml is present.
 *
 * Keep the keyword lists short: the score is matched / total, so every extra
 * keyword makes a category harder to qualify at the default 0.3 threshold.
 */
public final class DefaultRuleCatalog {

    private DefaultRuleCatalog() {}

    public static RuleCatalog create() {
        return new RuleCatalog(categories(), fallbackFolders(), ClassificationStrategy.defaults());
    }

    static List<Category> categories() {
        return List.of(
                new Category("运维管理",
                        List.of("运维", "部署", "监控", "服务器", "devops"),
                        List.of("DevOps运维", "运维管理", "运维"),
                        1),
                new Category("容器化",
                        List.of("容器", "docker", "k8s", "kubernetes"),
                        List.of("容器化部署", "容器"),
                        2),
                new Category("技术开发",
                        List.of("技术", "开发", "系统", "软件", "代码", "架构", "api", "tech"),
                        List.of("技术方案", "技术开发", "技术"),
                        3),
                new Category("项目管理",
                        List.of("项目", "管理", "计划", "进度", "project"),
                        List.of("项目管理", "项目文档", "项目"),
                        4),
                new Category("会议沟通",
                        List.of("会议", "纪要", "讨论", "meeting", "minutes"),
                        List.of("会议纪要", "会议"),
                        5),
                new Category("人力资源",
                        List.of("培训", "面试", "招聘", "员工", "入职", "hr"),
                        List.of("人力资源", "人事"),
                        6),
                new Category("财务管理",
                        List.of("财务", "预算", "成本", "费用", "报销", "finance"),
                        List.of("财务报告", "财务管理", "财务"),
                        7),
                new Category("学习成长",
                        List.of("学习", "成长", "读书", "笔记", "哲学", "思考"),
                        List.of("个人成长", "学习成长"),
                        8)
        );
    }

    static List<String> fallbackFolders() {
        return List.of("文档", "其他", "未分类", "通用", "documents", "misc", "uncategorized");
    }
}
