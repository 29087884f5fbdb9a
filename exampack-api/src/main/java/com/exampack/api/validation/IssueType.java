package com.exampack.api.validation;

public enum IssueType {
    SCHEMA, // 结构/类型约束不满足
    BUSINESS_RULE, // 业务规则（重复 ID、题型约束、难度配比）
    CROSS_REFERENCE, // 清单声明与实际内容不一致
    PARSE // 内容文件缺失或无法解析
}
