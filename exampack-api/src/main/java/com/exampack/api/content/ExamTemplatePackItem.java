package com.exampack.api.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 试卷模板条目
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExamTemplatePackItem {
    private String id;
    private String name;
    private Integer durationMinutes;
    private List<ExamSection> sections;
    private Map<String, Object> calculatorRules;
}
