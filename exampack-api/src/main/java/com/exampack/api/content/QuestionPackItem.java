package com.exampack.api.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 题目条目
 * <p>
 * {@code type} 取值：single / multi / scenario / order；
 * {@code difficulty} 取值：easy / med / hard。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuestionPackItem {
    private String id;
    private String type;
    private String stem;
    private List<String> topicIds;
    private List<QuestionChoice> choices;
    private List<String> correct;
    private List<String> correctOrder;
    private List<String> exhibits;
    private String difficulty;
    private String explanation;
}
