package com.exampack.api.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 学习提示条目
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TipPackItem {
    private String id;
    private List<String> topicIds;
    private String title;
    private String body;
    private List<String> tags;
    private List<String> relatedQuestionIds;
}
