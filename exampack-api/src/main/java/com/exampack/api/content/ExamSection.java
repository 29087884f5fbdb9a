package com.exampack.api.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 模板分区：从指定知识点抽取 count 道题，可选难度配比
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExamSection {
    private List<String> topicIds;
    private Integer count;
    private DifficultyMix difficultyMix;
}
