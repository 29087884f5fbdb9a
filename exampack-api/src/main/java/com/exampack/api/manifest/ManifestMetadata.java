package com.exampack.api.manifest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * 清单中声明的统计信息（仅作交叉校验，不作为事实来源）
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ManifestMetadata implements Serializable {
    private Integer totalQuestions;
    private Integer totalTips;
    private Integer totalTemplates;
    private List<String> topics;
    private List<String> supportedLanguages;
}
