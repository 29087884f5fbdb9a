package com.exampack.api.content;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 难度配比，三者之和应为 1.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DifficultyMix {
    private Double easy;
    private Double med;
    private Double hard;
}
