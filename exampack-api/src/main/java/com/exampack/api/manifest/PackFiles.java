package com.exampack.api.manifest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * 内容文件的相对路径
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PackFiles implements Serializable {
    private String questions;
    private String examTemplates;
    private String tips;
    private List<String> media;
}
