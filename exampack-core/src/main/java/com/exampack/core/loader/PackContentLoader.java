package com.exampack.core.loader;

import com.exampack.api.validation.IssueType;
import com.exampack.api.validation.ValidationIssue;
import com.exampack.core.archive.PackArchive;
import com.exampack.core.util.JsonUtils;
import com.exampack.core.validation.schema.SchemaValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 内容文件解析
 * <p>
 * .jsonl 每行一个对象，其他扩展名按 JSON 数组解析。解析失败记为 PARSE 问题，不抛异常。
 */
@Slf4j
public class PackContentLoader {

    private static final String JSONL_SUFFIX = ".jsonl";

    /**
     * 解析结果：已解析的条目与解析问题
     */
    @Value
    public static class LoadedContent {
        String file;
        List<JsonNode> items;
        List<ValidationIssue> issues;

        public boolean hasIssues() {
            return !issues.isEmpty();
        }
    }

    public LoadedContent load(PackArchive archive, String file) {
        Optional<byte[]> data = archive.entry(file);
        if (!data.isPresent()) {
            return new LoadedContent(file, Collections.emptyList(),
                    Collections.singletonList(parseIssue(file, null, "File not found in pack archive")));
        }
        return parse(file, data.get());
    }

    public LoadedContent parse(String file, byte[] data) {
        String text = new String(data, StandardCharsets.UTF_8);
        if (file.endsWith(JSONL_SUFFIX)) {
            return parseLines(file, text);
        }
        return parseArray(file, text);
    }

    private LoadedContent parseLines(String file, String text) {
        List<JsonNode> items = new ArrayList<>();
        List<ValidationIssue> issues = new ArrayList<>();
        String[] lines = text.split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                items.add(JsonUtils.mapper().readTree(line));
            } catch (JsonProcessingException e) {
                issues.add(parseIssue(file, i + 1, "Invalid JSON: " + e.getOriginalMessage()));
            }
        }
        log.debug("Parsed {} items from {} ({} parse issues)", items.size(), file, issues.size());
        return new LoadedContent(file, items, issues);
    }

    private LoadedContent parseArray(String file, String text) {
        JsonNode root;
        try {
            root = JsonUtils.mapper().readTree(text);
        } catch (IOException e) {
            return new LoadedContent(file, Collections.emptyList(),
                    Collections.singletonList(parseIssue(file, null, "Invalid JSON: " + e.getMessage())));
        }
        if (root == null || !root.isArray()) {
            String actual = root == null || root.isMissingNode() ? "empty document" : root.getNodeType().name().toLowerCase(Locale.ROOT);
            return new LoadedContent(file, Collections.emptyList(),
                    Collections.singletonList(parseIssue(file, null, "Expected array, got " + actual)));
        }
        List<JsonNode> items = new ArrayList<>();
        root.forEach(items::add);
        return new LoadedContent(file, items, Collections.emptyList());
    }

    private static ValidationIssue parseIssue(String file, Integer line, String message) {
        return ValidationIssue.builder()
                .file(file)
                .line(line)
                .field(SchemaValidator.ROOT)
                .message(message)
                .type(IssueType.PARSE)
                .build();
    }
}
