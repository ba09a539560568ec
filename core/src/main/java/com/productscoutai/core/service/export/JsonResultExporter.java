package com.productscoutai.core.service.export;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.productscoutai.core.model.CrawlReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * 결과 JSON 저장/로드.
 * - raw  : output 경로, 없으면 {outDir}/ai_crawl_results_{도메인 . → _}.json
 * - final: raw 옆의 {stem}_cleaned.json
 */
public final class JsonResultExporter {

    private static final ObjectMapper M = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public record Written(Path raw, Path cleaned) {}

    public Written export(CrawlReport raw, CrawlReport cleaned, Path output, Path outDir) throws IOException {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(cleaned, "cleaned");
        Path rawPath = (output != null) ? output : defaultRawPath(outDir, raw.domain());
        Path cleanedPath = cleanedPath(rawPath);
        write(raw, rawPath);
        write(cleaned, cleanedPath);
        return new Written(rawPath, cleanedPath);
    }

    public Path write(CrawlReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, M.writeValueAsString(report), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return file;
    }

    public CrawlReport read(Path file) throws IOException {
        return M.readValue(Files.readString(file, StandardCharsets.UTF_8), CrawlReport.class);
    }

    public static Path defaultRawPath(Path outDir, String domain) {
        Path dir = (outDir == null ? Path.of("out") : outDir);
        String d = (domain == null || domain.isBlank()) ? "unknown" : domain;
        return dir.resolve("ai_crawl_results_" + d.replace('.', '_') + ".json");
    }

    /** foo.json → foo_cleaned.json (확장자 없으면 그대로 뒤에 붙임) */
    public static Path cleanedPath(Path raw) {
        String name = raw.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : ".json";
        return raw.resolveSibling(stem + "_cleaned" + ext);
    }
}
