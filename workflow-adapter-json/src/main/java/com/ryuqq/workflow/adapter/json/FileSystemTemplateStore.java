package com.ryuqq.workflow.adapter.json;

import com.ryuqq.workflow.core.exception.InvalidWorkflowArgumentException;
import com.ryuqq.workflow.core.exception.TemplateNotFoundException;
import com.ryuqq.workflow.core.exception.TemplateParseException;
import com.ryuqq.workflow.core.model.TemplateSummary;
import com.ryuqq.workflow.core.model.WorkflowTemplate;
import com.ryuqq.workflow.core.spi.TemplateKeys;
import com.ryuqq.workflow.core.spi.TemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 디렉터리 기반 {@link TemplateStore}.
 *
 * <p>템플릿 파일 이름은 {@code <workflowType>_<projectType>.json} 또는 {@code <workflowType>.json}이며,
 * 프로젝트 전용 파일을 먼저 찾고 없으면 공통 파일로 대체합니다.</p>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>키에 경로 구분자나 {@code ..}가 포함되면 {@link InvalidWorkflowArgumentException}</li>
 *   <li>디렉터리가 없으면 목록은 비어 있고 load는 {@link TemplateNotFoundException}</li>
 *   <li>목록 조회 시 파싱할 수 없는 파일은 경고 로그 후 건너뜀</li>
 * </ul>
 *
 * <p>캐시하지 않습니다. 매 호출마다 파일을 다시 읽으므로 템플릿 수정이 즉시 반영됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FileSystemTemplateStore implements TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemTemplateStore.class);

    static final String EXTENSION = ".json";

    private final Path directory;
    private final JsonTemplateParser parser;

    public FileSystemTemplateStore(Path directory) {
        this(directory, new JsonTemplateParser());
    }

    /**
     * 생성자.
     *
     * @param directory 템플릿 디렉터리
     * @param parser 템플릿 파서
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public FileSystemTemplateStore(Path directory, JsonTemplateParser parser) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        this.directory = directory;
        this.parser = parser;
    }

    @Override
    public WorkflowTemplate load(String workflowType, String projectType) {
        requireSafeKey("workflowType", workflowType);
        requireSafeKey("projectType", projectType);

        for (String key : TemplateKeys.candidates(workflowType, projectType)) {
            Path file = directory.resolve(key + EXTENSION);
            if (Files.isRegularFile(file)) {
                log.debug("Resolved template: type={}, project={}, file={}", workflowType, projectType, file);
                return parser.parse(read(file), workflowType);
            }
        }
        log.warn("Template not found: type={}, project={}, directory={}", workflowType, projectType, directory);
        throw new TemplateNotFoundException(workflowType, projectType);
    }

    @Override
    public List<TemplateSummary> list() {
        if (!Files.isDirectory(directory)) {
            log.warn("Template directory does not exist: {}", directory);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list template directory: {}", directory, e);
            throw new UncheckedIOException("Failed to list template directory: " + directory, e);
        }

        List<TemplateSummary> summaries = new ArrayList<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            String key = fileName.substring(0, fileName.length() - EXTENSION.length());
            try {
                summaries.add(parser.parse(read(file), key).summarize());
            } catch (TemplateParseException e) {
                log.warn("Skipping unparsable template: file={}, reason={}", file, e.getMessage());
            }
        }
        return summaries;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read template file: {}", file, e);
            throw new TemplateParseException("Failed to read template file: " + file.getFileName(), e);
        }
    }

    private static void requireSafeKey(String name, String value) {
        if (value == null) {
            return;
        }
        if (value.contains("/") || value.contains("\\") || value.contains("..")) {
            throw new InvalidWorkflowArgumentException(name + " contains illegal path characters: " + value);
        }
    }
}
