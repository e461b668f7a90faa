package com.ryuqq.workflow.adapter.inmemory.operation;

import com.ryuqq.workflow.core.spi.Operation;
import com.ryuqq.workflow.core.spi.OperationProvider;
import com.ryuqq.workflow.core.spi.OperationRegistrar;
import com.ryuqq.workflow.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * 이름 기반 Operation Registry (빌드 후 불변).
 *
 * <p><strong>이름 규칙:</strong></p>
 * <ul>
 *   <li>이름은 {@link Locale#ROOT} 기준 소문자로 정규화되어 대소문자를 구분하지 않습니다.</li>
 *   <li>같은 이름의 중복 등록은 즉시 실패합니다 ({@link IllegalStateException}).</li>
 *   <li>별칭은 이미 등록된 이름만 가리킬 수 있습니다 (예: getAllSheets → getSheets).</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationRegistry registry = MapOperationRegistry.builder()
 *     .register("getSheets", sheetsOperation)
 *     .alias("getAllSheets", "getSheets")
 *     .install(new SheetOperations())
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MapOperationRegistry implements OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapOperationRegistry.class);

    private final Map<String, Operation> operations;
    private final Set<String> names;

    private MapOperationRegistry(Map<String, Operation> operations, Set<String> names) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 클래스패스의 모든 {@link OperationProvider}를 {@link ServiceLoader}로 찾아 등록합니다.
     *
     * @return 구성된 Registry
     * @throws IllegalStateException Provider 간 이름이 충돌하는 경우
     */
    public static MapOperationRegistry fromServiceLoader() {
        return fromServiceLoader(Thread.currentThread().getContextClassLoader());
    }

    /**
     * 지정한 ClassLoader에서 {@link OperationProvider}를 찾아 등록합니다.
     *
     * @param classLoader 탐색 대상 ClassLoader
     * @return 구성된 Registry
     */
    public static MapOperationRegistry fromServiceLoader(ClassLoader classLoader) {
        Builder builder = builder();
        for (OperationProvider provider : ServiceLoader.load(OperationProvider.class, classLoader)) {
            builder.install(provider);
        }
        return builder.build();
    }

    @Override
    public Optional<Operation> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(operations.get(normalize(name)));
    }

    /**
     * 등록된 이름과 별칭 (등록 시 표기 그대로).
     */
    @Override
    public Set<String> names() {
        return names;
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Registry 빌더. {@link OperationProvider}에는 {@link OperationRegistrar}로 노출됩니다.
     */
    public static final class Builder implements OperationRegistrar {

        private final Map<String, Operation> operations = new LinkedHashMap<>();
        private final Set<String> names = new LinkedHashSet<>();

        private Builder() {
        }

        @Override
        public Builder register(String name, Operation operation) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("operation name cannot be null or blank");
            }
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
            String key = normalize(name);
            if (operations.putIfAbsent(key, operation) != null) {
                throw new IllegalStateException("Operation already registered: " + name);
            }
            names.add(name.trim());
            return this;
        }

        @Override
        public Builder alias(String alias, String target) {
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("alias target cannot be null or blank");
            }
            Operation operation = operations.get(normalize(target));
            if (operation == null) {
                throw new IllegalStateException("Alias target not registered: " + target);
            }
            return register(alias, operation);
        }

        /**
         * Provider의 Operation을 모두 등록합니다.
         *
         * @param provider Operation 제공자
         * @return this
         */
        public Builder install(OperationProvider provider) {
            if (provider == null) {
                throw new IllegalArgumentException("provider cannot be null");
            }
            int before = operations.size();
            provider.registerOperations(this);
            log.info("Installed operation provider: {} ({} operations)",
                provider.getClass().getName(), operations.size() - before);
            return this;
        }

        public MapOperationRegistry build() {
            return new MapOperationRegistry(operations, names);
        }
    }
}
