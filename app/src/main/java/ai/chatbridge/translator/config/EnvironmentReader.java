package ai.chatbridge.translator.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    default Optional<String> nonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
