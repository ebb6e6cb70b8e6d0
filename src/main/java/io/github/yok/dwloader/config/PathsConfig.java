package io.github.yok.dwloader.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and resolves the location of the source extracts.
 *
 * <p>
 * Relative {@code source-file} values of the configured tables are resolved against
 * {@code data-path}; absolute values are used as they are.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that holds the source extracts (e.g. source_crm/, source_erp/)
    private String dataPath;

    /**
     * Resolves a configured source file against {@code data-path}.
     *
     * @param sourceFile file name or path from the table configuration
     * @return absolute normalized path of the source file
     * @throws IllegalStateException if {@code sourceFile} is relative and {@code dataPath} has not
     *         been set
     * @throws IllegalArgumentException if {@code sourceFile} is blank
     */
    public Path resolveSource(String sourceFile) {
        if (StringUtils.isBlank(sourceFile)) {
            throw new IllegalArgumentException("source-file must not be blank.");
        }
        Path file = Paths.get(sourceFile);
        if (file.isAbsolute()) {
            return file.normalize();
        }
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return Paths.get(dataPath).resolve(file).toAbsolutePath().normalize();
    }
}
