package io.github.yok.dwloader.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig}.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code dbunit.config.allow-empty-fields}: Whether empty fields are allowed. Must stay
 * {@code true} for the landing layer, which stores empty source fields verbatim.</li>
 * <li>{@code dbunit.config.batched-statements}: Whether to use batched statement execution</li>
 * <li>{@code dbunit.config.batch-size}: Batch size (number of statements per batch)</li>
 * <li>{@code dbunit.config.load-chunk-size}: Number of source records inserted per DBUnit
 * operation during the bulk load</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Specifies whether DBUnit permits empty fields (i.e., {@code ""}).
     */
    private boolean allowEmptyFields = true;

    /**
     * Specifies whether DBUnit's batched statement execution should be enabled.
     */
    private boolean batchedStatements = true;

    /**
     * Specifies the number of statements to execute per batch when DBUnit batching is enabled.
     */
    private int batchSize = 100;

    /**
     * Number of source records buffered before they are written to the landing table.
     */
    private int loadChunkSize = 5000;
}
