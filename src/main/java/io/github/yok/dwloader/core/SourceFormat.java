package io.github.yok.dwloader.core;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import lombok.Builder;
import lombok.Value;

/**
 * CSV contract of one source extract.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class SourceFormat {

    // Field separator
    @Builder.Default
    char delimiter = ',';

    // Optional quote character; null disables quoting
    @Builder.Default
    Character quoteChar = '"';

    // Record separator written by the producer; every one of CRLF, LF and CR is accepted on read
    @Builder.Default
    String lineTerminator = "\r\n";

    // Leading records that are not data
    @Builder.Default
    int headerRowsToSkip = 1;

    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;

    /**
     * Returns the format of the original extracts: comma separated, optionally double-quoted, CRLF,
     * one header line, UTF-8.
     *
     * @return default format
     */
    public static SourceFormat defaults() {
        return SourceFormat.builder().build();
    }
}
