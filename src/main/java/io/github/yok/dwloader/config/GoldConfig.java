package io.github.yok.dwloader.config;

import io.github.yok.dwloader.temporal.UnresolvedPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the gold model build ({@code gold.*}).
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "gold")
@Data
public class GoldConfig {

    // Handling of fact rows whose dimension cannot be resolved
    private UnresolvedPolicy unresolvedPolicy = UnresolvedPolicy.UNKNOWN_MEMBER;

    // Surrogate key of the unknown member row of each dimension
    private long unknownMemberKey = -1L;
}
