package io.github.yok.dwloader.gold;

import com.google.common.collect.ImmutableList;
import io.github.yok.dwloader.temporal.PointInTimeResolver;
import java.util.Map;
import lombok.Value;

/**
 * Built {@code dim_products} rows and the resolver from product number and date to surrogate key.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ProductDimension {
    ImmutableList<Map<String, Object>> rows;
    PointInTimeResolver<Long> resolver;
}
