package io.github.yok.dwloader.gold;

import com.google.common.collect.ImmutableList;
import io.github.yok.dwloader.temporal.DimensionVersion;
import io.github.yok.dwloader.temporal.IntervalCorrector;
import io.github.yok.dwloader.temporal.PointInTimeResolver;
import io.github.yok.dwloader.util.JdbcValues;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@code dim_products}: one row per product version with corrected validity intervals and
 * the ERP category hierarchy.
 *
 * @author Yasuharu.Okawauchi
 */
public class ProductDimensionBuilder {

    private final IntervalCorrector corrector;

    public ProductDimensionBuilder() {
        this(new IntervalCorrector());
    }

    ProductDimensionBuilder(IntervalCorrector corrector) {
        this.corrector = corrector;
    }

    /**
     * Builds the dimension. Versions are keyed by product number and ordered by {@code prd_id}
     * on equal start dates; surrogate keys are assigned from 1 in corrected order.
     *
     * @param products silver {@code crm_prd_info} rows
     * @param categories silver {@code erp_px_cat_g1v2} rows
     * @return rows and point-in-time resolver
     * @throws io.github.yok.dwloader.core.IntegrityException if the versions cannot be corrected
     */
    public ProductDimension build(List<Map<String, Object>> products,
            List<Map<String, Object>> categories) {
        Map<String, Map<String, Object>> categoryById = new HashMap<>();
        for (Map<String, Object> category : categories) {
            categoryById.putIfAbsent(JdbcValues.asText(category.get("id")), category);
        }

        List<DimensionVersion<Map<String, Object>>> versions = new ArrayList<>(products.size());
        for (Map<String, Object> product : products) {
            versions.add(DimensionVersion.<Map<String, Object>>builder()
                    .businessKey(JdbcValues.asText(product.get("prd_key")))
                    .sequence(JdbcValues.toLong(product.get("prd_id")))
                    .startDate(JdbcValues.toLocalDate(product.get("prd_start_dt")))
                    .endDate(JdbcValues.toLocalDate(product.get("prd_end_dt"))).payload(product)
                    .build());
        }

        ImmutableList.Builder<Map<String, Object>> rows = ImmutableList.builder();
        List<DimensionVersion<Long>> keys = new ArrayList<>(versions.size());
        long key = 1;
        for (DimensionVersion<Map<String, Object>> version : corrector.correct(versions)) {
            Map<String, Object> product = version.getPayload();
            Map<String, Object> category = categoryById
                    .getOrDefault(JdbcValues.asText(product.get("prd_category")), Map.of());

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("product_key", key);
            row.put("product_id", JdbcValues.toLong(product.get("prd_id")));
            row.put("product_number", version.getBusinessKey());
            row.put("product_name", product.get("prd_nm"));
            row.put("category_id", category.get("id"));
            row.put("category_name", category.get("cat"));
            row.put("subcategory_name", category.get("subcat"));
            row.put("maintenance_flag",
                    Boolean.TRUE.equals(JdbcValues.toBoolean(category.get("maintenance")))
                            ? "Yes"
                            : "No");
            row.put("product_cost", JdbcValues.toDecimal(product.get("prd_cost")));
            row.put("product_line", product.get("prd_line"));
            row.put("start_date", version.getStartDate());
            row.put("end_date", version.getEndDate());
            row.put("is_current", version.getEndDate() == null);
            rows.add(row);

            keys.add(DimensionVersion.<Long>builder().businessKey(version.getBusinessKey())
                    .sequence(version.getSequence()).startDate(version.getStartDate())
                    .endDate(version.getEndDate()).payload(key).build());
            key++;
        }
        return new ProductDimension(rows.build(), new PointInTimeResolver<>(keys));
    }

    /**
     * Returns the unknown member row.
     *
     * @param key surrogate key of the unknown member
     * @return dimension row
     */
    public Map<String, Object> unknownMember(long key) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("product_key", key);
        row.put("product_number", "n/a");
        row.put("product_name", "n/a");
        row.put("maintenance_flag", "No");
        row.put("is_current", Boolean.FALSE);
        return row;
    }
}
