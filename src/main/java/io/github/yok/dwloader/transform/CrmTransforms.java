package io.github.yok.dwloader.transform;

import static io.github.yok.dwloader.transform.CleanseFunctions.clean;
import static io.github.yok.dwloader.transform.CleanseFunctions.compactDate;
import static io.github.yok.dwloader.transform.CleanseFunctions.expand;
import static io.github.yok.dwloader.transform.CleanseFunctions.isoDate;
import static io.github.yok.dwloader.transform.CleanseFunctions.toDecimalOrZero;
import static io.github.yok.dwloader.transform.CleanseFunctions.toInteger;
import static io.github.yok.dwloader.transform.CleanseFunctions.toIntegerOrZero;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Silver transforms of the CRM extracts.
 *
 * @author Yasuharu.Okawauchi
 */
public final class CrmTransforms {

    static final String UNKNOWN = "Unknown";
    static final String NOT_AVAILABLE = "N/A";

    private static final Map<String, String> MARITAL_STATUS =
            ImmutableMap.of("S", "Single", "M", "Married");
    private static final Map<String, String> GENDER = ImmutableMap.of("M", "Male", "F", "Female");
    private static final Map<String, String> PRODUCT_LINE = ImmutableMap.of("M", "Mountain", "S",
            "Other Sales", "R", "Road", "T", "Touring");

    private CrmTransforms() {}

    /**
     * {@code crm_cust_info}: rows without id or key are dropped, codes are expanded.
     *
     * @param row bronze row
     * @return silver row
     */
    public static Optional<Map<String, Object>> customer(Map<String, Object> row) {
        Integer id = toInteger(row.get("cst_id"));
        String key = clean(row.get("cst_key"));
        if (id == null || key == null) {
            return Optional.empty();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cst_id", id);
        out.put("cst_key", key);
        out.put("cst_firstname", clean(row.get("cst_firstname")));
        out.put("cst_lastname", clean(row.get("cst_lastname")));
        out.put("cst_marital_status", expand(row.get("cst_marital_status"), MARITAL_STATUS,
                UNKNOWN));
        out.put("cst_gndr", expand(row.get("cst_gndr"), GENDER, UNKNOWN));
        out.put("cst_create_date", isoDate(row.get("cst_create_date")));
        return Optional.of(out);
    }

    /**
     * {@code crm_prd_info}: the source key {@code CO-RF-FR-R92B-58} splits into the category
     * {@code CO_RF} and the product key {@code FR-R92B-58}. End dates are stored as delivered; the
     * gold build corrects the validity intervals.
     *
     * @param row bronze row
     * @return silver row
     */
    public static Optional<Map<String, Object>> product(Map<String, Object> row) {
        Integer id = toInteger(row.get("prd_id"));
        String sourceKey = clean(row.get("prd_key"));
        if (id == null || sourceKey == null) {
            return Optional.empty();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("prd_id", id);
        out.put("prd_category", StringUtils.left(sourceKey, 5).replace('-', '_'));
        out.put("prd_key", StringUtils.substring(sourceKey, 6));
        out.put("prd_nm", clean(row.get("prd_nm")));
        out.put("prd_cost", toDecimalOrZero(row.get("prd_cost")));
        out.put("prd_line", expand(row.get("prd_line"), PRODUCT_LINE, NOT_AVAILABLE));
        out.put("prd_start_dt", isoDate(row.get("prd_start_dt")));
        out.put("prd_end_dt", isoDate(row.get("prd_end_dt")));
        return Optional.of(out);
    }

    /**
     * {@code crm_sales_details}: {@code yyyyMMdd} dates, measures default to zero.
     *
     * @param row bronze row
     * @return silver row
     */
    public static Optional<Map<String, Object>> sale(Map<String, Object> row) {
        String order = clean(row.get("sls_ord_num"));
        String productKey = clean(row.get("sls_prd_key"));
        Integer customerId = toInteger(row.get("sls_cust_id"));
        if (order == null || productKey == null || customerId == null) {
            return Optional.empty();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sls_ord_num", order);
        out.put("sls_prd_key", productKey);
        out.put("sls_cust_id", customerId);
        out.put("sls_order_dt", compactDate(row.get("sls_order_dt")));
        out.put("sls_ship_dt", compactDate(row.get("sls_ship_dt")));
        out.put("sls_due_dt", compactDate(row.get("sls_due_dt")));
        out.put("sls_sales", toDecimalOrZero(row.get("sls_sales")));
        out.put("sls_quantity", toIntegerOrZero(row.get("sls_quantity")));
        out.put("sls_price", toDecimalOrZero(row.get("sls_price")));
        return Optional.of(out);
    }
}
