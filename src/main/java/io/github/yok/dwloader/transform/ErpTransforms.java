package io.github.yok.dwloader.transform;

import static io.github.yok.dwloader.transform.CleanseFunctions.clean;
import static io.github.yok.dwloader.transform.CleanseFunctions.isoDateStrictLength;
import static io.github.yok.dwloader.transform.CleanseFunctions.yesNo;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Silver transforms of the ERP extracts.
 *
 * @author Yasuharu.Okawauchi
 */
public final class ErpTransforms {

    private ErpTransforms() {}

    /**
     * {@code erp_cust_az12}: the {@code NAS} prefix is stripped so the id joins with the CRM
     * customer key.
     *
     * @param row bronze row
     * @return silver row
     */
    public static Optional<Map<String, Object>> customerDemographics(Map<String, Object> row) {
        String cid = clean(row.get("cid"));
        if (cid == null) {
            return Optional.empty();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cid", StringUtils.removeStart(cid, "NAS"));
        out.put("bdate", isoDateStrictLength(row.get("bdate")));
        out.put("gen", clean(row.get("gen")));
        return Optional.of(out);
    }

    /**
     * {@code erp_loc_a101}: dashes are removed from the id, US and USA become United States.
     *
     * @param row bronze row
     * @return silver row
     */
    public static Optional<Map<String, Object>> customerLocation(Map<String, Object> row) {
        String cid = clean(row.get("cid"));
        if (cid == null) {
            return Optional.empty();
        }
        String country = clean(row.get("cntry"));
        if ("US".equals(country) || "USA".equals(country)) {
            country = "United States";
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cid", cid.replace("-", ""));
        out.put("cntry", country);
        return Optional.of(out);
    }

    /**
     * {@code erp_px_cat_g1v2}: maintenance Yes/No becomes a boolean.
     *
     * @param row bronze row
     * @return silver row
     */
    public static Optional<Map<String, Object>> productCategory(Map<String, Object> row) {
        String id = clean(row.get("id"));
        if (id == null) {
            return Optional.empty();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", id);
        out.put("cat", clean(row.get("cat")));
        out.put("subcat", clean(row.get("subcat")));
        out.put("maintenance", yesNo(row.get("maintenance")));
        return Optional.of(out);
    }
}
