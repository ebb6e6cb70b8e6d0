package io.github.yok.dwloader.transform;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The silver transforms of the six warehouse sources, in load order.
 *
 * @author Yasuharu.Okawauchi
 */
public final class StandardTransforms {

    private StandardTransforms() {}

    /**
     * Returns all transform definitions. Source and target tables share their name.
     *
     * @return definitions
     */
    public static List<TransformDefinition> all() {
        return ImmutableList.of(
                define("crm_cust_info", ImmutableList.of("cst_id"), CrmTransforms::customer),
                define("crm_prd_info", ImmutableList.of("prd_id"), CrmTransforms::product),
                define("crm_sales_details", ImmutableList.of("sls_ord_num", "sls_prd_key"),
                        CrmTransforms::sale),
                define("erp_cust_az12", ImmutableList.of("cid"),
                        ErpTransforms::customerDemographics),
                define("erp_loc_a101", ImmutableList.of("cid"), ErpTransforms::customerLocation),
                define("erp_px_cat_g1v2", ImmutableList.of("id"),
                        ErpTransforms::productCategory));
    }

    private static TransformDefinition define(String table, ImmutableList<String> keys,
            RowTransform transform) {
        return new TransformDefinition(table, table, keys, transform);
    }
}
