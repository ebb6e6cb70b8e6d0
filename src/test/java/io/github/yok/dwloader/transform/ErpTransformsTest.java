package io.github.yok.dwloader.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ErpTransformsTest {

    private static Map<String, Object> row(String... pairs) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            row.put(pairs[i], pairs[i + 1]);
        }
        return row;
    }

    @Test
    void customerDemographics_正常ケース_NAS接頭辞_除去されること() {
        Map<String, Object> out = ErpTransforms
                .customerDemographics(row("cid", "NASAW00011000", "bdate", "1971-10-06", "gen",
                        " Male "))
                .get();

        assertEquals("AW00011000", out.get("cid"));
        assertEquals(LocalDate.of(1971, 10, 6), out.get("bdate"));
        assertEquals("Male", out.get("gen"));
    }

    @Test
    void customerDemographics_正常ケース_10文字でない生年月日_nullになること() {
        Map<String, Object> out = ErpTransforms
                .customerDemographics(row("cid", "AW00011002", "bdate", "1971-2-9")).get();

        assertNull(out.get("bdate"));
    }

    @Test
    void customerLocation_正常ケース_ハイフンとUS表記_除去と正規化が行われること() {
        assertEquals("United States", ErpTransforms
                .customerLocation(row("cid", "AW-00011001", "cntry", "US")).get().get("cntry"));
        assertEquals("United States", ErpTransforms
                .customerLocation(row("cid", "AW-00011001", "cntry", "USA")).get().get("cntry"));
        Map<String, Object> out = ErpTransforms
                .customerLocation(row("cid", "AW-00011000", "cntry", " Australia")).get();
        assertEquals("AW00011000", out.get("cid"));
        assertEquals("Australia", out.get("cntry"));
    }

    @Test
    void productCategory_正常ケース_メンテナンス区分_真偽値に変換されること() {
        Map<String, Object> out = ErpTransforms.productCategory(
                row("id", "CO_RF", "cat", "Components", "subcat", "Road Frames", "maintenance",
                        "Yes"))
                .get();

        assertEquals(Boolean.TRUE, out.get("maintenance"));
    }

    @Test
    void productCategory_正常ケース_IDなし_除外されること() {
        assertTrue(ErpTransforms.productCategory(row("id", "")).isEmpty());
    }
}
