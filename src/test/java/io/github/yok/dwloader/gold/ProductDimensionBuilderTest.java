package io.github.yok.dwloader.gold;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.dwloader.core.IntegrityException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProductDimensionBuilderTest {

    private final ProductDimensionBuilder builder = new ProductDimensionBuilder();

    private static Map<String, Object> product(int id, String category, String key, String start,
            String end) {
        Map<String, Object> row = new HashMap<>();
        row.put("prd_id", id);
        row.put("prd_category", category);
        row.put("prd_key", key);
        row.put("prd_nm", "name " + id);
        row.put("prd_cost", new BigDecimal(id));
        row.put("prd_line", "Road");
        row.put("prd_start_dt", LocalDate.parse(start));
        row.put("prd_end_dt", end == null ? null : LocalDate.parse(end));
        return row;
    }

    private static Map<String, Object> category(String id, boolean maintenance) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("cat", "Accessories");
        row.put("subcat", "Helmets");
        row.put("maintenance", maintenance);
        return row;
    }

    @Test
    void build_正常ケース_不正な終了日を含む版_補正され現行フラグが設定されること() {
        ProductDimension dim = builder.build(
                List.of(product(213, "AC_HE", "HL-U509-R", "2012-07-01", "2008-12-27"),
                        product(212, "AC_HE", "HL-U509-R", "2011-07-01", "2007-12-28"),
                        product(214, "AC_HE", "HL-U509-R", "2013-07-01", null)),
                List.of(category("AC_HE", true)));

        List<Map<String, Object>> rows = dim.getRows();
        assertEquals(3, rows.size());
        assertEquals(212L, rows.get(0).get("product_id"));
        assertEquals(1L, rows.get(0).get("product_key"));
        assertEquals(LocalDate.of(2012, 6, 30), rows.get(0).get("end_date"));
        assertEquals(Boolean.FALSE, rows.get(0).get("is_current"));
        assertEquals(LocalDate.of(2013, 6, 30), rows.get(1).get("end_date"));
        assertNull(rows.get(2).get("end_date"));
        assertEquals(Boolean.TRUE, rows.get(2).get("is_current"));
        assertEquals("Helmets", rows.get(0).get("subcategory_name"));
        assertEquals("Yes", rows.get(0).get("maintenance_flag"));
    }

    @Test
    void build_正常ケース_リゾルバ_注文日時点の版の代理キーが返ること() {
        ProductDimension dim = builder.build(
                List.of(product(212, "AC_HE", "HL-U509-R", "2011-07-01", "2007-12-28"),
                        product(213, "AC_HE", "HL-U509-R", "2012-07-01", null)),
                List.of());

        assertEquals(2L, dim.getResolver().resolve("HL-U509-R", LocalDate.of(2012, 8, 15))
                .get().getPayload());
        assertTrue(dim.getResolver().resolve("HL-U509-R", LocalDate.of(2010, 1, 1)).isEmpty());
    }

    @Test
    void build_正常ケース_カテゴリなし_カテゴリ列がnullでメンテナンスはNoになること() {
        ProductDimension dim = builder.build(
                List.of(product(210, "CO_RF", "FR-R92B-58", "2003-07-01", null)), List.of());

        assertNull(dim.getRows().get(0).get("category_name"));
        assertEquals("No", dim.getRows().get(0).get("maintenance_flag"));
    }

    @Test
    void build_異常ケース_同一開始日の版が重複する_IntegrityExceptionが送出されること() {
        Map<String, Object> first = product(1, "AC_HE", "K", "2020-01-01", null);
        Map<String, Object> second = product(1, "AC_HE", "K", "2020-01-01", null);

        assertThrows(IntegrityException.class,
                () -> builder.build(List.of(first, second), List.of()));
    }

    @Test
    void unknownMember_正常ケース_キー指定_不明メンバー行が返ること() {
        Map<String, Object> row = builder.unknownMember(-1L);

        assertEquals(-1L, row.get("product_key"));
        assertEquals(Boolean.FALSE, row.get("is_current"));
    }
}
