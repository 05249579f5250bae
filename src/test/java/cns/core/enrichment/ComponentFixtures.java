package cns.core.enrichment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ComponentFixtures {

    private ComponentFixtures() {
    }

    /**
     * A valid supplier payload for LM358 covering all 22 expected fields.
     */
    public static Map<String, Object> lm358AllFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("mpn", "LM358");
        fields.put("manufacturer", "Texas Instruments");
        fields.put("description", "Dual operational amplifier");
        fields.put("category", "Amplifiers");
        fields.put("price_breaks", List.of(Map.of("quantity", 1, "price", "0.45"), Map.of("quantity", 100, "price", "0.32")));
        fields.put("unit_price", "$0.45");
        fields.put("stock_quantity", "12,500");
        fields.put("lifecycle_status", "Active");
        fields.put("parameters", Map.of("channels", "2", "supply_voltage", "3V-32V"));
        fields.put("datasheet_url", "https://www.ti.com/lit/ds/symlink/lm358.pdf");
        fields.put("image_url", "//images.example.com/lm358.jpg");
        fields.put("rohs_compliant", "Yes");
        fields.put("reach_compliant", true);
        fields.put("halogen_free", "no");
        fields.put("aec_qualified", false);
        fields.put("package", "SOIC-8");
        fields.put("lead_time_days", 42);
        fields.put("supplier_part_number", "595-LM358DR");
        fields.put("packaging", "Tape & Reel");
        fields.put("minimum_order_quantity", 1);
        fields.put("eccn_code", "EAR99");
        fields.put("hts_code", "8542.33.0001");
        return fields;
    }

    /**
     * The LM358 payload without the named fields.
     */
    public static Map<String, Object> lm358Without(String... fields) {
        Map<String, Object> values = lm358AllFields();
        for (String field : fields) {
            values.remove(field);
        }
        return values;
    }

    /**
     * The LM358 payload restricted to the named fields.
     */
    public static Map<String, Object> lm358Only(String... fields) {
        Map<String, Object> values = lm358AllFields();
        values.keySet().retainAll(Set.of(fields));
        return values;
    }
}
