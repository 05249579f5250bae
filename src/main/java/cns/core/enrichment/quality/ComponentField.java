package cns.core.enrichment.quality;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum ComponentField {
    MPN("mpn", FieldTier.REQUIRED, FieldKind.TEXT),
    MANUFACTURER("manufacturer", FieldTier.REQUIRED, FieldKind.TEXT),
    DESCRIPTION("description", FieldTier.REQUIRED, FieldKind.TEXT),
    CATEGORY("category", FieldTier.REQUIRED, FieldKind.TEXT),

    PRICE_BREAKS("price_breaks", FieldTier.HIGH_PRIORITY, FieldKind.LIST),
    UNIT_PRICE("unit_price", FieldTier.HIGH_PRIORITY, FieldKind.DECIMAL),
    STOCK_QUANTITY("stock_quantity", FieldTier.HIGH_PRIORITY, FieldKind.INTEGER),
    LIFECYCLE_STATUS("lifecycle_status", FieldTier.HIGH_PRIORITY, FieldKind.TEXT),
    PARAMETERS("parameters", FieldTier.HIGH_PRIORITY, FieldKind.MAP),
    DATASHEET_URL("datasheet_url", FieldTier.HIGH_PRIORITY, FieldKind.URL),

    IMAGE_URL("image_url", FieldTier.RECOMMENDED, FieldKind.URL),
    ROHS_COMPLIANT("rohs_compliant", FieldTier.RECOMMENDED, FieldKind.BOOLEAN),
    REACH_COMPLIANT("reach_compliant", FieldTier.RECOMMENDED, FieldKind.BOOLEAN),
    HALOGEN_FREE("halogen_free", FieldTier.RECOMMENDED, FieldKind.BOOLEAN),
    AEC_QUALIFIED("aec_qualified", FieldTier.RECOMMENDED, FieldKind.BOOLEAN),
    PACKAGE("package", FieldTier.RECOMMENDED, FieldKind.TEXT),
    LEAD_TIME_DAYS("lead_time_days", FieldTier.RECOMMENDED, FieldKind.INTEGER),
    SUPPLIER_PART_NUMBER("supplier_part_number", FieldTier.RECOMMENDED, FieldKind.TEXT),
    PACKAGING("packaging", FieldTier.RECOMMENDED, FieldKind.TEXT),
    MINIMUM_ORDER_QUANTITY("minimum_order_quantity", FieldTier.RECOMMENDED, FieldKind.INTEGER),
    ECCN_CODE("eccn_code", FieldTier.RECOMMENDED, FieldKind.TEXT),
    HTS_CODE("hts_code", FieldTier.RECOMMENDED, FieldKind.TEXT);

    private static final Map<String, ComponentField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ComponentField::key, Function.identity()));

    private final String key;
    private final FieldTier tier;
    private final FieldKind kind;

    ComponentField(String key, FieldTier tier, FieldKind kind) {
        this.key = key;
        this.tier = tier;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public FieldTier tier() {
        return tier;
    }

    public FieldKind kind() {
        return kind;
    }

    public static Optional<ComponentField> fromKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }

    public static List<ComponentField> inTier(FieldTier tier) {
        return Arrays.stream(values())
                .filter(field -> field.tier == tier)
                .toList();
    }
}
