package com.opspilot.domain.copilot.model.valobj;

import com.opspilot.types.enums.PlanFilterFieldEnum;
import com.opspilot.types.enums.PlanFilterOperatorEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * 计划过滤条件 (field, operator, value)。
 * <p>
 * 取值按字段类型归一：文本字段为 String，quantity 为 Double，low_stock 为 Boolean。
 * 字段与运算符不兼容或取值无法转换时构造失败。
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PlanFilter {

    private final PlanFilterFieldEnum field;
    private final PlanFilterOperatorEnum op;
    private final Object value;

    private PlanFilter(PlanFilterFieldEnum field, PlanFilterOperatorEnum op, Object value) {
        this.field = field;
        this.op = op;
        this.value = value;
    }

    public static PlanFilter of(PlanFilterFieldEnum field, PlanFilterOperatorEnum op, Object value) {
        if (field == null) {
            throw new IllegalArgumentException("filter field is required");
        }
        if (op == null) {
            throw new IllegalArgumentException("filter operator is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("filter value is required for field " + field.getCode());
        }
        if (!supports(field, op)) {
            throw new IllegalArgumentException("Unsupported operator '" + op.getCode()
                    + "' for field '" + field.getCode() + "'");
        }
        return new PlanFilter(field, op, coerceValue(field, value));
    }

    public static boolean supports(PlanFilterFieldEnum field, PlanFilterOperatorEnum op) {
        switch (field) {
            case NAME:
            case VENDOR:
            case CATEGORY:
            case UNIT:
                return op == PlanFilterOperatorEnum.EQ || op == PlanFilterOperatorEnum.CONTAINS;
            case STATUS:
            case LOW_STOCK:
                return op == PlanFilterOperatorEnum.EQ;
            case QUANTITY:
                return op != PlanFilterOperatorEnum.CONTAINS;
            default:
                throw new IllegalStateException("Unhandled filter field: " + field);
        }
    }

    private static Object coerceValue(PlanFilterFieldEnum field, Object value) {
        switch (field.getValueType()) {
            case TEXT:
                return String.valueOf(value).trim();
            case NUMBER:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                try {
                    return Double.parseDouble(String.valueOf(value).trim());
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("Invalid quantity value '" + value + "'");
                }
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
                return "true".equals(text) || "1".equals(text) || "yes".equals(text);
            default:
                throw new IllegalStateException("Unhandled value type: " + field.getValueType());
        }
    }
}
