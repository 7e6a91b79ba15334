package com.opspilot.domain.extraction.service;

import com.opspilot.domain.extraction.model.valobj.ReceiptExtraction;
import com.opspilot.domain.extraction.model.valobj.ReceiptItem;
import com.opspilot.domain.text.service.TextNormalizeDomainService;
import com.opspilot.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 收据解析领域服务：确定性兜底解析与条目归一。
 * <p>
 * 兜底解析是全函数，任意输入都返回结果，最差为空条目列表。
 * </p>
 */
@Service
public class ReceiptParseDomainService {

    private static final int VENDOR_MAX_LENGTH = 100;

    private static final List<LinePattern> LINE_PATTERNS = List.of(
            new LinePattern(Pattern.compile("^(?<qty>\\d+(?:\\.\\d+)?)\\s*(?:x|X)\\s*(?<name>[A-Za-z0-9\\-\\s]+)$"),
                    false),
            new LinePattern(Pattern.compile("^(?<name>[A-Za-z0-9\\-\\s]+)\\s+(?<qty>\\d+(?:\\.\\d+)?)\\s*(?<unit>[A-Za-z]+)?"
                    + "\\s*(?:\\$?(?<price>\\d+(?:\\.\\d+)?))?$"), true)
    );

    private final TextNormalizeDomainService textNormalizeDomainService;
    private final CategorySuggestDomainService categorySuggestDomainService;
    private final Clock clock;

    public ReceiptParseDomainService(TextNormalizeDomainService textNormalizeDomainService,
                                     CategorySuggestDomainService categorySuggestDomainService,
                                     Clock clock) {
        this.textNormalizeDomainService = textNormalizeDomainService;
        this.categorySuggestDomainService = categorySuggestDomainService;
        this.clock = clock;
    }

    public String normalizeText(String rawText) {
        return textNormalizeDomainService.normalizeDocument(rawText);
    }

    /**
     * 兜底解析：首个非空行为供应商，其余行依次尝试 “qty x name” 与 “name qty [unit] [$price]”；
     * 无任何命中时按逗号拆分 “name, qty”。
     *
     * @param normalizedText 已归一的收据文本
     */
    public ReceiptExtraction parseFallback(String normalizedText) {
        List<String> lines = new ArrayList<>();
        for (String line : StringUtils.defaultString(normalizedText).split("\n")) {
            if (StringUtils.isNotBlank(line)) {
                lines.add(line.trim());
            }
        }
        String vendor = lines.isEmpty() ? null : StringUtils.left(lines.get(0), VENDOR_MAX_LENGTH);
        List<String> body = lines.isEmpty() ? List.of() : lines.subList(1, lines.size());

        List<ReceiptItem> items = new ArrayList<>();
        for (String line : body) {
            if (line.length() < 2) {
                continue;
            }
            LineMatch match = matchLine(line);
            if (match == null) {
                continue;
            }
            Matcher matcher = match.matcher();
            String name = StringUtils.trimToEmpty(matcher.group("name"));
            if (name.isEmpty()) {
                continue;
            }
            String unit = match.withUnitAndPrice() ? matcher.group("unit") : null;
            String price = match.withUnitAndPrice() ? matcher.group("price") : null;
            items.add(ReceiptItem.builder()
                    .name(name)
                    .quantity(Double.parseDouble(matcher.group("qty")))
                    .unit(unit == null ? Constants.DEFAULT_UNIT : unit.toLowerCase(Locale.ROOT))
                    .vendor(vendor)
                    .category(categorySuggestDomainService.suggest(name))
                    .price(price == null ? null : Double.parseDouble(price))
                    .build());
        }

        if (items.isEmpty()) {
            for (String line : body) {
                ReceiptItem item = parseCommaLine(line, vendor);
                if (item != null) {
                    items.add(item);
                }
            }
        }

        return ReceiptExtraction.builder()
                .vendor(vendor)
                .date(LocalDate.now(clock.withZone(ZoneOffset.UTC)).toString())
                .items(items)
                .build();
    }

    /**
     * 从模型 JSON 构造抽取结果。
     *
     * @throws IllegalArgumentException 结构不合法
     */
    public ReceiptExtraction fromPayload(Map<String, Object> payload) {
        if (payload == null) {
            throw new IllegalArgumentException("receipt payload is empty");
        }
        Object rawItems = payload.get("items");
        if (!(rawItems instanceof List<?>)) {
            throw new IllegalArgumentException("receipt items must be a list");
        }
        List<ReceiptItem> items = new ArrayList<>();
        for (Object rawItem : (List<?>) rawItems) {
            if (!(rawItem instanceof Map<?, ?> item)) {
                throw new IllegalArgumentException("receipt item must be an object");
            }
            Object name = item.get("name");
            if (!(name instanceof String)) {
                throw new IllegalArgumentException("receipt item name is required");
            }
            Double quantity = toDouble(item.get("quantity"));
            items.add(ReceiptItem.builder()
                    .name((String) name)
                    .quantity(quantity == null ? 1D : quantity)
                    .unit(item.get("unit") == null ? Constants.DEFAULT_UNIT : String.valueOf(item.get("unit")))
                    .vendor(text(item.get("vendor")))
                    .category(text(item.get("category")))
                    .price(toDouble(item.get("price")))
                    .build());
        }
        return ReceiptExtraction.builder()
                .vendor(text(payload.get("vendor")))
                .date(text(payload.get("date")))
                .items(items)
                .build();
    }

    /**
     * 条目归一：丢弃空名称，非正或非有限数量改为 1，补全单位、分类与供应商。
     */
    public ReceiptExtraction normalize(ReceiptExtraction extraction) {
        if (extraction == null) {
            return ReceiptExtraction.builder().build();
        }
        String receiptVendor = StringUtils.left(StringUtils.trimToNull(extraction.getVendor()), VENDOR_MAX_LENGTH);
        List<ReceiptItem> normalized = new ArrayList<>();
        List<ReceiptItem> items = extraction.getItems() == null ? List.of() : extraction.getItems();
        for (ReceiptItem item : items) {
            if (item == null || StringUtils.isBlank(item.getName())) {
                continue;
            }
            String name = item.getName().trim();
            Double quantity = item.getQuantity();
            String category = StringUtils.trimToEmpty(item.getCategory()).toLowerCase(Locale.ROOT);
            String vendor = StringUtils.trimToNull(
                    StringUtils.isNotEmpty(item.getVendor()) ? item.getVendor() : receiptVendor);
            normalized.add(item.toBuilder()
                    .name(name)
                    .quantity(quantity == null || !Double.isFinite(quantity) || quantity <= 0 ? 1D : quantity)
                    .unit(StringUtils.defaultIfBlank(StringUtils.trimToEmpty(item.getUnit()), Constants.DEFAULT_UNIT))
                    .category(category.isEmpty() ? categorySuggestDomainService.suggest(name) : category)
                    .vendor(StringUtils.left(vendor, VENDOR_MAX_LENGTH))
                    .build());
        }
        return ReceiptExtraction.builder()
                .vendor(receiptVendor)
                .date(extraction.getDate())
                .items(normalized)
                .build();
    }

    private LineMatch matchLine(String line) {
        for (LinePattern linePattern : LINE_PATTERNS) {
            Matcher matcher = linePattern.pattern().matcher(line);
            if (matcher.matches()) {
                return new LineMatch(matcher, linePattern.withUnitAndPrice());
            }
        }
        return null;
    }

    private ReceiptItem parseCommaLine(String line, String vendor) {
        if (!line.contains(",")) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (String part : line.split(",")) {
            if (StringUtils.isNotBlank(part)) {
                parts.add(part.trim());
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        String name = parts.get(0);
        Double quantity = parts.size() > 1 ? toDouble(parts.get(1)) : null;
        return ReceiptItem.builder()
                .name(name)
                .quantity(quantity == null ? 1D : quantity)
                .unit(Constants.DEFAULT_UNIT)
                .vendor(vendor)
                .category(categorySuggestDomainService.suggest(name))
                .build();
    }

    private String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(String.valueOf(value).trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * 行模式；withUnitAndPrice 表示模式声明了 unit 与 price 分组。
     */
    private record LinePattern(Pattern pattern, boolean withUnitAndPrice) {
    }

    private record LineMatch(Matcher matcher, boolean withUnitAndPrice) {
    }
}
