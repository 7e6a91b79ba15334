package com.opspilot.domain.extraction.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * 条目分类建议：按关键字子串匹配，规则顺序即优先级。
 */
@Service
public class CategorySuggestDomainService {

    public static final String DEFAULT_CATEGORY = "general";

    private static final List<CategoryRule> RULES = List.of(
            new CategoryRule("electronics", List.of("cable", "usb", "charger", "adapter", "ssd", "hdmi")),
            new CategoryRule("office", List.of("paper", "pen", "notebook", "marker")),
            new CategoryRule("groceries", List.of("milk", "bread", "fruit", "water", "snack", "coffee")),
            new CategoryRule("supplies", List.of("cleaner", "soap", "detergent", "tissue"))
    );

    public String suggest(String itemName) {
        String lowered = StringUtils.defaultString(itemName).toLowerCase(Locale.ROOT);
        for (CategoryRule rule : RULES) {
            if (rule.matches(lowered)) {
                return rule.category();
            }
        }
        return DEFAULT_CATEGORY;
    }

    private record CategoryRule(String category, List<String> keywords) {

        boolean matches(String lowered) {
            for (String keyword : keywords) {
                if (lowered.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }
    }
}
