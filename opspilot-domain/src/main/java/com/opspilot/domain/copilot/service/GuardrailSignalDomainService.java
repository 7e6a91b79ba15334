package com.opspilot.domain.copilot.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 护栏信号领域服务：对提问计算相互独立的布尔信号。
 * <p>
 * 只负责识别，不负责评分与判定。
 * </p>
 */
@Service
public class GuardrailSignalDomainService {

    private static final List<Pattern> INVENTORY_INTENT_PATTERNS = compile(
            "\\binventory\\b",
            "\\blow stock\\b",
            "\\bin stock\\b",
            "\\bout of stock\\b",
            "\\bvendor\\b",
            "\\bsupplier\\b",
            "\\bstock levels?\\b",
            "\\bavailable\\b",
            "\\bavailability\\b",
            "\\bon hand\\b",
            "\\bcategory\\b",
            "\\bstatus\\b",
            "\\bquantity\\b",
            "\\bquantities\\b",
            "\\bsku\\b",
            "\\bitem\\b",
            "\\bitems\\b",
            "\\bdo we have\\b",
            "\\bhave\\b",
            "\\bfind\\b",
            "\\bsearch\\b",
            "\\blist\\b",
            "\\bshow\\b",
            "\\bcount\\b",
            "\\bhow many\\b",
            "\\bsum\\b",
            "\\btotal\\b"
    );

    // 不含 have / list / show 等泛化动词
    private static final List<Pattern> STRONG_INVENTORY_INTENT_PATTERNS = compile(
            "\\binventory\\b",
            "\\blow stock\\b",
            "\\bin stock\\b",
            "\\bout of stock\\b",
            "\\bvendor\\b",
            "\\bsupplier\\b",
            "\\bstock levels?\\b",
            "\\bavailable\\b",
            "\\bavailability\\b",
            "\\bon hand\\b",
            "\\bcategory\\b",
            "\\bstatus\\b",
            "\\bquantity\\b",
            "\\bquantities\\b",
            "\\bsku\\b",
            "\\bitem\\b",
            "\\bitems\\b",
            "\\bdo we have\\b",
            "\\bfind\\b",
            "\\bsearch\\b",
            "\\bcount\\b",
            "\\bhow many\\b",
            "\\bsum\\b",
            "\\btotal\\b"
    );

    private static final Pattern SYSTEM_TAG_PATTERN = Pattern.compile("<\\s*/?\\s*system\\s*>");

    private static final List<Pattern> PROMPT_INJECTION_PATTERNS = List.of(
            Pattern.compile("\\b(ignore|disregard|forget|override)\\b.{0,40}\\b(instruction|instructions|prompt|system|developer|guardrail|policy)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(reveal|show|print|leak|expose)\\b.{0,40}\\b(system prompt|developer message|hidden prompt|internal prompt|chain of thought|cot)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(role\\s*:\\s*(system|assistant|developer))\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(jailbreak|developer mode|dan)\\b", Pattern.CASE_INSENSITIVE),
            SYSTEM_TAG_PATTERN
    );

    private static final List<Pattern> OUT_OF_SCOPE_PATTERNS = compile(
            "\\bweather\\b",
            "\\bforecast\\b",
            "\\bnews\\b",
            "\\bpresident\\b",
            "\\bprime minister\\b",
            "\\bcapital of\\b",
            "\\bbitcoin\\b",
            "\\bcrypto\\b",
            "\\bstock market\\b",
            "\\btranslate\\b",
            "\\bpoem\\b",
            "\\bjoke\\b",
            "\\bwrite code\\b",
            "\\bpython\\b",
            "\\bjavascript\\b",
            "^who is\\b",
            "^what is\\b"
    );

    private static final List<Pattern> FINANCE_MARKET_PATTERNS = compile(
            "\\bstock exchange\\b",
            "\\bstock market\\b",
            "\\bshare price\\b",
            "\\bshares?\\b",
            "\\bequities?\\b",
            "\\bmarket cap\\b",
            "\\bticker\\b",
            "\\bnasdaq\\b",
            "\\bnyse\\b",
            "\\bdow jones\\b",
            "\\bs&p\\b"
    );

    private static final List<Pattern> SQL_LIKE_PATTERNS = List.of(
            Pattern.compile("\\bselect\\b[\\s\\S]{0,120}\\bfrom\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\binsert\\s+into\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bupdate\\b[\\s\\S]{0,120}\\bset\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdelete\\s+from\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdrop\\s+table\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\balter\\s+table\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\btruncate\\s+table\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bunion\\s+select\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\binformation_schema\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsqlite_master\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpragma\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--"),
            Pattern.compile("/\\*")
    );

    private static final Pattern QUOTED_TERM_PATTERN = Pattern.compile("[\"'][^\"']+[\"']");
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[a-z0-9_'-]+");

    private static final Set<String> COMMAND_TERMS = Set.of("ignore", "disregard", "override", "forget");
    private static final Set<String> CONTROL_TERMS = Set.of(
            "instruction", "instructions", "prompt", "system", "developer", "policy", "guardrail");
    private static final Set<String> REVEAL_TERMS = Set.of("reveal", "show", "print", "leak", "expose");
    private static final Set<String> SECRET_TERMS = Set.of(
            "system", "prompt", "hidden", "internal", "developer", "instruction", "instructions");
    private static final Set<String> IMPERSONATION_TERMS = Set.of("system", "assistant", "developer");

    /**
     * 计算信号。
     *
     * @param query 已归一的原始提问（保留大小写，用于识别引号内的条目名）
     * @return 信号集合
     */
    public GuardrailSignals detect(String query) {
        String original = query == null ? "" : query.trim();
        String lowered = original.toLowerCase(Locale.ROOT);
        if (lowered.isEmpty()) {
            return GuardrailSignals.empty();
        }

        List<String> tokens = tokenize(lowered);
        boolean injectionRegex = matchesAny(PROMPT_INJECTION_PATTERNS, lowered);
        boolean injectionFuzzy = (FuzzyTermMatcher.hasTermLike(tokens, COMMAND_TERMS)
                && FuzzyTermMatcher.hasTermLike(tokens, CONTROL_TERMS))
                || (FuzzyTermMatcher.hasTermLike(tokens, REVEAL_TERMS)
                && FuzzyTermMatcher.hasTermLike(tokens, SECRET_TERMS))
                || (tokens.contains("role") && FuzzyTermMatcher.hasTermLike(tokens, IMPERSONATION_TERMS));

        return new GuardrailSignals(
                false,
                matchesAny(INVENTORY_INTENT_PATTERNS, lowered),
                matchesAny(STRONG_INVENTORY_INTENT_PATTERNS, lowered),
                injectionRegex,
                injectionFuzzy,
                SYSTEM_TAG_PATTERN.matcher(lowered).find(),
                matchesAny(OUT_OF_SCOPE_PATTERNS, lowered),
                matchesAny(FINANCE_MARKET_PATTERNS, lowered),
                matchesAny(SQL_LIKE_PATTERNS, lowered),
                QUOTED_TERM_PATTERN.matcher(original).find(),
                lowered.split("\\s+").length
        );
    }

    private List<String> tokenize(String lowered) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(lowered);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex));
        }
        return List.copyOf(patterns);
    }

    /**
     * 护栏信号快照。
     */
    public record GuardrailSignals(boolean emptyQuery,
                                   boolean inventoryIntent,
                                   boolean strongInventoryIntent,
                                   boolean promptInjectionRegex,
                                   boolean promptInjectionFuzzy,
                                   boolean systemTag,
                                   boolean outOfScopeIntent,
                                   boolean financeMarketIntent,
                                   boolean sqlLikeSyntax,
                                   boolean quotedTerm,
                                   int wordCount) {

        public static GuardrailSignals empty() {
            return new GuardrailSignals(true, false, false, false, false, false,
                    false, false, false, false, 0);
        }

        public boolean promptInjection() {
            return promptInjectionRegex || promptInjectionFuzzy;
        }
    }
}
