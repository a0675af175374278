package com.example.honeypot.intel;

import com.example.honeypot.model.FindingKind;
import com.example.honeypot.model.IntelligenceFinding;
import com.example.honeypot.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses free text into typed, normalized findings.
 * <p>
 * Patterns run in a fixed priority order (links, e-mails, payment handles, policy
 * and order references, phone numbers, bank accounts, keywords). Every span a pattern consumes is masked out
 * of the working copy before the next pattern runs, so a digit run inside a link
 * or a phone number is never reported twice.
 */
@Component
public class IntelligenceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(IntelligenceExtractor.class);

    private static final char MASK = '\u0000';
    private static final int SNIPPET_RADIUS = 24;

    static final Pattern URL_PATTERN = Pattern.compile(
            "(?i)\\b(?:https?://|www\\.)[^\\s<>\"']+");

    static final Pattern EMAIL_PATTERN = Pattern.compile(
            "(?<![\\w.%+-])[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    // provider has no dot: pramod@paytm, 98xxxx@ybl
    static final Pattern UPI_PATTERN = Pattern.compile(
            "(?<![\\w.])[A-Za-z0-9._]{2,}@[A-Za-z0-9]{2,}(?!\\.?[A-Za-z0-9])");

    // reference has a digit and at least four characters: LIC-987654, POLICY/2024/001, TXN#88213
    static final Pattern POLICY_NUMBER_PATTERN = Pattern.compile(
            "(?i)\\b(?:policy|pol|lic|insurance)(?:\\s*(?:no\\.?|number))?[\\s#:/-]{0,3}"
                    + "((?=[a-z0-9/-]*\\d)(?=[a-z0-9/-]{4})[a-z0-9]{2,15}(?:[/-][a-z0-9]{1,15}){0,3})\\b");

    static final Pattern ORDER_NUMBER_PATTERN = Pattern.compile(
            "(?i)\\b(?:order|ord|txn|transaction|shipment|delivery|parcel)(?:\\s*(?:id|no\\.?|number))?[\\s#:/-]{0,3}"
                    + "((?=[a-z0-9/-]*\\d)(?=[a-z0-9/-]{4})[a-z0-9]{2,15}(?:[/-][a-z0-9]{1,15}){0,3})\\b");

    // optional bracketed area code after the country code: +1 (555) 123-4567
    static final Pattern INTERNATIONAL_PHONE_PATTERN = Pattern.compile(
            "(?<![\\w+])\\+\\d{1,3}(?:[\\s.-]?\\(\\d{1,4}\\))?(?:[\\s.-]?\\d){7,14}(?!\\d)");

    static final Pattern DOMESTIC_MOBILE_PATTERN = Pattern.compile(
            "(?<![\\w+])0?[6-9]\\d{4}[\\s-]?\\d{5}(?!\\d)");

    static final Pattern AREA_CODE_PHONE_PATTERN = Pattern.compile(
            "(?<![\\w+])\\(\\d{3}\\)\\s?\\d{3}[\\s.-]\\d{4}(?!\\d)");

    // one unbroken run, or groups of at least four digits: 1234 5678 9012
    static final Pattern BANK_ACCOUNT_PATTERN = Pattern.compile(
            "(?<![\\w+])(?:\\d{10,18}|\\d{4,6}(?:[ -]\\d{4,6}){1,3})(?![\\w-])");

    private static final int MIN_ACCOUNT_DIGITS = 10;
    private static final int MAX_ACCOUNT_DIGITS = 18;

    static final List<String> SCAM_KEYWORDS = List.of(
            // urgency
            "urgent", "urgently", "immediately", "asap", "today", "hurry", "last chance", "limited time",
            // verification
            "verify", "confirm", "validate", "authenticate", "kyc", "update details",
            // credentials
            "otp", "cvv", "pin", "password", "account number",
            // account threats
            "blocked", "suspended", "locked", "frozen", "deactivated", "expired",
            // legal threats
            "legal action", "police", "arrest", "penalty", "court",
            // rewards
            "refund", "cashback", "prize", "winner", "lottery", "reward",
            // links and payment
            "click here", "link", "login", "upi", "payment", "transfer");

    private static final List<ExtractionRule> RULES = buildRules();

    /**
     * Extracts findings from one message. Never throws; malformed input yields an empty set.
     */
    public Set<IntelligenceFinding> extract(String text) {
        Set<IntelligenceFinding> findings = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return findings;
        }
        try {
            StringBuilder working = new StringBuilder(text);
            for (ExtractionRule rule : RULES) {
                List<int[]> consumed = new ArrayList<>();
                Matcher matcher = rule.pattern.matcher(working);
                while (matcher.find()) {
                    String value = rule.normalizer.apply(matcher.group(rule.group));
                    if (value == null || value.isEmpty()) {
                        continue;
                    }
                    findings.add(IntelligenceFinding.builder()
                            .kind(rule.kind)
                            .value(value)
                            .contextSnippet(snippet(text, matcher.start(), matcher.end()))
                            .build());
                    consumed.add(new int[]{matcher.start(), matcher.end()});
                }
                for (int[] span : consumed) {
                    for (int i = span[0]; i < span[1]; i++) {
                        working.setCharAt(i, MASK);
                    }
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Extraction failed, returning no findings: {}", e.getMessage());
            return new LinkedHashSet<>();
        }
        return findings;
    }

    /**
     * Extracts from every counterpart-authored message, in order.
     */
    public Set<IntelligenceFinding> extractAll(Collection<Message> messages) {
        Set<IntelligenceFinding> findings = new LinkedHashSet<>();
        if (messages == null) {
            return findings;
        }
        for (Message message : messages) {
            if (message != null && message.isFromCounterpart()) {
                findings.addAll(extract(message.getText()));
            }
        }
        return findings;
    }

    /**
     * Operator-facing summary such as "Extracted: 1 phone number(s), 2 suspicious link(s)".
     */
    public String summarize(Collection<IntelligenceFinding> findings) {
        Map<FindingKind, Long> counts = new EnumMap<>(FindingKind.class);
        for (IntelligenceFinding finding : findings) {
            if (finding.isActionable()) {
                counts.merge(finding.getKind(), 1L, Long::sum);
            }
        }
        if (counts.isEmpty()) {
            return "No intelligence extracted yet";
        }
        return counts.entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey().getLabel() + "(s)")
                .collect(Collectors.joining(", ", "Extracted: ", ""));
    }

    private static List<ExtractionRule> buildRules() {
        List<ExtractionRule> rules = new ArrayList<>();
        rules.add(new ExtractionRule(FindingKind.URL, URL_PATTERN, IntelligenceExtractor::trimUrl));
        rules.add(new ExtractionRule(FindingKind.EMAIL, EMAIL_PATTERN, IntelligenceExtractor::lower));
        rules.add(new ExtractionRule(FindingKind.UPI_HANDLE, UPI_PATTERN, IntelligenceExtractor::lower));
        rules.add(new ExtractionRule(FindingKind.POLICY_NUMBER, POLICY_NUMBER_PATTERN, 1, IntelligenceExtractor::upper));
        rules.add(new ExtractionRule(FindingKind.ORDER_NUMBER, ORDER_NUMBER_PATTERN, 1, IntelligenceExtractor::upper));
        rules.add(new ExtractionRule(FindingKind.PHONE_NUMBER, INTERNATIONAL_PHONE_PATTERN,
                raw -> "+" + digitsOnly(raw)));
        rules.add(new ExtractionRule(FindingKind.PHONE_NUMBER, DOMESTIC_MOBILE_PATTERN,
                raw -> stripTrunkPrefix(digitsOnly(raw))));
        rules.add(new ExtractionRule(FindingKind.PHONE_NUMBER, AREA_CODE_PHONE_PATTERN,
                IntelligenceExtractor::digitsOnly));
        rules.add(new ExtractionRule(FindingKind.BANK_ACCOUNT, BANK_ACCOUNT_PATTERN,
                IntelligenceExtractor::accountDigits));
        for (String keyword : SCAM_KEYWORDS) {
            rules.add(new ExtractionRule(FindingKind.KEYWORD, keywordPattern(keyword), raw -> keyword));
        }
        return List.copyOf(rules);
    }

    private static Pattern keywordPattern(String keyword) {
        String body = Arrays.stream(keyword.split(" "))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
        return Pattern.compile("(?<!\\w)" + body + "(?!\\w)", Pattern.CASE_INSENSITIVE);
    }

    static String trimUrl(String raw) {
        int end = raw.length();
        while (end > 0 && ".,;:!?)]}'\"".indexOf(raw.charAt(end - 1)) >= 0) {
            end--;
        }
        return raw.substring(0, end);
    }

    private static String lower(String raw) {
        return raw.toLowerCase(Locale.ROOT);
    }

    private static String upper(String raw) {
        return raw.toUpperCase(Locale.ROOT);
    }

    private static String accountDigits(String raw) {
        String digits = digitsOnly(raw);
        return digits.length() >= MIN_ACCOUNT_DIGITS && digits.length() <= MAX_ACCOUNT_DIGITS ? digits : null;
    }

    private static String digitsOnly(String raw) {
        return raw.replaceAll("\\D", "");
    }

    private static String stripTrunkPrefix(String digits) {
        return digits.length() == 11 && digits.charAt(0) == '0' ? digits.substring(1) : digits;
    }

    private static String snippet(String text, int start, int end) {
        int from = Math.max(0, start - SNIPPET_RADIUS);
        int to = Math.min(text.length(), end + SNIPPET_RADIUS);
        return text.substring(from, to).replaceAll("\\s+", " ").trim();
    }

    private static final class ExtractionRule {
        private final FindingKind kind;
        private final Pattern pattern;
        private final int group;
        private final Function<String, String> normalizer;

        private ExtractionRule(FindingKind kind, Pattern pattern, Function<String, String> normalizer) {
            this(kind, pattern, 0, normalizer);
        }

        private ExtractionRule(FindingKind kind, Pattern pattern, int group, Function<String, String> normalizer) {
            this.kind = kind;
            this.pattern = pattern;
            this.group = group;
            this.normalizer = normalizer;
        }
    }
}
