package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.model.MoneyMention;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.SignalsBundle;
import com.example.mailtriage.model.TimePhrase;
import com.example.mailtriage.model.TimePhraseType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls observable signals (links, money amounts, time phrases) out of the decoded body.
 * Pure: the same message always yields the same bundle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalExtractor {

    private static final Pattern URL = Pattern.compile("\\bhttps?://[^\\s<>()\"']+", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL_TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?'\")\\]}>]+$");

    private static final String AMOUNT = "(\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.(\\d+))?";
    private static final String CODES = "USD|EUR|GBP|JPY|CAD|AUD|CHF|INR|CNY";

    private static final Pattern MONEY_SYMBOL_PREFIX = Pattern.compile(
            "((?<![A-Za-z])(?:US|C|A)\\$|[$€£₹¥])\\s?" + AMOUNT + "(?![\\d,]*\\d)");
    private static final Pattern MONEY_CODE_PREFIX = Pattern.compile(
            "\\b(" + CODES + ")\\s?" + AMOUNT + "\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONEY_SUFFIX = Pattern.compile(
            "(?<![\\w.,])" + AMOUNT + "\\s?(" + CODES + "|dollars|euros|pounds)\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> SYMBOL_CURRENCIES = Map.of(
            "$", "USD",
            "US$", "USD",
            "C$", "CAD",
            "A$", "AUD",
            "€", "EUR",
            "£", "GBP",
            "₹", "INR");
    private static final Map<String, String> WORD_CURRENCIES = Map.of(
            "dollars", "USD",
            "euros", "EUR",
            "pounds", "GBP");

    private static final String TIME_OF_DAY =
            "(?:(?:[01]?\\d|2[0-3]):[0-5]\\d(?:\\s?[ap]m)?|(?:1[0-2]|0?[1-9])\\s?[ap]m|noon|midnight)";
    private static final String WEEKDAY =
            "(?:monday|tuesday|wednesday|thursday|friday|saturday|sunday|mon|tue|tues|wed|thu|thur|thurs|fri)";
    private static final String MONTH =
            "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";
    private static final String AT_TIME = "(?:\\s+(?:at\\s+)?" + TIME_OF_DAY + ")?";

    private static final List<PhrasePattern> PHRASE_PATTERNS = List.of(
            new PhrasePattern(TimePhraseType.RECURRING,
                    "\\b(?:every|each)\\s+(?:other\\s+)?(?:day|week|month|year|morning|afternoon|evening|night|weekday|"
                            + WEEKDAY + "|\\d+\\s+(?:days|weeks|months))" + AT_TIME + "\\b"),
            new PhrasePattern(TimePhraseType.RECURRING,
                    "\\b(?:daily|weekly|bi-?weekly|monthly|quarterly|annually|yearly)\\b"),
            new PhrasePattern(TimePhraseType.RELATIVE,
                    "\\b(?:by\\s+)?(?:today|tonight|tomorrow|the\\s+day\\s+after\\s+tomorrow)" + AT_TIME + "\\b"),
            new PhrasePattern(TimePhraseType.RELATIVE,
                    "\\b(?:by\\s+)?(?:eod|cob|asap|end\\s+of\\s+(?:the\\s+)?(?:day|week|month))\\b"),
            new PhrasePattern(TimePhraseType.RELATIVE,
                    "\\b(?:in|within)\\s+\\d+\\s+(?:minutes?|hours?|days?|weeks?|months?)\\b"),
            new PhrasePattern(TimePhraseType.RELATIVE,
                    "\\b(?:next|this)\\s+week\\b"),
            new PhrasePattern(TimePhraseType.ABSOLUTE,
                    "\\b(?:(?:next|this|on|by)\\s+)?" + WEEKDAY + "\\b" + AT_TIME + "\\b"),
            new PhrasePattern(TimePhraseType.ABSOLUTE,
                    "\\b" + MONTH + "\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?(?:,?\\s+\\d{4})?" + AT_TIME + "\\b"),
            new PhrasePattern(TimePhraseType.ABSOLUTE,
                    "\\b\\d{1,2}(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTH + "\\b(?:,?\\s+\\d{4})?"),
            new PhrasePattern(TimePhraseType.ABSOLUTE,
                    "\\b\\d{4}-\\d{2}-\\d{2}(?:[T ]\\d{2}:\\d{2}(?::\\d{2})?)?\\b"),
            new PhrasePattern(TimePhraseType.ABSOLUTE,
                    "\\b\\d{1,2}/\\d{1,2}(?:/\\d{2,4})?\\b"),
            new PhrasePattern(TimePhraseType.ABSOLUTE,
                    "\\b" + TIME_OF_DAY + "\\b"));

    private final PipelineSettings settings;

    public SignalsBundle extract(NormalizedMessage message) {
        String text = message != null && message.getBodyText() != null ? message.getBodyText() : "";
        if (text.isBlank()) {
            return SignalsBundle.empty();
        }
        int limit = Math.max(0, settings.getMaxSignals());
        try {
            SignalsBundle bundle = SignalsBundle.builder()
                    .urls(extractUrls(text, limit))
                    .moneyMentions(extractMoney(text, limit))
                    .timePhrases(extractTimePhrases(text, limit))
                    .build();
            log.debug("Signals for message {}: urls={} money={} timePhrases={}",
                    message.getMessageId(), bundle.getUrls().size(), bundle.getMoneyMentions().size(),
                    bundle.getTimePhrases().size());
            return bundle;
        } catch (RuntimeException e) {
            log.warn("Signal extraction failed for message {}, continuing without signals: {}",
                    message.getMessageId(), e.toString());
            return SignalsBundle.empty();
        }
    }

    Set<String> extractUrls(String text, int limit) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL.matcher(text);
        while (matcher.find() && urls.size() < limit) {
            String url = URL_TRAILING_PUNCTUATION.matcher(matcher.group()).replaceAll("");
            String normalized = normalizeUrl(url);
            if (normalized != null) {
                urls.add(normalized);
            }
        }
        return urls;
    }

    /**
     * Lower-cases scheme and authority; path, query and fragment stay as written.
     */
    static String normalizeUrl(String url) {
        int schemeEnd = url.indexOf("://");
        if (schemeEnd < 0) {
            return null;
        }
        int authorityStart = schemeEnd + 3;
        int authorityEnd = url.length();
        for (int i = authorityStart; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                authorityEnd = i;
                break;
            }
        }
        if (authorityEnd == authorityStart) {
            return null;
        }
        return url.substring(0, authorityEnd).toLowerCase(Locale.ROOT) + url.substring(authorityEnd);
    }

    List<MoneyMention> extractMoney(String text, int limit) {
        List<Span<MoneyMention>> spans = new ArrayList<>();

        Matcher symbol = MONEY_SYMBOL_PREFIX.matcher(text);
        while (symbol.find()) {
            spans.add(new Span<>(symbol.start(), symbol.end(),
                    money(symbol.group().trim(), SYMBOL_CURRENCIES.get(symbol.group(1)), symbol.group(2), symbol.group(3))));
        }
        Matcher code = MONEY_CODE_PREFIX.matcher(text);
        while (code.find()) {
            spans.add(new Span<>(code.start(), code.end(),
                    money(code.group().trim(), code.group(1).toUpperCase(Locale.ROOT), code.group(2), code.group(3))));
        }
        Matcher suffix = MONEY_SUFFIX.matcher(text);
        while (suffix.find()) {
            String unit = suffix.group(3).toLowerCase(Locale.ROOT);
            String currency = WORD_CURRENCIES.getOrDefault(unit, unit.toUpperCase(Locale.ROOT));
            spans.add(new Span<>(suffix.start(), suffix.end(),
                    money(suffix.group().trim(), currency, suffix.group(1), suffix.group(2))));
        }

        List<MoneyMention> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Span<MoneyMention> span : longestFirst(spans)) {
            if (out.size() >= limit) {
                break;
            }
            if (seen.add(span.value.getRawText())) {
                out.add(span.value);
            }
        }
        return out;
    }

    private static MoneyMention money(String rawText, String currency, String integerPart, String fraction) {
        String digits = integerPart.replace(",", "");
        BigDecimal amount = new BigDecimal(fraction != null ? digits + "." + fraction : digits);
        return MoneyMention.builder()
                .rawText(rawText)
                .currency(currency)
                .amount(amount)
                .build();
    }

    List<TimePhrase> extractTimePhrases(String text, int limit) {
        List<Span<TimePhrase>> spans = new ArrayList<>();
        for (PhrasePattern phrase : PHRASE_PATTERNS) {
            Matcher matcher = phrase.pattern.matcher(text);
            while (matcher.find()) {
                String raw = matcher.group().trim();
                if (!raw.isEmpty()) {
                    spans.add(new Span<>(matcher.start(), matcher.end(), new TimePhrase(raw, phrase.type)));
                }
            }
        }

        List<TimePhrase> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Span<TimePhrase> span : longestFirst(spans)) {
            if (out.size() >= limit) {
                break;
            }
            if (seen.add(span.value.getRawText().toLowerCase(Locale.ROOT))) {
                out.add(span.value);
            }
        }
        return out;
    }

    /**
     * Keeps the longest of any overlapping spans (earlier start on ties), returned in text order.
     */
    static <T> List<Span<T>> longestFirst(List<Span<T>> spans) {
        List<Span<T>> bySize = new ArrayList<>(spans);
        bySize.sort(Comparator.<Span<T>>comparingInt(span -> span.end - span.start).reversed()
                .thenComparingInt(span -> span.start));
        List<Span<T>> accepted = new ArrayList<>();
        for (Span<T> candidate : bySize) {
            boolean overlaps = false;
            for (Span<T> kept : accepted) {
                if (candidate.start < kept.end && kept.start < candidate.end) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                accepted.add(candidate);
            }
        }
        accepted.sort(Comparator.comparingInt(span -> span.start));
        return accepted;
    }

    static final class Span<T> {
        final int start;
        final int end;
        final T value;

        Span(int start, int end, T value) {
            this.start = start;
            this.end = end;
            this.value = value;
        }
    }

    private static final class PhrasePattern {
        final TimePhraseType type;
        final Pattern pattern;

        PhrasePattern(TimePhraseType type, String regex) {
            this.type = type;
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }
    }
}
