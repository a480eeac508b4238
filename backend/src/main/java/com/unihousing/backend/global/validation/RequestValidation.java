package com.unihousing.backend.global.validation;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.unihousing.backend.global.error.ProblemException;

/**
 * Field checks shared by the request validators. Each check either returns the parsed value
 * or throws a 400 {@link ProblemException} with one of the codes below.
 */
public final class RequestValidation {

    public static final String MISSING_FIELD = "MISSING_FIELD";
    public static final String TOO_LONG = "TOO_LONG";
    public static final String INVALID_ENUM = "INVALID_ENUM";
    public static final String INVALID_DATE = "INVALID_DATE";

    public static final int TITLE_MAX_LENGTH = 200;
    public static final int DESCRIPTION_MAX_LENGTH = 5000;

    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern MONTH_PATTERN = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Pattern CODE_SEPARATORS = Pattern.compile("[\\s-]+");

    private RequestValidation() {
    }

    /**
     * Fails when any of the named fields is null or blank. Field order is kept so the message
     * reads in declaration order: {@code "title, type are required"}.
     */
    public static void requireFields(Map<String, ?> fields) {
        List<String> missing = new ArrayList<>();
        fields.forEach((name, value) -> {
            if (value == null || (value instanceof String text && text.isBlank())) {
                missing.add(name);
            }
        });
        if (!missing.isEmpty()) {
            String verb = missing.size() == 1 ? " is required" : " are required";
            throw ProblemException.badRequest(MISSING_FIELD, String.join(", ", missing) + verb);
        }
    }

    public static Map<String, Object> fields() {
        return new LinkedHashMap<>();
    }

    public static void requireMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw ProblemException.badRequest(TOO_LONG, field + " must be at most " + maxLength + " characters");
        }
    }

    /**
     * Lower-cases and folds spaces and dashes to underscores: {@code "In Progress"} becomes
     * {@code "in_progress"}.
     */
    public static String normalizeCode(String raw) {
        if (raw == null) {
            return null;
        }
        return CODE_SEPARATORS.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    public static <E extends Enum<E> & CodedEnum> Optional<E> findByCode(Class<E> type, String raw) {
        String normalized = normalizeCode(raw);
        if (normalized == null || normalized.isEmpty()) {
            return Optional.empty();
        }
        return Arrays.stream(type.getEnumConstants())
                .filter(constant -> constant.getCode().equals(normalized))
                .findFirst();
    }

    /** Strict parse for request bodies: unknown values are rejected. */
    public static <E extends Enum<E> & CodedEnum> E parseEnum(Class<E> type, String field, String raw) {
        return findByCode(type, raw).orElseThrow(() -> ProblemException.badRequest(
                INVALID_ENUM, field + " must be one of: " + allowedCodes(type)));
    }

    /** Lenient parse for list filters: an unknown value means "no filter". */
    public static <E extends Enum<E> & CodedEnum> E parseFilter(Class<E> type, String raw) {
        return findByCode(type, raw).orElse(null);
    }

    public static <E extends Enum<E> & CodedEnum> String allowedCodes(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(CodedEnum::getCode)
                .collect(Collectors.joining(", "));
    }

    /** {@code YYYY-MM-DD} that is also a real calendar day ({@code 2025-02-30} fails). */
    public static LocalDate parseDate(String field, String raw) {
        String value = raw == null ? "" : raw.trim();
        if (!DATE_PATTERN.matcher(value).matches()) {
            throw invalidDate(field, "YYYY-MM-DD");
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeException ex) {
            throw invalidDate(field, "YYYY-MM-DD");
        }
    }

    public static YearMonth parseMonth(String field, String raw) {
        String value = raw == null ? "" : raw.trim();
        if (!MONTH_PATTERN.matcher(value).matches()) {
            throw invalidDate(field, "YYYY-MM");
        }
        try {
            return YearMonth.parse(value);
        } catch (DateTimeException ex) {
            throw invalidDate(field, "YYYY-MM");
        }
    }

    /**
     * Positive integer truncation; absent, non-numeric or non-positive input means unbounded
     * and yields {@code null}.
     */
    public static Integer parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int limit = Integer.parseInt(raw.trim());
            return limit > 0 ? limit : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static ProblemException invalidDate(String field, String format) {
        return ProblemException.badRequest(INVALID_DATE, "Invalid " + field + " format. Use " + format);
    }
}
