package com.sparky.suppress.csv;

import com.sparky.suppress.Const;
import com.sparky.suppress.model.SuppressionRecord;
import com.sparky.suppress.model.SuppressionType;
import com.sparky.suppress.util.EmailAddressValidator;
import com.sparky.suppress.util.InvalidEmailAddressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns one data row into a {@link NormalizedRecord}. Holds no per-file state: the header is
 * passed in with every row.
 *
 * Address and type problems are reported and recorded in the result; only a row whose cell
 * count does not match the header fails the run.
 */
public class CsvRowNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvRowNormalizer.class);

    private static final Set<String> TRUE_TOKENS = Set.of("true", "t", "yes", "y", "1");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "f", "no", "n", "0");

    private final SuppressionType typeDefault;
    private final String descriptionDefault;

    public CsvRowNormalizer(SuppressionType typeDefault, String descriptionDefault) {
        this.typeDefault = typeDefault;
        this.descriptionDefault = descriptionDefault == null || descriptionDefault.isEmpty() ? null : descriptionDefault;
    }

    public NormalizedRecord normalize(SuppressionCsvHeader header, CsvRow row) throws InvalidSuppressionFileException {
        List<String> cells = row.cells();
        if (cells.size() != header.size()) {
            throw new InvalidSuppressionFileException(
                "expected " + header.size() + " fields but found " + cells.size(), row.lineNumber());
        }

        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            String value = cells.get(i) == null ? "" : cells.get(i).trim();
            if (!value.isEmpty()) {
                values.put(header.fields().get(i), value);
            }
        }

        long line = row.lineNumber();
        String rawRecipient = values.get(Const.Field.Recipient);
        String recipient = rawRecipient;
        boolean valid;
        try {
            recipient = EmailAddressValidator.normalize(rawRecipient);
            valid = true;
        } catch (InvalidEmailAddressException e) {
            LOGGER.warn("Line {} : {} {}", line, rawRecipient == null ? "" : rawRecipient, e.getMessage());
            valid = false;
        }

        NormalizedRecord.TypeDisposition disposition;
        SuppressionType type = resolveType(values.get(Const.Field.Type), line);
        if (type != null) {
            disposition = NormalizedRecord.TypeDisposition.FROM_TYPE;
        } else {
            type = resolveFlags(values.get(Const.Field.Transactional), values.get(Const.Field.NonTransactional), line);
            if (type != null) {
                disposition = NormalizedRecord.TypeDisposition.FROM_FLAGS;
            } else {
                type = typeDefault;
                disposition = NormalizedRecord.TypeDisposition.DEFAULTED;
            }
        }

        String description = values.getOrDefault(Const.Field.Description, descriptionDefault);

        SuppressionRecord record = new SuppressionRecord(
            recipient,
            type,
            description,
            values.get(Const.Field.Source),
            values.get(Const.Field.Created),
            values.get(Const.Field.Updated),
            values.get(Const.Field.SubaccountId));
        return new NormalizedRecord(line, record, valid, disposition);
    }

    private SuppressionType resolveType(String rawType, long line) {
        if (rawType == null) {
            return null;
        }
        SuppressionType type = SuppressionType.fromWireName(stripQuotes(rawType).toLowerCase(Locale.ROOT));
        if (type == null) {
            LOGGER.warn("Line {} : invalid \"{}\" = {}", line, Const.Field.Type, rawType);
        }
        return type;
    }

    // deprecated style, both columns must be present and exactly one must be set
    private SuppressionType resolveFlags(String rawTransactional, String rawNonTransactional, long line) {
        if (rawTransactional == null && rawNonTransactional == null) {
            return null;
        }
        Boolean transactional = parseFlag(Const.Field.Transactional, rawTransactional, line);
        Boolean nonTransactional = parseFlag(Const.Field.NonTransactional, rawNonTransactional, line);
        if (transactional == null || nonTransactional == null) {
            return null;
        }
        if (transactional && !nonTransactional) {
            return SuppressionType.TRANSACTIONAL;
        }
        if (!transactional && nonTransactional) {
            return SuppressionType.NON_TRANSACTIONAL;
        }
        return null;
    }

    private static Boolean parseFlag(String name, String raw, long line) {
        if (raw == null) {
            LOGGER.warn("Line {} : missing \"{}\" flag", line, name);
            return null;
        }
        String token = stripQuotes(raw).toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(token)) {
            return Boolean.FALSE;
        }
        LOGGER.warn("Line {} : invalid \"{}\" = {}", line, name, raw);
        return null;
    }

    static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end).trim();
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
