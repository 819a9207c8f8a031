package icu.wwj.benchmark.rmdb.protocol;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Turns a statement template and positional parameters into the text sent on the wire.
 * <p>
 * Both {@code %s} and {@code ?} are placeholders and may be mixed in one template. Parameters are consumed
 * left to right, each one replacing whichever placeholder comes first after the previous substitution.
 * Surplus parameters are ignored and surplus placeholders are left as they are.
 */
public final class StatementFormatter {
    
    public static final String TERMINATOR = ";";
    
    private static final String PRINTF_PLACEHOLDER = "%s";
    
    private static final String QUESTION_PLACEHOLDER = "?";
    
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    
    private StatementFormatter() {
    }
    
    public static String format(String template, Object... params) {
        StringBuilder result = new StringBuilder(template.length() + 16 * params.length);
        int cursor = 0;
        for (Object each : params) {
            int printfIndex = template.indexOf(PRINTF_PLACEHOLDER, cursor);
            int questionIndex = template.indexOf(QUESTION_PLACEHOLDER, cursor);
            int index;
            int length;
            if (printfIndex < 0 && questionIndex < 0) {
                break;
            }
            if (questionIndex < 0 || printfIndex >= 0 && printfIndex < questionIndex) {
                index = printfIndex;
                length = PRINTF_PLACEHOLDER.length();
            } else {
                index = questionIndex;
                length = QUESTION_PLACEHOLDER.length();
            }
            result.append(template, cursor, index).append(literal(each));
            cursor = index + length;
        }
        result.append(template, cursor, template.length());
        if (!result.toString().stripTrailing().endsWith(TERMINATOR)) {
            result.append(TERMINATOR);
        }
        return result.toString();
    }
    
    /**
     * Render one parameter as a literal of the statement language.
     *
     * @param param parameter value, may be null
     * @return literal text
     */
    public static String literal(Object param) {
        if (null == param) {
            return "NULL";
        }
        if (param instanceof String) {
            return quote((String) param);
        }
        if (param instanceof LocalDateTime) {
            return quote(TIMESTAMP_FORMATTER.format((LocalDateTime) param));
        }
        if (param instanceof Double || param instanceof Float) {
            return BigDecimal.valueOf(((Number) param).doubleValue()).toPlainString();
        }
        if (param instanceof BigDecimal) {
            return ((BigDecimal) param).toPlainString();
        }
        return String.valueOf(param);
    }
    
    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
