package com.purchasingpower.recordsearch.query;

import com.purchasingpower.recordsearch.exception.QuerySyntaxException;
import com.purchasingpower.recordsearch.search.SearchCondition;
import com.purchasingpower.recordsearch.search.SearchEffect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Parser for the single-line search query language.
 *
 * <pre>
 * query     := operation ( whitespace+ operation )*
 * operation := effect? field? condition? text?
 * effect    := [-+&amp;]+
 * field     := ( [\w-]+ | escape )*
 * condition := ':' | '=' | '%=' | '^=' | '[matches]:' | '[is]:' | '[equals]:' | '[includes]:' | '[contains]:'
 * text      := ( [^ \\":] | escape | '"' quoted '"' )*
 * </pre>
 *
 * <p>Examples:
 * <ul>
 *   <li>{@code dog} searches the default field for "dog"</li>
 *   <li>{@code -source:obsidian} removes records from the built-in source</li>
 *   <li>{@code +id^=warn} adds records whose id starts with "warn"</li>
 *   <li>{@code id="\"quoted text\""} searches for text containing quotes and spaces</li>
 * </ul>
 *
 * <p>A bare word looks like a field until a condition follows it, so when an operation
 * has neither a condition nor text, the parsed field is reinterpreted as the text.
 *
 * @since 1.0.0
 */
public final class QueryParser {

    private static final Pattern EFFECT = Pattern.compile("[-+&]+");
    private static final Pattern FIELD = Pattern.compile("[\\w-]+");
    private static final Pattern CONDITION =
            Pattern.compile("[\\^=~%:]+|\\[(?:is|equals|matches|has|includes|contains)]:");
    private static final Pattern TEXT_DELIMITER = Pattern.compile("[ \\\\\":]");
    private static final Pattern BRACED_HEX = Pattern.compile("\\{([^}]+)}");
    private static final Pattern HEX = Pattern.compile("[A-Fa-f0-9]+");

    private static final String STAGE_OPERATION = "search term";
    private static final String STAGE_TEXT = "text";
    private static final String STAGE_ESCAPE = "escape sequence";

    private QueryParser() {
    }

    /**
     * Parses a whole query into its operations.
     *
     * @param query The query string
     * @return The operations, in the order they appear
     * @throws QuerySyntaxException if the query is malformed
     */
    public static List<QueryOperation> parseQuery(String query) {
        return parseQuery(query, null);
    }

    /**
     * Parses a whole query, rejecting operations that name a field outside {@code fields}.
     *
     * <p>Plain words containing punctuation, like {@code it's} or {@code note.md}, read as
     * a field followed by text, so an unknown field is reported as a syntax error at the
     * field rather than surfacing as a missing column later.
     *
     * @param query The query string
     * @param fields The accepted field names, or {@code null} to accept any
     * @return The operations, in the order they appear
     * @throws QuerySyntaxException if the query is malformed or names an unknown field
     */
    public static List<QueryOperation> parseQuery(String query, Set<String> fields) {
        QueryParserContext ctx = new QueryParserContext(query);
        List<QueryOperation> operations = new ArrayList<>();

        while (!ctx.isDone()) {
            ctx.take().trim();
            if (ctx.isDone()) {
                break;
            }

            operations.add(parseOperation(ctx, fields));
        }

        return operations;
    }

    /**
     * Parses one operation, stopping before the whitespace that ends it.
     */
    public static QueryOperation parseOperation(QueryParserContext ctx) {
        return parseOperation(ctx, null);
    }

    /**
     * Parses one operation, rejecting a field outside {@code fields} unless it is {@code null}.
     */
    public static QueryOperation parseOperation(QueryParserContext ctx, Set<String> fields) {
        ctx.pushStage(STAGE_OPERATION);
        try {
            SearchEffect effect = parseOperationEffect(ctx);
            int fieldOffset = ctx.getOffset();
            String field = emptyToNull(parseOperationField(ctx));
            SearchCondition condition = parseOperationCondition(ctx);
            String text = ctx.isDone() || ctx.peek().prefix(" ") ? null : parseText(ctx);

            if (text == null && condition == null) {
                text = field;
                field = null;
            }

            boolean missingText = text == null || text.isEmpty();
            if (missingText && field == null && effect == null && condition == null) {
                throw ctx.error("Unexpected end");
            }

            if (missingText && condition == null) {
                throw ctx.error("Missing query text");
            }

            if (text != null && text.isEmpty()) {
                throw ctx.error("Missing query text");
            }

            if (field != null && fields != null && !fields.contains(field)) {
                throw ctx.error(fieldOffset, "Unknown field `" + field + "`");
            }

            return new QueryOperation(effect, field, condition, text);
        } finally {
            ctx.popStage();
        }
    }

    /**
     * Parses the leading effect symbols, if any.
     *
     * @return The effect, or {@code null} if the operation has no effect prefix
     */
    public static SearchEffect parseOperationEffect(QueryParserContext ctx) {
        Optional<MatchResult> match = ctx.take().lookingAt(EFFECT);
        if (match.isEmpty()) {
            return null;
        }

        String symbols = match.get().group();
        switch (symbols.replaceAll("(.)\\1+", "$1")) {
            case "-":
                return SearchEffect.REMOVE;

            case "+":
                return SearchEffect.ADD;

            case "&":
                return SearchEffect.FILTER;

            default:
                throw ctx.error("Unexpected symbol `" + symbols + "`. Did you mean `-`, `+`, or `&`?");
        }
    }

    /**
     * Parses the field name, which may contain escape sequences.
     *
     * @return The field name, empty if there is none
     */
    public static String parseOperationField(QueryParserContext ctx) {
        StringBuilder field = new StringBuilder();

        while (true) {
            Optional<MatchResult> match = ctx.take().lookingAt(FIELD);
            if (match.isPresent()) {
                field.append(match.get().group());
                continue;
            }

            if (ctx.peek().prefix("\\")) {
                field.append(parseEscapeSequence(ctx));
                continue;
            }

            return field.toString();
        }
    }

    /**
     * Parses the condition operator, if any.
     *
     * @return The condition, or {@code null} if there is no operator
     */
    public static SearchCondition parseOperationCondition(QueryParserContext ctx) {
        Optional<MatchResult> match = ctx.take().lookingAt(CONDITION);
        if (match.isEmpty()) {
            return null;
        }

        String operator = match.get().group();
        switch (operator) {
            case ":":
            case "[matches]:":
                return SearchCondition.MATCHES;

            case "=":
            case "[equals]:":
            case "[is]:":
                return SearchCondition.EQUALS;

            case "%=":
            case "[includes]:":
            case "[contains]:":
                return SearchCondition.INCLUDES;

            case "^=":
                return SearchCondition.STARTS_WITH;

            default:
                throw ctx.error("Unexpected symbol `" + operator + "`. Did you mean `:`, `=`, or `%=`?");
        }
    }

    /**
     * Parses possibly quoted or escaped text up to the next unquoted space.
     *
     * <p>Double quotes toggle quoting and are dropped; inside quotes, spaces are literal.
     */
    public static String parseText(QueryParserContext ctx) {
        ctx.pushStage(STAGE_TEXT);
        try {
            StringBuilder text = new StringBuilder();
            boolean quoted = false;

            while (true) {
                Optional<MatchResult> delimiter = ctx.peek().findFirst(TEXT_DELIMITER);
                if (delimiter.isEmpty()) {
                    text.append(ctx.take().remaining());
                    break;
                }

                text.append(ctx.take().next(delimiter.get().start() - ctx.getOffset()));
                String symbol = delimiter.get().group();

                if (symbol.equals("\\")) {
                    text.append(parseEscapeSequence(ctx));
                    continue;
                }

                if (symbol.equals(" ")) {
                    if (!quoted) {
                        break;
                    }

                    ctx.take().next(1);
                    text.append(' ');
                    continue;
                }

                if (symbol.equals("\"")) {
                    ctx.take().next(1);
                    quoted = !quoted;
                    continue;
                }

                throw ctx.error("Unexpected symbol `" + symbol + "`");
            }

            if (quoted) {
                throw ctx.error("Unexpected end of string while matching `\"`");
            }

            return text.toString();
        } finally {
            ctx.popStage();
        }
    }

    /**
     * Parses a backslash escape sequence.
     *
     * <p>Supported: {@code \\ \" \' \space \n \r}, {@code \xHH}, and {@code u} followed by four hex digits
     * or by any number of hex digits in braces.
     */
    public static String parseEscapeSequence(QueryParserContext ctx) {
        ctx.pushStage(STAGE_ESCAPE);
        try {
            if (!ctx.take().prefix("\\")) {
                throw ctx.error("Not an escape sequence");
            }

            String symbol = ctx.take().next(1);
            switch (symbol) {
                case "\\":
                case "\"":
                case "'":
                case " ":
                    return symbol;

                case "n":
                    return "\n";

                case "r":
                    return "\r";

                case "x":
                    return hexToString(ctx, ctx.take().next(2));

                case "u":
                    if (!ctx.peek().next(1).equals("{")) {
                        return hexToString(ctx, ctx.take().next(4));
                    }

                    Optional<MatchResult> braced = ctx.take().findLongest(BRACED_HEX);
                    if (braced.isEmpty()) {
                        throw ctx.error("Unexpected end of string while matching `{`");
                    }
                    return hexToString(ctx, braced.get().group(1));

                default:
                    throw ctx.error("Unknown escape sequence (" + symbol + ")");
            }
        } finally {
            ctx.popStage();
        }
    }

    /**
     * Converts a hexadecimal code point to the string it encodes.
     *
     * @throws QuerySyntaxException if {@code hex} is not a valid code point
     */
    public static String hexToString(QueryParserContext ctx, String hex) {
        if (!HEX.matcher(hex).matches() || hex.length() > 8) {
            throw ctx.error("Invalid hex number `" + hex + "`");
        }

        long codePoint = Long.parseLong(hex, 16);
        if (!Character.isValidCodePoint((int) codePoint) || codePoint > Character.MAX_CODE_POINT) {
            throw ctx.error("Invalid code point `" + hex + "`");
        }

        return new String(Character.toChars((int) codePoint));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
