package com.purchasingpower.recordsearch.query;

import com.google.common.base.Preconditions;
import com.purchasingpower.recordsearch.exception.QuerySyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cursor state for the query parser.
 *
 * <p>Reading goes through one of two {@link Cursor cursors} that share the same
 * offset: {@link #take()} consumes what it reads, {@link #peek()} leaves the offset
 * where it was. The stage stack records what the parser is currently doing so
 * syntax errors can say where they happened.
 *
 * @since 1.0.0
 */
public class QueryParserContext {

    private static final Pattern NOT_WHITESPACE = Pattern.compile("\\S", Pattern.UNICODE_CHARACTER_CLASS);

    private final String source;
    private final List<String> stages = new ArrayList<>();
    private final Cursor take = new Cursor(true);
    private final Cursor peek = new Cursor(false);
    private int offset;

    public QueryParserContext(String source) {
        this.source = Preconditions.checkNotNull(source, "Query cannot be null");
    }

    public String getSource() {
        return source;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Whether the source is fully consumed.
     */
    public boolean isDone() {
        return offset >= source.length();
    }

    public Cursor take() {
        return take;
    }

    public Cursor peek() {
        return peek;
    }

    public void pushStage(String stage) {
        stages.add(stage);
    }

    public void popStage() {
        stages.remove(stages.size() - 1);
    }

    /**
     * Creates a syntax error at the current offset and stage.
     */
    public QuerySyntaxException error(String reason) {
        return error(offset, reason);
    }

    /**
     * Creates a syntax error at an earlier offset, e.g. the start of the token at fault.
     */
    public QuerySyntaxException error(int errorOffset, String reason) {
        String stage = stages.isEmpty() ? "query" : String.join(" > ", stages);
        return new QuerySyntaxException(errorOffset, stage, reason);
    }

    /**
     * Reading operations over the parent context.
     */
    public final class Cursor {

        private final boolean consuming;

        private Cursor(boolean consuming) {
            this.consuming = consuming;
        }

        private void advanceTo(int newOffset) {
            if (consuming) {
                offset = newOffset;
            }
        }

        /**
         * Checks whether the source continues with {@code prefix}, consuming it if so.
         */
        public boolean prefix(String prefix) {
            if (source.startsWith(prefix, offset)) {
                advanceTo(offset + prefix.length());
                return true;
            }

            return false;
        }

        /**
         * Skips leading whitespace.
         *
         * @return The whitespace that was skipped
         */
        public String trim() {
            Matcher matcher = NOT_WHITESPACE.matcher(source);
            int end = matcher.find(Math.min(offset, source.length())) ? matcher.start() : source.length();

            String skipped = source.substring(Math.min(offset, end), end);
            advanceTo(end);
            return skipped;
        }

        /**
         * Reads up to {@code length} characters, fewer if the source ends first.
         */
        public String maybeNext(int length) {
            int start = Math.min(offset, source.length());
            int end = Math.min(start + length, source.length());
            advanceTo(offset + length);
            return source.substring(start, end);
        }

        /**
         * Reads exactly {@code length} characters.
         *
         * @throws QuerySyntaxException if the source ends first
         */
        public String next(int length) {
            if (offset + length > source.length()) {
                throw error("Unexpected end");
            }

            String substring = source.substring(offset, offset + length);
            advanceTo(offset + length);
            return substring;
        }

        /**
         * Reads everything left in the source.
         */
        public String remaining() {
            String rest = isDone() ? "" : source.substring(offset);
            advanceTo(Math.max(offset, source.length()));
            return rest;
        }

        /**
         * Matches a pattern anchored at the current offset.
         */
        public Optional<MatchResult> lookingAt(Pattern pattern) {
            if (offset > source.length()) {
                return Optional.empty();
            }

            Matcher matcher = matcherFromOffset(pattern);
            if (!matcher.lookingAt()) {
                return Optional.empty();
            }

            MatchResult result = matcher.toMatchResult();
            advanceTo(result.end());
            return Optional.of(result);
        }

        /**
         * Searches forward from the current offset and returns the match that starts
         * earliest among all the patterns. Earlier patterns win ties.
         */
        public Optional<MatchResult> findFirst(Pattern... patterns) {
            if (offset > source.length()) {
                return Optional.empty();
            }

            MatchResult first = null;
            for (Pattern pattern : patterns) {
                Matcher matcher = matcherFromOffset(pattern);
                if (matcher.find() && (first == null || matcher.start() < first.start())) {
                    first = matcher.toMatchResult();
                }
            }

            if (first != null) {
                advanceTo(first.end());
            }
            return Optional.ofNullable(first);
        }

        /**
         * Matches every pattern anchored at the current offset and returns the longest
         * match. Earlier patterns win ties.
         */
        public Optional<MatchResult> findLongest(Pattern... patterns) {
            if (offset > source.length()) {
                return Optional.empty();
            }

            MatchResult longest = null;
            for (Pattern pattern : patterns) {
                Matcher matcher = matcherFromOffset(pattern);
                if (matcher.lookingAt() && (longest == null || matcher.end() > longest.end())) {
                    longest = matcher.toMatchResult();
                }
            }

            if (longest != null) {
                advanceTo(longest.end());
            }
            return Optional.ofNullable(longest);
        }

        private Matcher matcherFromOffset(Pattern pattern) {
            return pattern.matcher(source)
                    .region(offset, source.length())
                    .useTransparentBounds(true)
                    .useAnchoringBounds(false);
        }
    }
}
