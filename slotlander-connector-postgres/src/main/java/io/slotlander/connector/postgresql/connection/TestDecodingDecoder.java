/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.slotlander.annotation.ThreadSafe;
import io.slotlander.connector.postgresql.connection.DecodedChange.Operation;
import io.slotlander.relational.TableId;
import io.slotlander.util.Strings;

/**
 * Decodes the textual lines emitted by the {@code test_decoding} output plugin into {@link DecodedChange row changes}.
 * A row change line has the form
 *
 * <pre>
 * table &lt;schema&gt;.&lt;table&gt;: &lt;INSERT|UPDATE|DELETE&gt;: &lt;column&gt;[&lt;type&gt;]:&lt;value&gt; &lt;column&gt;[&lt;type&gt;]:&lt;value&gt; ...
 * </pre>
 *
 * The line is read by a small state machine, one character at a time:
 * <ul>
 * <li>the schema is everything between the {@code table} keyword and the first {@code .};</li>
 * <li>column names consist of letters, digits and underscores, or are double quoted as the plugin prints mixed-case
 * and other special names, e.g. {@code "createdAt"}, with {@code ""} standing for a quote within the name; the type
 * runs to the matching {@code ]} and may contain spaces and nested brackets, e.g. {@code character varying[]};</li>
 * <li>a value runs up to the next whitespace that is followed by a {@code name[} token, or to the end of the line,
 * and is trimmed; surrounding single quotes are removed but nothing is unescaped, so {@code 'O''Brien'} yields
 * {@code O''Brien};</li>
 * <li>{@code (no-tuple-data)} yields no columns; for an {@code old-key:} / {@code new-tuple:} update only the new
 * tuple is kept.</li>
 * </ul>
 * A quoted value that itself contains whitespace followed by {@code name[} is split at that point. The plugin does
 * not give a way to tell the two apart without type information, so such values are not supported.
 * <p>
 * Lines that are not row changes ({@code BEGIN 1234}, {@code COMMIT 1234}, {@code TRUNCATE} and anything else that
 * does not match the header) yield an empty result and never raise an error.
 */
@ThreadSafe
public class TestDecodingDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TestDecodingDecoder.class);

    private static final String TABLE_KEYWORD = "table";
    private static final String NO_TUPLE_DATA = "(no-tuple-data)";
    private static final String OLD_KEY = "old-key:";
    private static final String NEW_TUPLE = "new-tuple:";
    private static final char SCHEMA_SEPARATOR = '.';
    private static final char TOKEN_END = ':';
    private static final char TYPE_START = '[';
    private static final char TYPE_END = ']';
    private static final char VALUE_QUOTE = '\'';
    private static final char NAME_QUOTE = '"';
    private static final int MAX_LOGGED_LENGTH = 200;

    /**
     * Decode one line of {@code test_decoding} output. The result only depends on the supplied text.
     *
     * @param raw the line; may be null
     * @return the decoded row change, or empty if the line is not a row change or cannot be read
     */
    public Optional<DecodedChange> decode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        final String line = raw.strip();
        final ParsingContext context = new ParsingContext(line);

        ParsingState previousState;
        ParsingState currentState = ParsingState.KEYWORD;
        currentState.onEntry(context);

        while (context.position < line.length() && !currentState.isTerminal()) {
            previousState = currentState;
            currentState = currentState.handleCharacter(line.charAt(context.position), context);

            if (currentState != previousState) {
                previousState.onExit(context);
                currentState.onEntry(context);
            }
            context.position++;
        }

        if (!currentState.isTerminal()) {
            currentState = currentState.onEndOfInput(context);
        }

        switch (currentState) {
            case ACCEPTED:
                return Optional.of(new DecodedChange(new TableId(context.schema, context.table), context.operation,
                        context.columns));
            case MALFORMED:
                LOGGER.warn("Skipping change to table '{}.{}' whose column data cannot be read at position {}: {}",
                        context.schema, context.table, context.position, Strings.abbreviate(line, MAX_LOGGED_LENGTH));
                return Optional.empty();
            default:
                LOGGER.trace("Skipping entry that is not a row change: {}", Strings.abbreviate(line, MAX_LOGGED_LENGTH));
                return Optional.empty();
        }
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static class ParsingContext {

        private final String input;
        private final Map<String, String> columns = new LinkedHashMap<>();
        private int position;
        private int startOfToken;
        private int typeDepth;
        private int markerLength;
        private boolean inOldKey;
        private String schema;
        private String table;
        private Operation operation;
        private String columnName;

        ParsingContext(String input) {
            this.input = input;
        }

        String token() {
            return input.substring(startOfToken, position);
        }

        boolean isNextCharacter(int offset, String expected) {
            return input.startsWith(expected, position + offset);
        }

        /**
         * Whether the whitespace at the current position ends the value being read, i.e. it is followed by the start of
         * the next column or, within an old key, by the new tuple.
         */
        boolean endsValue() {
            int index = position;
            while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
                index++;
            }
            if (inOldKey && input.startsWith(NEW_TUPLE, index)) {
                return true;
            }
            final int nameEnd = endOfName(index);
            return nameEnd > index && nameEnd < input.length() && input.charAt(nameEnd) == TYPE_START;
        }

        /**
         * @return the index just after the plain or quoted column name starting at {@code index}, or {@code index} if
         *         there is none
         */
        private int endOfName(int index) {
            if (index < input.length() && input.charAt(index) == NAME_QUOTE) {
                int end = index + 1;
                while (end < input.length()) {
                    if (input.charAt(end) == NAME_QUOTE) {
                        if (end + 1 < input.length() && input.charAt(end + 1) == NAME_QUOTE) {
                            end += 2;
                            continue;
                        }
                        return end + 1;
                    }
                    end++;
                }
                return index;
            }
            int end = index;
            while (end < input.length() && isNamePart(input.charAt(end))) {
                end++;
            }
            return end;
        }

        void addColumn(String rawValue) {
            String value = rawValue.trim();
            if (value.length() >= 2 && value.charAt(0) == VALUE_QUOTE && value.charAt(value.length() - 1) == VALUE_QUOTE) {
                value = value.substring(1, value.length() - 1);
            }
            // the old key is only needed to find the row, the new tuple carries the values after the update
            if (!inOldKey) {
                columns.put(columnName, value);
            }
        }
    }

    private enum ParsingState {

        KEYWORD {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (context.position < TABLE_KEYWORD.length()) {
                    return c == TABLE_KEYWORD.charAt(context.position) ? KEYWORD : REJECTED;
                }
                return Character.isWhitespace(c) ? AFTER_KEYWORD : REJECTED;
            }
        },

        AFTER_KEYWORD {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (Character.isWhitespace(c)) {
                    return AFTER_KEYWORD;
                }
                return c == SCHEMA_SEPARATOR ? REJECTED : IN_SCHEMA;
            }
        },

        IN_SCHEMA {
            @Override
            void onEntry(ParsingContext context) {
                context.startOfToken = context.position;
            }

            @Override
            void onExit(ParsingContext context) {
                context.schema = context.token();
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                return c == SCHEMA_SEPARATOR ? IN_TABLE : IN_SCHEMA;
            }
        },

        IN_TABLE {
            @Override
            void onEntry(ParsingContext context) {
                context.startOfToken = context.position + 1;
            }

            @Override
            void onExit(ParsingContext context) {
                context.table = context.token();
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (c == TOKEN_END) {
                    return context.position > context.startOfToken ? AFTER_TABLE : REJECTED;
                }
                return isNamePart(c) || c == '$' ? IN_TABLE : REJECTED;
            }
        },

        AFTER_TABLE {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                return Character.isWhitespace(c) ? BEFORE_OPERATION : REJECTED;
            }
        },

        BEFORE_OPERATION {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (Character.isWhitespace(c)) {
                    return BEFORE_OPERATION;
                }
                return Character.isLetter(c) ? IN_OPERATION : REJECTED;
            }
        },

        IN_OPERATION {
            @Override
            void onEntry(ParsingContext context) {
                context.startOfToken = context.position;
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (c == TOKEN_END) {
                    context.operation = Operation.forKeyword(context.token());
                    return context.operation != null ? AFTER_OPERATION : REJECTED;
                }
                return Character.isLetter(c) ? IN_OPERATION : REJECTED;
            }
        },

        AFTER_OPERATION {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                return Character.isWhitespace(c) ? BEFORE_COLUMN : REJECTED;
            }

            @Override
            ParsingState onEndOfInput(ParsingContext context) {
                return ACCEPTED;
            }
        },

        BEFORE_COLUMN {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (Character.isWhitespace(c)) {
                    return BEFORE_COLUMN;
                }
                if (context.columns.isEmpty() && !context.inOldKey) {
                    if (context.isNextCharacter(0, NO_TUPLE_DATA)) {
                        context.markerLength = NO_TUPLE_DATA.length();
                        return IN_MARKER;
                    }
                    if (context.isNextCharacter(0, OLD_KEY)) {
                        context.markerLength = OLD_KEY.length();
                        context.inOldKey = true;
                        return IN_MARKER;
                    }
                }
                if (context.inOldKey && context.isNextCharacter(0, NEW_TUPLE)) {
                    context.markerLength = NEW_TUPLE.length();
                    context.inOldKey = false;
                    return IN_MARKER;
                }
                if (c == NAME_QUOTE) {
                    return IN_QUOTED_COLUMN_NAME;
                }
                return isNamePart(c) ? IN_COLUMN_NAME : MALFORMED;
            }

            @Override
            ParsingState onEndOfInput(ParsingContext context) {
                return context.inOldKey ? MALFORMED : ACCEPTED;
            }
        },

        IN_MARKER {
            @Override
            void onEntry(ParsingContext context) {
                context.startOfToken = context.position;
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (context.position < context.startOfToken + context.markerLength) {
                    return IN_MARKER;
                }
                return Character.isWhitespace(c) ? BEFORE_COLUMN : MALFORMED;
            }

            @Override
            ParsingState onEndOfInput(ParsingContext context) {
                return context.inOldKey ? MALFORMED : ACCEPTED;
            }
        },

        IN_COLUMN_NAME {
            @Override
            void onEntry(ParsingContext context) {
                context.startOfToken = context.position;
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (c == TYPE_START) {
                    context.columnName = context.token();
                    return IN_TYPE;
                }
                return isNamePart(c) ? IN_COLUMN_NAME : MALFORMED;
            }
        },

        IN_QUOTED_COLUMN_NAME {
            @Override
            void onEntry(ParsingContext context) {
                context.startOfToken = context.position + 1;
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (c != NAME_QUOTE) {
                    return IN_QUOTED_COLUMN_NAME;
                }
                if (context.isNextCharacter(1, String.valueOf(NAME_QUOTE))) {
                    // doubled quote within the name
                    context.position++;
                    return IN_QUOTED_COLUMN_NAME;
                }
                context.columnName = context.token().replace("\"\"", "\"");
                return AFTER_QUOTED_COLUMN_NAME;
            }
        },

        AFTER_QUOTED_COLUMN_NAME {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                return c == TYPE_START ? IN_TYPE : MALFORMED;
            }
        },

        IN_TYPE {
            @Override
            void onEntry(ParsingContext context) {
                context.typeDepth = 1;
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (c == TYPE_START) {
                    context.typeDepth++;
                }
                else if (c == TYPE_END && --context.typeDepth == 0) {
                    return AFTER_TYPE;
                }
                return IN_TYPE;
            }
        },

        AFTER_TYPE {
            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                return c == TOKEN_END ? IN_VALUE : MALFORMED;
            }
        },

        IN_VALUE {
            @Override
            void onEntry(ParsingContext context) {
                context.startOfToken = context.position + 1;
            }

            @Override
            void onExit(ParsingContext context) {
                context.addColumn(context.token());
            }

            @Override
            ParsingState handleCharacter(char c, ParsingContext context) {
                if (Character.isWhitespace(c) && context.endsValue()) {
                    return BEFORE_COLUMN;
                }
                return IN_VALUE;
            }

            @Override
            ParsingState onEndOfInput(ParsingContext context) {
                context.addColumn(context.token());
                return context.inOldKey ? MALFORMED : ACCEPTED;
            }
        },

        ACCEPTED {
            @Override
            boolean isTerminal() {
                return true;
            }
        },

        REJECTED {
            @Override
            boolean isTerminal() {
                return true;
            }
        },

        MALFORMED {
            @Override
            boolean isTerminal() {
                return true;
            }
        };

        void onEntry(ParsingContext context) {
        }

        void onExit(ParsingContext context) {
        }

        ParsingState handleCharacter(char c, ParsingContext context) {
            throw new IllegalStateException("No input expected in state " + this);
        }

        /**
         * Determine the outcome when the line ends in this state. Ending within the header means the line is not a row
         * change, ending within a column means the column data is incomplete.
         */
        ParsingState onEndOfInput(ParsingContext context) {
            return context.operation == null ? REJECTED : MALFORMED;
        }

        boolean isTerminal() {
            return false;
        }
    }
}
