package io.flowforge.formula.core.lexer;

import io.flowforge.formula.core.error.FormulaLexException;
import java.util.ArrayList;
import java.util.List;

/**
 * Hand-written lexer for formula source text.
 *
 * <p>Produces the complete token list terminated by {@link TokenType#END}, or throws a
 * {@link FormulaLexException} on the first lexical error. There is no partial output.
 *
 * <p>Thread-safe: {@link #tokenize(String)} keeps all state on the stack of a private cursor.
 */
public final class Tokenizer {

    private Tokenizer() {}

    /**
     * Tokenizes the given source.
     *
     * @param source formula text, not null
     * @return immutable token list ending with an {@code END} token
     * @throws FormulaLexException on the first malformed token
     */
    public static List<Token> tokenize(String source) {
        return new Cursor(source).run();
    }

    private static final class Cursor {

        private final String src;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;

        Cursor(String src) {
            this.src = src;
        }

        List<Token> run() {
            while (true) {
                skipWhitespace();
                if (pos >= src.length()) {
                    tokens.add(new Token(TokenType.END, "", pos, pos));
                    return List.copyOf(tokens);
                }
                char c = src.charAt(pos);
                if (isDigit(c) || (c == '.' && pos + 1 < src.length() && isDigit(src.charAt(pos + 1)))) {
                    readNumber();
                } else if (c == '"' || c == '\'') {
                    readString(c);
                } else if (isIdentifierStart(c)) {
                    readIdentifier();
                } else {
                    readOperator(c);
                }
            }
        }

        private void skipWhitespace() {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
                pos++;
            }
        }

        private void readNumber() {
            int start = pos;
            while (pos < src.length() && isDigit(src.charAt(pos))) {
                pos++;
            }
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                while (pos < src.length() && isDigit(src.charAt(pos))) {
                    pos++;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos >= src.length() || !isDigit(src.charAt(pos))) {
                    throw new FormulaLexException("Invalid number: exponent has no digits", start);
                }
                while (pos < src.length() && isDigit(src.charAt(pos))) {
                    pos++;
                }
            }
            if (pos < src.length() && isIdentifierPart(src.charAt(pos))) {
                throw new FormulaLexException(
                        "Invalid number: unexpected character '" + src.charAt(pos) + "'", pos);
            }
            tokens.add(new Token(TokenType.NUMBER, src.substring(start, pos), start, pos));
        }

        private void readString(char quote) {
            int start = pos;
            pos++; // opening quote
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (pos >= src.length()) {
                    throw new FormulaLexException("Unterminated string", start);
                }
                char c = src.charAt(pos);
                if (c == quote) {
                    pos++;
                    break;
                }
                if (c == '\n' || c == '\r') {
                    throw new FormulaLexException("Unterminated string: line break inside string literal", start);
                }
                if (c == '\\') {
                    pos++;
                    if (pos >= src.length()) {
                        throw new FormulaLexException("Unterminated string", start);
                    }
                    char esc = src.charAt(pos);
                    switch (esc) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case 'r' -> sb.append('\r');
                        case 'u' -> sb.append(readUnicodeEscape());
                        default -> sb.append(esc);
                    }
                    pos++;
                    continue;
                }
                sb.append(c);
                pos++;
            }
            tokens.add(new Token(TokenType.STRING, sb.toString(), start, pos));
        }

        /** Reads the four hex digits after {@code \\u}; leaves {@code pos} on the last digit. */
        private char readUnicodeEscape() {
            int escapeStart = pos - 1;
            if (pos + 5 > src.length()) {
                throw new FormulaLexException("Invalid unicode escape", escapeStart);
            }
            String hex = src.substring(pos + 1, pos + 5);
            try {
                char decoded = (char) Integer.parseInt(hex, 16);
                pos += 4;
                return decoded;
            } catch (NumberFormatException e) {
                throw new FormulaLexException("Invalid unicode escape: \\u" + hex, escapeStart);
            }
        }

        private void readIdentifier() {
            int start = pos;
            pos++;
            while (pos < src.length() && isIdentifierPart(src.charAt(pos))) {
                pos++;
            }
            if (src.charAt(start) == '$' && pos == start + 1) {
                throw new FormulaLexException("Expected variable name after '$'", start);
            }
            tokens.add(new Token(TokenType.IDENTIFIER, src.substring(start, pos), start, pos));
        }

        private void readOperator(char c) {
            int start = pos;
            if (startsWith("===") || startsWith("!==")) {
                String op = src.substring(pos, pos + 3);
                throw new FormulaLexException(
                        "Unsupported operator '" + op + "': use '" + op.substring(0, 2)
                                + "', equality is always strict",
                        start);
            }
            TokenType two = pos + 1 < src.length() ? twoCharOperator(c, src.charAt(pos + 1)) : null;
            if (two != null) {
                pos += 2;
                tokens.add(new Token(two, two.symbol(), start, pos));
                return;
            }
            TokenType one = switch (c) {
                case '+' -> TokenType.PLUS;
                case '-' -> TokenType.MINUS;
                case '*' -> TokenType.STAR;
                case '/' -> TokenType.SLASH;
                case '%' -> TokenType.PERCENT;
                case '<' -> TokenType.LT;
                case '>' -> TokenType.GT;
                case '!' -> TokenType.BANG;
                case '&' -> TokenType.AMPERSAND;
                case '(' -> TokenType.LPAREN;
                case ')' -> TokenType.RPAREN;
                case '[' -> TokenType.LBRACKET;
                case ']' -> TokenType.RBRACKET;
                case '{' -> TokenType.LBRACE;
                case '}' -> TokenType.RBRACE;
                case ',' -> TokenType.COMMA;
                case '.' -> TokenType.DOT;
                case ':' -> TokenType.COLON;
                case '?' -> TokenType.QUESTION;
                default -> null;
            };
            if (one == null) {
                throw new FormulaLexException(unexpectedCharacterMessage(c), start);
            }
            pos++;
            tokens.add(new Token(one, one.symbol(), start, pos));
        }

        private String unexpectedCharacterMessage(char c) {
            return switch (c) {
                case '=' -> "Unexpected character '=': use '==' for comparison";
                case '|' -> "Unexpected character '|': use '||' for logical or";
                default -> "Unexpected character '" + new String(Character.toChars(src.codePointAt(pos))) + "'";
            };
        }

        private static TokenType twoCharOperator(char c, char next) {
            return switch ("" + c + next) {
                case "**" -> TokenType.STAR_STAR;
                case "==" -> TokenType.EQ;
                case "!=" -> TokenType.NEQ;
                case "<=" -> TokenType.LTE;
                case ">=" -> TokenType.GTE;
                case "&&" -> TokenType.AND_AND;
                case "||" -> TokenType.OR_OR;
                default -> null;
            };
        }

        private boolean startsWith(String s) {
            return src.startsWith(s, pos);
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || c == '$' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
