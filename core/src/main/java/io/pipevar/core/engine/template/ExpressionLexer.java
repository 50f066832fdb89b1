package io.pipevar.core.engine.template;

import io.pipevar.core.error.TemplateEvalException;
import java.util.ArrayList;
import java.util.List;

/** Splits the content of a {@code ${...}} marker into tokens. */
final class ExpressionLexer {

    enum TokenType {
        NUMBER,
        STRING,
        IDENT,
        TRUE,
        FALSE,
        NULL,
        DOT,
        LBRACKET,
        RBRACKET,
        LPAREN,
        RPAREN,
        QUESTION,
        COLON,
        OR,
        AND,
        NOT,
        EQ,
        NE,
        LT,
        LE,
        GT,
        GE,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        PERCENT,
        EOF
    }

    /**
     * A lexical token. {@code text} is the identifier name, the unescaped string content, or the
     * number literal as written.
     */
    record Token(TokenType type, String text, int position) {}

    private final String source;
    private int pos;

    private ExpressionLexer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        return new ExpressionLexer(source).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);
        if (Character.isDigit(c)) {
            return number();
        }
        if (c == '\'' || c == '"') {
            return string(c);
        }
        if (Character.isLetter(c) || c == '_') {
            return identifier();
        }
        pos++;
        switch (c) {
            case '.':
                return new Token(TokenType.DOT, ".", start);
            case '[':
                return new Token(TokenType.LBRACKET, "[", start);
            case ']':
                return new Token(TokenType.RBRACKET, "]", start);
            case '(':
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                return new Token(TokenType.RPAREN, ")", start);
            case '?':
                return new Token(TokenType.QUESTION, "?", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            case '+':
                return new Token(TokenType.PLUS, "+", start);
            case '-':
                return new Token(TokenType.MINUS, "-", start);
            case '*':
                return new Token(TokenType.STAR, "*", start);
            case '/':
                return new Token(TokenType.SLASH, "/", start);
            case '%':
                return new Token(TokenType.PERCENT, "%", start);
            case '|':
                expect('|', start);
                return new Token(TokenType.OR, "||", start);
            case '&':
                expect('&', start);
                return new Token(TokenType.AND, "&&", start);
            case '=':
                expect('=', start);
                return new Token(TokenType.EQ, "==", start);
            case '!':
                return match('=') ? new Token(TokenType.NE, "!=", start) : new Token(TokenType.NOT, "!", start);
            case '<':
                return match('=') ? new Token(TokenType.LE, "<=", start) : new Token(TokenType.LT, "<", start);
            case '>':
                return match('=') ? new Token(TokenType.GE, ">=", start) : new Token(TokenType.GT, ">", start);
            default:
                throw error("Unexpected character '" + c + "' at position " + start);
        }
    }

    private Token number() {
        int start = pos;
        consumeDigits();
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            consumeDigits();
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                consumeDigits();
            } else {
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private void consumeDigits() {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private Token string(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            if (c == '\\') {
                if (pos >= source.length()) {
                    break;
                }
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case '\\':
                    case '\'':
                    case '"':
                        sb.append(escaped);
                        break;
                    default:
                        throw error("Unknown escape '\\" + escaped + "' at position " + (pos - 2));
                }
            } else {
                sb.append(c);
            }
        }
        throw error("Unterminated string literal starting at position " + start);
    }

    private Token identifier() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String name = source.substring(start, pos);
        switch (name) {
            case "true":
                return new Token(TokenType.TRUE, name, start);
            case "false":
                return new Token(TokenType.FALSE, name, start);
            case "null":
                return new Token(TokenType.NULL, name, start);
            default:
                return new Token(TokenType.IDENT, name, start);
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private boolean match(char expected) {
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected, int start) {
        if (!match(expected)) {
            throw error("Expected '" + source.charAt(start) + expected + "' at position " + start);
        }
    }

    private TemplateEvalException error(String reason) {
        return new TemplateEvalException(reason, source);
    }
}
