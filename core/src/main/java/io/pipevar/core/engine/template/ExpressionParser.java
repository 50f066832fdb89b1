package io.pipevar.core.engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.pipevar.core.engine.template.ExpressionLexer.Token;
import io.pipevar.core.engine.template.ExpressionLexer.TokenType;
import io.pipevar.core.error.TemplateEvalException;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the restricted expression grammar:
 *
 * <pre>
 * expr     := or ('?' expr ':' expr)?
 * or       := and ('||' and)*
 * and      := equality ('&amp;&amp;' equality)*
 * equality := compare (('==' | '!=') compare)*
 * compare  := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)*
 * additive := mult (('+' | '-') mult)*
 * mult     := unary (('*' | '/' | '%') unary)*
 * unary    := ('!' | '-') unary | postfix
 * postfix  := primary ('.' IDENT | '[' expr ']')*
 * primary  := NUMBER | STRING | true | false | null | IDENT ('.' IDENT)* | '(' expr ')'
 * </pre>
 */
final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int pos;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = ExpressionLexer.tokenize(source);
    }

    static ExpressionNode parse(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        if (parser.peek().type() == TokenType.EOF) {
            throw new TemplateEvalException("Empty expression", source);
        }
        ExpressionNode node = parser.expression();
        if (parser.peek().type() != TokenType.EOF) {
            throw parser.unexpected();
        }
        return node;
    }

    private ExpressionNode expression() {
        ExpressionNode condition = or();
        if (accept(TokenType.QUESTION)) {
            ExpressionNode whenTrue = expression();
            expect(TokenType.COLON);
            ExpressionNode whenFalse = expression();
            return new ExpressionNode.Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private ExpressionNode or() {
        ExpressionNode left = and();
        while (accept(TokenType.OR)) {
            left = new ExpressionNode.Logical(false, left, and());
        }
        return left;
    }

    private ExpressionNode and() {
        ExpressionNode left = equality();
        while (accept(TokenType.AND)) {
            left = new ExpressionNode.Logical(true, left, equality());
        }
        return left;
    }

    private ExpressionNode equality() {
        ExpressionNode left = comparison();
        while (peekIs(TokenType.EQ, TokenType.NE)) {
            TokenType operator = advance().type();
            left = new ExpressionNode.Binary(operator, left, comparison());
        }
        return left;
    }

    private ExpressionNode comparison() {
        ExpressionNode left = additive();
        while (peekIs(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE)) {
            TokenType operator = advance().type();
            left = new ExpressionNode.Binary(operator, left, additive());
        }
        return left;
    }

    private ExpressionNode additive() {
        ExpressionNode left = multiplicative();
        while (peekIs(TokenType.PLUS, TokenType.MINUS)) {
            TokenType operator = advance().type();
            left = new ExpressionNode.Binary(operator, left, multiplicative());
        }
        return left;
    }

    private ExpressionNode multiplicative() {
        ExpressionNode left = unary();
        while (peekIs(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            TokenType operator = advance().type();
            left = new ExpressionNode.Binary(operator, left, unary());
        }
        return left;
    }

    private ExpressionNode unary() {
        if (peekIs(TokenType.NOT, TokenType.MINUS)) {
            TokenType operator = advance().type();
            return new ExpressionNode.Unary(operator, unary());
        }
        return postfix();
    }

    private ExpressionNode postfix() {
        ExpressionNode node = primary();
        while (true) {
            if (accept(TokenType.DOT)) {
                node = new ExpressionNode.Property(node, expect(TokenType.IDENT).text());
            } else if (accept(TokenType.LBRACKET)) {
                ExpressionNode index = expression();
                expect(TokenType.RBRACKET);
                node = new ExpressionNode.Index(node, index);
            } else {
                return node;
            }
        }
    }

    private ExpressionNode primary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new ExpressionNode.Literal(number(token));
            case STRING:
                return new ExpressionNode.Literal(JsonNodeFactory.instance.textNode(token.text()));
            case TRUE:
                return new ExpressionNode.Literal(BooleanNode.TRUE);
            case FALSE:
                return new ExpressionNode.Literal(BooleanNode.FALSE);
            case NULL:
                return new ExpressionNode.Literal(NullNode.getInstance());
            case IDENT:
                List<String> path = new ArrayList<>();
                path.add(token.text());
                while (peek().type() == TokenType.DOT && peekAt(1).type() == TokenType.IDENT) {
                    advance();
                    path.add(advance().text());
                }
                return new ExpressionNode.Reference(path);
            case LPAREN:
                ExpressionNode inner = expression();
                expect(TokenType.RPAREN);
                return inner;
            default:
                if (token.type() != TokenType.EOF) {
                    pos--;
                }
                throw unexpected();
        }
    }

    private JsonNode number(Token token) {
        String text = token.text();
        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            return JsonNodeFactory.instance.numberNode(Double.parseDouble(text));
        }
        try {
            return JsonNodeFactory.instance.numberNode(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new TemplateEvalException("Integer literal out of range: " + text, source);
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private boolean peekIs(TokenType... types) {
        TokenType current = peek().type();
        for (TokenType type : types) {
            if (current == type) {
                return true;
            }
        }
        return false;
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        if (peek().type() != type) {
            throw unexpected();
        }
        return advance();
    }

    private TemplateEvalException unexpected() {
        Token token = peek();
        if (token.type() == TokenType.EOF) {
            return new TemplateEvalException("Unexpected end of expression", source);
        }
        return new TemplateEvalException(
                "Unexpected token '" + token.text() + "' at position " + token.position(), source);
    }
}
