package com.stratdsl.parser;

import com.stratdsl.ast.AstNode;
import com.stratdsl.ast.AtomNode;
import com.stratdsl.ast.ListKind;
import com.stratdsl.ast.ListNode;
import com.stratdsl.ast.SourcePosition;
import com.stratdsl.ast.SymbolNode;
import com.stratdsl.exception.DslParseException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser turning strategy source into a single {@link AstNode}.
 *
 * <p>The source must contain exactly one top-level form. Nesting depth and total node count are
 * bounded so hostile input fails with a {@link DslParseException} instead of exhausting the
 * stack or memory.
 *
 * <p>Thread-safe: all parsing state lives in a per-call {@link Cursor}.
 */
public class StrategyParser {

    private static final Logger log = LoggerFactory.getLogger(StrategyParser.class);

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final int DEFAULT_MAX_NODES = 10_000;

    private final int maxDepth;
    private final int maxNodes;

    public StrategyParser() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES);
    }

    public StrategyParser(int maxDepth, int maxNodes) {
        if (maxDepth < 1 || maxNodes < 1) {
            throw new IllegalArgumentException("Parser limits must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
    }

    /**
     * Parses {@code source} into its AST.
     *
     * @throws DslParseException with line and column when the source is malformed
     */
    public AstNode parse(String source) {
        if (source == null || source.isBlank()) {
            throw new DslParseException("Empty strategy source", SourcePosition.START);
        }
        List<Token> tokens = new Tokenizer(source).tokenize();
        Cursor cursor = new Cursor(tokens);
        if (cursor.peek().type() == TokenType.EOF) {
            throw new DslParseException("Strategy source contains no expression", cursor.peek().position());
        }
        AstNode root = parseForm(cursor, 1);
        Token trailing = cursor.peek();
        if (trailing.type() != TokenType.EOF) {
            throw new DslParseException(
                    "Unexpected " + trailing.describe() + " after top-level expression", trailing.position());
        }
        log.debug("Parsed strategy: {} tokens, {} nodes", tokens.size(), cursor.nodeCount);
        return root;
    }

    private AstNode parseForm(Cursor cursor, int depth) {
        Token token = cursor.next();
        cursor.countNode(token);
        return switch (token.type()) {
            case LEFT_PAREN -> parseList(cursor, token, ListKind.PLAIN, TokenType.RIGHT_PAREN, depth);
            case LEFT_BRACKET -> parseList(cursor, token, ListKind.VECTOR, TokenType.RIGHT_BRACKET, depth);
            case LEFT_BRACE -> parseList(cursor, token, ListKind.MAP_LITERAL, TokenType.RIGHT_BRACE, depth);
            case NUMBER -> AtomNode.number(numberOf(token), token.position());
            case STRING -> AtomNode.string(token.text(), token.position());
            case BOOLEAN -> AtomNode.bool(Boolean.parseBoolean(token.text()), token.position());
            case SYMBOL -> new SymbolNode(token.text(), token.position());
            case EOF -> throw new DslParseException("Unexpected end of input", token.position());
            default -> throw new DslParseException("Unexpected " + token.describe(), token.position());
        };
    }

    private static BigDecimal numberOf(Token token) {
        try {
            return new BigDecimal(token.text());
        } catch (NumberFormatException e) {
            throw new DslParseException("Malformed numeric literal '" + token.text() + "'", token.position());
        }
    }

    private ListNode parseList(Cursor cursor, Token open, ListKind kind, TokenType closing, int depth) {
        if (depth > maxDepth) {
            throw new DslParseException("Maximum nesting depth of " + maxDepth + " exceeded", open.position());
        }
        List<AstNode> children = new ArrayList<>();
        while (true) {
            Token token = cursor.peek();
            if (token.type() == TokenType.EOF) {
                throw new DslParseException("Unclosed '" + open.text() + "'", open.position());
            }
            if (token.type().isClosing()) {
                if (token.type() != closing) {
                    throw new DslParseException(
                            "Mismatched " + token.describe() + ", expected closing for '" + open.text() + "'",
                            token.position());
                }
                cursor.next();
                break;
            }
            children.add(parseForm(cursor, depth + 1));
        }
        if (kind == ListKind.MAP_LITERAL && children.size() % 2 != 0) {
            throw new DslParseException("Unpaired map key", children.get(children.size() - 1).getPosition());
        }
        return new ListNode(children, kind, open.position());
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    private final class Cursor {

        private final List<Token> tokens;
        private int index;
        private int nodeCount;

        private Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            Token token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        private void countNode(Token token) {
            if (++nodeCount > maxNodes) {
                throw new DslParseException("Maximum node count of " + maxNodes + " exceeded", token.position());
            }
        }
    }
}
