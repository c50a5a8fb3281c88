package ai.aerof.deck.parser;

import ai.aerof.deck.lexer.Lexer;
import ai.aerof.deck.lexer.Token;
import ai.aerof.deck.lexer.TokenType;
import ai.aerof.deck.tree.Block;
import ai.aerof.deck.tree.Entry;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.ScalarStyle;
import ai.aerof.deck.tree.Tree;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for input decks.
 *
 * <pre>
 * document   := statement*
 * statement  := block | assignment
 * block      := "under" IDENT "{" statement* "}"
 * assignment := IDENT "=" SCALAR ";"
 * </pre>
 *
 * Duplicate keys are preserved in document order. Under {@link ParsePolicy#PERMISSIVE} blocks still open at end of
 * input are closed, and a malformed statement is skipped up to the next {@code ;} (or the next {@code }} or
 * {@code under}, which are left in place).
 */
public class Parser {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final ParsePolicy policy;

    public Parser() {
        this(ParsePolicy.STRICT);
    }

    public Parser(ParsePolicy policy) {
        this(new Lexer(), policy);
    }

    public Parser(Lexer lexer, ParsePolicy policy) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public ParsePolicy policy() {
        return policy;
    }

    public Tree parse(String text) {
        return parseWithDiagnostics(text).tree();
    }

    public Tree parse(List<Token> tokens) {
        return parseWithDiagnostics(tokens).tree();
    }

    public ParseResult parseWithDiagnostics(String text) {
        return parseWithDiagnostics(lexer.tokenize(text));
    }

    public ParseResult parseWithDiagnostics(List<Token> tokens) {
        State state = new State(Objects.requireNonNull(tokens, "tokens"));
        Block.Builder root = Tree.builder();
        while (!state.atEnd()) {
            if (state.peek().type() == TokenType.RBRACE) {
                Token stray = state.peek();
                if (policy == ParsePolicy.STRICT) {
                    throw state.error("'under' or identifier", stray);
                }
                state.warn("Skipped unmatched '}'", stray);
                state.advance();
                continue;
            }
            parseStatement(state, root);
        }
        LOGGER.debug("Parsed {} tokens into {} top-level entries ({} warnings)",
                tokens.size(), root.build().children().size(), state.warnings.size());
        return new ParseResult(new Tree(root.build()), state.warnings);
    }

    private void parseStatement(State state, Block.Builder parent) {
        int start = state.index;
        try {
            Token next = state.peek();
            switch (next.type()) {
                case UNDER -> parseBlock(state, parent);
                case IDENTIFIER -> parseAssignment(state, parent);
                default -> throw state.error("'under' or identifier", next);
            }
        } catch (ParseException ex) {
            if (policy == ParsePolicy.STRICT) {
                throw ex;
            }
            state.recover(start, ex);
        }
    }

    private void parseBlock(State state, Block.Builder parent) {
        Token keyword = state.expect(TokenType.UNDER, "'under'");
        Token name = state.expect(TokenType.IDENTIFIER, "block name");
        state.expect(TokenType.LBRACE, "'{'");
        Block.Builder block = Block.builder(name.text());
        while (true) {
            if (state.atEnd()) {
                if (policy == ParsePolicy.STRICT) {
                    throw state.error("'}' closing block '" + name.text() + "' opened at line " + keyword.line(), null);
                }
                state.warn("Block '" + name.text() + "' was not closed; closed at end of input", keyword);
                break;
            }
            if (state.peek().type() == TokenType.RBRACE) {
                state.advance();
                break;
            }
            parseStatement(state, block);
        }
        parent.block(block.build());
    }

    private void parseAssignment(State state, Block.Builder parent) {
        Token key = state.expect(TokenType.IDENTIFIER, "parameter name");
        state.expect(TokenType.EQUALS, "'='");
        if (state.atEnd() || !state.peek().type().isScalar()) {
            throw state.error("value for '" + key.text() + "'", state.atEnd() ? null : state.peek());
        }
        Token value = state.advance();
        state.expect(TokenType.SEMICOLON, "';'");
        parent.entry(new Entry(key.text(), toScalar(value)));
    }

    private static Scalar toScalar(Token token) {
        return switch (token.type()) {
            case STRING -> new Scalar(token.text(), ScalarStyle.QUOTED);
            case NUMBER -> new Scalar(token.text(), ScalarStyle.NUMERIC);
            case IDENTIFIER -> new Scalar(token.text(), ScalarStyle.BARE);
            default -> throw new IllegalStateException("Not a scalar token: " + token);
        };
    }

    private static final class State {

        private final List<Token> tokens;
        private final List<ParseWarning> warnings = new ArrayList<>();
        private int index;

        private State(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        Token peek() {
            return tokens.get(index);
        }

        Token advance() {
            return tokens.get(index++);
        }

        Token expect(TokenType type, String description) {
            if (atEnd()) {
                throw error(description, null);
            }
            Token token = peek();
            if (token.type() != type) {
                throw error(description, token);
            }
            index++;
            return token;
        }

        ParseException error(String expected, Token found) {
            if (found != null) {
                return new ParseException(expected, found.describe(), found.position(), found.line(), found.column());
            }
            if (tokens.isEmpty()) {
                return new ParseException(expected, "end of input", 0, 1, 1);
            }
            Token last = tokens.get(tokens.size() - 1);
            return new ParseException(expected, "end of input", last.endPosition(), last.endLine(), last.endColumn());
        }

        void warn(String message, Token at) {
            ParseWarning warning = new ParseWarning(message, at.line(), at.column());
            LOGGER.warn("{}", warning);
            warnings.add(warning);
        }

        void recover(int start, ParseException cause) {
            index = start;
            Token first = advance();
            while (!atEnd()) {
                TokenType type = peek().type();
                if (type == TokenType.SEMICOLON) {
                    index++;
                    break;
                }
                if (type == TokenType.RBRACE || type == TokenType.UNDER) {
                    break;
                }
                index++;
            }
            ParseWarning warning = new ParseWarning("Skipped malformed statement: expected " + cause.expected()
                    + " but found " + cause.found(), first.line(), first.column());
            LOGGER.warn("{}", warning);
            warnings.add(warning);
        }
    }
}
