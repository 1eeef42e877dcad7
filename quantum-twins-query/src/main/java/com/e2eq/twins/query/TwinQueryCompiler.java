package com.e2eq.twins.query;

import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.exceptions.TwinQueryCompileException;
import com.e2eq.twins.grammar.TwinQueryLexer;
import com.e2eq.twins.grammar.TwinQueryParser;
import com.e2eq.twins.query.ast.TwinQuery;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeWalker;
import org.jboss.logging.Logger;

import java.util.regex.Pattern;

/**
 * Translates the declarative twin query dialect into Cypher for the graph engine.
 * <p>
 * The query is tokenized and parsed with the {@code TwinQuery} grammar, turned into a
 * {@link TwinQuery} tree by {@link TwinQueryAstListener} and rendered by
 * {@link CypherQueryGenerator}. Anything the grammar cannot place fails the whole
 * compilation with a {@link TwinQueryCompileException}.
 */
public class TwinQueryCompiler {
    private static final Logger LOG = Logger.getLogger(TwinQueryCompiler.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public CompiledQuery compile(String query, String graphNamespace) {
        if (graphNamespace == null || !NAMESPACE.matcher(graphNamespace).matches()) {
            throw new InvalidArgumentException("Invalid graph namespace: " + graphNamespace);
        }
        TwinQuery ast = parse(query);
        CompiledQuery compiled = new CypherQueryGenerator(graphNamespace).generate(ast);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Compiled twin query [%s] to [%s]", query, compiled.getText());
        }
        return compiled;
    }

    /**
     * Parses the query into its tree without rendering it.
     */
    public TwinQuery parse(String query) {
        if (query == null || query.isBlank()) {
            throw new TwinQueryCompileException("Query cannot be null or empty", "");
        }
        final String q = WHITESPACE.matcher(query).replaceAll(" ").trim();

        BaseErrorListener errorListener = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                    int charPositionInLine, String msg, RecognitionException e) {
                String fragment = offendingSymbol instanceof Token token ? token.getText() : fragmentAt(q, charPositionInLine);
                throw new TwinQueryCompileException("Failed to parse " + q + " at position " + charPositionInLine + " due to " + msg,
                        fragment, charPositionInLine, e);
            }
        };

        TwinQueryLexer lexer = new TwinQueryLexer(CharStreams.fromString(q));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);
        TwinQueryParser parser = new TwinQueryParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        ParseTree tree = parser.query();

        TwinQueryAstListener listener = new TwinQueryAstListener();
        try {
            ParseTreeWalker.DEFAULT.walk(listener, tree);
        } catch (IllegalArgumentException e) {
            throw new TwinQueryCompileException(e.getMessage(), q, -1, e);
        }
        return listener.getQuery();
    }

    private static String fragmentAt(String query, int position) {
        if (position < 0 || position >= query.length()) {
            return "";
        }
        return query.substring(position, Math.min(query.length(), position + 10));
    }
}
