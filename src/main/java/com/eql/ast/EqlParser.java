package com.eql.ast;

import com.eql.edn.EdnValue;
import com.eql.edn.Meta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds the AST of a transaction.
 * <p>
 * Traversal runs on an explicit stack of {@link ParseFrame}s, so nesting depth is
 * bounded by heap rather than by the call stack. The first malformed element
 * aborts the whole parse with an {@link EqlParseException}.
 */
public class EqlParser {
    private static final Logger log = LoggerFactory.getLogger(EqlParser.class);

    private final EqlParserOptions options;
    private final NodeClassifier classifier;

    public EqlParser() {
        this(EqlParserOptions.defaults());
    }

    public EqlParser(EqlParserOptions options) {
        this.options = options;
        this.classifier = new NodeClassifier(options);
    }

    public EqlNode.Root parse(EdnValue transaction) {
        if (!(transaction instanceof EdnValue.EdnVector elements)) {
            throw new EqlParseException(ErrorKind.UNCLASSIFIABLE_ELEMENT, transaction, EqlPath.root(),
                classifier.positionOf(transaction, null));
        }

        Meta rootMeta = options.keepMeta() ? elements.meta() : null;
        ParseFrame rootFrame = new ParseFrame.SequenceFrame(EqlPath.root(), classifier.positionOf(elements, null),
            elements, children -> new EqlNode.Root(children, rootMeta));

        EqlNode.Root root = (EqlNode.Root) run(rootFrame);
        log.debug("Parsed transaction with {} top-level element(s)", root.children().size());
        return root;
    }

    /**
     * Parses a single query element, e.g. one entry of a transaction.
     */
    public EqlNode parseElement(EdnValue element) {
        Classified classified;
        try {
            classified = classifier.classify(element, EqlPath.root(), null);
        } catch (EqlParseException e) {
            log.debug("Rejected element: {}", e.getMessage());
            throw e;
        }
        return classified.isDone() ? classified.node() : run(classified.pending());
    }

    private EqlNode run(ParseFrame start) {
        Deque<ParseFrame> stack = new ArrayDeque<>();
        stack.push(start);
        EqlNode result = null;

        try {
            while (!stack.isEmpty()) {
                ParseFrame top = stack.peek();
                if (top.hasNext()) {
                    Classified classified = top.next(classifier);
                    if (classified.isDone()) {
                        top.built.add(classified.node());
                    } else {
                        stack.push(classified.pending());
                    }
                } else {
                    stack.pop();
                    EqlNode node = top.finish();
                    if (stack.isEmpty()) {
                        result = node;
                    } else {
                        stack.peek().built.add(node);
                    }
                }
            }
        } catch (EqlParseException e) {
            log.debug("Rejected element at depth {}: {}", stack.size(), e.getMessage());
            throw e;
        }
        return result;
    }
}
