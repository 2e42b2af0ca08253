package com.eql;

import com.eql.ast.EqlNode;
import com.eql.ast.EqlParser;
import com.eql.ast.EqlUnparser;
import com.eql.edn.EdnValue;
import org.eclipse.collections.api.list.ImmutableList;
import com.eql.query.QueryExtractor;
import com.eql.query.QueryMasker;
import com.eql.query.QueryMerger;
import com.eql.query.QueryShapes;
import com.eql.query.SubqueryFocus;

import java.util.List;
import java.util.Optional;

/**
 * Entry points for converting between query notation and its AST, and for the
 * query operations built on them. Every method is a pure function and safe to
 * call from any thread.
 */
public final class EQL {
    private static final EqlParser PARSER = new EqlParser();
    private static final EqlUnparser UNPARSER = new EqlUnparser();
    private static final QueryExtractor EXTRACTOR = new QueryExtractor();
    private static final SubqueryFocus FOCUS = new SubqueryFocus();
    private static final QueryMerger MERGER = new QueryMerger(PARSER, UNPARSER);
    private static final QueryMasker MASKER = new QueryMasker(PARSER, UNPARSER);
    private static final QueryShapes SHAPES = new QueryShapes(PARSER, MERGER);

    private EQL() {
    }

    /**
     * @throws com.eql.ast.EqlParseException if any element is malformed
     */
    public static EqlNode.Root parse(EdnValue transaction) {
        return PARSER.parse(transaction);
    }

    public static EqlNode parseElement(EdnValue element) {
        return PARSER.parseElement(element);
    }

    public static EdnValue unparse(EqlNode node) {
        return UNPARSER.unparse(node);
    }

    public static EdnValue getQuery(EqlNode node) {
        return EXTRACTOR.getQuery(node);
    }

    public static Optional<EdnValue.EdnVector> focusSubquery(EdnValue.EdnVector query, List<? extends EdnValue> path) {
        return FOCUS.focus(query, path);
    }

    public static Optional<EdnValue.EdnVector> merge(EdnValue.EdnVector left, EdnValue.EdnVector right) {
        return MERGER.merge(left, right);
    }

    public static EdnValue.EdnVector mask(EdnValue.EdnVector source, EdnValue.EdnVector mask) {
        return MASKER.mask(source, mask);
    }

    public static ImmutableList<EdnValue> rootProperties(EdnValue.EdnVector query) {
        return SHAPES.rootProperties(query);
    }

    public static Optional<EdnValue.EdnVector> dataToQuery(EdnValue data) {
        return SHAPES.dataToQuery(data);
    }
}
