package com.eql;

import com.eql.ast.EqlNode;
import com.eql.ast.EqlParseException;
import com.eql.ast.ErrorKind;
import com.eql.edn.EdnValue;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.eql.edn.Edn.*;
import static org.junit.jupiter.api.Assertions.*;

public class EQLTest {

    private static final EdnValue.EdnVector QUERY = vector(
        keyword("album/name"),
        map(keyword("album/artist"), vector(keyword("artist/name"), map(keyword("artist/albums"), recursion()))),
        map(list(keyword("album/tracks"), map(keyword("limit"), integer(10))), vector(keyword("track/title"))));

    @Test
    public void testParseAndUnparse() {
        EqlNode.Root root = EQL.parse(QUERY);

        assertEquals(3, root.children().size());
        assertEquals(QUERY, EQL.unparse(root));
        assertEquals(QUERY, EQL.getQuery(root));
    }

    @Test
    public void testParseElement() {
        EqlNode node = EQL.parseElement(keyword("album/name"));

        assertEquals(EqlNode.Prop.of(keyword("album/name")), node);
    }

    @Test
    public void testParseErrorIsReported() {
        EqlParseException e = assertThrows(EqlParseException.class,
            () -> EQL.parse(vector(map(keyword("a"), string("b")))));

        assertEquals(ErrorKind.INVALID_RECURSION_MARKER, e.kind());
    }

    @Test
    public void testFocusSubquery() {
        assertEquals(Optional.of(vector(keyword("track/title"))),
            EQL.focusSubquery(QUERY, List.of(keyword("album/tracks"))));
        assertEquals(Optional.of(vector(keyword("artist/name"), map(keyword("artist/albums"), recursion()))),
            EQL.focusSubquery(QUERY, List.of(keyword("album/artist"), keyword("artist/albums"))));
    }

    @Test
    public void testMergeMaskAndShapes() {
        assertEquals(Optional.of(vector(keyword("a"), keyword("b"))), EQL.merge(vector(keyword("a")), vector(keyword("b"))));
        assertEquals(vector(keyword("album/name")), EQL.mask(QUERY, vector(keyword("album/name"))));
        assertEquals(Lists.immutable.of(keyword("album/name"), keyword("album/artist"), keyword("album/tracks")),
            EQL.rootProperties(QUERY));
        assertEquals(Optional.of(vector(keyword("a"))), EQL.dataToQuery(map(keyword("a"), integer(1))));
    }

    @Test
    public void testConcurrentParsing() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<EdnValue>> results = Lists.mutable.empty();
            for (int i = 0; i < 64; i++) {
                EdnValue.EdnVector query = QUERY.with(ident("item/id", integer(i)));
                results.add(executor.submit(() -> EQL.unparse(EQL.parse(query))));
            }
            for (int i = 0; i < results.size(); i++) {
                EdnValue.EdnVector expected = QUERY.with(ident("item/id", integer(i)));
                assertEquals(expected, results.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
