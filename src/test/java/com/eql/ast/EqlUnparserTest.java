package com.eql.ast;

import com.eql.edn.EdnValue;
import com.eql.edn.Meta;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static com.eql.edn.Edn.*;
import static org.junit.jupiter.api.Assertions.*;

public class EqlUnparserTest {

    private final EqlParser parser = new EqlParser();
    private final EqlUnparser unparser = new EqlUnparser();

    private EdnValue roundTrip(EdnValue transaction) {
        return unparser.unparse(parser.parse(transaction));
    }

    static Stream<EdnValue> validTransactions() {
        return Stream.of(
            vector(),
            vector(keyword("album/name"), keyword("album/year")),
            vector(map(keyword("favorite-albums"), vector(keyword("album/name"), keyword("album/year")))),
            vector(ident("customer/id", integer(123))),
            vector(list(keyword("foo"), map(keyword("with"), string("params")))),
            vector(list(keyword("foo"), map())),
            vector(list(map(keyword("albums"), vector(keyword("album/name"))), map(keyword("limit"), integer(5)))),
            vector(map(list(ident("user/id", integer(1)), map(keyword("x"), integer(1))), vector(keyword("user/name")))),
            vector(keyword("entry/name"), map(keyword("entry/folders"), recursion())),
            vector(keyword("entry/name"), map(keyword("entry/folders"), integer(3))),
            vector(map(keyword("feed"), map(
                keyword("photo"), vector(keyword("photo/url"), map(keyword("photo/owner"), vector(keyword("user/name")))),
                keyword("video"), vector(keyword("video/title"))))),
            vector(list(symbol("app/save"), map(keyword("id"), integer(1)))),
            vector(symbol("app/ping")),
            vector(map(list(symbol("todo/create"), map(keyword("title"), string("milk"))), vector(keyword("todo/id")))),
            vector(map(keyword("a"), vector(map(keyword("b"), vector(map(keyword("c"), vector(keyword("d"))))))))
                .withMeta(Meta.at(1, 1)),
            vector(map(keyword("x"), vector(list(map(keyword("a"), vector(keyword("b"))), map(keyword("p"), integer(1)))))),
            vector(map(keyword("feed"), map(
                keyword("photo"), vector(list(map(keyword("owner"), vector(keyword("user/name"))), map(keyword("p"), integer(1)))),
                keyword("video"), vector(symbol("app/ping"), list(symbol("app/log")))))),
            vector(map(list(symbol("todo/create"), map()), vector(list(map(keyword("tags"), vector(keyword("tag/name"))),
                map(keyword("limit"), integer(3))))))
        );
    }

    @ParameterizedTest
    @MethodSource("validTransactions")
    public void testParseUnparseParseIsStable(EdnValue transaction) {
        EqlNode.Root first = parser.parse(transaction);
        EqlNode.Root second = parser.parse(unparser.unparse(first));

        assertEquals(EqlNodes.stripMeta(first), EqlNodes.stripMeta(second));
    }

    @ParameterizedTest
    @MethodSource("validTransactions")
    public void testUnparseIsAFixedPoint(EdnValue transaction) {
        EdnValue once = roundTrip(transaction);
        assertEquals(once, roundTrip(once));
    }

    @Test
    public void testPlainQueryUnparsesToItself() {
        EdnValue query = vector(
            keyword("album/name"),
            ident("customer/id", integer(123)),
            map(keyword("artist"), vector(keyword("artist/name"))));

        assertEquals(query, roundTrip(query));
    }

    @Test
    public void testWrappedJoinMapIsRewrittenAroundTheKey() {
        EdnValue.EdnMap params = map(keyword("limit"), integer(5));
        EdnValue wrapMap = vector(list(map(keyword("albums"), vector(keyword("album/name"))), params));

        assertEquals(vector(map(list(keyword("albums"), params), vector(keyword("album/name")))), roundTrip(wrapMap));
    }

    @Test
    public void testRecursionMarkersAreKeptExactly() {
        EdnValue query = vector(map(keyword("a"), recursion()), map(keyword("b"), integer(0)));

        assertEquals(query, roundTrip(query));
    }

    @Test
    public void testUnionKeepsBranchOrder() {
        EdnValue query = vector(map(keyword("feed"), map(
            keyword("video"), vector(keyword("video/title")),
            keyword("photo"), vector(keyword("photo/url")))));

        EdnValue.EdnMap join = (EdnValue.EdnMap) ((EdnValue.EdnVector) roundTrip(query)).get(0);
        EdnValue.EdnMap union = (EdnValue.EdnMap) join.get(keyword("feed"));
        assertEquals(Lists.immutable.of(keyword("video"), keyword("photo")), union.entries().keysView().toList().toImmutable());
    }

    @Test
    public void testBareCallUnparsesWithEmptyParams() {
        assertEquals(vector(list(symbol("app/ping"), map())), roundTrip(vector(symbol("app/ping"))));
    }

    @Test
    public void testMetaIsNotWritten() {
        EdnValue transaction = vector(map(keyword("a"), vector(keyword("b"))).withMeta(Meta.at(2, 2)))
            .withMeta(Meta.at(1, 1));

        EdnValue.EdnVector result = (EdnValue.EdnVector) roundTrip(transaction);

        assertNull(result.meta());
        assertNull(((EdnValue.EdnMap) result.get(0)).meta());
    }

    @Test
    public void testRewrittenChildrenAreReflected() {
        EqlNode.Root root = parser.parse(vector(map(keyword("artist"), vector(keyword("artist/name"), keyword("artist/bio")))));
        EqlNode.Join join = (EqlNode.Join) root.children().getFirst();
        EqlNode.Join trimmed = join.withQuery(join.query(), join.children().take(1));

        EdnValue result = unparser.unparse(root.withChildren(Lists.immutable.of(trimmed)));

        assertEquals(vector(map(keyword("artist"), vector(keyword("artist/name")))), result);
    }

    @Test
    public void testUnparseSingleNodes() {
        assertEquals(keyword("a"), unparser.unparse(EqlNode.Prop.of(keyword("a"))));
        assertEquals(list(symbol("app/save"), map()), unparser.unparse(EqlNode.Call.of(symbol("app/save"), map())));
    }

    @Test
    public void testUnionJoinWithoutUnionChildIsAProgrammingError() {
        EdnValue.EdnMap union = map(keyword("photo"), vector(keyword("url")));
        EqlNode.Join broken = new EqlNode.Join(keyword("feed"), keyword("feed"), new JoinQuery.UnionQuery(union),
            Lists.immutable.empty(), null, null);

        assertThrows(IllegalStateException.class, () -> unparser.unparse(broken));
    }
}
