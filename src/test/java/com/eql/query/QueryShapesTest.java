package com.eql.query;

import com.eql.ast.EqlParseException;
import com.eql.edn.EdnValue;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.eql.edn.Edn.*;
import static org.junit.jupiter.api.Assertions.*;

public class QueryShapesTest {

    private final QueryShapes shapes = new QueryShapes();

    // ==================== rootProperties ====================

    @Test
    public void testRootPropertiesInQueryOrder() {
        EdnValue.EdnVector query = vector(
            keyword("a"),
            map(keyword("b"), vector(keyword("c"))),
            list(keyword("d"), map()),
            list(symbol("app/save"), map()),
            ident("user/id", integer(1)));

        assertEquals(Lists.immutable.of(keyword("a"), keyword("b"), keyword("d"), symbol("app/save"), keyword("user/id")),
            shapes.rootProperties(query));
    }

    @Test
    public void testRootPropertiesRejectMalformedQueries() {
        assertThrows(EqlParseException.class, () -> shapes.rootProperties(vector(string("nope"))));
    }

    // ==================== dataToQuery ====================

    @Test
    public void testFlatMap() {
        assertEquals(Optional.of(vector(keyword("a"), keyword("b"))),
            shapes.dataToQuery(map(keyword("a"), integer(1), keyword("b"), string("x"))));
    }

    @Test
    public void testNestedMapsBecomeJoins() {
        EdnValue data = map(
            keyword("user/name"), string("Ada"),
            keyword("user/address"), map(keyword("address/city"), string("London")));

        assertEquals(Optional.of(vector(keyword("user/name"), map(keyword("user/address"), vector(keyword("address/city"))))),
            shapes.dataToQuery(data));
    }

    @Test
    public void testVectorOfMapsMergesShapes() {
        EdnValue data = map(keyword("items"), vector(
            map(keyword("x"), integer(1)),
            map(keyword("y"), integer(2), keyword("x"), integer(3))));

        assertEquals(Optional.of(vector(map(keyword("items"), vector(keyword("x"), keyword("y"))))),
            shapes.dataToQuery(data));
    }

    @Test
    public void testVectorOfScalarsIsAProp() {
        assertEquals(Optional.of(vector(keyword("tags"))),
            shapes.dataToQuery(map(keyword("tags"), vector(string("a"), string("b")))));
    }

    @Test
    public void testNonKeywordKeysAreSkipped() {
        assertEquals(Optional.of(vector(keyword("a"))),
            shapes.dataToQuery(map(string("s"), integer(1), keyword("a"), integer(2))));
    }

    @Test
    public void testValuesWithoutMapsGiveNothing() {
        assertTrue(shapes.dataToQuery(integer(1)).isEmpty());
        assertTrue(shapes.dataToQuery(map()).isEmpty());
        assertTrue(shapes.dataToQuery(vector(integer(1), string("x"))).isEmpty());
    }
}
