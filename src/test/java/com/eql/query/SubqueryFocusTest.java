package com.eql.query;

import com.eql.edn.EdnValue;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.eql.edn.Edn.*;
import static org.junit.jupiter.api.Assertions.*;

public class SubqueryFocusTest {

    private final SubqueryFocus focus = new SubqueryFocus();

    private static final EdnValue.EdnVector ALBUMS = vector(keyword("album/name"), keyword("album/year"));
    private static final EdnValue.EdnVector ARTIST = vector(
        keyword("artist/name"),
        map(keyword("artist/albums"), ALBUMS));
    private static final EdnValue.EdnVector QUERY = vector(
        keyword("user/name"),
        map(keyword("favorite-artist"), ARTIST),
        map(list(keyword("friends"), map(keyword("limit"), integer(10))), vector(keyword("user/name"))),
        map(ident("user/id", integer(7)), vector(keyword("user/email"))));

    private Optional<EdnValue.EdnVector> focus(EdnValue.EdnVector query, EdnValue... path) {
        return focus.focus(query, List.of(path));
    }

    // ==================== Paths ====================

    @Test
    public void testEmptyPathIsTheQueryItself() {
        assertEquals(Optional.of(QUERY), focus(QUERY));
    }

    @Test
    public void testSingleStep() {
        assertEquals(Optional.of(ARTIST), focus(QUERY, keyword("favorite-artist")));
    }

    @Test
    public void testNestedSteps() {
        assertEquals(Optional.of(ALBUMS), focus(QUERY, keyword("favorite-artist"), keyword("artist/albums")));
    }

    @Test
    public void testStepsCompose() {
        EdnValue.EdnVector first = focus(QUERY, keyword("favorite-artist")).orElseThrow();

        assertEquals(focus(QUERY, keyword("favorite-artist"), keyword("artist/albums")),
            focus(first, keyword("artist/albums")));
    }

    @Test
    public void testParameterizedJoinIsMatchedByItsKey() {
        assertEquals(Optional.of(vector(keyword("user/name"))), focus(QUERY, keyword("friends")));
    }

    @Test
    public void testWrappedJoinMapIsMatched() {
        EdnValue.EdnVector query = vector(list(map(keyword("albums"), ALBUMS), map(keyword("limit"), integer(5))));

        assertEquals(Optional.of(ALBUMS), focus(query, keyword("albums")));
    }

    @Test
    public void testIdentJoinMatchesDispatchKeyOrFullIdent() {
        EdnValue.EdnVector expected = vector(keyword("user/email"));

        assertEquals(Optional.of(expected), focus(QUERY, keyword("user/id")));
        assertEquals(Optional.of(expected), focus(QUERY, ident("user/id", integer(7))));
        assertTrue(focus(QUERY, ident("user/id", integer(8))).isEmpty());
    }

    @Test
    public void testFirstMatchingJoinWins() {
        EdnValue.EdnVector query = vector(
            map(keyword("a"), vector(keyword("first"))),
            map(keyword("a"), vector(keyword("second"))));

        assertEquals(Optional.of(vector(keyword("first"))), focus(query, keyword("a")));
    }

    @Test
    public void testMutationJoinIsMatchedBySymbol() {
        EdnValue.EdnVector query = vector(map(list(symbol("todo/create"), map()), vector(keyword("todo/id"))));

        assertEquals(Optional.of(vector(keyword("todo/id"))), focus(query, symbol("todo/create")));
    }

    @Test
    public void testMissingKeysAreNotFound() {
        assertTrue(focus(QUERY, keyword("missing")).isEmpty());
        assertTrue(focus(QUERY, keyword("user/name")).isEmpty());
        assertTrue(focus(QUERY, keyword("favorite-artist"), keyword("missing")).isEmpty());
    }

    // ==================== Unions ====================

    @Test
    public void testUnionBranchIsSelectedByTheNextKey() {
        EdnValue.EdnVector photo = vector(keyword("photo/url"));
        EdnValue.EdnVector video = vector(keyword("video/title"));
        EdnValue.EdnVector query = vector(map(keyword("feed"), map(keyword("photo"), photo, keyword("video"), video)));

        assertEquals(Optional.of(video), focus(query, keyword("feed"), keyword("video")));
        assertEquals(Optional.of(photo), focus(query, keyword("feed"), keyword("photo")));
        assertTrue(focus(query, keyword("feed")).isEmpty());
        assertTrue(focus(query, keyword("feed"), keyword("audio")).isEmpty());
    }

    // ==================== Recursion ====================

    @Test
    public void testUnboundedRecursionFocusesOnTheSameQuery() {
        EdnValue.EdnVector query = vector(keyword("entry/name"), map(keyword("entry/children"), recursion()));

        assertEquals(Optional.of(query), focus(query, keyword("entry/children")));
        assertEquals(Optional.of(query), focus(query, keyword("entry/children"), keyword("entry/children")));
    }

    @Test
    public void testBoundedRecursionLowersTheDepth() {
        EdnValue.EdnVector query = vector(keyword("entry/name"), map(keyword("entry/children"), integer(2)));

        assertEquals(Optional.of(vector(keyword("entry/name"), map(keyword("entry/children"), integer(1)))),
            focus(query, keyword("entry/children")));
        assertEquals(Optional.of(vector(keyword("entry/name"), map(keyword("entry/children"), integer(0)))),
            focus(query, keyword("entry/children"), keyword("entry/children")));
        assertTrue(focus(query, keyword("entry/children"), keyword("entry/children"), keyword("entry/children"))
            .isEmpty());
    }

    @Test
    public void testBoundedRecursionKeepsParams() {
        EdnValue.EdnMap params = map(keyword("x"), integer(1));
        EdnValue.EdnVector query = vector(map(list(keyword("tree"), params), integer(1)));

        assertEquals(Optional.of(vector(map(list(keyword("tree"), params), integer(0)))),
            focus(query, keyword("tree")));
    }

    @Test
    public void testZeroDepthIsNotFound() {
        assertTrue(focus(vector(map(keyword("tree"), integer(0))), keyword("tree")).isEmpty());
    }

    @Test
    public void testPathFromEclipseList() {
        assertEquals(Optional.of(ALBUMS),
            focus.focus(QUERY, Lists.immutable.of(keyword("favorite-artist"), keyword("artist/albums")).castToList()));
    }
}
