package com.convkit.model;

import com.convkit.codec.JsonCodec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaginationTest {

    @Test
    void prefersNextCursor() {
        var p = new Pagination("/v1/workspaces", "/v1/workspaces?cursor=abc", null, null, null, "xyz");
        assertEquals("xyz", p.cursorForNextPage().orElseThrow());
    }

    @Test
    void fallsBackToCursorInNextUrl() {
        var p = new Pagination("/v1/workspaces", "/v1/workspaces?version=2017-05-26&cursor=a%2Bb%3D", null, null,
                null, null);
        assertTrue(p.hasNextPage());
        assertEquals("a+b=", p.cursorForNextPage().orElseThrow());
    }

    @Test
    void lastPageHasNoCursor() {
        var p = new Pagination("/v1/workspaces", null, null, null, null, null);
        assertFalse(p.hasNextPage());
    }

    @Test
    void collectionDecodesWithCount() {
        var json = """
                {"workspaces":[{"name":"a","language":"en","workspace_id":"1"}],
                 "pagination":{"refresh_url":"/v1/workspaces","total":1,"matched":1}}
                """;
        var collection = JsonCodec.decode(json, WorkspaceCollection.SCHEMA);
        assertEquals(1, collection.workspaces().size());
        assertEquals(1L, collection.pagination().total());
        assertFalse(collection.pagination().hasNextPage());
    }
}
