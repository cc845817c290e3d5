package com.tarterware.pedalpath.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.HistoryEntry;

class RouteHistoryTest
{
    private static HistoryEntry entry(long timestamp)
    {
        return new HistoryEntry(List.of(), List.of(Coordinate.of(timestamp, 0)), timestamp);
    }

    @Test
    void testInvalidCapacity()
    {
        assertThrows(IllegalArgumentException.class, () -> new RouteHistory(0));
    }

    @Test
    void testEmptyHistory()
    {
        RouteHistory history = new RouteHistory();

        assertEquals(-1, history.getCursor());
        assertEquals(0, history.size());
        assertFalse(history.canUndo());
        assertFalse(history.canRedo());
        assertNull(history.undo());
        assertNull(history.redo());
        assertNull(history.current());
    }

    @Test
    void testUndoRedoBoundaries()
    {
        RouteHistory history = new RouteHistory();
        HistoryEntry first = entry(1);
        HistoryEntry second = entry(2);
        history.push(first);
        history.push(second);

        assertTrue(history.canUndo());
        assertFalse(history.canRedo());

        assertSame(first, history.undo());
        assertFalse(history.canUndo());
        assertNull(history.undo());
        assertEquals(0, history.getCursor());

        assertSame(second, history.redo());
        assertNull(history.redo());
        assertEquals(1, history.getCursor());
    }

    @Test
    void testPushDiscardsRedoBranch()
    {
        RouteHistory history = new RouteHistory();
        history.push(entry(1));
        history.push(entry(2));
        history.push(entry(3));
        history.undo();
        history.undo();

        HistoryEntry branch = entry(4);
        history.push(branch);

        assertEquals(2, history.size());
        assertSame(branch, history.current());
        assertFalse(history.canRedo());
    }

    @Test
    void testCapEvictsOldestEntries()
    {
        RouteHistory history = new RouteHistory();
        for (int i = 0; i < 120; i++)
        {
            history.push(entry(i));
            assertTrue(history.size() <= RouteHistory.DEFAULT_MAX_ENTRIES);
        }

        assertEquals(50, history.size());
        assertEquals(49, history.getCursor());
        assertEquals(119, history.current().getTimestamp());

        // Walking back stops at the oldest retained entry.
        HistoryEntry oldest = null;
        while (history.canUndo())
        {
            oldest = history.undo();
        }
        assertEquals(70, oldest.getTimestamp());
    }

    @Test
    void testReplaceCurrentAndSeed()
    {
        RouteHistory history = new RouteHistory();
        history.replaceCurrent(entry(1));
        assertEquals(0, history.size());

        history.push(entry(1));
        history.push(entry(2));
        HistoryEntry replacement = entry(3);
        history.replaceCurrent(replacement);
        assertSame(replacement, history.current());
        assertEquals(2, history.size());

        history.seed(entry(9));
        assertEquals(1, history.size());
        assertEquals(0, history.getCursor());
        assertFalse(history.canUndo());
    }
}
