package com.tarterware.pedalpath.components;

import java.util.ArrayList;
import java.util.List;

import com.tarterware.pedalpath.models.HistoryEntry;

/**
 * Bounded undo/redo history of planner snapshots.
 *
 * <p>
 * Entries are kept oldest first. The cursor points at the entry that matches
 * the live route; -1 means the history is empty. Pushing a new entry discards
 * everything after the cursor, and once the history holds {@code maxEntries}
 * the oldest entry is evicted.
 * </p>
 */
public class RouteHistory
{
    public static final int DEFAULT_MAX_ENTRIES = 50;

    private final int maxEntries;

    private final List<HistoryEntry> entries = new ArrayList<>();

    private int cursor = -1;

    public RouteHistory()
    {
        this(DEFAULT_MAX_ENTRIES);
    }

    /**
     * @param maxEntries Maximum number of retained entries.
     * @throws IllegalArgumentException if maxEntries is less than 1.
     */
    public RouteHistory(int maxEntries)
    {
        if (maxEntries < 1)
        {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Record a new state after the cursor, discarding any redo entries.
     *
     * @param entry The snapshot to record.
     */
    public void push(HistoryEntry entry)
    {
        // Truncate the redo branch.
        while (entries.size() > cursor + 1)
        {
            entries.remove(entries.size() - 1);
        }

        entries.add(entry);

        if (entries.size() > maxEntries)
        {
            entries.remove(0);
        }

        cursor = entries.size() - 1;
    }

    /**
     * Step back one entry.
     *
     * @return the entry now at the cursor, or null when already at the oldest
     *         entry.
     */
    public HistoryEntry undo()
    {
        if (!canUndo())
        {
            return null;
        }

        cursor--;
        return entries.get(cursor);
    }

    /**
     * Step forward one entry.
     *
     * @return the entry now at the cursor, or null when already at the newest
     *         entry.
     */
    public HistoryEntry redo()
    {
        if (!canRedo())
        {
            return null;
        }

        cursor++;
        return entries.get(cursor);
    }

    public boolean canUndo()
    {
        return cursor > 0;
    }

    public boolean canRedo()
    {
        return cursor < entries.size() - 1;
    }

    /**
     * Replace the entry at the cursor without moving it. Does nothing when the
     * history is empty.
     *
     * @param entry The replacement.
     */
    public void replaceCurrent(HistoryEntry entry)
    {
        if (cursor >= 0)
        {
            entries.set(cursor, entry);
        }
    }

    /**
     * @return the entry at the cursor, or null when the history is empty.
     */
    public HistoryEntry current()
    {
        return (cursor >= 0) ? entries.get(cursor) : null;
    }

    /**
     * Discard all entries and seed the history with a single one.
     *
     * @param entry The initial entry.
     */
    public void seed(HistoryEntry entry)
    {
        clear();
        push(entry);
    }

    public void clear()
    {
        entries.clear();
        cursor = -1;
    }

    public int size()
    {
        return entries.size();
    }

    public int getCursor()
    {
        return cursor;
    }

    public int getMaxEntries()
    {
        return maxEntries;
    }
}
