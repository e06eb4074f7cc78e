package org.dxworks.formframe.history;

import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.metadata.Json;
import org.dxworks.formframe.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Linear undo/redo over deep-copied snapshots of the document.
 *
 * <p>The stack holds at most {@code maxEntries} snapshots; the oldest is evicted first. A
 * debounced push captures the document and waits in a {@link DebounceSlot}, so a burst of
 * continuous edits becomes one entry holding the latest state. An immediate push flushes it first
 * to keep both kinds of edits in order. Snapshots
 * are copied on the way in and on the way out, so the live document is never aliased.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class HistoryManager {
    private static final Logger LOG = LoggerFactory.getLogger(HistoryManager.class);

    private final Supplier<List<Section>> source;
    private final Consumer<List<Section>> sink;
    private final int maxEntries;
    private final DebounceSlot debounce;
    private final List<List<Section>> stack = new ArrayList<>();
    private int cursor = -1;
    private Runnable onRestore = () -> {
    };

    /**
     * @param source reads the live document
     * @param sink   replaces the live document on undo and redo
     */
    public HistoryManager(Supplier<List<Section>> source, Consumer<List<Section>> sink, int maxEntries,
                          long debounceMillis, LongSupplier clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("History needs room for at least one entry, got " + maxEntries);
        }
        this.source = source;
        this.sink = sink;
        this.maxEntries = maxEntries;
        this.debounce = new DebounceSlot(debounceMillis, clock);
    }

    public HistoryManager(Supplier<List<Section>> source, Consumer<List<Section>> sink, FormframeConfig config) {
        this(source, sink, config.getMaxHistoryEntries(), config.getHistoryDebounceMillis(), System::currentTimeMillis);
    }

    /** Called after undo or redo replaced the document, e.g. to drop a selection that may be gone. */
    public void setOnRestore(Runnable onRestore) {
        this.onRestore = onRestore;
    }

    public void push(boolean immediate) {
        List<Section> snapshot = Json.copySections(source.get());
        if (!immediate) {
            debounce.schedule(() -> record(snapshot));
            return;
        }
        debounce.flush();
        record(snapshot);
    }

    private void record(List<Section> snapshot) {
        while (stack.size() > cursor + 1) {
            stack.remove(stack.size() - 1);
        }
        stack.add(snapshot);
        if (stack.size() > maxEntries) {
            stack.remove(0);
        }
        cursor = stack.size() - 1;
        LOG.debug("History entry {} of {} recorded", cursor + 1, stack.size());
    }

    /** Steps back one entry. A no-op at the oldest entry; returns whether the document changed. */
    public boolean undo() {
        debounce.flush();
        if (cursor <= 0) {
            return false;
        }
        cursor--;
        restore();
        return true;
    }

    /** Steps forward one entry. A no-op at the newest entry; returns whether the document changed. */
    public boolean redo() {
        debounce.flush();
        if (cursor >= stack.size() - 1) {
            return false;
        }
        cursor++;
        restore();
        return true;
    }

    private void restore() {
        sink.accept(Json.copySections(stack.get(cursor)));
        onRestore.run();
    }

    /** Records a debounced push whose delay has elapsed. */
    public boolean tick() {
        return debounce.fireIfDue();
    }

    public boolean flushPending() {
        return debounce.flush();
    }

    public boolean hasPendingPush() {
        return debounce.isPending();
    }

    /** Drops all entries and starts over from the given document. */
    public void reset(List<Section> initial) {
        debounce.cancel();
        stack.clear();
        stack.add(Json.copySections(initial));
        cursor = 0;
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < stack.size() - 1;
    }

    public int size() {
        return stack.size();
    }

    public int cursor() {
        return cursor;
    }

    public List<Section> snapshot(int index) {
        return Json.copySections(stack.get(index));
    }
}
