package org.dxworks.formframe.history;

import org.dxworks.formframe.model.Section;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HistoryManagerTest {

    private final AtomicReference<List<Section>> document = new AtomicReference<>(new ArrayList<>());
    private final AtomicLong now = new AtomicLong();
    private final HistoryManager history = new HistoryManager(document::get, document::set, 50, 400, now::get);

    /** Replaces the document with a single section whose id names the edit. */
    private void edit(String name) {
        Section section = Section.create(1);
        section.id = name;
        document.set(new ArrayList<>(List.of(section)));
    }

    private String current() {
        return document.get().get(0).id;
    }

    @Test
    void keepsTheNewestEntriesUpToTheBound() {
        for (int i = 1; i <= 60; i++) {
            edit("#" + i);
            history.push(true);
        }

        assertEquals(50, history.size());
        assertEquals("#11", history.snapshot(0).get(0).id);
        assertEquals("#60", history.snapshot(49).get(0).id);
        assertEquals(49, history.cursor());
    }

    @Test
    void undoTwiceThenRedoLandsOnTheSecondSnapshot() {
        edit("#1");
        history.push(true);
        edit("#2");
        history.push(true);
        edit("#3");
        history.push(true);

        history.undo();
        history.undo();
        history.redo();

        assertEquals("#2", current());
        assertEquals(1, history.cursor());
    }

    @Test
    void undoAndRedoAreInverse() {
        history.reset(document.get());
        for (int i = 1; i <= 5; i++) {
            edit("#" + i);
            history.push(true);
        }
        for (int i = 0; i < 5; i++) {
            assertTrue(history.undo());
        }
        assertTrue(document.get().isEmpty());
        for (int i = 0; i < 5; i++) {
            assertTrue(history.redo());
        }

        assertEquals("#5", current());
    }

    @Test
    void boundariesAreSilentNoOps() {
        edit("#1");
        history.reset(document.get());

        assertFalse(history.undo());
        assertFalse(history.redo());
        assertFalse(history.canUndo());
        assertEquals("#1", current());
    }

    @Test
    void newPushDropsTheRedoBranch() {
        edit("#1");
        history.push(true);
        edit("#2");
        history.push(true);
        history.undo();

        edit("#3");
        history.push(true);

        assertFalse(history.canRedo());
        assertEquals(2, history.size());
        assertEquals("#3", history.snapshot(1).get(0).id);
    }

    @Test
    void burstOfContinuousEditsBecomesOneEntry() {
        history.reset(document.get());
        for (int i = 1; i <= 3; i++) {
            now.set(i * 100L);
            edit("#" + i);
            history.push(false);
        }

        now.set(600);
        assertFalse(history.tick());
        now.set(700);
        assertTrue(history.tick());

        assertEquals(2, history.size());
        assertEquals("#3", history.snapshot(1).get(0).id);
    }

    @Test
    void immediatePushRecordsThePendingEditFirst() {
        history.reset(document.get());
        edit("typed");
        history.push(false);

        edit("added");
        history.push(true);

        assertEquals(3, history.size());
        assertEquals("typed", history.snapshot(1).get(0).id);
        assertEquals("added", history.snapshot(2).get(0).id);
        assertFalse(history.hasPendingPush());
    }

    @Test
    void undoFlushesAPendingEditBeforeSteppingBack() {
        edit("#1");
        history.reset(document.get());
        edit("#2");
        history.push(false);

        assertTrue(history.undo());

        assertEquals("#1", current());
        assertTrue(history.redo());
        assertEquals("#2", current());
    }

    @Test
    void snapshotsAreNotAliased() {
        edit("#1");
        history.push(true);

        document.get().get(0).id = "mutated";

        assertEquals("#1", history.snapshot(0).get(0).id);
    }

    @Test
    void restoreNotifiesTheOwner() {
        List<String> calls = new ArrayList<>();
        history.setOnRestore(() -> calls.add("restored"));
        edit("#1");
        history.push(true);
        edit("#2");
        history.push(true);

        history.undo();

        assertEquals(List.of("restored"), calls);
    }

    @Test
    void rejectsAnEmptyBound() {
        assertThrows(IllegalArgumentException.class,
                () -> new HistoryManager(document::get, document::set, 0, 400, now::get));
    }
}
