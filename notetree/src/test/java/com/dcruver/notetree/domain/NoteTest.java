package com.dcruver.notetree.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NoteTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");
    private static final Instant T1 = Instant.parse("2025-01-15T11:00:00Z");
    private static final Instant T2 = Instant.parse("2025-01-15T12:00:00Z");

    @Test
    void testCountsFollowContent() {
        Note note = new Note(1, "Counts", "hello  world\nfoo", T0);

        assertEquals(3, note.getWordCount());
        assertEquals(16, note.getCharCount());

        note.updateContent("   ", T1);
        assertEquals(0, note.getWordCount());
        assertEquals(3, note.getCharCount());
    }

    @Test
    void testEveryOverwriteSnapshotsPreviousContent() {
        Note note = new Note(1, "Draft", "v0", T0);

        assertTrue(note.updateContent("v1", T1));
        assertTrue(note.updateContent("v2", T2));

        assertEquals(2, note.getHistory().size());
        assertEquals("v0", note.getHistory().get(0).getContent());
        assertEquals(T1, note.getHistory().get(0).getTimestamp());
        assertEquals("v1", note.getHistory().get(1).getContent());
        assertEquals("v2", note.getContent());
        assertEquals(T2, note.getUpdated());
        assertEquals(T0, note.getCreated());
    }

    @Test
    void testIdenticalContentIsNotAnOverwrite() {
        Note note = new Note(1, "Same", "text", T0);

        assertFalse(note.updateContent("text", T1));

        assertTrue(note.getHistory().isEmpty());
        assertEquals(T0, note.getUpdated());
    }

    @Test
    void testRevertPushesContentItReplaces() throws Exception {
        Note note = new Note(1, "Revert", "one", T0);
        note.updateContent("two words", T1);

        note.revertToVersion(0, T2);

        assertEquals("one", note.getContent());
        assertEquals(1, note.getWordCount());
        assertEquals(2, note.getHistory().size());
        assertEquals("two words", note.getHistory().get(1).getContent());
    }

    @Test
    void testRevertOutOfRangeLeavesNoteUnchanged() {
        Note note = new Note(1, "Revert", "one", T0);
        note.updateContent("two", T1);

        IndexOutOfRangeException low = assertThrows(IndexOutOfRangeException.class,
            () -> note.revertToVersion(-1, T2));
        assertThrows(IndexOutOfRangeException.class, () -> note.revertToVersion(1, T2));

        assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, low.getKind());
        assertEquals("two", note.getContent());
        assertEquals(1, note.getHistory().size());
        assertEquals(T1, note.getUpdated());
    }

    @Test
    void testEncryptedContentSwapRecordsNoVersion() {
        Note note = new Note(1, "Secret", "plain text", T0);

        note.replaceEncryptedContent("Y2lwaGVy", true, T1);

        assertTrue(note.isEncrypted());
        assertTrue(note.getHistory().isEmpty());
        assertEquals(1, note.getWordCount());
        assertEquals(8, note.getCharCount());
    }

    @Test
    void testTrashStateCarriesOriginalParent() {
        Note note = new Note(1, "Trash", "", T0);

        note.moveToTrash(4L);
        assertTrue(note.isTrashed());
        assertEquals(Long.valueOf(4), note.getOriginalParentId());

        note.restoreFromTrash();
        assertFalse(note.isTrashed());
        assertNull(note.getOriginalParentId());
    }
}
