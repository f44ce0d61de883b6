package com.dcruver.notetree.store;

import com.dcruver.notetree.MutableClock;
import com.dcruver.notetree.domain.DuplicateNameException;
import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.IndexOutOfRangeException;
import com.dcruver.notetree.domain.InvalidArgumentException;
import com.dcruver.notetree.domain.NotFoundException;
import com.dcruver.notetree.domain.NoteVersion;
import com.dcruver.notetree.domain.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tag operations and content versioning.
 */
class NoteTreeTagAndVersionTest {

    @TempDir
    Path tempDir;

    private Path dataDir;
    private MutableClock clock;
    private NoteTree tree;

    @BeforeEach
    void setUp() {
        dataDir = tempDir.resolve("data");
        clock = new MutableClock("2025-01-15T10:00:00Z");
        tree = new NoteTree(dataDir, tempDir.resolve("trash"), clock);
    }

    private static List<String> names(List<Tag> tags) {
        return tags.stream().map(Tag::getName).toList();
    }

    @Test
    void testTagAddedThenRemovedLeavesActiveTagSet() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "Plan", "draft", List.of());

        tree.addTagToNote(note, "urgent");
        assertEquals(List.of("urgent"), names(tree.getTagsOf(note)));
        assertEquals(List.of("urgent"), names(tree.getAllTags()));

        tree.removeTagFromNote(note, "urgent");

        assertTrue(tree.getTagsOf(note).isEmpty());
        assertTrue(tree.getAllTags().isEmpty());
        assertEquals(List.of("urgent"), names(tree.listTagTable()), "Unreferenced tags stay in the table");
    }

    @Test
    void testAllTagsAreDedupedOrderedByIdAndIgnoreTrash() throws Exception {
        tree.createNote(Folder.ROOT_ID, "One", "", List.of("beta", "alpha"));
        long sub = tree.createFolder(Folder.ROOT_ID, "Sub");
        tree.createNote(sub, "Two", "", List.of("alpha"));
        long trashed = tree.createNote(Folder.ROOT_ID, "Three", "", List.of("gamma"));
        tree.deleteNote(trashed, false);

        assertEquals(List.of("beta", "alpha"), names(tree.getAllTags()));
        assertEquals(List.of("beta", "alpha", "gamma"), names(tree.listTagTable()));
    }

    @Test
    void testAddingTagTwiceIsIdempotent() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "N", "", List.of());

        Tag first = tree.addTagToNote(note, "work");
        Tag second = tree.addTagToNote(note, "work");

        assertEquals(first, second);
        assertEquals(1, tree.getNote(note).getTagIds().size());
        assertTrue(Files.readString(dataDir.resolve("note-" + note + ".org")).contains(":TAGS:     work\n"));
    }

    @Test
    void testRemovingAbsentTagIsNotFound() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "N", "", List.of());
        tree.createTag("exists");

        assertThrows(NotFoundException.class, () -> tree.removeTagFromNote(note, "missing"));
        assertThrows(NotFoundException.class, () -> tree.removeTagFromNote(note, "exists"));
        assertThrows(InvalidArgumentException.class, () -> tree.addTagToNote(note, "has space"));
    }

    @Test
    void testCreateTagRejectsDuplicates() throws Exception {
        tree.createTag("once");
        assertThrows(DuplicateNameException.class, () -> tree.createTag("once"));
    }

    @Test
    void testDeleteTagPurgesEveryReference() throws Exception {
        long active = tree.createNote(Folder.ROOT_ID, "Active", "", List.of("doomed", "kept"));
        long trashed = tree.createNote(Folder.ROOT_ID, "Trashed", "", List.of("doomed"));
        tree.deleteNote(trashed, false);

        tree.deleteTag("doomed");

        assertTrue(tree.getTagTable().find("doomed").isEmpty());
        assertEquals(List.of("kept"), names(tree.getTagsOf(active)));
        assertTrue(tree.getTagsOf(trashed).isEmpty());
        assertFalse(Files.readString(dataDir.resolve("note-" + active + ".org")).contains("doomed"));
        assertFalse(Files.readString(tempDir.resolve("trash/note-" + trashed + ".org")).contains("doomed"));

        assertThrows(NotFoundException.class, () -> tree.deleteTag("doomed"));
    }

    @Test
    void testEditReplacesTagSet() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "N", "", List.of("a", "b"));

        tree.editNote(note, null, null, List.of("c"));

        assertEquals(List.of("c"), names(tree.getTagsOf(note)));
        assertEquals("N", tree.getNote(note).getTitle());
    }

    @Test
    void testEveryEditSnapshotsThePreviousContent() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "Draft", "v0", List.of());
        clock.advance(Duration.ofMinutes(1));
        tree.editNote(note, null, "v1");
        clock.advance(Duration.ofMinutes(1));
        tree.editNote(note, "Final", "v2");

        List<NoteVersion> history = tree.getHistory(note);
        assertEquals(2, history.size());
        assertEquals("v1", history.get(history.size() - 1).getContent(),
            "Last snapshot holds the content from just before the latest edit");
        assertEquals("v0", history.get(0).getContent(), "The first edit snapshots the creation content");
        assertEquals("v2", tree.getNote(note).getContent());
        assertEquals("Final", tree.getNote(note).getTitle());
    }

    @Test
    void testEditWithSameContentRecordsNoVersion() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "Same", "text", List.of());

        tree.editNote(note, "Renamed", "text");

        assertTrue(tree.getHistory(note).isEmpty());
    }

    @Test
    void testRevertRestoresContentAndPushesReplacedContent() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "Draft", "first draft", List.of());
        tree.editNote(note, null, "v1");
        tree.editNote(note, null, "the second version");
        clock.advance(Duration.ofHours(1));

        tree.revertToVersion(note, 0);

        assertEquals("first draft", tree.getNote(note).getContent());
        assertEquals(2, tree.getNote(note).getWordCount());
        assertEquals(clock.instant(), tree.getNote(note).getUpdated());
        List<NoteVersion> history = tree.getHistory(note);
        assertEquals(3, history.size());
        assertEquals("the second version", history.get(2).getContent());
        assertTrue(Files.readString(dataDir.resolve("note-" + note + ".org")).endsWith("* Draft\nfirst draft"));

        // A revert can itself be reverted
        tree.revertToVersion(note, 2);
        assertEquals("the second version", tree.getNote(note).getContent());
    }

    @Test
    void testRevertOutOfRangeChangesNothing() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "Draft", "v0", List.of());
        tree.editNote(note, null, "v1");

        assertThrows(IndexOutOfRangeException.class, () -> tree.revertToVersion(note, -1));
        assertThrows(IndexOutOfRangeException.class, () -> tree.revertToVersion(note, 1));

        assertEquals("v1", tree.getNote(note).getContent());
        assertEquals(1, tree.getHistory(note).size());
    }

    @Test
    void testDiffAgainstVersion() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "Draft", "keep\nold line\n", List.of());
        tree.editNote(note, null, "keep\nnew line\n");

        String diff = tree.diffAgainstVersion(note, 0);

        assertTrue(diff.contains("--- version-0"));
        assertTrue(diff.contains("+++ current"));
        assertTrue(diff.contains("-old line"));
        assertTrue(diff.contains("+new line"));
        assertThrows(IndexOutOfRangeException.class, () -> tree.diffAgainstVersion(note, 1));
    }

    @Test
    void testDiffShowsTrailingNewlineChange() throws Exception {
        long note = tree.createNote(Folder.ROOT_ID, "Draft", "a", List.of());
        tree.editNote(note, null, "a\n");

        String diff = tree.diffAgainstVersion(note, 0);

        assertFalse(diff.isEmpty());
        assertTrue(diff.endsWith("\n+"), diff);
    }
}
