package com.dcruver.notetree.store;

import com.dcruver.notetree.MutableClock;
import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.Note;
import com.dcruver.notetree.domain.Tag;
import com.dcruver.notetree.io.FolderMetadataStore;
import com.dcruver.notetree.io.IdCounterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rebuilding the tree from the data and trash directories.
 */
class NoteTreePersistenceTest {

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path trashDir;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        dataDir = tempDir.resolve("data");
        trashDir = tempDir.resolve("trash");
        clock = new MutableClock("2025-01-15T10:00:00Z");
    }

    private NoteTree reload() throws Exception {
        NoteTree tree = new NoteTree(dataDir, trashDir, clock);
        tree.initializeFromFileSystem();
        return tree;
    }

    @Test
    void testReloadRebuildsTreesWithSameIds() throws Exception {
        NoteTree original = new NoteTree(dataDir, trashDir, clock);
        long work = original.createFolder(Folder.ROOT_ID, "Work");
        long projects = original.createFolder(work, "Projects");
        long archive = original.createFolder(Folder.ROOT_ID, "Archive");
        long plan = original.createNote(projects, "Plan", "step one\nstep two\n", List.of("work", "q1"));
        long loose = original.createNote(work, "Loose", "", List.of());
        long old = original.createNote(archive, "Old", "dusty", List.of());
        original.deleteNote(loose, false);
        original.deleteFolder(archive, false);

        NoteTree tree = reload();

        assertEquals("/Work/Projects", tree.pathOf(projects));
        Note reloaded = tree.getNote(plan);
        assertEquals("Plan", reloaded.getTitle());
        assertEquals("step one\nstep two\n", reloaded.getContent());
        assertEquals(4, reloaded.getWordCount());
        assertEquals(List.of("work", "q1"), tree.getTagsOf(plan).stream().map(Tag::getName).toList());
        assertEquals(original.getNote(plan).getCreated(), reloaded.getCreated());

        TrashContents trash = tree.getTrashContents();
        assertEquals(List.of(loose), trash.getNotes().stream().map(Note::getId).toList());
        assertEquals(List.of(archive), trash.getFolders().stream().map(Folder::getId).toList());
        assertEquals(Long.valueOf(work), tree.getNote(loose).getOriginalParentId());
        assertTrue(tree.getNote(old).isTrashed());

        // Restore still works after a restart
        tree.restoreItem(archive, false);
        tree.restoreItem(loose, true);
        assertEquals("/Archive", tree.pathOf(archive));
        assertEquals(work, tree.folderOfNote(loose));
    }

    @Test
    void testIdsContinuePastIdsOnDisk() throws Exception {
        NoteTree original = new NoteTree(dataDir, trashDir, clock);
        long folder = original.createFolder(Folder.ROOT_ID, "A");
        original.createFolder(folder, "B");
        original.createNote(folder, "One", "", List.of());
        long lastNote = original.createNote(folder, "Two", "", List.of());

        NoteTree tree = reload();

        assertTrue(tree.createNote(Folder.ROOT_ID, "Three", "", List.of()) > lastNote);
        assertEquals(3, tree.createFolder(Folder.ROOT_ID, "C"));
    }

    @Test
    void testPurgedIdsAreNotReusedAfterRestart() throws Exception {
        NoteTree original = new NoteTree(dataDir, trashDir, clock);
        original.createFolder(Folder.ROOT_ID, "Keep");
        long purgedFolder = original.createFolder(Folder.ROOT_ID, "Gone");
        original.createNote(Folder.ROOT_ID, "Keep", "", List.of());
        long purgedNote = original.createNote(Folder.ROOT_ID, "Gone", "", List.of());
        original.deleteNote(purgedNote, true);
        original.deleteFolder(purgedFolder, true);
        assertTrue(Files.exists(dataDir.resolve(IdCounterStore.FILE_NAME)));

        NoteTree tree = reload();

        assertTrue(tree.findNote(purgedNote).isEmpty());
        assertEquals(purgedNote + 1, tree.createNote(Folder.ROOT_ID, "New", "", List.of()));
        assertEquals(purgedFolder + 1, tree.createFolder(Folder.ROOT_ID, "New"));
    }

    @Test
    void testUnreadableIdCountersFallBackToIdsOnDisk() throws Exception {
        NoteTree original = new NoteTree(dataDir, trashDir, clock);
        long note = original.createNote(Folder.ROOT_ID, "One", "", List.of());
        Files.writeString(dataDir.resolve(IdCounterStore.FILE_NAME), "not json");

        NoteTree tree = reload();

        assertEquals(note + 1, tree.createNote(Folder.ROOT_ID, "Two", "", List.of()));
        assertTrue(Files.readString(dataDir.resolve(IdCounterStore.FILE_NAME)).contains("NOTE"),
            "The scan rewrites the counters file");
    }

    @Test
    void testMalformedFilesAreSkipped() throws Exception {
        NoteTree original = new NoteTree(dataDir, trashDir, clock);
        long good = original.createNote(Folder.ROOT_ID, "Good", "fine", List.of());
        Files.writeString(dataDir.resolve("note-99.org"), ":PROPERTIES:\n:ID: 99\n");
        Files.writeString(dataDir.resolve("readme.txt"), "not a note");

        NoteTree tree = reload();

        assertEquals(1, tree.getIndex().noteCount());
        assertEquals("fine", tree.getNote(good).getContent());
        assertTrue(tree.findNote(99).isEmpty());
    }

    @Test
    void testHandWrittenNoteAndFolderAreAdopted() throws Exception {
        Path inbox = dataDir.resolve("Inbox");
        Files.createDirectories(inbox);
        Files.writeString(inbox.resolve("todo.org"), "* Todo\nbuy milk\n");

        NoteTree tree = reload();

        Folder folder = tree.findFolderByPath("/Inbox").orElseThrow();
        assertEquals(1, folder.getNoteCount());
        Note note = tree.getNote(folder.getNoteIds().get(0));
        assertEquals("Todo", note.getTitle());
        assertEquals("buy milk\n", note.getContent());
        assertEquals(Instant.parse("2025-01-15T10:00:00Z"), note.getCreated());

        Path normalized = inbox.resolve("note-" + note.getId() + ".org");
        assertTrue(Files.exists(normalized));
        assertFalse(Files.exists(inbox.resolve("todo.org")));
        assertTrue(Files.readString(normalized).contains(":ID:       " + note.getId()));
        assertEquals(Long.valueOf(folder.getId()),
            new FolderMetadataStore().read(inbox).orElseThrow().getId());
    }

    @Test
    void testDuplicateIdsGetFreshIds() throws Exception {
        String file = """
            :PROPERTIES:
            :ID:       1
            :CREATED:  [2025-01-01T00:00:00Z]
            :UPDATED:  [2025-01-01T00:00:00Z]
            :END:
            * Copy
            same id
            """;
        Files.createDirectories(dataDir.resolve("A"));
        Files.createDirectories(dataDir.resolve("B"));
        Files.writeString(dataDir.resolve("A/note-1.org"), file);
        Files.writeString(dataDir.resolve("B/note-1.org"), file);

        NoteTree tree = reload();

        assertEquals(2, tree.getIndex().noteCount());
        long inA = tree.findFolderByPath("/A").orElseThrow().getNoteIds().get(0);
        long inB = tree.findFolderByPath("/B").orElseThrow().getNoteIds().get(0);
        assertEquals(1, inA);
        assertEquals(2, inB);
        assertTrue(Files.exists(dataDir.resolve("B/note-2.org")));
        assertFalse(Files.exists(dataDir.resolve("B/note-1.org")));

        // The repaired tree reloads without further changes
        NoteTree again = reload();
        assertEquals(2, again.getIndex().noteCount());
        assertEquals("/B", again.pathOf(again.folderOfNote(2)));
    }

    @Test
    void testMissingDirectoriesAreCreated() throws Exception {
        NoteTree tree = reload();

        assertTrue(Files.isDirectory(dataDir));
        assertTrue(Files.isDirectory(trashDir));
        assertTrue(tree.listContents(Folder.ROOT_ID).isEmpty());
        assertTrue(tree.getTrashContents().isEmpty());
    }

    @Test
    void testReloadReplacesInMemoryState() throws Exception {
        NoteTree tree = reload();
        long note = tree.createNote(Folder.ROOT_ID, "Kept", "", List.of());
        Files.delete(dataDir.resolve("note-" + note + ".org"));

        tree.initializeFromFileSystem();

        assertTrue(tree.findNote(note).isEmpty());
        try (Stream<Path> entries = Files.list(dataDir)) {
            assertEquals(0, entries.filter(p -> p.toString().endsWith(".org")).count());
        }
    }
}
