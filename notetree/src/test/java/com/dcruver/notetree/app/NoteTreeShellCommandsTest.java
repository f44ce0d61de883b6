package com.dcruver.notetree.app;

import com.dcruver.notetree.MutableClock;
import com.dcruver.notetree.config.NoteTreeProperties;
import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.search.NoteSearchEngine;
import com.dcruver.notetree.store.NoteTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoteTreeShellCommandsTest {

    @TempDir
    Path tempDir;

    private NoteTree tree;
    private NoteTreeShellCommands commands;
    private NoteExtrasShellCommands extras;

    @BeforeEach
    void setUp() {
        tree = new NoteTree(tempDir.resolve("data"), tempDir.resolve("trash"), new MutableClock("2025-01-15T10:00:00Z"));
        commands = new NoteTreeShellCommands(tree, new NoteSearchEngine(tree));

        NoteTreeProperties properties = new NoteTreeProperties();
        properties.setExportDir(tempDir.resolve("exports").toString());
        properties.setCipherKey("default-key");
        extras = new NoteExtrasShellCommands(tree, properties);
    }

    @Test
    void testNavigateAndList() {
        assertTrue(commands.mkdir("Projects").startsWith("Created folder"));
        assertEquals("/Projects", commands.cd("Projects"));
        assertEquals("/Projects", commands.pwd());
        assertTrue(commands.touch("Plan").startsWith("Created note"));

        String listing = commands.ls(null);
        assertTrue(listing.startsWith("/Projects\n"));
        assertTrue(listing.contains("Plan"));

        assertEquals("/", commands.cd("/"));
        assertTrue(commands.ls(null).contains("Projects/  (1 notes, 0 folders)"));
        assertTrue(commands.ls("/Projects").contains("Plan"));
    }

    @Test
    void testErrorsAreRenderedWithTheirKind() {
        commands.mkdir("Projects");

        assertTrue(commands.mkdir("Projects").startsWith("DUPLICATE_NAME: "));
        assertTrue(commands.cd("Missing").startsWith("NOT_FOUND: "));
        assertTrue(commands.view(999).startsWith("NOT_FOUND: "));
        assertEquals("/", commands.pwd(), "A failed cd leaves the current folder alone");
    }

    @Test
    void testDeleteListAndRestoreFromTrash() throws Exception {
        long id = tree.createNote(Folder.ROOT_ID, "Draft", "text", List.of());

        assertEquals("Moved note " + id + " 'Draft' to trash", commands.rm(id, false));
        assertTrue(commands.trashList().contains("Draft"));
        assertTrue(commands.ls(null).contains("(empty)"));

        assertEquals("Restored note " + id + " to /", commands.trashRestore(id, false));
        assertEquals("Trash is empty.", commands.trashList());
    }

    @Test
    void testEmptyTrash() throws Exception {
        long id = tree.createNote(Folder.ROOT_ID, "Draft", "text", List.of());
        commands.rm(id, false);

        assertEquals("Purged 1 items from the trash", commands.trashEmpty());
        assertTrue(tree.findNote(id).isEmpty());
    }

    @Test
    void testEditHistoryAndRevert() throws Exception {
        long id = tree.createNote(Folder.ROOT_ID, "Doc", "first", List.of());

        assertEquals("Saved note " + id + " (1 versions)", commands.edit(id, "second", null, null));
        assertTrue(commands.history(id).contains("0. 2025-01-15T10:00:00Z  first"));
        assertTrue(commands.diff(id, 0).contains("-first"));

        commands.revert(id, 0);
        assertEquals("first", tree.getNote(id).getContent());
        assertTrue(commands.revert(id, 9).startsWith("INDEX_OUT_OF_RANGE: "));
    }

    @Test
    void testTagsAndSearch() throws Exception {
        long plan = tree.createNote(Folder.ROOT_ID, "Plan", "quarterly goals", List.of());
        tree.createNote(Folder.ROOT_ID, "Other", "nothing", List.of());

        commands.tag(plan, "work");
        assertEquals("[1] work\n", commands.tags(false, null));

        String results = commands.search("goals", "", null, null, "active");
        assertTrue(results.startsWith("1 note:\n"));
        assertTrue(results.contains("Plan"));

        assertTrue(commands.search("", "work", null, null, "active").contains("Plan"));
        assertEquals("No matching notes.", commands.search("goals", "", null, null, "trash"));
        assertTrue(commands.search("", "", "not-a-date", null, "active").startsWith("INVALID_ARGUMENT: "));
    }

    @Test
    void testExportToDefaultDirectory() throws Exception {
        long id = tree.createNote(Folder.ROOT_ID, "Plan", "body", List.of());

        String result = extras.export(id, "md", null);

        Path expected = tempDir.resolve("exports").resolve("note-" + id + ".md");
        assertTrue(result.startsWith("Exported note " + id));
        assertEquals("# Plan\n\nbody\n", Files.readString(expected));
        assertTrue(extras.export(id, "pdf", null).startsWith("INVALID_ARGUMENT: "));
    }

    @Test
    void testRemindAndEncryptWithDefaultKey() throws Exception {
        long id = tree.createNote(Folder.ROOT_ID, "Plan", "secret body", List.of());

        assertTrue(extras.remind(id, "2025-02-01", "Call").startsWith("Reminder set on note " + id));
        assertEquals(1, tree.getNote(id).getReminders().size());

        assertEquals("Encrypted note " + id, extras.encrypt(id, null));
        assertNotEquals("secret body", tree.getNote(id).getContent());
        assertEquals("Decrypted note " + id, extras.decrypt(id, null));
        assertEquals("secret body", tree.getNote(id).getContent());
    }
}
