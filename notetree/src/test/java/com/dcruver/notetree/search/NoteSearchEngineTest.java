package com.dcruver.notetree.search;

import com.dcruver.notetree.MutableClock;
import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.Note;
import com.dcruver.notetree.store.NoteTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoteSearchEngineTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private NoteTree tree;
    private NoteSearchEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock("2025-01-15T10:00:00Z");
        tree = new NoteTree(tempDir.resolve("data"), tempDir.resolve("trash"), clock);
        engine = new NoteSearchEngine(tree);
    }

    private static List<Long> ids(List<Note> notes) {
        return notes.stream().map(Note::getId).toList();
    }

    @Test
    void testResultsFollowTreeTraversalOrder() throws Exception {
        long a = tree.createFolder(Folder.ROOT_ID, "A");
        long c = tree.createFolder(Folder.ROOT_ID, "C");
        long b = tree.createFolder(a, "B");
        long inC = tree.createNote(c, "match c", "", List.of());
        long inB = tree.createNote(b, "match b", "", List.of());
        long inA = tree.createNote(a, "match a", "", List.of());
        long inRoot = tree.createNote(Folder.ROOT_ID, "match root", "", List.of());

        List<Note> results = engine.searchByKeyword("match");

        assertEquals(List.of(inRoot, inA, inB, inC), ids(results));
    }

    @Test
    void testKeywordIsCaseSensitiveAndChecksTitleAndContent() throws Exception {
        long titled = tree.createNote(Folder.ROOT_ID, "Alpha release", "", List.of());
        long bodied = tree.createNote(Folder.ROOT_ID, "Other", "notes about Alpha", List.of());
        tree.createNote(Folder.ROOT_ID, "Lower", "alpha only", List.of());

        assertEquals(List.of(titled, bodied), ids(engine.searchByKeyword("Alpha")));
        assertEquals(3, engine.searchByKeyword("").size(), "Blank keyword matches everything");
    }

    @Test
    void testTagsAreCombinedWithAnd() throws Exception {
        long both = tree.createNote(Folder.ROOT_ID, "Both", "", List.of("work", "urgent"));
        long workOnly = tree.createNote(Folder.ROOT_ID, "Work", "", List.of("work"));

        SearchCriteria criteria = SearchCriteria.builder().tagName("work").tagName("urgent").build();

        assertEquals(List.of(both), ids(engine.search(criteria)));
        assertEquals(List.of(both, workOnly), ids(engine.searchByTag("work")));
        assertTrue(engine.searchByTag("missing").isEmpty());
    }

    @Test
    void testDateRangeIsInclusive() throws Exception {
        long ten = tree.createNote(Folder.ROOT_ID, "Ten", "", List.of());
        clock.advance(Duration.ofHours(1));
        long eleven = tree.createNote(Folder.ROOT_ID, "Eleven", "", List.of());
        clock.advance(Duration.ofHours(1));
        long twelve = tree.createNote(Folder.ROOT_ID, "Twelve", "", List.of());

        Instant at11 = Instant.parse("2025-01-15T11:00:00Z");
        Instant at12 = Instant.parse("2025-01-15T12:00:00Z");

        assertEquals(List.of(eleven, twelve), ids(engine.search(SearchCriteria.builder().from(at11).to(at12).build())));
        assertEquals(List.of(eleven), ids(engine.search(SearchCriteria.builder().from(at11).to(at11).build())));
        assertEquals(List.of(ten, eleven), ids(engine.search(SearchCriteria.builder().to(at11).build())));
    }

    @Test
    void testScopeSelectsActiveTrashOrBoth() throws Exception {
        long trashed = tree.createNote(Folder.ROOT_ID, "findme trashed", "", List.of());
        long active = tree.createNote(Folder.ROOT_ID, "findme active", "", List.of());
        tree.deleteNote(trashed, false);

        assertEquals(List.of(active), ids(engine.searchByKeyword("findme")));
        assertEquals(List.of(trashed),
            ids(engine.search(SearchCriteria.builder().keyword("findme").scope(SearchScope.TRASH).build())));
        assertEquals(List.of(active, trashed),
            ids(engine.search(SearchCriteria.builder().keyword("findme").scope(SearchScope.BOTH).build())));
    }

    @Test
    void testFiltersCombine() throws Exception {
        tree.createNote(Folder.ROOT_ID, "report", "", List.of("work"));
        clock.advance(Duration.ofDays(2));
        long recent = tree.createNote(Folder.ROOT_ID, "report", "", List.of("work"));
        tree.createNote(Folder.ROOT_ID, "report", "", List.of("home"));

        SearchCriteria criteria = SearchCriteria.builder()
            .keyword("report")
            .tagName("work")
            .from(Instant.parse("2025-01-16T00:00:00Z"))
            .build();

        assertEquals(List.of(recent), ids(engine.search(criteria)));
    }
}
