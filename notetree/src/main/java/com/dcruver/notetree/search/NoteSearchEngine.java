package com.dcruver.notetree.search;

import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.Note;
import com.dcruver.notetree.domain.Tag;
import com.dcruver.notetree.store.FolderContents;
import com.dcruver.notetree.store.NoteTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Linear scan over the note tree. Results come back in traversal order: a
 * folder's own notes first, then each subfolder in turn, the active tree
 * before the trash.
 */
@Slf4j
@RequiredArgsConstructor
public class NoteSearchEngine {

    private final NoteTree noteTree;

    public List<Note> search(SearchCriteria criteria) {
        // Unknown tag names can never match
        Set<Long> requiredTagIds = new HashSet<>();
        for (String tagName : criteria.getTagNames()) {
            Optional<Tag> tag = noteTree.getTagTable().find(tagName);
            if (tag.isEmpty()) {
                log.debug("Search for unknown tag '{}' matches nothing", tagName);
                return List.of();
            }
            requiredTagIds.add(tag.get().getId());
        }

        List<Note> results = new ArrayList<>();
        SearchScope scope = criteria.getScope() == null ? SearchScope.ACTIVE : criteria.getScope();
        if (scope != SearchScope.TRASH) {
            collect(noteTree.getRoot(), criteria, requiredTagIds, results);
        }
        if (scope != SearchScope.ACTIVE) {
            collect(noteTree.getTrashRoot(), criteria, requiredTagIds, results);
        }
        log.debug("Search {} matched {} notes", criteria, results.size());
        return results;
    }

    public List<Note> searchByKeyword(String keyword) {
        return search(SearchCriteria.keyword(keyword));
    }

    public List<Note> searchByTag(String tagName) {
        return search(SearchCriteria.tag(tagName));
    }

    private void collect(Folder folder, SearchCriteria criteria, Set<Long> requiredTagIds, List<Note> results) {
        FolderContents contents = noteTree.contentsOf(folder);
        for (Note note : contents.getNotes()) {
            if (matches(note, criteria, requiredTagIds)) {
                results.add(note);
            }
        }
        for (Folder child : contents.getFolders()) {
            collect(child, criteria, requiredTagIds, results);
        }
    }

    private boolean matches(Note note, SearchCriteria criteria, Set<Long> requiredTagIds) {
        String keyword = criteria.getKeyword();
        if (keyword != null && !keyword.isBlank()
                && !note.getTitle().contains(keyword) && !note.getContent().contains(keyword)) {
            return false;
        }
        if (!note.getTagIds().containsAll(requiredTagIds)) {
            return false;
        }
        if (criteria.getFrom() != null && note.getUpdated().isBefore(criteria.getFrom())) {
            return false;
        }
        return criteria.getTo() == null || !note.getUpdated().isAfter(criteria.getTo());
    }
}
