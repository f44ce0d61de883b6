package com.dcruver.notetree.domain;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A single note.
 *
 * The note keeps its own version history: every content overwrite pushes the
 * content as it was before the write. Word and character counts are derived
 * from the content and recomputed on every content write.
 */
public class Note {

    @Getter
    private final long id;
    @Getter
    private String title;
    @Getter
    private String content;
    @Getter
    private final Instant created;
    @Getter
    private Instant updated;

    private final Set<Long> tagIds = new LinkedHashSet<>();
    private final List<NoteVersion> history = new ArrayList<>();
    private final List<String> attachments = new ArrayList<>();
    private final List<Reminder> reminders = new ArrayList<>();

    @Getter
    @Setter
    private ColorLabel colorLabel;
    @Getter
    private boolean trashed;
    // Set only while the note itself was the item moved to the trash
    @Getter
    private Long originalParentId;
    @Getter
    private boolean encrypted;
    @Getter
    private int wordCount;
    @Getter
    private int charCount;

    public Note(long id, String title, String content, Instant created) {
        this(id, title, content, created, created);
    }

    public Note(long id, String title, String content, Instant created, Instant updated) {
        this.id = id;
        this.title = title == null ? "" : title;
        this.content = content == null ? "" : content;
        this.created = created;
        this.updated = updated == null ? created : updated;
        recount();
    }

    public void setTitle(String title, Instant at) {
        this.title = title == null ? "" : title;
        this.updated = at;
    }

    /**
     * Overwrite the content. The previous content is pushed onto the history
     * first. Writing identical content is not an overwrite and changes nothing.
     *
     * @return true if the content changed
     */
    public boolean updateContent(String newContent, Instant at) {
        String value = newContent == null ? "" : newContent;
        if (value.equals(content)) {
            return false;
        }
        history.add(new NoteVersion(at, content));
        applyContent(value, at);
        return true;
    }

    /**
     * Restore the content of a history entry. The content being replaced is
     * itself pushed as a new version, so a revert can be reverted.
     */
    public void revertToVersion(int index, Instant at) throws IndexOutOfRangeException {
        if (index < 0 || index >= history.size()) {
            throw new IndexOutOfRangeException("versions", id, index, history.size());
        }
        String target = history.get(index).getContent();
        history.add(new NoteVersion(at, content));
        applyContent(target, at);
    }

    /**
     * Swap in cipher text or plain text. Not a user edit, so no version is recorded.
     */
    public void replaceEncryptedContent(String newContent, boolean encrypted, Instant at) {
        this.encrypted = encrypted;
        applyContent(newContent, at);
    }

    public void setEncrypted(boolean encrypted) {
        this.encrypted = encrypted;
    }

    private void applyContent(String value, Instant at) {
        this.content = value;
        this.updated = at;
        recount();
    }

    private void recount() {
        int words = 0;
        boolean inWord = false;
        for (int i = 0; i < content.length(); i++) {
            if (Character.isWhitespace(content.charAt(i))) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                words++;
            }
        }
        this.wordCount = words;
        this.charCount = content.length();
    }

    public List<NoteVersion> getHistory() {
        return Collections.unmodifiableList(history);
    }

    // Tags

    public Set<Long> getTagIds() {
        return Collections.unmodifiableSet(tagIds);
    }

    public boolean addTagId(long tagId) {
        return tagIds.add(tagId);
    }

    public boolean removeTagId(long tagId) {
        return tagIds.remove(tagId);
    }

    public boolean hasTagId(long tagId) {
        return tagIds.contains(tagId);
    }

    public void clearTagIds() {
        tagIds.clear();
    }

    // Attachments

    public List<String> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public void addAttachment(String path) {
        attachments.add(path);
    }

    public boolean removeAttachment(String path) {
        return attachments.remove(path);
    }

    // Reminders

    public List<Reminder> getReminders() {
        return Collections.unmodifiableList(reminders);
    }

    public void addReminder(Reminder reminder) {
        reminders.add(reminder);
    }

    // Trash

    public void moveToTrash(Long originalParentId) {
        this.trashed = true;
        this.originalParentId = originalParentId;
    }

    public void restoreFromTrash() {
        this.trashed = false;
        this.originalParentId = null;
    }
}
