package com.dcruver.notetree.domain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The single owner of every tag. Names are unique; notes hold tag ids and
 * resolve names through this table when they need them.
 */
public class TagTable {

    private final IdAllocator ids;
    private final Map<Long, Tag> tagsById = new LinkedHashMap<>();
    private final Map<String, Long> idsByName = new HashMap<>();

    public TagTable(IdAllocator ids) {
        this.ids = ids;
    }

    /**
     * Check that a tag name is usable: non-blank and free of whitespace,
     * since tag names are stored space-separated on disk.
     */
    public static void validateName(String name) throws InvalidArgumentException {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Tag name must not be blank");
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i))) {
                throw new InvalidArgumentException("Tag name must not contain whitespace: '" + name + "'");
            }
        }
    }

    public Tag create(String name) throws NoteTreeException {
        validateName(name);
        if (idsByName.containsKey(name)) {
            throw new DuplicateNameException("Tag already exists: " + name);
        }
        return register(name);
    }

    public Tag resolveOrCreate(String name) throws InvalidArgumentException {
        validateName(name);
        Long existing = idsByName.get(name);
        if (existing != null) {
            return tagsById.get(existing);
        }
        return register(name);
    }

    private Tag register(String name) {
        Tag tag = new Tag(ids.nextId(EntityKind.TAG), name);
        tagsById.put(tag.getId(), tag);
        idsByName.put(name, tag.getId());
        return tag;
    }

    public Optional<Tag> find(String name) {
        Long id = idsByName.get(name);
        return id == null ? Optional.empty() : Optional.of(tagsById.get(id));
    }

    public Optional<Tag> get(long id) {
        return Optional.ofNullable(tagsById.get(id));
    }

    /**
     * Name of a referenced tag. References are never dangling, so a miss is a bug.
     */
    public String nameOf(long id) {
        Tag tag = tagsById.get(id);
        if (tag == null) {
            throw new IllegalStateException("Dangling tag reference: " + id);
        }
        return tag.getName();
    }

    public void remove(long id) {
        Tag removed = tagsById.remove(id);
        if (removed != null) {
            idsByName.remove(removed.getName());
        }
    }

    public List<Tag> all() {
        return new ArrayList<>(tagsById.values());
    }

    public int size() {
        return tagsById.size();
    }

    public void clear() {
        tagsById.clear();
        idsByName.clear();
    }
}
