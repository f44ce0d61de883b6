package com.dcruver.notetree.domain;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
public class Reminder {
    private final Instant due;
    private final String description;
    private boolean completed;

    public Reminder(Instant due, String description) {
        this(due, description, false);
    }

    public Reminder(Instant due, String description, boolean completed) {
        this.due = due;
        this.description = description == null ? "" : description;
        this.completed = completed;
    }

    public void markCompleted() {
        this.completed = true;
    }
}
