package com.dcruver.notetree.export;

import com.dcruver.notetree.domain.Note;
import com.dcruver.notetree.domain.Reminder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Renders a note as Markdown, JSON, HTML or plain text.
 * Reads the note's fields only; never touches the tree.
 */
@Component
@Slf4j
public class NoteExporter {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Parser markdownParser;
    private final HtmlRenderer htmlRenderer;

    public NoteExporter() {
        List<Extension> extensions = List.of(TablesExtension.create(), StrikethroughExtension.create());
        this.markdownParser = Parser.builder().extensions(extensions).build();
        this.htmlRenderer = HtmlRenderer.builder().extensions(extensions).escapeHtml(true).build();
    }

    public String render(Note note, List<String> tagNames, ExportFormat format) {
        return switch (format) {
            case MARKDOWN -> toMarkdown(note, tagNames);
            case JSON -> toJson(note, tagNames);
            case HTML -> toHtml(note, tagNames);
            case TEXT -> toPlainText(note);
        };
    }

    /**
     * Render and write to a file, creating parent directories as needed
     */
    public Path export(Note note, List<String> tagNames, ExportFormat format, Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, render(note, tagNames, format));
        log.info("Exported note {} as {} to {}", note.getId(), format, target);
        return target;
    }

    public String toMarkdown(Note note, List<String> tagNames) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(note.getTitle()).append("\n\n");
        if (!tagNames.isEmpty()) {
            sb.append("Tags: ");
            for (int i = 0; i < tagNames.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append('#').append(tagNames.get(i));
            }
            sb.append("\n\n");
        }
        sb.append(note.getContent());
        if (!note.getContent().endsWith("\n")) {
            sb.append("\n");
        }
        return sb.toString();
    }

    public String toJson(Note note, List<String> tagNames) {
        NoteExport export = NoteExport.builder()
            .id(note.getId())
            .title(note.getTitle())
            .content(note.getContent())
            .created(note.getCreated())
            .updated(note.getUpdated())
            .tags(tagNames)
            .wordCount(note.getWordCount())
            .charCount(note.getCharCount())
            .encrypted(note.isEncrypted())
            .color(note.getColorLabel() == null ? null : note.getColorLabel().toString())
            .attachments(note.getAttachments())
            .reminders(note.getReminders())
            .versionCount(note.getHistory().size())
            .build();
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String toHtml(Note note, List<String> tagNames) {
        Node document = markdownParser.parse(note.getContent());
        String title = escapeHtml(note.getTitle());

        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n");
        sb.append("<title>").append(title).append("</title>\n</head>\n<body>\n");
        sb.append("<h1>").append(title).append("</h1>\n");
        if (!tagNames.isEmpty()) {
            sb.append("<p class=\"tags\">");
            for (String tag : tagNames) {
                sb.append("<span class=\"tag\">").append(escapeHtml(tag)).append("</span>");
            }
            sb.append("</p>\n");
        }
        sb.append(htmlRenderer.render(document));
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    public String toPlainText(Note note) {
        return note.getTitle() + "\n\n" + note.getContent();
    }

    private static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }

    /**
     * JSON shape of an exported note.
     */
    @Data
    @Builder
    public static class NoteExport {
        private final long id;
        private final String title;
        private final String content;
        private final Instant created;
        private final Instant updated;
        private final List<String> tags;
        private final int wordCount;
        private final int charCount;
        private final boolean encrypted;
        private final String color;
        private final List<String> attachments;
        private final List<Reminder> reminders;
        private final int versionCount;
    }
}
