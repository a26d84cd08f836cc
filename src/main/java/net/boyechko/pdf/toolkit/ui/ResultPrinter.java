/*
 * PDF-Toolkit - Command-line PDF page assembly and extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.toolkit.ui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import net.boyechko.pdf.toolkit.core.Bookmark;
import net.boyechko.pdf.toolkit.extract.Attachment;
import net.boyechko.pdf.toolkit.extract.DocumentInfo;
import net.boyechko.pdf.toolkit.extract.FormField;
import net.boyechko.pdf.toolkit.extract.PageObject;
import net.boyechko.pdf.toolkit.extract.PageText;

/** Prints extraction results as plain text lines or as indented JSON. */
public class ResultPrinter {
    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final PrintStream out;
    private final OutputFormat format;

    public ResultPrinter(PrintStream out, OutputFormat format) {
        this.out = out;
        this.format = format;
    }

    public void printText(List<PageText> pages) {
        if (format == OutputFormat.JSON) {
            printJson(MAPPER.valueToTree(pages));
            return;
        }
        for (PageText page : pages) {
            out.println(page.text());
        }
    }

    public void printBookmarks(List<Bookmark> bookmarks) {
        if (format == OutputFormat.JSON) {
            ArrayNode array = MAPPER.createArrayNode();
            for (Bookmark bookmark : bookmarks) {
                ObjectNode node = array.addObject();
                node.put("title", bookmark.title());
                node.put("level", bookmark.level());
                if (bookmark.action() == null) {
                    node.putNull("action");
                } else {
                    node.put("action", bookmark.action().label());
                }
                if (bookmark.page() == null) {
                    node.putNull("page");
                } else {
                    node.put("page", bookmark.page());
                }
            }
            printJson(array);
            return;
        }
        if (bookmarks.isEmpty()) {
            out.println("No bookmarks found");
            return;
        }
        for (Bookmark bookmark : bookmarks) {
            out.println(
                    bookmark.level()
                            + "> "
                            + bookmark.title()
                            + "\t["
                            + (bookmark.action() == null ? "" : bookmark.action().label())
                            + " "
                            + orEmpty(bookmark.page())
                            + "]");
        }
    }

    public void printInfo(DocumentInfo info) {
        if (format == OutputFormat.JSON) {
            printJson(MAPPER.valueToTree(info));
            return;
        }
        out.println("Pages = " + info.pages());
        out.println("Author = " + orEmpty(info.author()));
        out.println("CreationDate = " + orEmpty(info.creationDate()));
        out.println("Creator = " + orEmpty(info.creator()));
        out.println("Keywords = " + orEmpty(info.keywords()));
        out.println("Producer = " + orEmpty(info.producer()));
        out.println("ModifiedDate = " + orEmpty(info.modifiedDate()));
        out.println("Subject = " + orEmpty(info.subject()));
        out.println("Title = " + orEmpty(info.title()));
        out.println("Version = " + orEmpty(info.version()));
        out.println("Trapped = " + orEmpty(info.trapped()));
    }

    public void printAttachments(List<Attachment> attachments) {
        if (format == OutputFormat.JSON) {
            printJson(MAPPER.valueToTree(attachments));
            return;
        }
        if (attachments.isEmpty()) {
            out.println("No attachments found in the PDF document.");
            return;
        }
        out.println("Found " + attachments.size() + " attachment(s):");
        out.println();
        for (Attachment attachment : attachments) {
            out.println("Attachment " + attachment.index() + ":");
            out.println("  Name: " + attachment.name());
            out.println(String.format(Locale.US, "  Size: %,d bytes", attachment.size()));
            out.println("  MIME Type: " + orEmpty(attachment.mimeType()));
            if (attachment.creationDate() != null) {
                out.println("  Created: " + attachment.creationDate());
            }
            if (attachment.modificationDate() != null) {
                out.println("  Modified: " + attachment.modificationDate());
            }
            if (attachment.description() != null && !attachment.description().isEmpty()) {
                out.println("  Description: " + attachment.description());
            }
            out.println();
        }
    }

    public void printObjects(List<PageObject> objects) {
        if (format == OutputFormat.JSON) {
            ArrayNode array = MAPPER.createArrayNode();
            for (PageObject object : objects) {
                ObjectNode node = array.addObject();
                node.put("page", object.page());
                node.put("type", object.type().label());
                node.put("left", object.left());
                node.put("bottom", object.bottom());
                node.put("right", object.right());
                node.put("top", object.top());
            }
            printJson(array);
            return;
        }
        out.println("Found " + objects.size() + " objects:");
        for (PageObject object : objects) {
            out.println(
                    String.format(
                            Locale.ROOT,
                            " - Page: %d, Type: %s, Bounds: [L: %.2f, B: %.2f, R: %.2f, T: %.2f]",
                            object.page(),
                            object.type().label(),
                            object.left(),
                            object.bottom(),
                            object.right(),
                            object.top()));
        }
    }

    public void printFormFields(List<FormField> fields) {
        if (format == OutputFormat.JSON) {
            printJson(MAPPER.valueToTree(fields));
            return;
        }
        out.println("Found " + fields.size() + " form fields:");
        for (FormField field : fields) {
            out.println(
                    " - Page: "
                            + orEmpty(field.page())
                            + ", Name: "
                            + field.name()
                            + ", Type: "
                            + field.type()
                            + ", Value: '"
                            + orEmpty(field.value())
                            + "', Rect: "
                            + field.rect());
        }
    }

    private void printJson(Object tree) {
        try {
            out.println(MAPPER.writeValueAsString(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result: " + e.getMessage(), e);
        }
    }

    private static String orEmpty(Object value) {
        return value == null ? "" : value.toString();
    }
}
