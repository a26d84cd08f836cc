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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.toolkit.core.ProgressListener;
import net.boyechko.pdf.toolkit.core.VerbosityLevel;
import org.slf4j.LoggerFactory;

/**
 * Console transcript of one command: a box per operation holding progress lines, the log events
 * raised meanwhile, and the outcome. While attached, toolkit log events go into the box instead of
 * the console appender.
 */
public class ProcessingReporter implements ProgressListener, AutoCloseable {
    static final String TOOLKIT_LOGGER = "net.boyechko.pdf.toolkit";

    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean boxOpen = false;
    private final Logger toolkitLogger;
    private final boolean wasAdditive;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ProcessingReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        toolkitLogger = (Logger) LoggerFactory.getLogger(TOOLKIT_LOGGER);
        wasAdditive = toolkitLogger.isAdditive();
        logBuffer = new ListAppender<>();
        logBuffer.start();
        toolkitLogger.addAppender(logBuffer);
        toolkitLogger.setAdditive(false);
    }

    public void onOperationStart(String title) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            closeBoxIfOpen();
            printBoxHeader(title);
            boxOpen = true;
        }
    }

    @Override
    public void onProgress(int current, int total, String context) {
        printLine(current + "/" + total + "  " + context, INFO);
    }

    public void onSuccess(String message) {
        printLine(message, SUCCESS);
    }

    public void onWarning(String message) {
        printLine(message, WARNING);
    }

    public void onInfo(String message) {
        printLine(message, INFO);
    }

    /** Errors are shown at every verbosity, after the log events that led to them. */
    public void onError(String message) {
        drainLogBuffer();
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    public boolean shouldShow(VerbosityLevel level) {
        return verbosity.shouldShow(level);
    }

    /** Closes the open box, flushing captured log events into it. */
    public void finish() {
        if (boxOpen) {
            closeBoxIfOpen();
        } else {
            drainLogBuffer();
        }
    }

    /** Finishes the transcript and gives log events back to the console appender. */
    @Override
    public void close() {
        finish();
        toolkitLogger.detachAppender(logBuffer);
        logBuffer.stop();
        toolkitLogger.setAdditive(wasAdditive);
    }

    private void closeBoxIfOpen() {
        if (boxOpen && verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            boxOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Prints log events captured since the last drain, with the icon matching their level. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        for (ILoggingEvent event : events) {
            Level level = event.getLevel();
            String icon;
            VerbosityLevel shownAt;
            if (level.isGreaterOrEqual(Level.ERROR)) {
                icon = ERROR;
                shownAt = VerbosityLevel.QUIET;
            } else if (level.isGreaterOrEqual(Level.WARN)) {
                icon = WARNING;
                shownAt = VerbosityLevel.NORMAL;
            } else {
                icon = INFO;
                shownAt = VerbosityLevel.VERBOSE;
            }
            String origin = event.getLoggerName();
            origin = origin.substring(origin.lastIndexOf('.') + 1);
            printLine(
                    "[" + level + "] " + origin + ": " + event.getFormattedMessage(),
                    icon,
                    shownAt);
        }
    }

    /**
     * Prints an indented line with the given message and icon, word-wrapping long messages to stay
     * within the box width. Continuation lines are indented to align with the message start.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix);
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    /** Word-wraps text at word boundaries to fit within maxWidth characters per line. */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        String[] words = text.split(" ");
        StringBuilder currentLine = new StringBuilder();

        for (String word : words) {
            if (currentLine.isEmpty()) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (!currentLine.isEmpty()) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
