package org.disnet.dcdb.util;

/*
 * This file is part of DISNET DCDB.
 *
 * Copyright (C) 2025 DISNET
 *
 * DISNET DCDB is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DISNET DCDB is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DISNET DCDB.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Minimal logger for the DCDB integration.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>Log levels (TRACE, DEBUG, INFO, WARN, ERROR)</li>
 *   <li>Timestamp + thread name in each line</li>
 *   <li>Thread-safe output, optionally mirrored to an append-only log file</li>
 *   <li>Configuration via system properties:
 *     <ul>
 *       <li><b>disnet.log.level</b> – minimum level to print (default: INFO)</li>
 *       <li><b>disnet.log.datetime</b> – pattern (default: yyyy-MM-dd HH:mm:ss)</li>
 *     </ul>
 *   </li>
 * </ul>
 */
public final class Logger {

    /** Log levels in increasing order of severity. */
    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    private static final Level MIN_LEVEL =
            Level.parse(System.getProperty("disnet.log.level"), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(
                    System.getProperty("disnet.log.datetime", "yyyy-MM-dd HH:mm:ss")
            );

    // Guarded by Logger.class
    private static Path filePath;
    private static BufferedWriter fileSink;

    private Logger() {}

    public static void trace(String msg, Object... args) { log(Level.TRACE, null, msg, args); }
    public static void debug(String msg, Object... args) { log(Level.DEBUG, null, msg, args); }
    public static void info (String msg, Object... args) { log(Level.INFO , null, msg, args); }
    public static void warn (String msg, Object... args) { log(Level.WARN , null, msg, args); }
    public static void error(String msg, Object... args) { log(Level.ERROR, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { log(Level.WARN , t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { log(Level.ERROR, t, msg, args); }

    /**
     * Mirror every emitted line to {@code file} (append mode). Calling this again
     * with the same path is a no-op; a different path replaces the previous sink.
     */
    public static void attachFile(Path file) {
        if (file == null) return;
        Path normalized = file.toAbsolutePath().normalize();
        synchronized (Logger.class) {
            if (normalized.equals(filePath)) return;
            detachFile();
            try {
                if (normalized.getParent() != null) {
                    Files.createDirectories(normalized.getParent());
                }
                fileSink = Files.newBufferedWriter(normalized, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                filePath = normalized;
            } catch (IOException ex) {
                System.err.println("[WARN] Unable to open log file " + normalized + ": " + ex.getMessage());
            }
        }
    }

    /** Close the file sink if one is attached. */
    public static void detachFile() {
        synchronized (Logger.class) {
            if (fileSink != null) {
                try {
                    fileSink.close();
                } catch (IOException ex) {
                    System.err.println("[WARN] Unable to close log file " + filePath + ": " + ex.getMessage());
                }
            }
            fileSink = null;
            filePath = null;
        }
    }

    private static void log(Level level, Throwable t, String msg, Object... args) {
        if (level.ordinal() < MIN_LEVEL.ordinal()) return;

        final String ts = LocalDateTime.now().format(TS);
        final String thread = Thread.currentThread().getName();
        final String line = "[" + ts + "] [" + thread + "] " + level + " " + safeFormat(msg, args);

        // INFO and below -> stdout; WARN/ERROR -> stderr
        final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

        synchronized (Logger.class) {
            out.println(line);
            if (t != null) {
                t.printStackTrace(out);
            }
            writeToFile(line, t);
        }
    }

    private static void writeToFile(String line, Throwable t) {
        if (fileSink == null) return;
        try {
            fileSink.write(line);
            fileSink.newLine();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                fileSink.write(sw.toString());
            }
            fileSink.flush();
        } catch (IOException ex) {
            System.err.println("[WARN] Log file write failed, detaching: " + ex.getMessage());
            fileSink = null;
            filePath = null;
        }
    }

    /**
     * Replaces each "{}" with the stringified next argument.
     * If counts mismatch, extra args are appended.
     */
    static String safeFormat(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int argIdx = 0;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '}' && argIdx < args.length) {
                sb.append(String.valueOf(args[argIdx++]));
                i++;
            } else {
                sb.append(c);
            }
        }
        while (argIdx < args.length) {
            sb.append(' ').append(String.valueOf(args[argIdx++]));
        }
        return sb.toString();
    }
}
