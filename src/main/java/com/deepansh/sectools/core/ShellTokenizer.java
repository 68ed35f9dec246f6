package com.deepansh.sectools.core;

import com.deepansh.sectools.exception.ErrorKind;
import com.deepansh.sectools.exception.ToolInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into words using POSIX shell quoting rules.
 *
 * Only word splitting and quote removal are performed. There is no variable
 * expansion, globbing, command substitution or operator handling: characters
 * such as ';', '|', '$' and '&gt;' are ordinary word characters, and the
 * resulting argv is handed to ProcessBuilder as-is.
 *
 * Rules:
 * - unquoted whitespace separates words
 * - '...' preserves every character literally
 * - "..." preserves every character, except that a backslash escapes
 *   \ " $ ` and newline
 * - an unquoted backslash escapes the next character (backslash-newline is
 *   a line continuation)
 * - adjacent segments join into one word; '' and "" produce an empty word
 */
public final class ShellTokenizer {

    private ShellTokenizer() {
    }

    public static List<String> split(String commandLine) {
        List<String> words = new ArrayList<>();
        if (commandLine == null) return words;

        StringBuilder current = new StringBuilder();
        boolean inWord = false;
        int i = 0;
        int n = commandLine.length();

        while (i < n) {
            char c = commandLine.charAt(i);

            if (isBlank(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
                i++;
            } else if (c == '\'') {
                int end = commandLine.indexOf('\'', i + 1);
                if (end < 0) throw noClosingQuotation();
                current.append(commandLine, i + 1, end);
                inWord = true;
                i = end + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(commandLine, i + 1, current);
                inWord = true;
            } else if (c == '\\') {
                if (i + 1 >= n) {
                    throw new ToolInputException(ErrorKind.INVALID_VALUE, "No escaped character");
                }
                char next = commandLine.charAt(i + 1);
                if (next != '\n') {
                    current.append(next);
                    inWord = true;
                }
                i += 2;
            } else {
                current.append(c);
                inWord = true;
                i++;
            }
        }

        if (inWord) words.add(current.toString());
        return words;
    }

    /** Returns the index just past the closing quote. */
    private static int readDoubleQuoted(String s, int start, StringBuilder out) {
        int i = start;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"') return i + 1;
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(i + 1);
                switch (next) {
                    case '\\', '"', '$', '`' -> {
                        out.append(next);
                        i += 2;
                        continue;
                    }
                    case '\n' -> {
                        i += 2;
                        continue;
                    }
                    default -> {
                        // backslash stays literal
                    }
                }
            }
            out.append(c);
            i++;
        }
        throw noClosingQuotation();
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\n';
    }

    private static ToolInputException noClosingQuotation() {
        return new ToolInputException(ErrorKind.INVALID_VALUE, "No closing quotation");
    }
}
