/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites line magics into calls on the shell bound as {@value InteractiveShell#SHELL_BINDING}.
 *
 * <pre>
 *   %who                  -&gt;  __shell__.runLineMagic("who", "");
 *   names = %who_ls       -&gt;  names = __shell__.runLineMagic("who_ls", "");
 *   var home = %env HOME  -&gt;  var home = __shell__.runLineMagic("env", "HOME");
 * </pre>
 *
 * Every other line is left as it is, as are lines that start inside a template literal or a block
 * comment left open by an earlier line. Regular expression literals are not recognised, so a
 * backtick or comment opener inside one can still throw that tracking off.
 */
public class LineMagicTransformer implements CellTransformer {

    private static final Pattern ASSIGNMENT =
            Pattern.compile(
                    "^(\\s*)((?:var|let|const)\\s+)?([A-Za-z_$][\\w$]*)\\s*=\\s*%([A-Za-z_]\\w*)(.*)$");
    private static final Pattern STATEMENT = Pattern.compile("^(\\s*)%([A-Za-z_]\\w*)(.*)$");

    @Override
    public String transform(String cellSource) {
        if (cellSource == null || cellSource.indexOf('%') == -1) {
            return cellSource;
        }
        String[] lines = cellSource.split("\n", -1);
        StringBuilder sb = new StringBuilder(cellSource.length() + 64);
        Carry carry = Carry.CODE;
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            String line = lines[i];
            String out = carry == Carry.CODE ? transformLine(line) : line;
            sb.append(out);
            // a rewritten magic line holds its arguments in a string literal
            carry = out.equals(line) ? scan(line, carry) : Carry.CODE;
        }
        return sb.toString();
    }

    /** Lexical context a line starts in. */
    enum Carry {
        CODE,
        BLOCK_COMMENT,
        TEMPLATE
    }

    /**
     * Returns the context at the end of {@code line}. Quoted strings and line comments never
     * extend past the line they start on.
     */
    static Carry scan(String line, Carry start) {
        Carry state = start;
        int n = line.length();
        for (int i = 0; i < n; i++) {
            char c = line.charAt(i);
            switch (state) {
                case BLOCK_COMMENT:
                    if (c == '*' && i + 1 < n && line.charAt(i + 1) == '/') {
                        state = Carry.CODE;
                        i++;
                    }
                    break;
                case TEMPLATE:
                    if (c == '\\') {
                        i++;
                    } else if (c == '`') {
                        state = Carry.CODE;
                    }
                    break;
                default:
                    if (c == '`') {
                        state = Carry.TEMPLATE;
                    } else if (c == '\'' || c == '"') {
                        i = skipQuoted(line, i);
                    } else if (c == '/' && i + 1 < n) {
                        char next = line.charAt(i + 1);
                        if (next == '/') {
                            return Carry.CODE;
                        }
                        if (next == '*') {
                            state = Carry.BLOCK_COMMENT;
                            i++;
                        }
                    }
                    break;
            }
        }
        return state;
    }

    private static int skipQuoted(String line, int open) {
        char quote = line.charAt(open);
        for (int i = open + 1; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i;
            }
        }
        return line.length();
    }

    private static String transformLine(String line) {
        // keep CRLF documents intact
        String eol = line.endsWith("\r") ? "\r" : "";
        String body = line.substring(0, line.length() - eol.length());

        Matcher m = ASSIGNMENT.matcher(body);
        if (m.matches()) {
            String declaration = m.group(2) == null ? "" : m.group(2);
            return m.group(1)
                    + declaration
                    + m.group(3)
                    + " = "
                    + magicCall(m.group(4), m.group(5))
                    + eol;
        }
        m = STATEMENT.matcher(body);
        if (m.matches()) {
            return m.group(1) + magicCall(m.group(2), m.group(3)) + eol;
        }
        return line;
    }

    private static String magicCall(String name, String args) {
        return InteractiveShell.SHELL_BINDING
                + ".runLineMagic(\""
                + name
                + "\", \""
                + escapeJsString(args.trim())
                + "\");";
    }

    private static String escapeJsString(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
