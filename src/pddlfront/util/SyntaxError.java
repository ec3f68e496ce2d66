// This file is part of the PDDL Front-End (pfe).
//
// The PDDL Front-End is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The PDDL Front-End is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the PDDL Front-End. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package pddlfront.util;

import java.io.PrintStream;

import pddlfront.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when a PDDL document cannot be turned into a
 * planning model, either because its shape is wrong or because it refers to
 * something which was never (or was twice) declared. Line and column numbers
 * are 1-based and a tab character counts as a single column.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {

	/**
	 * Distinguishes the stage of the front-end which detected the problem.
	 */
	public enum Kind {
		/**
		 * The shape of the input is wrong (e.g. unbalanced brackets, missing
		 * sections, malformed duration).
		 */
		STRUCTURAL,
		/**
		 * Something is declared more than once (e.g. a type or a function
		 * parameter).
		 */
		DECLARATION,
		/**
		 * A reference to an undeclared type, fluent, object, task or parameter.
		 */
		RESOLUTION
	}

	private final Kind kind;
	private final String msg;
	private final String src;
	private final int start;
	private final int end;

	/**
	 * Identify a structural error at a particular point in a document.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param src
	 *            The text of the document this error is referring to.
	 * @param start
	 *            Offset of first character of the offending span.
	 * @param end
	 *            Offset of last character of the offending span.
	 */
	public SyntaxError(String msg, String src, int start, int end) {
		this(Kind.STRUCTURAL, msg, src, start, end);
	}

	/**
	 * Identify an error of a given kind at a particular point in a document.
	 *
	 * @param kind
	 *            The kind of error
	 * @param msg
	 *            Message detailing the problem.
	 * @param src
	 *            The text of the document this error is referring to.
	 * @param start
	 *            Offset of first character of the offending span.
	 * @param end
	 *            Offset of last character of the offending span.
	 */
	public SyntaxError(Kind kind, String msg, String src, int start, int end) {
		this.kind = kind;
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	public SyntaxError(Kind kind, String msg, String src, int start, int end, Throwable ex) {
		super(ex);
		this.kind = kind;
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		String m = msg != null ? msg : "";
		if (src != null && start >= 0) {
			m += "\nError from line: " + line(src, start) + ", col " + column(src, start) + " to line: "
					+ line(src, end) + ", col " + column(src, end);
		}
		return m;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Error message (without position information).
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * Text of the document where the error arose.
	 *
	 * @return
	 */
	public String source() {
		return src;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Line (1-based) of the first character of the offending location.
	 *
	 * @return
	 */
	public int startLine() {
		return line(src, start);
	}

	/**
	 * Column (1-based) of the first character of the offending location.
	 *
	 * @return
	 */
	public int startColumn() {
		return column(src, start);
	}

	public int endLine() {
		return line(src, end);
	}

	public int endColumn() {
		return column(src, end);
	}

	/**
	 * Output the syntax error to a given output stream, followed by the
	 * offending line with the span underlined.
	 */
	public void outputSourceError(PrintStream output) {
		if (src == null || start < 0) {
			output.println("syntax error: " + msg);
		} else {
			int lineStart = 0;
			int lineEnd = 0;
			while (lineEnd < src.length() && lineEnd <= start) {
				lineStart = lineEnd;
				lineEnd = parseLine(src, lineEnd);
			}
			lineEnd = Math.min(lineEnd, src.length());

			output.println("line " + line(src, start) + ": " + msg);
			StringBuilder str = new StringBuilder(src.substring(lineStart, lineEnd));
			if (str.length() > 0 && str.charAt(str.length() - 1) == '\n') {
				output.print(str);
			} else {
				// this must be the very last line of output and, in this
				// particular case, there is no new-line character provided.
				output.println(str);
			}
			str = new StringBuilder();
			for (int i = lineStart; i < start; ++i) {
				str.append(src.charAt(i) == '\t' ? '\t' : ' ');
			}
			// never underline the line terminator
			int lineLast = lineEnd > 0 && src.charAt(lineEnd - 1) == '\n' ? lineEnd - 2 : lineEnd - 1;
			int last = Math.min(end, lineLast);
			for (int i = start; i <= Math.max(start, last); ++i) {
				str.append('^');
			}
			output.println(str);
		}
	}

	/**
	 * Determine the 1-based line containing a given offset.
	 *
	 * @param text
	 * @param offset
	 * @return
	 */
	public static int line(String text, int offset) {
		int line = 1;
		int limit = Math.min(offset, text.length());
		for (int i = 0; i < limit; ++i) {
			if (text.charAt(i) == '\n') {
				line = line + 1;
			}
		}
		return line;
	}

	/**
	 * Determine the 1-based column of a given offset. A tab counts as one column
	 * regardless of where it sits.
	 *
	 * @param text
	 * @param offset
	 * @return
	 */
	public static int column(String text, int offset) {
		int limit = Math.min(offset, text.length());
		int lineStart = text.lastIndexOf('\n', limit - 1) + 1;
		return offset - lineStart + 1;
	}

	private static int parseLine(String text, int index) {
		while (index < text.length() && text.charAt(index) != '\n') {
			index++;
		}
		return index + 1;
	}

	public static final long serialVersionUID = 1l;

	public static void syntaxError(Kind kind, String msg, String src, SyntacticElement elem) {
		int start = -1;
		int end = -1;

		Attribute.Source attr = elem == null ? null : elem.attribute(Attribute.Source.class);
		if (attr != null) {
			start = attr.start;
			end = attr.end;
		}

		throw new SyntaxError(kind, msg, src, start, end);
	}

	public static void syntaxError(Kind kind, String msg, String src, SyntacticElement elem, Throwable ex) {
		int start = -1;
		int end = -1;

		Attribute.Source attr = elem == null ? null : elem.attribute(Attribute.Source.class);
		if (attr != null) {
			start = attr.start;
			end = attr.end;
		}

		throw new SyntaxError(kind, msg, src, start, end, ex);
	}
}
