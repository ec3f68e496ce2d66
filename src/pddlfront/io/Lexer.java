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
package pddlfront.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import pddlfront.util.SyntaxError;

/**
 * Responsible for turning a stream of characters into a sequence of tokens.
 * PDDL has very little lexical structure: there are brackets, and there are
 * words (maximal runs of characters which are neither brackets nor
 * whitespace). A semi-colon starts a comment running to the end of the line.
 * Token offsets refer to the text exactly as read, so that error positions can
 * be reported against it.
 *
 * @author Daivd J. Pearce
 *
 */
public class Lexer {

	private final String input;
	private int pos;

	public Lexer(String filename) throws IOException {
		this(new InputStreamReader(new FileInputStream(filename), "UTF8"));
	}

	public Lexer(InputStream instream) throws IOException {
		this(new InputStreamReader(instream, "UTF8"));
	}

	public Lexer(Reader reader) throws IOException {
		try (BufferedReader in = new BufferedReader(reader)) {
			StringBuilder text = new StringBuilder();
			char[] buffer = new char[8192];
			int n;
			while ((n = in.read(buffer)) != -1) {
				text.append(buffer, 0, n);
			}
			input = text.toString();
		}
	}

	/**
	 * Get the text being scanned.
	 *
	 * @return
	 */
	public String source() {
		return input;
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding
	 * list of tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '(') {
				tokens.add(new LeftBrace(pos++));
			} else if (c == ')') {
				tokens.add(new RightBrace(pos++));
			} else if (c == ';') {
				scanLineComment();
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else if (Character.isISOControl(c)) {
				syntaxError("unexpected control character");
			} else {
				tokens.add(scanWord());
			}
		}

		return tokens;
	}

	/**
	 * Scan a word. Words starting with a colon are keywords (e.g.
	 * <code>:action</code>) and words starting with a question mark are
	 * variables (e.g. <code>?x</code>).
	 *
	 * @return
	 */
	public Token scanWord() {
		int start = pos;
		while (pos < input.length() && !isDelimiter(input.charAt(pos))) {
			pos++;
		}
		String text = input.substring(start, pos);
		if (text.charAt(0) == ':') {
			return new Keyword(text, start);
		} else if (text.charAt(0) == '?') {
			return new Variable(text, start);
		} else {
			return new Word(text, start);
		}
	}

	private static boolean isDelimiter(char c) {
		return c == '(' || c == ')' || c == ';' || Character.isWhitespace(c);
	}

	public void scanLineComment() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Raise a syntax error with a given message at the current index.
	 *
	 * @param msg
	 */
	private void syntaxError(String msg) {
		throw new SyntaxError(msg, input, pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Represents a plain word, such as a name (e.g. <code>truck</code>), a number
	 * (e.g. <code>1.5</code>) or an operator (e.g. <code>&gt;=</code>).
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Word extends Token {

		public Word(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a section or property keyword, such as <code>:types</code> or
	 * <code>:effect</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Keyword extends Word {

		public Keyword(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a variable, such as <code>?x</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Variable extends Word {

		public Variable(String text, int pos) {
			super(text, pos);
		}
	}

	public static class LeftBrace extends Token {

		public LeftBrace(int pos) {
			super("(", pos);
		}
	}

	public static class RightBrace extends Token {

		public RightBrace(int pos) {
			super(")", pos);
		}
	}
}
