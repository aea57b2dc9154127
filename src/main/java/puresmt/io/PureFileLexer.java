// Copyright 2026 The PureSMT Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package puresmt.io;

import java.util.ArrayList;
import java.util.List;

import puresmt.core.SyntaxError;

/**
 * Splits source text into tokens. Line breaks are significant only outside of
 * brackets, where they are reported as a single <code>NEWLINE</code> token;
 * blank lines and comments produce nothing.
 *
 * @author The PureSMT Project Developers
 */
public class PureFileLexer {
	private static final String[] OPERATORS = {
			"**", "//", "==", "!=", "<=", ">=", "->",
			"+", "-", "*", "/", "%", "<", ">", "(", ")", "[", "]", ",", ":", "@", "=" };

	private final String input;
	private int pos;
	private int line = 1;
	private int lineStart;

	public PureFileLexer(String input) {
		this.input = input;
	}

	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		int depth = 0;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '\n') {
				if (depth == 0 && !tokens.isEmpty() && tokens.get(tokens.size() - 1).kind != Token.Kind.NEWLINE) {
					tokens.add(new Token(Token.Kind.NEWLINE, "\n", pos, line, pos - lineStart));
				}
				pos = pos + 1;
				line = line + 1;
				lineStart = pos;
			} else if (c == '#') {
				while (pos < input.length() && input.charAt(pos) != '\n') {
					pos = pos + 1;
				}
			} else if (c == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
				pos = pos + 2;
				line = line + 1;
				lineStart = pos;
			} else if (Character.isWhitespace(c)) {
				pos = pos + 1;
			} else if (Character.isDigit(c)) {
				tokens.add(scanNumber());
			} else if (Character.isJavaIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else {
				Token t = scanOperator();
				if (t.text.equals("(") || t.text.equals("[")) {
					depth = depth + 1;
				} else if (t.text.equals(")") || t.text.equals("]")) {
					depth = Math.max(0, depth - 1);
				}
				tokens.add(t);
			}
		}
		if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind != Token.Kind.NEWLINE) {
			tokens.add(new Token(Token.Kind.NEWLINE, "\n", pos, line, pos - lineStart));
		}
		tokens.add(new Token(Token.Kind.EOF, "", pos, line, pos - lineStart));
		return tokens;
	}

	private Token scanNumber() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
		return new Token(Token.Kind.NUMBER, input.substring(start, pos), start, line, start - lineStart);
	}

	private Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos = pos + 1;
		}
		return new Token(Token.Kind.IDENTIFIER, input.substring(start, pos), start, line, start - lineStart);
	}

	private Token scanOperator() {
		for (String op : OPERATORS) {
			if (input.startsWith(op, pos)) {
				int start = pos;
				pos = pos + op.length();
				return new Token(Token.Kind.OPERATOR, op, start, line, start - lineStart);
			}
		}
		throw new SyntaxError("line " + line + ":" + (pos - lineStart) + ": unexpected character '"
				+ input.charAt(pos) + "'");
	}

	public static class Token {
		public enum Kind {
			IDENTIFIER, NUMBER, OPERATOR, NEWLINE, EOF
		}

		public final Kind kind;
		public final String text;
		public final int start;
		public final int line;
		public final int column;

		public Token(Kind kind, String text, int start, int line, int column) {
			this.kind = kind;
			this.text = text;
			this.start = start;
			this.line = line;
			this.column = column;
		}

		public int end() {
			return start + text.length();
		}

		public boolean is(String text) {
			return kind != Kind.NEWLINE && kind != Kind.EOF && this.text.equals(text);
		}

		@Override
		public String toString() {
			return kind == Kind.NEWLINE ? "newline" : kind == Kind.EOF ? "end of file" : "'" + text + "'";
		}
	}
}
