package org.javai.nandu.expr;

import org.javai.nandu.NanduException;

/**
 * Thrown when the input contains a character that cannot begin a token.
 */
public class ExprLexException extends NanduException {

	private final String character;
	private final int position;

	/**
	 * @param codePoint the offending character, which may lie outside the BMP
	 * @param position its offset in the input, in UTF-16 units
	 */
	public ExprLexException(int codePoint, int position) {
		this(new String(Character.toChars(codePoint)), position);
	}

	private ExprLexException(String character, int position) {
		super("Unexpected character '" + character + "' at position " + position);
		this.character = character;
		this.position = position;
	}

	public String character() {
		return character;
	}

	public int position() {
		return position;
	}
}
