package org.metricshub.tcldoc.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Tcldoc
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Turns the bytes of a script into text without losing any of them.
 * <p>
 * The bytes are decoded strictly with the preferred charset. When they are not
 * valid in that charset, or would not encode back to the same bytes, they are
 * read as ISO-8859-1 instead, which maps each byte to one character. Either way,
 * encoding the text with {@link Decoded#getCharset()} gives the original bytes.
 */
public final class ScriptDecoder {

	/**
	 * Text of a script, with the charset it was decoded with.
	 */
	public static final class Decoded {

		private final String text;
		private final Charset charset;

		Decoded(String text, Charset charset) {
			this.text = text;
			this.charset = charset;
		}

		public String getText() {
			return text;
		}

		/**
		 * @return the charset that encodes {@link #getText()} back to the original
		 *         bytes
		 */
		public Charset getCharset() {
			return charset;
		}
	}

	private ScriptDecoder() {}

	/**
	 * @param bytes raw script contents
	 * @param preferred charset the script is expected to be written in
	 * @return the decoded text
	 */
	public static Decoded decode(byte[] bytes, Charset preferred) {
		CharsetDecoder decoder = preferred.newDecoder();
		decoder.onMalformedInput(CodingErrorAction.REPORT);
		decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
		String text;
		try {
			text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
		} catch (CharacterCodingException e) {
			return asLatin1(bytes);
		}
		if (!Arrays.equals(text.getBytes(preferred), bytes)) {
			return asLatin1(bytes);
		}
		return new Decoded(text, preferred);
	}

	private static Decoded asLatin1(byte[] bytes) {
		return new Decoded(new String(bytes, StandardCharsets.ISO_8859_1), StandardCharsets.ISO_8859_1);
	}
}
