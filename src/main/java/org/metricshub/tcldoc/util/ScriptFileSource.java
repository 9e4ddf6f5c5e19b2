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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A Tcl script read from a file.
 * <p>
 * The file is read in one go when its contents are requested, never kept open.
 * Its bytes are decoded with {@link ScriptDecoder}, so a file that is not valid
 * in the configured charset is still read, byte for byte.
 */
public class ScriptFileSource extends ScriptSource {

	private Path filePath;
	private Charset charset;

	/**
	 * <p>
	 * Constructor for ScriptFileSource.
	 * </p>
	 *
	 * @param filePath path of the script file
	 * @param title title of the script
	 * @param baseHref relative path from the script's page back to the output root
	 * @param charset preferred encoding of the file
	 */
	public ScriptFileSource(Path filePath, String title, String baseHref, Charset charset) {
		super(title, baseHref, null);
		this.filePath = filePath;
		this.charset = charset;
	}

	/**
	 * <p>
	 * Getter for the field <code>filePath</code>.
	 * </p>
	 *
	 * @return a {@link java.nio.file.Path} object
	 */
	public Path getFilePath() {
		return filePath;
	}

	/**
	 * @return the preferred encoding of the file
	 */
	public Charset getCharset() {
		return charset;
	}

	/**
	 * Reads the raw contents of the file.
	 *
	 * @return all the bytes of the file
	 * @throws IOException if the file cannot be read
	 */
	public byte[] readBytes() throws IOException {
		return Files.readAllBytes(filePath);
	}

	/** {@inheritDoc} */
	@Override
	public Reader getReader() throws IOException {
		return new StringReader(ScriptDecoder.decode(readBytes(), charset).getText());
	}
}
