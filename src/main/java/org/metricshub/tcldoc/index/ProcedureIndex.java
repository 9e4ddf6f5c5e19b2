package org.metricshub.tcldoc.index;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the Tcl procedure definitions found in all the scripts of one run.
 * <p>
 * Keys are procedure names (case-sensitive), values the definitions in the
 * order they were found. A procedure of the same name can be defined more than
 * once, even in the same file: the n-th definition of a name is tagged
 * <code>name_n</code>, the first one just <code>name</code>. Numbering is global to
 * the run, so it depends on the order in which the files are parsed.
 * <p>
 * Entries are only ever appended. The index is not thread-safe: files must be
 * parsed one at a time against the same instance.
 * <p>
 * A {@link #stage() staged} index collects tentative definitions on top of
 * another one. Its tags are numbered as if they were already part of the parent,
 * and they only become part of it when {@link #commit()} is called. Queries on
 * a staged index only see its own definitions.
 */
public class ProcedureIndex {

	/**
	 * One definition site of a procedure.
	 */
	public static final class Definition {

		private final String title;
		private final int occurrence;

		Definition(String title, int occurrence) {
			this.title = title;
			this.occurrence = occurrence;
		}

		/**
		 * @return title of the script where the procedure is defined
		 */
		public String getTitle() {
			return title;
		}

		/**
		 * @return 1-based rank of this definition among those of the same name
		 */
		public int getOccurrence() {
			return occurrence;
		}

		@Override
		public String toString() {
			return title + "#" + occurrence;
		}
	}

	private final Map<String, List<Definition>> definitions = new LinkedHashMap<String, List<Definition>>();

	/** Index receiving the definitions on commit, null for a run index */
	private final ProcedureIndex parent;

	/** Names in registration order, kept only while staged */
	private final List<String> registrationOrder = new ArrayList<String>();

	/**
	 * Create a new, empty run index
	 */
	public ProcedureIndex() {
		this(null);
	}

	private ProcedureIndex(ProcedureIndex parent) {
		this.parent = parent;
	}

	/**
	 * Records a new definition of a procedure.
	 *
	 * @param name procedure name
	 * @param title title of the script defining it
	 * @return the tag identifying this definition
	 */
	public String register(String name, String title) {
		Definition definition = new Definition(title, count(name) + 1);
		definitions.computeIfAbsent(name, k -> new ArrayList<Definition>()).add(definition);
		if (parent != null) {
			registrationOrder.add(name);
		}
		return tag(name, definition.getOccurrence());
	}

	/**
	 * Opens an index whose definitions are numbered after those of this one, but
	 * stay out of it until committed. Dropping the staged index discards them.
	 *
	 * @return a new, empty staged index
	 */
	public ProcedureIndex stage() {
		return new ProcedureIndex(this);
	}

	/**
	 * Appends the definitions of this staged index to its parent, in the order
	 * they were registered, and empties this index.
	 *
	 * @throws IllegalStateException if this index was not obtained from
	 *         {@link #stage()}
	 */
	public void commit() {
		if (parent == null) {
			throw new IllegalStateException("Only a staged index can be committed");
		}
		Map<String, Integer> committed = new HashMap<String, Integer>();
		for (String name : registrationOrder) {
			int i = committed.merge(name, 1, Integer::sum) - 1;
			parent.register(name, definitions.get(name).get(i).getTitle());
		}
		definitions.clear();
		registrationOrder.clear();
	}

	/**
	 * Number of definitions of a name, including those of the enclosing indexes.
	 */
	private int count(String name) {
		List<Definition> list = definitions.get(name);
		int own = list == null ? 0 : list.size();
		return parent == null ? own : parent.count(name) + own;
	}

	/**
	 * Builds the tag of the n-th definition of a procedure.
	 *
	 * @param name procedure name
	 * @param occurrence 1-based rank of the definition
	 * @return {@code name} for the first definition, <code>name_n</code> otherwise
	 */
	public static String tag(String name, int occurrence) {
		return occurrence == 1 ? name : name + "_" + occurrence;
	}

	/**
	 * @param name procedure name
	 * @return the definitions of {@code name} in insertion order, possibly empty
	 */
	public List<Definition> getDefinitions(String name) {
		List<Definition> list = definitions.get(name);
		return list == null ? Collections.<Definition>emptyList() : Collections.unmodifiableList(list);
	}

	/**
	 * @param name procedure name
	 * @param title script title
	 * @return {@code true} if {@code name} has a definition in {@code title}
	 */
	public boolean isDefinedIn(String name, String title) {
		for (Definition definition : getDefinitions(name)) {
			if (definition.getTitle().equals(title)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the defined names, in order of first definition
	 */
	public Set<String> getNames() {
		return Collections.unmodifiableSet(definitions.keySet());
	}

	/**
	 * Returns the defined names in alphabetical order, ignoring case. Names that
	 * only differ by case keep a stable relative order.
	 *
	 * @return sorted procedure names
	 */
	public List<String> getSortedNames() {
		List<String> names = new ArrayList<String>(definitions.keySet());
		names.sort(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()));
		return names;
	}

	public boolean isEmpty() {
		return definitions.isEmpty();
	}

	/**
	 * @return the number of distinct procedure names
	 */
	public int size() {
		return definitions.size();
	}

	@Override
	public String toString() {
		return definitions.toString();
	}
}
