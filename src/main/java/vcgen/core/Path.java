// Copyright 2020 The Whiley Project Developers
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
package vcgen.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A structural path made from a sequence of non-empty segments, written
 * <code>a/b/c</code>. Paths identify obligations by the decisions taken to
 * reach them (branches, loop phases, sites), so they stay the same when the
 * same goal is regenerated.
 *
 * @author David J. Pearce
 *
 */
public final class Path implements Comparable<Path> {
	public static final Path ROOT = new Path(new String[0]);

	private final String[] segments;

	private Path(String[] segments) {
		this.segments = segments;
	}

	/**
	 * Parse a path from its string form, e.g. <code>for:sum/step</code>.
	 *
	 * @param str
	 * @return
	 */
	public static Path fromString(String str) {
		if (str.isEmpty()) {
			return ROOT;
		}
		String[] segments = str.split("/", -1);
		for (String s : segments) {
			checkSegment(s);
		}
		return new Path(segments);
	}

	public Path append(String segment) {
		checkSegment(segment);
		String[] nsegments = Arrays.copyOf(segments, segments.length + 1);
		nsegments[segments.length] = segment;
		return new Path(nsegments);
	}

	public int size() {
		return segments.length;
	}

	public String get(int i) {
		return segments[i];
	}

	public String last() {
		return segments[segments.length - 1];
	}

	public List<String> segments() {
		return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(segments)));
	}

	/**
	 * Check whether this path starts with the given path.
	 *
	 * @param prefix
	 * @return
	 */
	public boolean startsWith(Path prefix) {
		if (prefix.segments.length > segments.length) {
			return false;
		}
		for (int i = 0; i != prefix.segments.length; ++i) {
			if (!segments[i].equals(prefix.segments[i])) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Check whether any segment of this path equals the given segment.
	 *
	 * @param segment
	 * @return
	 */
	public boolean contains(String segment) {
		for (int i = 0; i != segments.length; ++i) {
			if (segments[i].equals(segment)) {
				return true;
			}
		}
		return false;
	}

	private static void checkSegment(String segment) {
		if (segment == null || segment.isEmpty() || segment.indexOf('/') >= 0) {
			throw new IllegalArgumentException("invalid path segment: " + segment);
		}
	}

	@Override
	public int compareTo(Path o) {
		int n = Math.min(segments.length, o.segments.length);
		for (int i = 0; i != n; ++i) {
			int c = segments[i].compareTo(o.segments[i]);
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(segments.length, o.segments.length);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Path && Arrays.equals(((Path) o).segments, segments);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(segments);
	}

	@Override
	public String toString() {
		return String.join("/", segments);
	}
}
