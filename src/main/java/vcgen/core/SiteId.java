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

/**
 * Identifies a syntactic location (a loop or a join point) to which an
 * invariant may be attached. Identifiers are chosen by whoever builds the
 * computation and must be unique within it.
 *
 * @author David J. Pearce
 *
 */
public final class SiteId implements Comparable<SiteId> {
	private final String name;

	private SiteId(String name) {
		if (name == null || name.isEmpty() || name.indexOf('/') >= 0) {
			throw new IllegalArgumentException("invalid site identifier: " + name);
		}
		this.name = name;
	}

	public static SiteId of(String name) {
		return new SiteId(name);
	}

	public String getName() {
		return name;
	}

	@Override
	public int compareTo(SiteId o) {
		return name.compareTo(o.name);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof SiteId && ((SiteId) o).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
