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

import java.util.Objects;

/**
 * Names a generated obligation. The stable identifier is used by external
 * tools to target a specific obligation and does not change when the same goal
 * is regenerated. The hint is a human readable description of where the
 * obligation came from, and may change at any time. Equality and hashing
 * consider only the stable identifier.
 *
 * @author David J. Pearce
 *
 */
public final class Label implements Comparable<Label> {
	/**
	 * The phases of a loop. Every obligation arising from a given phase of a loop
	 * has the corresponding segment (e.g. <code>sum:step</code>) in its
	 * identifier.
	 */
	public enum Phase {
		PRE, STEP, POST, EXIT;

		public String segment(SiteId site) {
			return site.getName() + ":" + name().toLowerCase();
		}
	}

	private final Path stableId;
	private final String hint;

	public Label(Path stableId, String hint) {
		this.stableId = Objects.requireNonNull(stableId);
		this.hint = hint == null ? "" : hint;
	}

	public Path getStableId() {
		return stableId;
	}

	public String getHint() {
		return hint;
	}

	/**
	 * The kind of obligation, which is the final segment of its identifier. This
	 * is one of <code>invariant</code> (a loop invariant is established or
	 * preserved), <code>join</code> (a join point invariant is established),
	 * <code>result</code>, <code>return</code> or <code>throw</code> (the goal's
	 * relation holds on that exit).
	 *
	 * @return
	 */
	public String getKind() {
		return stableId.last();
	}

	/**
	 * Check whether this obligation arises from a given phase of a given loop.
	 * Paths which leave the loop early pass through its step phase first, but
	 * belong only to its exit phase.
	 *
	 * @param site
	 * @param phase
	 * @return
	 */
	public boolean isFrom(SiteId site, Phase phase) {
		if (phase == Phase.STEP && stableId.contains(Phase.EXIT.segment(site))) {
			return false;
		}
		return stableId.contains(phase.segment(site));
	}

	@Override
	public int compareTo(Label o) {
		return stableId.compareTo(o.stableId);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Label && ((Label) o).stableId.equals(stableId);
	}

	@Override
	public int hashCode() {
		return stableId.hashCode();
	}

	@Override
	public String toString() {
		return hint.isEmpty() ? stableId.toString() : stableId + " (" + hint + ")";
	}
}
