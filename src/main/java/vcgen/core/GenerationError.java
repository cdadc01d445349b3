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
 * Describes why obligations could not be generated for some part of a goal.
 * Every error carries enough context (the site or node concerned, and a
 * reason) to fix the input.
 *
 * @author David J. Pearce
 *
 */
public final class GenerationError {
	public enum Kind {
		/**
		 * A loop site has no invariant attached.
		 */
		MISSING_INVARIANT,
		/**
		 * An invariant does not type check against the bindings live at its site.
		 */
		TYPE_MISMATCH_INVARIANT,
		/**
		 * A computation is ill-formed, or uses constructs in a combination for
		 * which no obligations can be generated.
		 */
		UNSUPPORTED_CONSTRUCT,
		/**
		 * An invariant uses the loop cursor where there is none, or in a way which
		 * is not valid for an arbitrary iteration.
		 */
		MALFORMED_CURSOR_USE
	}

	private final Kind kind;
	private final SiteId site;
	private final Computation node;
	private final String reason;

	private GenerationError(Kind kind, SiteId site, Computation node, String reason) {
		this.kind = kind;
		this.site = site;
		this.node = node;
		this.reason = reason == null ? "" : reason;
	}

	public static GenerationError missingInvariant(SiteId site) {
		return new GenerationError(Kind.MISSING_INVARIANT, Objects.requireNonNull(site), null,
				"no invariant attached to loop");
	}

	public static GenerationError typeMismatch(SiteId site, String reason) {
		return new GenerationError(Kind.TYPE_MISMATCH_INVARIANT, Objects.requireNonNull(site), null, reason);
	}

	public static GenerationError unsupported(Computation node, String reason) {
		return new GenerationError(Kind.UNSUPPORTED_CONSTRUCT, null, node, reason);
	}

	public static GenerationError malformedCursorUse(SiteId site, String reason) {
		return new GenerationError(Kind.MALFORMED_CURSOR_USE, Objects.requireNonNull(site), null, reason);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Get the site concerned, or <code>null</code> if this error is about a node
	 * rather than a site.
	 *
	 * @return
	 */
	public SiteId getSite() {
		return site;
	}

	/**
	 * Get the computation concerned, or <code>null</code> if this error is about a
	 * site or the goal as a whole.
	 *
	 * @return
	 */
	public Computation getNode() {
		return node;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof GenerationError) {
			GenerationError e = (GenerationError) o;
			return kind == e.kind && Objects.equals(site, e.site) && node == e.node && reason.equals(e.reason);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, site, reason);
	}

	@Override
	public String toString() {
		String where = site != null ? site.toString() : node != null ? node.getTag().toString() : "goal";
		return kind + "(" + where + "): " + reason;
	}
}
