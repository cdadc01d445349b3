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
package vcgen.spec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import vcgen.core.GenerationError;
import vcgen.core.GenerationException;
import vcgen.core.Goal;
import vcgen.core.ObligationSet;
import vcgen.core.SiteId;
import vcgen.tasks.Typing;

/**
 * Associates invariants with sites. A map bound to a goal checks each
 * invariant as it is attached, so mistakes are reported at the point they are
 * made rather than during generation. Once attached, an invariant cannot be
 * replaced.
 *
 * @author David J. Pearce
 *
 */
public final class InvariantMap {
	private final Map<SiteId, Invariant> invariants = new LinkedHashMap<>();
	private final Typing typing;

	/**
	 * Construct a map which is not bound to any goal. Invariants are then only
	 * checked during generation.
	 */
	public InvariantMap() {
		this.typing = null;
	}

	private InvariantMap(Typing typing) {
		this.typing = typing;
	}

	/**
	 * Construct a map bound to a given goal.
	 *
	 * @param goal
	 * @return
	 */
	public static InvariantMap forGoal(Goal goal) {
		return new InvariantMap(Typing.check(goal));
	}

	/**
	 * Attach an invariant to a given site.
	 *
	 * @param site
	 * @param invariant
	 * @return
	 * @throws GenerationException      if this map is bound to a goal, and the
	 *                                  invariant is not valid for the site.
	 * @throws IllegalArgumentException if the site already has an invariant, or
	 *                                  is not in the bound goal.
	 */
	public InvariantMap attach(SiteId site, Invariant invariant) throws GenerationException {
		if (invariants.containsKey(site)) {
			throw new IllegalArgumentException("invariant already attached to " + site);
		}
		if (typing != null) {
			Typing.Site info = typing.getSite(site);
			if (info == null) {
				throw new IllegalArgumentException("unknown site " + site);
			}
			GenerationError error = InvariantChecker.check(site, invariant, info.getLive(), info.getElement());
			if (error != null) {
				throw new GenerationException(Collections.singletonList(error), ObligationSet.EMPTY);
			}
		}
		invariants.put(site, invariant);
		return this;
	}

	public Invariant get(SiteId site) {
		return invariants.get(site);
	}

	public boolean contains(SiteId site) {
		return invariants.containsKey(site);
	}

	public int size() {
		return invariants.size();
	}

	public Map<SiteId, Invariant> asMap() {
		return Collections.unmodifiableMap(invariants);
	}
}
