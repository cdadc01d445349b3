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
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Predicate;

/**
 * The obligations generated for a goal, in generation order, indexed by their
 * stable identifiers.
 *
 * @author David J. Pearce
 *
 */
public final class ObligationSet implements Iterable<Obligation> {
	public static final ObligationSet EMPTY = new ObligationSet(Collections.<Obligation>emptyList());

	private final LinkedHashMap<Path, Obligation> obligations;

	public ObligationSet(List<Obligation> items) {
		this.obligations = new LinkedHashMap<>();
		for (Obligation o : items) {
			Path id = o.getLabel().getStableId();
			if (obligations.containsKey(id)) {
				throw new IllegalArgumentException("duplicate obligation identifier: " + id);
			}
			obligations.put(id, o);
		}
	}

	public int size() {
		return obligations.size();
	}

	public boolean isEmpty() {
		return obligations.isEmpty();
	}

	/**
	 * Get the obligation with a given identifier, or <code>null</code> if there
	 * is none.
	 *
	 * @param id
	 * @return
	 */
	public Obligation get(Path id) {
		return obligations.get(id);
	}

	public Obligation get(String id) {
		return get(Path.fromString(id));
	}

	public Obligation get(Label label) {
		return get(label.getStableId());
	}

	public List<Obligation> toList() {
		return new ArrayList<>(obligations.values());
	}

	public List<Label> getLabels() {
		ArrayList<Label> labels = new ArrayList<>();
		for (Obligation o : obligations.values()) {
			labels.add(o.getLabel());
		}
		return labels;
	}

	/**
	 * Get all obligations arising from a given phase of a given loop.
	 *
	 * @param site
	 * @param phase
	 * @return
	 */
	public List<Obligation> family(SiteId site, Label.Phase phase) {
		return select(o -> o.getLabel().isFrom(site, phase));
	}

	public List<Obligation> open() {
		return select(o -> !o.isDischarged());
	}

	public List<Obligation> discharged() {
		return select(Obligation::isDischarged);
	}

	public List<Obligation> select(Predicate<Obligation> filter) {
		ArrayList<Obligation> result = new ArrayList<>();
		for (Obligation o : obligations.values()) {
			if (filter.test(o)) {
				result.add(o);
			}
		}
		return result;
	}

	@Override
	public Iterator<Obligation> iterator() {
		return Collections.unmodifiableCollection(obligations.values()).iterator();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ObligationSet && toList().equals(((ObligationSet) o).toList());
	}

	@Override
	public int hashCode() {
		return obligations.hashCode();
	}

	@Override
	public String toString() {
		return obligations.values().toString();
	}
}
