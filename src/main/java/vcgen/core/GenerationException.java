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
import java.util.List;

/**
 * Signals that obligations could not be generated for every part of a goal.
 * This carries all errors found (not just the first), along with the
 * obligations generated for those parts of the goal which were unaffected.
 *
 * @author David J. Pearce
 *
 */
public class GenerationException extends Exception {
	private static final long serialVersionUID = 1L;

	private final List<GenerationError> errors;
	private final transient ObligationSet partial;

	public GenerationException(List<GenerationError> errors, ObligationSet partial) {
		super(describe(errors));
		if (errors.isEmpty()) {
			throw new IllegalArgumentException("no errors given");
		}
		this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
		this.partial = partial;
	}

	public List<GenerationError> getErrors() {
		return errors;
	}

	/**
	 * Get the errors of a given kind.
	 *
	 * @param kind
	 * @return
	 */
	public List<GenerationError> getErrors(GenerationError.Kind kind) {
		ArrayList<GenerationError> result = new ArrayList<>();
		for (GenerationError e : errors) {
			if (e.getKind() == kind) {
				result.add(e);
			}
		}
		return result;
	}

	/**
	 * Get the obligations generated for those parts of the goal unaffected by any
	 * error.
	 *
	 * @return
	 */
	public ObligationSet getPartialObligations() {
		return partial;
	}

	private static String describe(List<GenerationError> errors) {
		StringBuilder sb = new StringBuilder();
		sb.append(errors.size()).append(errors.size() == 1 ? " error" : " errors");
		for (GenerationError e : errors) {
			sb.append("\n  ").append(e);
		}
		return sb.toString();
	}
}
