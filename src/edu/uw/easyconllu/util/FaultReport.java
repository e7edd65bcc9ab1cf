package edu.uw.easyconllu.util;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import edu.uw.easyconllu.util.Fault.Kind;

/**
 * Collects the faults of a whole run. Nothing here stops processing; the report is printed once at the end.
 */
public class FaultReport {
	private final ListMultimap<Kind, Fault> faults = ArrayListMultimap.create();

	public void add(final Fault fault) {
		faults.put(fault.getKind(), fault);
	}

	public void add(final Kind kind, final String sentenceId, final String detail) {
		add(new Fault(kind, sentenceId, detail));
	}

	public List<Fault> get(final Kind kind) {
		return ImmutableList.copyOf(faults.get(kind));
	}

	public Collection<Fault> getAll() {
		return ImmutableList.copyOf(faults.values());
	}

	public int count(final Kind kind) {
		return faults.get(kind).size();
	}

	public boolean isEmpty() {
		return faults.isEmpty();
	}

	public void addAll(final FaultReport other) {
		faults.putAll(other.faults);
	}

	/**
	 * Ids of the sentences with at least one fault of the given kind, in the order they were reported.
	 */
	public Set<String> getSentenceIds(final Kind kind) {
		final Set<String> result = new LinkedHashSet<>();
		for (final Fault fault : faults.get(kind)) {
			result.add(fault.getSentenceId());
		}
		return result;
	}

	public void print(final PrintStream out, final boolean verbose) {
		if (faults.isEmpty()) {
			out.println("No faults.");
			return;
		}

		for (final Kind kind : Kind.values()) {
			final List<Fault> ofKind = faults.get(kind);
			if (ofKind.isEmpty()) {
				continue;
			}

			out.println(kind + ": " + ofKind.size() + " in sentences " + new ArrayList<>(getSentenceIds(kind)));
			if (verbose) {
				for (final Fault fault : ofKind) {
					out.println("\t" + fault);
				}
			}
		}
	}
}
