package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.Destination;
import nl.utwente.ewi.fmt.SC2JANI.Edge;

/**
 * Position in the compilation of an executable body: the edges and
 * locations created so far, and the destination that the next
 * statement extends.
 */
final class BodyCursor
{
	final List<Edge> edges;
	final List<String> locations;
	final Destination open;

	private BodyCursor(List<Edge> edges, List<String> locations, Destination open)
	{
		this.edges = Collections.unmodifiableList(edges);
		this.locations = Collections.unmodifiableList(locations);
		this.open = open;
	}

	static BodyCursor start(Destination open) {
		return new BodyCursor(List.of(), List.of(), open);
	}

	/** A cursor positioned at the (single) destination of the
	 * first edge of a path. */
	static BodyCursor start(Edge first, Destination open) {
		return new BodyCursor(List.of(first), List.of(), open);
	}

	/** Continue on a new edge, whose destination becomes the open
	 * one. */
	BodyCursor then(Edge edge, Destination open, String... newLocations) {
		ArrayList<Edge> es = new ArrayList<>(edges);
		es.add(edge);
		ArrayList<String> ls = new ArrayList<>(locations);
		ls.addAll(Arrays.asList(newLocations));
		return new BodyCursor(es, ls, open);
	}

	/** Add the edges and locations of a nested body, keeping the
	 * open destination. */
	BodyCursor include(BodyCursor nested) {
		ArrayList<Edge> es = new ArrayList<>(edges);
		es.addAll(nested.edges);
		ArrayList<String> ls = new ArrayList<>(locations);
		ls.addAll(nested.locations);
		return new BodyCursor(es, ls, open);
	}
}
