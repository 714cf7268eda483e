package io.vena.geonode.diff;

import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.asList;
import static java.util.stream.Collectors.joining;

/**
 * The location of a value within a snapshot tree: the sequence of object field
 * names and array indexes leading to it from the root.
 *
 * <p>
 * Array indexes are stored as their decimal text, so the path to element
 * <code>2</code> of an array looks the same as the path to a field named <code>"2"</code>.
 */
public record ChangePath(List<String> segments) {
	public ChangePath {
		segments = List.copyOf(segments);
	}

	public static ChangePath empty() {
		return EMPTY;
	}

	public static ChangePath of(String... segments) {
		return new ChangePath(asList(segments));
	}

	public ChangePath then(String fieldName) {
		List<String> result = new ArrayList<>(segments.size() + 1);
		result.addAll(segments);
		result.add(fieldName);
		return new ChangePath(result);
	}

	public ChangePath then(int index) {
		return then(Integer.toString(index));
	}

	public int length() { return segments.size(); }
	public boolean isEmpty() { return segments.isEmpty(); }

	public String segment(int index) {
		return segments.get(index);
	}

	public String lastSegment() {
		if (segments.isEmpty()) {
			throw new IllegalStateException("Empty path has no last segment");
		}
		return segments.get(segments.size() - 1);
	}

	/**
	 * @return true if <code>other</code> is this path or one of its descendants
	 */
	public boolean isPrefixOf(ChangePath other) {
		return other.segments.size() >= segments.size()
			&& other.segments.subList(0, segments.size()).equals(segments);
	}

	/**
	 * Segments are URL-encoded and joined by slashes, with a leading slash.
	 * The empty path is <code>"/"</code>.
	 */
	public String urlEncoded() {
		return "/" + segments.stream()
			.map(s -> URLEncoder.encode(s, UTF_8))
			.collect(joining("/"));
	}

	@Override
	public String toString() {
		return urlEncoded();
	}

	private static final ChangePath EMPTY = new ChangePath(List.of());
}
