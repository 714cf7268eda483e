package io.vena.geonode.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import io.vena.geonode.AbstractNodeTest;
import io.vena.geonode.NodeCollection;
import io.vena.geonode.NodeId;
import io.vena.geonode.Point;
import io.vena.geonode.Polyline;
import io.vena.geonode.Rectangle;
import io.vena.geonode.diff.ChangeKind;
import io.vena.geonode.diff.ChangePath;
import io.vena.geonode.diff.ChangeRecord;
import io.vena.geonode.diff.ChangeRecord.Added;
import io.vena.geonode.diff.ChangeRecord.Modified;
import io.vena.geonode.diff.ChangeRecord.Removed;
import io.vena.geonode.diff.ChangeRecorder;
import io.vena.geonode.diff.LoggingChangeListener;
import io.vena.geonode.diff.SnapshotDiffer;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.stream.Collectors.toList;
import static java.util.stream.Collectors.toSet;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end behaviour: mutate a {@link NodeCollection}, snapshot it, and diff the snapshots.
 */
class SnapshotDiffScenarioTest extends AbstractNodeTest {
	private SnapshotCodec codec;
	private SnapshotDiffer differ;
	private NodeCollection nodes;
	private NodeId rectID;
	private NodeId pointID;

	@BeforeEach
	void setUp() {
		codec = new SnapshotCodec(extendedRegistry());
		differ = new SnapshotDiffer();
		SampleNodes sample = sampleNodes();
		nodes = sample.collection();
		rectID = sample.rectangleID();
		pointID = sample.pointID();
	}

	@Test
	void selfDiff_allUnchanged() {
		JsonNode snapshot = codec.toSnapshot(nodes);
		List<ChangeRecord> records = differ.diff(snapshot, snapshot);

		assertThat(records, not(empty()));
		assertThat(kinds(records), everyItem(is(ChangeKind.UNCHANGED)));
	}

	@Test
	void selfDiff_afterRoundTrip_allUnchanged() {
		JsonNode snapshot = codec.toSnapshot(nodes);
		JsonNode reread = codec.toSnapshot(codec.fromSnapshot(snapshot));
		ChangeRecorder recorder = new ChangeRecorder();
		differ.diff(snapshot, reread, recorder);
		assertTrue(recorder.isUnchanged());
	}

	@Test
	void singleFieldChange_oneModifiedRecord() {
		JsonNode before = codec.toSnapshot(nodes);
		nodes.getTyped(rectID, Rectangle.class).orElseThrow().setWidth(11.0);
		JsonNode after = codec.toSnapshot(nodes);

		ChangeRecorder recorder = new ChangeRecorder();
		differ.diff(before, after, recorder);

		List<ChangeRecord> changes = recorder.changes();
		assertThat(changes, hasSize(1));
		Modified modified = (Modified) changes.get(0);
		assertEquals(ChangePath.of(rectID.toString(), "width"), modified.path());
		assertEquals(10.0, modified.oldValue().doubleValue());
		assertEquals(11.0, modified.newValue().doubleValue());
		assertEquals((long) recorder.records().size() - 1, recorder.count(ChangeKind.UNCHANGED));
	}

	@Test
	void anchorReassignedToOriginPoint_onlyAnchorIDModified() {
		Rectangle rect = nodes.getTyped(rectID, Rectangle.class).orElseThrow();
		Point p = nodes.getTyped(pointID, Point.class).orElseThrow();
		NodeId originalAnchorID = rect.anchor().id();

		JsonNode before = codec.toSnapshot(nodes);
		rect.setAnchor(p);
		JsonNode after = codec.toSnapshot(nodes);

		ChangeRecorder recorder = new ChangeRecorder();
		differ.diff(before, after, new LoggingChangeListener(recorder));

		// Both points sit at the origin, so only the copied id differs
		ChangePath anchorPath = ChangePath.of(rectID.toString(), "anchor");
		List<ChangeRecord> changes = recorder.changes();
		assertThat(changes, hasSize(1));
		Modified modified = (Modified) changes.get(0);
		assertEquals(anchorPath.then("id"), modified.path());
		assertEquals(originalAnchorID.toString(), modified.oldValue().textValue());
		assertEquals(pointID.toString(), modified.newValue().textValue());

		assertTrue(recorder.recordsUnder(ChangePath.of(pointID.toString())).stream()
			.allMatch(r -> r.kind() == ChangeKind.UNCHANGED));
	}

	@Test
	void anchorReassignedToMovedPoint_anchorFieldsModified() {
		Rectangle rect = nodes.getTyped(rectID, Rectangle.class).orElseThrow();
		Point p = nodes.getTyped(pointID, Point.class).orElseThrow();
		p.setX(1.0);
		p.setY(2.0);
		p.setZ(3.0);

		JsonNode before = codec.toSnapshot(nodes);
		rect.setAnchor(p);
		JsonNode after = codec.toSnapshot(nodes);

		ChangePath anchorPath = ChangePath.of(rectID.toString(), "anchor");
		List<ChangeRecord> changes = new ChangeRecorderFor(before, after).recorder.changes();
		assertEquals(
			Set.of(anchorPath.then("x"), anchorPath.then("y"), anchorPath.then("z"), anchorPath.then("id")),
			changes.stream().map(ChangeRecord::path).collect(toSet()));
		assertThat(kinds(changes), everyItem(is(ChangeKind.MODIFIED)));

		Modified x = (Modified) changes.stream().filter(r -> r.path().equals(anchorPath.then("x"))).findFirst().orElseThrow();
		assertEquals(0.0, x.oldValue().doubleValue());
		assertEquals(1.0, x.newValue().doubleValue());
		assertEquals(1.0, p.getX(), "Copying into the anchor leaves the point alone");
	}

	@Test
	void mutatedDeserializedPoint_exactlyXAndYModified() {
		Rectangle rect = nodes.getTyped(rectID, Rectangle.class).orElseThrow();
		rect.setAnchor(nodes.getTyped(pointID, Point.class).orElseThrow());
		JsonNode before = codec.toSnapshot(nodes);

		NodeCollection deserialized = codec.fromSnapshot(before);
		Point p = deserialized.getTyped(pointID, Point.class).orElseThrow();
		p.setX(50.0);
		p.setY(100.0);
		JsonNode after = codec.toSnapshot(deserialized);

		List<ChangeRecord> changes = new ChangeRecorderFor(before, after).recorder.changes();
		assertThat(changes, hasSize(2));
		assertEquals(
			List.of(ChangePath.of(pointID.toString(), "x"), ChangePath.of(pointID.toString(), "y")),
			changes.stream().map(ChangeRecord::path).collect(toList()));
		Modified y = (Modified) changes.get(1);
		assertEquals(0.0, y.oldValue().doubleValue());
		assertEquals(100.0, y.newValue().doubleValue());
	}

	@Test
	void pushAndRemove_wholeNodesAddedAndRemoved() {
		JsonNode before = codec.toSnapshot(nodes);
		Point newcomer = point(4, 5, 6);
		nodes.push(newcomer);
		nodes.remove(rectID);
		JsonNode after = codec.toSnapshot(nodes);

		List<ChangeRecord> changes = new ChangeRecorderFor(before, after).recorder.changes();
		assertThat(changes, hasSize(2));
		for (ChangeRecord change: changes) {
			if (change instanceof Added added) {
				assertEquals(ChangePath.of(newcomer.id().toString()), added.path());
				assertEquals(codec.nodeToSnapshot(newcomer), added.value());
			} else if (change instanceof Removed removed) {
				assertEquals(ChangePath.of(rectID.toString()), removed.path());
				assertEquals("Rectangle", removed.value().get("geometry_node").textValue());
			} else {
				throw new AssertionError("Unexpected change: " + change.describe());
			}
		}
	}

	@Test
	void insertionOrder_doesNotAffectDiff() {
		Point a = point(1, 1, 1);
		Rectangle b = rectangle(2, 2);
		Point c = point(3, 3, 3);
		JsonNode forward = codec.toSnapshot(NodeCollection.of(a, b, c));
		JsonNode backward = codec.toSnapshot(NodeCollection.of(c, b, a));
		assertEquals(codec.toJson(NodeCollection.of(a, b, c)), codec.toJson(NodeCollection.of(c, b, a)));

		c.setZ(9);
		JsonNode changed = codec.toSnapshot(NodeCollection.of(b, c, a));
		List<ChangeRecord> fromForward = differ.diff(forward, changed);
		assertEquals(fromForward, differ.diff(backward, changed));
		assertThat(fromForward.stream().filter(r -> r.kind() != ChangeKind.UNCHANGED).collect(toList()), hasSize(1));
	}

	@Test
	void reorderedVertices_reportedAsPairwiseModifications() {
		Point first = point(1, 0, 0);
		Point second = point(0, 1, 0);
		Polyline line = new Polyline().withVertex(first).withVertex(second);
		NodeCollection collection = NodeCollection.of(line);
		JsonNode before = codec.toSnapshot(collection);

		List<Point> vertices = line.vertices();
		vertices.add(vertices.remove(0));
		JsonNode after = codec.toSnapshot(collection);

		List<ChangeRecord> changes = new ChangeRecorderFor(before, after).recorder.changes();
		ChangePath verticesPath = ChangePath.of(line.id().toString(), "vertices");
		assertThat(kinds(changes), everyItem(is(ChangeKind.MODIFIED)));
		assertTrue(changes.stream().anyMatch(r -> verticesPath.then(0).isPrefixOf(r.path())));
		assertTrue(changes.stream().anyMatch(r -> verticesPath.then(1).isPrefixOf(r.path())));
		// x, y and id differ at both positions
		assertThat(changes, hasSize(6));
	}

	@Test
	void appendedVertex_reportedAsAdded() {
		Polyline line = new Polyline().withVertex(point(1, 0, 0));
		NodeCollection collection = NodeCollection.of(line);
		JsonNode before = codec.toSnapshot(collection);
		Point extra = point(0, 0, 1);
		line.withVertex(extra);
		JsonNode after = codec.toSnapshot(collection);

		List<ChangeRecord> changes = differ.diff(before, after).stream()
			.filter(r -> r.kind() != ChangeKind.UNCHANGED)
			.collect(toList());
		assertThat(changes, hasSize(1));
		Added added = (Added) changes.get(0);
		assertEquals(ChangePath.of(line.id().toString(), "vertices", "1"), added.path());
		assertEquals(extra.id().toString(), added.value().get("id").textValue());
	}

	private static List<ChangeKind> kinds(List<ChangeRecord> records) {
		return records.stream().map(ChangeRecord::kind).collect(toList());
	}

	private final class ChangeRecorderFor {
		final ChangeRecorder recorder = new ChangeRecorder();

		ChangeRecorderFor(JsonNode before, JsonNode after) {
			differ.diff(before, after, recorder);
		}
	}
}
