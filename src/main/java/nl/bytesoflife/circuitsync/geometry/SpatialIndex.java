package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Position;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope index over sheet items. An STRtree cannot take inserts once built, so the tree is
 * rebuilt lazily on the first query after an insert.
 */
public class SpatialIndex<T> {

    private final List<Entry<T>> entries = new ArrayList<>();
    private STRtree tree;

    public void insert(Envelope envelope, T item) {
        entries.add(new Entry<>(envelope, item));
        tree = null;
    }

    public void insert(Position position, T item) {
        insert(new Envelope(position.x(), position.x(), position.y(), position.y()), item);
    }

    public void insert(Segment segment, T item) {
        insert(segment.getEnvelope(), item);
    }

    public int size() {
        return entries.size();
    }

    @SuppressWarnings("unchecked")
    public List<T> query(Envelope envelope) {
        ensureBuilt();
        List<Entry<T>> hits = (List<Entry<T>>) tree.query(envelope);
        List<T> result = new ArrayList<>(hits.size());
        for (Entry<T> hit : hits) {
            result.add(hit.item());
        }
        return result;
    }

    public List<T> queryNeighbors(Position position, double searchDistance) {
        Envelope searchEnvelope = new Envelope(position.x(), position.x(), position.y(), position.y());
        searchEnvelope.expandBy(searchDistance);
        return query(searchEnvelope);
    }

    public List<T> queryNeighbors(Segment segment, double searchDistance) {
        Envelope searchEnvelope = segment.getEnvelope();
        searchEnvelope.expandBy(searchDistance);
        return query(searchEnvelope);
    }

    private void ensureBuilt() {
        if (tree == null) {
            tree = new STRtree();
            for (Entry<T> entry : entries) {
                tree.insert(entry.envelope(), entry);
            }
            tree.build();
        }
    }

    private record Entry<T>(Envelope envelope, T item) {}
}
