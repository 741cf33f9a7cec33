package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.GlobalRow;
import ai.pipestream.edge.repository.GlobalMirrorRepository;
import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The rows of one dataset version, read lazily in insertion order.
 * <p>
 * Every call to {@link #iterator()} starts from the first row again and pulls one page at a time
 * from the repository, so a sequence can be iterated any number of times without holding the
 * whole version in memory. Versions are immutable, so every pass yields the same rows.
 */
public final class RowSequence implements Iterable<JsonNode> {

    private final GlobalMirrorRepository repository;
    private final String datasetId;
    private final String version;
    private final int pageSize;

    RowSequence(GlobalMirrorRepository repository, String datasetId, String version, int pageSize) {
        this.repository = repository;
        this.datasetId = datasetId;
        this.version = version;
        this.pageSize = pageSize;
    }

    public String datasetId() {
        return datasetId;
    }

    public String version() {
        return version;
    }

    @Override
    public Iterator<JsonNode> iterator() {
        return new PageIterator();
    }

    private final class PageIterator implements Iterator<JsonNode> {

        private List<GlobalRow> page = List.of();
        private int position;
        private long afterId;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            page = repository.findRowsPage(datasetId, version, afterId, pageSize);
            position = 0;
            if (page.size() < pageSize) {
                exhausted = true;
            }
            if (page.isEmpty()) {
                return false;
            }
            afterId = page.get(page.size() - 1).id;
            return true;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return JsonDocuments.parse(page.get(position++).item);
        }
    }
}
