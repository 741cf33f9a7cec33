package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.UserDbTable;
import ai.pipestream.edge.entity.UserDbTableIndex;

import java.util.Collections;
import java.util.List;

/**
 * A UserDB table with its declared indexes and current document count.
 */
public final class TableDescription {

    public final UserDbTable table;
    public final List<UserDbTableIndex> indexes;
    public final long documentCount;

    public TableDescription(UserDbTable table, List<UserDbTableIndex> indexes, long documentCount) {
        this.table = table;
        this.indexes = Collections.unmodifiableList(indexes);
        this.documentCount = documentCount;
    }

    public boolean hasIndex(String colName) {
        for (UserDbTableIndex index : indexes) {
            if (index.colName.equals(colName)) {
                return true;
            }
        }
        return false;
    }
}
