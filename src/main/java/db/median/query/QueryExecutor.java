package db.median.query;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import db.median.exec.Operator;
import db.median.exec.Row;

/**
 * Executes a planned operator pipeline via streaming.
 */
public class QueryExecutor {
    /**
     * Returns an Iterable that opens the operator on first iteration and closes it when
     * exhausted or when the pipeline throws (an aggregate failure aborts the query).
     */
    public Iterable<Row> stream(Operator op) {
        return () -> new Iterator<Row>() {
            private boolean opened = false;
            private Row next = null;
            private boolean finished = false;

            private void ensureOpen() {
                if (!opened) {
                    opened = true;
                    try {
                        op.open();
                    } catch (RuntimeException e) {
                        finished = true;
                        op.close();
                        throw e;
                    }
                    advance();
                }
            }

            private void advance() {
                if (finished) return;
                try {
                    next = op.next();
                } catch (RuntimeException e) {
                    finished = true;
                    op.close();
                    throw e;
                }
                if (next == null) {
                    finished = true;
                    op.close();
                }
            }

            @Override
            public boolean hasNext() {
                ensureOpen();
                return !finished;
            }

            @Override
            public Row next() {
                if (!hasNext()) throw new NoSuchElementException();
                Row current = next;
                advance();
                return current;
            }
        };
    }

    /** Run the pipeline to completion. */
    public List<Row> collect(Operator op) {
        List<Row> rows = new ArrayList<>();
        for (Row r : stream(op)) rows.add(r);
        return rows;
    }
}
