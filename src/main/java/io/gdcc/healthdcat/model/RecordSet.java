package io.gdcc.healthdcat.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/** Ordered, immutable sequence of {@link Record}s. Order is source row order. */
public final class RecordSet implements Iterable<Record> {
    private static final RecordSet EMPTY = new RecordSet(List.of());

    private final List<Record> records;

    private RecordSet(List<Record> records) {
        this.records = records;
    }

    public static RecordSet empty() {
        return EMPTY;
    }

    public static RecordSet of(List<Record> records) {
        Objects.requireNonNull(records, "records");
        return records.isEmpty() ? EMPTY : new RecordSet(List.copyOf(records));
    }

    public static RecordSet of(Record... records) {
        return of(List.of(records));
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Record get(int row) {
        return records.get(row);
    }

    public List<Record> records() {
        return records;
    }

    public Stream<Record> stream() {
        return records.stream();
    }

    /** Union of all column names, in order of first appearance. */
    public List<String> columns() {
        Set<String> columns = new LinkedHashSet<>();
        for (Record record : records) {
            columns.addAll(record.columns());
        }
        return List.copyOf(columns);
    }

    public RecordSet map(UnaryOperator<Record> fn) {
        List<Record> out = new ArrayList<>(records.size());
        for (Record record : records) {
            out.add(Objects.requireNonNull(fn.apply(record), "mapped record"));
        }
        return of(out);
    }

    public RecordSet filter(Predicate<Record> keep) {
        List<Record> out = new ArrayList<>(records.size());
        for (Record record : records) {
            if (keep.test(record)) {
                out.add(record);
            }
        }
        return out.size() == records.size() ? this : of(out);
    }

    @Override
    public Iterator<Record> iterator() {
        return records.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordSet)) {
            return false;
        }
        return records.equals(((RecordSet) o).records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "RecordSet" + records;
    }
}
