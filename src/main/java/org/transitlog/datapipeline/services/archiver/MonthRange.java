package org.transitlog.datapipeline.services.archiver;

import java.util.ArrayList;
import java.util.List;

import org.transitlog.datapipeline.api.contracts.PartitionKey;

/**
 * Inclusive range of partitions to archive.
 *
 * @param first first month (inclusive)
 * @param last  last month (inclusive)
 */
public record MonthRange(PartitionKey first, PartitionKey last) {

    public MonthRange {
        if (last.compareTo(first) < 0) {
            throw new IllegalArgumentException("Range end " + last + " is before start " + first);
        }
    }

    /**
     * @return every month from {@code first} to {@code last}, in order
     */
    public List<PartitionKey> months() {
        List<PartitionKey> months = new ArrayList<>();
        for (PartitionKey month = first; month.compareTo(last) <= 0; month = month.next()) {
            months.add(month);
        }
        return months;
    }

    @Override
    public String toString() {
        return first + ".." + last;
    }
}
