package org.harvest.traits.storage;

import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One page of a listing.
 *
 * @param items page content
 * @param page 1-based page number
 * @param perPage requested page size
 * @param total number of matching rows across all pages
 */
public record Page<T>(
    List<T> items,
    int page,
    @JsonProperty("per_page") int perPage,
    long total
) {

    public Page {
        items = List.copyOf(items);
    }

    public static <T> Page<T> slice(List<T> all, int page, int perPage) {
        validate(page, perPage);
        final int from = Math.min(all.size(), (page - 1) * perPage);
        final int to = Math.min(all.size(), from + perPage);
        return new Page<>(all.subList(from, to), page, perPage, all.size());
    }

    public static void validate(int page, int perPage) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be >= 1");
        }
    }

    public <R> Page<R> map(Function<T, R> mapper) {
        return new Page<>(items.stream().map(mapper).toList(), page, perPage, total);
    }
}
