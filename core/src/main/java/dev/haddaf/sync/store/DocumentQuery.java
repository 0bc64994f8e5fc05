package dev.haddaf.sync.store;

import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * Immutable description of a collection query. Each {@code where}/{@code orderBy}/{@code limit} call returns
 * a new instance.
 */
public record DocumentQuery(String collection,
                            List<QueryFilter> filters,
                            String orderByField,
                            boolean descending,
                            Integer limit) {

    public DocumentQuery {
        if (!StringUtils.hasText(collection)) {
            throw new IllegalArgumentException("Collection must not be blank");
        }
        filters = filters == null ? List.of() : List.copyOf(filters);
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
    }

    public static DocumentQuery collection(String collection) {
        return new DocumentQuery(collection, List.of(), null, false, null);
    }

    public DocumentQuery where(String field, FilterOperator operator, Object value) {
        List<QueryFilter> next = new ArrayList<>(filters);
        next.add(new QueryFilter(field, operator, value));
        return new DocumentQuery(collection, next, orderByField, descending, limit);
    }

    public DocumentQuery whereEqualTo(String field, Object value) {
        return where(field, FilterOperator.EQUAL, value);
    }

    public DocumentQuery orderBy(String field, boolean descendingOrder) {
        return new DocumentQuery(collection, filters, field, descendingOrder, limit);
    }

    public DocumentQuery limit(int maxResults) {
        return new DocumentQuery(collection, filters, orderByField, descending, maxResults);
    }

    public boolean matches(StoredDocument document) {
        if (!document.path().collection().equals(collection)) {
            return false;
        }
        for (QueryFilter filter : filters) {
            if (!filter.matches(document)) {
                return false;
            }
        }
        return orderByField == null || document.has(orderByField);
    }
}
