package dev.haddaf.sync.store;

import java.util.Objects;
import org.springframework.util.StringUtils;

public record QueryFilter(String field, FilterOperator operator, Object value) {

    public QueryFilter {
        if (!StringUtils.hasText(field)) {
            throw new IllegalArgumentException("Filter field must not be blank");
        }
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public boolean matches(StoredDocument document) {
        return operator.matches(document.get(field), value);
    }
}
