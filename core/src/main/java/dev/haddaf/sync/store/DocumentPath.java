package dev.haddaf.sync.store;

import org.springframework.util.StringUtils;

/**
 * Address of a single document: the slash separated collection path plus the document id.
 * Sub-collections are expressed through the collection path, e.g. {@code teams/t1/players}.
 */
public record DocumentPath(String collection, String id) {

    public DocumentPath {
        if (!StringUtils.hasText(collection)) {
            throw new IllegalArgumentException("Collection must not be blank");
        }
        if (!StringUtils.hasText(id)) {
            throw new IllegalArgumentException("Document id must not be blank");
        }
        if (id.contains("/")) {
            throw new IllegalArgumentException("Document id must not contain '/': " + id);
        }
    }

    public static DocumentPath of(String collection, String id) {
        return new DocumentPath(collection, id);
    }

    public static DocumentPath subCollection(String parentCollection, String parentId,
                                             String subCollection, String id) {
        return new DocumentPath(parentCollection + "/" + parentId + "/" + subCollection, id);
    }

    public String path() {
        return collection + "/" + id;
    }

    @Override
    public String toString() {
        return path();
    }
}
