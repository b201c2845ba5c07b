package io.github.yok.stagemerge.db;

import io.github.yok.stagemerge.core.CanonicalType;
import java.util.Optional;

/**
 * Two-way mapping between canonical column types and native column types.
 */
public interface DialectTypeOperations {

    /**
     * Returns the native column type used for a canonical type.
     *
     * @param type canonical type
     * @return native type name
     */
    String toNativeType(CanonicalType type);

    /**
     * Resolves the canonical type of a native column type.
     *
     * @param nativeType native type name as reported by the catalog
     * @return canonical type, or empty when the native type is not mapped
     */
    Optional<CanonicalType> toCanonicalType(String nativeType);
}
