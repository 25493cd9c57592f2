package com.ymcmp.arkade.ast;

/**
 * An opaque property path such as {@code tx.time}. Emitted as a placeholder.
 */
public final class Property extends Expression {

    public static final String ASSET_GROUPS = "tx.assetGroups";

    public final String path;

    public Property(String path) {
        this.path = path;
    }

    public boolean isAssetGroups() {
        return ASSET_GROUPS.equals(path);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Property && ((Property) obj).path.equals(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
