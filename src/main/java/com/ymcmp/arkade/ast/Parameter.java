package com.ymcmp.arkade.ast;

import java.util.Objects;

public final class Parameter {

    public static final String ARRAY_SUFFIX = "[]";

    public final String name;
    public final String type;

    public Parameter(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public boolean isArray() {
        return type.endsWith(ARRAY_SUFFIX);
    }

    public String getBaseType() {
        return isArray() ? type.substring(0, type.length() - ARRAY_SUFFIX.length()) : type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj instanceof Parameter) {
            final Parameter other = (Parameter) obj;
            return name.equals(other.name) && type.equals(other.type);
        }
        return false;
    }

    @Override
    public String toString() {
        return type + " " + name;
    }
}
