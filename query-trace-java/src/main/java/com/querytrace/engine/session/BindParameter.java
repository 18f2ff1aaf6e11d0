package com.querytrace.engine.session;

/**
 * One bound parameter of a statement.
 *
 * @param typeId host type identifier (e.g. a type OID)
 * @param value  host value, ignored when {@code isNull}
 */
public record BindParameter(long typeId, Object value, boolean isNull) {

    public static BindParameter of(long typeId, Object value) {
        return new BindParameter(typeId, value, value == null);
    }

    public static BindParameter nullOf(long typeId) {
        return new BindParameter(typeId, null, true);
    }
}
